/*
 * Armor.java
 *
 * This source file is part of the Strict Types open source project
 *
 * Copyright 2024 the Strict Types project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.stricttypes.codec;

import com.google.common.base.Splitter;
import com.google.common.io.BaseEncoding;
import org.stricttypes.annotation.API;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * ASCII armoring of canonical encodings:
 *
 * <pre>
 * -----BEGIN STRICT TYPE SYSTEM-----
 * Id: urn:ubideco:sts:...
 *
 * base64 data, 64 characters per line
 *
 * -----END STRICT TYPE SYSTEM-----
 * </pre>
 */
@API(API.Status.UNSTABLE)
public final class Armor {
    public static final int LINE_WIDTH = 64;
    private static final String ID_HEADER = "Id: ";
    private static final BaseEncoding BASE64 = BaseEncoding.base64();

    private Armor() {
    }

    /**
     * Armor encoded bytes.
     *
     * @param title the block title, e.g. {@code STRICT TYPE SYSTEM}
     * @param id the text form of the identity of the encoded value
     * @param data the canonical encoding
     * @return the armored text, ending with a newline
     */
    @Nonnull
    public static String armor(@Nonnull String title, @Nonnull String id, @Nonnull byte[] data) {
        final StringBuilder sb = new StringBuilder();
        sb.append(beginMarker(title)).append('\n');
        sb.append(ID_HEADER).append(id).append('\n');
        sb.append('\n');
        for (String line : Splitter.fixedLength(LINE_WIDTH).split(BASE64.encode(data))) {
            sb.append(line).append('\n');
        }
        sb.append('\n');
        sb.append(endMarker(title)).append('\n');
        return sb.toString();
    }

    /**
     * Parse armored text.
     *
     * @param title the expected block title
     * @param text the armored text
     * @return the declared identity and the decoded bytes
     * @throws DecodeException if the markers, the header or the base64 payload are malformed
     */
    @Nonnull
    public static Armored unarmor(@Nonnull String title, @Nonnull String text) {
        final List<String> lines = Splitter.on('\n').trimResults().splitToList(text.trim());
        if (lines.size() < 3 || !lines.get(0).equals(beginMarker(title))) {
            throw new DecodeException("missing armor begin marker", "title", title);
        }
        if (!lines.get(lines.size() - 1).equals(endMarker(title))) {
            throw new DecodeException("missing armor end marker", "title", title);
        }
        String id = null;
        int i = 1;
        for (; i < lines.size() - 1 && !lines.get(i).isEmpty(); i++) {
            final String header = lines.get(i);
            if (header.startsWith(ID_HEADER)) {
                id = header.substring(ID_HEADER.length()).trim();
            }
        }
        if (id == null) {
            throw new DecodeException("missing armor id header", "title", title);
        }
        final StringBuilder payload = new StringBuilder();
        for (; i < lines.size() - 1; i++) {
            payload.append(lines.get(i));
        }
        try {
            return new Armored(id, BASE64.decode(payload.toString()));
        } catch (IllegalArgumentException e) {
            throw new DecodeException("invalid armored data", e)
                    .addLogInfo("title", title)
                    .addLogInfo(LogMessageKeys.ID_TEXT.toString(), id);
        }
    }

    @Nonnull
    private static String beginMarker(@Nonnull String title) {
        return "-----BEGIN " + title + "-----";
    }

    @Nonnull
    private static String endMarker(@Nonnull String title) {
        return "-----END " + title + "-----";
    }

    /**
     * Content of an armored block.
     */
    public static final class Armored {
        @Nonnull
        private final String id;
        @Nonnull
        private final byte[] data;

        private Armored(@Nonnull String id, @Nonnull byte[] data) {
            this.id = id;
            this.data = data;
        }

        @Nonnull
        public String getId() {
            return id;
        }

        @Nonnull
        public byte[] getData() {
            return data.clone();
        }
    }
}
