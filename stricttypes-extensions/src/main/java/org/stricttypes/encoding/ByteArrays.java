/*
 * ByteArrays.java
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

package org.stricttypes.encoding;

import org.stricttypes.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Helpers for putting raw bytes into log messages and exception log info.
 */
@API(API.Status.UNSTABLE)
public final class ByteArrays {
    private static final byte EQUALS_CHARACTER = (byte)'=';
    private static final byte DOUBLE_QUOTE_CHARACTER = (byte)'"';
    private static final byte BACKSLASH_CHARACTER = (byte)'\\';
    private static final byte MINIMUM_PRINTABLE_CHARACTER = 32;
    private static final int MAXIMUM_PRINTABLE_CHARACTER = 127;
    private static final char[] LOWER_CASE_HEX_CHARS =
            { '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f' };

    private ByteArrays() {
    }

    /**
     * Creates a human-readable representation of {@code bytes}. Printable ASCII is kept as is, everything
     * else becomes {@code \xNN}. The {@code =} and {@code "} characters are escaped as well, since they
     * would break {@code key="value"} log parsing.
     *
     * @param bytes a {@code byte} array
     * @return a printable representation of {@code bytes}
     */
    @Nullable
    public static String loggable(@Nullable byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        return loggable(bytes, 0, bytes.length);
    }

    /**
     * Like {@link #loggable(byte[])}, but renders at most {@code limit} bytes followed by {@code ...}
     * when the array is longer. Encoded type systems can be megabytes long; log lines should not be.
     *
     * @param bytes a {@code byte} array
     * @param limit the maximum number of bytes to render
     * @return a printable representation of a prefix of {@code bytes}
     */
    @Nullable
    public static String loggablePrefix(@Nullable byte[] bytes, int limit) {
        if (bytes == null) {
            return null;
        }
        if (bytes.length <= limit) {
            return loggable(bytes, 0, bytes.length);
        }
        return loggable(bytes, 0, limit) + "...";
    }

    @Nonnull
    private static String loggable(@Nonnull byte[] bytes, int from, int to) {
        final StringBuilder sb = new StringBuilder(to - from);
        for (int i = from; i < to; i++) {
            final byte b = bytes[i];
            if (b >= MINIMUM_PRINTABLE_CHARACTER && b < MAXIMUM_PRINTABLE_CHARACTER &&
                    b != BACKSLASH_CHARACTER && b != EQUALS_CHARACTER && b != DOUBLE_QUOTE_CHARACTER) {
                sb.append((char)b);
            } else if (b == BACKSLASH_CHARACTER) {
                sb.append("\\\\");
            } else {
                sb.append("\\x").append(LOWER_CASE_HEX_CHARS[(b >>> 4) & 0x0F]).append(LOWER_CASE_HEX_CHARS[b & 0x0F]);
            }
        }
        return sb.toString();
    }
}
