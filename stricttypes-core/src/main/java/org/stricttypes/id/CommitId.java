/*
 * CommitId.java
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

package org.stricttypes.id;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;
import com.google.common.primitives.UnsignedBytes;
import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.encoding.Base58;
import org.stricttypes.encoding.Proquint;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;

/**
 * A 32-byte commitment identifying some content. Each kind of identity is a separate subclass with its own
 * hashing tag and human readable identifier ("HRI"); identities of different kinds are never equal, even when
 * their bytes are.
 *
 * <p>
 * The text form is {@code urn:ubideco:<hri>:<base58>#<mnemonic>}, where the base58 part encodes the 32 id bytes
 * followed by a 4 byte checksum (the first bytes of {@code SHA256(hri || id)}) and the mnemonic renders the
 * checksum as proquint words. Ids of one kind sort by their bytes, compared as unsigned values.
 * </p>
 */
@API(API.Status.STABLE)
public abstract class CommitId implements Comparable<CommitId> {
    public static final int LENGTH = 32;
    public static final int CHECKSUM_LENGTH = 4;
    public static final String URN_PREFIX = "urn:ubideco:";

    private static final Comparator<byte[]> BYTES_ORDER = UnsignedBytes.lexicographicalComparator();
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    @Nonnull
    private final byte[] bytes;

    protected CommitId(@Nonnull byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new StrictTypesArgumentException("identity must be exactly " + LENGTH + " bytes long",
                    LogMessageKeys.ACTUAL, bytes.length);
        }
        this.bytes = bytes.clone();
    }

    /**
     * Get the human readable identifier of this kind of identity, used as the prefix of the text form.
     *
     * @return the HRI, e.g. {@code semid}
     */
    @Nonnull
    public abstract String getHri();

    @Nonnull
    public byte[] toByteArray() {
        return bytes.clone();
    }

    @Nonnull
    public String toHex() {
        return HEX.encode(bytes);
    }

    /**
     * Get the compact text form: base58 of the id followed by its checksum, without prefix or mnemonic.
     *
     * @return the compact form
     */
    @Nonnull
    public String toBaid58() {
        return Base58.encode(Bytes.concat(bytes, checksum(getHri(), bytes)));
    }

    @Nonnull
    public String toMnemonic() {
        return Proquint.encode(Ints.fromByteArray(checksum(getHri(), bytes)));
    }

    @Override
    public int compareTo(@Nonnull CommitId o) {
        final int kind = getHri().compareTo(o.getHri());
        return kind != 0 ? kind : BYTES_ORDER.compare(bytes, o.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(bytes, ((CommitId)o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return URN_PREFIX + getHri() + ":" + toBaid58() + "#" + toMnemonic();
    }

    @Nonnull
    static byte[] checksum(@Nonnull String hri, @Nonnull byte[] payload) {
        return Arrays.copyOf(Hashing.sha256().newHasher()
                .putBytes(hri.getBytes(StandardCharsets.US_ASCII))
                .putBytes(payload)
                .hash()
                .asBytes(), CHECKSUM_LENGTH);
    }

    /**
     * Parse the text form of an identity of the given kind. Accepted forms are the full URN, the URN without the
     * {@code urn:ubideco:} prefix, and the bare base58 part; each with or without the mnemonic suffix.
     *
     * @param text the text to parse
     * @param hri the expected human readable identifier
     * @return the 32 id bytes
     * @throws IdentityParseException if the text is not a valid identity of that kind
     */
    @Nonnull
    protected static byte[] parse(@Nonnull String text, @Nonnull String hri) {
        String rest = text.trim();
        if (rest.startsWith(URN_PREFIX)) {
            rest = rest.substring(URN_PREFIX.length());
        }
        final int colon = rest.indexOf(':');
        if (colon >= 0) {
            final String prefix = rest.substring(0, colon);
            if (!prefix.equals(hri)) {
                throw new IdentityParseException("identity has a wrong type prefix",
                        LogMessageKeys.ID_TEXT, text,
                        LogMessageKeys.EXPECTED, hri,
                        LogMessageKeys.ACTUAL, prefix);
            }
            rest = rest.substring(colon + 1);
        }
        String mnemonic = null;
        final int hash = rest.indexOf('#');
        if (hash >= 0) {
            mnemonic = rest.substring(hash + 1);
            rest = rest.substring(0, hash);
        }
        final byte[] decoded;
        try {
            decoded = Base58.decode(rest);
        } catch (IllegalArgumentException e) {
            throw new IdentityParseException("identity is not valid base58", e)
                    .addLogInfo(LogMessageKeys.ID_TEXT.toString(), text);
        }
        if (decoded.length != LENGTH + CHECKSUM_LENGTH) {
            throw new IdentityParseException("identity has a wrong length",
                    LogMessageKeys.ID_TEXT, text,
                    LogMessageKeys.ACTUAL, decoded.length);
        }
        final byte[] payload = Arrays.copyOf(decoded, LENGTH);
        final byte[] checksum = Arrays.copyOfRange(decoded, LENGTH, decoded.length);
        if (!Arrays.equals(checksum, checksum(hri, payload))) {
            throw new IdentityParseException("identity checksum mismatch",
                    LogMessageKeys.ID_TEXT, text);
        }
        checkMnemonic(text, mnemonic, checksum);
        return payload;
    }

    private static void checkMnemonic(@Nonnull String text, @Nullable String mnemonic, @Nonnull byte[] checksum) {
        if (mnemonic != null && !mnemonic.equals(Proquint.encode(Ints.fromByteArray(checksum)))) {
            throw new IdentityParseException("identity mnemonic does not match its checksum",
                    LogMessageKeys.ID_TEXT, text);
        }
    }
}
