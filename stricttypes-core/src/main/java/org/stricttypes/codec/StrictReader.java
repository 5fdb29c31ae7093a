/*
 * StrictReader.java
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

import com.google.common.io.LittleEndianDataInputStream;
import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.encoding.ByteArrays;
import org.stricttypes.id.LibId;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.FieldName;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeName;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Reader of the canonical strict encoding written by {@link StrictWriter}. Truncated input, values outside of
 * their declared range and invalid identifiers are all reported as {@link DecodeException}s carrying the offset
 * at which decoding failed.
 */
@API(API.Status.UNSTABLE)
public class StrictReader {
    private static final int LOGGED_PREFIX = 64;

    @Nonnull
    private final byte[] data;
    @Nonnull
    private final ByteArrayInputStream bytes;
    @Nonnull
    private final LittleEndianDataInputStream in;

    public StrictReader(@Nonnull byte[] data) {
        this.data = data;
        this.bytes = new ByteArrayInputStream(data);
        this.in = new LittleEndianDataInputStream(bytes);
    }

    public int readU8() {
        try {
            return in.readUnsignedByte();
        } catch (IOException e) {
            throw failure(e);
        }
    }

    public int readU16() {
        try {
            return in.readUnsignedShort();
        } catch (IOException e) {
            throw failure(e);
        }
    }

    public int readU24() {
        try {
            final int low = in.readUnsignedShort();
            return low | (in.readUnsignedByte() << 16);
        } catch (IOException e) {
            throw failure(e);
        }
    }

    /**
     * Read a collection length written by {@link StrictWriter#writeLength(int, int)}.
     *
     * @param width the width of the length in bytes: 1, 2 or 3
     * @return the length
     */
    public int readLength(int width) {
        switch (width) {
            case 1:
                return readU8();
            case 2:
                return readU16();
            case 3:
                return readU24();
            default:
                throw new StrictTypesArgumentException("unsupported length width", LogMessageKeys.ACTUAL, width);
        }
    }

    @Nonnull
    public byte[] readBytes(int length) {
        final byte[] result = new byte[length];
        try {
            in.readFully(result);
        } catch (IOException e) {
            throw failure(e);
        }
        return result;
    }

    @Nonnull
    public LibName readLibName() {
        return readIdent(LibName::of);
    }

    @Nonnull
    public TypeName readTypeName() {
        return readIdent(TypeName::of);
    }

    @Nonnull
    public FieldName readFieldName() {
        return readIdent(FieldName::of);
    }

    @Nonnull
    public SemId readSemId() {
        return SemId.fromBytes(readBytes(SemId.LENGTH));
    }

    @Nonnull
    public LibId readLibId() {
        return LibId.fromBytes(readBytes(LibId.LENGTH));
    }

    @Nonnull
    private <T> T readIdent(@Nonnull Function<String, T> factory) {
        final int offset = getOffset();
        final int length = readU8();
        final String text = new String(readBytes(length), StandardCharsets.US_ASCII);
        try {
            return factory.apply(text);
        } catch (StrictTypesArgumentException e) {
            throw new DecodeException("invalid identifier", e)
                    .addLogInfo(LogMessageKeys.OFFSET.toString(), offset)
                    .addLogInfo(LogMessageKeys.IDENT.toString(), text);
        }
    }

    /**
     * Get the number of bytes consumed so far.
     *
     * @return the current offset
     */
    public int getOffset() {
        return data.length - bytes.available();
    }

    public boolean isAtEnd() {
        return bytes.available() == 0;
    }

    /**
     * Check that the whole input has been consumed.
     *
     * @throws DecodeException if there are unread bytes left
     */
    public void checkEnd() {
        if (!isAtEnd()) {
            throw new DecodeException("unexpected data after the end of the encoded value",
                    LogMessageKeys.OFFSET, getOffset(),
                    LogMessageKeys.ACTUAL, data.length);
        }
    }

    /**
     * Create an exception for malformed content at the current position.
     *
     * @param msg what is wrong
     * @param keyValues additional log info
     * @return the exception to throw
     */
    @Nonnull
    public DecodeException invalid(@Nonnull String msg, @Nonnull Object... keyValues) {
        final DecodeException e = new DecodeException(msg, keyValues);
        e.addLogInfo(LogMessageKeys.OFFSET.toString(), getOffset());
        return e;
    }

    @Nonnull
    private DecodeException failure(@Nonnull IOException e) {
        final DecodeException ex = new DecodeException(e instanceof EOFException ? "unexpected end of data" : "unable to read encoded data", e);
        ex.addLogInfo(LogMessageKeys.OFFSET.toString(), getOffset());
        ex.addLogInfo(LogMessageKeys.RAW_BYTES.toString(), ByteArrays.loggablePrefix(data, LOGGED_PREFIX));
        return ex;
    }
}
