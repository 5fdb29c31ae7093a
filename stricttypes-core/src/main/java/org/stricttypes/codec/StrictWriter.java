/*
 * StrictWriter.java
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

import com.google.common.io.LittleEndianDataOutputStream;
import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.StrictTypesException;
import org.stricttypes.annotation.API;
import org.stricttypes.id.CommitId;
import org.stricttypes.ident.Ident;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writer of the canonical strict encoding: little-endian unsigned integers, identifiers as a one byte length
 * followed by their ASCII text, and identities as their raw 32 bytes. The same value always produces the same
 * bytes.
 */
@API(API.Status.UNSTABLE)
public class StrictWriter {
    public static final int MAX_U8 = 0xFF;
    public static final int MAX_U16 = 0xFFFF;
    public static final int MAX_U24 = 0xFFFFFF;

    @Nonnull
    private final ByteArrayOutputStream bytes;
    @Nonnull
    private final LittleEndianDataOutputStream out;

    public StrictWriter() {
        this.bytes = new ByteArrayOutputStream();
        this.out = new LittleEndianDataOutputStream(bytes);
    }

    @Nonnull
    public StrictWriter writeU8(int value) {
        checkRange("u8", value, MAX_U8);
        try {
            out.writeByte(value);
        } catch (IOException e) {
            throw new StrictTypesException("unable to write encoded data", e);
        }
        return this;
    }

    @Nonnull
    public StrictWriter writeU16(int value) {
        checkRange("u16", value, MAX_U16);
        try {
            out.writeShort(value);
        } catch (IOException e) {
            throw new StrictTypesException("unable to write encoded data", e);
        }
        return this;
    }

    @Nonnull
    public StrictWriter writeU24(int value) {
        checkRange("u24", value, MAX_U24);
        try {
            out.writeShort(value & 0xFFFF);
            out.writeByte(value >>> 16);
        } catch (IOException e) {
            throw new StrictTypesException("unable to write encoded data", e);
        }
        return this;
    }

    @Nonnull
    public StrictWriter writeBytes(@Nonnull byte[] data) {
        try {
            out.write(data);
        } catch (IOException e) {
            throw new StrictTypesException("unable to write encoded data", e);
        }
        return this;
    }

    @Nonnull
    public StrictWriter writeIdent(@Nonnull Ident ident) {
        writeU8(ident.length());
        return writeBytes(ident.getValue().getBytes(StandardCharsets.US_ASCII));
    }

    @Nonnull
    public StrictWriter writeId(@Nonnull CommitId id) {
        return writeBytes(id.toByteArray());
    }

    /**
     * Write a collection length as a little-endian integer of the given width.
     *
     * @param count the number of elements
     * @param width the width of the length in bytes: 1, 2 or 3
     * @return this writer
     */
    @Nonnull
    public StrictWriter writeLength(int count, int width) {
        switch (width) {
            case 1:
                return writeU8(count);
            case 2:
                return writeU16(count);
            case 3:
                return writeU24(count);
            default:
                throw new StrictTypesArgumentException("unsupported length width", LogMessageKeys.ACTUAL, width);
        }
    }

    public int size() {
        return bytes.size();
    }

    @Nonnull
    public byte[] toByteArray() {
        try {
            out.flush();
        } catch (IOException e) {
            throw new StrictTypesException("unable to write encoded data", e);
        }
        return bytes.toByteArray();
    }

    private static void checkRange(@Nonnull String what, int value, int max) {
        if (value < 0 || value > max) {
            throw new StrictTypesArgumentException("value does not fit into " + what,
                    LogMessageKeys.ACTUAL, value,
                    LogMessageKeys.LIMIT, max);
        }
    }
}
