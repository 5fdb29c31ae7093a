/*
 * Primitive.java
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

package org.stricttypes.ast;

import org.stricttypes.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Primitive types. Each has a fixed one byte code used by the canonical encoding; the codes are part of every
 * semantic id and must never change.
 */
@API(API.Status.STABLE)
public enum Primitive {
    U8(0x01, "U8", 1),
    U16(0x02, "U16", 2),
    U24(0x03, "U24", 3),
    U32(0x04, "U32", 4),
    U64(0x08, "U64", 8),
    U128(0x10, "U128", 16),
    U256(0x20, "U256", 32),
    I8(0x41, "I8", 1),
    I16(0x42, "I16", 2),
    I24(0x43, "I24", 3),
    I32(0x44, "I32", 4),
    I64(0x48, "I64", 8),
    I128(0x50, "I128", 16),
    I256(0x60, "I256", 32),
    F16(0xC1, "F16", 2),
    F32(0xC3, "F32", 4),
    F64(0xC7, "F64", 8),
    BYTE(0x40, "Byte", 1),
    UNIT(0x00, "Unit", 0);

    private final int code;
    @Nonnull
    private final String expression;
    private final int byteSize;

    Primitive(int code, @Nonnull String expression, int byteSize) {
        this.code = code;
        this.expression = expression;
        this.byteSize = byteSize;
    }

    public int getCode() {
        return code;
    }

    /**
     * Get the number of bytes a value of this primitive occupies when encoded.
     *
     * @return the encoded size in bytes
     */
    public int getByteSize() {
        return byteSize;
    }

    @Nonnull
    public String getExpression() {
        return expression;
    }

    @Nullable
    public static Primitive fromCode(int code) {
        for (Primitive primitive : values()) {
            if (primitive.code == code) {
                return primitive;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return expression;
    }
}
