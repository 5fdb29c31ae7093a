/*
 * TyCodecTest.java
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

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.stricttypes.ast.Field;
import org.stricttypes.ast.Primitive;
import org.stricttypes.ast.Sizing;
import org.stricttypes.ast.Ty;
import org.stricttypes.ast.UnionVariant;
import org.stricttypes.ast.Variant;
import org.stricttypes.id.SemId;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TyCodec}, {@link StrictWriter} and {@link StrictReader}.
 */
public class TyCodecTest {
    private static final SemId U8 = SemId.of(Ty.primitive(Primitive.U8));
    private static final SemId STR = SemId.of(Ty.unicode());

    @Test
    public void primitiveEncoding() {
        assertArrayEquals(new byte[] {0, 0x01}, TyCodec.encode(Ty.primitive(Primitive.U8)));
        assertArrayEquals(new byte[] {1}, TyCodec.encode(Ty.unicode()));
    }

    @Test
    public void integersAreLittleEndian() {
        final byte[] bytes = new StrictWriter().writeU16(0x0102).writeU24(0x030405).toByteArray();
        assertArrayEquals(new byte[] {0x02, 0x01, 0x05, 0x04, 0x03}, bytes);
        final StrictReader reader = new StrictReader(bytes);
        assertEquals(0x0102, reader.readU16());
        assertEquals(0x030405, reader.readU24());
        reader.checkEnd();
    }

    @Test
    public void everyKindDecodes() {
        final List<Ty<SemId>> types = ImmutableList.of(
                Ty.primitive(Primitive.F64),
                Ty.unicode(),
                Ty.enumerate(ImmutableList.of(Variant.of("red", 1), Variant.of("green", 2))),
                Ty.union(ImmutableList.of(UnionVariant.of("none", 0, U8), UnionVariant.of("some", 1, STR))),
                Ty.tuple(ImmutableList.of(U8, STR, U8)),
                Ty.struct(ImmutableList.of(Field.of("id", U8), Field.of("label", STR))),
                Ty.array(U8, 32),
                Ty.list(STR, Sizing.U16),
                Ty.set(U8, Sizing.of(1, 10)),
                Ty.map(STR, U8, Sizing.U8),
                Ty.optional(STR),
                Ty.recursive(3));
        for (Ty<SemId> ty : types) {
            assertEquals(ty, TyCodec.decode(TyCodec.encode(ty)), ty::toString);
        }
    }

    @Test
    public void unknownTag() {
        final DecodeException e = assertThrows(DecodeException.class, () -> TyCodec.decode(new byte[] {42}));
        assertThat(e.getMessage(), containsString("invalid type definition"));
    }

    @Test
    public void unknownPrimitive() {
        assertThrows(DecodeException.class, () -> TyCodec.decode(new byte[] {0, 0x7F}));
    }

    @Test
    public void invalidSizing() {
        final byte[] bytes = new StrictWriter().writeU8(Ty.Kind.LIST.getTag()).writeId(U8)
                .writeU16(5).writeU16(4).toByteArray();
        assertThrows(DecodeException.class, () -> TyCodec.decode(bytes));
    }

    @Test
    public void truncated() {
        final byte[] bytes = TyCodec.encode(Ty.optional(STR));
        final DecodeException e = assertThrows(DecodeException.class, () -> TyCodec.decode(Arrays.copyOf(bytes, 10)));
        assertThat(e.getMessage(), containsString("unexpected end of data"));
    }

    @Test
    public void trailingData() {
        final byte[] bytes = TyCodec.encode(Ty.unicode());
        assertThrows(DecodeException.class, () -> TyCodec.decode(Arrays.copyOf(bytes, bytes.length + 2)));
    }

    @Test
    public void invalidIdentifier() {
        final byte[] bytes = new StrictWriter().writeU8(Ty.Kind.ENUM.getTag()).writeU8(1)
                .writeU8(2).writeBytes(new byte[] {'9', 'x'}).writeU8(0).toByteArray();
        final DecodeException e = assertThrows(DecodeException.class, () -> TyCodec.decode(bytes));
        assertThat(e.getMessage(), containsString("invalid identifier"));
    }
}
