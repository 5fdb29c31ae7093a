/*
 * TypeLibTest.java
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

package org.stricttypes.typelib;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.stricttypes.ast.Field;
import org.stricttypes.ast.Primitive;
import org.stricttypes.ast.Sizing;
import org.stricttypes.ast.Ty;
import org.stricttypes.codec.DecodeException;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeName;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TypeLib} encoding and identity.
 */
public class TypeLibTest {

    private static TypeLib sample() {
        return new LibBuilder(LibName.of("Sample"), StandardLibrary.get())
                .transpile("Name", Ty.list(TranspileRef.external(StandardLibrary.NAME, StandardLibrary.ALPHA_NUM), Sizing.U8_NONEMPTY))
                .transpile("Entry", Ty.struct(ImmutableList.of(
                        Field.of("name", TranspileRef.named("Name")),
                        Field.of("amount", TranspileRef.primitive(Primitive.U64)))))
                .compile();
    }

    @Test
    public void binaryRoundTrip() {
        final TypeLib lib = sample();
        final TypeLib decoded = TypeLib.decode(lib.toBytes());
        assertEquals(lib, decoded);
        assertEquals(lib.id(), decoded.id());
        assertEquals(lib.getExterns(), decoded.getExterns());
    }

    @Test
    public void armoredRoundTrip() {
        final TypeLib lib = sample();
        final String armored = lib.toArmoredString();
        assertThat(armored, startsWith("-----BEGIN STRICT TYPE LIB-----\nId: urn:ubideco:stl:"));
        assertEquals(lib, TypeLib.fromArmoredString(armored));
    }

    @Test
    public void armoredIdMustMatch() {
        final String armored = sample().toArmoredString()
                .replace(sample().id().toString(), StandardLibrary.get().id().toString());
        final DecodeException e = assertThrows(DecodeException.class, () -> TypeLib.fromArmoredString(armored));
        assertThat(e.getMessage(), containsString("does not match"));
    }

    @Test
    public void trailingBytesAreRejected() {
        final byte[] bytes = sample().toBytes();
        final byte[] extended = Arrays.copyOf(bytes, bytes.length + 1);
        assertThrows(DecodeException.class, () -> TypeLib.decode(extended));
    }

    @Test
    public void truncatedInputIsRejected() {
        final byte[] bytes = sample().toBytes();
        assertThrows(DecodeException.class, () -> TypeLib.decode(Arrays.copyOf(bytes, bytes.length - 1)));
    }

    @Test
    public void forgedMemberIsRejected() {
        final SemId u8 = SemId.of(Ty.primitive(Primitive.U8));
        final TypeLib forged = TypeLibTestHelper.forge(LibName.of("Forged"), TypeName.of("Bad"), u8, Ty.primitive(Primitive.U16));
        final DecodeException e = assertThrows(DecodeException.class, () -> TypeLib.decode(forged.toBytes()));
        assertThat(e.getMessage(), containsString("semantic id"));
    }

    @Test
    public void identityCommitsToName() {
        final TypeLib first = new LibBuilder(LibName.of("First")).transpile("T", Ty.unicode()).compile();
        final TypeLib renamed = new LibBuilder(LibName.of("Renamed")).transpile("T", Ty.unicode()).compile();
        assertEquals(first.getSemId(TypeName.of("T")), renamed.getSemId(TypeName.of("T")));
        assertThat(first.id().toString(), startsWith("urn:ubideco:stl:"));
        assertNotEquals(first.id(), renamed.id());
    }

    @Test
    public void listing() {
        final TypeLib lib = sample();
        final String listing = lib.toString();
        assertThat(listing, startsWith("typelib Sample -- " + lib.id() + "\n\nimport Std -- " + StandardLibrary.get().id() + "\n"));
        assertThat(listing, containsString("\ndata Entry :: "));
        assertThat(listing, containsString("\ndata Name :: "));
        assertThat(listing, containsString("Std.AlphaNum"));
    }
}
