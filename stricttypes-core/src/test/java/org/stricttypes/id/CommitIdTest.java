/*
 * CommitIdTest.java
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
import com.google.common.primitives.Bytes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.ast.Primitive;
import org.stricttypes.ast.Ty;
import org.stricttypes.codec.TyCodec;
import org.stricttypes.encoding.Base58;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for the identity types and their text forms.
 */
public class CommitIdTest {
    private static final SemId U8 = SemId.of(Ty.primitive(Primitive.U8));

    @Test
    public void semIdIsTaggedHashOfEncoding() {
        final byte[] tag = Hashing.sha256().hashString(SemId.TAG, StandardCharsets.US_ASCII).asBytes();
        final byte[] content = TyCodec.encode(Ty.primitive(Primitive.U8));
        final byte[] expected = Hashing.sha256().hashBytes(Bytes.concat(tag, tag, content)).asBytes();
        assertArrayEquals(expected, U8.toByteArray());
    }

    @Test
    public void semIdIsDeterministic() {
        assertEquals(U8, SemId.of(Ty.primitive(Primitive.U8)));
        assertNotEquals(U8, SemId.of(Ty.primitive(Primitive.I8)));
    }

    @Test
    public void tagsSeparateDomains() {
        final byte[] content = {1, 2, 3};
        final byte[] lib = LibId.commit(content).toByteArray();
        final byte[] sys = TypeSysId.commit(content).toByteArray();
        final byte[] sem = new CommitEngine(SemId.TAG).commit(content).finish();
        assertNotEquals(Base58.encode(lib), Base58.encode(sys));
        assertNotEquals(Base58.encode(lib), Base58.encode(sem));
        assertNotEquals(Base58.encode(sys), Base58.encode(sem));
    }

    @Test
    public void identityKindsAreNotInterchangeable() {
        final byte[] bytes = U8.toByteArray();
        assertNotEquals(SemId.fromBytes(bytes), LibId.fromBytes(bytes));
        assertEquals(SemId.fromBytes(bytes), U8);
    }

    @Test
    public void wrongLength() {
        assertThrows(StrictTypesArgumentException.class, () -> SemId.fromBytes(new byte[31]));
    }

    @Test
    public void textForm() {
        final String text = U8.toString();
        assertThat(text, matchesPattern("urn:ubideco:semid:[1-9A-HJ-NP-Za-km-z]+#[a-z]{5}-[a-z]{5}"));
        assertThat(text, containsString(U8.toBaid58()));
        assertThat(text, containsString("#" + U8.toMnemonic()));
        assertEquals(64, U8.toHex().length());
    }

    @Test
    public void parseAcceptedForms() {
        final String full = U8.toString();
        assertEquals(U8, SemId.parse(full));
        assertEquals(U8, SemId.parse(full.substring(CommitId.URN_PREFIX.length())));
        assertEquals(U8, SemId.parse("urn:ubideco:semid:" + U8.toBaid58()));
        assertEquals(U8, SemId.parse(U8.toBaid58()));
        assertEquals(U8, SemId.parse(U8.toBaid58() + "#" + U8.toMnemonic()));
    }

    @Test
    public void parseOtherKinds() {
        final LibId lib = LibId.commit(new byte[] {42});
        final TypeSysId sys = TypeSysId.commit(new byte[] {42});
        assertEquals(lib, LibId.parse(lib.toString()));
        assertEquals(sys, TypeSysId.parse(sys.toString()));
        assertThat(lib.toString(), containsString(":stl:"));
        assertThat(sys.toString(), containsString(":sts:"));
    }

    @Test
    public void wrongHri() {
        final LibId lib = LibId.commit(new byte[] {42});
        final IdentityParseException e = assertThrows(IdentityParseException.class, () -> SemId.parse(lib.toString()));
        assertThat(e.getMessage(), containsString("prefix"));
    }

    @Test
    public void checksumIsBoundToHri() {
        // a library id rendered without its prefix does not pass as a semantic id
        final LibId lib = LibId.commit(new byte[] {42});
        assertThrows(IdentityParseException.class, () -> SemId.parse(lib.toBaid58()));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "urn:ubideco:semid:0OIl",
            "urn:ubideco:semid:abc",
            "",
    })
    public void malformed(String text) {
        assertThrows(IdentityParseException.class, () -> SemId.parse(text));
    }

    @Test
    public void checksumMismatch() {
        final byte[] payload = U8.toByteArray();
        payload[0] ^= 1;
        final String withOldChecksum = Base58.encode(Bytes.concat(payload, checksumOf(U8)));
        assertThrows(IdentityParseException.class, () -> SemId.parse(withOldChecksum));
    }

    @Test
    public void mnemonicMismatch() {
        final SemId other = SemId.of(Ty.primitive(Primitive.U16));
        final IdentityParseException e = assertThrows(IdentityParseException.class,
                () -> SemId.parse(U8.toBaid58() + "#" + other.toMnemonic()));
        assertThat(e.getMessage(), containsString("mnemonic"));
    }

    private static byte[] checksumOf(CommitId id) {
        final byte[] decoded = Base58.decode(id.toBaid58());
        final byte[] checksum = new byte[CommitId.CHECKSUM_LENGTH];
        System.arraycopy(decoded, CommitId.LENGTH, checksum, 0, CommitId.CHECKSUM_LENGTH);
        return checksum;
    }
}
