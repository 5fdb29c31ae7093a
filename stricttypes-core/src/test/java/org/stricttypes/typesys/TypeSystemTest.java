/*
 * TypeSystemTest.java
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

package org.stricttypes.typesys;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import org.junit.jupiter.api.Test;
import org.stricttypes.ConfinementException;
import org.stricttypes.StrictTypesConfig;
import org.stricttypes.ast.Field;
import org.stricttypes.ast.Primitive;
import org.stricttypes.ast.Sizing;
import org.stricttypes.ast.Ty;
import org.stricttypes.codec.DecodeException;
import org.stricttypes.codec.StrictWriter;
import org.stricttypes.codec.TyCodec;
import org.stricttypes.id.LibId;
import org.stricttypes.id.SemId;
import org.stricttypes.id.TypeSysId;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeFqn;
import org.stricttypes.ident.TypeName;
import org.stricttypes.typelib.LibBuilder;
import org.stricttypes.typelib.StandardLibrary;
import org.stricttypes.typelib.TranspileRef;
import org.stricttypes.typelib.TypeLib;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TypeSystem}.
 */
public class TypeSystemTest {

    private static TypeLib account() {
        return new LibBuilder(LibName.of("Bank"), StandardLibrary.get())
                .transpile("Account", Ty.struct(ImmutableList.of(
                        Field.of("owner", TranspileRef.embedded(Ty.list(
                                TranspileRef.external(StandardLibrary.NAME, StandardLibrary.ALPHA_NUM), Sizing.U8_NONEMPTY))),
                        Field.of("balance", TranspileRef.primitive(Primitive.U64)),
                        Field.of("frozen", TranspileRef.external(StandardLibrary.NAME, StandardLibrary.BOOL)))))
                .compile();
    }

    private static TypeSystem system() {
        return new SystemBuilder().importLibs(StandardLibrary.get(), account()).build();
    }

    @Test
    public void idIsDeterministic() {
        final TypeSystem first = system();
        final TypeSystem second = system();
        assertEquals(first.id(), second.id());
        assertEquals(first.id(), first.id());
        assertThat(first.id().toString(), startsWith("urn:ubideco:sts:"));
    }

    @Test
    public void idCommitsToLibraries() {
        final TypeLib renamed = new LibBuilder(LibName.of("Renamed")).transpile("Flag", Ty.primitive(Primitive.U8)).compile();
        final TypeLib original = new LibBuilder(LibName.of("Original")).transpile("Flag", Ty.primitive(Primitive.U8)).compile();
        final TypeSystem first = new SystemBuilder().importLib(original).build();
        final TypeSystem second = new SystemBuilder().importLib(renamed).build();
        assertEquals(first.getSemIds(), second.getSemIds());
        assertNotEquals(first.id(), second.id());
    }

    @Test
    public void idOfEmptySystem() {
        final TypeSystem empty = new SystemBuilder().build();
        final byte[] content = new StrictWriter().writeU16(0).writeU24(0).toByteArray();
        assertEquals(TypeSysId.commit(content), empty.id());
        // same content, different tag
        assertFalse(Arrays.equals(LibId.commit(content).toByteArray(), empty.id().toByteArray()));
    }

    @Test
    public void lookup() {
        final TypeSystem system = system();
        final TypeLib account = account();
        final SemId accountId = account.getSemId(TypeName.of("Account"));
        assertEquals(account.getType(accountId).getTy(), system.index(accountId));
        assertEquals(accountId, system.resolve(TypeFqn.of(LibName.of("Bank"), TypeName.of("Account"))));
        assertNull(system.resolve(TypeFqn.of(LibName.of("Bank"), TypeName.of("Missing"))));
        final SemId unknown = SemId.of(Ty.primitive(Primitive.I256));
        assertNull(system.get(unknown));
        assertThrows(VerifyException.class, () -> system.index(unknown));
    }

    @Test
    public void membersAreOrderedById() {
        final List<SemId> ids = new ArrayList<>(system().getTypes().keySet());
        for (int i = 1; i < ids.size(); i++) {
            assertEquals(-1, Integer.signum(ids.get(i - 1).compareTo(ids.get(i))));
        }
    }

    @Test
    public void binaryRoundTrip() {
        final TypeSystem system = system();
        final byte[] bytes = system.toBytes();
        assertEquals(bytes.length, system.getSerializedSize());
        final TypeSystem decoded = TypeSystem.decode(bytes);
        assertEquals(system, decoded);
        assertEquals(system.id(), decoded.id());
        assertArrayEquals(bytes, decoded.toBytes());
    }

    @Test
    public void armoredRoundTrip() {
        final TypeSystem system = system();
        final String armored = system.toArmoredString();
        assertThat(armored, startsWith("-----BEGIN STRICT TYPE SYSTEM-----\nId: " + system.id()));
        assertEquals(system, TypeSystem.fromArmoredString(armored));
    }

    @Test
    public void incompleteEncodingIsRejected() {
        final SemId missing = SemId.of(Ty.primitive(Primitive.U128));
        final Ty<SemId> dangling = Ty.optional(missing);
        final StrictWriter writer = new StrictWriter().writeU16(0).writeU24(1).writeId(SemId.of(dangling));
        TyCodec.write(writer, dangling);
        final DecodeException e = assertThrows(DecodeException.class, () -> TypeSystem.decode(writer.toByteArray()));
        assertThat(e.getCause(), instanceOf(IncompleteTypeSystemException.class));
        assertThat(((IncompleteTypeSystemException)e.getCause()).getErrors(),
                contains(ResolutionError.missingType(SemId.of(dangling), missing)));
    }

    @Test
    public void nonCanonicalOrderIsRejected() {
        final Ty<SemId> first = Ty.primitive(Primitive.U8);
        final Ty<SemId> second = Ty.primitive(Primitive.U16);
        final List<Ty<SemId>> types = new ArrayList<>();
        if (SemId.of(first).compareTo(SemId.of(second)) < 0) {
            types.add(second);
            types.add(first);
        } else {
            types.add(first);
            types.add(second);
        }
        final StrictWriter writer = new StrictWriter().writeU16(0).writeU24(2);
        for (Ty<SemId> ty : types) {
            writer.writeId(SemId.of(ty));
            TyCodec.write(writer, ty);
        }
        assertThrows(DecodeException.class, () -> TypeSystem.decode(writer.toByteArray()));
    }

    @Test
    public void mismatchedIdIsRejected() {
        final Ty<SemId> ty = Ty.primitive(Primitive.U8);
        final StrictWriter writer = new StrictWriter().writeU16(0).writeU24(1).writeId(SemId.of(Ty.primitive(Primitive.U16)));
        TyCodec.write(writer, ty);
        assertThrows(DecodeException.class, () -> TypeSystem.decode(writer.toByteArray()));
    }

    @Test
    public void typeCountIsBounded() {
        final StrictTypesConfig config = StrictTypesConfig.newBuilder().setMaxTypes(2).build();
        final SystemBuilder builder = new SystemBuilder(config).importLib(StandardLibrary.get());
        final ConfinementException e = assertThrows(ConfinementException.class, builder::build);
        assertEquals(2, e.getLimit());
        assertEquals(3, e.getActual());
    }

    @Test
    public void serializedSizeIsBounded() {
        final TypeLib lib = new LibBuilder(LibName.of("Small")).transpile("Byte", Ty.primitive(Primitive.U8)).compile();
        // header and one library id fit, the type does not
        final StrictTypesConfig config = StrictTypesConfig.newBuilder().setMaxSerializedSize(40).build();
        assertThrows(ConfinementException.class, () -> new SystemBuilder(config).importLib(lib).build());
    }

    @Test
    public void decodeAppliesConfiguredBounds() {
        final byte[] bytes = system().toBytes();
        final StrictTypesConfig config = StrictTypesConfig.newBuilder().setMaxTypes(1).build();
        assertThrows(ConfinementException.class, () -> TypeSystem.decode(bytes, config));
    }

    @Test
    public void listing() {
        final TypeLib lib = new LibBuilder(LibName.of("Small")).transpile("Byte", Ty.primitive(Primitive.U8)).compile();
        final TypeSystem system = new SystemBuilder().importLib(lib).build();
        final SemId byteId = lib.getSemId(TypeName.of("Byte"));
        assertEquals("typesys -- " + system.id() + "\n\ndata " + byteId.toBaid58() + " :: U8\n", system.toString());
    }

    @Test
    public void builtSystemIsASnapshot() {
        final SystemBuilder builder = new SystemBuilder().importLib(StandardLibrary.get());
        final TypeSystem before = builder.build();
        final TypeSysId beforeId = before.id();
        final int beforeCount = before.countTypes();

        builder.importLib(account());
        final TypeSystem after = builder.build();
        assertNotEquals(beforeCount, after.countTypes());
        assertEquals(beforeCount, before.countTypes());
        assertEquals(beforeId, before.id());
        assertThat(before.getTypes(), instanceOf(ImmutableSortedMap.class));
        assertThat(before.getLibIds(), instanceOf(ImmutableSortedSet.class));
        assertThrows(UnsupportedOperationException.class,
                () -> before.getTypes().remove(before.getTypes().firstKey()));
    }
}
