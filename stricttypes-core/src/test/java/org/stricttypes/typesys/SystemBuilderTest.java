/*
 * SystemBuilderTest.java
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

import org.junit.jupiter.api.Test;
import org.stricttypes.ast.Primitive;
import org.stricttypes.ast.Sizing;
import org.stricttypes.ast.Ty;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeFqn;
import org.stricttypes.ident.TypeName;
import org.stricttypes.typelib.LibBuilder;
import org.stricttypes.typelib.StandardLibrary;
import org.stricttypes.typelib.TranspileRef;
import org.stricttypes.typelib.TypeLib;
import org.stricttypes.typelib.TypeLibTestHelper;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SystemBuilder}.
 */
public class SystemBuilderTest {
    private static final TypeName U8 = TypeName.of("U8");

    private static TypeLib u8Lib(String name) {
        return new LibBuilder(LibName.of(name)).transpile(U8, Ty.primitive(Primitive.U8)).compile();
    }

    @Test
    public void sharedTypeIsCountedOnce() {
        final TypeLib first = u8Lib("First");
        final TypeLib second = u8Lib("Second");
        final TypeSystem system = new SystemBuilder()
                .importLib(first)
                .importLib(second)
                .build();
        assertEquals(1, system.countTypes());
        assertEquals(2, system.countLibs());
        final SemId u8 = first.getSemId(U8);
        assertTrue(system.contains(u8));
        assertThat(system.getProvenance(u8), contains(
                TypeFqn.of(LibName.of("First"), U8),
                TypeFqn.of(LibName.of("Second"), U8)));
    }

    @Test
    public void importIsIdempotent() {
        final TypeLib lib = u8Lib("Once");
        final SystemBuilder builder = new SystemBuilder().importLib(lib).importLib(lib);
        assertEquals(1, builder.countLibs());
        assertEquals(1, builder.countTypes());
    }

    @Test
    public void collisionIsRejected() {
        final TypeLib honest = u8Lib("Honest");
        final SemId u8 = honest.getSemId(U8);
        final TypeLib forged = TypeLibTestHelper.forge(LibName.of("Forged"), U8, u8, Ty.primitive(Primitive.I8));
        final SystemBuilder builder = new SystemBuilder().importLib(honest);
        final TypeCollisionException e = assertThrows(TypeCollisionException.class, () -> builder.importLib(forged));
        assertEquals(u8, e.getSemId());
        assertEquals(1, builder.countLibs());
        assertEquals(Ty.primitive(Primitive.U8), builder.build().index(u8));
    }

    @Test
    public void missingDependencyAndTypesAreReported() {
        final TypeLib std = StandardLibrary.get();
        final TypeLib lib = new LibBuilder(LibName.of("Flags"), std)
                .transpile("Flag", Ty.optional(TranspileRef.external(StandardLibrary.NAME, StandardLibrary.BOOL)))
                .compile();
        final SystemBuilder builder = new SystemBuilder().importLib(lib);
        final IncompleteTypeSystemException e = assertThrows(IncompleteTypeSystemException.class, builder::build);
        final SemId flag = lib.getSemId(TypeName.of("Flag"));
        assertThat(e.getErrors(), contains(
                ResolutionError.missingDependency(LibName.of("Flags"), std.toDependency()),
                ResolutionError.missingType(flag, std.getSemId(StandardLibrary.BOOL))));
        assertEquals(ResolutionError.Kind.MISSING_DEPENDENCY, e.getErrors().get(0).getKind());

        builder.importLib(std);
        assertThat(builder.validate(), empty());
        final TypeSystem system = builder.build();
        assertEquals(std.countTypes() + 1, system.countTypes());
    }

    @Test
    public void missingTypesAreOrderedByReferencingId() {
        final TypeLib std = StandardLibrary.get();
        final TypeLib lib = new LibBuilder(LibName.of("Text"), std)
                .transpile("Digits", Ty.list(TranspileRef.external(StandardLibrary.NAME, StandardLibrary.DEC), Sizing.U8))
                .transpile("Word", Ty.list(TranspileRef.external(StandardLibrary.NAME, StandardLibrary.ALPHA_SMALL), Sizing.U8))
                .transpile("Letters", Ty.set(TranspileRef.external(StandardLibrary.NAME, StandardLibrary.ALPHA_SMALL), Sizing.U8))
                .compile();
        final List<ResolutionError> errors = new SystemBuilder().importLib(lib).validate();
        // one missing dependency, then one error per referencing type
        assertEquals(4, errors.size());
        assertEquals(ResolutionError.Kind.MISSING_DEPENDENCY, errors.get(0).getKind());
        for (int i = 2; i < errors.size(); i++) {
            assertTrue(errors.get(i - 1).getReferencedBy().compareTo(errors.get(i).getReferencedBy()) < 0);
        }
        assertThat(errors.subList(1, 4).stream().map(ResolutionError::getMissingType).collect(Collectors.toSet()),
                containsInAnyOrder(std.getSemId(StandardLibrary.DEC), std.getSemId(StandardLibrary.ALPHA_SMALL)));
    }

    @Test
    public void importOrderDoesNotMatter() {
        final TypeLib std = StandardLibrary.get();
        final TypeLib lib = new LibBuilder(LibName.of("Flags"), std)
                .transpile("Flag", Ty.optional(TranspileRef.external(StandardLibrary.NAME, StandardLibrary.BOOL)))
                .compile();
        final TypeSystem forward = new SystemBuilder().importLibs(std, lib).build();
        final TypeSystem backward = new SystemBuilder().importLibs(lib, std).build();
        assertEquals(forward, backward);
        assertEquals(forward.id(), backward.id());
    }
}
