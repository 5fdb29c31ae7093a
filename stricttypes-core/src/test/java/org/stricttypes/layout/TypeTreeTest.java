/*
 * TypeTreeTest.java
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

package org.stricttypes.layout;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.ast.Field;
import org.stricttypes.ast.Primitive;
import org.stricttypes.ast.Sizing;
import org.stricttypes.ast.Ty;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.FieldName;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeName;
import org.stricttypes.typelib.LibBuilder;
import org.stricttypes.typelib.StandardLibrary;
import org.stricttypes.typelib.TranspileRef;
import org.stricttypes.typelib.TypeLib;
import org.stricttypes.typesys.SystemBuilder;
import org.stricttypes.typesys.TypeSystem;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TypeTree}.
 */
public class TypeTreeTest {

    @Test
    public void enumVariantsAreLeaves() {
        final TypeLib std = StandardLibrary.get();
        final TypeTree tree = TypeTree.of(std, std.getSemId(StandardLibrary.BOOL));
        assertThat(tree.getItems(), contains(
                new TypeInfo(0, null, StandardLibrary.BOOL, "(false:0 | true:1)"),
                new TypeInfo(1, FieldName.of("false"), null, "0"),
                new TypeInfo(1, FieldName.of("true"), null, "1")));
    }

    @Test
    public void structMembersAreExpanded() {
        final TypeLib lib = new LibBuilder(LibName.of("Geo"))
                .transpile("Coord", Ty.primitive(Primitive.I32))
                .transpile("Point", Ty.struct(ImmutableList.of(
                        Field.of("x", TranspileRef.named("Coord")),
                        Field.of("y", TranspileRef.named("Coord")))))
                .transpile("Path", Ty.list(TranspileRef.named("Point"), Sizing.U16))
                .compile();
        final TypeTree tree = TypeTree.of(lib, lib.getSemId(TypeName.of("Path")));
        final List<Integer> depths = tree.getItems().stream().map(TypeInfo::getDepth).collect(Collectors.toList());
        assertThat(depths, contains(0, 1, 2, 2));
        final TypeInfo point = tree.getItems().get(1);
        assertEquals(TypeName.of("Point"), point.getTypeName());
        assertEquals(FieldName.of("x"), tree.getItems().get(2).getFieldName());
        assertEquals(TypeName.of("Coord"), tree.getItems().get(3).getTypeName());

        final TypeVesper vesper = TypeLayout.from(tree).toVesper();
        assertEquals(1, vesper.getChildren().size());
        assertEquals(2, vesper.getChildren().get(0).getChildren().size());
    }

    @Test
    public void recursiveReferencesAreLeaves() {
        final TypeLib lib = new LibBuilder(LibName.of("Data"))
                .transpile("Tree", Ty.struct(ImmutableList.of(
                        Field.of("value", TranspileRef.primitive(Primitive.U8)),
                        Field.of("children", TranspileRef.embedded(Ty.list(TranspileRef.indirect("Tree"), Sizing.U8))))))
                .compile();
        final TypeTree tree = TypeTree.of(lib, lib.getSemId(TypeName.of("Tree")));
        final List<Integer> depths = tree.getItems().stream().map(TypeInfo::getDepth).collect(Collectors.toList());
        assertThat(depths, contains(0, 1, 1, 2));
        assertEquals(tree.size(), TypeLayout.from(tree).toVesper().size());
    }

    @Test
    public void externalTypesInLibrariesAreLeaves() {
        final TypeLib std = StandardLibrary.get();
        final TypeLib lib = new LibBuilder(LibName.of("Flags"), std)
                .transpile("Flag", Ty.optional(TranspileRef.external(StandardLibrary.NAME, StandardLibrary.BOOL)))
                .compile();
        final TypeTree fromLib = TypeTree.of(lib, lib.getSemId(TypeName.of("Flag")));
        assertEquals(2, fromLib.size());
        assertEquals("Std.Bool", fromLib.getItems().get(1).getExpression());

        final TypeSystem system = new SystemBuilder().importLibs(std, lib).build();
        final TypeTree fromSystem = TypeTree.of(system, lib.getSemId(TypeName.of("Flag")));
        // the system expands Bool and its two variants
        assertEquals(4, fromSystem.size());
        assertEquals(StandardLibrary.BOOL, fromSystem.getItems().get(1).getTypeName());
    }

    @Test
    public void unknownRoot() {
        final TypeSystem system = new SystemBuilder().build();
        assertThrows(StrictTypesArgumentException.class, () -> TypeTree.of(system, SemId.of(Ty.unicode())));
    }

    @Test
    public void sharedTypesAreExpandedAtEveryUse() {
        final LibBuilder builder = new LibBuilder(LibName.of("Chain"))
                .transpile("Level0", Ty.primitive(Primitive.U8));
        for (int i = 1; i <= 10; i++) {
            builder.transpile("Level" + i, Ty.struct(ImmutableList.of(
                    Field.of("left", TranspileRef.named("Level" + (i - 1))),
                    Field.of("right", TranspileRef.named("Level" + (i - 1))))));
        }
        final TypeLib lib = builder.compile();
        final TypeSystem system = new SystemBuilder().importLib(lib).build();
        final SemId top = lib.getSemId(TypeName.of("Level10"));

        assertEquals((1 << 11) - 1, TypeTree.of(system, top).size());
        assertEquals((1 << 11) - 1, TypeTree.of(system, top, (1 << 11) - 1).size());
        assertThrows(InvalidLayoutException.class, () -> TypeTree.of(system, top, (1 << 11) - 2));
    }
}
