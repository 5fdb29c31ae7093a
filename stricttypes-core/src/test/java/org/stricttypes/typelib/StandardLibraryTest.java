/*
 * StandardLibraryTest.java
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

import org.junit.jupiter.api.Test;
import org.stricttypes.ast.Ty;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.TypeName;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Tests for {@link StandardLibrary}.
 */
public class StandardLibraryTest {

    @Test
    public void builtOnce() {
        assertSame(StandardLibrary.get(), StandardLibrary.get());
    }

    @Test
    public void exportsAllTypes() {
        final TypeLib std = StandardLibrary.get();
        assertEquals(StandardLibrary.NAME, std.getName());
        assertEquals(7, std.getExports().size());
        assertEquals(7, std.countTypes());
        assertThat(std.getDependencies(), empty());
    }

    @Test
    public void enumsHaveExpectedSizes() {
        final TypeLib std = StandardLibrary.get();
        assertEquals(2, variantCount(std, StandardLibrary.BOOL));
        assertEquals(10, variantCount(std, StandardLibrary.DEC));
        assertEquals(16, variantCount(std, StandardLibrary.HEX_DEC_CAPS));
        assertEquals(26, variantCount(std, StandardLibrary.ALPHA_SMALL));
        assertEquals(62, variantCount(std, StandardLibrary.ALPHA_NUM));
    }

    @Test
    public void identityIsStable() {
        final TypeLib recompiled = StandardLibrary.symbolic().compile();
        assertEquals(StandardLibrary.get().id(), recompiled.id());
    }

    private static int variantCount(TypeLib lib, TypeName name) {
        final SemId semId = lib.getSemId(name);
        assertNotNull(semId);
        return ((Ty.EnumTy<SemId>)lib.getType(semId).getTy()).getVariants().size();
    }
}
