/*
 * StandardLibrary.java
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

import com.google.common.base.Suppliers;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Ty;
import org.stricttypes.ast.Variant;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeName;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * The {@code Std} library of built-in character and boolean types. It is built once, on first use, and never
 * changes afterwards.
 */
@API(API.Status.EXPERIMENTAL)
public final class StandardLibrary {
    public static final LibName NAME = LibName.of("Std");

    public static final TypeName BOOL = TypeName.of("Bool");
    public static final TypeName DEC = TypeName.of("Dec");
    public static final TypeName HEX_DEC_CAPS = TypeName.of("HexDecCaps");
    public static final TypeName HEX_DEC_SMALL = TypeName.of("HexDecSmall");
    public static final TypeName ALPHA_CAPS = TypeName.of("AlphaCaps");
    public static final TypeName ALPHA_SMALL = TypeName.of("AlphaSmall");
    public static final TypeName ALPHA_NUM = TypeName.of("AlphaNum");

    private static final String[] DIGIT_NAMES = {"zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine"};

    private static final Supplier<SymbolicLib> SYMBOLIC = Suppliers.memoize(StandardLibrary::buildSymbolic);
    private static final Supplier<TypeLib> COMPILED = Suppliers.memoize(() -> SYMBOLIC.get().compile());

    private StandardLibrary() {
    }

    /**
     * Get the compiled standard library.
     *
     * @return the {@code Std} library
     */
    @Nonnull
    public static TypeLib get() {
        return COMPILED.get();
    }

    @Nonnull
    public static SymbolicLib symbolic() {
        return SYMBOLIC.get();
    }

    @Nonnull
    private static SymbolicLib buildSymbolic() {
        final List<Variant> bool = new ArrayList<>();
        bool.add(Variant.of("false", 0));
        bool.add(Variant.of("true", 1));

        final List<Variant> dec = digits();
        final List<Variant> hexDecCaps = digits();
        final List<Variant> hexDecSmall = digits();
        for (char c = 'a'; c <= 'f'; c++) {
            hexDecCaps.add(Variant.of(String.valueOf(c), Character.toUpperCase(c)));
            hexDecSmall.add(Variant.of(String.valueOf(c), c));
        }

        final List<Variant> alphaCaps = letters('A');
        final List<Variant> alphaSmall = letters('a');
        final List<Variant> alphaNum = digits();
        alphaNum.addAll(alphaCaps);
        alphaNum.addAll(alphaSmall);

        return new LibBuilder(NAME)
                .transpile(BOOL, Ty.enumerate(bool))
                .transpile(DEC, Ty.enumerate(dec))
                .transpile(HEX_DEC_CAPS, Ty.enumerate(hexDecCaps))
                .transpile(HEX_DEC_SMALL, Ty.enumerate(hexDecSmall))
                .transpile(ALPHA_CAPS, Ty.enumerate(alphaCaps))
                .transpile(ALPHA_SMALL, Ty.enumerate(alphaSmall))
                .transpile(ALPHA_NUM, Ty.enumerate(alphaNum))
                .compileSymbols();
    }

    @Nonnull
    private static List<Variant> digits() {
        final List<Variant> variants = new ArrayList<>();
        for (int i = 0; i < DIGIT_NAMES.length; i++) {
            variants.add(Variant.of(DIGIT_NAMES[i], '0' + i));
        }
        return variants;
    }

    @Nonnull
    private static List<Variant> letters(char first) {
        final List<Variant> variants = new ArrayList<>();
        for (char c = first; c < first + 26; c++) {
            variants.add(Variant.of(String.valueOf(c), c));
        }
        return variants;
    }
}
