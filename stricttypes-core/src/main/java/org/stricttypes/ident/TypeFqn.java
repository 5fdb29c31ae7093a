/*
 * TypeFqn.java
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

package org.stricttypes.ident;

import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.Objects;

/**
 * Fully qualified type name, {@code Lib.Type}. Used to describe where a type was declared; it never takes
 * part in a type's semantic identity.
 */
@API(API.Status.STABLE)
public final class TypeFqn implements Comparable<TypeFqn> {
    private static final Comparator<TypeFqn> COMPARATOR = Comparator.comparing(TypeFqn::getLib).thenComparing(TypeFqn::getName);

    @Nonnull
    private final LibName lib;
    @Nonnull
    private final TypeName name;

    private TypeFqn(@Nonnull LibName lib, @Nonnull TypeName name) {
        this.lib = lib;
        this.name = name;
    }

    @Nonnull
    public static TypeFqn of(@Nonnull LibName lib, @Nonnull TypeName name) {
        return new TypeFqn(lib, name);
    }

    /**
     * Parse a name of the form {@code Lib.Type}.
     *
     * @param text the qualified name
     * @return the parsed name
     * @throws StrictTypesArgumentException if the text does not consist of two valid identifiers separated by a dot
     */
    @Nonnull
    public static TypeFqn parse(@Nonnull String text) {
        final int dot = text.indexOf('.');
        if (dot < 0 || dot != text.lastIndexOf('.')) {
            throw new StrictTypesArgumentException("invalid fully qualified type name",
                    LogMessageKeys.IDENT, text);
        }
        return of(LibName.of(text.substring(0, dot)), TypeName.of(text.substring(dot + 1)));
    }

    @Nonnull
    public LibName getLib() {
        return lib;
    }

    @Nonnull
    public TypeName getName() {
        return name;
    }

    @Override
    public int compareTo(@Nonnull TypeFqn o) {
        return COMPARATOR.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TypeFqn typeFqn = (TypeFqn)o;
        return lib.equals(typeFqn.lib) && name.equals(typeFqn.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lib, name);
    }

    @Override
    public String toString() {
        return lib + "." + name;
    }
}
