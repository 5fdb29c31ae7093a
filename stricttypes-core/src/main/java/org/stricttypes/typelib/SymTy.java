/*
 * SymTy.java
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

import com.google.common.collect.ImmutableSortedSet;
import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Ty;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeName;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled type with the symbolic information it was declared with: its name, if it was declared as a named
 * type, and the libraries it originates from. Types with the same structure compile to the same
 * {@link SemId} regardless of their names, so one compiled type may have several origins.
 */
@API(API.Status.STABLE)
public final class SymTy {
    public static final int MAX_ORIGINS = 0xFF;

    @Nonnull
    private final Ty<SemId> ty;
    @Nullable
    private final TypeName name;
    @Nonnull
    private final ImmutableSortedSet<LibName> origins;

    private SymTy(@Nonnull Ty<SemId> ty, @Nullable TypeName name, @Nonnull ImmutableSortedSet<LibName> origins) {
        if (origins.size() > MAX_ORIGINS) {
            throw new StrictTypesArgumentException("too many origin libraries",
                    LogMessageKeys.TYPE_NAME, name,
                    LogMessageKeys.ACTUAL, origins.size(),
                    LogMessageKeys.LIMIT, MAX_ORIGINS);
        }
        this.ty = ty;
        this.name = name;
        this.origins = origins;
    }

    @Nonnull
    public static SymTy named(@Nonnull LibName lib, @Nonnull TypeName name, @Nonnull Ty<SemId> ty) {
        return new SymTy(ty, name, ImmutableSortedSet.of(lib));
    }

    @Nonnull
    public static SymTy unnamed(@Nonnull Ty<SemId> ty) {
        return new SymTy(ty, null, ImmutableSortedSet.of());
    }

    @Nonnull
    public static SymTy of(@Nonnull Ty<SemId> ty, @Nullable TypeName name, @Nonnull Set<LibName> origins) {
        return new SymTy(ty, name, ImmutableSortedSet.copyOf(origins));
    }

    @Nonnull
    public Ty<SemId> getTy() {
        return ty;
    }

    @Nullable
    public TypeName getName() {
        return name;
    }

    @Nonnull
    public Set<LibName> getOrigins() {
        return origins;
    }

    @Nonnull
    public SemId getSemId() {
        return SemId.of(ty);
    }

    /**
     * Combine the symbolic information of two declarations of the same type. The first name wins; origins are
     * merged.
     *
     * @param other another declaration of the same type
     * @return the combined declaration
     */
    @Nonnull
    SymTy merge(@Nonnull SymTy other) {
        final TypeName mergedName = name != null ? name : other.name;
        return new SymTy(ty, mergedName, ImmutableSortedSet.<LibName>naturalOrder().addAll(origins).addAll(other.origins).build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SymTy symTy = (SymTy)o;
        return ty.equals(symTy.ty) && Objects.equals(name, symTy.name) && origins.equals(symTy.origins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ty, name, origins);
    }

    @Override
    public String toString() {
        return (name == null ? "" : name + " :: ") + ty;
    }
}
