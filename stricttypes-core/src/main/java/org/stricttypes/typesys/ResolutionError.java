/*
 * ResolutionError.java
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

import org.stricttypes.annotation.API;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.LibName;
import org.stricttypes.typelib.Dependency;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A reference that cannot be resolved within the libraries imported into a {@link SystemBuilder}: a type referring
 * to a semantic id that no imported library provides, or a library depending on a library that was not imported.
 */
@API(API.Status.UNSTABLE)
public final class ResolutionError {
    /**
     * Kinds of unresolved references.
     */
    public enum Kind {
        MISSING_TYPE,
        MISSING_DEPENDENCY
    }

    @Nonnull
    private final Kind kind;
    @Nullable
    private final SemId referencedBy;
    @Nullable
    private final SemId missingType;
    @Nullable
    private final LibName lib;
    @Nullable
    private final Dependency missingDependency;

    private ResolutionError(@Nonnull Kind kind, @Nullable SemId referencedBy, @Nullable SemId missingType,
                            @Nullable LibName lib, @Nullable Dependency missingDependency) {
        this.kind = kind;
        this.referencedBy = referencedBy;
        this.missingType = missingType;
        this.lib = lib;
        this.missingDependency = missingDependency;
    }

    @Nonnull
    public static ResolutionError missingType(@Nonnull SemId referencedBy, @Nonnull SemId missing) {
        return new ResolutionError(Kind.MISSING_TYPE, referencedBy, missing, null, null);
    }

    @Nonnull
    public static ResolutionError missingDependency(@Nonnull LibName lib, @Nonnull Dependency missing) {
        return new ResolutionError(Kind.MISSING_DEPENDENCY, null, null, lib, missing);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Get the member type containing the unresolved reference.
     *
     * @return the referencing type, for {@link Kind#MISSING_TYPE} errors
     */
    @Nullable
    public SemId getReferencedBy() {
        return referencedBy;
    }

    @Nullable
    public SemId getMissingType() {
        return missingType;
    }

    /**
     * Get the library declaring the unresolved dependency.
     *
     * @return the library name, for {@link Kind#MISSING_DEPENDENCY} errors
     */
    @Nullable
    public LibName getLib() {
        return lib;
    }

    @Nullable
    public Dependency getMissingDependency() {
        return missingDependency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ResolutionError that = (ResolutionError)o;
        return kind == that.kind &&
               Objects.equals(referencedBy, that.referencedBy) &&
               Objects.equals(missingType, that.missingType) &&
               Objects.equals(lib, that.lib) &&
               Objects.equals(missingDependency, that.missingDependency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, referencedBy, missingType, lib, missingDependency);
    }

    @Override
    public String toString() {
        if (kind == Kind.MISSING_TYPE) {
            return "type " + referencedBy + " refers to unknown type " + missingType;
        }
        return "library " + lib + " depends on library " + missingDependency + " which was not imported";
    }
}
