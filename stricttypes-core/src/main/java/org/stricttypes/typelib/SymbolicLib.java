/*
 * SymbolicLib.java
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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Ty;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeFqn;
import org.stricttypes.ident.TypeName;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * A type library in its symbolic form: named types whose nested references are still names. References to
 * dependency libraries are already resolved to semantic ids, see {@link #getExterns()}.
 *
 * <p>
 * Instances are immutable and are produced by {@link LibBuilder#compileSymbols()}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class SymbolicLib {
    @Nonnull
    private final LibName name;
    @Nonnull
    private final ImmutableSortedSet<Dependency> dependencies;
    @Nonnull
    private final ImmutableSortedMap<TypeName, Ty<TranspileRef>> types;
    @Nonnull
    private final ImmutableSortedMap<TypeFqn, SemId> externs;

    SymbolicLib(@Nonnull LibName name,
                @Nonnull ImmutableSortedSet<Dependency> dependencies,
                @Nonnull ImmutableSortedMap<TypeName, Ty<TranspileRef>> types,
                @Nonnull ImmutableSortedMap<TypeFqn, SemId> externs) {
        this.name = name;
        this.dependencies = dependencies;
        this.types = types;
        this.externs = externs;
    }

    @Nonnull
    public LibName getName() {
        return name;
    }

    @Nonnull
    public ImmutableSortedSet<Dependency> getDependencies() {
        return dependencies;
    }

    /**
     * Get the declared types, in ascending name order.
     *
     * @return map from type name to symbolic type
     */
    @Nonnull
    public Map<TypeName, Ty<TranspileRef>> getTypes() {
        return types;
    }

    @Nullable
    public Ty<TranspileRef> getType(@Nonnull TypeName typeName) {
        return types.get(typeName);
    }

    /**
     * Get the semantic ids of the types of dependency libraries referenced by this library.
     *
     * @return map from fully qualified name to semantic id
     */
    @Nonnull
    public ImmutableSortedMap<TypeFqn, SemId> getExterns() {
        return externs;
    }

    /**
     * Resolve every named reference and compute the semantic id of every type.
     *
     * @return the compiled library
     * @throws CompileException listing every unresolved name, cycle without indirection or exceeded limit
     */
    @Nonnull
    public TypeLib compile() {
        return new LibCompiler(this).compile();
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("typelib ").append(name).append('\n');
        if (!dependencies.isEmpty()) {
            sb.append('\n');
            for (Dependency dependency : dependencies) {
                sb.append("import ").append(dependency).append('\n');
            }
        }
        sb.append('\n');
        for (Map.Entry<TypeName, Ty<TranspileRef>> entry : types.entrySet()) {
            sb.append("data ").append(entry.getKey()).append(" :: ").append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }
}
