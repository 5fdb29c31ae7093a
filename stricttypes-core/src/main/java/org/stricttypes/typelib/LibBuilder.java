/*
 * LibBuilder.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Ty;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeFqn;
import org.stricttypes.ident.TypeName;
import org.stricttypes.logging.KeyValueLogMessage;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Collects type declarations for one library and turns them into a {@link SymbolicLib}.
 *
 * <p>
 * Declarations are given either as {@link StrictSchema}s or as raw symbolic types. Schema references are replaced
 * by references to the schema's name, registering the referenced schema as well; references to dependency libraries
 * are resolved against the exports of the dependencies given at construction. References to other types of this
 * library are left as names: they may point to types declared later and are only resolved by
 * {@link SymbolicLib#compile()}.
 * </p>
 *
 * <p>
 * Problems do not stop the builder. They are collected and reported together by {@link #compileSymbols()}.
 * A builder is meant to be used by a single thread.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class LibBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(LibBuilder.class);

    @Nonnull
    private final LibName libName;
    @Nonnull
    private final Map<LibName, TypeLib> dependencies = new TreeMap<>();
    @Nonnull
    private final Map<TypeName, Ty<TranspileRef>> types = new TreeMap<>();
    @Nonnull
    private final Map<TypeFqn, SemId> externs = new TreeMap<>();
    @Nonnull
    private final Map<TypeName, Class<?>> schemas = new HashMap<>();
    @Nonnull
    private final Set<LibError> errors = new LinkedHashSet<>();

    public LibBuilder(@Nonnull LibName libName, @Nonnull TypeLib... dependencies) {
        this(libName, Arrays.asList(dependencies));
    }

    public LibBuilder(@Nonnull LibName libName, @Nonnull Collection<TypeLib> dependencies) {
        this.libName = libName;
        for (TypeLib dependency : dependencies) {
            final TypeLib existing = this.dependencies.putIfAbsent(dependency.getName(), dependency);
            if (existing != null && !existing.id().equals(dependency.id())) {
                errors.add(new LibError(LibError.Kind.DUPLICATE_DEPENDENCY, null, dependency.getName().toString()));
            }
        }
    }

    @Nonnull
    public LibName getLibName() {
        return libName;
    }

    /**
     * Declare a schema, and every schema it refers to, as named types of this library.
     *
     * @param schema the schema to declare
     * @return this builder
     */
    @Nonnull
    public LibBuilder transpile(@Nonnull StrictSchema schema) {
        registerSchema(schema);
        return this;
    }

    /**
     * Declare a named type of this library.
     *
     * @param name the type name
     * @param ty the symbolic type
     * @return this builder
     */
    @Nonnull
    public LibBuilder transpile(@Nonnull TypeName name, @Nonnull Ty<TranspileRef> ty) {
        register(name, ty);
        return this;
    }

    @Nonnull
    public LibBuilder transpile(@Nonnull String name, @Nonnull Ty<TranspileRef> ty) {
        return transpile(TypeName.of(name), ty);
    }

    /**
     * Finish the symbolic stage.
     *
     * @return the symbolic library
     * @throws TranspileException listing every problem found in the declarations
     */
    @Nonnull
    public SymbolicLib compileSymbols() {
        if (!errors.isEmpty()) {
            throw new TranspileException(libName, ImmutableList.copyOf(errors));
        }
        final ImmutableSortedSet<Dependency> deps = dependencies.values().stream()
                .map(TypeLib::toDependency)
                .collect(ImmutableSortedSet.toImmutableSortedSet(Comparator.naturalOrder()));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("transpiled type library",
                    LogMessageKeys.LIB_NAME, libName,
                    LogMessageKeys.TYPE_COUNT, types.size(),
                    LogMessageKeys.DEPENDENCY_COUNT, deps.size()));
        }
        return new SymbolicLib(libName, deps, ImmutableSortedMap.copyOf(types), ImmutableSortedMap.copyOf(externs));
    }

    /**
     * Finish the symbolic stage and compile the result.
     *
     * @return the compiled library
     * @throws TranspileException if the declarations are inconsistent
     * @throws CompileException if the symbolic library does not compile
     */
    @Nonnull
    public TypeLib compile() {
        return compileSymbols().compile();
    }

    @Nonnull
    private TypeName registerSchema(@Nonnull StrictSchema schema) {
        final TypeName name = schema.getTypeName();
        final Class<?> existing = schemas.putIfAbsent(name, schema.getClass());
        if (existing == null) {
            register(name, schema.getSymbolicType());
        } else if (!existing.equals(schema.getClass())) {
            errors.add(new LibError(LibError.Kind.DUPLICATE_NAME, null, name.toString()));
        }
        return name;
    }

    private void register(@Nonnull TypeName name, @Nonnull Ty<TranspileRef> ty) {
        final Ty<TranspileRef> resolved = resolve(name, ty);
        final Ty<TranspileRef> existing = types.putIfAbsent(name, resolved);
        if (existing != null && !existing.equals(resolved)) {
            errors.add(new LibError(LibError.Kind.DUPLICATE_NAME, null, name.toString()));
        }
    }

    @Nonnull
    private Ty<TranspileRef> resolve(@Nonnull TypeName within, @Nonnull Ty<TranspileRef> ty) {
        return ty.mapReferences(ref -> resolveRef(within, ref));
    }

    @Nonnull
    private TranspileRef resolveRef(@Nonnull TypeName within, @Nonnull TranspileRef ref) {
        switch (ref.getKind()) {
            case EMBEDDED:
                return TranspileRef.embedded(resolve(within, ref.getEmbedded()));
            case SCHEMA:
                return TranspileRef.named(registerSchema(ref.getSchema()));
            case EXTERNAL:
                final TypeFqn fqn = ref.getFqn();
                final TypeLib dependency = dependencies.get(fqn.getLib());
                if (dependency == null) {
                    errors.add(new LibError(LibError.Kind.UNKNOWN_DEPENDENCY, within, fqn.getLib().toString()));
                } else {
                    final SemId id = dependency.getSemId(fqn.getName());
                    if (id == null) {
                        errors.add(new LibError(LibError.Kind.UNKNOWN_EXTERN, within, fqn.toString()));
                    } else {
                        externs.put(fqn, id);
                    }
                }
                return ref;
            default:
                return ref;
        }
    }
}
