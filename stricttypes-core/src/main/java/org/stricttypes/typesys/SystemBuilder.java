/*
 * SystemBuilder.java
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stricttypes.StrictTypesConfig;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Ty;
import org.stricttypes.id.LibId;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeFqn;
import org.stricttypes.ident.TypeName;
import org.stricttypes.logging.KeyValueLogMessage;
import org.stricttypes.logging.LogMessageKeys;
import org.stricttypes.typelib.Dependency;
import org.stricttypes.typelib.SymTy;
import org.stricttypes.typelib.TypeLib;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Assembles a {@link TypeSystem} from compiled libraries.
 *
 * <p>
 * Libraries are imported one at a time with {@link #importLib(TypeLib)}; the types of every imported library are
 * merged by semantic id. Once all libraries are imported, {@link #build()} checks that the merged types are complete
 * and that every dependency of every imported library was itself imported, and returns the finished type system.
 * </p>
 *
 * <p>
 * A builder is not thread safe and is meant to be used once.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class SystemBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(SystemBuilder.class);

    @Nonnull
    private final StrictTypesConfig config;
    @Nonnull
    private final SortedMap<LibId, TypeLib> libs = new TreeMap<>();
    @Nonnull
    private final SortedMap<SemId, Ty<SemId>> types = new TreeMap<>();
    @Nonnull
    private final SortedMap<SemId, SortedSet<TypeFqn>> provenance = new TreeMap<>();

    public SystemBuilder() {
        this(StrictTypesConfig.defaultConfig());
    }

    public SystemBuilder(@Nonnull StrictTypesConfig config) {
        this.config = config;
    }

    /**
     * Import the types of a library. Importing a library that was already imported does nothing.
     *
     * @param lib the library
     * @return this builder
     * @throws TypeCollisionException if the library assigns a different type to a semantic id that an earlier
     * library already provided; the builder is left unchanged in that case
     */
    @Nonnull
    public SystemBuilder importLib(@Nonnull TypeLib lib) {
        final LibId libId = lib.id();
        if (libs.containsKey(libId)) {
            return this;
        }
        for (Map.Entry<SemId, SymTy> entry : lib.getTypes().entrySet()) {
            final Ty<SemId> existing = types.get(entry.getKey());
            final Ty<SemId> incoming = entry.getValue().getTy();
            if (existing != null && !existing.equals(incoming)) {
                throw new TypeCollisionException(entry.getKey(), existing, incoming, lib.getName());
            }
        }
        libs.put(libId, lib);
        for (Map.Entry<SemId, SymTy> entry : lib.getTypes().entrySet()) {
            types.putIfAbsent(entry.getKey(), entry.getValue().getTy());
            final TypeName name = entry.getValue().getName();
            if (name != null) {
                for (LibName origin : entry.getValue().getOrigins()) {
                    addProvenance(entry.getKey(), TypeFqn.of(origin, name));
                }
            }
        }
        for (Map.Entry<TypeName, SemId> export : lib.getExports().entrySet()) {
            addProvenance(export.getValue(), TypeFqn.of(lib.getName(), export.getKey()));
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("imported type library",
                    LogMessageKeys.LIB_NAME, lib.getName(),
                    LogMessageKeys.LIB_ID, libId,
                    LogMessageKeys.TYPE_COUNT, types.size()));
        }
        return this;
    }

    @Nonnull
    public SystemBuilder importLibs(@Nonnull TypeLib... libs) {
        for (TypeLib lib : libs) {
            importLib(lib);
        }
        return this;
    }

    private void addProvenance(@Nonnull SemId semId, @Nonnull TypeFqn fqn) {
        provenance.computeIfAbsent(semId, ignore -> new TreeSet<>()).add(fqn);
    }

    public int countTypes() {
        return types.size();
    }

    public int countLibs() {
        return libs.size();
    }

    /**
     * Find everything that prevents the imported libraries from forming a complete type system.
     * Missing dependencies come first, in library id order, followed by missing types in ascending order of the
     * referencing type.
     *
     * @return the resolution errors, empty if {@link #build()} would succeed
     */
    @Nonnull
    public List<ResolutionError> validate() {
        final List<ResolutionError> errors = new ArrayList<>();
        for (TypeLib lib : libs.values()) {
            for (Dependency dependency : lib.getDependencies()) {
                if (!libs.containsKey(dependency.getId())) {
                    errors.add(ResolutionError.missingDependency(lib.getName(), dependency));
                }
            }
        }
        errors.addAll(TypeSystem.findMissingTypes(types));
        return errors;
    }

    /**
     * Finish the type system.
     *
     * @return the complete type system
     * @throws IncompleteTypeSystemException if any type or dependency cannot be resolved
     * @throws org.stricttypes.ConfinementException if the type system exceeds the configured limits
     */
    @Nonnull
    public TypeSystem build() {
        final List<ResolutionError> errors = validate();
        if (!errors.isEmpty()) {
            throw new IncompleteTypeSystemException(errors);
        }
        final TypeSystem.Draft draft = new TypeSystem.Draft(config);
        for (LibId libId : libs.keySet()) {
            draft.addLib(libId);
        }
        for (Map.Entry<SemId, Ty<SemId>> entry : types.entrySet()) {
            draft.insert(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<SemId, SortedSet<TypeFqn>> entry : provenance.entrySet()) {
            for (TypeFqn fqn : entry.getValue()) {
                draft.addProvenance(entry.getKey(), fqn);
            }
        }
        final TypeSystem system = draft.freeze();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("built type system",
                    LogMessageKeys.SYS_ID, system.id(),
                    LogMessageKeys.LIB_COUNT, system.countLibs(),
                    LogMessageKeys.TYPE_COUNT, system.countTypes()));
        }
        return system;
    }
}
