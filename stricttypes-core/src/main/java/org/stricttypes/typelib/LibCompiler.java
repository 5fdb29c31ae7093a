/*
 * LibCompiler.java
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.StrictTypesConfig;
import org.stricttypes.ast.Ty;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.TypeFqn;
import org.stricttypes.ident.TypeName;
import org.stricttypes.logging.KeyValueLogMessage;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Compiles a {@link SymbolicLib} into a {@link TypeLib}.
 *
 * <p>
 * Named types are compiled depth first, in ascending name order: a type's semantic id depends on the ids of the
 * types it refers to, so those are compiled first. The names currently being compiled form a stack. A reference
 * to a name already on the stack closes a cycle; it is accepted only if at least one edge of the cycle is an
 * {@link TranspileRef.Kind#INDIRECT indirect} reference, and it then compiles to a {@link Ty#recursive(int)} back
 * reference counting the named types between the reference and its target.
 * </p>
 *
 * <p>
 * Only types whose compiled form contains no back reference are reused for later references. A member of a cycle
 * is expanded again from every root it is reached from, so its id depends on the structure of the cycle and never
 * on the order of the names it was declared under.
 * </p>
 *
 * <p>
 * A problem found inside a type does not stop the compilation of that type: the offending reference is replaced
 * by a placeholder and the remaining references are still checked, so that every independent problem is reported
 * in a single {@link CompileException}.
 * </p>
 */
final class LibCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(LibCompiler.class);
    private static final int NO_LOW_LINK = Integer.MAX_VALUE;
    private static final SemId PLACEHOLDER = SemId.fromBytes(new byte[SemId.LENGTH]);

    @Nonnull
    private final SymbolicLib lib;
    @Nonnull
    private final Map<TypeName, SemId> compiledNames = new HashMap<>();
    @Nonnull
    private final Map<SemId, SymTy> members = new TreeMap<>();
    @Nonnull
    private final Map<TypeName, SemId> exports = new TreeMap<>();
    @Nonnull
    private final List<Frame> stack = new ArrayList<>();
    @Nonnull
    private final Set<LibError> errors = new LinkedHashSet<>();

    LibCompiler(@Nonnull SymbolicLib lib) {
        this.lib = lib;
    }

    @Nonnull
    TypeLib compile() {
        for (TypeName name : lib.getTypes().keySet()) {
            exports.put(name, compileNamed(name, false).id);
        }
        checkLimit("exports", exports.size(), TypeLib.MAX_EXPORTS);
        checkLimit("types", members.size(), StrictTypesConfig.HARD_LIMIT);
        checkLimit("dependencies", lib.getDependencies().size(), TypeLib.MAX_DEPENDENCIES);
        checkLimit("externs", lib.getExterns().size(), TypeLib.MAX_EXTERNS);
        if (!errors.isEmpty()) {
            throw new CompileException(lib.getName(), ImmutableList.copyOf(errors));
        }
        final TypeLib typeLib = new TypeLib(lib.getName(),
                ImmutableSortedMap.copyOf(exports),
                ImmutableSortedMap.copyOf(members),
                lib.getDependencies(),
                lib.getExterns());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("compiled type library",
                    LogMessageKeys.LIB_NAME, lib.getName(),
                    LogMessageKeys.LIB_ID, typeLib.id(),
                    LogMessageKeys.TYPE_COUNT, members.size()));
        }
        return typeLib;
    }

    private void checkLimit(@Nonnull String what, int actual, int limit) {
        if (actual > limit) {
            errors.add(new LibError(LibError.Kind.LIMIT_EXCEEDED, null, what + " (" + actual + " > " + limit + ")"));
        }
    }

    @Nonnull
    private Compiled compileNamed(@Nonnull TypeName name, boolean indirect) {
        final int onStack = indexOnStack(name);
        if (onStack >= 0) {
            return backReference(name, onStack, indirect);
        }
        final SemId known = compiledNames.get(name);
        if (known != null) {
            return new Compiled(known, NO_LOW_LINK);
        }
        final Ty<TranspileRef> ty = lib.getType(name);
        if (ty == null) {
            return failure(LibError.Kind.UNKNOWN_TYPE, name.toString());
        }
        stack.add(new Frame(name, indirect));
        final int index = stack.size() - 1;
        final CompiledTy body;
        try {
            body = compileTy(ty);
        } finally {
            stack.remove(index);
        }
        if (body.lowLink == NO_LOW_LINK) {
            final SemId id = addMember(SymTy.named(lib.getName(), name, body.ty));
            compiledNames.put(name, id);
            return new Compiled(id, NO_LOW_LINK);
        }
        if (body.lowLink >= index) {
            // cycle closed here, recompiled from every root
            return new Compiled(addMember(SymTy.named(lib.getName(), name, body.ty)), NO_LOW_LINK);
        }
        return new Compiled(addMember(SymTy.unnamed(body.ty)), body.lowLink);
    }

    @Nonnull
    private Compiled backReference(@Nonnull TypeName name, int target, boolean indirect) {
        boolean viaIndirection = indirect;
        for (int i = target + 1; i < stack.size() && !viaIndirection; i++) {
            viaIndirection = stack.get(i).indirect;
        }
        if (!viaIndirection) {
            return failure(LibError.Kind.CYCLIC_REFERENCE, name.toString());
        }
        final Ty<SemId> recursive;
        try {
            recursive = Ty.recursive(stack.size() - 1 - target);
        } catch (StrictTypesArgumentException e) {
            return failure(LibError.Kind.LIMIT_EXCEEDED, "recursion depth of " + name);
        }
        return new Compiled(addMember(SymTy.unnamed(recursive)), target);
    }

    @Nonnull
    private CompiledTy compileTy(@Nonnull Ty<TranspileRef> ty) {
        final int[] lowLink = {NO_LOW_LINK};
        final Ty<SemId> compiled = ty.mapReferences(ref -> {
            final Compiled nested = compileRef(ref);
            lowLink[0] = Math.min(lowLink[0], nested.lowLink);
            return nested.id;
        });
        return new CompiledTy(compiled, lowLink[0]);
    }

    @Nonnull
    private Compiled compileRef(@Nonnull TranspileRef ref) {
        switch (ref.getKind()) {
            case EMBEDDED:
                final CompiledTy embedded = compileTy(ref.getEmbedded());
                return new Compiled(addMember(SymTy.unnamed(embedded.ty)), embedded.lowLink);
            case NAMED:
            case SCHEMA:
                return compileNamed(ref.getName(), false);
            case INDIRECT:
                return compileNamed(ref.getName(), true);
            case EXTERNAL:
                final TypeFqn fqn = ref.getFqn();
                final SemId id = lib.getExterns().get(fqn);
                if (id == null) {
                    return failure(LibError.Kind.UNKNOWN_EXTERN, fqn.toString());
                }
                return new Compiled(id, NO_LOW_LINK);
            default:
                throw new IllegalStateException("unknown reference kind " + ref.getKind());
        }
    }

    @Nonnull
    private Compiled failure(@Nonnull LibError.Kind kind, @Nonnull String subject) {
        errors.add(new LibError(kind, currentName(), subject));
        return new Compiled(PLACEHOLDER, NO_LOW_LINK);
    }

    @Nonnull
    private SemId addMember(@Nonnull SymTy symTy) {
        final SemId id = symTy.getSemId();
        members.merge(id, symTy, SymTy::merge);
        return id;
    }

    private int indexOnStack(@Nonnull TypeName name) {
        for (int i = 0; i < stack.size(); i++) {
            if (stack.get(i).name.equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Nullable
    private TypeName currentName() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1).name;
    }

    private static final class Frame {
        @Nonnull
        private final TypeName name;
        private final boolean indirect;

        private Frame(@Nonnull TypeName name, boolean indirect) {
            this.name = name;
            this.indirect = indirect;
        }
    }

    /**
     * Result of compiling one reference: the semantic id and the lowest stack index of a named type it refers back
     * to, or {@link #NO_LOW_LINK}.
     */
    private static final class Compiled {
        @Nonnull
        private final SemId id;
        private final int lowLink;

        private Compiled(@Nonnull SemId id, int lowLink) {
            this.id = id;
            this.lowLink = lowLink;
        }
    }

    private static final class CompiledTy {
        @Nonnull
        private final Ty<SemId> ty;
        private final int lowLink;

        private CompiledTy(@Nonnull Ty<SemId> ty, int lowLink) {
            this.ty = ty;
            this.lowLink = lowLink;
        }
    }
}
