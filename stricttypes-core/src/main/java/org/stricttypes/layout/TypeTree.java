/*
 * TypeTree.java
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
import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Field;
import org.stricttypes.ast.Ty;
import org.stricttypes.ast.UnionVariant;
import org.stricttypes.ast.Variant;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.FieldName;
import org.stricttypes.ident.TypeFqn;
import org.stricttypes.ident.TypeName;
import org.stricttypes.logging.LogMessageKeys;
import org.stricttypes.typelib.SymTy;
import org.stricttypes.typelib.TypeLib;
import org.stricttypes.typesys.TypeSystem;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The fully expanded structure of one compiled type, flattened in preorder. Every nested reference is expanded
 * into the referenced type's own item followed by the items of its members; enum variants become leaf items.
 * Recursive back-references are leaves, so the expansion is finite.
 *
 * <p>
 * Expressions refer to nested types by name where one is known and by compact semantic id otherwise.
 * </p>
 *
 * <p>
 * A type referenced from several places is expanded again at every use, so the number of items can grow
 * exponentially with the nesting depth of shared types. Expansion therefore stops with an
 * {@link InvalidLayoutException} once it exceeds a maximum number of items, {@link #DEFAULT_MAX_ITEMS} unless
 * another bound is given.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class TypeTree implements Iterable<TypeInfo> {
    public static final int DEFAULT_MAX_ITEMS = 1 << 20;

    @Nonnull
    private final SemId root;
    @Nonnull
    private final ImmutableList<TypeInfo> items;

    private TypeTree(@Nonnull SemId root, @Nonnull ImmutableList<TypeInfo> items) {
        this.root = root;
        this.items = items;
    }

    /**
     * Expand a member of a type system.
     *
     * @param system the type system
     * @param semId the root type
     * @return the tree of the type
     * @throws StrictTypesArgumentException if the type is not a member of the system
     * @throws InvalidLayoutException if the expansion has more than {@link #DEFAULT_MAX_ITEMS} items
     */
    @Nonnull
    public static TypeTree of(@Nonnull TypeSystem system, @Nonnull SemId semId) {
        return of(system, semId, DEFAULT_MAX_ITEMS);
    }

    /**
     * Expand a member of a type system, with a bound on the number of items.
     *
     * @param system the type system
     * @param semId the root type
     * @param maxItems the maximum number of items of the expansion
     * @return the tree of the type
     * @throws StrictTypesArgumentException if the type is not a member of the system
     * @throws InvalidLayoutException if the expansion has more than {@code maxItems} items
     */
    @Nonnull
    public static TypeTree of(@Nonnull TypeSystem system, @Nonnull SemId semId, int maxItems) {
        return expand(semId, maxItems, new Source() {
            @Nullable
            @Override
            public Ty<SemId> lookup(@Nonnull SemId id) {
                return system.get(id);
            }

            @Nullable
            @Override
            public TypeName nameOf(@Nonnull SemId id) {
                final Set<TypeFqn> names = system.getProvenance(id);
                return names.isEmpty() ? null : names.iterator().next().getName();
            }
        });
    }

    /**
     * Expand a member of a library. References to types of dependency libraries are not expanded: they appear as
     * leaves carrying the fully qualified name of the external type.
     *
     * @param lib the library
     * @param semId the root type
     * @return the tree of the type
     * @throws StrictTypesArgumentException if the type is not a member of the library
     * @throws InvalidLayoutException if the expansion has more than {@link #DEFAULT_MAX_ITEMS} items
     */
    @Nonnull
    public static TypeTree of(@Nonnull TypeLib lib, @Nonnull SemId semId) {
        final Map<SemId, TypeFqn> externs = new HashMap<>();
        for (Map.Entry<TypeFqn, SemId> entry : lib.getExterns().entrySet()) {
            externs.putIfAbsent(entry.getValue(), entry.getKey());
        }
        return expand(semId, DEFAULT_MAX_ITEMS, new Source() {
            @Nullable
            @Override
            public Ty<SemId> lookup(@Nonnull SemId id) {
                final SymTy symTy = lib.getType(id);
                return symTy == null ? null : symTy.getTy();
            }

            @Nullable
            @Override
            public TypeName nameOf(@Nonnull SemId id) {
                final SymTy symTy = lib.getType(id);
                if (symTy != null) {
                    return symTy.getName();
                }
                final TypeFqn fqn = externs.get(id);
                return fqn == null ? null : fqn.getName();
            }

            @Nonnull
            @Override
            public String unresolved(@Nonnull SemId id) {
                final TypeFqn fqn = externs.get(id);
                return fqn == null ? id.toBaid58() : fqn.toString();
            }
        });
    }

    @Nonnull
    private static TypeTree expand(@Nonnull SemId semId, int maxItems, @Nonnull Source source) {
        if (source.lookup(semId) == null) {
            throw new StrictTypesArgumentException("unknown root type", LogMessageKeys.SEM_ID, semId);
        }
        final Expansion expansion = new Expansion(source, maxItems);
        expansion.visit(semId, 0, null);
        return new TypeTree(semId, expansion.items.build());
    }

    private static final class Expansion {
        @Nonnull
        private final Source source;
        private final int maxItems;
        @Nonnull
        private final ImmutableList.Builder<TypeInfo> items = ImmutableList.builder();
        private int count;

        private Expansion(@Nonnull Source source, int maxItems) {
            this.source = source;
            this.maxItems = maxItems;
        }

        private void add(@Nonnull TypeInfo item) {
            if (++count > maxItems) {
                throw new InvalidLayoutException("type expansion has too many items",
                        LogMessageKeys.LIMIT, maxItems);
            }
            items.add(item);
        }

        private void visit(@Nonnull SemId semId, int depth, @Nullable FieldName fieldName) {
            final Ty<SemId> ty = source.lookup(semId);
            final TypeName typeName = source.nameOf(semId);
            if (ty == null) {
                add(new TypeInfo(depth, fieldName, typeName, source.unresolved(semId)));
                return;
            }
            add(new TypeInfo(depth, fieldName, typeName, ty.toExpression(source::render)));
            switch (ty.getKind()) {
                case ENUM:
                    for (Variant variant : ((Ty.EnumTy<SemId>)ty).getVariants()) {
                        add(new TypeInfo(depth + 1, variant.getName(), null, Integer.toString(variant.getTag())));
                    }
                    break;
                case UNION:
                    for (UnionVariant<SemId> variant : ((Ty.UnionTy<SemId>)ty).getVariants()) {
                        visit(variant.getType(), depth + 1, variant.getName());
                    }
                    break;
                case STRUCT:
                    for (Field<SemId> field : ((Ty.StructTy<SemId>)ty).getFields()) {
                        visit(field.getType(), depth + 1, field.getName());
                    }
                    break;
                default:
                    for (SemId ref : ty.getReferences()) {
                        visit(ref, depth + 1, null);
                    }
                    break;
            }
        }
    }

    @Nonnull
    public SemId getRoot() {
        return root;
    }

    @Nonnull
    public List<TypeInfo> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    @Nonnull
    @Override
    public Iterator<TypeInfo> iterator() {
        return items.iterator();
    }

    @Override
    public String toString() {
        return TypeLayout.from(this).toString();
    }

    private interface Source {
        @Nullable
        Ty<SemId> lookup(@Nonnull SemId id);

        @Nullable
        TypeName nameOf(@Nonnull SemId id);

        @Nonnull
        default String unresolved(@Nonnull SemId id) {
            return id.toBaid58();
        }

        @Nonnull
        default String render(@Nonnull SemId id) {
            final TypeName name = nameOf(id);
            return name == null ? id.toBaid58() : name.toString();
        }
    }
}
