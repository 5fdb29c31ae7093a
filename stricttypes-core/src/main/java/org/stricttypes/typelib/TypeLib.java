/*
 * TypeLib.java
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
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Ty;
import org.stricttypes.codec.Armor;
import org.stricttypes.codec.DecodeException;
import org.stricttypes.codec.StrictReader;
import org.stricttypes.codec.StrictWriter;
import org.stricttypes.codec.TyCodec;
import org.stricttypes.id.IdentityParseException;
import org.stricttypes.id.LibId;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeFqn;
import org.stricttypes.ident.TypeName;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * A compiled type library. Every member type is keyed by its {@link SemId} and refers to nested types only by
 * semantic id; nested types are either members of this library or types exported by one of its dependencies.
 * Named types are listed in the exports.
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class TypeLib {
    public static final String ARMOR_TITLE = "STRICT TYPE LIB";
    public static final int MAX_DEPENDENCIES = 0xFF;
    public static final int MAX_EXPORTS = 0xFFFF;
    public static final int MAX_EXTERNS = 0xFFFF;

    @Nonnull
    private final LibName name;
    @Nonnull
    private final ImmutableSortedMap<TypeName, SemId> exports;
    @Nonnull
    private final ImmutableSortedMap<SemId, SymTy> types;
    @Nonnull
    private final ImmutableSortedSet<Dependency> dependencies;
    @Nonnull
    private final ImmutableSortedMap<TypeFqn, SemId> externs;
    @Nonnull
    private final Supplier<LibId> id;

    TypeLib(@Nonnull LibName name,
            @Nonnull ImmutableSortedMap<TypeName, SemId> exports,
            @Nonnull ImmutableSortedMap<SemId, SymTy> types,
            @Nonnull ImmutableSortedSet<Dependency> dependencies,
            @Nonnull ImmutableSortedMap<TypeFqn, SemId> externs) {
        this.name = name;
        this.exports = exports;
        this.types = types;
        this.dependencies = dependencies;
        this.externs = externs;
        this.id = Suppliers.memoize(() -> LibId.commit(toBytes()));
    }

    @Nonnull
    public LibName getName() {
        return name;
    }

    @Nonnull
    public LibId id() {
        return id.get();
    }

    @Nonnull
    public Dependency toDependency() {
        return Dependency.of(name, id());
    }

    @Nonnull
    public Set<Dependency> getDependencies() {
        return dependencies;
    }

    /**
     * Get the named types of this library.
     *
     * @return map from type name to semantic id, in name order
     */
    @Nonnull
    public Map<TypeName, SemId> getExports() {
        return exports;
    }

    /**
     * Get all member types, named or not.
     *
     * @return map from semantic id to the compiled type, in id order
     */
    @Nonnull
    public Map<SemId, SymTy> getTypes() {
        return types;
    }

    /**
     * Get the types of dependency libraries that members of this library refer to.
     *
     * @return map from fully qualified name to semantic id
     */
    @Nonnull
    public Map<TypeFqn, SemId> getExterns() {
        return externs;
    }

    @Nullable
    public SemId getSemId(@Nonnull TypeName typeName) {
        return exports.get(typeName);
    }

    @Nullable
    public SymTy getType(@Nonnull SemId semId) {
        return types.get(semId);
    }

    public int countTypes() {
        return types.size();
    }

    /**
     * Get the canonical encoding of this library, which is also the content its {@link LibId} commits to.
     *
     * @return the encoded library
     */
    @Nonnull
    public byte[] toBytes() {
        final StrictWriter writer = new StrictWriter();
        writer.writeIdent(name);
        writer.writeLength(dependencies.size(), 1);
        for (Dependency dependency : dependencies) {
            writer.writeIdent(dependency.getName());
            writer.writeId(dependency.getId());
        }
        writer.writeLength(externs.size(), 2);
        for (Map.Entry<TypeFqn, SemId> entry : externs.entrySet()) {
            writer.writeIdent(entry.getKey().getLib());
            writer.writeIdent(entry.getKey().getName());
            writer.writeId(entry.getValue());
        }
        writer.writeLength(exports.size(), 2);
        for (Map.Entry<TypeName, SemId> entry : exports.entrySet()) {
            writer.writeIdent(entry.getKey());
            writer.writeId(entry.getValue());
        }
        writer.writeLength(types.size(), 3);
        for (Map.Entry<SemId, SymTy> entry : types.entrySet()) {
            final SymTy symTy = entry.getValue();
            writer.writeId(entry.getKey());
            if (symTy.getName() == null) {
                writer.writeU8(0);
            } else {
                writer.writeU8(1);
                writer.writeIdent(symTy.getName());
            }
            writer.writeLength(symTy.getOrigins().size(), 1);
            for (LibName origin : symTy.getOrigins()) {
                writer.writeIdent(origin);
            }
            TyCodec.write(writer, symTy.getTy());
        }
        return writer.toByteArray();
    }

    /**
     * Decode a library from its canonical encoding. Entries must be in canonical order and every member must match
     * its semantic id.
     *
     * @param bytes the encoded library
     * @return the library
     * @throws DecodeException if the bytes are not a canonical library encoding
     */
    @Nonnull
    public static TypeLib decode(@Nonnull byte[] bytes) {
        final StrictReader reader = new StrictReader(bytes);
        final LibName name = reader.readLibName();

        final int dependencyCount = reader.readLength(1);
        final ImmutableSortedSet.Builder<Dependency> dependencies = ImmutableSortedSet.naturalOrder();
        Dependency lastDependency = null;
        for (int i = 0; i < dependencyCount; i++) {
            final Dependency dependency = Dependency.of(reader.readLibName(), reader.readLibId());
            lastDependency = checkOrder(reader, lastDependency, dependency);
            dependencies.add(dependency);
        }

        final int externCount = reader.readLength(2);
        final ImmutableSortedMap.Builder<TypeFqn, SemId> externs = ImmutableSortedMap.naturalOrder();
        TypeFqn lastExtern = null;
        for (int i = 0; i < externCount; i++) {
            final TypeFqn fqn = TypeFqn.of(reader.readLibName(), reader.readTypeName());
            lastExtern = checkOrder(reader, lastExtern, fqn);
            externs.put(fqn, reader.readSemId());
        }

        final int exportCount = reader.readLength(2);
        final ImmutableSortedMap.Builder<TypeName, SemId> exports = ImmutableSortedMap.naturalOrder();
        TypeName lastExport = null;
        for (int i = 0; i < exportCount; i++) {
            final TypeName typeName = reader.readTypeName();
            lastExport = checkOrder(reader, lastExport, typeName);
            exports.put(typeName, reader.readSemId());
        }

        final int typeCount = reader.readLength(3);
        final ImmutableSortedMap.Builder<SemId, SymTy> types = ImmutableSortedMap.naturalOrder();
        SemId lastId = null;
        for (int i = 0; i < typeCount; i++) {
            final SemId semId = reader.readSemId();
            lastId = checkOrder(reader, lastId, semId);
            final int hasName = reader.readU8();
            if (hasName > 1) {
                throw reader.invalid("invalid type name marker", LogMessageKeys.ACTUAL, hasName);
            }
            final TypeName typeName = hasName == 1 ? reader.readTypeName() : null;
            final int originCount = reader.readLength(1);
            final Set<LibName> origins = new TreeSet<>();
            for (int j = 0; j < originCount; j++) {
                origins.add(reader.readLibName());
            }
            final Ty<SemId> ty = TyCodec.read(reader);
            if (!SemId.of(ty).equals(semId)) {
                throw reader.invalid("type does not match its semantic id", LogMessageKeys.SEM_ID, semId);
            }
            types.put(semId, SymTy.of(ty, typeName, origins));
        }
        reader.checkEnd();

        final TypeLib lib = new TypeLib(name, exports.build(), types.build(), dependencies.build(), externs.build());
        for (Map.Entry<TypeName, SemId> export : lib.exports.entrySet()) {
            if (!lib.types.containsKey(export.getValue())) {
                throw new DecodeException("exported type is not a member of the library",
                        LogMessageKeys.LIB_NAME, name,
                        LogMessageKeys.TYPE_NAME, export.getKey(),
                        LogMessageKeys.SEM_ID, export.getValue());
            }
        }
        return lib;
    }

    @Nonnull
    private static <T extends Comparable<? super T>> T checkOrder(@Nonnull StrictReader reader, @Nullable T previous, @Nonnull T next) {
        if (previous != null && previous.compareTo(next) >= 0) {
            throw reader.invalid("entries are not in canonical order", LogMessageKeys.ACTUAL, next);
        }
        return next;
    }

    @Nonnull
    public String toArmoredString() {
        return Armor.armor(ARMOR_TITLE, id().toString(), toBytes());
    }

    /**
     * Parse the armored form of a library, checking the declared id against the decoded content.
     *
     * @param armored the armored text
     * @return the library
     * @throws DecodeException if the text is malformed or the id does not match
     */
    @Nonnull
    public static TypeLib fromArmoredString(@Nonnull String armored) {
        final Armor.Armored block = Armor.unarmor(ARMOR_TITLE, armored);
        final TypeLib lib = decode(block.getData());
        final LibId declared;
        try {
            declared = LibId.parse(block.getId());
        } catch (IdentityParseException e) {
            throw new DecodeException("invalid armored library id", e);
        }
        if (!declared.equals(lib.id())) {
            throw new DecodeException("armored library id does not match its content",
                    LogMessageKeys.EXPECTED, declared,
                    LogMessageKeys.ACTUAL, lib.id());
        }
        return lib;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TypeLib typeLib = (TypeLib)o;
        return name.equals(typeLib.name) && id().equals(typeLib.id());
    }

    @Override
    public int hashCode() {
        return id().hashCode();
    }

    /**
     * Render the library as text: a header with its name and id, the imported libraries and one {@code data} line
     * per named type. Unnamed nested types are rendered in place.
     *
     * @return the library listing
     */
    @Override
    public String toString() {
        final Map<SemId, String> externNames = new HashMap<>();
        for (Map.Entry<TypeFqn, SemId> entry : externs.entrySet()) {
            externNames.putIfAbsent(entry.getValue(), entry.getKey().toString());
        }
        final StringBuilder sb = new StringBuilder();
        sb.append("typelib ").append(name).append(" -- ").append(id()).append('\n');
        if (!dependencies.isEmpty()) {
            sb.append('\n');
            for (Dependency dependency : dependencies) {
                sb.append("import ").append(dependency).append('\n');
            }
        }
        sb.append('\n');
        for (Map.Entry<TypeName, SemId> entry : exports.entrySet()) {
            final SymTy symTy = types.get(entry.getValue());
            sb.append("data ").append(entry.getKey()).append(" :: ")
                    .append(symTy.getTy().toExpression(ref -> renderRef(ref, externNames)))
                    .append('\n');
        }
        return sb.toString();
    }

    @Nonnull
    private String renderRef(@Nonnull SemId ref, @Nonnull Map<SemId, String> externNames) {
        final SymTy member = types.get(ref);
        if (member == null) {
            final String externName = externNames.get(ref);
            return externName != null ? externName : ref.toBaid58();
        }
        if (member.getName() != null && ref.equals(exports.get(member.getName()))) {
            return member.getName().toString();
        }
        return member.getTy().toExpression(nested -> renderRef(nested, externNames));
    }
}
