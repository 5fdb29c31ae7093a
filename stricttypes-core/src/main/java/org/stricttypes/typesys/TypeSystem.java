/*
 * TypeSystem.java
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

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import org.stricttypes.ConfinementException;
import org.stricttypes.StrictTypesConfig;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Ty;
import org.stricttypes.codec.Armor;
import org.stricttypes.codec.DecodeException;
import org.stricttypes.codec.StrictReader;
import org.stricttypes.codec.StrictWriter;
import org.stricttypes.codec.TyCodec;
import org.stricttypes.id.CommitId;
import org.stricttypes.id.IdentityParseException;
import org.stricttypes.id.LibId;
import org.stricttypes.id.SemId;
import org.stricttypes.id.TypeSysId;
import org.stricttypes.ident.TypeFqn;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A complete set of compiled types, keyed by semantic id, together with the ids of the libraries they were taken
 * from.
 *
 * <p>
 * A type system guarantees that:
 * </p>
 * <ul>
 *     <li>it holds fewer than 2<sup>24</sup> types, or fewer than the configured maximum;</li>
 *     <li>its canonical encoding is shorter than 2<sup>24</sup> bytes, or than the configured maximum;</li>
 *     <li>it is complete: every semantic id referenced by a member is itself a member.</li>
 * </ul>
 *
 * <p>
 * Type systems are assembled by a {@link SystemBuilder} or decoded with {@link #decode(byte[])}, and are not
 * modified once returned; they can then be read from any number of threads. The fully qualified names under which
 * types were declared are kept for display and lookup but are not part of the identity or the encoding.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class TypeSystem {
    public static final String ARMOR_TITLE = "STRICT TYPE SYSTEM";
    public static final int MAX_LIBS = 0xFFFF;
    private static final int HEADER_SIZE = 2 + 3;

    @Nonnull
    private final ImmutableSortedMap<SemId, Ty<SemId>> types;
    @Nonnull
    private final ImmutableSortedSet<LibId> libIds;
    @Nonnull
    private final ImmutableSortedMap<SemId, ImmutableSortedSet<TypeFqn>> provenance;
    private final long serializedSize;

    private TypeSystem(@Nonnull Draft draft) {
        this.types = ImmutableSortedMap.copyOfSorted(draft.types);
        this.libIds = ImmutableSortedSet.copyOfSorted(draft.libIds);
        final ImmutableSortedMap.Builder<SemId, ImmutableSortedSet<TypeFqn>> names = ImmutableSortedMap.naturalOrder();
        for (Map.Entry<SemId, SortedSet<TypeFqn>> entry : draft.provenance.entrySet()) {
            names.put(entry.getKey(), ImmutableSortedSet.copyOfSorted(entry.getValue()));
        }
        this.provenance = names.build();
        this.serializedSize = draft.serializedSize;
    }

    /**
     * A type system under assembly. The limits of the configuration are enforced on every addition; completeness is
     * left to the caller. {@link #freeze()} takes an immutable snapshot.
     */
    static final class Draft {
        @Nonnull
        private final StrictTypesConfig config;
        @Nonnull
        private final SortedMap<SemId, Ty<SemId>> types = new TreeMap<>();
        @Nonnull
        private final SortedSet<LibId> libIds = new TreeSet<>();
        @Nonnull
        private final SortedMap<SemId, SortedSet<TypeFqn>> provenance = new TreeMap<>();
        private long serializedSize = HEADER_SIZE;

        Draft(@Nonnull StrictTypesConfig config) {
            this.config = config;
        }

        void addLib(@Nonnull LibId libId) {
            if (libIds.contains(libId)) {
                return;
            }
            if (libIds.size() >= MAX_LIBS) {
                throw new ConfinementException("number of libraries", libIds.size() + 1L, MAX_LIBS);
            }
            checkSize(serializedSize + CommitId.LENGTH);
            libIds.add(libId);
            serializedSize += CommitId.LENGTH;
        }

        /**
         * Add a type. Re-inserting a type that is already present does nothing.
         *
         * @param semId the semantic id of the type
         * @param ty the type
         * @throws ConfinementException if the type count or the encoded size would exceed their limits
         */
        void insert(@Nonnull SemId semId, @Nonnull Ty<SemId> ty) {
            if (types.containsKey(semId)) {
                return;
            }
            if (types.size() >= config.getMaxTypes()) {
                throw new ConfinementException("number of types", types.size() + 1L, config.getMaxTypes());
            }
            final long newSize = serializedSize + CommitId.LENGTH + TyCodec.encode(ty).length;
            checkSize(newSize);
            types.put(semId, ty);
            serializedSize = newSize;
        }

        void addProvenance(@Nonnull SemId semId, @Nonnull TypeFqn fqn) {
            provenance.computeIfAbsent(semId, ignore -> new TreeSet<>()).add(fqn);
        }

        @Nonnull
        SortedMap<SemId, Ty<SemId>> getTypes() {
            return types;
        }

        @Nonnull
        TypeSystem freeze() {
            return new TypeSystem(this);
        }

        private void checkSize(long newSize) {
            if (newSize > config.getMaxSerializedSize()) {
                throw new ConfinementException("serialized type system size", newSize, config.getMaxSerializedSize());
            }
        }
    }

    @Nullable
    public Ty<SemId> get(@Nonnull SemId semId) {
        return types.get(semId);
    }

    /**
     * Get a member type that is known to be present, e.g. because it is referenced by another member.
     *
     * @param semId the semantic id
     * @return the type
     * @throws com.google.common.base.VerifyException if the type is not a member, which can only happen through a
     * bug since type systems are complete
     */
    @Nonnull
    public Ty<SemId> index(@Nonnull SemId semId) {
        return Verify.verifyNotNull(types.get(semId), "type system inconsistency: missing type %s", semId);
    }

    public boolean contains(@Nonnull SemId semId) {
        return types.containsKey(semId);
    }

    public int countTypes() {
        return types.size();
    }

    public int countLibs() {
        return libIds.size();
    }

    @Nonnull
    public SortedSet<LibId> getLibIds() {
        return libIds;
    }

    @Nonnull
    public Set<SemId> getSemIds() {
        return types.keySet();
    }

    /**
     * Get the member types in ascending semantic id order.
     *
     * @return the members
     */
    @Nonnull
    public SortedMap<SemId, Ty<SemId>> getTypes() {
        return types;
    }

    /**
     * Get the names under which a type was declared in the imported libraries.
     *
     * @param semId the semantic id
     * @return the fully qualified names, empty for unnamed types and for decoded type systems
     */
    @Nonnull
    public Set<TypeFqn> getProvenance(@Nonnull SemId semId) {
        final Set<TypeFqn> names = provenance.get(semId);
        return names == null ? ImmutableSortedSet.<TypeFqn>of() : names;
    }

    /**
     * Find the type declared under the given name.
     *
     * @param fqn the fully qualified type name
     * @return the semantic id of the type, or {@code null} if no imported library declares that name
     */
    @Nullable
    public SemId resolve(@Nonnull TypeFqn fqn) {
        for (Map.Entry<SemId, ImmutableSortedSet<TypeFqn>> entry : provenance.entrySet()) {
            if (entry.getValue().contains(fqn)) {
                return entry.getKey();
            }
        }
        return null;
    }

    /**
     * Get the size of the canonical encoding of this type system.
     *
     * @return the encoded size in bytes
     */
    public long getSerializedSize() {
        return serializedSize;
    }

    /**
     * Compute the identity of this type system. The id commits to the library ids and the member semantic ids, both
     * in ascending order; it is recomputed on every call.
     *
     * @return the type system id
     */
    @Nonnull
    public TypeSysId id() {
        final StrictWriter writer = new StrictWriter();
        writer.writeU16(libIds.size());
        for (LibId libId : libIds) {
            writer.writeId(libId);
        }
        writer.writeU24(types.size());
        for (SemId semId : types.keySet()) {
            writer.writeId(semId);
        }
        return TypeSysId.commit(writer.toByteArray());
    }

    /**
     * Find every reference to a type that is not in the given set of types.
     *
     * @param types the types to check
     * @return one error per distinct referencing type and missing type, ordered by referencing id then by the
     * position of the reference
     */
    @Nonnull
    static List<ResolutionError> findMissingTypes(@Nonnull Map<SemId, Ty<SemId>> types) {
        final Set<ResolutionError> errors = new LinkedHashSet<>();
        for (Map.Entry<SemId, Ty<SemId>> entry : types.entrySet()) {
            for (SemId ref : entry.getValue().getReferences()) {
                if (!types.containsKey(ref)) {
                    errors.add(ResolutionError.missingType(entry.getKey(), ref));
                }
            }
        }
        return new ArrayList<>(errors);
    }

    @Nonnull
    public byte[] toBytes() {
        final StrictWriter writer = new StrictWriter();
        writer.writeU16(libIds.size());
        for (LibId libId : libIds) {
            writer.writeId(libId);
        }
        writer.writeU24(types.size());
        for (Map.Entry<SemId, Ty<SemId>> entry : types.entrySet()) {
            writer.writeId(entry.getKey());
            TyCodec.write(writer, entry.getValue());
        }
        return writer.toByteArray();
    }

    @Nonnull
    public static TypeSystem decode(@Nonnull byte[] bytes) {
        return decode(bytes, StrictTypesConfig.defaultConfig());
    }

    /**
     * Decode a type system from its canonical encoding.
     *
     * @param bytes the encoded type system
     * @param config the limits to apply
     * @return the type system
     * @throws DecodeException if the bytes are not a canonical encoding of a complete type system
     * @throws ConfinementException if the type system exceeds the configured limits
     */
    @Nonnull
    public static TypeSystem decode(@Nonnull byte[] bytes, @Nonnull StrictTypesConfig config) {
        final StrictReader reader = new StrictReader(bytes);
        final Draft system = new Draft(config);
        final int libCount = reader.readU16();
        LibId lastLib = null;
        for (int i = 0; i < libCount; i++) {
            final LibId libId = reader.readLibId();
            if (lastLib != null && lastLib.compareTo(libId) >= 0) {
                throw reader.invalid("library ids are not in canonical order", LogMessageKeys.LIB_ID, libId);
            }
            system.addLib(libId);
            lastLib = libId;
        }
        final int typeCount = reader.readU24();
        SemId lastId = null;
        for (int i = 0; i < typeCount; i++) {
            final SemId semId = reader.readSemId();
            if (lastId != null && lastId.compareTo(semId) >= 0) {
                throw reader.invalid("types are not in canonical order", LogMessageKeys.SEM_ID, semId);
            }
            final Ty<SemId> ty = TyCodec.read(reader);
            if (!SemId.of(ty).equals(semId)) {
                throw reader.invalid("type does not match its semantic id", LogMessageKeys.SEM_ID, semId);
            }
            system.insert(semId, ty);
            lastId = semId;
        }
        reader.checkEnd();
        final List<ResolutionError> missing = findMissingTypes(system.getTypes());
        if (!missing.isEmpty()) {
            throw new DecodeException("decoded type system is incomplete", new IncompleteTypeSystemException(missing));
        }
        return system.freeze();
    }

    @Nonnull
    public String toArmoredString() {
        return Armor.armor(ARMOR_TITLE, id().toString(), toBytes());
    }

    /**
     * Parse the armored form of a type system, checking the declared id against the decoded content.
     *
     * @param armored the armored text
     * @return the type system
     * @throws DecodeException if the text is malformed, the content is not a complete type system or the id does not
     * match
     */
    @Nonnull
    public static TypeSystem fromArmoredString(@Nonnull String armored) {
        final Armor.Armored block = Armor.unarmor(ARMOR_TITLE, armored);
        final TypeSystem system = decode(block.getData());
        final TypeSysId declared;
        try {
            declared = TypeSysId.parse(block.getId());
        } catch (IdentityParseException e) {
            throw new DecodeException("invalid armored type system id", e);
        }
        final TypeSysId actual = system.id();
        if (!declared.equals(actual)) {
            throw new DecodeException("armored type system id does not match its content",
                    LogMessageKeys.EXPECTED, declared,
                    LogMessageKeys.ACTUAL, actual);
        }
        return system;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TypeSystem that = (TypeSystem)o;
        return types.equals(that.types) && libIds.equals(that.libIds);
    }

    @Override
    public int hashCode() {
        return 31 * types.hashCode() + libIds.hashCode();
    }

    /**
     * Render the type system as a listing: a header with the system id followed by one {@code data} line per member
     * type, in id order. Ids in the listing use their compact form.
     *
     * @return the listing
     */
    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("typesys -- ").append(id()).append("\n\n");
        for (Map.Entry<SemId, Ty<SemId>> entry : types.entrySet()) {
            sb.append("data ").append(entry.getKey().toBaid58()).append(" :: ")
                    .append(entry.getValue().toExpression(SemId::toBaid58))
                    .append('\n');
        }
        return sb.toString();
    }
}
