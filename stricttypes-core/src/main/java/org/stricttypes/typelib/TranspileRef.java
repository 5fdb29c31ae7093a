/*
 * TranspileRef.java
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

import com.google.common.base.Verify;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Primitive;
import org.stricttypes.ast.Ty;
import org.stricttypes.ident.LibName;
import org.stricttypes.ident.TypeFqn;
import org.stricttypes.ident.TypeName;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A reference from a symbolic type to a nested type.
 *
 * <ul>
 *     <li>{@link Kind#EMBEDDED}: an anonymous type declared in place</li>
 *     <li>{@link Kind#NAMED}: a type of the same library, by name</li>
 *     <li>{@link Kind#INDIRECT}: like {@code NAMED}, but allowed to close a reference cycle</li>
 *     <li>{@link Kind#EXTERNAL}: a type exported by a dependency library</li>
 *     <li>{@link Kind#SCHEMA}: a producer declared schema; only valid until the type is transpiled, at which
 *     point it becomes a {@code NAMED} reference</li>
 * </ul>
 */
@API(API.Status.STABLE)
public final class TranspileRef {
    /**
     * Kinds of symbolic references.
     */
    public enum Kind {
        EMBEDDED,
        NAMED,
        INDIRECT,
        EXTERNAL,
        SCHEMA
    }

    @Nonnull
    private final Kind kind;
    @Nullable
    private final Ty<TranspileRef> embedded;
    @Nullable
    private final LibName lib;
    @Nullable
    private final TypeName name;
    @Nullable
    private final StrictSchema schema;

    private TranspileRef(@Nonnull Kind kind, @Nullable Ty<TranspileRef> embedded, @Nullable LibName lib,
                         @Nullable TypeName name, @Nullable StrictSchema schema) {
        this.kind = kind;
        this.embedded = embedded;
        this.lib = lib;
        this.name = name;
        this.schema = schema;
    }

    @Nonnull
    public static TranspileRef embedded(@Nonnull Ty<TranspileRef> ty) {
        return new TranspileRef(Kind.EMBEDDED, Objects.requireNonNull(ty), null, null, null);
    }

    @Nonnull
    public static TranspileRef primitive(@Nonnull Primitive primitive) {
        return embedded(Ty.primitive(primitive));
    }

    @Nonnull
    public static TranspileRef named(@Nonnull TypeName name) {
        return new TranspileRef(Kind.NAMED, null, null, Objects.requireNonNull(name), null);
    }

    @Nonnull
    public static TranspileRef named(@Nonnull String name) {
        return named(TypeName.of(name));
    }

    @Nonnull
    public static TranspileRef indirect(@Nonnull TypeName name) {
        return new TranspileRef(Kind.INDIRECT, null, null, Objects.requireNonNull(name), null);
    }

    @Nonnull
    public static TranspileRef indirect(@Nonnull String name) {
        return indirect(TypeName.of(name));
    }

    @Nonnull
    public static TranspileRef external(@Nonnull LibName lib, @Nonnull TypeName name) {
        return new TranspileRef(Kind.EXTERNAL, null, Objects.requireNonNull(lib), Objects.requireNonNull(name), null);
    }

    @Nonnull
    public static TranspileRef external(@Nonnull TypeFqn fqn) {
        return external(fqn.getLib(), fqn.getName());
    }

    @Nonnull
    public static TranspileRef schema(@Nonnull StrictSchema schema) {
        return new TranspileRef(Kind.SCHEMA, null, null, schema.getTypeName(), schema);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nonnull
    public Ty<TranspileRef> getEmbedded() {
        return Verify.verifyNotNull(embedded, "not an embedded reference: %s", this);
    }

    /**
     * Get the referenced type name. Available for every kind of reference except {@link Kind#EMBEDDED}.
     *
     * @return the type name
     */
    @Nonnull
    public TypeName getName() {
        return Verify.verifyNotNull(name, "embedded reference has no name: %s", this);
    }

    @Nonnull
    public TypeFqn getFqn() {
        return TypeFqn.of(Verify.verifyNotNull(lib, "not an external reference: %s", this), getName());
    }

    @Nonnull
    public StrictSchema getSchema() {
        return Verify.verifyNotNull(schema, "not a schema reference: %s", this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TranspileRef that = (TranspileRef)o;
        return kind == that.kind &&
               Objects.equals(embedded, that.embedded) &&
               Objects.equals(lib, that.lib) &&
               Objects.equals(name, that.name) &&
               (schema == null ? that.schema == null : that.schema != null && schema.getClass().equals(that.schema.getClass()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, embedded, lib, name);
    }

    @Override
    public String toString() {
        switch (kind) {
            case EMBEDDED:
                return String.valueOf(embedded);
            case EXTERNAL:
                return lib + "." + name;
            default:
                return String.valueOf(name);
        }
    }
}
