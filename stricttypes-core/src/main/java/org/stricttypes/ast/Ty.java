/*
 * Ty.java
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

package org.stricttypes.ast;

import com.google.common.collect.ImmutableList;
import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.ident.FieldName;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Structural description of a strict type. A {@code Ty} never contains another {@code Ty} directly: nested types are
 * held as references of type {@code R}. While a library is being declared the references are symbolic (names or
 * embedded declarations); once compiled they are {@link org.stricttypes.id.SemId}s, which makes every type a node of
 * a content addressed graph and allows recursive types without cyclic object graphs.
 *
 * <p>
 * The set of variants is closed: the only subclasses are the nested classes of this class, one per {@link Kind}.
 * Code that needs to handle every variant should use a {@link TyVisitor}.
 * </p>
 *
 * @param <R> how this type refers to nested types
 */
@API(API.Status.STABLE)
public abstract class Ty<R> {
    public static final int MAX_MEMBERS = 0xFF;
    public static final int MAX_ARRAY_LEN = 0xFFFF;
    public static final int MAX_RECURSION_DEPTH = 0xFF;

    /**
     * The variants of {@link Ty}, with the tag that starts each variant's canonical encoding.
     */
    public enum Kind {
        PRIMITIVE(0),
        UNICODE(1),
        ENUM(2),
        UNION(3),
        TUPLE(4),
        STRUCT(5),
        ARRAY(6),
        LIST(7),
        SET(8),
        MAP(9),
        OPTIONAL(10),
        RECURSIVE(11);

        private final int tag;

        Kind(int tag) {
            this.tag = tag;
        }

        public int getTag() {
            return tag;
        }

        @Nonnull
        public static Kind fromTag(int tag) {
            for (Kind kind : values()) {
                if (kind.tag == tag) {
                    return kind;
                }
            }
            throw new StrictTypesArgumentException("unknown type tag", LogMessageKeys.TAG, tag);
        }
    }

    private Ty() {
    }

    @Nonnull
    public abstract Kind getKind();

    public abstract <T> T accept(@Nonnull TyVisitor<R, T> visitor);

    /**
     * Get the references to nested types, in declaration order. A reference appears once per occurrence.
     *
     * @return the nested type references
     */
    @Nonnull
    public abstract List<R> getReferences();

    /**
     * Create a type of the same shape with every nested reference replaced.
     *
     * @param mapper function converting each reference
     * @param <S> the new reference type
     * @return the converted type
     */
    @Nonnull
    public abstract <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper);

    /**
     * Render this type as a one line expression, using the given function to render nested references.
     *
     * @param refRenderer renders one nested reference
     * @return the type expression
     */
    @Nonnull
    public abstract String toExpression(@Nonnull Function<? super R, String> refRenderer);

    public boolean isPrimitive() {
        return getKind() == Kind.PRIMITIVE;
    }

    /**
     * Whether this type is a composite type, i.e. one that takes one line per member when laid out.
     *
     * @return {@code true} for enums, unions, tuples and structs
     */
    public boolean isCompound() {
        switch (getKind()) {
            case ENUM:
            case UNION:
            case TUPLE:
            case STRUCT:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return toExpression(String::valueOf);
    }

    // factories

    @Nonnull
    public static <R> Ty<R> primitive(@Nonnull Primitive primitive) {
        return new PrimitiveTy<>(primitive);
    }

    @Nonnull
    public static <R> Ty<R> unit() {
        return primitive(Primitive.UNIT);
    }

    @Nonnull
    public static <R> Ty<R> unicode() {
        return new UnicodeTy<>();
    }

    @Nonnull
    public static <R> Ty<R> enumerate(@Nonnull List<Variant> variants) {
        checkMemberCount(Kind.ENUM, variants.size());
        checkUnique(Kind.ENUM, variants.stream().map(Variant::getName).collect(Collectors.toList()),
                variants.stream().map(Variant::getTag).collect(Collectors.toList()));
        return new EnumTy<>(ImmutableList.copyOf(variants));
    }

    @Nonnull
    public static <R> Ty<R> union(@Nonnull List<UnionVariant<R>> variants) {
        checkMemberCount(Kind.UNION, variants.size());
        checkUnique(Kind.UNION, variants.stream().map(UnionVariant::getName).collect(Collectors.toList()),
                variants.stream().map(UnionVariant::getTag).collect(Collectors.toList()));
        return new UnionTy<>(ImmutableList.copyOf(variants));
    }

    @Nonnull
    public static <R> Ty<R> tuple(@Nonnull List<R> members) {
        checkMemberCount(Kind.TUPLE, members.size());
        return new TupleTy<>(ImmutableList.copyOf(members));
    }

    @Nonnull
    public static <R> Ty<R> struct(@Nonnull List<Field<R>> fields) {
        checkMemberCount(Kind.STRUCT, fields.size());
        checkUnique(Kind.STRUCT, fields.stream().map(Field::getName).collect(Collectors.toList()), ImmutableList.of());
        return new StructTy<>(ImmutableList.copyOf(fields));
    }

    @Nonnull
    public static <R> Ty<R> array(@Nonnull R element, int length) {
        if (length < 1 || length > MAX_ARRAY_LEN) {
            throw new StrictTypesArgumentException("array length out of range",
                    LogMessageKeys.ACTUAL, length,
                    LogMessageKeys.LIMIT, MAX_ARRAY_LEN);
        }
        return new ArrayTy<>(Objects.requireNonNull(element), length);
    }

    @Nonnull
    public static <R> Ty<R> list(@Nonnull R element, @Nonnull Sizing sizing) {
        return new ListTy<>(Objects.requireNonNull(element), sizing);
    }

    @Nonnull
    public static <R> Ty<R> set(@Nonnull R element, @Nonnull Sizing sizing) {
        return new SetTy<>(Objects.requireNonNull(element), sizing);
    }

    @Nonnull
    public static <R> Ty<R> map(@Nonnull R key, @Nonnull R value, @Nonnull Sizing sizing) {
        return new MapTy<>(Objects.requireNonNull(key), Objects.requireNonNull(value), sizing);
    }

    @Nonnull
    public static <R> Ty<R> optional(@Nonnull R inner) {
        return new OptionalTy<>(Objects.requireNonNull(inner));
    }

    /**
     * Create a back reference to a named type that is being defined: depth {@code 0} is the innermost named type
     * enclosing the reference, {@code 1} the one enclosing that, and so on.
     *
     * @param depth how many named types up the reference points
     * @param <R> the reference type
     * @return the recursive reference type
     */
    @Nonnull
    public static <R> Ty<R> recursive(int depth) {
        if (depth < 0 || depth > MAX_RECURSION_DEPTH) {
            throw new StrictTypesArgumentException("recursion depth out of range",
                    LogMessageKeys.DEPTH, depth,
                    LogMessageKeys.LIMIT, MAX_RECURSION_DEPTH);
        }
        return new RecursiveTy<>(depth);
    }

    private static void checkMemberCount(@Nonnull Kind kind, int count) {
        if (count < 1 || count > MAX_MEMBERS) {
            throw new StrictTypesArgumentException("invalid number of members",
                    "kind", kind,
                    LogMessageKeys.ACTUAL, count,
                    LogMessageKeys.LIMIT, MAX_MEMBERS);
        }
    }

    private static void checkUnique(@Nonnull Kind kind, @Nonnull List<FieldName> names, @Nonnull List<Integer> tags) {
        final Set<FieldName> seenNames = new HashSet<>();
        for (FieldName name : names) {
            if (!seenNames.add(name)) {
                throw new StrictTypesArgumentException("repeated member name",
                        "kind", kind,
                        LogMessageKeys.FIELD_NAME, name);
            }
        }
        final Set<Integer> seenTags = new HashSet<>();
        for (Integer tag : tags) {
            if (!seenTags.add(tag)) {
                throw new StrictTypesArgumentException("repeated variant tag",
                        "kind", kind,
                        LogMessageKeys.TAG, tag);
            }
        }
    }

    /**
     * A primitive type.
     * @param <R> reference type
     */
    public static final class PrimitiveTy<R> extends Ty<R> {
        @Nonnull
        private final Primitive primitive;

        private PrimitiveTy(@Nonnull Primitive primitive) {
            this.primitive = primitive;
        }

        @Nonnull
        public Primitive getPrimitive() {
            return primitive;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.PRIMITIVE;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitPrimitive(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return ImmutableList.of();
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new PrimitiveTy<>(primitive);
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return primitive.getExpression();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof PrimitiveTy && primitive == ((PrimitiveTy<?>)o).primitive;
        }

        @Override
        public int hashCode() {
            return primitive.hashCode();
        }
    }

    /**
     * A single unicode character.
     * @param <R> reference type
     */
    public static final class UnicodeTy<R> extends Ty<R> {
        private UnicodeTy() {
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.UNICODE;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitUnicode(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return ImmutableList.of();
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new UnicodeTy<>();
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return "Unicode";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof UnicodeTy;
        }

        @Override
        public int hashCode() {
            return Kind.UNICODE.getTag();
        }
    }

    /**
     * An enumeration of tagged, payload-free variants.
     * @param <R> reference type
     */
    public static final class EnumTy<R> extends Ty<R> {
        @Nonnull
        private final List<Variant> variants;

        private EnumTy(@Nonnull List<Variant> variants) {
            this.variants = variants;
        }

        @Nonnull
        public List<Variant> getVariants() {
            return variants;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.ENUM;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitEnum(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return ImmutableList.of();
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new EnumTy<>(variants);
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return variants.stream().map(Variant::toString).collect(Collectors.joining(" | ", "(", ")"));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof EnumTy && variants.equals(((EnumTy<?>)o).variants);
        }

        @Override
        public int hashCode() {
            return variants.hashCode();
        }
    }

    /**
     * A tagged union.
     * @param <R> reference type
     */
    public static final class UnionTy<R> extends Ty<R> {
        @Nonnull
        private final List<UnionVariant<R>> variants;

        private UnionTy(@Nonnull List<UnionVariant<R>> variants) {
            this.variants = variants;
        }

        @Nonnull
        public List<UnionVariant<R>> getVariants() {
            return variants;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.UNION;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitUnion(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return variants.stream().map(UnionVariant::getType).collect(ImmutableList.toImmutableList());
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new UnionTy<>(variants.stream().map(v -> v.<S>map(mapper)).collect(ImmutableList.toImmutableList()));
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return variants.stream()
                    .map(v -> v.getName() + ":" + v.getTag() + " " + refRenderer.apply(v.getType()))
                    .collect(Collectors.joining(" | ", "(", ")"));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof UnionTy && variants.equals(((UnionTy<?>)o).variants);
        }

        @Override
        public int hashCode() {
            return variants.hashCode();
        }
    }

    /**
     * An anonymous product type.
     * @param <R> reference type
     */
    public static final class TupleTy<R> extends Ty<R> {
        @Nonnull
        private final List<R> members;

        private TupleTy(@Nonnull List<R> members) {
            this.members = members;
        }

        @Nonnull
        public List<R> getMembers() {
            return members;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.TUPLE;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitTuple(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return members;
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new TupleTy<S>(members.stream().map(r -> Objects.<S>requireNonNull(mapper.apply(r))).collect(ImmutableList.toImmutableList()));
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return members.stream().map(refRenderer).collect(Collectors.joining(", ", "(", ")"));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TupleTy && members.equals(((TupleTy<?>)o).members);
        }

        @Override
        public int hashCode() {
            return members.hashCode();
        }
    }

    /**
     * A product type with named fields.
     * @param <R> reference type
     */
    public static final class StructTy<R> extends Ty<R> {
        @Nonnull
        private final List<Field<R>> fields;

        private StructTy(@Nonnull List<Field<R>> fields) {
            this.fields = fields;
        }

        @Nonnull
        public List<Field<R>> getFields() {
            return fields;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.STRUCT;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitStruct(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return fields.stream().map(Field::getType).collect(ImmutableList.toImmutableList());
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new StructTy<>(fields.stream().map(f -> f.<S>map(mapper)).collect(ImmutableList.toImmutableList()));
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return fields.stream()
                    .map(f -> f.getName() + " " + refRenderer.apply(f.getType()))
                    .collect(Collectors.joining(", ", "(", ")"));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StructTy && fields.equals(((StructTy<?>)o).fields);
        }

        @Override
        public int hashCode() {
            return fields.hashCode();
        }
    }

    /**
     * A fixed length array.
     * @param <R> reference type
     */
    public static final class ArrayTy<R> extends Ty<R> {
        @Nonnull
        private final R element;
        private final int length;

        private ArrayTy(@Nonnull R element, int length) {
            this.element = element;
            this.length = length;
        }

        @Nonnull
        public R getElement() {
            return element;
        }

        public int getLength() {
            return length;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.ARRAY;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitArray(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return ImmutableList.of(element);
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new ArrayTy<>(Objects.requireNonNull(mapper.apply(element)), length);
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return "[" + refRenderer.apply(element) + " ^ " + length + "]";
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ArrayTy)) {
                return false;
            }
            final ArrayTy<?> that = (ArrayTy<?>)o;
            return length == that.length && element.equals(that.element);
        }

        @Override
        public int hashCode() {
            return Objects.hash(element, length);
        }
    }

    /**
     * A variable length list.
     * @param <R> reference type
     */
    public static final class ListTy<R> extends Ty<R> {
        @Nonnull
        private final R element;
        @Nonnull
        private final Sizing sizing;

        private ListTy(@Nonnull R element, @Nonnull Sizing sizing) {
            this.element = element;
            this.sizing = sizing;
        }

        @Nonnull
        public R getElement() {
            return element;
        }

        @Nonnull
        public Sizing getSizing() {
            return sizing;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.LIST;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitList(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return ImmutableList.of(element);
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new ListTy<>(Objects.requireNonNull(mapper.apply(element)), sizing);
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return "[" + refRenderer.apply(element) + sizing + "]";
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ListTy)) {
                return false;
            }
            final ListTy<?> that = (ListTy<?>)o;
            return sizing.equals(that.sizing) && element.equals(that.element);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.LIST, element, sizing);
        }
    }

    /**
     * A set of unique elements.
     * @param <R> reference type
     */
    public static final class SetTy<R> extends Ty<R> {
        @Nonnull
        private final R element;
        @Nonnull
        private final Sizing sizing;

        private SetTy(@Nonnull R element, @Nonnull Sizing sizing) {
            this.element = element;
            this.sizing = sizing;
        }

        @Nonnull
        public R getElement() {
            return element;
        }

        @Nonnull
        public Sizing getSizing() {
            return sizing;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.SET;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitSet(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return ImmutableList.of(element);
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new SetTy<>(Objects.requireNonNull(mapper.apply(element)), sizing);
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return "{" + refRenderer.apply(element) + sizing + "}";
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof SetTy)) {
                return false;
            }
            final SetTy<?> that = (SetTy<?>)o;
            return sizing.equals(that.sizing) && element.equals(that.element);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.SET, element, sizing);
        }
    }

    /**
     * A map from unique keys to values.
     * @param <R> reference type
     */
    public static final class MapTy<R> extends Ty<R> {
        @Nonnull
        private final R key;
        @Nonnull
        private final R value;
        @Nonnull
        private final Sizing sizing;

        private MapTy(@Nonnull R key, @Nonnull R value, @Nonnull Sizing sizing) {
            this.key = key;
            this.value = value;
            this.sizing = sizing;
        }

        @Nonnull
        public R getKey() {
            return key;
        }

        @Nonnull
        public R getValue() {
            return value;
        }

        @Nonnull
        public Sizing getSizing() {
            return sizing;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.MAP;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitMap(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return ImmutableList.of(key, value);
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new MapTy<>(Objects.requireNonNull(mapper.apply(key)), Objects.requireNonNull(mapper.apply(value)), sizing);
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return "{" + refRenderer.apply(key) + " -> " + refRenderer.apply(value) + sizing + "}";
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof MapTy)) {
                return false;
            }
            final MapTy<?> that = (MapTy<?>)o;
            return sizing.equals(that.sizing) && key.equals(that.key) && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, value, sizing);
        }
    }

    /**
     * An optional value.
     * @param <R> reference type
     */
    public static final class OptionalTy<R> extends Ty<R> {
        @Nonnull
        private final R inner;

        private OptionalTy(@Nonnull R inner) {
            this.inner = inner;
        }

        @Nonnull
        public R getInner() {
            return inner;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.OPTIONAL;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitOptional(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return ImmutableList.of(inner);
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new OptionalTy<>(Objects.requireNonNull(mapper.apply(inner)));
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return refRenderer.apply(inner) + "?";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof OptionalTy && inner.equals(((OptionalTy<?>)o).inner);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.OPTIONAL, inner);
        }
    }

    /**
     * A back reference to an enclosing named type.
     * @param <R> reference type
     * @see #recursive(int)
     */
    public static final class RecursiveTy<R> extends Ty<R> {
        private final int depth;

        private RecursiveTy(int depth) {
            this.depth = depth;
        }

        public int getDepth() {
            return depth;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.RECURSIVE;
        }

        @Override
        public <T> T accept(@Nonnull TyVisitor<R, T> visitor) {
            return visitor.visitRecursive(this);
        }

        @Nonnull
        @Override
        public List<R> getReferences() {
            return ImmutableList.of();
        }

        @Nonnull
        @Override
        public <S> Ty<S> mapReferences(@Nonnull Function<? super R, ? extends S> mapper) {
            return new RecursiveTy<>(depth);
        }

        @Nonnull
        @Override
        public String toExpression(@Nonnull Function<? super R, String> refRenderer) {
            return "Rec(" + depth + ")";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RecursiveTy && depth == ((RecursiveTy<?>)o).depth;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.RECURSIVE, depth);
        }
    }
}
