/*
 * UnionVariant.java
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

import org.stricttypes.annotation.API;
import org.stricttypes.ident.FieldName;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.function.Function;

/**
 * A tagged union alternative: name, one byte tag and the type of the alternative's payload.
 *
 * @param <R> how the variant refers to its payload type
 */
@API(API.Status.STABLE)
public final class UnionVariant<R> {
    @Nonnull
    private final FieldName name;
    private final int tag;
    @Nonnull
    private final R type;

    private UnionVariant(@Nonnull FieldName name, int tag, @Nonnull R type) {
        this.name = name;
        this.tag = tag;
        this.type = type;
    }

    @Nonnull
    public static <R> UnionVariant<R> of(@Nonnull FieldName name, int tag, @Nonnull R type) {
        Variant.checkTag(name, tag);
        return new UnionVariant<>(name, tag, type);
    }

    @Nonnull
    public static <R> UnionVariant<R> of(@Nonnull String name, int tag, @Nonnull R type) {
        return of(FieldName.of(name), tag, type);
    }

    @Nonnull
    public FieldName getName() {
        return name;
    }

    public int getTag() {
        return tag;
    }

    @Nonnull
    public R getType() {
        return type;
    }

    @Nonnull
    <S> UnionVariant<S> map(@Nonnull Function<? super R, ? extends S> mapper) {
        return new UnionVariant<>(name, tag, Objects.requireNonNull(mapper.apply(type)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final UnionVariant<?> that = (UnionVariant<?>)o;
        return tag == that.tag && name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tag, type);
    }

    @Override
    public String toString() {
        return name + ":" + tag + " " + type;
    }
}
