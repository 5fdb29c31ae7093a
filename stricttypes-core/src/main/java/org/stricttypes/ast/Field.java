/*
 * Field.java
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
 * A named member of a structure.
 *
 * @param <R> how the field refers to its type
 */
@API(API.Status.STABLE)
public final class Field<R> {
    @Nonnull
    private final FieldName name;
    @Nonnull
    private final R type;

    private Field(@Nonnull FieldName name, @Nonnull R type) {
        this.name = name;
        this.type = type;
    }

    @Nonnull
    public static <R> Field<R> of(@Nonnull FieldName name, @Nonnull R type) {
        return new Field<>(name, type);
    }

    @Nonnull
    public static <R> Field<R> of(@Nonnull String name, @Nonnull R type) {
        return new Field<>(FieldName.of(name), type);
    }

    @Nonnull
    public FieldName getName() {
        return name;
    }

    @Nonnull
    public R getType() {
        return type;
    }

    @Nonnull
    <S> Field<S> map(@Nonnull Function<? super R, ? extends S> mapper) {
        return new Field<>(name, Objects.requireNonNull(mapper.apply(type)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Field<?> field = (Field<?>)o;
        return name.equals(field.name) && type.equals(field.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + " " + type;
    }
}
