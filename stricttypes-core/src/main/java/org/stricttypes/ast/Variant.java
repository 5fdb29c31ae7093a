/*
 * Variant.java
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

import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.ident.FieldName;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A named enumeration variant with its one byte tag.
 */
@API(API.Status.STABLE)
public final class Variant {
    @Nonnull
    private final FieldName name;
    private final int tag;

    private Variant(@Nonnull FieldName name, int tag) {
        this.name = name;
        this.tag = tag;
    }

    @Nonnull
    public static Variant of(@Nonnull FieldName name, int tag) {
        checkTag(name, tag);
        return new Variant(name, tag);
    }

    @Nonnull
    public static Variant of(@Nonnull String name, int tag) {
        return of(FieldName.of(name), tag);
    }

    static void checkTag(@Nonnull FieldName name, int tag) {
        if (tag < 0 || tag > 0xFF) {
            throw new StrictTypesArgumentException("variant tag must fit into one byte",
                    LogMessageKeys.FIELD_NAME, name,
                    LogMessageKeys.TAG, tag);
        }
    }

    @Nonnull
    public FieldName getName() {
        return name;
    }

    public int getTag() {
        return tag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Variant variant = (Variant)o;
        return tag == variant.tag && name.equals(variant.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tag);
    }

    @Override
    public String toString() {
        return name + ":" + tag;
    }
}
