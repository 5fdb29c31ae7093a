/*
 * Dependency.java
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

import org.stricttypes.annotation.API;
import org.stricttypes.id.LibId;
import org.stricttypes.ident.LibName;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.Objects;

/**
 * A library another library depends on, pinned by identity.
 */
@API(API.Status.STABLE)
public final class Dependency implements Comparable<Dependency> {
    private static final Comparator<Dependency> COMPARATOR = Comparator.comparing(Dependency::getName).thenComparing(Dependency::getId);

    @Nonnull
    private final LibName name;
    @Nonnull
    private final LibId id;

    private Dependency(@Nonnull LibName name, @Nonnull LibId id) {
        this.name = name;
        this.id = id;
    }

    @Nonnull
    public static Dependency of(@Nonnull LibName name, @Nonnull LibId id) {
        return new Dependency(name, id);
    }

    @Nonnull
    public LibName getName() {
        return name;
    }

    @Nonnull
    public LibId getId() {
        return id;
    }

    @Override
    public int compareTo(@Nonnull Dependency o) {
        return COMPARATOR.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Dependency that = (Dependency)o;
        return name.equals(that.name) && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, id);
    }

    @Override
    public String toString() {
        return name + " -- " + id;
    }
}
