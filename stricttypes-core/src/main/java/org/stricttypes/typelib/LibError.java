/*
 * LibError.java
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
import org.stricttypes.ident.TypeName;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One problem found while building or compiling a type library. Errors are collected rather than thrown one at a
 * time, so that all problems of a library can be fixed in one pass.
 */
@API(API.Status.UNSTABLE)
public final class LibError {
    /**
     * What went wrong.
     */
    public enum Kind {
        UNKNOWN_DEPENDENCY("unknown dependency library"),
        DUPLICATE_DEPENDENCY("repeated dependency library with a different identity"),
        UNKNOWN_EXTERN("type is not exported by the dependency library"),
        DUPLICATE_NAME("repeated type name with a different definition"),
        UNKNOWN_TYPE("unknown type name"),
        CYCLIC_REFERENCE("cyclic reference without indirection"),
        LIMIT_EXCEEDED("library limit exceeded");

        @Nonnull
        private final String description;

        Kind(@Nonnull String description) {
            this.description = description;
        }

        @Nonnull
        public String getDescription() {
            return description;
        }
    }

    @Nonnull
    private final Kind kind;
    @Nullable
    private final TypeName within;
    @Nonnull
    private final String subject;

    LibError(@Nonnull Kind kind, @Nullable TypeName within, @Nonnull String subject) {
        this.kind = kind;
        this.within = within;
        this.subject = subject;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Get the declared type whose definition contains the problem, if the problem belongs to one.
     *
     * @return the enclosing type name or {@code null}
     */
    @Nullable
    public TypeName getWithin() {
        return within;
    }

    /**
     * Get the offending name: the unknown type or library, the repeated name, and so on.
     *
     * @return the offending name
     */
    @Nonnull
    public String getSubject() {
        return subject;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final LibError that = (LibError)o;
        return kind == that.kind && Objects.equals(within, that.within) && subject.equals(that.subject);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, within, subject);
    }

    @Override
    public String toString() {
        return kind.getDescription() + " `" + subject + "`" + (within == null ? "" : " in type `" + within + "`");
    }
}
