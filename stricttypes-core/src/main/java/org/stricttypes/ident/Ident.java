/*
 * Ident.java
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

package org.stricttypes.ident;

import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * An ASCII identifier naming a library, a type or a field. Identifiers are 1 to {@value #MAX_LENGTH}
 * characters long, start with an ASCII letter and otherwise contain only ASCII letters, digits and
 * underscores.
 *
 * <p>
 * Each kind of name is its own subclass; two identifiers are equal only if they have the same text and
 * the same kind, so a {@link TypeName} can never be mistaken for a {@link LibName}. Identifiers of one kind
 * sort by their text, which is how libraries order their exports.
 * </p>
 */
@API(API.Status.STABLE)
public abstract class Ident implements Comparable<Ident> {
    public static final int MAX_LENGTH = 32;

    @Nonnull
    private final String value;

    protected Ident(@Nonnull String value) {
        this.value = validate(value);
    }

    /**
     * Check that the given text is a valid identifier.
     *
     * @param value the candidate text
     * @return {@code value}
     * @throws StrictTypesArgumentException if {@code value} is not a valid identifier
     */
    @Nonnull
    public static String validate(@Nonnull String value) {
        if (value.isEmpty() || value.length() > MAX_LENGTH) {
            throw new StrictTypesArgumentException("identifier must be between 1 and " + MAX_LENGTH + " characters long",
                    LogMessageKeys.IDENT, value,
                    LogMessageKeys.ACTUAL, value.length());
        }
        final char first = value.charAt(0);
        if (!isAsciiLetter(first)) {
            throw new StrictTypesArgumentException("identifier must start with an alphabetic character",
                    LogMessageKeys.IDENT, value);
        }
        for (int i = 1; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (!isAsciiLetter(c) && !(c >= '0' && c <= '9') && c != '_') {
                throw new StrictTypesArgumentException("identifier contains invalid character",
                        LogMessageKeys.IDENT, value,
                        LogMessageKeys.OFFSET, i);
            }
        }
        return value;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    @Nonnull
    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public int compareTo(@Nonnull Ident o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((Ident)o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
