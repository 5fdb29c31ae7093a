/*
 * TypeInfo.java
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

package org.stricttypes.layout;

import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.ident.FieldName;
import org.stricttypes.ident.TypeName;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Objects;

/**
 * One item of a {@link TypeLayout}: a type or type member at a given depth below the root type.
 */
@API(API.Status.EXPERIMENTAL)
public final class TypeInfo {
    private final int depth;
    @Nullable
    private final FieldName fieldName;
    @Nullable
    private final TypeName typeName;
    @Nonnull
    private final String expression;

    public TypeInfo(int depth, @Nullable FieldName fieldName, @Nullable TypeName typeName, @Nonnull String expression) {
        if (depth < 0) {
            throw new StrictTypesArgumentException("layout depth must not be negative", LogMessageKeys.DEPTH, depth);
        }
        this.depth = depth;
        this.fieldName = fieldName;
        this.typeName = typeName;
        this.expression = expression;
    }

    /**
     * Get the depth of this item; the root type has depth zero and members of a type at depth {@code d} have
     * depth {@code d + 1}.
     *
     * @return the depth
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Get the field or variant name under which this item appears in its parent.
     *
     * @return the name, or {@code null} for the root and for positional members
     */
    @Nullable
    public FieldName getFieldName() {
        return fieldName;
    }

    @Nullable
    public TypeName getTypeName() {
        return typeName;
    }

    @Nonnull
    public String getExpression() {
        return expression;
    }

    /**
     * Convert this item into a tree node without children.
     *
     * @return the leaf node
     */
    @Nonnull
    public TypeVesper toVesper() {
        return new TypeVesper(fieldName, typeName, expression, Collections.emptyList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TypeInfo that = (TypeInfo)o;
        return depth == that.depth &&
               Objects.equals(fieldName, that.fieldName) &&
               Objects.equals(typeName, that.typeName) &&
               expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(depth, fieldName, typeName, expression);
    }

    @Override
    public String toString() {
        return depth + ":" + (fieldName == null ? "" : fieldName) + ":" + (typeName == null ? "" : typeName) + ":" + expression;
    }
}
