/*
 * TypeVesper.java
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

import com.google.common.collect.ImmutableList;
import org.stricttypes.annotation.API;
import org.stricttypes.ident.FieldName;
import org.stricttypes.ident.TypeName;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * One node of the tree form of a type layout: the declaration of a type or of one of its members, with the
 * declarations of its own members as children.
 *
 * <p>
 * Nodes are immutable and compare structurally, so two layouts can be diffed by comparing their trees.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class TypeVesper {
    private static final String INDENT = "  ";

    @Nullable
    private final FieldName fieldName;
    @Nullable
    private final TypeName typeName;
    @Nonnull
    private final String expression;
    @Nonnull
    private final ImmutableList<TypeVesper> children;

    public TypeVesper(@Nullable FieldName fieldName, @Nullable TypeName typeName, @Nonnull String expression,
                      @Nonnull List<TypeVesper> children) {
        this.fieldName = fieldName;
        this.typeName = typeName;
        this.expression = expression;
        this.children = ImmutableList.copyOf(children);
    }

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

    @Nonnull
    public List<TypeVesper> getChildren() {
        return children;
    }

    /**
     * Count the nodes of the subtree rooted at this node, including this node.
     *
     * @return the number of nodes
     */
    public int size() {
        int size = 1;
        for (TypeVesper child : children) {
            size += child.size();
        }
        return size;
    }

    /**
     * Render this subtree with one line per node and two spaces of indentation per level.
     *
     * @return the rendered tree, ending with a newline
     */
    @Nonnull
    public String render() {
        final StringBuilder sb = new StringBuilder();
        render(sb, 0);
        return sb.toString();
    }

    private void render(@Nonnull StringBuilder sb, int level) {
        for (int i = 0; i < level; i++) {
            sb.append(INDENT);
        }
        sb.append(headline()).append('\n');
        for (TypeVesper child : children) {
            child.render(sb, level + 1);
        }
    }

    @Nonnull
    private String headline() {
        final StringBuilder sb = new StringBuilder();
        if (fieldName != null) {
            sb.append(fieldName).append(' ');
        }
        if (typeName != null) {
            sb.append(typeName).append(' ');
        }
        return sb.append(expression).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TypeVesper that = (TypeVesper)o;
        return Objects.equals(fieldName, that.fieldName) &&
               Objects.equals(typeName, that.typeName) &&
               expression.equals(that.expression) &&
               children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldName, typeName, expression, children);
    }

    @Override
    public String toString() {
        return render();
    }
}
