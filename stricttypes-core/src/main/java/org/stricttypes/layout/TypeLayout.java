/*
 * TypeLayout.java
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
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * A type described as a flat sequence of depth-tagged items, in preorder. A layout can be turned back into the tree
 * it was flattened from with {@link #toVesper()}.
 *
 * <p>
 * A valid layout starts with its only depth zero item, and every following item is at most one level deeper than
 * the item before it.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class TypeLayout {
    public static final int MAX_CHILDREN = 0xFF;

    @Nonnull
    private final ImmutableList<TypeInfo> items;

    private TypeLayout(@Nonnull ImmutableList<TypeInfo> items) {
        this.items = items;
    }

    @Nonnull
    public static TypeLayout of(@Nonnull List<TypeInfo> items) {
        return new TypeLayout(ImmutableList.copyOf(items));
    }

    @Nonnull
    public static TypeLayout from(@Nonnull TypeTree tree) {
        return new TypeLayout(ImmutableList.copyOf(tree.getItems()));
    }

    @Nonnull
    public List<TypeInfo> getItems() {
        return items;
    }

    /**
     * Rebuild the tree described by this layout.
     *
     * <p>
     * The reconstruction keeps the path of child indexes leading from the root to the most recently added item.
     * An item at depth {@code d} is added as the last child of the node reached by following the first
     * {@code d - 1} indexes of the path, and its own index then becomes the last element of the path.
     * </p>
     *
     * @return the root node
     * @throws InvalidLayoutException if the layout is empty, has more than one root, has an item before the root,
     * skips a level or gives one node more than {@value #MAX_CHILDREN} children
     */
    @Nonnull
    public TypeVesper toVesper() {
        Node root = null;
        final List<Integer> path = new ArrayList<>();
        for (int index = 0; index < items.size(); index++) {
            final TypeInfo item = items.get(index);
            final int depth = item.getDepth();
            if (depth == 0) {
                if (root != null) {
                    throw new InvalidLayoutException("invalid type layout with more than one root",
                            LogMessageKeys.ITEM_INDEX, index);
                }
                root = new Node(item);
                continue;
            }
            if (root == null) {
                throw new InvalidLayoutException("invalid type layout with an item before the root",
                        LogMessageKeys.ITEM_INDEX, index,
                        LogMessageKeys.DEPTH, depth);
            }
            if (path.size() < depth - 1) {
                throw new InvalidLayoutException("invalid type layout with skipped levels",
                        LogMessageKeys.ITEM_INDEX, index,
                        LogMessageKeys.DEPTH, depth,
                        LogMessageKeys.PATH, path);
            }
            if (path.size() >= depth) {
                path.subList(depth - 1, path.size()).clear();
            }
            Node head = root;
            for (int child : path) {
                head = head.children.get(child);
            }
            if (head.children.size() >= MAX_CHILDREN) {
                throw new InvalidLayoutException("invalid type layout containing too many items",
                        LogMessageKeys.ITEM_INDEX, index,
                        LogMessageKeys.CHILD_COUNT, head.children.size() + 1,
                        LogMessageKeys.LIMIT, MAX_CHILDREN);
            }
            path.add(head.children.size());
            head.children.add(new Node(item));
        }
        if (root == null) {
            throw new InvalidLayoutException("invalid type layout with zero items");
        }
        return root.freeze();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return items.equals(((TypeLayout)o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    /**
     * Render the tree described by this layout.
     *
     * @return the indented rendering of {@link #toVesper()}
     * @throws InvalidLayoutException if the layout is not valid
     */
    @Override
    public String toString() {
        return toVesper().render();
    }

    private static final class Node {
        @Nullable
        private final FieldName fieldName;
        @Nullable
        private final TypeName typeName;
        @Nonnull
        private final String expression;
        @Nonnull
        private final List<Node> children = new ArrayList<>();

        private Node(@Nonnull TypeInfo item) {
            this.fieldName = item.getFieldName();
            this.typeName = item.getTypeName();
            this.expression = item.getExpression();
        }

        @Nonnull
        private TypeVesper freeze() {
            final List<TypeVesper> frozen = new ArrayList<>(children.size());
            for (Node child : children) {
                frozen.add(child.freeze());
            }
            return new TypeVesper(fieldName, typeName, expression, frozen);
        }
    }
}
