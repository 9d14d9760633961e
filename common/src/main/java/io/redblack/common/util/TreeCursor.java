/**
 * Copyright Pravega Authors.
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
package io.redblack.common.util;

import com.google.common.base.Preconditions;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Immutable position within a {@link RedBlackTree}: either an item, or End (one past the largest item). Moving the
 * cursor returns a new instance. Two cursors are equal if they belong to the same tree and point to the same position.
 * <p>
 * A cursor stays valid while items other than the one it points to are inserted or deleted. Using a cursor whose item
 * has been deleted is not supported.
 *
 * @param <T> The type of the items.
 */
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
@EqualsAndHashCode
public final class TreeCursor<T> {
    @Getter(AccessLevel.PACKAGE)
    private final RedBlackTree<T> tree;
    @Getter(AccessLevel.PACKAGE)
    private final RedBlackTree.Node<T> node;

    /**
     * Gets a value indicating whether this cursor points beyond the largest item.
     *
     * @return True if End, false otherwise.
     */
    public boolean isEnd() {
        return this.node == null;
    }

    /**
     * Gets a value indicating whether this cursor points to the smallest item. An End cursor over an empty tree is also
     * a Begin cursor.
     *
     * @return True if Begin, false otherwise.
     */
    public boolean isBegin() {
        return this.node == this.tree.getMinNode();
    }

    /**
     * Gets the item this cursor points to.
     *
     * @return The item.
     * @throws IllegalStateException If this is an End cursor, or its item has been deleted.
     */
    public T item() {
        checkNotEnd();
        return this.node.item;
    }

    /**
     * Creates a cursor pointing to the next larger item. If this cursor points to the largest item, the result is End.
     *
     * @return A new cursor.
     * @throws IllegalStateException If this is an End cursor, or its item has been deleted.
     */
    public TreeCursor<T> next() {
        checkNotEnd();
        return new TreeCursor<>(this.tree, this.node.successor());
    }

    /**
     * Creates a cursor pointing to the next smaller item. If this is an End cursor, the result points to the largest
     * item.
     *
     * @return A new cursor.
     * @throws IllegalStateException If this is a Begin cursor, or its item has been deleted.
     */
    public TreeCursor<T> prev() {
        Preconditions.checkState(!isBegin(), "Cannot move before the smallest item.");
        if (isEnd()) {
            return new TreeCursor<>(this.tree, this.tree.getMaxNode());
        }

        checkNotDetached();
        return new TreeCursor<>(this.tree, this.node.predecessor());
    }

    private void checkNotEnd() {
        Preconditions.checkState(!isEnd(), "Cursor is positioned at End.");
        checkNotDetached();
    }

    private void checkNotDetached() {
        Preconditions.checkState(!this.node.isDetached(), "Cursor points to an item that has been deleted.");
    }

    @Override
    public String toString() {
        return isEnd() ? "TreeCursor[End]" : String.format("TreeCursor[%s]", this.node.item);
    }
}
