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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.redblack.common.Exceptions;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import javax.annotation.concurrent.NotThreadSafe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered set of items backed by a Red-Black Tree. Items are ordered exclusively by the Comparator supplied at
 * construction; no two items that compare equal may be stored at the same time.
 * <p>
 * Lookups, insertions and deletions take O(log n) time. Navigation is done using {@link TreeCursor} instances, which
 * walk the tree using parent links (no auxiliary stack). The smallest and largest nodes are cached, so {@link #begin()},
 * {@link #first()} and {@link #last()} are O(1).
 * <p>
 * Note: This class is not thread-safe and requires external synchronization when in a multi-threaded environment.
 *
 * @param <T> The type of the items.
 */
@Slf4j
@NotThreadSafe
public class RedBlackTree<T> implements Iterable<T> {
    //region Members

    private final Comparator<? super T> comparator;
    private final RedBlackTreeConfig config;
    private Node<T> root;
    private Node<T> minNode;
    private Node<T> maxNode;
    private int count;
    private int modCount;
    private int mutationsSinceValidation;

    //endregion

    //region Constructor

    /**
     * Creates a new instance of the RedBlackTree class using the default configuration.
     *
     * @param comparator The Comparator to order items by. This must define a total order and must not change its
     *                   behavior for the lifetime of the tree.
     */
    public RedBlackTree(Comparator<? super T> comparator) {
        this(comparator, RedBlackTreeConfig.DEFAULT);
    }

    /**
     * Creates a new instance of the RedBlackTree class.
     *
     * @param comparator The Comparator to order items by. This must define a total order and must not change its
     *                   behavior for the lifetime of the tree.
     * @param config     The configuration to use.
     */
    public RedBlackTree(Comparator<? super T> comparator, RedBlackTreeConfig config) {
        this.comparator = Preconditions.checkNotNull(comparator, "comparator");
        this.config = Preconditions.checkNotNull(config, "config");
        if (config.isValidationEnabled()) {
            log.debug("RedBlackTree created with invariant validation every {} mutation(s).", config.getValidationInterval());
        }
    }

    //endregion

    //region Lookups

    /**
     * Gets the number of items in the tree.
     *
     * @return The number of items.
     */
    public int size() {
        return this.count;
    }

    /**
     * Gets a value indicating whether the tree has no items.
     *
     * @return True if empty, false otherwise.
     */
    public boolean isEmpty() {
        return this.count == 0;
    }

    /**
     * Gets the item that compares equal to the given key.
     *
     * @param key The key to search by. Only the parts of it that the Comparator looks at need to be set.
     * @return The stored item, or null if no such item exists.
     */
    public T get(T key) {
        SearchResult<T> result = findGreaterOrEqual(key);
        return result.exact ? result.node.item : null;
    }

    /**
     * Gets the smallest item in the tree.
     *
     * @return The smallest item, or null if the tree is empty.
     */
    public T first() {
        return this.minNode == null ? null : this.minNode.item;
    }

    /**
     * Gets the largest item in the tree.
     *
     * @return The largest item, or null if the tree is empty.
     */
    public T last() {
        return this.maxNode == null ? null : this.maxNode.item;
    }

    /**
     * Creates a cursor that points to the smallest item in the tree. If the tree is empty, the result is also an End
     * cursor.
     *
     * @return A new cursor.
     */
    public TreeCursor<T> begin() {
        return new TreeCursor<>(this, this.minNode);
    }

    /**
     * Creates a cursor that points beyond the largest item in the tree.
     *
     * @return A new End cursor.
     */
    public TreeCursor<T> end() {
        return new TreeCursor<>(this, null);
    }

    /**
     * Finds the smallest item that is greater than or equal to the given key.
     *
     * @param key The key to search by.
     * @return A cursor pointing to the sought item, or an End cursor if every item is smaller than the key.
     */
    public TreeCursor<T> findCeiling(T key) {
        return new TreeCursor<>(this, findGreaterOrEqual(key).node);
    }

    /**
     * Finds the largest item that is smaller than or equal to the given key.
     *
     * @param key The key to search by.
     * @return A cursor pointing to the sought item, or an End cursor if every item is larger than the key.
     */
    public TreeCursor<T> findFloor(T key) {
        SearchResult<T> result = findGreaterOrEqual(key);
        if (result.exact) {
            return new TreeCursor<>(this, result.node);
        } else if (result.node != null) {
            return new TreeCursor<>(this, result.node.predecessor());
        } else {
            // The key is larger than every item (or the tree is empty).
            return new TreeCursor<>(this, this.maxNode);
        }
    }

    /**
     * Returns an Iterator over the items, in ascending order. The Iterator is fail-fast: it throws a
     * ConcurrentModificationException if the tree is modified other than through its own remove() method.
     *
     * @return A new Iterator.
     */
    @Override
    public Iterator<T> iterator() {
        return new NodeIterator(this.minNode, false);
    }

    /**
     * Returns an Iterator over the items, in descending order. Same fail-fast semantics as {@link #iterator()}.
     *
     * @return A new Iterator.
     */
    public Iterator<T> descendingIterator() {
        return new NodeIterator(this.maxNode, true);
    }

    //endregion

    //region Mutations

    /**
     * Inserts the given item, unless an item comparing equal to it already exists.
     *
     * @param item The item to insert.
     * @return True if the item was inserted, false if an equal item was already present (the tree is unchanged).
     */
    public boolean insert(T item) {
        Preconditions.checkNotNull(item, "item");
        Node<T> node = attach(item);
        if (node == null) {
            return false;
        }

        this.count++;
        this.modCount++;
        rebalanceAfterInsert(node);
        afterMutation();
        return true;
    }

    /**
     * Deletes the item that compares equal to the given key.
     *
     * @param key The key to search by.
     * @return True if an item was deleted, false if no such item exists.
     */
    public boolean delete(T key) {
        SearchResult<T> result = findGreaterOrEqual(key);
        if (!result.exact) {
            return false;
        }

        deleteNode(result.node);
        afterMutation();
        return true;
    }

    /**
     * Deletes the item the given cursor points to. The cursor (and any other cursor pointing to the same item) may no
     * longer be used after this call; cursors pointing to other items remain valid.
     *
     * @param cursor The cursor to delete at.
     * @throws IllegalArgumentException If the cursor is an End cursor, belongs to a different tree or points to an item
     *                                  that has already been deleted.
     */
    public void delete(TreeCursor<T> cursor) {
        Preconditions.checkNotNull(cursor, "cursor");
        Exceptions.checkArgument(cursor.getTree() == this, "cursor", "Belongs to a different tree.");
        Exceptions.checkArgument(!cursor.isEnd(), "cursor", "Cannot delete at an End cursor.");
        Exceptions.checkArgument(!cursor.getNode().isDetached(), "cursor", "Points to an item that has been deleted.");
        deleteNode(cursor.getNode());
        afterMutation();
    }

    /**
     * Removes all items from the tree. Every existing cursor, except End cursors, becomes invalid and fails if used.
     */
    public void clear() {
        log.trace("Clearing RedBlackTree with {} item(s).", this.count);
        detachAll(this.root);
        this.root = null;
        this.minNode = null;
        this.maxNode = null;
        this.count = 0;
        this.modCount++;
        this.mutationsSinceValidation = 0;
    }

    @Override
    public String toString() {
        return String.format("RedBlackTree[size=%d]", this.count);
    }

    /**
     * Detaches every node of the given subtree, bottom-up, using parent links instead of a stack.
     */
    private void detachAll(Node<T> subtreeRoot) {
        Node<T> n = subtreeRoot;
        while (n != null) {
            if (n.left != null) {
                n = n.left;
            } else if (n.right != null) {
                n = n.right;
            } else {
                // Leaf: unlink it from its parent so the parent eventually becomes a leaf too.
                Node<T> parent = n.parent;
                if (parent != null) {
                    if (parent.left == n) {
                        parent.left = null;
                    } else {
                        parent.right = null;
                    }
                }

                n.detach();
                n = parent;
            }
        }
    }

    //endregion

    //region Package-private accessors

    Node<T> getMinNode() {
        return this.minNode;
    }

    Node<T> getMaxNode() {
        return this.maxNode;
    }

    @VisibleForTesting
    Node<T> getRoot() {
        return this.root;
    }

    /**
     * Verifies every structural invariant of the tree.
     *
     * @return The black-height of the tree.
     * @throws TreeCorruptedException If any invariant does not hold.
     */
    @VisibleForTesting
    int validate() {
        return RedBlackTreeInvariants.check(this.root, this.minNode, this.maxNode, this.count, this.comparator);
    }

    //endregion

    //region Search

    /**
     * Finds the node with the smallest item that is greater than or equal to the given key.
     *
     * @param key The key to search by.
     * @return A SearchResult with the sought node (null if every item is smaller than the key) and whether the node's
     * item compares equal to the key.
     */
    private SearchResult<T> findGreaterOrEqual(T key) {
        Preconditions.checkNotNull(key, "key");
        Node<T> node = this.root;
        while (node != null) {
            int c = this.comparator.compare(key, node.item);
            if (c == 0) {
                return new SearchResult<>(node, true);
            } else if (c < 0) {
                if (node.left == null) {
                    return new SearchResult<>(node, false);
                }

                node = node.left;
            } else {
                if (node.right == null) {
                    Node<T> successor = node.successor();
                    return successor == null
                            ? new SearchResult<>(null, false)
                            : new SearchResult<>(successor, this.comparator.compare(key, successor.item) == 0);
                }

                node = node.right;
            }
        }

        return new SearchResult<>(null, false);
    }

    //endregion

    //region Insertion

    /**
     * Links a new red node holding the given item at the bottom of the tree, keeping the min/max cache current.
     *
     * @return The new node, or null if an equal item already exists.
     */
    private Node<T> attach(T item) {
        if (this.root == null) {
            Node<T> node = new Node<>(item, null);
            this.root = node;
            this.minNode = node;
            this.maxNode = node;
            return node;
        }

        Node<T> parent = this.root;
        while (true) {
            int c = this.comparator.compare(item, parent.item);
            if (c == 0) {
                return null;
            } else if (c < 0) {
                if (parent.left == null) {
                    Node<T> node = new Node<>(item, parent);
                    parent.left = node;
                    if (parent == this.minNode) {
                        // Only the minimum node's left child can hold a new minimum.
                        this.minNode = node;
                    }

                    return node;
                }

                parent = parent.left;
            } else {
                if (parent.right == null) {
                    Node<T> node = new Node<>(item, parent);
                    parent.right = node;
                    if (parent == this.maxNode) {
                        this.maxNode = node;
                    }

                    return node;
                }

                parent = parent.right;
            }
        }
    }

    /**
     * Restores the Red-Black invariants after a red leaf has been attached.
     *
     * @param node The freshly attached node.
     */
    private void rebalanceAfterInsert(Node<T> node) {
        Node<T> n = node;
        while (true) {
            Node<T> parent = n.parent;
            if (parent == null) {
                // N is the root.
                n.color = Color.BLACK;
                return;
            }

            if (parent.color == Color.BLACK) {
                return;
            }

            // A red parent is never the root, so the grandparent exists.
            Node<T> grandparent = parent.parent;
            checkIntegrity(grandparent != null, "Red node %s is the root.", parent.item);
            Node<T> uncle = parent.isLeftChild() ? grandparent.right : grandparent.left;
            if (isRed(uncle)) {
                // Parent and uncle are both red: push the blackness down from the grandparent and continue from there.
                parent.color = Color.BLACK;
                uncle.color = Color.BLACK;
                grandparent.color = Color.RED;
                n = grandparent;
                continue;
            }

            // Black uncle. If N is an inner grandchild, rotate it into the outer position; the old parent takes its role.
            if (n.isRightChild() && parent.isLeftChild()) {
                rotateLeft(parent);
                n = parent;
                continue;
            }

            if (n.isLeftChild() && parent.isRightChild()) {
                rotateRight(parent);
                n = parent;
                continue;
            }

            // Black uncle, outer grandchild.
            parent.color = Color.BLACK;
            grandparent.color = Color.RED;
            if (n.isLeftChild()) {
                rotateRight(grandparent);
            } else {
                rotateLeft(grandparent);
            }

            return;
        }
    }

    //endregion

    //region Deletion

    /**
     * Unlinks the given node from the tree and restores all invariants.
     *
     * @param node The node to remove.
     */
    private void deleteNode(Node<T> node) {
        if (this.minNode == node) {
            this.minNode = null;
        }

        if (this.maxNode == node) {
            this.maxNode = null;
        }

        this.count--;
        this.modCount++;
        if (node.left != null && node.right != null) {
            swapWithPredecessor(node);
        }

        checkIntegrity(node.left == null || node.right == null, "Node %s still has two children.", node.item);
        Node<T> child = node.right != null ? node.right : node.left;
        if (node.color == Color.BLACK) {
            node.color = colorOf(child);
            rebalanceBeforeDelete(node);
        }

        replaceNode(node, child);
        if (node.parent == null && child != null) {
            child.color = Color.BLACK;
        }

        node.detach();
        if (this.count > 0) {
            if (this.minNode == null) {
                this.minNode = this.root.leftmost();
            }

            if (this.maxNode == null) {
                this.maxNode = this.root.rightmost();
            }
        } else {
            checkIntegrity(this.root == null, "Tree is empty but still has a root.");
        }
    }

    /**
     * Exchanges the positions (links and colors) of a node with two children and its in-order predecessor. Afterwards
     * the node sits in the predecessor's old slot, which has no right child, and the predecessor node (with its own
     * item) sits in the node's old slot. Ordering is preserved once the node is removed.
     *
     * @param node The node to move down. Must have two children.
     */
    private void swapWithPredecessor(Node<T> node) {
        Node<T> pred = node.left.rightmost();
        Node<T> predParent = pred.parent;
        Node<T> predLeft = pred.left;
        Color predColor = pred.color;
        checkIntegrity(pred.right == null, "Predecessor %s has a right child.", pred.item);

        replaceNode(node, pred);
        pred.color = node.color;
        pred.right = node.right;
        pred.right.parent = pred;
        if (predParent == node) {
            // The predecessor is the node's left child; the node becomes the predecessor's left child.
            pred.left = node;
            node.parent = pred;
        } else {
            // The predecessor is deeper; it was the right child of its parent, which now adopts the node.
            pred.left = node.left;
            pred.left.parent = pred;
            predParent.right = node;
            node.parent = predParent;
        }

        node.left = predLeft;
        if (predLeft != null) {
            predLeft.parent = node;
        }

        node.right = null;
        node.color = predColor;
    }

    /**
     * Restores the Red-Black invariants around a black node that is about to be unlinked. The node is still part of
     * the tree, so its sibling can be inspected and rotated.
     *
     * @param node The node whose subtree is about to lose one black node.
     */
    private void rebalanceBeforeDelete(Node<T> node) {
        Node<T> n = node;
        while (n.parent != null) {
            Node<T> sibling = n.sibling();
            checkIntegrity(sibling != null, "Black node %s has no sibling.", n.item);
            if (isRed(sibling)) {
                // Red sibling: rotate it above the parent so that N gets a black sibling.
                n.parent.color = Color.RED;
                sibling.color = Color.BLACK;
                if (n.isLeftChild()) {
                    rotateLeft(n.parent);
                } else {
                    rotateRight(n.parent);
                }

                sibling = n.sibling();
            }

            boolean blackNephews = isBlack(sibling.left) && isBlack(sibling.right);
            if (isBlack(n.parent) && isBlack(sibling) && blackNephews) {
                // Everything is black: shorten the sibling's side too and move the deficiency up.
                sibling.color = Color.RED;
                n = n.parent;
                continue;
            }

            if (isRed(n.parent) && isBlack(sibling) && blackNephews) {
                sibling.color = Color.RED;
                n.parent.color = Color.BLACK;
                return;
            }

            rotateRedNephew(n);
            return;
        }
    }

    /**
     * Handles the deletion cases where N's sibling is black and has at least one red child.
     */
    private void rotateRedNephew(Node<T> n) {
        Node<T> sibling = n.sibling();
        if (n.isLeftChild() && isBlack(sibling) && isRed(sibling.left) && isBlack(sibling.right)) {
            // Near nephew red, far nephew black: rotate the red nephew into the far position.
            sibling.color = Color.RED;
            sibling.left.color = Color.BLACK;
            rotateRight(sibling);
        } else if (n.isRightChild() && isBlack(sibling) && isRed(sibling.right) && isBlack(sibling.left)) {
            sibling.color = Color.RED;
            sibling.right.color = Color.BLACK;
            rotateLeft(sibling);
        }

        // Far nephew is red.
        sibling = n.sibling();
        sibling.color = n.parent.color;
        n.parent.color = Color.BLACK;
        if (n.isLeftChild()) {
            checkIntegrity(isRed(sibling.right), "Far nephew of %s is not red.", n.item);
            sibling.right.color = Color.BLACK;
            rotateLeft(n.parent);
        } else {
            checkIntegrity(isRed(sibling.left), "Far nephew of %s is not red.", n.item);
            sibling.left.color = Color.BLACK;
            rotateRight(n.parent);
        }
    }

    //endregion

    //region Rotations

    /**
     * Makes the given node's right child take its place; the node becomes that child's left child.
     * <pre>
     *     X             Y
     *   A   Y   =&gt;    X   C
     *      B C      A B
     * </pre>
     */
    private void rotateLeft(Node<T> x) {
        Node<T> y = x.right;
        x.right = y.left;
        if (y.left != null) {
            y.left.parent = x;
        }

        replaceNode(x, y);
        y.left = x;
        x.parent = y;
    }

    /**
     * Makes the given node's left child take its place; the node becomes that child's right child.
     * <pre>
     *      Y           X
     *    X   C  =&gt;   A   Y
     *   A B             B C
     * </pre>
     */
    private void rotateRight(Node<T> y) {
        Node<T> x = y.left;
        y.left = x.right;
        if (x.right != null) {
            x.right.parent = y;
        }

        replaceNode(y, x);
        x.right = y;
        y.parent = x;
    }

    /**
     * Points whichever link referenced oldNode (its parent's child link, or the root) to newNode.
     */
    private void replaceNode(Node<T> oldNode, Node<T> newNode) {
        if (oldNode.parent == null) {
            this.root = newNode;
        } else if (oldNode.isLeftChild()) {
            oldNode.parent.left = newNode;
        } else {
            oldNode.parent.right = newNode;
        }

        if (newNode != null) {
            newNode.parent = oldNode.parent;
        }
    }

    //endregion

    //region Helpers

    private void afterMutation() {
        if (this.config.isValidationEnabled() && ++this.mutationsSinceValidation >= this.config.getValidationInterval()) {
            this.mutationsSinceValidation = 0;
            validate();
        }
    }

    private void checkIntegrity(boolean condition, String messageFormat, Object... args) {
        if (!condition) {
            String message = String.format(messageFormat, args);
            log.error("RedBlackTree integrity check failed: {}", message);
            throw new TreeCorruptedException(message);
        }
    }

    private static boolean isRed(Node<?> node) {
        return node != null && node.color == Color.RED;
    }

    private static boolean isBlack(Node<?> node) {
        return !isRed(node);
    }

    private static Color colorOf(Node<?> node) {
        return node == null ? Color.BLACK : node.color;
    }

    //endregion

    //region Helper Classes

    enum Color {
        RED,
        BLACK
    }

    /**
     * Tree node. Child links own the subtree; the parent link is a back-reference used for navigation and rebalancing.
     */
    static final class Node<T> {
        T item;
        Color color;
        Node<T> parent;
        Node<T> left;
        Node<T> right;

        Node(T item, Node<T> parent) {
            this.item = item;
            this.parent = parent;
            this.color = Color.RED;
        }

        boolean isLeftChild() {
            return this == this.parent.left;
        }

        boolean isRightChild() {
            return this == this.parent.right;
        }

        Node<T> sibling() {
            return isLeftChild() ? this.parent.right : this.parent.left;
        }

        Node<T> leftmost() {
            Node<T> n = this;
            while (n.left != null) {
                n = n.left;
            }

            return n;
        }

        Node<T> rightmost() {
            Node<T> n = this;
            while (n.right != null) {
                n = n.right;
            }

            return n;
        }

        /**
         * Gets the node with the smallest item larger than this one's, or null if this is the largest.
         */
        Node<T> successor() {
            if (this.right != null) {
                return this.right.leftmost();
            }

            Node<T> n = this;
            while (n.parent != null) {
                if (n.isLeftChild()) {
                    return n.parent;
                }

                n = n.parent;
            }

            return null;
        }

        /**
         * Gets the node with the largest item smaller than this one's, or null if this is the smallest.
         */
        Node<T> predecessor() {
            if (this.left != null) {
                return this.left.rightmost();
            }

            Node<T> n = this;
            while (n.parent != null) {
                if (n.isRightChild()) {
                    return n.parent;
                }

                n = n.parent;
            }

            return null;
        }

        /**
         * Drops all links and the item. Items are never null while a node is in the tree, so a null item marks the
         * node as removed.
         */
        void detach() {
            this.item = null;
            this.parent = null;
            this.left = null;
            this.right = null;
        }

        boolean isDetached() {
            return this.item == null;
        }

        @Override
        public String toString() {
            return String.format("%s (%s), Left = %s, Right = %s", this.item, this.color,
                    this.left == null ? "" : this.left.item, this.right == null ? "" : this.right.item);
        }
    }

    @RequiredArgsConstructor
    private static class SearchResult<T> {
        final Node<T> node;
        final boolean exact;
    }

    /**
     * Iterator that walks the tree using parent links.
     */
    private class NodeIterator implements Iterator<T> {
        private final boolean descending;
        private Node<T> next;
        private Node<T> lastReturned;
        private int expectedModCount;

        NodeIterator(Node<T> first, boolean descending) {
            this.next = first;
            this.descending = descending;
            this.expectedModCount = RedBlackTree.this.modCount;
        }

        @Override
        public boolean hasNext() {
            return this.next != null;
        }

        @Override
        public T next() {
            checkModCount();
            if (this.next == null) {
                throw new NoSuchElementException();
            }

            this.lastReturned = this.next;
            this.next = this.descending ? this.next.predecessor() : this.next.successor();
            return this.lastReturned.item;
        }

        @Override
        public void remove() {
            Preconditions.checkState(this.lastReturned != null, "next() has not been called or remove() was already called.");
            checkModCount();

            // Node identities survive deletion of other nodes, so 'next' is still the correct continuation point.
            delete(new TreeCursor<>(RedBlackTree.this, this.lastReturned));
            this.lastReturned = null;
            this.expectedModCount = RedBlackTree.this.modCount;
        }

        private void checkModCount() {
            if (this.expectedModCount != RedBlackTree.this.modCount) {
                throw new ConcurrentModificationException("RedBlackTree has been modified; iteration cannot continue.");
            }
        }
    }

    //endregion
}
