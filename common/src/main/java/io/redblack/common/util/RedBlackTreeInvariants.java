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

import java.util.Comparator;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies the structural invariants of a Red-Black Tree:
 * <ul>
 * <li> Items are in strictly increasing order (in-order) under the tree's Comparator.
 * <li> The root is black and has no parent.
 * <li> No red node has a red child.
 * <li> Every path from a node to a missing child has the same number of black nodes.
 * <li> Every child links back to its parent.
 * <li> The cached min/max nodes are the leftmost/rightmost nodes, and the cached count is the number of nodes.
 * </ul>
 * Each check is O(n); this is meant for tests and for debugging via {@link RedBlackTreeConfig#VALIDATION_ENABLED}.
 */
@Slf4j
final class RedBlackTreeInvariants {
    private RedBlackTreeInvariants() {
    }

    /**
     * Checks all invariants.
     *
     * @return The black-height of the tree (0 for an empty tree).
     * @throws TreeCorruptedException If an invariant does not hold.
     */
    static <T> int check(RedBlackTree.Node<T> root, RedBlackTree.Node<T> minNode, RedBlackTree.Node<T> maxNode, int count,
                         Comparator<? super T> comparator) {
        if (root == null) {
            verify(count == 0, "Empty tree has count %s.", count);
            verify(minNode == null && maxNode == null, "Empty tree has cached min/max nodes.");
            return 0;
        }

        verify(root.parent == null, "Root %s has a parent.", root.item);
        verify(root.color == RedBlackTree.Color.BLACK, "Root %s is red.", root.item);
        verify(minNode == root.leftmost(), "Cached min node %s is not the leftmost node.", minNode);
        verify(maxNode == root.rightmost(), "Cached max node %s is not the rightmost node.", maxNode);

        Walk<T> walk = new Walk<>(comparator);
        int blackHeight = walk.visit(root);
        verify(walk.nodeCount == count, "Tree has %s nodes but count is %s.", walk.nodeCount, count);
        return blackHeight;
    }

    private static void verify(boolean condition, String messageFormat, Object... args) {
        if (!condition) {
            String message = String.format(messageFormat, args);
            log.error("RedBlackTree invariant violated: {}", message);
            throw new TreeCorruptedException(message);
        }
    }

    /**
     * In-order walk that tracks the previously visited item (for ordering) and the number of nodes seen.
     */
    private static class Walk<T> {
        private final Comparator<? super T> comparator;
        private RedBlackTree.Node<T> previous;
        private int nodeCount;

        Walk(Comparator<? super T> comparator) {
            this.comparator = comparator;
        }

        /**
         * Visits the subtree rooted at the given node.
         *
         * @return The black-height of the subtree, counting the null children as black.
         */
        int visit(RedBlackTree.Node<T> node) {
            if (node == null) {
                return 1;
            }

            verify(node.item != null, "Node with null item found.");
            verify(node.color != null, "Node %s has no color.", node.item);
            if (node.left != null) {
                verify(node.left.parent == node, "Left child of %s does not link back to it.", node.item);
            }

            int leftHeight = visit(node.left);
            if (this.previous != null) {
                verify(this.comparator.compare(this.previous.item, node.item) < 0,
                        "Items out of order: %s is not smaller than %s.", this.previous.item, node.item);
            }

            this.previous = node;
            this.nodeCount++;

            if (node.right != null) {
                verify(node.right.parent == node, "Right child of %s does not link back to it.", node.item);
            }

            int rightHeight = visit(node.right);
            if (node.color == RedBlackTree.Color.RED) {
                verify(node.left == null || node.left.color == RedBlackTree.Color.BLACK, "Red node %s has a red left child.", node.item);
                verify(node.right == null || node.right.color == RedBlackTree.Color.BLACK, "Red node %s has a red right child.", node.item);
            }

            verify(leftHeight == rightHeight, "Node %s has black-heights %s (left) and %s (right).", node.item, leftHeight, rightHeight);
            return leftHeight + (node.color == RedBlackTree.Color.BLACK ? 1 : 0);
        }
    }
}
