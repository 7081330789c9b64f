/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Arbor.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.arbor.visitor;

/**
 * Visitor interface for depth aware traversal of the keyed trees. Nodes are visited in pre-order, a parent
 * before its children.
 *
 * @param <K> The key type of the visited tree
 * @param <I> The item type of the visited tree
 * @author hal.hildebrand
 */
public interface TreeVisitor<K, I> {

    /**
     * Called before traversal begins.
     *
     * @param totalNodes Total number of nodes in the tree
     */
    default void beginTraversal(int totalNodes) {
        // Default: do nothing
    }

    /**
     * Called after traversal completes.
     *
     * @param nodesVisited Number of nodes actually visited
     */
    default void endTraversal(int nodesVisited) {
        // Default: do nothing
    }

    /**
     * Controls the maximum depth to traverse.
     *
     * @return maximum depth to traverse (-1 for unlimited)
     */
    default int getMaxDepth() {
        return -1;
    }

    /**
     * Called when leaving a node after all children have been visited. Only called if visitNode returned
     * true.
     *
     * @param key        The key of the node being left
     * @param level      The depth level of this node
     * @param childCount Number of child nodes that were visited
     */
    default void leaveNode(K key, int level, int childCount) {
        // Default: do nothing
    }

    /**
     * Called when entering a node during traversal.
     *
     * @param key         The node's key
     * @param item        The node's item
     * @param level       The depth level of this node (0 = root)
     * @param subtreeSize The number of nodes in the subtree rooted here, including the node
     * @return true to continue traversing children, false to skip children
     */
    boolean visitNode(K key, I item, int level, int subtreeSize);
}
