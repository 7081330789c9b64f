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
package com.hellblazer.arbor.rank;

/**
 * Node of an order statistics tree. Children are owned exclusively by the node, there are no parent links.
 *
 * Thread Safety: This class is NOT thread-safe.
 *
 * @param <K> the key type
 * @param <I> the item type
 * @author hal.hildebrand
 */
public final class RankNode<K, I> {
    K              key;
    I              item;
    RankNode<K, I> left;
    RankNode<K, I> right;
    int            subtreeSize = 1;

    RankNode(K key, I item) {
        this.key = key;
        this.item = item;
    }

    static int sizeOf(RankNode<?, ?> node) {
        return node == null ? 0 : node.subtreeSize;
    }

    public I getItem() {
        return item;
    }

    public K getKey() {
        return key;
    }

    public RankNode<K, I> getLeft() {
        return left;
    }

    public RankNode<K, I> getRight() {
        return right;
    }

    /**
     * @return the number of nodes in the subtree rooted here, including this node
     */
    public int getSubtreeSize() {
        return subtreeSize;
    }

    public boolean isLeaf() {
        return left == null && right == null;
    }

    @Override
    public String toString() {
        return "RankNode[" + key + " -> " + item + ", size=" + subtreeSize + "]";
    }
}
