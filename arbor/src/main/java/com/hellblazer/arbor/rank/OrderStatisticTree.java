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

import com.hellblazer.arbor.InvalidRankException;
import com.hellblazer.arbor.KeyNotFoundException;
import com.hellblazer.arbor.KeyedIndex;
import com.hellblazer.arbor.visitor.TreeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Binary search tree augmented with the subtree size of every node, answering rank queries (the k-th smallest
 * key) in addition to lookup, insertion and deletion.
 * <p>
 * Insertion is an upsert: inserting a present key replaces its item and leaves the structure untouched. The
 * tree performs no rebalancing, every operation is O(h) in the height of the tree, so the shape is entirely a
 * product of the insertion order.
 * <p>
 * Every mutating operation locates its target before changing anything, so a failing call leaves the tree as
 * it was.
 * <p>
 * Thread Safety: This class is NOT thread-safe.
 *
 * @param <K> the key type
 * @param <I> the item type
 * @author hal.hildebrand
 */
public class OrderStatisticTree<K extends Comparable<? super K>, I> implements KeyedIndex<K, I> {
    private static final Logger log = LoggerFactory.getLogger(OrderStatisticTree.class);

    private RankNode<K, I> root;
    private int            length;
    private int            modCount;

    @Override
    public void accept(TreeVisitor<K, I> visitor) {
        visitor.beginTraversal(length);
        int visited = root == null ? 0 : visit(root, visitor, 0);
        visitor.endTraversal(visited);
    }

    @Override
    public boolean contains(K key) {
        return findNode(key) != null;
    }

    /**
     * Remove the key and its item. A node with two children takes the key and item of its in-order successor,
     * whose original node is then spliced out of the right subtree.
     *
     * @param key the key to remove
     * @throws KeyNotFoundException if the key is absent
     */
    public void delete(K key) {
        if (findNode(key) == null) {
            throw new KeyNotFoundException(key);
        }
        RankNode<K, I> parent = null;
        RankNode<K, I> current = root;
        int c;
        while ((c = key.compareTo(current.key)) != 0) {
            current.subtreeSize--;
            parent = current;
            current = c < 0 ? current.left : current.right;
        }
        current.subtreeSize--;

        if (current.left != null && current.right != null) {
            RankNode<K, I> successorParent = current;
            RankNode<K, I> successor = current.right;
            while (successor.left != null) {
                successor.subtreeSize--;
                successorParent = successor;
                successor = successor.left;
            }
            current.key = successor.key;
            current.item = successor.item;
            if (successorParent == current) {
                successorParent.right = successor.right;
            } else {
                successorParent.left = successor.right;
            }
        } else {
            replaceChild(parent, current, current.left != null ? current.left : current.right);
        }
        length--;
        modCount++;
        log.trace("Deleted {}, {} keys remain", key, length);
    }

    /**
     * A lazy in-order sequence of the key/item pairs, ascending by key. Each call to {@link Iterable#iterator()}
     * starts a fresh traversal; iterators fail fast if the tree is modified while they are in use.
     */
    public Iterable<Map.Entry<K, I>> entries() {
        return InOrderIterator::new;
    }

    /**
     * @return the root node, or null when empty
     */
    public RankNode<K, I> getRoot() {
        return root;
    }

    @Override
    public int height() {
        if (root == null) {
            return 0;
        }
        Deque<RankNode<K, I>> level = new ArrayDeque<>();
        level.add(root);
        int height = 0;
        while (!level.isEmpty()) {
            height++;
            for (int i = level.size(); i > 0; i--) {
                var node = level.poll();
                if (node.left != null) {
                    level.add(node.left);
                }
                if (node.right != null) {
                    level.add(node.right);
                }
            }
        }
        return height;
    }

    @Override
    public void insert(K key, I item) {
        Objects.requireNonNull(key, "key cannot be null");
        var existing = findNode(key);
        if (existing != null) {
            existing.item = item;
            return;
        }
        var leaf = new RankNode<>(key, item);
        if (root == null) {
            root = leaf;
        } else {
            RankNode<K, I> current = root;
            for (;;) {
                current.subtreeSize++;
                if (key.compareTo(current.key) < 0) {
                    if (current.left == null) {
                        current.left = leaf;
                        break;
                    }
                    current = current.left;
                } else {
                    if (current.right == null) {
                        current.right = leaf;
                        break;
                    }
                    current = current.right;
                }
            }
        }
        length++;
        modCount++;
    }

    /**
     * Answer the node of rank k, the k-th smallest key, 1-indexed.
     *
     * @param k the rank
     * @return the node holding the k-th smallest key
     * @throws InvalidRankException if k is outside [1, size]
     */
    public RankNode<K, I> kthSmallest(int k) {
        if (k < 1 || k > length) {
            throw new InvalidRankException(k, length);
        }
        RankNode<K, I> current = root;
        while (current != null) {
            int leftSize = RankNode.sizeOf(current.left);
            if (k == leftSize + 1) {
                return current;
            } else if (k <= leftSize) {
                current = current.left;
            } else {
                k -= leftSize + 1;
                current = current.right;
            }
        }
        throw new IllegalStateException("Subtree sizes inconsistent with length " + length);
    }

    @Override
    public I lookup(K key) {
        var node = findNode(key);
        if (node == null) {
            throw new KeyNotFoundException(key);
        }
        return node.item;
    }

    /**
     * The items whose keys fall in [low, high], ascending by key. A single in-order traversal that only enters
     * subtrees able to hold keys in the range, O(h + result size).
     *
     * @param low  the inclusive lower key
     * @param high the inclusive upper key
     * @return the matching items, empty if low is greater than high
     */
    public List<I> range(K low, K high) {
        Objects.requireNonNull(low, "low cannot be null");
        Objects.requireNonNull(high, "high cannot be null");
        var result = new ArrayList<I>();
        if (low.compareTo(high) <= 0) {
            collect(root, low, high, result);
        }
        return result;
    }

    /**
     * The rank of a key, the inverse of {@link #kthSmallest(int)}.
     *
     * @param key the key
     * @return the 1-indexed rank of the key
     * @throws KeyNotFoundException if the key is absent
     */
    public int rank(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        int rank = 0;
        RankNode<K, I> current = root;
        while (current != null) {
            int c = key.compareTo(current.key);
            if (c < 0) {
                current = current.left;
            } else if (c > 0) {
                rank += RankNode.sizeOf(current.left) + 1;
                current = current.right;
            } else {
                return rank + RankNode.sizeOf(current.left) + 1;
            }
        }
        throw new KeyNotFoundException(key);
    }

    @Override
    public int size() {
        return length;
    }

    @Override
    public String toString() {
        return "OrderStatisticTree[size=" + length + "]";
    }

    private void collect(RankNode<K, I> node, K low, K high, List<I> result) {
        if (node == null) {
            return;
        }
        if (low.compareTo(node.key) < 0) {
            collect(node.left, low, high, result);
        }
        if (low.compareTo(node.key) <= 0 && high.compareTo(node.key) >= 0) {
            result.add(node.item);
        }
        if (high.compareTo(node.key) > 0) {
            collect(node.right, low, high, result);
        }
    }

    private RankNode<K, I> findNode(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        RankNode<K, I> current = root;
        while (current != null) {
            int c = key.compareTo(current.key);
            if (c == 0) {
                return current;
            }
            current = c < 0 ? current.left : current.right;
        }
        return null;
    }

    private void replaceChild(RankNode<K, I> parent, RankNode<K, I> child, RankNode<K, I> replacement) {
        if (parent == null) {
            root = replacement;
        } else if (parent.left == child) {
            parent.left = replacement;
        } else {
            parent.right = replacement;
        }
    }

    private int visit(RankNode<K, I> node, TreeVisitor<K, I> visitor, int level) {
        if (!visitor.visitNode(node.key, node.item, level, node.subtreeSize)) {
            return 1;
        }
        int visited = 1;
        int children = 0;
        if (visitor.getMaxDepth() < 0 || level < visitor.getMaxDepth()) {
            if (node.left != null) {
                visited += visit(node.left, visitor, level + 1);
                children++;
            }
            if (node.right != null) {
                visited += visit(node.right, visitor, level + 1);
                children++;
            }
        }
        visitor.leaveNode(node.key, level, children);
        return visited;
    }

    private class InOrderIterator implements Iterator<Map.Entry<K, I>> {
        private final Deque<RankNode<K, I>> stack            = new ArrayDeque<>();
        private final int                   expectedModCount = modCount;

        InOrderIterator() {
            pushLeft(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public Map.Entry<K, I> next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            var node = stack.pop();
            pushLeft(node.right);
            return new AbstractMap.SimpleImmutableEntry<>(node.key, node.item);
        }

        private void pushLeft(RankNode<K, I> node) {
            while (node != null) {
                stack.push(node);
                node = node.left;
            }
        }
    }
}
