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
package com.hellblazer.arbor.spatial;

import com.hellblazer.arbor.KeyedIndex;
import com.hellblazer.arbor.PointNotFoundException;
import com.hellblazer.arbor.geometry.Point3i;
import com.hellblazer.arbor.visitor.TreeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Tuple3f;
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
import java.util.Optional;

/**
 * Unbalanced point region tree over integer 3D points. Every node splits space into the eight octants around
 * its own point and holds at most one child per octant; no splitting plane is stored, membership is always
 * tested against the ancestor's coordinates.
 * <p>
 * The tree never restructures itself. Its height depends only on the insertion order, see
 * {@link com.hellblazer.arbor.balancing.BalancedOrderBuilder} for an order that keeps it shallow.
 * <p>
 * Thread Safety: This class is NOT thread-safe.
 *
 * @param <I> the item type
 * @author hal.hildebrand
 */
public class PointTree<I> implements KeyedIndex<Point3i, I> {
    private static final Logger log = LoggerFactory.getLogger(PointTree.class);

    private PointNode<I> root;
    private int          length;
    private int          modCount;

    @Override
    public void accept(TreeVisitor<Point3i, I> visitor) {
        visitor.beginTraversal(length);
        int visited = root == null ? 0 : visit(root, visitor, 0);
        visitor.endTraversal(visited);
    }

    @Override
    public boolean contains(Point3i point) {
        return findNode(point) != null;
    }

    /**
     * A lazy pre-order sequence of the point/item pairs, each node before its children and children in octant
     * order. Each call to {@link Iterable#iterator()} starts a fresh traversal.
     */
    public Iterable<Map.Entry<Point3i, I>> entries() {
        return PreOrderIterator::new;
    }

    /**
     * @return the root node, or null when empty
     */
    public PointNode<I> getRoot() {
        return root;
    }

    @Override
    public int height() {
        if (root == null) {
            return 0;
        }
        Deque<PointNode<I>> level = new ArrayDeque<>();
        level.add(root);
        int height = 0;
        while (!level.isEmpty()) {
            height++;
            for (int i = level.size(); i > 0; i--) {
                for (var child : level.poll().children) {
                    if (child != null) {
                        level.add(child);
                    }
                }
            }
        }
        return height;
    }

    /**
     * Insert the item at the point. A present point has its item replaced in place; otherwise the point is
     * attached as a new leaf in the first empty octant along its descent and every node on the path grows by
     * one.
     */
    @Override
    public void insert(Point3i point, I item) {
        Objects.requireNonNull(point, "point cannot be null");
        var existing = findNode(point);
        if (existing != null) {
            existing.item = item;
            return;
        }
        var leaf = new PointNode<>(point, item);
        if (root == null) {
            root = leaf;
        } else {
            var current = root;
            for (;;) {
                current.subtreeSize++;
                int octant = current.octantOf(point);
                var child = current.children[octant];
                if (child == null) {
                    current.children[octant] = leaf;
                    break;
                }
                current = child;
            }
        }
        length++;
        modCount++;
    }

    public boolean isLeaf(PointNode<I> node) {
        return node.isLeaf();
    }

    /**
     * @throws PointNotFoundException if the point is absent
     */
    @Override
    public I lookup(Point3i point) {
        var node = findNode(point);
        if (node == null) {
            throw new PointNotFoundException(point);
        }
        return node.item;
    }

    /**
     * The stored point closest to the target by Euclidean distance. Octants whose region cannot hold a point
     * nearer than the best found so far are skipped.
     *
     * @param target the query position
     * @return the nearest node, empty when the tree is empty
     */
    public Optional<PointNode<I>> nearest(Tuple3f target) {
        Objects.requireNonNull(target, "target cannot be null");
        if (root == null) {
            return Optional.empty();
        }
        var search = new NearestSearch<I>(target);
        search.nearest(root);
        log.trace("Nearest to {} is {} after visiting {} of {} nodes", target, search.best, search.visited, length);
        return Optional.of(search.best);
    }

    @Override
    public int size() {
        return length;
    }

    @Override
    public String toString() {
        return "PointTree[size=" + length + "]";
    }

    /**
     * The nodes whose points lie in the box [min, max), min inclusive and max exclusive, in pre-order.
     */
    public List<PointNode<I>> within(Point3i min, Point3i max) {
        Objects.requireNonNull(min, "min cannot be null");
        Objects.requireNonNull(max, "max cannot be null");
        var result = new ArrayList<PointNode<I>>();
        if (root != null) {
            collect(root, min, max, result);
        }
        return result;
    }

    private void collect(PointNode<I> node, Point3i min, Point3i max, List<PointNode<I>> result) {
        if (node.key.isWithinBounds(min, max)) {
            result.add(node);
        }
        for (int octant = 0; octant < Octant.COUNT; octant++) {
            var child = node.children[octant];
            if (child != null && Octant.intersects(octant, node.key, min, max)) {
                collect(child, min, max, result);
            }
        }
    }

    private PointNode<I> findNode(Point3i point) {
        Objects.requireNonNull(point, "point cannot be null");
        var current = root;
        while (current != null) {
            if (current.key.equals(point)) {
                return current;
            }
            current = current.childFor(point);
        }
        return null;
    }

    private int visit(PointNode<I> node, TreeVisitor<Point3i, I> visitor, int level) {
        if (!visitor.visitNode(node.key, node.item, level, node.subtreeSize)) {
            return 1;
        }
        int visited = 1;
        int children = 0;
        if (visitor.getMaxDepth() < 0 || level < visitor.getMaxDepth()) {
            for (var child : node.children) {
                if (child != null) {
                    visited += visit(child, visitor, level + 1);
                    children++;
                }
            }
        }
        visitor.leaveNode(node.key, level, children);
        return visited;
    }

    private static class NearestSearch<I> {
        private final Tuple3f      target;
        private       PointNode<I> best;
        private       double       bestDistance;
        private       int          visited;

        private NearestSearch(Tuple3f target) {
            this.target = target;
        }

        private void nearest(PointNode<I> node) {
            ++visited;
            double d = node.key.distanceSquared(target);
            if (best == null || d < bestDistance) {
                bestDistance = d;
                best = node;
            }
            if (bestDistance == 0) {
                return;
            }
            int home = Octant.of(node.key, target);
            if (node.children[home] != null) {
                nearest(node.children[home]);
            }
            for (int octant = 0; octant < Octant.COUNT; octant++) {
                var child = node.children[octant];
                if (octant == home || child == null) {
                    continue;
                }
                if (Octant.minDistanceSquared(octant, node.key, target) < bestDistance) {
                    nearest(child);
                }
            }
        }
    }

    private class PreOrderIterator implements Iterator<Map.Entry<Point3i, I>> {
        private final Deque<PointNode<I>> stack            = new ArrayDeque<>();
        private final int                 expectedModCount = modCount;

        PreOrderIterator() {
            if (root != null) {
                stack.push(root);
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public Map.Entry<Point3i, I> next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            var node = stack.pop();
            for (int octant = Octant.COUNT - 1; octant >= 0; octant--) {
                if (node.children[octant] != null) {
                    stack.push(node.children[octant]);
                }
            }
            return new AbstractMap.SimpleImmutableEntry<>(node.key, node.item);
        }
    }
}
