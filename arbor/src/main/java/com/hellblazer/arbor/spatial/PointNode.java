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

import com.hellblazer.arbor.geometry.Point3i;

/**
 * Node of a point tree. Up to eight children, one per octant of this node's point, each owned exclusively by
 * this node.
 *
 * Thread Safety: This class is NOT thread-safe.
 *
 * @param <I> the item type
 * @author hal.hildebrand
 */
public final class PointNode<I> {
    final Point3i        key;
    final PointNode<I>[] children;
    I                    item;
    int                  subtreeSize = 1;

    @SuppressWarnings("unchecked")
    PointNode(Point3i key, I item) {
        this.key = key;
        this.item = item;
        this.children = (PointNode<I>[]) new PointNode[Octant.COUNT];
    }

    /**
     * @return the number of occupied octants
     */
    public int childCount() {
        int count = 0;
        for (var child : children) {
            if (child != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * The child occupying the octant the point falls in.
     *
     * @return the child, or null if that octant is empty
     */
    public PointNode<I> childFor(Point3i point) {
        return children[octantOf(point)];
    }

    /**
     * @param octant the octant index (0-7)
     * @return the child in that octant, or null
     */
    public PointNode<I> getChild(int octant) {
        return children[octant];
    }

    public I getItem() {
        return item;
    }

    public Point3i getKey() {
        return key;
    }

    public int getSubtreeSize() {
        return subtreeSize;
    }

    /**
     * Check if a specific octant has a child
     *
     * @param octant the octant index (0-7)
     */
    public boolean hasChild(int octant) {
        return children[octant] != null;
    }

    public boolean isLeaf() {
        for (var child : children) {
            if (child != null) {
                return false;
            }
        }
        return true;
    }

    public int octantOf(Point3i point) {
        return Octant.of(key, point);
    }

    @Override
    public String toString() {
        return "PointNode[" + key + " -> " + item + ", size=" + subtreeSize + "]";
    }
}
