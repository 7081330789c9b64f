/*
 * Copyright (c) 2026 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.arbor.geometry;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.Objects;

/**
 * Immutable 3D point with integer coordinates. Used as the key of the octant point tree and as the unit of
 * the balanced insertion order.
 *
 * @author hal.hildebrand
 */
public final class Point3i {

    /** X coordinate */
    public final int x;

    /** Y coordinate */
    public final int y;

    /** Z coordinate */
    public final int z;

    /**
     * Create a new 3D integer point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     * @param z Z coordinate
     */
    public Point3i(int x, int y, int z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Create point from array [x, y, z].
     *
     * @param array Array with at least 3 elements
     * @return Point from array
     * @throws IllegalArgumentException if array length < 3
     */
    public static Point3i fromArray(int[] array) {
        if (array.length < 3) {
            throw new IllegalArgumentException("Array must have at least 3 elements");
        }
        return new Point3i(array[0], array[1], array[2]);
    }

    /**
     * Squared Euclidean distance to a floating point position. Avoids sqrt().
     *
     * @param target the position
     * @return squared distance
     */
    public double distanceSquared(Tuple3f target) {
        double dx = x - (double) target.x;
        double dy = y - (double) target.y;
        double dz = z - (double) target.z;
        return dx * dx + dy * dy + dz * dz;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point3i other)) return false;
        return x == other.x && y == other.y && z == other.z;
    }

    /**
     * The coordinate on an axis.
     *
     * @param axis the axis
     * @return x, y or z
     */
    public int get(Axis axis) {
        return switch (axis) {
            case X -> x;
            case Y -> y;
            case Z -> z;
        };
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z);
    }

    /**
     * Check if this point is within a cubic bounds.
     *
     * @param min Minimum corner (inclusive)
     * @param max Maximum corner (exclusive)
     * @return True if point is within bounds
     */
    public boolean isWithinBounds(Point3i min, Point3i max) {
        return x >= min.x && x < max.x &&
               y >= min.y && y < max.y &&
               z >= min.z && z < max.z;
    }

    public Point3f toPoint3f() {
        return new Point3f(x, y, z);
    }

    @Override
    public String toString() {
        return String.format("Point3i(%d, %d, %d)", x, y, z);
    }
}
