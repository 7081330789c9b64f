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

import javax.vecmath.Tuple3f;

/**
 * Octant indexing relative to a reference point. The index is a 3 bit code: bit 2 is set when x >= ref.x,
 * bit 1 when y >= ref.y and bit 0 when z >= ref.z.
 *
 * @author hal.hildebrand
 */
public final class Octant {
    public static final int COUNT  = 8;
    public static final int X_HIGH = 4;
    public static final int Y_HIGH = 2;
    public static final int Z_HIGH = 1;

    private Octant() {
    }

    /**
     * Does the octant of the reference hold any point of the box [min, max)?
     */
    public static boolean intersects(int octant, Point3i reference, Point3i min, Point3i max) {
        return axisIntersects(octant & X_HIGH, reference.x, min.x, max.x)
        && axisIntersects(octant & Y_HIGH, reference.y, min.y, max.y)
        && axisIntersects(octant & Z_HIGH, reference.z, min.z, max.z);
    }

    /**
     * A lower bound on the squared distance from the target to any integer point in the octant of the
     * reference.
     */
    public static double minDistanceSquared(int octant, Point3i reference, Tuple3f target) {
        double dx = axisGap(octant & X_HIGH, reference.x, target.x);
        double dy = axisGap(octant & Y_HIGH, reference.y, target.y);
        double dz = axisGap(octant & Z_HIGH, reference.z, target.z);
        return dx * dx + dy * dy + dz * dz;
    }

    /**
     * The octant of the reference that the point falls in.
     *
     * @return the octant index in [0, 7]
     */
    public static int of(Point3i reference, Point3i point) {
        int idx = 0;
        if (point.x >= reference.x) idx |= X_HIGH;
        if (point.y >= reference.y) idx |= Y_HIGH;
        if (point.z >= reference.z) idx |= Z_HIGH;
        return idx;
    }

    /**
     * The octant of the reference whose region is closest to a floating point position.
     */
    public static int of(Point3i reference, Tuple3f target) {
        int idx = 0;
        if (target.x >= reference.x) idx |= X_HIGH;
        if (target.y >= reference.y) idx |= Y_HIGH;
        if (target.z >= reference.z) idx |= Z_HIGH;
        return idx;
    }

    private static double axisGap(int high, int reference, float target) {
        if (high != 0) {
            return target < reference ? reference - (double) target : 0.0;
        }
        // low side holds coordinates <= reference - 1
        double top = reference - 1.0;
        return target > top ? target - top : 0.0;
    }

    private static boolean axisIntersects(int high, int reference, int min, int max) {
        return high != 0 ? max > reference : min < reference;
    }
}
