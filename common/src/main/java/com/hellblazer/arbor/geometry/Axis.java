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

import java.util.Comparator;

/**
 * The three coordinate axes of integer space, in x, y, z order.
 *
 * @author hal.hildebrand
 */
public enum Axis {
    X, Y, Z;

    private static final Axis[] VALUES = values();

    /**
     * The axis used at the given recursion depth when cycling from this axis.
     *
     * @param depth recursion depth, 0 is this axis
     * @return this axis advanced by depth mod 3
     */
    public Axis atDepth(int depth) {
        return VALUES[Math.floorMod(ordinal() + depth, VALUES.length)];
    }

    /**
     * @return a comparator ordering points by their coordinate on this axis
     */
    public Comparator<Point3i> comparator() {
        return (a, b) -> Integer.compare(a.get(this), b.get(this));
    }

    public Axis next() {
        return atDepth(1);
    }
}
