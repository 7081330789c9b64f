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
package com.hellblazer.arbor.balancing;

import com.hellblazer.arbor.geometry.Axis;

import java.util.Objects;

/**
 * Configuration of a {@link BalancedOrderBuilder}.
 *
 * <p>Immutable; the {@code with} methods answer modified copies.
 *
 * @author hal.hildebrand
 */
public final class BuildOrderConfig {

    /** Default axis of the first partition */
    public static final Axis DEFAULT_START_AXIS = Axis.X;

    /** Default pivot source seed, fixed so equal inputs give equal orders */
    public static final long DEFAULT_SEED = 0x5EEDL;

    private final Axis startAxis;
    private final long seed;

    /**
     * @param startAxis the axis the first partition splits on, later depths cycle x, y, z from it
     * @param seed      seed of the selection pivot source
     */
    public BuildOrderConfig(Axis startAxis, long seed) {
        this.startAxis = Objects.requireNonNull(startAxis, "startAxis cannot be null");
        this.seed = seed;
    }

    public static BuildOrderConfig defaultConfig() {
        return new BuildOrderConfig(DEFAULT_START_AXIS, DEFAULT_SEED);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BuildOrderConfig that)) return false;
        return seed == that.seed && startAxis == that.startAxis;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startAxis, seed);
    }

    public long seed() {
        return seed;
    }

    public Axis startAxis() {
        return startAxis;
    }

    @Override
    public String toString() {
        return "BuildOrderConfig{startAxis=" + startAxis + ", seed=" + seed + "}";
    }

    public BuildOrderConfig withSeed(long seed) {
        return new BuildOrderConfig(startAxis, seed);
    }

    public BuildOrderConfig withStartAxis(Axis startAxis) {
        return new BuildOrderConfig(startAxis, seed);
    }
}
