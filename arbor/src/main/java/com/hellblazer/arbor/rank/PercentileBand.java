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
 * The closed, 1-indexed rank interval selected by a [x%, y%] percentile request over n items.
 * <p>
 * The bounds are {@code lowRank = floor(x * n / 100) + 1} and {@code highRank = ceil(y * n / 100)}, each clamped
 * to [1, n]. Away from the clamped ends a rank r is selected exactly when {@code 100 * r / n > x} and
 * {@code 100 * (r - 1) / n < y}, that is when the percentile slice the item occupies overlaps the request.
 * {@code x = 0} always selects the smallest item and {@code y = 100} the largest; a band with equal bounds
 * selects at most one item.
 *
 * @param lowRank  first selected rank
 * @param highRank last selected rank, less than lowRank when the band is empty
 * @author hal.hildebrand
 */
public record PercentileBand(int lowRank, int highRank) {

    public static final PercentileBand EMPTY = new PercentileBand(1, 0);

    /**
     * Compute the band for a request.
     *
     * @param x    lower percentage in [0, 100]
     * @param y    upper percentage in [x, 100]
     * @param size number of stored items
     * @return the rank band, {@link #EMPTY} when size is 0
     * @throws IllegalArgumentException if the percentages are out of range or reversed
     */
    public static PercentileBand of(double x, double y, int size) {
        if (!(x >= 0.0 && x <= 100.0)) {
            throw new IllegalArgumentException("x must be between 0 and 100: " + x);
        }
        if (!(y >= 0.0 && y <= 100.0)) {
            throw new IllegalArgumentException("y must be between 0 and 100: " + y);
        }
        if (x > y) {
            throw new IllegalArgumentException("x must not exceed y: " + x + " > " + y);
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        if (size == 0) {
            return EMPTY;
        }
        int low = clamp((long) Math.floor(x * size / 100.0) + 1, size);
        int high = clamp((long) Math.ceil(y * size / 100.0), size);
        return new PercentileBand(low, high);
    }

    private static int clamp(long rank, int size) {
        return (int) Math.max(1, Math.min(size, rank));
    }

    public boolean isEmpty() {
        return lowRank > highRank;
    }

    /**
     * @return the number of ranks in the band
     */
    public int size() {
        return isEmpty() ? 0 : highRank - lowRank + 1;
    }
}
