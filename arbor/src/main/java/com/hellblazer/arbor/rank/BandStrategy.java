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
 * How a {@link PercentileStore} gathers the items of a percentile band. Both strategies produce the same
 * ascending sequence.
 *
 * @author hal.hildebrand
 */
public enum BandStrategy {
    /** One rank lookup per rank in the band, O(band size * h) */
    RANK_WALK,
    /** Rank lookups for the two boundary keys, then one pruned in-order traversal, O(band size + h) */
    TRAVERSAL
}
