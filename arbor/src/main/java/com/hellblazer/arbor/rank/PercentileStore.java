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

import com.hellblazer.arbor.KeyNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered set of values answering percentile band queries. Each value is both key and item of a single
 * {@link OrderStatisticTree}, so adding a value already present changes nothing.
 * <p>
 * Thread Safety: This class is NOT thread-safe.
 *
 * @param <T> the value type
 * @author hal.hildebrand
 */
public class PercentileStore<T extends Comparable<? super T>> {
    private static final Logger log = LoggerFactory.getLogger(PercentileStore.class);

    private final OrderStatisticTree<T, T> items = new OrderStatisticTree<>();
    private final BandStrategy             strategy;

    public PercentileStore() {
        this(BandStrategy.TRAVERSAL);
    }

    public PercentileStore(BandStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy cannot be null");
    }

    public void addPoint(T item) {
        items.insert(item, item);
    }

    /**
     * The rank band a {@link #ratio(double, double)} request selects at the current size.
     */
    public PercentileBand band(double x, double y) {
        return PercentileBand.of(x, y, items.size());
    }

    public boolean contains(T item) {
        return items.contains(item);
    }

    public BandStrategy getStrategy() {
        return strategy;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * The value at a percentile by the nearest rank method: rank {@code ceil(p * n / 100)}, at least 1.
     *
     * @param p percentage in [0, 100]
     * @return the value, empty when the store is empty
     */
    public Optional<T> percentile(double p) {
        if (!(p >= 0.0 && p <= 100.0)) {
            throw new IllegalArgumentException("p must be between 0 and 100: " + p);
        }
        int n = items.size();
        if (n == 0) {
            return Optional.empty();
        }
        int rank = (int) Math.max(1, Math.min(n, (long) Math.ceil(p * n / 100.0)));
        return Optional.of(items.kthSmallest(rank).getItem());
    }

    /**
     * The values whose ranks lie in the percentile band [x, y], ascending. See {@link PercentileBand} for the
     * boundary convention.
     *
     * @param x lower percentage in [0, 100]
     * @param y upper percentage in [x, 100]
     * @return the values in the band, empty if the store is empty
     * @throws IllegalArgumentException if the percentages are out of range or reversed
     */
    public List<T> ratio(double x, double y) {
        var band = band(x, y);
        if (band.isEmpty()) {
            log.trace("ratio({}, {}) over {} values is empty", x, y, items.size());
            return Collections.emptyList();
        }
        log.trace("ratio({}, {}) selects ranks [{}, {}] of {}", x, y, band.lowRank(), band.highRank(), items.size());
        return switch (strategy) {
            case TRAVERSAL -> items.range(items.kthSmallest(band.lowRank()).getKey(),
                                          items.kthSmallest(band.highRank()).getKey());
            case RANK_WALK -> {
                var result = new ArrayList<T>(band.size());
                for (int rank = band.lowRank(); rank <= band.highRank(); rank++) {
                    result.add(items.kthSmallest(rank).getItem());
                }
                yield result;
            }
        };
    }

    /**
     * @throws KeyNotFoundException if the value is absent
     */
    public void removePoint(T item) {
        items.delete(item);
    }

    public int size() {
        return items.size();
    }
}
