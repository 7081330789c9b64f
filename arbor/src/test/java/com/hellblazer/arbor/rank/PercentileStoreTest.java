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
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for percentile band queries.
 *
 * @author hal.hildebrand
 */
public class PercentileStoreTest {

    private static PercentileStore<Integer> oneToTen(BandStrategy strategy) {
        var store = new PercentileStore<Integer>(strategy);
        var values = IntStream.rangeClosed(1, 10).boxed().collect(Collectors.toList());
        Collections.shuffle(values, new Random(1293810293));
        values.forEach(store::addPoint);
        return store;
    }

    @Property
    @Label("Traversal and rank walk agree on every band")
    void strategiesAgree(@ForAll @Size(max = 60) List<@IntRange(min = -500, max = 500) Integer> values,
                         @ForAll @DoubleRange(min = 0, max = 100) double a,
                         @ForAll @DoubleRange(min = 0, max = 100) double b) {
        var traversal = new PercentileStore<Integer>(BandStrategy.TRAVERSAL);
        var walk = new PercentileStore<Integer>(BandStrategy.RANK_WALK);
        values.forEach(traversal::addPoint);
        values.forEach(walk::addPoint);
        double x = Math.min(a, b);
        double y = Math.max(a, b);

        var result = traversal.ratio(x, y);
        assertEquals(walk.ratio(x, y), result);
        assertEquals(traversal.band(x, y).size(), result.size());

        var sorted = new ArrayList<>(new TreeSet<>(values));
        var band = traversal.band(x, y);
        if (!band.isEmpty()) {
            assertEquals(sorted.subList(band.lowRank() - 1, band.highRank()), result);
        }
    }

    @Property
    @Label("A single point band holds at most one item")
    void pointBandHoldsAtMostOne(@ForAll @Size(max = 40) List<@IntRange(min = 0, max = 100) Integer> values,
                                 @ForAll @DoubleRange(min = 0, max = 100) double x) {
        var store = new PercentileStore<Integer>();
        values.forEach(store::addPoint);
        assertTrue(store.ratio(x, x).size() <= 1);
    }

    @Test
    public void testAddIsIdempotent() {
        var store = new PercentileStore<Integer>();
        store.addPoint(3);
        store.addPoint(3);
        store.addPoint(1);
        assertEquals(2, store.size());
        assertEquals(List.of(1, 3), store.ratio(0, 100));
    }

    @Test
    public void testEmptyStore() {
        var store = new PercentileStore<Integer>();
        assertTrue(store.isEmpty());
        assertEquals(List.of(), store.ratio(0, 100));
        assertEquals(List.of(), store.ratio(25, 25));
        assertTrue(store.band(0, 100).isEmpty());
        assertTrue(store.percentile(50).isEmpty());
    }

    @Test
    public void testInvalidBounds() {
        var store = oneToTen(BandStrategy.TRAVERSAL);
        assertThrows(IllegalArgumentException.class, () -> store.ratio(-1, 50));
        assertThrows(IllegalArgumentException.class, () -> store.ratio(10, 101));
        assertThrows(IllegalArgumentException.class, () -> store.ratio(60, 40));
        assertThrows(IllegalArgumentException.class, () -> store.ratio(Double.NaN, 40));
        assertThrows(IllegalArgumentException.class, () -> store.percentile(100.5));
    }

    @Test
    public void testLowerHalf() {
        for (var strategy : BandStrategy.values()) {
            var store = oneToTen(strategy);
            assertEquals(strategy, store.getStrategy());
            assertEquals(List.of(1, 2, 3, 4, 5), store.ratio(0, 50));
            assertEquals(List.of(6, 7, 8, 9, 10), store.ratio(50, 100));
            assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), store.ratio(0, 100));
        }
    }

    @Test
    public void testPercentile() {
        var store = oneToTen(BandStrategy.TRAVERSAL);
        assertEquals(1, store.percentile(0).orElseThrow());
        assertEquals(5, store.percentile(50).orElseThrow());
        assertEquals(6, store.percentile(51).orElseThrow());
        assertEquals(10, store.percentile(100).orElseThrow());
    }

    @Test
    public void testPointBands() {
        var store = oneToTen(BandStrategy.TRAVERSAL);
        // 30% is the boundary between the 3rd and 4th values
        assertEquals(List.of(), store.ratio(30, 30));
        // 35% falls within the 4th value's slice
        assertEquals(List.of(4), store.ratio(35, 35));
        // the ends select the extreme values
        assertEquals(List.of(1), store.ratio(0, 0));
        assertEquals(List.of(10), store.ratio(100, 100));
    }

    @Test
    public void testRemovePoint() {
        var store = oneToTen(BandStrategy.TRAVERSAL);
        store.removePoint(1);
        store.removePoint(10);
        assertFalse(store.contains(1));
        assertEquals(8, store.size());
        assertEquals(List.of(2, 3, 4, 5), store.ratio(0, 50));
        assertThrows(KeyNotFoundException.class, () -> store.removePoint(42));
        assertEquals(8, store.size());
    }

    @Test
    public void testUnevenValues() {
        var store = new PercentileStore<Integer>();
        var values = new ArrayList<>(List.of(4, 9, 14, 15, 16, 82, 87, 91, 92, 99));
        Collections.shuffle(values, new Random(1293810293));
        values.forEach(store::addPoint);

        assertEquals(List.of(4, 9, 14, 15, 16), store.ratio(0, 42));
        assertEquals(List.of(9, 14, 15, 16, 82, 87), store.ratio(15, 66));
        assertEquals(new PercentileBand(2, 7), store.band(15, 66));
    }
}
