/*
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
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

package com.hellblazer.arbor.common;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class QuickSelectTest {

    private static final Comparator<Integer> NATURAL = Comparator.naturalOrder();

    @Test
    public void testOutOfRangeIndex() {
        var select = new QuickSelect(0L);
        var list = new ArrayList<>(List.of(1, 2, 3));
        assertThrows(IllegalArgumentException.class, () -> select.select(list, 0, 2, 3, NATURAL));
        assertThrows(IllegalArgumentException.class, () -> select.select(list, 1, 2, 0, NATURAL));
    }

    @Test
    public void testPartition3() {
        var select = new QuickSelect(7L);
        var list = new ArrayList<>(List.of(5, 1, 5, 9, 5, 0, 7));

        var run = select.partition3(list, 0, list.size() - 1, 5, NATURAL);

        assertEquals(new QuickSelect.Run(2, 4), run);
        assertEquals(3, run.length());
        assertTrue(list.subList(0, 2).stream().allMatch(v -> v < 5));
        assertEquals(List.of(5, 5, 5), list.subList(2, 5));
        assertTrue(list.subList(5, 7).stream().allMatch(v -> v > 5));
    }

    @Test
    public void testSelectMedian() {
        var select = new QuickSelect(42L);
        var list = new ArrayList<>(List.of(0, 9, 1, 8, 2));

        assertEquals(2, select.select(list, 2, NATURAL));
        assertEquals(2, list.get(2));
    }

    @Test
    public void testSelectWithinSubRange() {
        var select = new QuickSelect(3L);
        var list = new ArrayList<>(List.of(100, 4, 3, 2, 1, -100));

        assertEquals(2, select.select(list, 1, 4, 2, NATURAL));
        // Elements outside the range are untouched
        assertEquals(100, list.get(0));
        assertEquals(-100, list.get(5));
    }

    @Property
    @Label("Selected element has the requested order")
    void selectedElementHasRequestedOrder(@ForAll @Size(min = 1, max = 60) List<@IntRange(min = -20, max = 20) Integer> values,
                                          @ForAll long seed) {
        var list = new ArrayList<>(values);
        int n = list.size() / 2;

        int selected = new QuickSelect(seed).select(list, n, NATURAL);

        var sorted = new ArrayList<>(values);
        sorted.sort(NATURAL);
        assertEquals(sorted.get(n), selected);
        for (int i = 0; i < n; i++) {
            assertTrue(list.get(i) <= selected);
        }
        for (int i = n + 1; i < list.size(); i++) {
            assertTrue(list.get(i) >= selected);
        }
    }

    @Property
    @Label("Run of equal elements always contains the selected index")
    void runContainsSelectedIndex(@ForAll @Size(min = 1, max = 60) List<@IntRange(min = 0, max = 5) Integer> values,
                                  @ForAll long seed) {
        var list = new ArrayList<>(values);
        int n = list.size() / 2;

        var run = new QuickSelect(seed).selectRun(list, 0, list.size() - 1, n, NATURAL);

        assertTrue(run.contains(n));
        int median = list.get(n);
        for (int i = 0; i < list.size(); i++) {
            int c = Integer.compare(list.get(i), median);
            if (i < run.lo()) {
                assertTrue(c < 0);
            } else if (i > run.hi()) {
                assertTrue(c > 0);
            } else {
                assertEquals(0, c);
            }
        }
        var sortedInput = new ArrayList<>(values);
        var sortedOutput = new ArrayList<>(list);
        sortedInput.sort(NATURAL);
        sortedOutput.sort(NATURAL);
        assertEquals(sortedInput, sortedOutput);
    }
}
