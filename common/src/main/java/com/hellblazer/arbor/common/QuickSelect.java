/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 * 
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License as published by the Free
 * Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 * 
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 * 
 * You should have received a copy of the GNU Affero General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.arbor.common;

import java.util.Comparator;
import java.util.List;
import java.util.Random;

//
// Java implementation of quickselect algorithm, with a three way partition
// step for locating the run of elements equal to the selected one.
// See https://en.wikipedia.org/wiki/Quickselect
// and https://en.wikipedia.org/wiki/Dutch_national_flag_problem
//
/**
 * In place selection over a range of a list. Not thread safe, the pivot source is shared by every call on an
 * instance.
 *
 * @author hal.hildebrand
 */
public class QuickSelect {

    /**
     * The closed index range [lo, hi] of the elements that compare equal to a pivot after a three way
     * partition.
     */
    public record Run(int lo, int hi) {
        public boolean contains(int index) {
            return index >= lo && index <= hi;
        }

        public int length() {
            return hi - lo + 1;
        }
    }

    private final Random random;

    public QuickSelect(long seed) {
        this(new Random(seed));
    }

    public QuickSelect(Random random) {
        this.random = random;
    }

    private static <T> int partition(List<T> list, int left, int right, int pivot, Comparator<? super T> cmp) {
        T pivotValue = list.get(pivot);
        swap(list, pivot, right);
        int store = left;
        for (int i = left; i < right; ++i) {
            if (cmp.compare(list.get(i), pivotValue) < 0) {
                swap(list, store, i);
                ++store;
            }
        }
        swap(list, right, store);
        return store;
    }

    private static <T> void swap(List<T> list, int i, int j) {
        T value = list.get(i);
        list.set(i, list.get(j));
        list.set(j, value);
    }

    /**
     * Rearrange [left, right] so that every element less than the pivot precedes every element equal to it,
     * which precede every element greater than it.
     *
     * @return the run of elements equal to the pivot
     */
    public <T> Run partition3(List<T> list, int left, int right, T pivotValue, Comparator<? super T> cmp) {
        int lt = left;
        int gt = right;
        int i = left;
        while (i <= gt) {
            int c = cmp.compare(list.get(i), pivotValue);
            if (c < 0) {
                swap(list, lt++, i++);
            } else if (c > 0) {
                swap(list, i, gt--);
            } else {
                ++i;
            }
        }
        return new Run(lt, gt);
    }

    public <T> T select(List<T> list, int n, Comparator<? super T> cmp) {
        return select(list, 0, list.size() - 1, n, cmp);
    }

    /**
     * Place the element of order n (an absolute index in [left, right]) at position n, with no greater
     * element before it and no smaller element after it.
     *
     * @return the selected element
     */
    public <T> T select(List<T> list, int left, int right, int n, Comparator<? super T> cmp) {
        if (n < left || n > right) {
            throw new IllegalArgumentException("Index " + n + " outside [" + left + ", " + right + "]");
        }
        for (;;) {
            if (left == right)
                return list.get(left);
            int pivot = pivotIndex(left, right);
            pivot = partition(list, left, right, pivot, cmp);
            if (n == pivot)
                return list.get(n);
            else if (n < pivot)
                right = pivot - 1;
            else
                left = pivot + 1;
        }
    }

    /**
     * Select the element of order n within [left, right] and gather every element equal to it into one
     * contiguous run, which always contains n.
     */
    public <T> Run selectRun(List<T> list, int left, int right, int n, Comparator<? super T> cmp) {
        T median = select(list, left, right, n, cmp);
        return partition3(list, left, right, median, cmp);
    }

    private int pivotIndex(int left, int right) {
        return left + random.nextInt(right - left + 1);
    }
}
