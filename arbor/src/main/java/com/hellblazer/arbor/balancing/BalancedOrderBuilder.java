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

import com.hellblazer.arbor.common.QuickSelect;
import com.hellblazer.arbor.geometry.Point3i;
import com.hellblazer.arbor.spatial.PointTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Computes an insertion order for a batch of points that keeps a {@link PointTree} built from it shallow.
 * <p>
 * The order is a k-d style recursive median partition: the points of a partition are split around the median
 * of the partition's axis, the median is emitted first, then the lower partition and then the upper, with the
 * axis advancing x, y, z at each depth. Each median is placed near the root of the subtree its partition
 * becomes.
 * <p>
 * When points share the median coordinate, the pivot moves to the last of them, so every tie lands in the
 * lower partition; when the tied run covers more than half of the partition the pivot moves to the first of
 * them instead, and the ties land in the upper partition.
 * <p>
 * The partitions are processed iteratively from an explicit work stack, with a selection rather than a sort
 * per partition, O(n log n) overall.
 *
 * @author hal.hildebrand
 */
public class BalancedOrderBuilder {
    private static final Logger log = LoggerFactory.getLogger(BalancedOrderBuilder.class);

    private final BuildOrderConfig config;

    public BalancedOrderBuilder() {
        this(BuildOrderConfig.defaultConfig());
    }

    public BalancedOrderBuilder(BuildOrderConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Answer a permutation of the points whose insertion order keeps a point tree shallow. The input is not
     * modified.
     *
     * @param points the points, expected to be distinct
     * @return a new list holding every input point exactly once
     */
    public List<Point3i> buildOrder(List<Point3i> points) {
        Objects.requireNonNull(points, "points cannot be null");
        var work = new ArrayList<Point3i>(points.size());
        for (var point : points) {
            work.add(Objects.requireNonNull(point, "points cannot contain null"));
        }
        var order = new ArrayList<Point3i>(work.size());
        var select = new QuickSelect(config.seed());
        Deque<Partition> stack = new ArrayDeque<>();
        stack.push(new Partition(0, work.size(), 0));
        int partitions = 0;
        int maxDepth = 0;

        while (!stack.isEmpty()) {
            var partition = stack.pop();
            int size = partition.end - partition.begin;
            if (size == 0) {
                continue;
            }
            partitions++;
            maxDepth = Math.max(maxDepth, partition.depth + 1);
            if (size == 1) {
                order.add(work.get(partition.begin));
                continue;
            }
            var axis = config.startAxis().atDepth(partition.depth);
            int median = partition.begin + size / 2;
            var run = select.selectRun(work, partition.begin, partition.end - 1, median, axis.comparator());
            int pivot = run.length() > size / 2 ? run.lo() : run.hi();
            order.add(work.get(pivot));

            // lower partition is popped, and emitted, first
            stack.push(new Partition(pivot + 1, partition.end, partition.depth + 1));
            stack.push(new Partition(partition.begin, pivot, partition.depth + 1));
        }

        log.debug("Ordered {} points in {} partitions, depth {}", order.size(), partitions, maxDepth);
        return order;
    }

    /**
     * Build a point tree by inserting the points in balanced order.
     *
     * @param points the points
     * @param items  the item to store at each point
     * @return the populated tree
     */
    public <I> PointTree<I> buildTree(List<Point3i> points, Function<? super Point3i, ? extends I> items) {
        Objects.requireNonNull(items, "items cannot be null");
        var tree = new PointTree<I>();
        for (var point : buildOrder(points)) {
            tree.insert(point, items.apply(point));
        }
        if (log.isDebugEnabled()) {
            log.debug("Built point tree of {} points, height {}", tree.size(), tree.height());
        }
        return tree;
    }

    public BuildOrderConfig getConfig() {
        return config;
    }

    private record Partition(int begin, int end, int depth) {
    }
}
