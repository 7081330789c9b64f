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
package com.hellblazer.arbor.visitor;

import java.util.HashMap;
import java.util.Map;

/**
 * Visitor that counts nodes and leaves per level, giving the shape of a tree without printing it.
 *
 * @param <K> The key type
 * @param <I> The item type
 * @author hal.hildebrand
 */
public class NodeCountVisitor<K, I> implements TreeVisitor<K, I> {

    private final Map<Integer, Integer> nodesPerLevel    = new HashMap<>();
    private final Map<Integer, Integer> leavesPerLevel   = new HashMap<>();
    private       int                   totalNodes       = 0;
    private       int                   totalLeaves      = 0;
    private       int                   maxLevelObserved = -1;

    /**
     * Number of levels observed, which is the tree height when the traversal was unbounded.
     *
     * @return the height, 0 for an empty tree
     */
    public int getHeight() {
        return maxLevelObserved + 1;
    }

    /**
     * Get the number of leaves at a specific level.
     *
     * @param level the level to query
     * @return number of leaves at that level
     */
    public int getLeavesAtLevel(int level) {
        return leavesPerLevel.getOrDefault(level, 0);
    }

    /**
     * Get the maximum level observed.
     *
     * @return maximum level, -1 when nothing was visited
     */
    public int getMaxLevelObserved() {
        return maxLevelObserved;
    }

    /**
     * Get the number of nodes at a specific level.
     *
     * @param level the level to query
     * @return number of nodes at that level
     */
    public int getNodesAtLevel(int level) {
        return nodesPerLevel.getOrDefault(level, 0);
    }

    /**
     * Get statistics as a formatted string.
     *
     * @return formatted statistics
     */
    public String getStatistics() {
        StringBuilder sb = new StringBuilder();
        sb.append("Tree Statistics:\n");
        sb.append("  Total nodes: ").append(totalNodes).append("\n");
        sb.append("  Total leaves: ").append(totalLeaves).append("\n");
        sb.append("  Height: ").append(getHeight()).append("\n");
        sb.append("  Nodes per level:\n");

        for (int level = 0; level <= maxLevelObserved; level++) {
            int nodes = getNodesAtLevel(level);
            if (nodes > 0) {
                sb.append("    Level ")
                  .append(level)
                  .append(": ")
                  .append(nodes)
                  .append(" nodes, ")
                  .append(getLeavesAtLevel(level))
                  .append(" leaves")
                  .append("\n");
            }
        }

        return sb.toString();
    }

    public int getTotalLeaves() {
        return totalLeaves;
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    @Override
    public void leaveNode(K key, int level, int childCount) {
        if (childCount == 0) {
            totalLeaves++;
            leavesPerLevel.merge(level, 1, Integer::sum);
        }
    }

    /**
     * Reset all counters.
     */
    public void reset() {
        nodesPerLevel.clear();
        leavesPerLevel.clear();
        totalNodes = 0;
        totalLeaves = 0;
        maxLevelObserved = -1;
    }

    @Override
    public boolean visitNode(K key, I item, int level, int subtreeSize) {
        totalNodes++;
        nodesPerLevel.merge(level, 1, Integer::sum);
        maxLevelObserved = Math.max(maxLevelObserved, level);
        return true;
    }
}
