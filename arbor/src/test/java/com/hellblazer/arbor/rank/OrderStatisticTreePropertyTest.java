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
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.UniqueElements;
import org.junit.jupiter.api.DisplayName;

import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Order Statistics Tree Property-Based Tests")
class OrderStatisticTreePropertyTest {

    @Provide
    Arbitrary<List<Operation>> operations() {
        var inserts = Arbitraries.integers().between(-30, 30).map(k -> new Operation(true, k));
        var deletes = Arbitraries.integers().between(-30, 30).map(k -> new Operation(false, k));
        return Arbitraries.frequencyOf(Tuple.of(3, inserts), Tuple.of(2, deletes)).list().ofMaxSize(120);
    }

    @Property
    @Label("Rank queries enumerate unique insertions in ascending order")
    void kthSmallestIsAscending(@ForAll @UniqueElements @Size(max = 80) List<@IntRange(min = -1000, max = 1000) Integer> keys) {
        var tree = new OrderStatisticTree<Integer, Integer>();
        keys.forEach(k -> tree.insert(k, k * 2));

        assertEquals(keys.size(), tree.size());
        Integer previous = null;
        for (int rank = 1; rank <= tree.size(); rank++) {
            var node = tree.kthSmallest(rank);
            if (previous != null) {
                assertTrue(node.getKey() > previous);
            }
            assertEquals(node.getKey() * 2, node.getItem());
            assertEquals(rank, tree.rank(node.getKey()));
            previous = node.getKey();
        }
    }

    @Property
    @Label("Subtree sizes stay consistent under inserts and deletes")
    void invariantsHoldUnderMutation(@ForAll("operations") List<Operation> operations) {
        var tree = new OrderStatisticTree<Integer, String>();
        var reference = new TreeMap<Integer, String>();

        for (var op : operations) {
            if (op.insert) {
                tree.insert(op.key, "i" + op.key);
                reference.put(op.key, "i" + op.key);
            } else if (reference.containsKey(op.key)) {
                tree.delete(op.key);
                reference.remove(op.key);
            } else {
                assertThrows(KeyNotFoundException.class, () -> tree.delete(op.key));
            }
            assertEquals(reference.size(), tree.size());
            OrderStatisticTreeTest.assertWellFormed(tree.getRoot(), null, null);
        }

        int rank = 1;
        for (var entry : reference.entrySet()) {
            assertEquals(entry.getKey(), tree.kthSmallest(rank++).getKey());
            assertEquals(entry.getValue(), tree.lookup(entry.getKey()));
        }
    }

    record Operation(boolean insert, int key) {
    }
}
