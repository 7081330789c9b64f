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
package com.hellblazer.arbor;

import com.hellblazer.arbor.visitor.TreeVisitor;

/**
 * The call contract shared by the keyed trees: upsert insertion, lookup that fails loudly on an absent key,
 * and size accounting.
 *
 * Thread Safety: implementations are NOT thread-safe. A single owner mutates an index in place; callers
 * sharing an index must provide external locking.
 *
 * @param <K> the key type
 * @param <I> the item type
 * @author hal.hildebrand
 */
public interface KeyedIndex<K, I> {

    /**
     * Visit every node in pre-order, root first.
     *
     * @param visitor the visitor to call back
     */
    void accept(TreeVisitor<K, I> visitor);

    /**
     * @return true if the key is present
     */
    boolean contains(K key);

    /**
     * Number of nodes on the longest root to leaf path, 0 when empty.
     */
    int height();

    /**
     * Insert the item under the key. An existing key keeps its node and has its item replaced.
     *
     * @param key  the key, not null
     * @param item the item
     */
    void insert(K key, I item);

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Answer the item stored under the key.
     *
     * @param key the key, not null
     * @return the item
     * @throws IndexException if the key is absent
     */
    I lookup(K key);

    /**
     * @return the number of keys stored
     */
    int size();
}
