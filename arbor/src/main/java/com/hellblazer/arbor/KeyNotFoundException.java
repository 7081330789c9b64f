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

/**
 * Raised by lookup or delete of a key that is not stored.
 *
 * @author hal.hildebrand
 */
public final class KeyNotFoundException extends IndexException {

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super("Key not found: " + key);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
