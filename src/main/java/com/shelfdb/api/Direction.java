/*
 * ShelfDB: Embedded Object Store for Java
 *
 * Copyright 2021 Ken Westlund
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.shelfdb.api;

/**
 * The order in which a {@link Cursor} visits records.
 */
public enum Direction {
    /**
     * Ascending key order, including duplicate keys.
     */
    NEXT(false, false),
    /**
     * Ascending key order, visiting only the first record of each key.
     */
    NEXTUNIQUE(true, false),
    /**
     * Descending key order, including duplicate keys.
     */
    PREV(false, true),
    /**
     * Descending key order, visiting only one record of each key.
     */
    PREVUNIQUE(true, true);

    private final boolean unique;
    private final boolean reverse;

    Direction(boolean unique, boolean reverse) {
        this.unique = unique;
        this.reverse = reverse;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isReverse() {
        return reverse;
    }
}
