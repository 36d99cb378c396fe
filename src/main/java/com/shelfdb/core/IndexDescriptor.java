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

package com.shelfdb.core;

/**
 * IndexDescriptor records the definition of one index on an object store.
 * Index entries are not materialized; cursors derive them from the store's
 * records each time they are built.
 * <p>
 * The unique and multiEntry flags are kept as declared metadata only.
 * Duplicate index keys are not rejected, and array values are indexed as
 * ordinary (non-key) values.
 */
public final class IndexDescriptor {

    private final String name;
    private final KeyPath keyPath;
    private final boolean isUnique;
    private final boolean isMultiEntry;

    public IndexDescriptor(String name, KeyPath keyPath, boolean isUnique, boolean isMultiEntry) {
        this.name = name;
        this.keyPath = keyPath;
        this.isUnique = isUnique;
        this.isMultiEntry = isMultiEntry;
    }

    public String getName() {
        return name;
    }

    public KeyPath getKeyPath() {
        return keyPath;
    }

    public boolean isUnique() {
        return isUnique;
    }

    public boolean isMultiEntry() {
        return isMultiEntry;
    }
}
