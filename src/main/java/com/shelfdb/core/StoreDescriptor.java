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

import com.shelfdb.access.KeyComparator;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * StoreDescriptor holds the contents and definition of one object store: its
 * records ordered by primary key, its optional key path, its key generator
 * and its indexes.
 * <p>
 * A transaction works on a copy made with the copy constructor. Record values
 * are never modified in place once stored, so the copy shares them and only
 * duplicates the record table and index metadata.
 */
public final class StoreDescriptor {

    private final String name;
    private final KeyPath keyPath; // null for out-of-line keys
    private final boolean autoIncrement;
    private final NavigableMap<Object, Object> records;
    private final NavigableMap<String, IndexDescriptor> indexes;
    private long currentKey; // last key handed out by the key generator

    public StoreDescriptor(String name, KeyPath keyPath, boolean autoIncrement) {
        this.name = name;
        this.keyPath = keyPath;
        this.autoIncrement = autoIncrement;
        this.records = new TreeMap<>(KeyComparator.INSTANCE);
        this.indexes = new TreeMap<>();
    }

    public StoreDescriptor(StoreDescriptor storeDescriptor) {
        name = storeDescriptor.name;
        keyPath = storeDescriptor.keyPath;
        autoIncrement = storeDescriptor.autoIncrement;
        records = new TreeMap<>(storeDescriptor.records);
        indexes = new TreeMap<>(storeDescriptor.indexes);
        currentKey = storeDescriptor.currentKey;
    }

    public String getName() {
        return name;
    }

    public KeyPath getKeyPath() {
        return keyPath;
    }

    public boolean isAutoIncrement() {
        return autoIncrement;
    }

    /**
     * Gets the record table, ordered by primary key.
     */
    public NavigableMap<Object, Object> getRecords() {
        return records;
    }

    /**
     * Generates the next key.
     *
     * @return a key greater than every key previously generated or explicitly
     * stored as a number
     */
    public long nextKey() {
        return ++currentKey;
    }

    /**
     * Advances the key generator past an explicitly supplied numeric key so
     * that generated keys never collide with it.
     */
    public void observeKey(Object key) {
        if (key instanceof Number) {
            double value = Math.floor(((Number) key).doubleValue());
            if (value > currentKey)
                currentKey = value >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) value;
        }
    }

    public long getCurrentKey() {
        return currentKey;
    }

    public IndexDescriptor getIndex(String name) {
        return indexes.get(name);
    }

    public void addIndex(IndexDescriptor indexDescriptor) {
        indexes.put(indexDescriptor.getName(), indexDescriptor);
    }

    public void removeIndex(String name) {
        indexes.remove(name);
    }

    /**
     * Gets the index names in sorted order.
     */
    public List<String> getIndexNames() {
        return new ArrayList<>(indexes.keySet());
    }
}
