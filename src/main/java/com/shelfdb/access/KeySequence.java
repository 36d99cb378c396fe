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

package com.shelfdb.access;

import com.shelfdb.api.Direction;
import com.shelfdb.core.KeyPath;
import com.shelfdb.util.Validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * KeySequence is the ordered list of positions a cursor visits, computed once
 * from the records of a store when the cursor is opened.
 * <p>
 * For a store the sequence key of a record is its primary key. For an index
 * it is the value found at the index's key path; records without a valid key
 * there are left out. Entries are ordered by sequence key, and records with
 * equal index keys keep the order of their primary keys.
 */
public class KeySequence {

    /**
     * One position of a cursor.
     */
    public static final class Entry {
        private final Object key;
        private final Object primaryKey;

        Entry(Object key, Object primaryKey) {
            this.key = key;
            this.primaryKey = primaryKey;
        }

        public Object getKey() {
            return key;
        }

        public Object getPrimaryKey() {
            return primaryKey;
        }

        @Override
        public String toString() {
            return key + "=" + primaryKey;
        }
    }

    private final List<Entry> entries;
    private int position;

    private KeySequence(List<Entry> entries) {
        this.entries = entries;
    }

    /**
     * Builds the sequence for a cursor.
     *
     * @param records      the store's records, ordered by primary key
     * @param indexKeyPath the key path of the index, or null to traverse the
     *                     store by primary key
     * @param query        the query keys must match, or null to keep every key
     * @param direction    the order of traversal; the unique directions keep
     *                     only the first record of each run of equal keys
     * @return the sequence, positioned before its first entry
     */
    public static KeySequence build(Map<Object, Object> records, KeyPath indexKeyPath, Object query,
                                    Direction direction) {
        List<Entry> entries = new ArrayList<>();
        for (Map.Entry<Object, Object> record : records.entrySet()) {
            Object key = indexKeyPath == null ? record.getKey() : indexKeyPath.evaluate(record.getValue());
            if (!Validation.isValidKey(key))
                continue;
            if (query == null || KeyMatcher.matches(key, query))
                entries.add(new Entry(key, record.getKey()));
        }

        // stable, so equal keys stay in primary key order
        entries.sort((a, b) -> KeyComparator.INSTANCE.compare(a.key, b.key));

        if (direction.isUnique()) {
            List<Entry> unique = new ArrayList<>();
            for (Entry e : entries) {
                if (unique.isEmpty() || !KeyComparator.INSTANCE.equal(unique.get(unique.size() - 1).key, e.key))
                    unique.add(e);
            }
            entries = unique;
        }

        if (direction.isReverse())
            Collections.reverse(entries);

        return new KeySequence(entries);
    }

    public boolean hasNext() {
        return position < entries.size();
    }

    /**
     * Moves past the next entry.
     *
     * @return the entry, or null if the sequence is exhausted
     */
    public Entry next() {
        return hasNext() ? entries.get(position++) : null;
    }

    /**
     * Gets the number of entries in the sequence.
     */
    public int size() {
        return entries.size();
    }
}
