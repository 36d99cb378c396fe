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

import com.shelfdb.api.DataException;
import com.shelfdb.util.Validation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * KeyPath locates a key within a stored value. A path is one field name, or a
 * dot-separated sequence of field names resolved by repeated field lookup
 * through nested maps.
 */
public final class KeyPath {

    private final String path;
    private final String[] fields;

    private KeyPath(String path) {
        this.path = path;
        this.fields = path.split("\\.");
    }

    /**
     * Parses a key path.
     *
     * @param path the path, such as "id" or "address.city"
     * @return the parsed key path
     * @throws IllegalArgumentException if the path is not a valid key path
     */
    public static KeyPath of(String path) {
        if (!Validation.isValidKeyPath(path))
            throw new IllegalArgumentException("Not a valid key path: " + path);
        return new KeyPath(path);
    }

    /**
     * Resolves this path against a value.
     *
     * @param value the value to inspect
     * @return the object found at this path, or null if the value or any
     * intermediate field is missing or not a map
     */
    public Object evaluate(Object value) {
        Object current = value;
        for (String field : fields) {
            if (!(current instanceof Map))
                return null;
            current = ((Map<?, ?>) current).get(field);
        }
        return current;
    }

    /**
     * Stores a generated key into a value at this path, creating any missing
     * intermediate maps.
     *
     * @param value the value to update
     * @param key   the key to store
     * @throws DataException if a field on the path holds something other than
     *                       a map
     */
    @SuppressWarnings("unchecked")
    public void inject(Object value, Object key) throws DataException {
        if (!(value instanceof Map))
            throw new DataException("Cannot set key at path '" + path + "' on value");
        Map<String, Object> current = (Map<String, Object>) value;
        for (int i = 0; i < fields.length - 1; i++) {
            Object next = current.get(fields[i]);
            if (next == null) {
                next = new LinkedHashMap<String, Object>();
                current.put(fields[i], next);
            } else if (!(next instanceof Map)) {
                throw new DataException("Cannot set key at path '" + path + "' on value");
            }
            current = (Map<String, Object>) next;
        }
        current.put(fields[fields.length - 1], key);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof KeyPath && ((KeyPath) obj).path.equals(path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }
}
