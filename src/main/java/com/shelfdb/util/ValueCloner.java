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

package com.shelfdb.util;

import com.shelfdb.api.DataCloneException;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ValueCloner deep-copies JSON-like values into plain data so that stored
 * records never alias structures owned by the caller.
 * <p>
 * Maps with string keys and lists are copied recursively; strings, booleans,
 * finite numbers and null are immutable and returned as is. Any other object
 * is treated as an opaque blob and shared by reference. Non-finite numbers,
 * maps with non-string keys and cyclic structures cannot be cloned.
 */
public final class ValueCloner {

    private ValueCloner() {
    }

    public static Object clone(Object value) throws DataCloneException {
        return clone(value, new IdentityHashMap<>());
    }

    private static Object clone(Object value, IdentityHashMap<Object, Boolean> path)
            throws DataCloneException {
        if (value == null || value instanceof String || value instanceof Boolean)
            return value;

        if (value instanceof Number) {
            if (!Double.isFinite(((Number) value).doubleValue()))
                throw new DataCloneException("Cannot clone non-finite number: " + value);
            return value;
        }

        if (value instanceof Map) {
            enter(value, path);
            Map<?, ?> map = (Map<?, ?>) value;
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String))
                    throw new DataCloneException("Cannot clone map with non-string key: " + entry.getKey());
                copy.put((String) entry.getKey(), clone(entry.getValue(), path));
            }
            path.remove(value);
            return copy;
        }

        if (value instanceof List) {
            enter(value, path);
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list)
                copy.add(clone(element, path));
            path.remove(value);
            return copy;
        }

        // opaque blob
        return value;
    }

    private static void enter(Object value, IdentityHashMap<Object, Boolean> path)
            throws DataCloneException {
        if (path.put(value, Boolean.TRUE) != null)
            throw new DataCloneException("Cannot clone cyclic structure");
    }
}
