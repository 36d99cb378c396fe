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

import com.shelfdb.api.KeyRange;

import java.util.Date;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validation holds the argument checks shared by the API implementation:
 * identifiers, key paths, versions, keys and key ranges.
 */
public final class Validation {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-zA-Z0-9_\\-$]*$");

    private Validation() {
    }

    /**
     * Is the string usable as a database, store or index name?
     */
    public static boolean isValidIdentifier(String identifier) {
        return identifier != null && IDENTIFIER.matcher(identifier).matches();
    }

    /**
     * Is the string a key path, either a single identifier such as "id" or a
     * dotted path of identifiers such as "address.city"?
     */
    public static boolean isValidKeyPath(String keyPath) {
        if (keyPath == null)
            return false;
        for (String part : keyPath.split("\\.", -1)) {
            if (!isValidIdentifier(part))
                return false;
        }
        return true;
    }

    /**
     * Is the list a non-empty list of key paths?
     */
    public static boolean isValidMultiKeyPath(List<?> keyPaths) {
        if (keyPaths == null || keyPaths.isEmpty())
            return false;
        for (Object keyPath : keyPaths) {
            if (!(keyPath instanceof String) || !isValidKeyPath((String) keyPath))
                return false;
        }
        return true;
    }

    public static boolean isValidVersion(long version) {
        return version > 0;
    }

    /**
     * Is the object a key: a finite number, a string or a date?
     */
    public static boolean isValidKey(Object key) {
        if (key instanceof Number)
            return Double.isFinite(((Number) key).doubleValue());
        return key instanceof String || key instanceof Date;
    }

    /**
     * Is the object a key range: a {@link KeyRange}, or a non-empty list whose
     * elements are each a key or a key range?
     */
    public static boolean isValidKeyRange(Object range) {
        if (range instanceof KeyRange)
            return true;
        if (range instanceof List) {
            List<?> list = (List<?>) range;
            if (list.isEmpty())
                return false;
            for (Object element : list) {
                if (!isValidKey(element) && !isValidKeyRange(element))
                    return false;
            }
            return true;
        }
        return false;
    }

    /**
     * Is the object usable as a query: a key or a key range?
     */
    public static boolean isValidQuery(Object query) {
        return isValidKey(query) || isValidKeyRange(query);
    }
}
