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

import com.shelfdb.api.KeyRange;
import com.shelfdb.util.Validation;

import java.util.List;

/**
 * KeyMatcher tests whether a key satisfies a query. A query is a single key
 * (matched by equality), a {@link KeyRange} (matched by inclusion) or a list
 * of keys and ranges (matched if any element matches).
 */
public final class KeyMatcher {

    private KeyMatcher() {
    }

    public static boolean matches(Object key, Object query) {
        if (!Validation.isValidKey(key))
            return false;
        if (query instanceof KeyRange)
            return ((KeyRange) query).contains(key);
        if (query instanceof List) {
            for (Object element : (List<?>) query) {
                if (matches(key, element))
                    return true;
            }
            return false;
        }
        if (Validation.isValidKey(query))
            return KeyComparator.INSTANCE.equal(key, query);
        return false;
    }
}
