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

import com.shelfdb.access.KeyComparator;
import com.shelfdb.util.Validation;

/**
 * KeyRange is an interval of keys used to filter lookups, deletes, counts and
 * cursors. Either bound may be absent, and each present bound is independently
 * open (excluded) or closed (included).
 * <p>
 * Ranges are created through the static factories {@link #only},
 * {@link #bound}, {@link #lowerBound} and {@link #upperBound}.
 *
 * @see ObjectStore
 * @see Index
 */
public final class KeyRange {

    private final Object lower;
    private final Object upper;
    private final boolean lowerOpen;
    private final boolean upperOpen;

    private KeyRange(Object lower, Object upper, boolean lowerOpen, boolean upperOpen)
            throws DataException {
        if (lower != null && !Validation.isValidKey(lower))
            throw new DataException("Lower bound must be a valid key (number, string, date): " + lower);
        if (upper != null && !Validation.isValidKey(upper))
            throw new DataException("Upper bound must be a valid key (number, string, date): " + upper);
        if (lower != null && upper != null && KeyComparator.INSTANCE.compare(lower, upper) > 0)
            throw new DataException("Lower bound must not be greater than upper bound");

        this.lower = lower;
        this.upper = upper;
        this.lowerOpen = lowerOpen;
        this.upperOpen = upperOpen;
    }

    /**
     * Creates a range matching the single key <code>value</code>.
     *
     * @param value the only key in the range
     * @return the new range
     * @throws DataException if value is not a valid key
     */
    public static KeyRange only(Object value) throws DataException {
        checkKey(value, "only()");
        return new KeyRange(value, value, false, false);
    }

    /**
     * Creates a closed range between two keys.
     *
     * @see #bound(Object, Object, boolean, boolean)
     */
    public static KeyRange bound(Object lower, Object upper) throws DataException {
        return bound(lower, upper, false, false);
    }

    /**
     * Creates a range between two keys.
     *
     * @param lower     the lower bound
     * @param upper     the upper bound
     * @param lowerOpen true to exclude the lower bound itself
     * @param upperOpen true to exclude the upper bound itself
     * @return the new range
     * @throws DataException if either bound is not a valid key, or lower is
     *                       greater than upper
     */
    public static KeyRange bound(Object lower, Object upper, boolean lowerOpen, boolean upperOpen)
            throws DataException {
        checkKey(lower, "bound()");
        checkKey(upper, "bound()");
        return new KeyRange(lower, upper, lowerOpen, upperOpen);
    }

    public static KeyRange lowerBound(Object lower) throws DataException {
        return lowerBound(lower, false);
    }

    /**
     * Creates a range with a lower bound and no upper bound.
     *
     * @param lower the lower bound
     * @param open  true to exclude the bound itself
     * @return the new range
     * @throws DataException if lower is not a valid key
     */
    public static KeyRange lowerBound(Object lower, boolean open) throws DataException {
        checkKey(lower, "lowerBound()");
        return new KeyRange(lower, null, open, true);
    }

    public static KeyRange upperBound(Object upper) throws DataException {
        return upperBound(upper, false);
    }

    /**
     * Creates a range with an upper bound and no lower bound.
     *
     * @param upper the upper bound
     * @param open  true to exclude the bound itself
     * @return the new range
     * @throws DataException if upper is not a valid key
     */
    public static KeyRange upperBound(Object upper, boolean open) throws DataException {
        checkKey(upper, "upperBound()");
        return new KeyRange(null, upper, true, open);
    }

    /**
     * Gets the lower bound.
     *
     * @return the lower bound, or null if the range has none
     */
    public Object getLower() {
        return lower;
    }

    /**
     * Gets the upper bound.
     *
     * @return the upper bound, or null if the range has none
     */
    public Object getUpper() {
        return upper;
    }

    public boolean isLowerOpen() {
        return lowerOpen;
    }

    public boolean isUpperOpen() {
        return upperOpen;
    }

    /**
     * Is the key within this range?
     *
     * @param key the key to test
     * @return true if the key lies within the range
     * @throws DataException if key is not a valid key
     */
    public boolean includes(Object key) throws DataException {
        checkKey(key, "includes()");
        return contains(key);
    }

    /**
     * Is the object a key within this range? Unlike {@link #includes}, an
     * object that is not a key is simply outside the range.
     */
    public boolean contains(Object key) {
        if (!Validation.isValidKey(key))
            return false;
        if (upper != null) {
            int c = KeyComparator.INSTANCE.compare(key, upper);
            if (upperOpen ? c >= 0 : c > 0)
                return false;
        }
        if (lower != null) {
            int c = KeyComparator.INSTANCE.compare(key, lower);
            if (lowerOpen ? c <= 0 : c < 0)
                return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return (lower == null ? "(" : lowerOpen ? "(" : "[")
                + (lower == null ? "" : lower) + ", " + (upper == null ? "" : upper)
                + (upper == null ? ")" : upperOpen ? ")" : "]");
    }

    private static void checkKey(Object key, String method) throws DataException {
        if (!Validation.isValidKey(key))
            throw new DataException(method + ": key must be a valid key (number, string, date): " + key);
    }
}
