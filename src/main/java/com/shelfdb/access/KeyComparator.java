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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.Date;

/**
 * KeyComparator defines the total order over keys. Keys of different types
 * order by type first, numbers before dates before strings, and keys of the
 * same type order by natural value: numbers numerically, dates
 * chronologically and strings by UTF-16 code unit.
 * <p>
 * Integral and floating numbers compare by exact numeric value, so 1, 1L and
 * 1.0 are the same key, as are 0.0 and -0.0, while distinct longs beyond the
 * range a double represents exactly remain distinct keys.
 */
public final class KeyComparator implements Comparator<Object> {

    public static final KeyComparator INSTANCE = new KeyComparator();

    private static final int NUMBER = 1;
    private static final int DATE = 2;
    private static final int STRING = 3;

    private KeyComparator() {
    }

    @Override
    public int compare(Object a, Object b) {
        int ta = typeOf(a);
        int tb = typeOf(b);
        if (ta != tb)
            return ta < tb ? -1 : 1;

        switch (ta) {
            case NUMBER:
                return compareNumbers((Number) a, (Number) b);
            case DATE:
                return Long.compare(((Date) a).getTime(), ((Date) b).getTime());
            default:
                return ((String) a).compareTo((String) b);
        }
    }

    /**
     * Are the two keys the same key under this ordering?
     */
    public boolean equal(Object a, Object b) {
        return compare(a, b) == 0;
    }

    private static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b))
            return Long.compare(a.longValue(), b.longValue());
        if ((a instanceof Double || a instanceof Float) && (b instanceof Double || b instanceof Float)) {
            double x = a.doubleValue();
            double y = b.doubleValue();
            return x < y ? -1 : x > y ? 1 : 0;
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal)
            return (BigDecimal) n;
        if (n instanceof BigInteger)
            return new BigDecimal((BigInteger) n);
        if (isIntegral(n))
            return BigDecimal.valueOf(n.longValue());
        return new BigDecimal(n.doubleValue());
    }

    private static int typeOf(Object key) {
        if (key instanceof Number)
            return NUMBER;
        if (key instanceof Date)
            return DATE;
        if (key instanceof String)
            return STRING;
        throw new IllegalArgumentException("Not a valid key: " + key);
    }
}
