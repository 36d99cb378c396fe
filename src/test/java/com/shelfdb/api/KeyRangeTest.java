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

import org.junit.jupiter.api.Test;

import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

public class KeyRangeTest {

    @Test
    public void testOnly() throws Exception {
        KeyRange range = KeyRange.only("a");
        assertTrue(range.includes("a"));
        assertFalse(range.includes("b"));
        assertEquals("a", range.getLower());
        assertEquals("a", range.getUpper());
        assertFalse(range.isLowerOpen());
        assertFalse(range.isUpperOpen());
    }

    @Test
    public void testBound() throws Exception {
        KeyRange closed = KeyRange.bound(1, 3);
        assertTrue(closed.includes(1));
        assertTrue(closed.includes(3));
        assertFalse(closed.includes(3.5));

        KeyRange open = KeyRange.bound(1, 3, true, true);
        assertFalse(open.includes(1));
        assertTrue(open.includes(2));
        assertFalse(open.includes(3));

        assertTrue(KeyRange.bound(2, 2).includes(2));
        assertThrows(DataException.class, () -> KeyRange.bound(3, 1));
        assertThrows(DataException.class, () -> KeyRange.bound("a", 1));
    }

    @Test
    public void testHalfOpen() throws Exception {
        KeyRange lower = KeyRange.lowerBound(new Date(100), true);
        assertFalse(lower.includes(new Date(100)));
        assertTrue(lower.includes(new Date(101)));
        assertTrue(lower.includes("strings sort after dates"));
        assertNull(lower.getUpper());

        KeyRange upper = KeyRange.upperBound(10);
        assertTrue(upper.includes(-1000));
        assertTrue(upper.includes(10));
        assertFalse(upper.includes(new Date(0)));
        assertNull(upper.getLower());
    }

    @Test
    public void testInvalidKeys() throws Exception {
        assertThrows(DataException.class, () -> KeyRange.only(null));
        assertThrows(DataException.class, () -> KeyRange.lowerBound(Double.NaN));
        assertThrows(DataException.class, () -> KeyRange.upperBound(true));
        KeyRange range = KeyRange.only(1);
        assertThrows(DataException.class, () -> range.includes(new Object()));
        assertFalse(range.contains(new Object()));
        assertEquals("DataError", assertThrows(DataException.class, () -> KeyRange.only(null)).getErrorName());
    }

    @Test
    public void testCmp() throws Exception {
        assertEquals(-1, ShelfDB.cmp(1, "1"));
        assertEquals(0, ShelfDB.cmp(2, 2.0));
        assertEquals(1, ShelfDB.cmp("b", "a"));
        assertThrows(DataException.class, () -> ShelfDB.cmp(1, null));
    }
}
