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
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

public class KeyMatcherTest {

    @Test
    public void testSingleKey() {
        assertTrue(KeyMatcher.matches(1, 1L));
        assertTrue(KeyMatcher.matches("x", "x"));
        assertTrue(KeyMatcher.matches(new Date(42), new Date(42)));
        assertFalse(KeyMatcher.matches(1, 2));
        assertFalse(KeyMatcher.matches(1, "1"));
    }

    @Test
    public void testRange() throws Exception {
        KeyRange range = KeyRange.bound(1, 3, true, false);
        assertFalse(KeyMatcher.matches(1, range));
        assertTrue(KeyMatcher.matches(2, range));
        assertTrue(KeyMatcher.matches(3, range));
        assertFalse(KeyMatcher.matches("2", range));
    }

    @Test
    public void testList() throws Exception {
        Object query = Arrays.asList(5, KeyRange.lowerBound("m"), Arrays.asList("a"));
        assertTrue(KeyMatcher.matches(5, query));
        assertTrue(KeyMatcher.matches("z", query));
        assertTrue(KeyMatcher.matches("a", query));
        assertFalse(KeyMatcher.matches("b", query));
        assertFalse(KeyMatcher.matches(6, query));
    }

    @Test
    public void testInvalidKeyNeverMatches() {
        assertFalse(KeyMatcher.matches(null, 1));
        assertFalse(KeyMatcher.matches(Double.NaN, Double.NaN));
        assertFalse(KeyMatcher.matches(true, true));
    }
}
