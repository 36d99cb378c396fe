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
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

public class ValidationTest {

    @Test
    public void testIdentifiers() {
        assertTrue(Validation.isValidIdentifier("shop"));
        assertTrue(Validation.isValidIdentifier("_items-2$"));
        assertTrue(Validation.isValidIdentifier("camelCase"));
        assertFalse(Validation.isValidIdentifier("Shop"));
        assertFalse(Validation.isValidIdentifier("2items"));
        assertFalse(Validation.isValidIdentifier(""));
        assertFalse(Validation.isValidIdentifier("a b"));
        assertFalse(Validation.isValidIdentifier(null));
    }

    @Test
    public void testKeyPaths() {
        assertTrue(Validation.isValidKeyPath("id"));
        assertTrue(Validation.isValidKeyPath("address.city"));
        assertFalse(Validation.isValidKeyPath("address."));
        assertFalse(Validation.isValidKeyPath(".id"));
        assertFalse(Validation.isValidKeyPath(null));
        assertTrue(Validation.isValidMultiKeyPath(Arrays.asList("a", "b.c")));
        assertFalse(Validation.isValidMultiKeyPath(Collections.emptyList()));
        assertFalse(Validation.isValidMultiKeyPath(Arrays.asList("a", 1)));
    }

    @Test
    public void testVersions() {
        assertTrue(Validation.isValidVersion(1));
        assertFalse(Validation.isValidVersion(0));
        assertFalse(Validation.isValidVersion(-1));
    }

    @Test
    public void testKeys() {
        assertTrue(Validation.isValidKey(0));
        assertTrue(Validation.isValidKey(-2.5));
        assertTrue(Validation.isValidKey(""));
        assertTrue(Validation.isValidKey(new Date()));
        assertFalse(Validation.isValidKey(Double.POSITIVE_INFINITY));
        assertFalse(Validation.isValidKey(Double.NaN));
        assertFalse(Validation.isValidKey(null));
        assertFalse(Validation.isValidKey(true));
        assertFalse(Validation.isValidKey(Collections.emptyMap()));
    }

    @Test
    public void testKeyRanges() throws Exception {
        assertTrue(Validation.isValidKeyRange(KeyRange.only(1)));
        assertTrue(Validation.isValidKeyRange(Arrays.asList(1, "a")));
        assertTrue(Validation.isValidKeyRange(Arrays.asList(KeyRange.only(1), Arrays.asList(2))));
        assertFalse(Validation.isValidKeyRange(Collections.emptyList()));
        assertFalse(Validation.isValidKeyRange(Arrays.asList(1, true)));
        assertFalse(Validation.isValidKeyRange(1));
        assertTrue(Validation.isValidQuery(1));
        assertFalse(Validation.isValidQuery(null));
    }
}
