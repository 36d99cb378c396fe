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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueClonerTest {

    @Test
    public void testDeepCopy() throws Exception {
        Map<String, Object> inner = new HashMap<>();
        inner.put("tags", new ArrayList<>(Arrays.asList("a", "b")));
        Map<String, Object> value = new HashMap<>();
        value.put("name", "pen");
        value.put("price", 1.5);
        value.put("stock", null);
        value.put("active", true);
        value.put("meta", inner);

        Object copy = ValueCloner.clone(value);
        assertEquals(value, copy);
        assertNotSame(value, copy);
        assertNotSame(inner, ((Map<?, ?>) copy).get("meta"));

        inner.put("extra", 1);
        assertFalse(((Map<?, ?>) ((Map<?, ?>) copy).get("meta")).containsKey("extra"));
    }

    @Test
    public void testOpaqueBlobIsShared() throws Exception {
        byte[] blob = {1, 2, 3};
        List<Object> value = new ArrayList<>();
        value.add(blob);
        List<?> copy = (List<?>) ValueCloner.clone(value);
        assertSame(blob, copy.get(0));
    }

    @Test
    public void testRejected() {
        assertThrows(DataCloneException.class, () -> ValueCloner.clone(Double.NaN));
        assertThrows(DataCloneException.class,
                     () -> ValueCloner.clone(Arrays.asList(1, Double.NEGATIVE_INFINITY)));

        Map<Object, Object> nonStringKey = new HashMap<>();
        nonStringKey.put(1, "one");
        assertThrows(DataCloneException.class, () -> ValueCloner.clone(nonStringKey));

        List<Object> cyclic = new ArrayList<>();
        cyclic.add(cyclic);
        assertThrows(DataCloneException.class, () -> ValueCloner.clone(cyclic));
    }

    @Test
    public void testSharedNonCyclicStructure() throws Exception {
        List<Object> shared = new ArrayList<>(Arrays.asList(1, 2));
        List<Object> value = new ArrayList<>();
        value.add(shared);
        value.add(shared);
        List<?> copy = (List<?>) ValueCloner.clone(value);
        assertEquals(value, copy);
    }
}
