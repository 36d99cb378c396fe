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

package com.shelfdb.api.impl;

import com.shelfdb.api.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CursorTest extends ApiTestBase {

    private Database db;

    @BeforeEach
    public void setUpStores() throws Exception {
        db = open("cursors", 1, (d, tx) -> {
            d.createObjectStore("nums");
            ObjectStore people = d.createObjectStore("people", "id", false);
            people.createIndex("by_city", "city");
        });
        Transaction tx = db.transaction(Arrays.asList("nums", "people"), TransactionMode.READWRITE);
        ObjectStore nums = tx.objectStore("nums");
        for (int key : new int[]{3, 1, 2})
            nums.put("v" + key, key);
        ObjectStore people = tx.objectStore("people");
        people.put(map("id", 1, "city", "b"));
        people.put(map("id", 2, "city", "a"));
        people.put(map("id", 3, "city", "a"));
        people.put(map("id", 4));
        loop.drain();
        assertFalse(tx.isAborted());
    }

    /**
     * Walks a cursor to the end, collecting the primary keys it visits.
     */
    private List<Object> walk(Request<Cursor> request) {
        List<Object> keys = new ArrayList<>();
        request.addEventListener(Event.SUCCESS, e -> {
            Cursor cursor = request.getResult();
            if (cursor != null) {
                keys.add(cursor.getPrimaryKey());
                cursor.continueCursor();
            }
        });
        loop.drain();
        return keys;
    }

    @Test
    public void testStoreDirections() throws Exception {
        ObjectStore nums = db.transaction("nums").objectStore("nums");
        assertEquals(Arrays.asList(1, 2, 3), walk(nums.openCursor()));

        nums = db.transaction("nums").objectStore("nums");
        assertEquals(Arrays.asList(3, 2, 1), walk(nums.openCursor(null, Direction.PREV)));

        nums = db.transaction("nums").objectStore("nums");
        assertEquals(Arrays.asList(1, 2), walk(nums.openCursor(KeyRange.bound(1, 2))));

        nums = db.transaction("nums").objectStore("nums");
        assertEquals(Arrays.asList(3, 1), walk(nums.openCursor(Arrays.asList(3, 1), Direction.PREV)));
    }

    @Test
    public void testValuesAreCopies() throws Exception {
        ObjectStore people = db.transaction("people").objectStore("people");
        Request<Cursor> request = people.openCursor(2);
        loop.drain();
        Cursor cursor = request.getResult();
        assertEquals(2, cursor.getKey());
        assertEquals(2, cursor.getPrimaryKey());
        @SuppressWarnings("unchecked")
        Map<String, Object> value = (Map<String, Object>) cursor.getValue();
        assertEquals("a", value.get("city"));
        assertSame(people, cursor.getSource());
        assertSame(request, cursor.getRequest());
        assertEquals(Direction.NEXT, cursor.getDirection());
    }

    @Test
    public void testIndexCursor() throws Exception {
        Index cities = db.transaction("people").objectStore("people").index("by_city");
        Request<Cursor> request = cities.openCursor();
        List<String> seen = new ArrayList<>();
        request.addEventListener(Event.SUCCESS, e -> {
            Cursor cursor = request.getResult();
            if (cursor != null) {
                seen.add(cursor.getKey() + "=" + cursor.getPrimaryKey());
                assertSame(cities, cursor.getSource());
                cursor.continueCursor();
            }
        });
        loop.drain();
        assertEquals(Arrays.asList("a=2", "a=3", "b=1"), seen);

        Index byCity = db.transaction("people").objectStore("people").index("by_city");
        assertEquals(Arrays.asList(2, 1), walk(byCity.openCursor(null, Direction.NEXTUNIQUE)));
        byCity = db.transaction("people").objectStore("people").index("by_city");
        assertEquals(Arrays.asList(1, 3, 2), walk(byCity.openCursor(null, Direction.PREV)));
        byCity = db.transaction("people").objectStore("people").index("by_city");
        assertEquals(Arrays.asList(1, 2), walk(byCity.openCursor(null, Direction.PREVUNIQUE)));
        byCity = db.transaction("people").objectStore("people").index("by_city");
        assertEquals(Arrays.asList(2, 3), walk(byCity.openCursor("a")));
    }

    @Test
    public void testCursorSeesEarlierRequests() throws Exception {
        Transaction tx = db.transaction("nums", TransactionMode.READWRITE);
        ObjectStore nums = tx.objectStore("nums");
        nums.put("v0", 0);
        nums.delete(2);
        assertEquals(Arrays.asList(0, 1, 3), walk(nums.openCursor()));
    }

    @Test
    public void testAdvanceAndContinueToKey() throws Exception {
        Transaction tx = db.transaction("nums", TransactionMode.READWRITE);
        ObjectStore nums = tx.objectStore("nums");
        nums.put("v4", 4);
        nums.put("v5", 5);
        Request<Cursor> request = nums.openCursor();
        List<Object> keys = new ArrayList<>();
        request.addEventListener(Event.SUCCESS, e -> {
            Cursor cursor = request.getResult();
            if (cursor == null)
                return;
            keys.add(cursor.getKey());
            if (keys.size() == 1)
                cursor.continueCursor(4);
            else
                cursor.advance(2);
        });
        loop.drain();
        assertEquals(Arrays.asList(1, 4), keys);
        assertNull(request.getResult());
    }

    @Test
    public void testContinuePrimaryKey() throws Exception {
        Index byCity = db.transaction("people").objectStore("people").index("by_city");
        Request<Cursor> request = byCity.openCursor();
        List<Object> keys = new ArrayList<>();
        request.addEventListener(Event.SUCCESS, e -> {
            Cursor cursor = request.getResult();
            if (cursor == null)
                return;
            keys.add(cursor.getPrimaryKey());
            if (keys.size() == 1)
                cursor.continuePrimaryKey("z", 1);
            else
                cursor.continueCursor();
        });
        loop.drain();
        assertEquals(Arrays.asList(2, 1), keys);
    }

    @Test
    public void testPositioningRules() throws Exception {
        ObjectStore nums = db.transaction("nums").objectStore("nums");
        Request<Cursor> request = nums.openCursor();
        List<Class<?>> failures = new ArrayList<>();
        request.addEventListener(Event.SUCCESS, e -> {
            Cursor cursor = request.getResult();
            if (cursor == null)
                return;
            assertThrows(IllegalArgumentException.class, () -> cursor.advance(0));
            assertThrows(DataException.class, () -> cursor.continueCursor(true));
            cursor.continueCursor();
            assertEquals(ReadyState.PENDING, request.getReadyState());
            failures.add(assertThrows(InvalidStateException.class, cursor::continueCursor).getClass());
        });
        loop.drain();
        assertEquals(3, failures.size());
    }

    @Test
    public void testExhaustedCursor() throws Exception {
        ObjectStore nums = db.transaction("nums").objectStore("nums");
        Request<Cursor> request = nums.openCursor(3);
        List<Cursor> cursors = new ArrayList<>();
        request.addEventListener(Event.SUCCESS, e -> {
            Cursor cursor = request.getResult();
            if (cursor != null) {
                cursors.add(cursor);
                cursor.continueCursor();
            }
        });
        loop.drain();
        assertNull(request.getResult());
        Cursor cursor = cursors.get(0);
        assertNull(cursor.getKey());
        assertNull(cursor.getPrimaryKey());
        assertNull(cursor.getValue());
        assertThrows(InvalidStateException.class, cursor::continueCursor);
        assertThrows(InvalidStateException.class, () -> cursor.update("x"));

        Request<Cursor> empty = db.transaction("nums").objectStore("nums").openCursor(99);
        loop.drain();
        assertNull(empty.getResult());
    }

    @Test
    public void testUpdateAndDelete() throws Exception {
        Transaction tx = db.transaction(Arrays.asList("nums", "people"), TransactionMode.READWRITE);
        Request<Cursor> numbers = tx.objectStore("nums").openCursor();
        numbers.addEventListener(Event.SUCCESS, e -> {
            Cursor cursor = numbers.getResult();
            if (cursor == null)
                return;
            if (cursor.getPrimaryKey().equals(2))
                cursor.delete();
            else
                cursor.update(cursor.getValue() + "!");
            cursor.continueCursor();
        });
        Request<Cursor> people = tx.objectStore("people").openCursor(1);
        people.addEventListener(Event.SUCCESS, e -> {
            Cursor cursor = people.getResult();
            if (cursor == null)
                return;
            assertThrows(DataException.class, () -> cursor.update(map("id", 9, "city", "c")));
            cursor.update(map("id", 1, "city", "c"));
        });
        loop.drain();
        assertFalse(tx.isAborted());

        Transaction check = db.transaction(Arrays.asList("nums", "people"), TransactionMode.READONLY);
        assertEquals(Arrays.asList(1, 3), walk(check.objectStore("nums").openCursor()));
        check = db.transaction(Arrays.asList("nums", "people"), TransactionMode.READONLY);
        Request<Object> one = check.objectStore("nums").get(1);
        Request<Object> person = check.objectStore("people").get(1);
        loop.drain();
        assertEquals("v1!", one.getResult());
        assertEquals("c", ((Map<?, ?>) person.getResult()).get("city"));
    }

    @Test
    public void testReadOnlyCursorCannotWrite() throws Exception {
        Request<Cursor> request = db.transaction("nums").objectStore("nums").openCursor();
        List<Class<?>> failures = new ArrayList<>();
        request.addEventListener(Event.SUCCESS, e -> {
            Cursor cursor = request.getResult();
            if (cursor != null && failures.isEmpty()) {
                failures.add(assertThrows(ReadOnlyException.class, () -> cursor.update("x")).getClass());
                failures.add(assertThrows(ReadOnlyException.class, cursor::delete).getClass());
            }
        });
        loop.drain();
        assertEquals(2, failures.size());
    }

    @Test
    public void testDeleteNullValuedRecord() throws Exception {
        Transaction tx = db.transaction("nums", TransactionMode.READWRITE);
        ObjectStore nums = tx.objectStore("nums");
        nums.put(null, 5);
        Request<Cursor> request = nums.openCursor(5);
        List<Request<Void>> deletes = new ArrayList<>();
        request.addEventListener(Event.SUCCESS, e -> {
            Cursor cursor = request.getResult();
            assertNotNull(cursor);
            assertNull(cursor.getValue());
            deletes.add(cursor.delete());
        });
        loop.drain();

        assertFalse(tx.isAborted());
        assertEquals(1, deletes.size());
        assertNull(deletes.get(0).getError());

        Request<Long> count = db.transaction("nums").objectStore("nums").count(5);
        loop.drain();
        assertEquals(0L, count.getResult());
    }
}
