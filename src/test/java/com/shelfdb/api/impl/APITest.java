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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class APITest extends ApiTestBase {

    @Test
    public void testPutGetAcrossTransactions() throws Exception {
        Database db = openShop();
        Map<String, Object> pen = map("name", "pen", "tags", new ArrayList<>(Arrays.asList("blue")));

        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        Request<Object> put = tx.objectStore("items").put(pen);
        loop.drain();
        assertEquals(1L, put.getResult());
        assertTrue(tx.isFinished());
        assertFalse(tx.isAborted());
        assertNull(tx.getError());

        // the caller's structure is not aliased
        pen.put("name", "changed");
        assertFalse(pen.containsKey("id"));

        Transaction read = db.transaction("items");
        Request<Object> get = read.objectStore("items").get(1);
        Request<Object> again = read.objectStore("items").get(1);
        loop.drain();
        assertEquals(map("id", 1L, "name", "pen", "tags", Arrays.asList("blue")), get.getResult());
        assertEquals(get.getResult(), again.getResult());
        assertNotSame(get.getResult(), again.getResult());
    }

    @Test
    public void testResultNotReadableWhilePending() throws Exception {
        Database db = openShop();
        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        Request<Object> put = tx.objectStore("items").add(map("name", "pen"));
        assertEquals(ReadyState.PENDING, put.getReadyState());
        assertThrows(InvalidStateException.class, put::getResult);
        assertThrows(InvalidStateException.class, put::getError);
        assertThrows(InvalidStateException.class, tx::getError);
        assertSame(tx, put.getTransaction());
        assertSame(tx.objectStore("items"), put.getSource());
        loop.drain();
        assertEquals(ReadyState.DONE, put.getReadyState());
    }

    @Test
    public void testAbortLeavesStoreUnchanged() throws Exception {
        Database db = openShop();
        Transaction setup = db.transaction("items", TransactionMode.READWRITE);
        for (String name : Arrays.asList("pen", "ink", "pad"))
            setup.objectStore("items").add(map("name", name));
        loop.drain();

        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        ObjectStore items = tx.objectStore("items");
        items.put(map("name", "cap"));
        items.delete(1);
        Request<Object> last = items.put(map("id", 2, "name", "quill"));
        last.addEventListener(Event.SUCCESS, e -> tx.abort());
        List<String> events = new ArrayList<>();
        tx.addEventListener(Event.ABORT, e -> events.add(e.getType()));
        tx.addEventListener(Event.COMPLETE, e -> events.add(e.getType()));
        loop.drain();

        assertTrue(tx.isAborted());
        assertNull(tx.getError());
        assertEquals(Collections.singletonList(Event.ABORT), events);
        assertThrows(InvalidStateException.class, tx::abort);

        Transaction check = db.transaction("items");
        Request<Long> count = check.objectStore("items").count();
        Request<Object> two = check.objectStore("items").get(2);
        loop.drain();
        assertEquals(3L, count.getResult());
        assertEquals("ink", ((Map<?, ?>) two.getResult()).get("name"));
    }

    @Test
    public void testAbortBeforeRunFailsQueuedRequests() throws Exception {
        Database db = openShop();
        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        Request<Object> put = tx.objectStore("items").put(map("name", "pen"));
        List<DatabaseException> errors = new ArrayList<>();
        put.addEventListener(Event.ERROR, e -> errors.add(put.getError()));
        tx.abort();
        assertThrows(InvalidStateException.class, () -> tx.objectStore("items"));
        loop.drain();

        assertEquals(1, errors.size());
        assertTrue(errors.get(0) instanceof AbortException);
        assertEquals("AbortError", errors.get(0).getErrorName());
        assertNull(put.getResult());
    }

    @Test
    public void testAddVersusPut() throws Exception {
        Database db = open("notes", 1, (d, tx) -> d.createObjectStore("notes"));
        Transaction tx = db.transaction("notes", TransactionMode.READWRITE);
        tx.objectStore("notes").add("first", "k");
        loop.drain();

        Transaction dup = db.transaction("notes", TransactionMode.READWRITE);
        Request<Object> add = dup.objectStore("notes").add("second", "k");
        List<Event> bubbled = new ArrayList<>();
        db.addEventListener(Event.ERROR, bubbled::add);
        loop.drain();
        assertTrue(add.getError() instanceof ConstraintException);
        assertTrue(dup.isAborted());
        assertSame(add.getError(), dup.getError());
        assertEquals(1, bubbled.size());
        assertSame(add, bubbled.get(0).getTarget());

        Transaction put = db.transaction("notes", TransactionMode.READWRITE);
        Request<Object> overwrite = put.objectStore("notes").put("second", "k");
        Request<Object> get = put.objectStore("notes").get("k");
        loop.drain();
        assertEquals("k", overwrite.getResult());
        assertEquals("second", get.getResult());
        assertFalse(put.isAborted());
    }

    @Test
    public void testPreventDefaultKeepsTransactionAlive() throws Exception {
        Database db = open("notes", 1, (d, tx) -> d.createObjectStore("notes"));
        Transaction setup = db.transaction("notes", TransactionMode.READWRITE);
        setup.objectStore("notes").add("first", 1);
        loop.drain();

        Transaction tx = db.transaction("notes", TransactionMode.READWRITE);
        tx.addEventListener(Event.ERROR, Event::preventDefault);
        Request<Object> add = tx.objectStore("notes").add("again", 1);
        Request<Object> next = tx.objectStore("notes").add("second", 2);
        loop.drain();

        assertTrue(add.getError() instanceof ConstraintException);
        assertEquals(2, next.getResult());
        assertFalse(tx.isAborted());
        assertNull(tx.getError());
    }

    @Test
    public void testListenerFailureAbortsTransaction() throws Exception {
        Database db = openShop();
        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        Request<Object> put = tx.objectStore("items").put(map("name", "pen"));
        put.addEventListener(Event.SUCCESS, e -> {
            throw new IllegalStateException("listener bug");
        });
        loop.drain();
        assertTrue(tx.isAborted());
        assertTrue(tx.getError().getCause() instanceof IllegalStateException);
    }

    @Test
    public void testDeleteMissingAndClearEmptyAreNoOps() throws Exception {
        Database db = openShop();
        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        Request<Void> delete = tx.objectStore("items").delete(12345);
        Request<Void> range = tx.objectStore("items").delete(KeyRange.lowerBound(0));
        Request<Void> clear = tx.objectStore("items").clear();
        loop.drain();
        assertNull(delete.getError());
        assertNull(range.getError());
        assertNull(clear.getError());
        assertFalse(tx.isAborted());
    }

    @Test
    public void testDeleteByRangeAndList() throws Exception {
        Database db = open("nums", 1, (d, tx) -> d.createObjectStore("nums"));
        Transaction tx = db.transaction("nums", TransactionMode.READWRITE);
        for (int i = 1; i <= 6; i++)
            tx.objectStore("nums").put("v" + i, i);
        tx.objectStore("nums").delete(KeyRange.bound(2, 3));
        tx.objectStore("nums").delete(Arrays.asList(5, 99));
        Request<Long> count = tx.objectStore("nums").count();
        Request<Long> high = tx.objectStore("nums").count(KeyRange.lowerBound(4));
        loop.drain();
        assertEquals(3L, count.getResult());
        assertEquals(2L, high.getResult());
    }

    @Test
    public void testKeyValidation() throws Exception {
        Database db = openShop();
        Database plain = open("plain", 1, (d, tx) -> d.createObjectStore("things"));
        ObjectStore items = db.transaction("items", TransactionMode.READWRITE).objectStore("items");
        ObjectStore things = plain.transaction("things", TransactionMode.READWRITE).objectStore("things");

        assertThrows(DataException.class, () -> items.put("not a map"));
        assertThrows(DataException.class, () -> items.put(map("name", "pen"), 1));
        assertThrows(DataException.class, () -> items.put(map("id", true)));
        assertThrows(DataException.class, () -> things.put("value"));
        assertThrows(DataException.class, () -> things.put("value", Double.NaN));
        assertThrows(DataCloneException.class, () -> things.put(map("x", Double.POSITIVE_INFINITY), 1));
        assertThrows(DataException.class, () -> things.get(true));
        assertThrows(DataException.class, () -> things.delete(null));
        assertThrows(DataException.class, () -> things.count(Collections.emptyList()));
        loop.drain();
    }

    @Test
    public void testReadOnly() throws Exception {
        Database db = openShop();
        Transaction tx = db.transaction(Collections.singletonList("items"), TransactionMode.READONLY);
        ObjectStore items = tx.objectStore("items");
        assertThrows(ReadOnlyException.class, () -> items.put(map("name", "pen")));
        assertThrows(ReadOnlyException.class, () -> items.add(map("name", "pen")));
        assertThrows(ReadOnlyException.class, () -> items.delete(1));
        assertThrows(ReadOnlyException.class, items::clear);
        assertEquals("ReadOnlyError",
                     assertThrows(ReadOnlyException.class, items::clear).getErrorName());
        loop.drain();
        assertTrue(tx.isFinished());
    }

    @Test
    public void testTransactionArguments() throws Exception {
        Database db = openShop();
        assertThrows(IllegalArgumentException.class,
                     () -> db.transaction(Collections.emptyList(), TransactionMode.READONLY));
        assertThrows(IllegalArgumentException.class, () -> db.transaction("Items"));
        assertThrows(IllegalArgumentException.class, () -> db.transaction("items", TransactionMode.VERSIONCHANGE));
        assertThrows(NotFoundException.class, () -> db.transaction("missing"));

        Transaction tx = db.transaction("items");
        assertEquals(TransactionMode.READONLY, tx.getMode());
        assertSame(db, tx.getDatabase());
        assertEquals(Collections.singletonList("items"), tx.getObjectStoreNames());
        assertSame(tx.objectStore("items"), tx.objectStore("items"));
        assertThrows(IllegalArgumentException.class, () -> tx.objectStore("Bad"));
        assertThrows(NotFoundException.class, () -> tx.objectStore("other"));
        loop.drain();

        assertThrows(InvalidStateException.class, () -> tx.objectStore("items"));
    }

    @Test
    public void testStoreHandleAfterFinish() throws Exception {
        Database db = openShop();
        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        ObjectStore items = tx.objectStore("items");
        loop.drain();
        assertTrue(tx.isFinished());
        assertThrows(InvalidStateException.class, () -> items.put(map("name", "late")));
        assertThrows(InvalidStateException.class, () -> items.get(1));
        assertThrows(InvalidStateException.class, items::count);
        assertThrows(InvalidStateException.class, items::openCursor);
    }

    @Test
    public void testTransactionsRunInRequestOrder() throws Exception {
        Database db = openShop();
        List<String> log = new ArrayList<>();
        Transaction first = db.transaction("items", TransactionMode.READWRITE);
        Transaction second = db.transaction("items");
        first.objectStore("items").put(map("name", "pen"));
        Request<Long> count = second.objectStore("items").count();
        first.addEventListener(Event.COMPLETE, e -> log.add("first"));
        second.addEventListener(Event.COMPLETE, e -> log.add("second"));
        assertEquals(1, loop.runPending());
        assertEquals(Arrays.asList("first", "second"), log);
        assertEquals(1L, count.getResult());
    }

    @Test
    public void testRequestsQueuedFromListenersRunInSameTransaction() throws Exception {
        Database db = openShop();
        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        ObjectStore items = tx.objectStore("items");
        Request<Object> put = items.put(map("name", "pen"));
        List<Object> seen = new ArrayList<>();
        put.addEventListener(Event.SUCCESS, e -> {
            Request<Object> get = items.get(put.getResult());
            get.addEventListener(Event.SUCCESS, e2 -> seen.add(get.getResult()));
        });
        loop.drain();
        assertEquals(Collections.singletonList(map("name", "pen", "id", 1L)), seen);
        assertFalse(tx.isAborted());
    }

    @Test
    public void testConnectionsShareCommittedData() throws Exception {
        Database first = openShop();
        Database second = open("shop", 1, null);
        Transaction tx = first.transaction("items", TransactionMode.READWRITE);
        tx.objectStore("items").put(map("name", "pen"));
        loop.drain();

        Request<Long> count = second.transaction("items").objectStore("items").count();
        loop.drain();
        assertEquals(1L, count.getResult());
    }

    @Test
    public void testClose() throws Exception {
        Database db = openShop();
        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        tx.objectStore("items").put(map("name", "pen"));
        List<String> events = new ArrayList<>();
        db.addEventListener(Event.CLOSE, e -> events.add(e.getType()));

        db.close();
        // queued transactions run before the connection closes
        assertTrue(tx.isFinished());
        assertTrue(db.isClosed());
        assertEquals(Collections.singletonList(Event.CLOSE), events);
        assertThrows(InvalidStateException.class, () -> db.transaction("items"));

        db.close();
        assertEquals(1, events.size());
        assertFalse(loop.hasPending());
    }

    @Test
    public void testIndexLookups() throws Exception {
        Database db = openShop();
        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        ObjectStore items = tx.objectStore("items");
        items.put(map("name", "pen", "price", 3));
        items.put(map("name", "ink", "price", 1));
        items.put(map("name", "pen", "price", 2));
        items.put(map("price", 9));
        Index byName = items.index("by_name");
        Request<Object> pen = byName.get("pen");
        Request<Long> pens = byName.count("pen");
        Request<Long> named = byName.count();
        Request<Object> first = byName.get(null);
        loop.drain();

        assertEquals(1L, ((Map<?, ?>) pen.getResult()).get("id"));
        assertEquals(2L, pens.getResult());
        assertEquals(3L, named.getResult());
        assertEquals("ink", ((Map<?, ?>) first.getResult()).get("name"));
        assertSame(items, byName.getObjectStore());
        assertEquals("name", byName.getKeyPath());
        assertFalse(byName.isUnique());
        assertFalse(byName.isMultiEntry());
    }

    @Test
    public void testMissingIndex() throws Exception {
        Database db = openShop();
        ObjectStore items = db.transaction("items").objectStore("items");
        assertThrows(NotFoundException.class, () -> items.index("by_price"));
        assertEquals(Collections.singletonList("by_name"), items.getIndexNames());
        assertEquals("id", items.getKeyPath());
        assertTrue(items.isAutoIncrement());
        assertThrows(InvalidStateException.class, () -> items.createIndex("by_price", "price"));
        assertThrows(InvalidStateException.class, () -> db.createObjectStore("other"));
        loop.drain();
    }

    @Test
    public void testExplicitKeysAdvanceGenerator() throws Exception {
        Database db = openShop();
        Transaction tx = db.transaction("items", TransactionMode.READWRITE);
        ObjectStore items = tx.objectStore("items");
        items.put(map("id", 10, "name", "pen"));
        Request<Object> generated = items.put(map("name", "ink"));
        loop.drain();
        assertEquals(11L, generated.getResult());
    }

    @Test
    public void testLargeLongKeysAreDistinct() throws Exception {
        Database db = open("notes", 1, (d, tx) -> d.createObjectStore("notes"));
        Transaction tx = db.transaction("notes", TransactionMode.READWRITE);
        ObjectStore notes = tx.objectStore("notes");
        notes.add("a", 9007199254740992L);
        Request<Object> second = notes.add("b", 9007199254740993L);
        Request<Long> count = notes.count();
        loop.drain();

        assertNull(second.getError());
        assertFalse(tx.isAborted());
        assertEquals(2L, count.getResult());
    }

    @Test
    public void testNegativeZeroMatchesZero() throws Exception {
        Database db = open("notes", 1, (d, tx) -> d.createObjectStore("notes"));
        Transaction tx = db.transaction("notes", TransactionMode.READWRITE);
        ObjectStore notes = tx.objectStore("notes");
        notes.put("zero", 0);
        Request<Object> get = notes.get(-0.0);
        Request<Long> count = notes.count(-0.0);
        loop.drain();

        assertEquals("zero", get.getResult());
        assertEquals(1L, count.getResult());
    }

    @Test
    public void testGeneratedKeyAtNestedPath() throws Exception {
        Database db = open("notes", 1, (d, tx) -> d.createObjectStore("notes", "meta.id", true));
        Transaction tx = db.transaction("notes", TransactionMode.READWRITE);
        Request<Object> put = tx.objectStore("notes").put(map("name", "pen"));
        loop.drain();
        assertNull(put.getError());
        assertEquals(1L, put.getResult());

        Transaction read = db.transaction("notes");
        Request<Object> get = read.objectStore("notes").get(1);
        loop.drain();
        assertEquals(map("name", "pen", "meta", map("id", 1L)), get.getResult());
    }
}
