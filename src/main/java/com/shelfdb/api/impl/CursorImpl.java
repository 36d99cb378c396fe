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

import com.shelfdb.access.KeyComparator;
import com.shelfdb.access.KeyMatcher;
import com.shelfdb.access.KeySequence;
import com.shelfdb.api.*;
import com.shelfdb.transaction.Operation;
import com.shelfdb.transaction.WorkingSet;
import com.shelfdb.util.Validation;
import com.shelfdb.util.ValueCloner;

public class CursorImpl implements Cursor {

    private final RequestImpl<Cursor> request;
    private final Object source;
    private final ObjectStoreImpl store;
    private final Direction direction;
    private final KeySequence sequence;
    private final Operation<Cursor> continuation = new Continuation();
    private Object key;
    private Object primaryKey;
    private Object value;
    private boolean loaded;

    CursorImpl(RequestImpl<Cursor> request, Object source, ObjectStoreImpl store, Direction direction,
               KeySequence sequence) {
        this.request = request;
        this.source = source;
        this.store = store;
        this.direction = direction;
        this.sequence = sequence;
    }

    @Override
    public Object getSource() {
        return source;
    }

    @Override
    public Direction getDirection() {
        return direction;
    }

    @Override
    public Request<Cursor> getRequest() {
        return request;
    }

    @Override
    public Object getKey() {
        return key;
    }

    @Override
    public Object getPrimaryKey() {
        return primaryKey;
    }

    @Override
    public Object getValue() {
        return value;
    }

    @Override
    public void continueCursor() throws DatabaseException {
        continueCursor(null);
    }

    @Override
    public void continueCursor(Object targetKey) throws DatabaseException {
        if (targetKey != null && !Validation.isValidQuery(targetKey))
            throw new DataException("continue(): target must be a valid key (number, string, date) or key range");
        checkPositionable("continue()");
        step();
        while (primaryKey != null && targetKey != null && !KeyMatcher.matches(key, targetKey))
            step();
        request.rerun(continuation);
    }

    @Override
    public void continuePrimaryKey(Object targetKey, Object targetPrimaryKey) throws DatabaseException {
        if (!Validation.isValidQuery(targetKey) || !Validation.isValidQuery(targetPrimaryKey))
            throw new DataException("continuePrimaryKey(): targets must be valid keys (number, string, date) or key ranges");
        checkPositionable("continuePrimaryKey()");
        step();
        while (primaryKey != null && !KeyMatcher.matches(key, targetKey)
                && !KeyMatcher.matches(primaryKey, targetPrimaryKey))
            step();
        request.rerun(continuation);
    }

    @Override
    public void advance(long count) throws DatabaseException {
        if (count < 1)
            throw new IllegalArgumentException("advance(): count must be 1 or more");
        checkPositionable("advance()");
        for (long i = 0; i < count && primaryKey != null; i++)
            step();
        request.rerun(continuation);
    }

    @Override
    public Request<Object> update(Object newValue) throws DatabaseException {
        if (!loaded)
            throw new InvalidStateException("update(): Cursor is not positioned on a record");
        if (store.keyPath != null) {
            Object k = store.keyPath.evaluate(newValue);
            if (!Validation.isValidKey(k) || !KeyComparator.INSTANCE.equal(k, primaryKey))
                throw new DataException("update(): value." + store.keyPath + " must match the cursor's primary key");
            return store.put(newValue);
        }
        return store.put(newValue, primaryKey);
    }

    @Override
    public Request<Void> delete() throws DatabaseException {
        if (!loaded)
            throw new InvalidStateException("delete(): Cursor is not positioned on a record");
        return store.delete(primaryKey);
    }

    /**
     * Moves to the next entry of the sequence. The value is loaded when the
     * request next runs.
     */
    void step() {
        KeySequence.Entry entry = sequence.next();
        key = entry == null ? null : entry.getKey();
        primaryKey = entry == null ? null : entry.getPrimaryKey();
        value = null;
        loaded = false;
    }

    /**
     * Loads a copy of the value at the current position.
     *
     * @return false if the cursor has moved past the last entry
     */
    boolean load(WorkingSet workingSet) throws DatabaseException {
        if (primaryKey == null)
            return false;
        value = ValueCloner.clone(workingSet.requireStore(store.name).getRecords().get(primaryKey));
        loaded = true;
        return true;
    }

    private void checkPositionable(String method) throws InvalidStateException {
        if (request.getReadyState() != ReadyState.DONE)
            throw new InvalidStateException(method + ": Cursor request is still pending");
        if (primaryKey == null)
            throw new InvalidStateException(method + ": Cursor has moved past the last record");
        store.checkState(method);
    }

    private class Continuation extends Operation<Cursor> {
        Continuation() {
            super(Type.CURSOR_CONTINUATION);
        }

        @Override
        public Cursor execute(WorkingSet workingSet) throws DatabaseException {
            return load(workingSet) ? CursorImpl.this : null;
        }
    }

    @Override
    public String toString() {
        return "Cursor(" + source + ", " + direction + ", " + key + ")";
    }
}
