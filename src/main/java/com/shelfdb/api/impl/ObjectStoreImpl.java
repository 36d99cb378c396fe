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
import com.shelfdb.core.IndexDescriptor;
import com.shelfdb.core.KeyPath;
import com.shelfdb.core.StoreDescriptor;
import com.shelfdb.transaction.ClearOperation;
import com.shelfdb.transaction.CountOperation;
import com.shelfdb.transaction.DeleteOperation;
import com.shelfdb.transaction.GetOperation;
import com.shelfdb.transaction.PutOperation;
import com.shelfdb.util.Validation;
import com.shelfdb.util.ValueCloner;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ObjectStoreImpl implements ObjectStore {

    final TransactionImpl transaction;
    final String name;
    final KeyPath keyPath;
    final boolean autoIncrement;
    private final Map<String, IndexImpl> indexes = new HashMap<>();

    ObjectStoreImpl(TransactionImpl transaction, String name) {
        StoreDescriptor sd = transaction.getStore(name);
        this.transaction = transaction;
        this.name = name;
        this.keyPath = sd.getKeyPath();
        this.autoIncrement = sd.isAutoIncrement();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getKeyPath() {
        return keyPath == null ? null : keyPath.toString();
    }

    @Override
    public boolean isAutoIncrement() {
        return autoIncrement;
    }

    @Override
    public List<String> getIndexNames() {
        StoreDescriptor sd = transaction.getStore(name);
        return sd == null ? Collections.emptyList() : sd.getIndexNames();
    }

    @Override
    public Transaction getTransaction() {
        return transaction;
    }

    @Override
    public Request<Object> put(Object value) throws DatabaseException {
        return store(value, null, false, "put()");
    }

    @Override
    public Request<Object> put(Object value, Object key) throws DatabaseException {
        return store(value, key, false, "put()");
    }

    @Override
    public Request<Object> add(Object value) throws DatabaseException {
        return store(value, null, true, "add()");
    }

    @Override
    public Request<Object> add(Object value, Object key) throws DatabaseException {
        return store(value, key, true, "add()");
    }

    private Request<Object> store(Object value, Object key, boolean noOverwrite, String method)
            throws DatabaseException {
        if (keyPath != null) {
            if (!(value instanceof Map))
                throw new DataException(method + ": value must be a map for object stores where a keyPath is set");
            if (key != null)
                throw new DataException(method + ": key parameter cannot be set (use value." + keyPath + " instead)");
            key = keyPath.evaluate(value);
            if (key != null && !Validation.isValidKey(key))
                throw new DataException(method + ": inline key (value." + keyPath + ") must be a valid key (number, string, date)");
            if (key == null && !autoIncrement)
                throw new DataException(method + ": inline key (value." + keyPath + ") must be set (object store does not autoincrement)");
        } else {
            if (key != null && !Validation.isValidKey(key))
                throw new DataException(method + ": key parameter must be a valid key (number, string, date)");
            if (key == null && !autoIncrement)
                throw new DataException(method + ": key parameter must be set (object store does not autoincrement)");
        }

        checkState(method);
        if (transaction.mode == TransactionMode.READONLY)
            throw new ReadOnlyException(method + ": Transaction is read only");

        Object copy;
        try {
            copy = ValueCloner.clone(value);
        } catch (DataCloneException e) {
            throw new DataCloneException(method + ": value must be a JSON-like value", e);
        }
        return transaction.request(this, new PutOperation(name, copy, key, noOverwrite));
    }

    @Override
    public Request<Object> get(Object query) throws DatabaseException {
        checkQuery(query, "get()");
        checkState("get()");
        return transaction.request(this, new GetOperation(name, null, query));
    }

    @Override
    public Request<Long> count() throws DatabaseException {
        return count(null);
    }

    @Override
    public Request<Long> count(Object query) throws DatabaseException {
        checkQuery(query, "count()");
        checkState("count()");
        return transaction.request(this, new CountOperation(name, null, query));
    }

    @Override
    public Request<Void> delete(Object query) throws DatabaseException {
        if (!Validation.isValidQuery(query))
            throw new DataException("delete(): query must be a valid key (number, string, date) or key range");
        if (transaction.mode == TransactionMode.READONLY)
            throw new ReadOnlyException("delete(): Transaction is read only");
        checkState("delete()");
        return transaction.request(this, new DeleteOperation(name, query));
    }

    @Override
    public Request<Void> clear() throws DatabaseException {
        checkState("clear()");
        if (transaction.mode == TransactionMode.READONLY)
            throw new ReadOnlyException("clear(): Transaction is read only");
        return transaction.request(this, new ClearOperation(name));
    }

    @Override
    public Index index(String indexName) throws DatabaseException {
        if (!Validation.isValidIdentifier(indexName))
            throw new IllegalArgumentException("index(): name must be a valid identifier: " + indexName);
        StoreDescriptor sd = checkState("index()");
        IndexDescriptor id = sd.getIndex(indexName);
        if (id == null)
            throw new NotFoundException("index(): Index '" + indexName + "' does not exist");

        IndexImpl index = indexes.get(indexName);
        if (index == null) {
            index = new IndexImpl(this, id);
            indexes.put(indexName, index);
        }
        return index;
    }

    @Override
    public Index createIndex(String indexName, String indexKeyPath) throws DatabaseException {
        return createIndex(indexName, indexKeyPath, false, false);
    }

    @Override
    public Index createIndex(String indexName, String indexKeyPath, boolean unique, boolean multiEntry)
            throws DatabaseException {
        if (!Validation.isValidIdentifier(indexName))
            throw new IllegalArgumentException("createIndex(): name must be a valid identifier: " + indexName);
        KeyPath kp = KeyPath.of(indexKeyPath);
        StoreDescriptor sd = checkState("createIndex()");
        checkVersionChange("createIndex()");
        if (sd.getIndex(indexName) != null)
            throw new ConstraintException("createIndex(): Index '" + indexName + "' already exists");
        sd.addIndex(new IndexDescriptor(indexName, kp, unique, multiEntry));
        return index(indexName);
    }

    @Override
    public void deleteIndex(String indexName) throws DatabaseException {
        if (!Validation.isValidIdentifier(indexName))
            throw new IllegalArgumentException("deleteIndex(): name must be a valid identifier: " + indexName);
        StoreDescriptor sd = checkState("deleteIndex()");
        checkVersionChange("deleteIndex()");
        if (sd.getIndex(indexName) == null)
            throw new NotFoundException("deleteIndex(): Index '" + indexName + "' does not exist");
        sd.removeIndex(indexName);
        indexes.remove(indexName);
    }

    @Override
    public Request<Cursor> openCursor() throws DatabaseException {
        return openCursor(null, Direction.NEXT);
    }

    @Override
    public Request<Cursor> openCursor(Object query) throws DatabaseException {
        return openCursor(query, Direction.NEXT);
    }

    @Override
    public Request<Cursor> openCursor(Object query, Direction direction) throws DatabaseException {
        return openCursor(null, query, direction);
    }

    Request<Cursor> openCursor(IndexImpl index, Object query, Direction direction) throws DatabaseException {
        if (direction == null)
            throw new IllegalArgumentException("openCursor(): direction must be set");
        checkQuery(query, "openCursor()");
        checkState("openCursor()");
        if (index != null)
            index.checkExists("openCursor()");
        OpenCursorOperation operation = new OpenCursorOperation(this, index, query, direction);
        RequestImpl<Cursor> request = transaction.request(index != null ? index : this, operation);
        operation.bind(request);
        return request;
    }

    /**
     * Checks that the transaction is still live and this store still exists.
     *
     * @return the store as the transaction currently sees it
     */
    StoreDescriptor checkState(String method) throws InvalidStateException {
        if (transaction.isFinished())
            throw new InvalidStateException(method + ": Transaction has finished");
        StoreDescriptor sd = transaction.getStore(name);
        if (sd == null)
            throw new InvalidStateException(method + ": Object store '" + name + "' does not exist");
        return sd;
    }

    private void checkVersionChange(String method) throws InvalidStateException {
        if (transaction.mode != TransactionMode.VERSIONCHANGE || !transaction.isRunning())
            throw new InvalidStateException(method + ": Can only be used within an active 'versionchange' transaction");
    }

    static void checkQuery(Object query, String method) throws DataException {
        if (query != null && !Validation.isValidQuery(query))
            throw new DataException(method + ": query must be a valid key (number, string, date), key range, or null");
    }

    @Override
    public String toString() {
        return "ObjectStore(" + name + ")";
    }
}
