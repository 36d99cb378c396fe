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
import com.shelfdb.transaction.CountOperation;
import com.shelfdb.transaction.GetOperation;

public class IndexImpl implements Index {

    final ObjectStoreImpl store;
    final String name;
    private final IndexDescriptor descriptor;

    IndexImpl(ObjectStoreImpl store, IndexDescriptor descriptor) {
        this.store = store;
        this.name = descriptor.getName();
        this.descriptor = descriptor;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getKeyPath() {
        return descriptor.getKeyPath().toString();
    }

    @Override
    public boolean isUnique() {
        return descriptor.isUnique();
    }

    @Override
    public boolean isMultiEntry() {
        return descriptor.isMultiEntry();
    }

    @Override
    public ObjectStore getObjectStore() {
        return store;
    }

    @Override
    public Request<Object> get(Object query) throws DatabaseException {
        ObjectStoreImpl.checkQuery(query, "get()");
        checkExists("get()");
        return store.transaction.request(this, new GetOperation(store.name, name, query));
    }

    @Override
    public Request<Long> count() throws DatabaseException {
        return count(null);
    }

    @Override
    public Request<Long> count(Object query) throws DatabaseException {
        ObjectStoreImpl.checkQuery(query, "count()");
        checkExists("count()");
        return store.transaction.request(this, new CountOperation(store.name, name, query));
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
        return store.openCursor(this, query, direction);
    }

    void checkExists(String method) throws InvalidStateException {
        if (store.checkState(method).getIndex(name) == null)
            throw new InvalidStateException(method + ": Index '" + name + "' does not exist");
    }

    @Override
    public String toString() {
        return "Index(" + store.name + "." + name + ")";
    }
}
