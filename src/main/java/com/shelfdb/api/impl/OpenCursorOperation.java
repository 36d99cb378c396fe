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

import com.shelfdb.access.KeySequence;
import com.shelfdb.api.Cursor;
import com.shelfdb.api.DatabaseException;
import com.shelfdb.api.Direction;
import com.shelfdb.core.KeyPath;
import com.shelfdb.core.StoreDescriptor;
import com.shelfdb.transaction.Operation;
import com.shelfdb.transaction.WorkingSet;

/**
 * Builds a cursor from the records the transaction sees when the request
 * first runs, and positions it on the first of them.
 */
class OpenCursorOperation extends Operation<Cursor> {

    private final ObjectStoreImpl store;
    private final IndexImpl index;
    private final Object query;
    private final Direction direction;
    private RequestImpl<Cursor> request;

    OpenCursorOperation(ObjectStoreImpl store, IndexImpl index, Object query, Direction direction) {
        super(Type.OPEN_CURSOR);
        this.store = store;
        this.index = index;
        this.query = query;
        this.direction = direction;
    }

    void bind(RequestImpl<Cursor> request) {
        this.request = request;
    }

    @Override
    public Cursor execute(WorkingSet workingSet) throws DatabaseException {
        StoreDescriptor sd = workingSet.requireStore(store.name);
        KeyPath indexKeyPath = index == null ? null : workingSet.requireIndex(store.name, index.name).getKeyPath();
        KeySequence sequence = KeySequence.build(sd.getRecords(), indexKeyPath, query, direction);
        CursorImpl cursor = new CursorImpl(request, index != null ? index : store, store, direction, sequence);
        cursor.step();
        return cursor.load(workingSet) ? cursor : null;
    }
}
