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

package com.shelfdb.transaction;

import com.shelfdb.access.KeySequence;
import com.shelfdb.api.DatabaseException;
import com.shelfdb.api.Direction;
import com.shelfdb.core.KeyPath;
import com.shelfdb.core.StoreDescriptor;
import com.shelfdb.util.ValueCloner;

/**
 * Fetches a copy of the value of the first record matching a query, in
 * ascending order of the store's primary keys or of an index's keys.
 */
public class GetOperation extends Operation<Object> {

    private final String storeName;
    private final String indexName;
    private final Object query;

    /**
     * @param storeName the store to read
     * @param indexName the index to order and match by, or null for the
     *                  store's primary keys
     * @param query     the query, or null to match any key
     */
    public GetOperation(String storeName, String indexName, Object query) {
        super(Type.GET);
        this.storeName = storeName;
        this.indexName = indexName;
        this.query = query;
    }

    @Override
    public Object execute(WorkingSet workingSet) throws DatabaseException {
        StoreDescriptor sd = workingSet.requireStore(storeName);
        KeyPath indexKeyPath = indexName == null ? null
                : workingSet.requireIndex(storeName, indexName).getKeyPath();
        KeySequence sequence = KeySequence.build(sd.getRecords(), indexKeyPath, query, Direction.NEXT);
        if (!sequence.hasNext())
            return null;
        return ValueCloner.clone(sd.getRecords().get(sequence.next().getPrimaryKey()));
    }
}
