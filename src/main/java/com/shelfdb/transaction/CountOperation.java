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

/**
 * Counts the records of a store or index whose keys match a query.
 */
public class CountOperation extends Operation<Long> {

    private final String storeName;
    private final String indexName;
    private final Object query;

    public CountOperation(String storeName, String indexName, Object query) {
        super(Type.COUNT);
        this.storeName = storeName;
        this.indexName = indexName;
        this.query = query;
    }

    @Override
    public Long execute(WorkingSet workingSet) throws DatabaseException {
        StoreDescriptor sd = workingSet.requireStore(storeName);
        if (indexName == null && query == null)
            return (long) sd.getRecords().size();
        KeyPath indexKeyPath = indexName == null ? null
                : workingSet.requireIndex(storeName, indexName).getKeyPath();
        return (long) KeySequence.build(sd.getRecords(), indexKeyPath, query, Direction.NEXT).size();
    }
}
