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

import com.shelfdb.access.KeyMatcher;
import com.shelfdb.api.DatabaseException;
import com.shelfdb.core.StoreDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Deletes every record whose primary key matches a query.
 */
public class DeleteOperation extends Operation<Void> {

    private final String storeName;
    private final Object query;

    public DeleteOperation(String storeName, Object query) {
        super(Type.DELETE);
        this.storeName = storeName;
        this.query = query;
    }

    @Override
    public Void execute(WorkingSet workingSet) throws DatabaseException {
        StoreDescriptor sd = workingSet.requireStore(storeName);
        List<Object> keys = new ArrayList<>(sd.getRecords().keySet());
        for (Object key : keys) {
            if (KeyMatcher.matches(key, query))
                sd.getRecords().remove(key);
        }
        return null;
    }
}
