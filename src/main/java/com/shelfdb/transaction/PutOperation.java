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

import com.shelfdb.api.ConstraintException;
import com.shelfdb.api.DatabaseException;
import com.shelfdb.core.StoreDescriptor;

/**
 * Stores a value, generating its key when none was supplied. The value has
 * already been copied from the caller's structure.
 */
public class PutOperation extends Operation<Object> {

    private final String storeName;
    private final Object value;
    private final Object key;
    private final boolean noOverwrite;

    /**
     * @param storeName   the store to write
     * @param value       the copied value
     * @param key         the key, or null to generate one
     * @param noOverwrite true to fail if a record with the key exists
     */
    public PutOperation(String storeName, Object value, Object key, boolean noOverwrite) {
        super(Type.PUT);
        this.storeName = storeName;
        this.value = value;
        this.key = key;
        this.noOverwrite = noOverwrite;
    }

    @Override
    public Object execute(WorkingSet workingSet) throws DatabaseException {
        StoreDescriptor sd = workingSet.requireStore(storeName);
        Object k = key;
        if (k == null) {
            k = sd.nextKey();
            if (sd.getKeyPath() != null)
                sd.getKeyPath().inject(value, k);
        }
        if (noOverwrite && sd.getRecords().containsKey(k))
            throw new ConstraintException("Key already exists in object store '" + storeName + "': " + k);
        if (sd.isAutoIncrement())
            sd.observeKey(k);
        sd.getRecords().put(k, value);
        return k;
    }
}
