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

import com.shelfdb.api.DatabaseException;

/**
 * Deletes every record of a store. The key generator is not reset.
 */
public class ClearOperation extends Operation<Void> {

    private final String storeName;

    public ClearOperation(String storeName) {
        super(Type.CLEAR);
        this.storeName = storeName;
    }

    @Override
    public Void execute(WorkingSet workingSet) throws DatabaseException {
        workingSet.requireStore(storeName).getRecords().clear();
        return null;
    }
}
