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

package com.shelfdb.api;

/**
 * <code>Index</code> orders the records of an {@link ObjectStore} by a
 * secondary key found at the index's key path within each stored value.
 * Records without a valid key at that path are not part of the index.
 * <p>
 * An index is derived from the store's records each time it is read, so it
 * always reflects the work of earlier requests in the transaction.
 *
 * @see ObjectStore#createIndex
 * @see ObjectStore#index
 */
public interface Index {
    String getName();

    String getKeyPath();

    boolean isUnique();

    boolean isMultiEntry();

    ObjectStore getObjectStore();

    /**
     * Fetches the value of the first record, in ascending index key order,
     * whose index key matches the query.
     *
     * @see ObjectStore#get
     */
    Request<Object> get(Object query) throws DatabaseException;

    Request<Long> count() throws DatabaseException;

    /**
     * Counts the records whose index keys match the query.
     *
     * @see ObjectStore#count(Object)
     */
    Request<Long> count(Object query) throws DatabaseException;

    Request<Cursor> openCursor() throws DatabaseException;

    Request<Cursor> openCursor(Object query) throws DatabaseException;

    /**
     * Opens a cursor over the records whose index keys match the query. The
     * cursor's key is the index key and its primary key is the record's key in
     * the store.
     *
     * @see ObjectStore#openCursor(Object, Direction)
     */
    Request<Cursor> openCursor(Object query, Direction direction) throws DatabaseException;
}
