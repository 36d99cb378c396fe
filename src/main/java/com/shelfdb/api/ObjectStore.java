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

import java.util.List;

/**
 * <code>ObjectStore</code> is a named table of records with unique keys,
 * accessed through a {@link Transaction}.
 * <p>
 * A store either derives the key of each record from the stored value through
 * its key path, or takes keys supplied separately with each value. A store
 * with a key generator assigns increasing integer keys to records stored
 * without one.
 * <p>
 * Keys are finite numbers, strings or dates. Queries select keys with a single
 * key, a {@link KeyRange}, or a list of keys and ranges. Values are JSON-like:
 * maps with string keys, lists, finite numbers, strings, booleans and null.
 * They are deep-copied when stored and when returned.
 * <p>
 * Every operation returns a {@link Request} that runs later, in order, within
 * the transaction. Argument and state errors are thrown immediately; errors
 * found when the request runs are reported by the request.
 *
 * @see Transaction
 * @see Index
 * @see Cursor
 */
public interface ObjectStore {
    String getName();

    /**
     * Gets the key path of this store.
     *
     * @return the key path, or null if keys are supplied with each value
     */
    String getKeyPath();

    boolean isAutoIncrement();

    /**
     * Gets the names of the indexes on this store.
     *
     * @return the index names in sorted order
     */
    List<String> getIndexNames();

    Transaction getTransaction();

    /**
     * Stores a value under the key found at the store's key path, or under a
     * generated key.
     *
     * @see #put(Object, Object)
     */
    Request<Object> put(Object value) throws DatabaseException;

    /**
     * Stores a value, replacing any record with the same key.
     *
     * @param value the value to store
     * @param key   the key, which must be null for stores with a key path, and
     *              may be null for stores with a key generator
     * @return a request whose result is the key of the stored record
     * @throws DataException         if no usable key is given or derivable
     * @throws DataCloneException    if the value is not JSON-like
     * @throws ReadOnlyException     if the transaction is read-only
     * @throws InvalidStateException if the transaction has finished or the
     *                               store no longer exists
     */
    Request<Object> put(Object value, Object key) throws DatabaseException;

    /**
     * Stores a value under the key found at the store's key path, or under a
     * generated key, failing if the key is in use.
     *
     * @see #add(Object, Object)
     */
    Request<Object> add(Object value) throws DatabaseException;

    /**
     * Stores a new record. The request fails with a
     * {@link ConstraintException} if a record with the same key exists.
     *
     * @see #put(Object, Object)
     */
    Request<Object> add(Object value, Object key) throws DatabaseException;

    /**
     * Fetches the value of the first record, in ascending key order, whose
     * key matches the query.
     *
     * @param query a key, a key range, a list of keys and ranges, or null to
     *              match any key
     * @return a request whose result is the value, or null if nothing matched
     * @throws DataException if the query is not valid
     */
    Request<Object> get(Object query) throws DatabaseException;

    /**
     * Counts every record in the store.
     */
    Request<Long> count() throws DatabaseException;

    /**
     * Counts the records whose keys match the query.
     *
     * @param query a key, a key range, a list of keys and ranges, or null to
     *              count every record
     * @return a request whose result is the number of matching records
     */
    Request<Long> count(Object query) throws DatabaseException;

    /**
     * Deletes every record whose key matches the query. Matching nothing is
     * not an error.
     *
     * @param query a key, a key range, or a list of keys and ranges
     * @return a request with a null result
     */
    Request<Void> delete(Object query) throws DatabaseException;

    /**
     * Deletes every record in the store.
     */
    Request<Void> clear() throws DatabaseException;

    /**
     * Gets an index on this store.
     *
     * @param name the index name
     * @return the index
     * @throws NotFoundException if no such index exists
     */
    Index index(String name) throws DatabaseException;

    /**
     * Creates a non-unique, single-entry index.
     *
     * @see #createIndex(String, String, boolean, boolean)
     */
    Index createIndex(String name, String keyPath) throws DatabaseException;

    /**
     * Creates an index within the running upgrade transaction. The unique and
     * multiEntry flags are recorded and reported by the index but do not
     * change how it orders or matches records.
     *
     * @param name       the index name
     * @param keyPath    the path of the indexed key within stored values
     * @param unique     the declared uniqueness of the index
     * @param multiEntry the declared multi-entry flag of the index
     * @return the new index
     * @throws IllegalArgumentException if name or keyPath is not valid
     * @throws InvalidStateException    if the transaction is not an upgrade
     *                                  transaction
     * @throws ConstraintException      if the index already exists
     */
    Index createIndex(String name, String keyPath, boolean unique, boolean multiEntry) throws DatabaseException;

    /**
     * Deletes an index within the running upgrade transaction.
     *
     * @param name the index name
     * @throws InvalidStateException if the transaction is not an upgrade
     *                               transaction
     * @throws NotFoundException     if no such index exists
     */
    void deleteIndex(String name) throws DatabaseException;

    /**
     * Opens a cursor over every record in ascending key order.
     */
    Request<Cursor> openCursor() throws DatabaseException;

    /**
     * Opens a cursor over the matching records in ascending key order.
     */
    Request<Cursor> openCursor(Object query) throws DatabaseException;

    /**
     * Opens a cursor over the records whose keys match the query. The set of
     * records is fixed when the request first runs, so it includes the work of
     * every earlier request in the transaction.
     *
     * @param query     a key, a key range, a list of keys and ranges, or null
     * @param direction the order of traversal
     * @return a request whose result is the cursor while it is positioned on a
     * record, or null once it has moved past the last one
     */
    Request<Cursor> openCursor(Object query, Direction direction) throws DatabaseException;
}
