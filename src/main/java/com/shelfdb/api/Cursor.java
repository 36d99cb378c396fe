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
 * <code>Cursor</code> is a movable position within the records of an object
 * store or index, obtained as the result of an <code>openCursor</code>
 * request.
 * <p>
 * The records a cursor visits are fixed when its request first runs. Each
 * call that moves the cursor queues its request again; the new position is
 * reported when the request next completes, with the cursor as its result,
 * or a null result once the cursor has moved past the last record.
 * A cursor can only be moved while its request is done.
 *
 * @see ObjectStore#openCursor
 * @see Index#openCursor
 */
public interface Cursor {
    /**
     * Gets the store or index this cursor traverses.
     */
    Object getSource();

    Direction getDirection();

    Request<Cursor> getRequest();

    /**
     * Gets the key at the current position: the index key for index cursors,
     * the primary key otherwise.
     *
     * @return the key, or null past the last record
     */
    Object getKey();

    /**
     * Gets the primary key of the record at the current position.
     *
     * @return the primary key, or null past the last record
     */
    Object getPrimaryKey();

    /**
     * Gets a copy of the value of the record at the current position.
     *
     * @return the value, or null past the last record
     */
    Object getValue();

    /**
     * Moves to the next record.
     *
     * @see #continueCursor(Object)
     */
    void continueCursor() throws DatabaseException;

    /**
     * Moves at least one record forward, then on until the key matches the
     * target.
     *
     * @param targetKey a key, a key range, a list of keys and ranges, or null
     *                  to stop at the next record
     * @throws DataException         if targetKey is not valid
     * @throws InvalidStateException if the request is pending or the cursor is
     *                               past the last record
     */
    void continueCursor(Object targetKey) throws DatabaseException;

    /**
     * Moves at least one record forward, then on until either the key matches
     * targetKey or the primary key matches targetPrimaryKey.
     *
     * @throws DataException         if either target is not valid
     * @throws InvalidStateException if the request is pending or the cursor is
     *                               past the last record
     */
    void continuePrimaryKey(Object targetKey, Object targetPrimaryKey) throws DatabaseException;

    /**
     * Moves forward by count records.
     *
     * @param count the number of records to move
     * @throws IllegalArgumentException if count is less than 1
     * @throws InvalidStateException    if the request is pending or the cursor
     *                                  is past the last record
     */
    void advance(long count) throws DatabaseException;

    /**
     * Replaces the value of the record at the current position.
     *
     * @param value the new value
     * @return the request made on the cursor's object store
     * @throws InvalidStateException if the cursor is not on a record
     * @throws DataException         if the store derives keys from values and
     *                               the new value's key differs
     */
    Request<Object> update(Object value) throws DatabaseException;

    /**
     * Deletes the record at the current position.
     *
     * @return the request made on the cursor's object store
     * @throws InvalidStateException if the cursor is not on a record
     */
    Request<Void> delete() throws DatabaseException;
}
