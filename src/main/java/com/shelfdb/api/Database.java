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

import java.util.Collection;
import java.util.List;

/**
 * <code>Database</code> is a connection to a named, versioned database,
 * obtained as the result of an {@link OpenRequest}.
 * <p>
 * All work on the data happens within a {@link Transaction} created through
 * <code>transaction</code>. Transactions requested on one connection run one
 * at a time, in the order they were requested, starting one scheduling tick
 * after the first of them was requested. Each runs to completion, committing
 * or aborting, before the next begins.
 * <p>
 * Object stores can only be created and deleted from within the upgrade
 * transaction of an open request, while <code>upgradeneeded</code> is being
 * dispatched.
 * <p>
 * A connection dispatches <code>versionchange</code> when another request
 * needs it closed, and <code>close</code> once it is closed. Events of its
 * transactions and requests bubble up to it.
 *
 * @see ShelfDB
 * @see Transaction
 * @see ObjectStore
 */
public interface Database extends EventTarget {
    String getName();

    long getVersion();

    /**
     * Gets the names of the object stores in this database.
     *
     * @return the store names in sorted order
     */
    List<String> getObjectStoreNames();

    /**
     * Creates a read-only transaction on a single object store.
     *
     * @see #transaction(Collection, TransactionMode)
     */
    Transaction transaction(String storeName) throws DatabaseException;

    /**
     * Creates a transaction on a single object store.
     *
     * @see #transaction(Collection, TransactionMode)
     */
    Transaction transaction(String storeName, TransactionMode mode) throws DatabaseException;

    /**
     * Creates a transaction on a set of object stores. The transaction is
     * queued and returned immediately; it runs on a later scheduling tick.
     *
     * @param storeNames the names of the stores the transaction may access
     * @param mode       {@link TransactionMode#READONLY} or
     *                   {@link TransactionMode#READWRITE}
     * @return the new transaction
     * @throws IllegalArgumentException if storeNames is empty or holds an
     *                                  invalid name, or mode is not allowed
     * @throws NotFoundException        if a named store does not exist
     * @throws InvalidStateException    if the connection is closed or closing
     */
    Transaction transaction(Collection<String> storeNames, TransactionMode mode) throws DatabaseException;

    /**
     * Creates an object store with out-of-line keys and no key generator.
     *
     * @see #createObjectStore(String, String, boolean)
     */
    ObjectStore createObjectStore(String name) throws DatabaseException;

    /**
     * Creates an object store within the running upgrade transaction.
     *
     * @param name          the name of the new store
     * @param keyPath       the path of the key within stored values, or null for
     *                      keys supplied separately from values
     * @param autoIncrement true to generate keys for records stored without one
     * @return the new store, bound to the upgrade transaction
     * @throws IllegalArgumentException if name or keyPath is not valid
     * @throws InvalidStateException    if no upgrade transaction is running
     * @throws ConstraintException      if the store already exists
     */
    ObjectStore createObjectStore(String name, String keyPath, boolean autoIncrement) throws DatabaseException;

    /**
     * Deletes an object store and all of its records within the running
     * upgrade transaction.
     *
     * @param name the name of the store
     * @throws InvalidStateException if no upgrade transaction is running
     * @throws NotFoundException     if the store does not exist
     */
    void deleteObjectStore(String name) throws DatabaseException;

    /**
     * Closes this connection. No new transactions can be created; those
     * already requested run to completion first. Closing a connection that is
     * already closing has no effect.
     */
    void close();

    boolean isClosed();
}
