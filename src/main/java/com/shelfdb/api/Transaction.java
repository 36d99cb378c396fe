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
 * <code>Transaction</code> is an atomic, ordered batch of requests against one
 * or more object stores.
 * <p>
 * A transaction works on a private copy of the stores in its scope, taken
 * when it starts to run, so it neither sees nor disturbs the work of other
 * transactions. Its requests run one at a time in the order they were made.
 * When the last request has completed, the copy replaces the committed stores
 * and <code>complete</code> is dispatched. If the transaction is aborted
 * instead, the copy is discarded, every request still queued fails with an
 * {@link AbortException} and <code>abort</code> is dispatched.
 *
 * @see Database#transaction
 * @see ObjectStore
 * @see Request
 */
public interface Transaction extends EventTarget {
    Database getDatabase();

    TransactionMode getMode();

    /**
     * Gets the names of the stores in this transaction's scope.
     *
     * @return the store names in sorted order
     */
    List<String> getObjectStoreNames();

    /**
     * Gets an object store in this transaction's scope.
     *
     * @param name the store name
     * @return the store, the same instance for every call with the same name
     * @throws IllegalArgumentException if name is not a valid identifier
     * @throws InvalidStateException    if the transaction has finished
     * @throws NotFoundException        if the store is not in scope or does not
     *                                  exist
     */
    ObjectStore objectStore(String name) throws DatabaseException;

    /**
     * Aborts this transaction. The abort takes effect before the next request
     * runs; it may be called from a listener of one of this transaction's
     * requests.
     *
     * @throws InvalidStateException if the transaction has already finished
     */
    void abort() throws InvalidStateException;

    /**
     * Gets the failure that aborted this transaction.
     *
     * @return the failure, or null if the transaction committed or was
     * aborted explicitly
     * @throws InvalidStateException if the transaction has not finished
     */
    DatabaseException getError() throws InvalidStateException;

    /**
     * Has this transaction committed or aborted?
     */
    boolean isFinished();

    boolean isAborted();
}
