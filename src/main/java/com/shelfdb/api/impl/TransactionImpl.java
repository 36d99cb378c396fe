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

package com.shelfdb.api.impl;

import com.shelfdb.api.*;
import com.shelfdb.core.StoreDescriptor;
import com.shelfdb.transaction.Operation;
import com.shelfdb.transaction.WorkingSet;
import com.shelfdb.util.Validation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

public class TransactionImpl implements Transaction {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionImpl.class);

    final DatabaseImpl database;
    final TransactionMode mode;
    final EventSupport events;
    private final List<String> storeNames;
    private final Deque<RequestImpl<?>> queue = new ArrayDeque<>();
    private final Map<String, ObjectStoreImpl> objectStores = new HashMap<>();
    private WorkingSet workingSet;
    private boolean finished;
    private boolean aborted;
    private DatabaseException error;

    TransactionImpl(DatabaseImpl database, Collection<String> storeNames, TransactionMode mode) {
        this.database = database;
        this.storeNames = new ArrayList<>(new TreeSet<>(storeNames));
        this.mode = mode;
        this.events = new EventSupport(this, database.events);
    }

    @Override
    public Database getDatabase() {
        return database;
    }

    @Override
    public TransactionMode getMode() {
        return mode;
    }

    @Override
    public List<String> getObjectStoreNames() {
        if (mode == TransactionMode.VERSIONCHANGE && workingSet != null)
            return workingSet.getStoreNames();
        return new ArrayList<>(storeNames);
    }

    @Override
    public ObjectStore objectStore(String name) throws DatabaseException {
        if (!Validation.isValidIdentifier(name))
            throw new IllegalArgumentException("objectStore(): name must be a valid identifier: " + name);
        if (finished)
            throw new InvalidStateException("objectStore(): Transaction has already finished");
        if (!getObjectStoreNames().contains(name))
            throw new NotFoundException("objectStore(): Object store '" + name + "' is not in this transaction's scope");
        if (getStore(name) == null)
            throw new NotFoundException("objectStore(): Object store '" + name + "' does not exist");

        ObjectStoreImpl os = objectStores.get(name);
        if (os == null) {
            os = new ObjectStoreImpl(this, name);
            objectStores.put(name, os);
        }
        return os;
    }

    @Override
    public void abort() throws InvalidStateException {
        if (finished)
            throw new InvalidStateException("abort(): Transaction has already finished");
        finished = true;
        aborted = true;
        LOGGER.debug("abort requested database=\"{}\" stores={}", database.getName(), storeNames);
    }

    @Override
    public DatabaseException getError() throws InvalidStateException {
        if (!finished)
            throw new InvalidStateException("Transaction error can only be read after the transaction has finished");
        return error;
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    @Override
    public boolean isAborted() {
        return aborted;
    }

    @Override
    public void addEventListener(String type, EventListener listener) {
        events.addEventListener(type, listener);
    }

    @Override
    public void removeEventListener(String type, EventListener listener) {
        events.removeEventListener(type, listener);
    }

    /**
     * Aborts this transaction because one of its requests failed.
     */
    void abortWithError(DatabaseException e) {
        if (finished)
            return;
        error = e;
        finished = true;
        aborted = true;
        LOGGER.debug("aborting on error database=\"{}\" stores={}", database.getName(), storeNames, e);
    }

    /**
     * Gets the failure that aborted this transaction without checking that it
     * has finished.
     */
    DatabaseException getAbortCause() {
        return error;
    }

    /**
     * Is this transaction currently draining its request queue?
     */
    boolean isRunning() {
        return workingSet != null;
    }

    WorkingSet getWorkingSet() {
        return workingSet;
    }

    /**
     * Gets a store as this transaction currently sees it: from the working set
     * while running, from the committed state otherwise.
     *
     * @return the store, or null if it does not exist
     */
    StoreDescriptor getStore(String name) {
        if (workingSet != null)
            return workingSet.getStore(name);
        return database.descriptor.getStores().get(name);
    }

    void forgetObjectStore(String name) {
        objectStores.remove(name);
    }

    <T> RequestImpl<T> request(Object source, Operation<T> operation) throws InvalidStateException {
        if (finished)
            throw new InvalidStateException("Cannot create request when transaction has already finished");
        RequestImpl<T> request = new RequestImpl<>(this, source, operation);
        queue.addLast(request);
        return request;
    }

    void requeue(RequestImpl<?> request) throws InvalidStateException {
        if (finished)
            throw new InvalidStateException("Cannot queue request when transaction has already finished");
        queue.addLast(request);
    }

    /**
     * Runs every queued request against a private copy of the stores in scope,
     * then commits the copy or, if the transaction was aborted, discards it.
     */
    void run() {
        if (!aborted) {
            workingSet = WorkingSet.snapshot(database.descriptor, storeNames, mode == TransactionMode.VERSIONCHANGE);
            RequestImpl<?> request;
            while (!aborted && (request = queue.pollFirst()) != null)
                request.run(workingSet);
        }

        if (aborted) {
            RequestImpl<?> request;
            while ((request = queue.pollFirst()) != null)
                request.abandon();
            workingSet = null;
            LOGGER.debug("aborted database=\"{}\" mode={} stores={}", database.getName(), mode, storeNames);
            events.dispatch(new Event(Event.ABORT, true, false));
            return;
        }

        if (mode != TransactionMode.READONLY)
            workingSet.commit();
        finished = true;
        workingSet = null;
        LOGGER.debug("committed database=\"{}\" mode={} stores={}", database.getName(), mode, storeNames);
        events.dispatch(new Event(Event.COMPLETE, false, false));
    }

    @Override
    public String toString() {
        return "Transaction(" + database.getName() + ", " + mode + ", " + storeNames + ")";
    }
}
