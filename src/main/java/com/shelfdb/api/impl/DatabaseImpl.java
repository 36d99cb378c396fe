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
import com.shelfdb.core.DatabaseDescriptor;
import com.shelfdb.core.DatabaseManager;
import com.shelfdb.core.KeyPath;
import com.shelfdb.core.StoreDescriptor;
import com.shelfdb.schedule.ScheduledTask;
import com.shelfdb.schedule.Scheduler;
import com.shelfdb.util.Validation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

public class DatabaseImpl implements Database {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseImpl.class);

    final DatabaseDescriptor descriptor;
    final EventSupport events = new EventSupport(this, null);
    private final String name;
    private final DatabaseManager manager;
    private final Scheduler scheduler;
    private final Deque<TransactionImpl> queue = new ArrayDeque<>();
    private long version;
    private TransactionImpl active;
    private ScheduledTask scheduledRun;
    private boolean running;
    private boolean closing;
    private boolean closed;

    DatabaseImpl(DatabaseManager manager, Scheduler scheduler, DatabaseDescriptor descriptor, long version) {
        this.manager = manager;
        this.scheduler = scheduler;
        this.descriptor = descriptor;
        this.name = descriptor.getName();
        this.version = version;
        manager.addConnection(this);
        LOGGER.debug("opened connection database=\"{}\" version={}", name, version);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public long getVersion() {
        return version;
    }

    @Override
    public List<String> getObjectStoreNames() {
        if (active != null && active.mode == TransactionMode.VERSIONCHANGE && active.isRunning())
            return active.getWorkingSet().getStoreNames();
        return descriptor.getStoreNames();
    }

    @Override
    public Transaction transaction(String storeName) throws DatabaseException {
        return transaction(Collections.singletonList(storeName), TransactionMode.READONLY);
    }

    @Override
    public Transaction transaction(String storeName, TransactionMode mode) throws DatabaseException {
        return transaction(Collections.singletonList(storeName), mode);
    }

    @Override
    public Transaction transaction(Collection<String> storeNames, TransactionMode mode) throws DatabaseException {
        if (storeNames == null || storeNames.isEmpty())
            throw new IllegalArgumentException("transaction(): storeNames cannot be empty");
        for (String storeName : storeNames) {
            if (!Validation.isValidIdentifier(storeName))
                throw new IllegalArgumentException("transaction(): storeNames must only include valid identifiers");
        }
        if (mode != TransactionMode.READONLY && mode != TransactionMode.READWRITE)
            throw new IllegalArgumentException("transaction(): mode must be READWRITE or READONLY");
        if (closed)
            throw new InvalidStateException("transaction(): Database connection is closed");
        if (closing)
            throw new InvalidStateException("transaction(): Database connection is closing");
        for (String storeName : storeNames) {
            if (!descriptor.getStores().containsKey(storeName))
                throw new NotFoundException("transaction(): Object store '" + storeName + "' does not exist");
        }

        TransactionImpl tx = new TransactionImpl(this, storeNames, mode);
        if (!running && scheduledRun == null)
            scheduledRun = scheduler.schedule(this::runScheduled);
        queue.addLast(tx);
        return tx;
    }

    @Override
    public ObjectStore createObjectStore(String storeName) throws DatabaseException {
        return createObjectStore(storeName, null, false);
    }

    @Override
    public ObjectStore createObjectStore(String storeName, String keyPath, boolean autoIncrement)
            throws DatabaseException {
        if (!Validation.isValidIdentifier(storeName))
            throw new IllegalArgumentException("createObjectStore(): name must be a valid identifier: " + storeName);
        KeyPath kp = keyPath == null ? null : KeyPath.of(keyPath);
        TransactionImpl tx = requireVersionChange("createObjectStore()");
        if (tx.getWorkingSet().getStore(storeName) != null)
            throw new ConstraintException("createObjectStore(): Object store '" + storeName + "' already exists");
        tx.getWorkingSet().createStore(new StoreDescriptor(storeName, kp, autoIncrement));
        LOGGER.debug("created object store database=\"{}\" store=\"{}\"", name, storeName);
        return tx.objectStore(storeName);
    }

    @Override
    public void deleteObjectStore(String storeName) throws DatabaseException {
        if (!Validation.isValidIdentifier(storeName))
            throw new IllegalArgumentException("deleteObjectStore(): name must be a valid identifier: " + storeName);
        TransactionImpl tx = requireVersionChange("deleteObjectStore()");
        if (tx.getWorkingSet().getStore(storeName) == null)
            throw new NotFoundException("deleteObjectStore(): Object store '" + storeName + "' does not exist");
        tx.getWorkingSet().deleteStore(storeName);
        tx.forgetObjectStore(storeName);
        LOGGER.debug("deleted object store database=\"{}\" store=\"{}\"", name, storeName);
    }

    @Override
    public void close() {
        if (closing || closed)
            return;
        closing = true;
        LOGGER.debug("closing connection database=\"{}\" queued={}", name, queue.size());
        // a drain in progress finishes the close when it returns
        if (!running)
            drain();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void addEventListener(String type, EventListener listener) {
        events.addEventListener(type, listener);
    }

    @Override
    public void removeEventListener(String type, EventListener listener) {
        events.removeEventListener(type, listener);
    }

    boolean isClosing() {
        return closing;
    }

    void setVersion(long version) {
        this.version = version;
    }

    /**
     * Creates the upgrade transaction of an open request, scoped to every
     * store of the database.
     *
     * @throws InvalidStateException if the connection is closed or closing, or
     *                               already has transactions
     */
    TransactionImpl upgradeTransaction() throws InvalidStateException {
        if (closed)
            throw new InvalidStateException("upgradeTransaction(): Database connection is closed");
        if (closing)
            throw new InvalidStateException("upgradeTransaction(): Database connection is closing");
        if (!queue.isEmpty())
            throw new InvalidStateException("upgradeTransaction(): Database connection already has transactions");
        TransactionImpl tx = new TransactionImpl(this, descriptor.getStoreNames(), TransactionMode.VERSIONCHANGE);
        queue.addLast(tx);
        return tx;
    }

    /**
     * Runs every queued transaction to completion, in the order they were
     * requested.
     *
     * @throws InvalidStateException if the connection is closed
     */
    void runTransactions() throws InvalidStateException {
        if (closed)
            throw new InvalidStateException("runTransactions(): Database connection is closed");
        drain();
    }

    private void runScheduled() {
        scheduledRun = null;
        if (!closed)
            drain();
    }

    private void drain() {
        if (running)
            return;
        if (scheduledRun != null) {
            scheduledRun.cancel();
            scheduledRun = null;
        }
        running = true;
        try {
            TransactionImpl tx;
            while ((tx = queue.pollFirst()) != null) {
                active = tx;
                tx.run();
            }
        } finally {
            active = null;
            running = false;
        }
        if (closing && !closed)
            finishClose();
    }

    private void finishClose() {
        closed = true;
        manager.removeConnection(this);
        LOGGER.debug("closed connection database=\"{}\"", name);
        events.dispatch(new Event(Event.CLOSE, false, false));
    }

    private TransactionImpl requireVersionChange(String method) throws InvalidStateException {
        if (closed)
            throw new InvalidStateException(method + ": Database connection is closed");
        if (active == null || !active.isRunning())
            throw new InvalidStateException(method + ": Can only be used when a transaction is running");
        if (active.mode != TransactionMode.VERSIONCHANGE || active.isFinished())
            throw new InvalidStateException(method + ": Can only be used within an active 'versionchange' transaction");
        return active;
    }

    @Override
    public String toString() {
        return "Database(" + name + ", " + version + ")";
    }
}
