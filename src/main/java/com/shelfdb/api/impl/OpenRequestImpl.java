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
import com.shelfdb.schedule.Scheduler;
import com.shelfdb.transaction.Operation;
import com.shelfdb.transaction.WorkingSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class OpenRequestImpl implements OpenRequest {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenRequestImpl.class);

    private final DatabaseManager manager;
    private final Scheduler scheduler;
    private final String name;
    private final Long version;
    private final boolean delete;
    private final EventSupport events = new EventSupport(this, null);
    private ReadyState readyState = ReadyState.PENDING;
    private boolean started;
    private Database result;
    private DatabaseException error;
    private Transaction transaction;

    /**
     * Creates an open or delete request and schedules it to run.
     *
     * @param manager   the registry of databases and connections
     * @param scheduler the scheduler that runs the request and the connection
     * @param name      the database name
     * @param version   the requested version, or null for the current version
     * @param delete    true to delete the database instead of opening it
     */
    public OpenRequestImpl(DatabaseManager manager, Scheduler scheduler, String name, Long version, boolean delete) {
        this.manager = manager;
        this.scheduler = scheduler;
        this.name = name;
        this.version = version;
        this.delete = delete;
        scheduler.schedule(this::run);
    }

    @Override
    public Database getResult() throws InvalidStateException {
        if (readyState != ReadyState.DONE)
            throw new InvalidStateException("Cannot get result until request is done");
        return result;
    }

    @Override
    public DatabaseException getError() throws InvalidStateException {
        if (readyState != ReadyState.DONE)
            throw new InvalidStateException("Cannot get error until request is done");
        return error;
    }

    @Override
    public ReadyState getReadyState() {
        return readyState;
    }

    @Override
    public Object getSource() {
        return null;
    }

    @Override
    public Transaction getTransaction() {
        return transaction;
    }

    @Override
    public void addEventListener(String type, EventListener listener) {
        events.addEventListener(type, listener);
    }

    @Override
    public void removeEventListener(String type, EventListener listener) {
        events.removeEventListener(type, listener);
    }

    void run() {
        if (started)
            throw new IllegalStateException("Open request has already been run");
        started = true;

        long oldVersion = manager.getVersion(name);

        if (delete) {
            LOGGER.debug("deleting database=\"{}\" version={}", name, oldVersion);
            if (!closeOtherConnections(oldVersion, null))
                return;
            manager.removeDatabase(name);
            succeed(null);
            return;
        }

        long requested = version != null ? version : Math.max(oldVersion, 1);
        if (requested < oldVersion) {
            fail(new VersionException("Requested version " + requested
                    + " is lower than current version " + oldVersion));
        } else if (requested == oldVersion) {
            succeed(new DatabaseImpl(manager, scheduler, manager.getDatabase(name), requested));
        } else {
            upgrade(oldVersion, requested);
        }
    }

    private void upgrade(long oldVersion, long newVersion) {
        LOGGER.debug("upgrading database=\"{}\" from version={} to version={}", name, oldVersion, newVersion);
        if (!closeOtherConnections(oldVersion, newVersion))
            return;

        DatabaseDescriptor existing = manager.getDatabase(name);
        DatabaseDescriptor descriptor = existing != null ? existing : new DatabaseDescriptor(name, 0);
        DatabaseImpl db = new DatabaseImpl(manager, scheduler, descriptor, newVersion);

        TransactionImpl tx;
        try {
            tx = db.upgradeTransaction();
            tx.request(tx, new UpgradeOperation(db, tx, oldVersion, newVersion));
            db.runTransactions();
        } catch (InvalidStateException e) {
            db.close();
            fail(e);
            return;
        }

        if (tx.isAborted()) {
            LOGGER.debug("upgrade aborted database=\"{}\" version={}", name, oldVersion);
            db.close();
            fail(new AbortException("Version change transaction was aborted", tx.getAbortCause()));
            return;
        }

        descriptor.setVersion(newVersion);
        manager.putDatabase(descriptor);
        succeed(db);
    }

    /**
     * Asks every other connection to the database to close.
     *
     * @return false if a connection is still open, in which case the request
     * is blocked and never completes
     */
    private boolean closeOtherConnections(long oldVersion, Long newVersion) {
        List<Database> connections = manager.getConnections(name);
        if (connections.isEmpty())
            return true;

        for (Database connection : connections)
            ((DatabaseImpl) connection).events.dispatch(
                    new VersionChangeEvent(Event.VERSION_CHANGE, oldVersion, newVersion));

        List<Database> open = manager.getConnections(name);
        if (open.isEmpty())
            return true;

        if (!events.hasListeners(Event.BLOCKED, false))
            LOGGER.warn("open request blocked database=\"{}\" openConnections={}", name, open.size());
        events.dispatch(new VersionChangeEvent(Event.BLOCKED, oldVersion, newVersion));
        return false;
    }

    private void succeed(Database db) {
        result = db;
        error = null;
        readyState = ReadyState.DONE;
        events.dispatch(new Event(Event.SUCCESS, false, false));
    }

    private void fail(DatabaseException e) {
        result = null;
        error = e;
        readyState = ReadyState.DONE;
        if (!events.hasListeners(Event.ERROR, false))
            LOGGER.warn("unhandled open request error database=\"{}\"", name, e);
        events.dispatch(new Event(Event.ERROR, false, true));
    }

    /**
     * Publishes the connection and dispatches <code>upgradeneeded</code> while
     * the upgrade transaction is running.
     */
    private class UpgradeOperation extends Operation<Void> {
        private final DatabaseImpl db;
        private final TransactionImpl tx;
        private final long oldVersion;
        private final long newVersion;

        UpgradeOperation(DatabaseImpl db, TransactionImpl tx, long oldVersion, long newVersion) {
            super(Type.SCHEMA);
            this.db = db;
            this.tx = tx;
            this.oldVersion = oldVersion;
            this.newVersion = newVersion;
        }

        @Override
        public Void execute(WorkingSet workingSet) throws DatabaseException {
            result = db;
            readyState = ReadyState.DONE;
            transaction = tx;
            Exception failure;
            try {
                failure = events.dispatch(new VersionChangeEvent(Event.UPGRADE_NEEDED, oldVersion, newVersion));
            } finally {
                transaction = null;
            }
            if (failure != null)
                throw RequestImpl.asDatabaseException(failure);
            return null;
        }
    }

    @Override
    public String toString() {
        return "OpenRequest(" + name + ", " + (delete ? "delete" : version) + ")";
    }
}
