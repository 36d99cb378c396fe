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

import com.shelfdb.access.KeyComparator;
import com.shelfdb.api.impl.OpenRequestImpl;
import com.shelfdb.core.DatabaseManager;
import com.shelfdb.schedule.EventLoop;
import com.shelfdb.schedule.Scheduler;
import com.shelfdb.util.Validation;

/**
 * ShelfDB is the entry point to a set of named, versioned databases. Use
 * {@link #getInstance()} to get the process-wide instance, which runs its
 * work on an {@link EventLoop}, or construct an isolated instance around a
 * {@link Scheduler} of your own.
 * <p>
 * Call {@link #open} to connect to a database, creating or upgrading it as
 * needed, and {@link #deleteDatabase} to remove one. Both return an
 * {@link OpenRequest} that runs on a later scheduling tick.
 */
public class ShelfDB {
    private static final ShelfDB instance = new ShelfDB(new EventLoop());

    private final Scheduler scheduler;
    private final DatabaseManager manager = new DatabaseManager();

    /**
     * Creates an instance with its own databases, running its work on the
     * given scheduler.
     *
     * @param scheduler the scheduler that runs requests and transactions
     */
    public ShelfDB(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Gets the process-wide instance of ShelfDB. Its scheduler is an
     * {@link EventLoop}, which does nothing until the caller runs it, so the
     * thread that owns the instance must drive it:
     * <pre>
     *     ShelfDB shelf = ShelfDB.getInstance();
     *     OpenRequest request = shelf.open("shop", 1);
     *     ((EventLoop) shelf.getScheduler()).drain();
     * </pre>
     *
     * @return the process-wide instance, whose scheduler is an {@link EventLoop}
     */
    public static ShelfDB getInstance() {
        return instance;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    /**
     * Opens a connection to a database at its current version, creating it at
     * version 1 if it does not exist.
     *
     * @param name the database name
     * @return the pending open request
     * @throws IllegalArgumentException if name is not a valid identifier
     */
    public OpenRequest open(String name) {
        if (!Validation.isValidIdentifier(name))
            throw new IllegalArgumentException("Not a valid database name: " + name);
        return new OpenRequestImpl(manager, scheduler, name, null, false);
    }

    /**
     * Opens a connection to a database at the given version, creating or
     * upgrading the database if its stored version is lower.
     *
     * @param name    the database name
     * @param version the requested version, at least 1
     * @return the pending open request
     * @throws IllegalArgumentException if name or version is not valid
     */
    public OpenRequest open(String name, long version) {
        if (!Validation.isValidIdentifier(name))
            throw new IllegalArgumentException("Not a valid database name: " + name);
        if (!Validation.isValidVersion(version))
            throw new IllegalArgumentException("Not a valid database version: " + version);
        return new OpenRequestImpl(manager, scheduler, name, version, false);
    }

    /**
     * Deletes a database once every connection to it has closed. Deleting a
     * database that does not exist succeeds.
     *
     * @param name the database name
     * @return the pending delete request
     * @throws IllegalArgumentException if name is not a valid identifier
     */
    public OpenRequest deleteDatabase(String name) {
        if (!Validation.isValidIdentifier(name))
            throw new IllegalArgumentException("Not a valid database name: " + name);
        return new OpenRequestImpl(manager, scheduler, name, null, true);
    }

    /**
     * Compares two keys under the total key order.
     *
     * @return a negative number, zero or a positive number as a is less than,
     * equal to or greater than b
     * @throws DataException if either argument is not a valid key
     */
    public static int cmp(Object a, Object b) throws DataException {
        if (!Validation.isValidKey(a) || !Validation.isValidKey(b))
            throw new DataException("cmp(): arguments must be valid keys (number, string, date)");
        return Integer.signum(KeyComparator.INSTANCE.compare(a, b));
    }

    /**
     * Discards every database, version and connection of this instance.
     */
    public void reset() {
        manager.reset();
    }
}
