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

package com.shelfdb.core;

import com.shelfdb.api.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * DatabaseManager is the central point of control for the committed state of
 * every database known to one factory: the database descriptors (versions and
 * stores) and the set of open connections to each database.
 * <p>
 * The manager is created by its factory and handed to every connection and
 * open request it creates; {@link #reset()} discards everything.
 */
public class DatabaseManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseManager.class);

    private final Map<String, DatabaseDescriptor> databases = new HashMap<>();
    private final Map<String, List<Database>> connections = new HashMap<>();

    /**
     * Gets the committed descriptor of a database.
     *
     * @param name the database name
     * @return the descriptor, or null if the database does not exist
     */
    public synchronized DatabaseDescriptor getDatabase(String name) {
        return databases.get(name);
    }

    /**
     * Gets the committed version of a database.
     *
     * @param name the database name
     * @return the version, or 0 if the database does not exist
     */
    public synchronized long getVersion(String name) {
        DatabaseDescriptor dd = databases.get(name);
        return dd == null ? 0 : dd.getVersion();
    }

    /**
     * Records a descriptor as the committed state of its database.
     */
    public synchronized void putDatabase(DatabaseDescriptor databaseDescriptor) {
        databases.put(databaseDescriptor.getName(), databaseDescriptor);
    }

    /**
     * Forgets a database together with its connection registry entry.
     */
    public synchronized void removeDatabase(String name) {
        databases.remove(name);
        connections.remove(name);
        LOGGER.debug("removed database name=\"{}\"", name);
    }

    public synchronized void addConnection(Database connection) {
        connections.computeIfAbsent(connection.getName(), k -> new ArrayList<>()).add(connection);
    }

    public synchronized void removeConnection(Database connection) {
        List<Database> list = connections.get(connection.getName());
        if (list != null)
            list.remove(connection);
    }

    /**
     * Gets the connections currently open on a database.
     *
     * @param name the database name
     * @return a snapshot of the open connections, in the order they were opened
     */
    public synchronized List<Database> getConnections(String name) {
        List<Database> list = connections.get(name);
        if (list == null)
            return Collections.emptyList();
        return new ArrayList<>(list);
    }

    /**
     * Discards every database, version and connection.
     */
    public synchronized void reset() {
        databases.clear();
        connections.clear();
        LOGGER.debug("reset database registry");
    }
}
