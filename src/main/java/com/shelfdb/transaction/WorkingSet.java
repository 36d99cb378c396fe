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

package com.shelfdb.transaction;

import com.shelfdb.api.InvalidStateException;
import com.shelfdb.core.DatabaseDescriptor;
import com.shelfdb.core.IndexDescriptor;
import com.shelfdb.core.StoreDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * WorkingSet is the private copy of the object stores a transaction may
 * access. It is taken when the transaction starts to run and replaces the
 * committed stores if the transaction commits; an aborted transaction simply
 * drops it.
 * <p>
 * A version change transaction copies every store of the database and may
 * create and delete stores. Its commit replaces the whole set of committed
 * stores.
 */
public class WorkingSet {

    private final DatabaseDescriptor live;
    private final List<String> scope;
    private final boolean versionChange;
    private final NavigableMap<String, StoreDescriptor> stores = new TreeMap<>();

    private WorkingSet(DatabaseDescriptor live, Collection<String> scope, boolean versionChange) {
        this.live = live;
        this.scope = new ArrayList<>(scope);
        this.versionChange = versionChange;
    }

    /**
     * Copies the stores in scope from the committed state of a database.
     *
     * @param live          the committed state
     * @param scope         the names of the stores to copy; ignored for a
     *                      version change, which copies every store
     * @param versionChange true for the upgrade transaction of an open request
     * @return the new working set
     */
    public static WorkingSet snapshot(DatabaseDescriptor live, Collection<String> scope, boolean versionChange) {
        WorkingSet ws = new WorkingSet(live, versionChange ? live.getStoreNames() : scope, versionChange);
        for (String name : ws.scope) {
            StoreDescriptor sd = live.getStores().get(name);
            if (sd != null)
                ws.stores.put(name, new StoreDescriptor(sd));
        }
        return ws;
    }

    public boolean isVersionChange() {
        return versionChange;
    }

    /**
     * Gets a store of this working set.
     *
     * @return the store, or null if it does not exist
     */
    public StoreDescriptor getStore(String name) {
        return stores.get(name);
    }

    /**
     * Gets a store that must exist.
     *
     * @throws InvalidStateException if the store has been deleted
     */
    public StoreDescriptor requireStore(String name) throws InvalidStateException {
        StoreDescriptor sd = stores.get(name);
        if (sd == null)
            throw new InvalidStateException("Object store '" + name + "' has been deleted");
        return sd;
    }

    /**
     * Gets an index that must exist.
     *
     * @throws InvalidStateException if the store or the index has been deleted
     */
    public IndexDescriptor requireIndex(String storeName, String indexName) throws InvalidStateException {
        IndexDescriptor id = requireStore(storeName).getIndex(indexName);
        if (id == null)
            throw new InvalidStateException("Index '" + indexName + "' has been deleted");
        return id;
    }

    public void createStore(StoreDescriptor storeDescriptor) {
        stores.put(storeDescriptor.getName(), storeDescriptor);
    }

    public void deleteStore(String name) {
        stores.remove(name);
    }

    /**
     * Gets the names of the stores in this working set in sorted order.
     */
    public List<String> getStoreNames() {
        return new ArrayList<>(stores.keySet());
    }

    /**
     * Publishes this working set as the committed state of the database.
     */
    public void commit() {
        synchronized (live) {
            NavigableMap<String, StoreDescriptor> target = live.getStores();
            if (versionChange) {
                target.clear();
                target.putAll(stores);
                return;
            }
            for (String name : scope) {
                StoreDescriptor sd = stores.get(name);
                if (sd != null)
                    target.put(name, sd);
                else
                    target.remove(name);
            }
        }
    }
}
