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

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * DatabaseDescriptor is the committed state of one named database: its
 * version and its object stores. It is shared by every connection open on
 * the database and is only modified by a committing transaction.
 */
public final class DatabaseDescriptor {

    private final String name;
    private final NavigableMap<String, StoreDescriptor> stores = new TreeMap<>();
    private long version;

    public DatabaseDescriptor(String name, long version) {
        this.name = name;
        this.version = version;
    }

    public String getName() {
        return name;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    /**
     * Gets the live object stores keyed by name.
     */
    public NavigableMap<String, StoreDescriptor> getStores() {
        return stores;
    }

    /**
     * Gets the object store names in sorted order.
     */
    public List<String> getStoreNames() {
        return new ArrayList<>(stores.keySet());
    }
}
