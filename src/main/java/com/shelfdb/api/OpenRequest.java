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
 * <code>OpenRequest</code> is the request returned by {@link ShelfDB#open}
 * and {@link ShelfDB#deleteDatabase}. It runs by itself one scheduling tick
 * after it is created, which leaves time to register listeners.
 * <p>
 * An open request compares the requested version to the stored one:
 * <ul>
 * <li>lower: the request fails with a {@link VersionException};
 * <li>equal: a new connection is opened on the existing data;
 * <li>higher: every other connection is asked to close (see below), then an
 * upgrade transaction runs while <code>upgradeneeded</code> is dispatched,
 * and finally the new version is committed.
 * </ul>
 * A delete request closes every connection and then removes the database.
 * <p>
 * Other connections are asked to close by dispatching
 * <code>versionchange</code> to each of them. If any remains open afterwards,
 * the request dispatches <code>blocked</code> and never completes.
 *
 * @see ShelfDB
 * @see VersionChangeEvent
 */
public interface OpenRequest extends Request<Database> {
    /**
     * Gets the upgrade transaction.
     *
     * @return the <code>versionchange</code> transaction while
     * <code>upgradeneeded</code> is being dispatched, null otherwise
     */
    @Override
    Transaction getTransaction();
}
