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
 * VersionChangeEvent carries the versions involved in a version change. It is
 * dispatched as <code>upgradeneeded</code> and <code>blocked</code> on an
 * {@link OpenRequest}, and as <code>versionchange</code> on each
 * {@link Database} connection that must close to let the change proceed.
 */
public class VersionChangeEvent extends Event {

    private final long oldVersion;
    private final Long newVersion;

    public VersionChangeEvent(String type, long oldVersion, Long newVersion) {
        super(type, false, false);
        this.oldVersion = oldVersion;
        this.newVersion = newVersion;
    }

    /**
     * Gets the version of the database before the change.
     *
     * @return the old version, 0 if the database did not exist
     */
    public long getOldVersion() {
        return oldVersion;
    }

    /**
     * Gets the version being requested.
     *
     * @return the new version, or null if the database is being deleted
     */
    public Long getNewVersion() {
        return newVersion;
    }

    @Override
    public String toString() {
        return "VersionChangeEvent(" + getType() + ", " + oldVersion + " -> " + newVersion + ")";
    }
}
