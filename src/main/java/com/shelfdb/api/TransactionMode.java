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
 * The access mode of a {@link Transaction}.
 */
public enum TransactionMode {
    /**
     * Reads only; writes fail with {@link ReadOnlyException}.
     */
    READONLY,
    /**
     * Reads and writes records of the stores in scope.
     */
    READWRITE,
    /**
     * The upgrade transaction of an {@link OpenRequest}: full access to every
     * store, plus creation and deletion of stores and indexes.
     */
    VERSIONCHANGE
}
