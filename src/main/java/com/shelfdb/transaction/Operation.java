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

import com.shelfdb.api.DatabaseException;

/**
 * Operation is the unit of work carried by a request. It runs against the
 * {@link WorkingSet} of its transaction when the request reaches the head of
 * the transaction's queue.
 *
 * @param <T> the type of the result
 */
public abstract class Operation<T> {

    public enum Type {
        PUT, GET, DELETE, CLEAR, COUNT, OPEN_CURSOR, CURSOR_CONTINUATION, SCHEMA
    }

    private final Type type;

    protected Operation(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    /**
     * Runs the operation.
     *
     * @param workingSet the transaction's private copy of its stores
     * @return the result reported by the request
     * @throws DatabaseException if the operation fails; the request reports
     *                           the exception as its error
     */
    public abstract T execute(WorkingSet workingSet) throws DatabaseException;

    @Override
    public String toString() {
        return type.toString();
    }
}
