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
 * DatabaseException is the base class of every checked failure raised by the
 * database API, whether synchronously from a call or later as the error of a
 * {@link Request}.
 * <p>
 * Each subclass corresponds to one error kind and reports its conventional
 * name through {@link #getErrorName()}.
 */
public class DatabaseException extends Exception {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

    public DatabaseException(Throwable cause) {
        super(cause);
    }

    /**
     * Gets the name of the error kind, such as <code>InvalidStateError</code>.
     *
     * @return the error kind name
     */
    public String getErrorName() {
        return "UnknownError";
    }
}
