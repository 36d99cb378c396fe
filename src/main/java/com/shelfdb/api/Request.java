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
 * <code>Request</code> is a deferred, single-shot unit of work queued on a
 * {@link Transaction}. It runs when its transaction runs, in the order it was
 * queued, and then reports either a result or an error.
 * <p>
 * On completion a request dispatches <code>success</code>, or a bubbling and
 * cancelable <code>error</code>. Unless a listener calls
 * {@link Event#preventDefault()} on the error event, the failure aborts the
 * transaction. Requests left queued in an aborted transaction fail with an
 * {@link AbortException}.
 * <p>
 * A cursor request completes once per cursor position: each call that moves
 * the cursor returns the request to {@link ReadyState#PENDING} and queues it
 * again.
 *
 * @param <T> the type of the result
 * @see ObjectStore
 * @see Index
 * @see Cursor
 */
public interface Request<T> extends EventTarget {
    /**
     * Gets the result of this request.
     *
     * @return the result, which may be null
     * @throws InvalidStateException if the request is still pending
     */
    T getResult() throws InvalidStateException;

    /**
     * Gets the error of this request.
     *
     * @return the error, or null if the request succeeded
     * @throws InvalidStateException if the request is still pending
     */
    DatabaseException getError() throws InvalidStateException;

    ReadyState getReadyState();

    /**
     * Gets the object the request was made against.
     *
     * @return an {@link ObjectStore}, an {@link Index}, or null for requests
     * made by the database itself
     */
    Object getSource();

    /**
     * Gets the transaction this request belongs to.
     *
     * @return the transaction, or null if there is none
     */
    Transaction getTransaction();
}
