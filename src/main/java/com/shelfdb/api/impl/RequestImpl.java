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

package com.shelfdb.api.impl;

import com.shelfdb.api.*;
import com.shelfdb.transaction.Operation;
import com.shelfdb.transaction.WorkingSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RequestImpl<T> implements Request<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(RequestImpl.class);

    final TransactionImpl transaction;
    final Object source;
    private final EventSupport events;
    private Operation<T> operation;
    private ReadyState readyState = ReadyState.PENDING;
    private T result;
    private DatabaseException error;

    RequestImpl(TransactionImpl transaction, Object source, Operation<T> operation) {
        this.transaction = transaction;
        this.source = source;
        this.operation = operation;
        this.events = new EventSupport(this, transaction.events);
    }

    @Override
    public T getResult() throws InvalidStateException {
        if (readyState != ReadyState.DONE)
            throw new InvalidStateException("Cannot get result until request is done");
        return result;
    }

    @Override
    public DatabaseException getError() throws InvalidStateException {
        if (readyState != ReadyState.DONE)
            throw new InvalidStateException("Cannot get error until request is done");
        return error;
    }

    @Override
    public ReadyState getReadyState() {
        return readyState;
    }

    @Override
    public Object getSource() {
        return source;
    }

    @Override
    public Transaction getTransaction() {
        return transaction;
    }

    @Override
    public void addEventListener(String type, EventListener listener) {
        events.addEventListener(type, listener);
    }

    @Override
    public void removeEventListener(String type, EventListener listener) {
        events.removeEventListener(type, listener);
    }

    Operation<T> getOperation() {
        return operation;
    }

    /**
     * Runs the operation against the transaction's working set and reports
     * the outcome.
     */
    void run(WorkingSet workingSet) {
        if (transaction.isFinished()) {
            fail(new InvalidStateException("Transaction has finished"));
            return;
        }
        T value;
        try {
            value = operation.execute(workingSet);
        } catch (DatabaseException e) {
            fail(e);
            return;
        }
        result = value;
        error = null;
        readyState = ReadyState.DONE;

        Exception failure = events.dispatch(new Event(Event.SUCCESS, false, false));
        if (failure != null && !transaction.isFinished())
            transaction.abortWithError(asDatabaseException(failure));
    }

    /**
     * Reports a failure. The transaction aborts unless a listener prevents the
     * default action of the error event.
     */
    void fail(DatabaseException e) {
        result = null;
        error = e;
        readyState = ReadyState.DONE;

        Event event = new Event(Event.ERROR, true, true);
        if (!events.hasListeners(Event.ERROR, true))
            LOGGER.warn("unhandled request error operation={} source={}", operation, source, e);
        Exception failure = events.dispatch(event);
        if (transaction.isFinished())
            return;
        if (failure != null)
            transaction.abortWithError(asDatabaseException(failure));
        else if (!event.isDefaultPrevented())
            transaction.abortWithError(e);
    }

    /**
     * Fails a request left queued in an aborted transaction.
     */
    void abandon() {
        result = null;
        error = new AbortException("Request's transaction has been aborted");
        readyState = ReadyState.DONE;
        events.dispatch(new Event(Event.ERROR, true, true));
    }

    /**
     * Queues this request again with a new operation, as a cursor does when it
     * is moved.
     */
    void rerun(Operation<T> continuation) throws InvalidStateException {
        transaction.requeue(this);
        operation = continuation;
        readyState = ReadyState.PENDING;
    }

    static DatabaseException asDatabaseException(Exception e) {
        if (e instanceof DatabaseException)
            return (DatabaseException) e;
        return new DatabaseException("Event listener failed", e);
    }

    @Override
    public String toString() {
        return "Request(" + operation + ", " + readyState + ")";
    }
}
