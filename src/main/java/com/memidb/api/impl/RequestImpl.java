/*
 * MemIDB: In-Memory Indexed Database for Java
 *
 * Copyright 2026 The MemIDB Authors
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

package com.memidb.api.impl;

import com.memidb.api.*;
import com.memidb.event.EventLoop;
import com.memidb.transaction.PendingRequest;
import com.memidb.transaction.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * RequestImpl carries the outcome of an operation from the moment it is
 * issued, when the outcome is already known, to its delivery in a later turn
 * of the event loop, when its listeners run.
 * <p>
 * A request that belongs to a transaction is registered with the transaction
 * manager when issued and reported back once delivered, which is what keeps
 * the transaction alive and orders its completion after its requests.
 */
public class RequestImpl<T> implements Request<T>, PendingRequest {

    private static final Logger log = LoggerFactory.getLogger(RequestImpl.class);

    private final EventLoop eventLoop;
    private final TransactionManager transactionManager;
    private final Object source;
    private final TransactionImpl transaction;
    private final List<RequestListener<T>> successListeners = new ArrayList<>();
    private final List<RequestListener<T>> errorListeners = new ArrayList<>();
    private ReadyState readyState = ReadyState.PENDING;
    private T result;
    private DatabaseException error;
    private boolean defaultPrevented;
    private Runnable resolver;

    RequestImpl(EventLoop eventLoop, TransactionManager transactionManager, Object source,
                TransactionImpl transaction) {
        this.eventLoop = eventLoop;
        this.transactionManager = transactionManager;
        this.source = source;
        this.transaction = transaction;
    }

    @Override
    public ReadyState getReadyState() {
        return readyState;
    }

    @Override
    public T getResult() throws InvalidStateException {
        checkDone();
        return result;
    }

    @Override
    public DatabaseException getError() throws InvalidStateException {
        checkDone();
        return error;
    }

    @Override
    public Object getSource() {
        return source;
    }

    @Override
    public com.memidb.api.Transaction getTransaction() {
        return transaction;
    }

    @Override
    public Request<T> onSuccess(RequestListener<T> listener) {
        successListeners.add(listener);
        return this;
    }

    @Override
    public Request<T> onError(RequestListener<T> listener) {
        errorListeners.add(listener);
        return this;
    }

    @Override
    public void preventDefault() {
        defaultPrevented = true;
    }

    void succeed(T result) {
        this.result = result;
        this.error = null;
    }

    void fail(DatabaseException error) {
        this.result = null;
        this.error = error;
    }

    /**
     * Sets an action that runs when the request is delivered successfully,
     * before its listeners.
     */
    void setResolver(Runnable resolver) {
        this.resolver = resolver;
    }

    /**
     * Registers the request with its transaction and schedules its delivery.
     *
     * @throws InvalidStateException if the transaction is not active
     */
    void issue() throws InvalidStateException {
        if (transaction != null)
            transactionManager.requestIssued(transaction.getTrans(), this);
        schedule();
    }

    /**
     * Schedules delivery of a request that does not belong to a transaction,
     * or that has already been registered with one.
     */
    void schedule() {
        readyState = ReadyState.PENDING;
        defaultPrevented = false;
        eventLoop.post(this::deliver);
    }

    void deliver() {
        if (error == null && resolver != null)
            resolver.run();
        readyState = ReadyState.DONE;

        DatabaseException unhandled = null;
        if (error == null) {
            fire(successListeners);
        } else {
            fire(errorListeners);
            if (!defaultPrevented)
                unhandled = error;
        }

        if (transaction != null)
            transactionManager.requestDelivered(transaction.getTrans(), this, unhandled);
    }

    @Override
    public void abortPending(AbortException abortError) {
        if (readyState == ReadyState.DONE)
            return;
        fail(abortError);
    }

    private void fire(List<RequestListener<T>> listeners) {
        for (RequestListener<T> listener : new ArrayList<>(listeners)) {
            try {
                listener.handleEvent(this);
            } catch (DatabaseException e) {
                log.warn("Request listener failed", e);
                abortTransaction(e);
            } catch (RuntimeException e) {
                log.warn("Request listener failed", e);
                abortTransaction(new AbortException("Request listener failed", e));
            }
        }
    }

    private void abortTransaction(DatabaseException cause) {
        if (transaction != null)
            transactionManager.abortTransaction(transaction.getTrans(), cause);
    }

    private void checkDone() throws InvalidStateException {
        if (readyState == ReadyState.PENDING)
            throw new InvalidStateException("The request has not finished");
    }

    @Override
    public String toString() {
        return "Request[" + source + ", " + readyState + (error == null ? "" : ", " + error.getErrorName()) + "]";
    }
}
