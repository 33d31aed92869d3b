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

package com.memidb.api;

/**
 * <code>Request</code> is the handle returned by every data operation. The
 * effect of the operation is applied immediately, when the operation is
 * issued, but its outcome is announced later: success or error listeners
 * are never invoked before the code that issued the request has returned
 * control to the {@link com.memidb.event.EventLoop}.
 * <p>
 * Requests issued against the same transaction are delivered in the order
 * they were issued, and all of them are delivered before the transaction's
 * completion notification.
 * <p>
 * An error that no error listener acknowledges with {@link #preventDefault}
 * aborts the owning transaction.
 *
 * @param <T> the type of the result
 * @see Transaction
 */
public interface Request<T> {

    enum ReadyState {
        PENDING, DONE
    }

    ReadyState getReadyState();

    /**
     * Gets the result of a successful request.
     *
     * @return the result, or null if the request failed
     * @throws InvalidStateException if the request is still pending
     */
    T getResult() throws InvalidStateException;

    /**
     * Gets the error of a failed request.
     *
     * @return the error, or null if the request succeeded
     * @throws InvalidStateException if the request is still pending
     */
    DatabaseException getError() throws InvalidStateException;

    /**
     * Gets the object the request was issued against: an {@link ObjectStore},
     * an {@link Index}, a {@link Cursor}, or null for database requests.
     */
    Object getSource();

    /**
     * Gets the owning transaction, or null for requests that do not belong
     * to one.
     */
    Transaction getTransaction();

    Request<T> onSuccess(RequestListener<T> listener);

    Request<T> onError(RequestListener<T> listener);

    /**
     * Acknowledges the error of this request so that it does not abort the
     * owning transaction. Only meaningful when called from an error listener.
     */
    void preventDefault();
}
