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

import java.util.List;

/**
 * <code>Transaction</code> groups operations against a declared set of object
 * stores with a declared access mode.
 * <p>
 * A transaction is active from its creation. Every request issued keeps it
 * alive; once the event loop completes a turn with no outstanding request on
 * it, the transaction commits and its completion listeners run. It can also
 * be committed early with {@link #commit}, or cancelled with {@link #abort},
 * in which case every write it applied is reverted and its abort listeners
 * run instead.
 * <p>
 * An error on one of its requests that is not acknowledged with
 * {@link Request#preventDefault} aborts the transaction.
 *
 * @see Connection#transaction
 * @see Request
 */
public interface Transaction {

    TransactionMode getMode();

    TransactionState getState();

    /**
     * Gets the names of the stores in scope, in ascending order.
     *
     * @return the store names
     */
    List<String> getObjectStoreNames();

    /**
     * Gets the error that caused this transaction to abort.
     *
     * @return the error, or null if the transaction did not abort, or was
     * aborted explicitly
     */
    DatabaseException getError();

    Connection getConnection();

    /**
     * Gets a handle to one of the stores in scope.
     *
     * @param name the store name
     * @return the <code>ObjectStore</code>
     * @throws InvalidStateException if the transaction is finished or the
     *                               store is outside its scope
     * @throws NotFoundException     if the store no longer exists
     */
    ObjectStore objectStore(String name) throws DatabaseException;

    /**
     * Requests an early commit. No further requests may be issued; the
     * transaction commits once its outstanding requests are delivered.
     *
     * @throws InvalidStateException if the transaction is not active
     */
    void commit() throws DatabaseException;

    /**
     * Aborts the transaction. Writes are reverted immediately and requests
     * not yet delivered fail with an {@link AbortException}.
     *
     * @throws InvalidStateException if the transaction has already
     *                               committed or aborted
     */
    void abort() throws DatabaseException;

    Transaction onComplete(TransactionListener listener);

    Transaction onAbort(TransactionListener listener);
}
