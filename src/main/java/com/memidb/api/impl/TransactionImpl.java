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
import com.memidb.core.DatabaseCore;
import com.memidb.storage.Dataset;
import com.memidb.transaction.Transaction;
import com.memidb.transaction.TransactionManager;
import com.memidb.transaction.TransactionObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class TransactionImpl implements com.memidb.api.Transaction, TransactionObserver {

    private static final Logger log = LoggerFactory.getLogger(TransactionImpl.class);

    final ConnectionImpl connection;
    final TransactionManager transactionManager;
    private final Transaction trans;
    private final TransactionObserver next;
    private final Map<String, ObjectStoreImpl> stores = new HashMap<>();
    private final List<TransactionListener> completeListeners = new ArrayList<>();
    private final List<TransactionListener> abortListeners = new ArrayList<>();

    /**
     * Wraps an engine transaction and takes over its observer.
     *
     * @param connection         the connection that created the transaction
     * @param transactionManager the manager driving the transaction
     * @param trans              the engine transaction
     * @param next               notified after this transaction's own
     *                           listeners, or null
     */
    TransactionImpl(ConnectionImpl connection, TransactionManager transactionManager, Transaction trans,
                    TransactionObserver next) {
        this.connection = connection;
        this.transactionManager = transactionManager;
        this.trans = trans;
        this.next = next;
        trans.setObserver(this);
    }

    Transaction getTrans() {
        return trans;
    }

    DatabaseCore getDatabase() {
        return trans.getDatabase();
    }

    <T> RequestImpl<T> newRequest(Object source) {
        return new RequestImpl<>(transactionManager.getEventLoop(), transactionManager, source, this);
    }

    @Override
    public TransactionMode getMode() {
        return trans.getMode();
    }

    @Override
    public TransactionState getState() {
        return trans.getState();
    }

    @Override
    public List<String> getObjectStoreNames() {
        if (trans.getMode() == TransactionMode.VERSIONCHANGE)
            return getDatabase().getStoreNames();
        return trans.getScope();
    }

    @Override
    public DatabaseException getError() {
        return trans.getError();
    }

    @Override
    public Connection getConnection() {
        return connection;
    }

    @Override
    public ObjectStore objectStore(String name) throws DatabaseException {
        if (trans.getState().isFinished())
            throw new InvalidStateException("Transaction " + trans.getTransId() + " has finished");
        if (!trans.isInScope(name))
            throw new InvalidStateException("Object store " + name + " is not in the scope of transaction "
                    + trans.getTransId());
        Dataset dataset = getDatabase().getStore(name);
        if (dataset == null)
            throw new NotFoundException("Object store " + name + " not found");
        return storeHandle(dataset);
    }

    /**
     * Gets the handle of a store within this transaction, creating it on first
     * use.
     */
    ObjectStoreImpl storeHandle(Dataset dataset) {
        ObjectStoreImpl store = stores.get(dataset.getName());
        if (store == null || store.dataset != dataset) {
            store = new ObjectStoreImpl(this, dataset);
            stores.put(dataset.getName(), store);
        }
        return store;
    }

    @Override
    public void commit() throws DatabaseException {
        transactionManager.commitTransaction(trans);
    }

    @Override
    public void abort() throws DatabaseException {
        if (trans.getState().isFinished())
            throw new InvalidStateException("Transaction " + trans.getTransId() + " has already "
                    + trans.getState().name().toLowerCase());
        transactionManager.abortTransaction(trans, null);
    }

    @Override
    public com.memidb.api.Transaction onComplete(TransactionListener listener) {
        completeListeners.add(listener);
        return this;
    }

    @Override
    public com.memidb.api.Transaction onAbort(TransactionListener listener) {
        abortListeners.add(listener);
        return this;
    }

    @Override
    public void transactionCompleted(Transaction trans) {
        fire(completeListeners);
        if (next != null)
            next.transactionCompleted(trans);
    }

    @Override
    public void transactionAborted(Transaction trans) {
        fire(abortListeners);
        if (next != null)
            next.transactionAborted(trans);
    }

    private void fire(List<TransactionListener> listeners) {
        for (TransactionListener listener : new ArrayList<>(listeners)) {
            try {
                listener.handleEvent(this);
            } catch (DatabaseException | RuntimeException e) {
                // the transaction has already finished
                log.warn("Listener of transaction {} failed", trans.getTransId(), e);
            }
        }
    }

    @Override
    public String toString() {
        return trans.toString();
    }
}
