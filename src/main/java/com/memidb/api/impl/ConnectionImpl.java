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
import com.memidb.core.StoreDescriptor;
import com.memidb.storage.Dataset;
import com.memidb.transaction.Transaction;

import java.util.Collections;
import java.util.List;

public class ConnectionImpl implements Connection {

    final RegistryImpl registry;
    final DatabaseCore database;
    private final long version;
    private TransactionImpl upgrade;
    private boolean closed;

    ConnectionImpl(RegistryImpl registry, DatabaseCore database, long version) {
        this.registry = registry;
        this.database = database;
        this.version = version;
    }

    void setUpgrade(TransactionImpl upgrade) {
        this.upgrade = upgrade;
    }

    @Override
    public String getName() {
        return database.getName();
    }

    @Override
    public long getVersion() {
        return version;
    }

    @Override
    public List<String> getObjectStoreNames() {
        return database.getStoreNames();
    }

    @Override
    public ObjectStore createObjectStore(String name) throws DatabaseException {
        return createObjectStore(name, new StoreOptions());
    }

    @Override
    public ObjectStore createObjectStore(String name, StoreOptions options) throws DatabaseException {
        if (name == null)
            throw new IllegalArgumentException("Object store name must not be null");
        if (options == null)
            options = new StoreOptions();
        TransactionImpl trans = validateUpgrade();
        Dataset dataset = database.createStore(trans.getTrans(),
                new StoreDescriptor(name, options.getKeyPath(), options.isAutoIncrement()));
        return trans.storeHandle(dataset);
    }

    @Override
    public void deleteObjectStore(String name) throws DatabaseException {
        TransactionImpl trans = validateUpgrade();
        database.deleteStore(trans.getTrans(), name);
    }

    @Override
    public com.memidb.api.Transaction transaction(String storeName) throws DatabaseException {
        return transaction(storeName, TransactionMode.READONLY);
    }

    @Override
    public com.memidb.api.Transaction transaction(String storeName, TransactionMode mode) throws DatabaseException {
        return transaction(Collections.singletonList(storeName), mode);
    }

    @Override
    public com.memidb.api.Transaction transaction(List<String> storeNames, TransactionMode mode)
            throws DatabaseException {
        if (mode == TransactionMode.VERSIONCHANGE)
            throw new IllegalArgumentException("versionchange transactions are only created by upgrades");
        if (closed)
            throw new InvalidStateException("Connection to database " + getName() + " is closed");
        if (storeNames.isEmpty())
            throw new InvalidAccessException("A transaction needs at least one object store in scope");
        for (String storeName : storeNames) {
            if (database.getStore(storeName) == null)
                throw new NotFoundException("Object store " + storeName + " not found in database " + getName());
        }

        Transaction trans = registry.getTransactionManager().beginTransaction(database, mode, storeNames, null);
        return new TransactionImpl(this, registry.getTransactionManager(), trans, null);
    }

    /**
     * Closes the connection. An upgrade still running on it is aborted.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        if (upgrade != null && !upgrade.getState().isFinished())
            registry.getTransactionManager().abortTransaction(upgrade.getTrans(),
                    new AbortException("Connection closed during upgrade"));
        registry.connectionClosed(this);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    private TransactionImpl validateUpgrade() throws InvalidStateException {
        if (upgrade == null || upgrade.getState() != TransactionState.ACTIVE)
            throw new InvalidStateException("Object stores can only be changed while upgrading the database");
        return upgrade;
    }

    @Override
    public String toString() {
        return "Connection[" + getName() + "@" + version + (closed ? ", closed" : "") + "]";
    }
}
