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

package com.memidb.core;

import com.memidb.api.ConstraintException;
import com.memidb.api.DatabaseException;
import com.memidb.api.InvalidAccessException;
import com.memidb.api.KeyPath;
import com.memidb.api.NotFoundException;
import com.memidb.storage.Dataset;
import com.memidb.transaction.Transaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeMap;

/**
 * DatabaseCore is the state of one named database: its version and its
 * catalog of object stores, each backed by a {@link Dataset}.
 * <p>
 * The catalog changes only within the database's upgrade transaction, which
 * is also recorded here so that other transactions can be kept out while it
 * runs. Catalog changes are logged to the transaction's undo log.
 */
public class DatabaseCore {

    private final String name;
    private long version;
    private final TreeMap<String, Dataset> stores = new TreeMap<>();
    private Transaction upgradeTransaction;

    public DatabaseCore(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    /**
     * Gets the upgrade transaction in progress.
     *
     * @return the transaction, or null if the database is not being upgraded
     */
    public Transaction getUpgradeTransaction() {
        return upgradeTransaction;
    }

    public void setUpgradeTransaction(Transaction upgradeTransaction) {
        this.upgradeTransaction = upgradeTransaction;
    }

    public List<String> getStoreNames() {
        return new ArrayList<>(stores.keySet());
    }

    public Collection<Dataset> getStores() {
        return stores.values();
    }

    /**
     * Gets a store.
     *
     * @param name the store name
     * @return the store, or null if there is none
     */
    public Dataset getStore(String name) {
        return stores.get(name);
    }

    /**
     * Creates a store.
     *
     * @param trans      the upgrade transaction, or null
     * @param descriptor the store definition
     * @return the new store
     * @throws ConstraintException    if the store exists
     * @throws InvalidAccessException if the store auto-increments with an
     *                                empty or compound key path
     */
    public Dataset createStore(Transaction trans, StoreDescriptor descriptor) throws DatabaseException {
        String storeName = descriptor.getName();
        if (stores.containsKey(storeName))
            throw new ConstraintException("Object store " + storeName + " already exists in database " + name);
        KeyPath keyPath = descriptor.getKeyPath();
        if (descriptor.isAutoIncrement() && keyPath != null
                && (keyPath.isCompound() || keyPath.getPath().isEmpty()))
            throw new InvalidAccessException("Object store " + storeName
                    + " cannot auto-increment with key path '" + keyPath + "'");

        Dataset dataset = new Dataset(descriptor);
        stores.put(storeName, dataset);
        if (trans != null)
            trans.logUndo(() -> stores.remove(storeName));
        return dataset;
    }

    /**
     * Deletes a store along with its records and indexes.
     *
     * @param trans     the upgrade transaction, or null
     * @param storeName the store name
     * @throws NotFoundException if there is no such store
     */
    public void deleteStore(Transaction trans, String storeName) throws NotFoundException {
        Dataset dataset = stores.remove(storeName);
        if (dataset == null)
            throw new NotFoundException("Object store " + storeName + " not found in database " + name);
        if (trans != null)
            trans.logUndo(() -> stores.put(storeName, dataset));
    }

    @Override
    public String toString() {
        return name + "@" + version + stores.keySet();
    }
}
