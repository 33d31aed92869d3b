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
import com.memidb.core.IndexDescriptor;
import com.memidb.core.StoreDescriptor;
import com.memidb.event.EventLoop;
import com.memidb.seed.DatabaseContents;
import com.memidb.seed.DatabaseSchema;
import com.memidb.seed.IndexSchema;
import com.memidb.seed.StoreSchema;
import com.memidb.storage.Dataset;
import com.memidb.transaction.Transaction;
import com.memidb.transaction.TransactionManager;
import com.memidb.transaction.TransactionObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * RegistryImpl owns the databases of one {@link MemIDB} and carries out the
 * database requests: opening with its version upgrade, deletion and listing.
 * <p>
 * Database requests are processed in turns of their own, in the order they
 * were made. Requests for a database that is being upgraded wait until the
 * upgrade has finished.
 */
public class RegistryImpl {

    private static final Logger log = LoggerFactory.getLogger(RegistryImpl.class);

    private final EventLoop eventLoop;
    private final TransactionManager transactionManager;
    private final TreeMap<String, DatabaseCore> databases = new TreeMap<>();
    private final Map<DatabaseCore, List<ConnectionImpl>> connections = new IdentityHashMap<>();
    private final Map<String, ArrayDeque<Runnable>> waiting = new HashMap<>();

    public RegistryImpl(EventLoop eventLoop) {
        this.eventLoop = eventLoop;
        this.transactionManager = new TransactionManager(eventLoop);
    }

    public EventLoop getEventLoop() {
        return eventLoop;
    }

    TransactionManager getTransactionManager() {
        return transactionManager;
    }

    public OpenRequest open(String name, long version) {
        checkName(name);
        if (version < 0)
            throw new IllegalArgumentException("version must be positive: " + version);
        OpenRequestImpl request = new OpenRequestImpl(eventLoop, transactionManager, name, version);
        eventLoop.post(() -> processOpen(request));
        return request;
    }

    public Request<Void> deleteDatabase(String name) {
        checkName(name);
        RequestImpl<Void> request = new RequestImpl<>(eventLoop, transactionManager, null, null);
        eventLoop.post(() -> processDelete(name, request));
        return request;
    }

    public Request<List<DatabaseInfo>> databases() {
        RequestImpl<List<DatabaseInfo>> request = new RequestImpl<>(eventLoop, transactionManager, null, null);
        List<DatabaseInfo> infos = new ArrayList<>();
        for (DatabaseCore database : databases.values())
            infos.add(new DatabaseInfo(database.getName(), database.getVersion()));
        request.succeed(infos);
        request.schedule();
        return request;
    }

    private void processOpen(OpenRequestImpl request) {
        String name = request.getName();
        if (mustWait(name, () -> processOpen(request)))
            return;

        DatabaseCore database = databases.get(name);
        boolean created = database == null;
        long oldVersion = created ? 0 : database.getVersion();
        long newVersion = request.getVersion() == 0 ? Math.max(oldVersion, 1) : request.getVersion();

        if (newVersion < oldVersion) {
            request.fail(new VersionException("Database " + name + " is at version " + oldVersion
                    + ", which is higher than the requested version " + newVersion));
            request.schedule();
            return;
        }

        if (created) {
            database = new DatabaseCore(name);
            databases.put(name, database);
            log.debug("Created database {}", name);
        }

        ConnectionImpl connection = new ConnectionImpl(this, database, newVersion);
        connections.computeIfAbsent(database, d -> new ArrayList<>()).add(connection);
        request.succeed(connection);

        if (newVersion == oldVersion) {
            request.schedule();
            return;
        }

        upgrade(request, connection, database, oldVersion, newVersion, created);
    }

    private void upgrade(OpenRequestImpl request, ConnectionImpl connection, DatabaseCore database,
                         long oldVersion, long newVersion, boolean created) {
        String name = database.getName();
        UpgradeObserver observer = new UpgradeObserver(request, connection);
        Transaction trans;
        try {
            trans = transactionManager.beginTransaction(database, TransactionMode.VERSIONCHANGE,
                    Collections.emptyList(), null);
        } catch (InvalidStateException e) {
            // another upgrade holds the database
            connection.close();
            request.fail(e);
            request.schedule();
            return;
        }
        TransactionImpl upgrade = new TransactionImpl(connection, transactionManager, trans, observer);
        connection.setUpgrade(upgrade);

        database.setVersion(newVersion);
        trans.logUndo(() -> {
            database.setVersion(oldVersion);
            if (created && databases.get(name) == database)
                databases.remove(name);
        });
        log.debug("Upgrading database {} from version {} to {}", name, oldVersion, newVersion);

        DatabaseException failure = request.fireUpgradeNeeded(
                new VersionChangeEvent(oldVersion, newVersion, connection, upgrade));
        if (failure != null)
            transactionManager.abortTransaction(trans, failure);
    }

    private void processDelete(String name, RequestImpl<Void> request) {
        if (mustWait(name, () -> processDelete(name, request)))
            return;

        DatabaseCore database = databases.remove(name);
        if (database != null) {
            closeConnections(database);
            log.debug("Deleted database {}", name);
        }
        request.succeed(null);
        request.schedule();
    }

    /**
     * Queues a database request behind a running upgrade.
     *
     * @return true if the request was queued
     */
    private boolean mustWait(String name, Runnable retry) {
        DatabaseCore database = databases.get(name);
        if (database == null || database.getUpgradeTransaction() == null)
            return false;
        waiting.computeIfAbsent(name, n -> new ArrayDeque<>()).add(retry);
        return true;
    }

    private void resume(String name) {
        ArrayDeque<Runnable> queue = waiting.remove(name);
        if (queue != null) {
            for (Runnable retry : queue)
                eventLoop.post(retry);
        }
    }

    void connectionClosed(ConnectionImpl connection) {
        List<ConnectionImpl> open = connections.get(connection.database);
        if (open != null) {
            open.remove(connection);
            if (open.isEmpty())
                connections.remove(connection.database);
        }
    }

    private void closeConnections(DatabaseCore database) {
        List<ConnectionImpl> open = connections.remove(database);
        if (open != null) {
            for (ConnectionImpl connection : new ArrayList<>(open))
                connection.close();
        }
    }

    /**
     * Creates a database from a fixture schema, replacing any database of the
     * same name. Records for which no key can be resolved are skipped.
     *
     * @param schema the fixture schema
     * @throws DatabaseException if the schema is inconsistent, or its records
     *                           violate a unique index
     */
    public void seedDatabase(DatabaseSchema schema) throws DatabaseException {
        DatabaseCore database = new DatabaseCore(schema.getName());
        database.setVersion(schema.getVersion());

        for (StoreSchema storeSchema : schema.getStores()) {
            Dataset dataset = database.createStore(null, new StoreDescriptor(storeSchema.getName(),
                    storeSchema.getKeyPath(), storeSchema.isAutoIncrement()));
            for (IndexSchema indexSchema : storeSchema.getIndexes()) {
                dataset.createIndex(null, new IndexDescriptor(indexSchema.getName(), indexSchema.getKeyPath(),
                        indexSchema.isUnique(), indexSchema.isMultiEntry()));
            }
            for (StoreSchema.Entry entry : storeSchema.getEntries()) {
                try {
                    dataset.put(null, entry.getValue(), entry.getKey());
                } catch (DataException e) {
                    log.debug("Skipped record without a valid key in {}.{}: {}", schema.getName(),
                            storeSchema.getName(), e.getMessage());
                }
            }
        }

        DatabaseCore previous = databases.put(schema.getName(), database);
        if (previous != null)
            closeConnections(previous);
        log.debug("Seeded database {} at version {} with stores {}", schema.getName(), schema.getVersion(),
                database.getStoreNames());
    }

    public SortedMap<Key, Value> getStore(String databaseName, String storeName) {
        DatabaseCore database = databases.get(databaseName);
        Dataset dataset = database == null ? null : database.getStore(storeName);
        return dataset == null ? null : dataset.getRecords().snapshot();
    }

    public DatabaseContents getDatabase(String name) {
        DatabaseCore database = databases.get(name);
        return database == null ? null : contents(database);
    }

    public List<DatabaseContents> getAllDatabases() {
        List<DatabaseContents> all = new ArrayList<>();
        for (DatabaseCore database : databases.values())
            all.add(contents(database));
        return all;
    }

    /**
     * Deletes every database immediately, closing their connections. Database
     * requests waiting behind an aborted upgrade are processed against the
     * emptied registry.
     */
    public void clearAllDatabases() {
        for (DatabaseCore database : new ArrayList<>(databases.values()))
            closeConnections(database);
        databases.clear();
        for (String name : new ArrayList<>(waiting.keySet()))
            resume(name);
        log.debug("Cleared all databases");
    }

    private static DatabaseContents contents(DatabaseCore database) {
        Map<String, SortedMap<Key, Value>> stores = new LinkedHashMap<>();
        for (Dataset dataset : database.getStores())
            stores.put(dataset.getName(), dataset.getRecords().snapshot());
        return new DatabaseContents(database.getName(), database.getVersion(), stores);
    }

    private static void checkName(String name) {
        if (name == null)
            throw new IllegalArgumentException("Database name must not be null");
    }

    /**
     * Completes an open request once its upgrade transaction has finished.
     */
    private class UpgradeObserver implements TransactionObserver {
        private final OpenRequestImpl request;
        private final ConnectionImpl connection;

        UpgradeObserver(OpenRequestImpl request, ConnectionImpl connection) {
            this.request = request;
            this.connection = connection;
        }

        @Override
        public void transactionCompleted(Transaction trans) {
            connection.setUpgrade(null);
            log.debug("Upgraded database {} to version {}", connection.getName(), connection.getVersion());
            request.schedule();
            resume(connection.getName());
        }

        @Override
        public void transactionAborted(Transaction trans) {
            connection.setUpgrade(null);
            connection.close();
            log.debug("Upgrade of database {} to version {} aborted", connection.getName(), connection.getVersion());
            request.fail(new AbortException("Upgrade of database " + connection.getName() + " was aborted",
                    trans.getError()));
            request.schedule();
            resume(connection.getName());
        }
    }
}
