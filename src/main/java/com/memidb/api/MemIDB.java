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

import com.memidb.api.impl.RegistryImpl;
import com.memidb.event.EventLoop;
import com.memidb.seed.DatabaseContents;
import com.memidb.seed.DatabaseSchema;

import java.util.List;
import java.util.SortedMap;

/**
 * MemIDB is an in-memory, transactional, versioned object database for tests.
 * Each instance owns an independent set of named databases and the
 * {@link EventLoop} that delivers their notifications.
 * <p>
 * Every operation applies its effect when called and returns a
 * {@link Request}; success and error listeners run only when the event loop
 * is driven, with {@link #runOnce} or {@link #runUntilIdle}:
 *
 * <pre>
 * MemIDB memidb = new MemIDB();
 * memidb.open("shop", 1)
 *         .onUpgradeNeeded(event -&gt; event.getConnection().createObjectStore("orders",
 *                 new StoreOptions().setKeyPath("id").setAutoIncrement(true)))
 *         .onSuccess(request -&gt; connection = request.getResult());
 * memidb.runUntilIdle();
 * </pre>
 * <p>
 * The fixture methods {@link #seedDatabase}, {@link #getDatabase},
 * {@link #getStore}, {@link #getAllDatabases} and {@link #clearAllDatabases}
 * read and write databases directly, bypassing transactions and the event
 * loop.
 *
 * @see Connection
 * @see Request
 */
public class MemIDB {
    private final RegistryImpl registry;

    public MemIDB() {
        registry = new RegistryImpl(new EventLoop());
    }

    /**
     * Opens a database at its current version, creating it at version 1 if
     * it does not exist.
     *
     * @param name the database name
     * @return the open request
     */
    public OpenRequest open(String name) {
        return registry.open(name, 0);
    }

    /**
     * Opens a database at the given version. If the database does not exist
     * or is at a lower version, the request's upgrade listeners run within a
     * <code>versionchange</code> transaction before the connection is
     * delivered. If the database is at a higher version, the request fails
     * with a {@link VersionException}.
     *
     * @param name    the database name
     * @param version the version, at least 1
     * @return the open request
     */
    public OpenRequest open(String name, long version) {
        if (version < 1)
            throw new IllegalArgumentException("version must be positive: " + version);
        return registry.open(name, version);
    }

    /**
     * Deletes a database and closes its connections. Deleting a database
     * that does not exist succeeds.
     *
     * @param name the database name
     * @return a request with a null result
     */
    public Request<Void> deleteDatabase(String name) {
        return registry.deleteDatabase(name);
    }

    /**
     * Lists the databases.
     *
     * @return a request whose result is the name and version of every
     * database
     */
    public Request<List<DatabaseInfo>> databases() {
        return registry.databases();
    }

    /**
     * Compares two keys.
     *
     * @return -1, 0 or 1 as the first key sorts before, with or after the
     * second
     */
    public int cmp(Key a, Key b) {
        if (a == null || b == null)
            throw new IllegalArgumentException("keys must not be null");
        return Integer.signum(a.compareTo(b));
    }

    public EventLoop getEventLoop() {
        return registry.getEventLoop();
    }

    /**
     * Runs the next pending notification.
     *
     * @return true if there was one
     */
    public boolean runOnce() {
        return registry.getEventLoop().runOnce();
    }

    /**
     * Runs notifications until none remain.
     * <p>
     * A single call runs at most {@link EventLoop#getMaxTurns()} turns,
     * {@link EventLoop#DEFAULT_MAX_TURNS} unless changed through
     * {@link #getEventLoop()}. A cursor walk takes one turn per step, so
     * walking larger stores in one call needs a higher limit.
     *
     * @return the number of turns run
     * @throws IllegalStateException if notifications are still pending after
     *                               the maximum number of turns
     */
    public int runUntilIdle() {
        return registry.getEventLoop().runUntilIdle();
    }

    /**
     * Loads a database from a fixture schema, replacing any database of the
     * same name.
     *
     * @param schema the schema and records
     * @throws DatabaseException if the schema is inconsistent or its records
     *                           violate a unique index
     */
    public void seedDatabase(DatabaseSchema schema) throws DatabaseException {
        registry.seedDatabase(schema);
    }

    /**
     * Copies the version and records of a database.
     *
     * @param name the database name
     * @return the contents, or null if there is no such database
     */
    public DatabaseContents getDatabase(String name) {
        return registry.getDatabase(name);
    }

    /**
     * Copies the records of a store.
     *
     * @param databaseName the database name
     * @param storeName    the store name
     * @return the records in key order, or null if there is no such store
     */
    public SortedMap<Key, Value> getStore(String databaseName, String storeName) {
        return registry.getStore(databaseName, storeName);
    }

    public List<DatabaseContents> getAllDatabases() {
        return registry.getAllDatabases();
    }

    /**
     * Deletes every database at once.
     */
    public void clearAllDatabases() {
        registry.clearAllDatabases();
    }
}
