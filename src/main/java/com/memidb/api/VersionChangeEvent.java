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
 * Describes a schema upgrade in progress.
 */
public class VersionChangeEvent {
    private final long oldVersion;
    private final long newVersion;
    private final Connection connection;
    private final Transaction transaction;

    public VersionChangeEvent(long oldVersion, long newVersion, Connection connection,
                              Transaction transaction) {
        this.oldVersion = oldVersion;
        this.newVersion = newVersion;
        this.connection = connection;
        this.transaction = transaction;
    }

    /**
     * Gets the version before the upgrade, 0 when the database is new.
     */
    public long getOldVersion() {
        return oldVersion;
    }

    public long getNewVersion() {
        return newVersion;
    }

    /**
     * Gets the connection being opened; use it to create and delete object
     * stores.
     */
    public Connection getConnection() {
        return connection;
    }

    /**
     * Gets the <code>versionchange</code> transaction that scopes every
     * store of the database.
     */
    public Transaction getTransaction() {
        return transaction;
    }
}
