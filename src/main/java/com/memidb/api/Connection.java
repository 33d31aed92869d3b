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
 * <code>Connection</code> is an open handle to a named, versioned database
 * obtained through {@link MemIDB#open}.
 * <p>
 * All reads and writes go through a {@link Transaction} created with
 * {@link #transaction}. The set of object stores can only be changed while the
 * connection is being upgraded, that is from within the
 * {@link UpgradeListener} of the open request that produced it.
 *
 * @see MemIDB
 * @see Transaction
 */
public interface Connection {
    /**
     * Gets the name of the database.
     *
     * @return the database name
     */
    String getName();

    /**
     * Gets the version of the database as seen by this connection.
     *
     * @return the database version
     */
    long getVersion();

    /**
     * Gets the names of the object stores of the database, in ascending
     * order.
     *
     * @return the store names
     */
    List<String> getObjectStoreNames();

    /**
     * Creates an object store with out-of-line keys and no key generator.
     *
     * @param name the name of the new store
     * @return the new <code>ObjectStore</code>, scoped to the upgrade
     * transaction
     * @throws DatabaseException if the connection is not being upgraded or
     *                           the store already exists
     * @see #createObjectStore(String, StoreOptions)
     */
    ObjectStore createObjectStore(String name) throws DatabaseException;

    /**
     * Creates an object store.
     *
     * @param name    the name of the new store
     * @param options the key path and key generator options
     * @return the new <code>ObjectStore</code>, scoped to the upgrade
     * transaction
     * @throws InvalidStateException  if the connection is not being upgraded
     * @throws ConstraintException    if a store with the same name exists
     * @throws InvalidAccessException if a key generator is requested with an
     *                                empty or compound key path
     */
    ObjectStore createObjectStore(String name, StoreOptions options) throws DatabaseException;

    /**
     * Deletes an object store along with its records and indexes.
     *
     * @param name the name of the store to delete
     * @throws InvalidStateException if the connection is not being upgraded
     * @throws NotFoundException     if the store does not exist
     */
    void deleteObjectStore(String name) throws DatabaseException;

    /**
     * Creates a read-only transaction over a single store.
     *
     * @param storeName the store in scope
     * @return the new transaction
     * @throws DatabaseException if the transaction cannot be created
     */
    Transaction transaction(String storeName) throws DatabaseException;

    /**
     * Creates a transaction over a single store.
     *
     * @param storeName the store in scope
     * @param mode      <code>READONLY</code> or <code>READWRITE</code>
     * @return the new transaction
     * @throws DatabaseException if the transaction cannot be created
     */
    Transaction transaction(String storeName, TransactionMode mode) throws DatabaseException;

    /**
     * Creates a transaction. The transaction is active until the current
     * turn of the event loop ends without outstanding requests, then it
     * commits by itself.
     *
     * @param storeNames the stores in scope
     * @param mode       <code>READONLY</code> or <code>READWRITE</code>
     * @return the new transaction
     * @throws InvalidStateException    if the connection is closed or the
     *                                  database is being upgraded
     * @throws InvalidAccessException   if the scope is empty
     * @throws NotFoundException        if a store in scope does not exist
     * @throws IllegalArgumentException if the mode is
     *                                  <code>VERSIONCHANGE</code>
     */
    Transaction transaction(List<String> storeNames, TransactionMode mode) throws DatabaseException;

    /**
     * Closes this connection. Transactions already created run to
     * completion, but no new ones can be created.
     */
    void close();

    boolean isClosed();
}
