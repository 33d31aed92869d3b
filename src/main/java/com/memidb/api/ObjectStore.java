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
 * <code>ObjectStore</code> is a handle to a named store of records, ordered by
 * primary key, within the scope of one {@link Transaction}.
 * <p>
 * The primary key of a record is either supplied explicitly (out-of-line
 * keys), read from the value through the store's {@link KeyPath} (in-line
 * keys), or generated by the store's key generator when the store was
 * created with auto-increment. Generated keys are written back into the value
 * at the key path when the store has one.
 * <p>
 * Every operation returns a {@link Request} immediately. Writes are applied
 * at once and every index of the store is updated before the operation
 * returns. Failures that depend on the data, such as a duplicate key, are
 * reported through the request. Misuse, such as a write in a read-only
 * transaction, throws.
 * <p>
 * A null <code>KeyRange</code> selects every record.
 *
 * @see Index
 * @see Cursor
 */
public interface ObjectStore {

    String getName();

    /**
     * Gets the key path of the store.
     *
     * @return the key path, or null if the store uses out-of-line keys
     */
    KeyPath getKeyPath();

    boolean isAutoIncrement();

    /**
     * Gets the names of the indexes of this store, in ascending order.
     *
     * @return the index names
     */
    List<String> getIndexNames();

    Transaction getTransaction();

    /**
     * Inserts a record, failing if one with the same key exists.
     *
     * @param value the value to store
     * @return a request whose result is the primary key of the new record
     * @throws ReadOnlyException     if the transaction is read-only
     * @throws InvalidStateException if the transaction is not active
     */
    Request<Key> add(Value value) throws DatabaseException;

    /**
     * Inserts a record with an explicit key, failing if one with the same key
     * exists.
     *
     * @param value the value to store
     * @param key   the primary key
     * @return a request whose result is the primary key of the new record
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Key> add(Value value, Key key) throws DatabaseException;

    /**
     * Inserts or replaces a record.
     *
     * @param value the value to store
     * @return a request whose result is the primary key of the record
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Key> put(Value value) throws DatabaseException;

    Request<Key> put(Value value, Key key) throws DatabaseException;

    /**
     * Gets the value of the record with the given key.
     *
     * @param key the primary key
     * @return a request whose result is the value, or null if there is no
     * such record
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Value> get(Key key) throws DatabaseException;

    /**
     * Gets the value of the first record in the range.
     *
     * @param range the key range
     * @return a request whose result is the value, or null
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Value> get(KeyRange range) throws DatabaseException;

    /**
     * Gets the primary key of the record with the given key, which tests
     * whether the record exists.
     *
     * @param key the primary key
     * @return a request whose result is the key, or null
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Key> getKey(Key key) throws DatabaseException;

    Request<Key> getKey(KeyRange range) throws DatabaseException;

    Request<List<Value>> getAll() throws DatabaseException;

    Request<List<Value>> getAll(KeyRange range) throws DatabaseException;

    /**
     * Gets the values of the records in the range, in key order.
     *
     * @param range the key range
     * @param count the maximum number of values, or 0 for no limit
     * @return a request whose result is the list of values
     * @throws DatabaseException if the request cannot be issued
     */
    Request<List<Value>> getAll(KeyRange range, int count) throws DatabaseException;

    Request<List<Key>> getAllKeys() throws DatabaseException;

    Request<List<Key>> getAllKeys(KeyRange range) throws DatabaseException;

    Request<List<Key>> getAllKeys(KeyRange range, int count) throws DatabaseException;

    Request<Integer> count() throws DatabaseException;

    Request<Integer> count(KeyRange range) throws DatabaseException;

    /**
     * Deletes the record with the given key, if there is one.
     *
     * @param key the primary key
     * @return a request with a null result
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Void> delete(Key key) throws DatabaseException;

    Request<Void> delete(KeyRange range) throws DatabaseException;

    /**
     * Deletes every record in the store.
     *
     * @return a request with a null result
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Void> clear() throws DatabaseException;

    Request<CursorWithValue> openCursor() throws DatabaseException;

    Request<CursorWithValue> openCursor(KeyRange range) throws DatabaseException;

    /**
     * Opens a cursor over the records in the range. The request's result is
     * the cursor positioned at the first record in the given direction, or
     * null if the range is empty. The same request is delivered again each
     * time the cursor moves.
     *
     * @param range     the key range
     * @param direction the traversal direction
     * @return the cursor request
     * @throws DatabaseException if the request cannot be issued
     */
    Request<CursorWithValue> openCursor(KeyRange range, CursorDirection direction) throws DatabaseException;

    Request<Cursor> openKeyCursor() throws DatabaseException;

    Request<Cursor> openKeyCursor(KeyRange range) throws DatabaseException;

    /**
     * Opens a cursor over the keys in the range without loading values.
     *
     * @param range     the key range
     * @param direction the traversal direction
     * @return the cursor request
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Cursor> openKeyCursor(KeyRange range, CursorDirection direction) throws DatabaseException;

    Index createIndex(String name, String keyPath) throws DatabaseException;

    /**
     * Creates an index over the existing and future records of this store.
     * Only allowed within the upgrade transaction.
     *
     * @param name    the index name
     * @param keyPath where the index key lives in each value
     * @param options the unique and multi-entry flags
     * @return the new <code>Index</code>
     * @throws InvalidStateException if not in an upgrade
     * @throws ConstraintException   if the index already exists, or a
     *                               unique index cannot be built over
     *                               the existing records
     */
    Index createIndex(String name, KeyPath keyPath, IndexOptions options) throws DatabaseException;

    /**
     * Deletes an index. Only allowed within the upgrade transaction.
     *
     * @param name the index name
     * @throws InvalidStateException if not in an upgrade
     * @throws NotFoundException     if the index does not exist
     */
    void deleteIndex(String name) throws DatabaseException;

    /**
     * Gets a handle to an index of this store.
     *
     * @param name the index name
     * @return the <code>Index</code>
     * @throws NotFoundException if the index does not exist
     */
    Index index(String name) throws DatabaseException;
}
