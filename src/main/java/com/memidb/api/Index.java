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
 * <code>Index</code> is a handle to a secondary ordering of the records of an
 * {@link ObjectStore}, keyed by a value extracted from each record through the
 * index's {@link KeyPath}.
 * <p>
 * Records whose value does not yield a valid key at the key path are not
 * indexed. A multi-entry index maps each element of an array value to the
 * record separately. Several records may share an index key unless the index
 * is unique; entries with the same index key are ordered by primary key.
 * <p>
 * Reads through an index return the records, or their primary keys for
 * {@link #getKey} and {@link #getAllKeys}.
 *
 * @see ObjectStore#createIndex
 */
public interface Index {

    String getName();

    KeyPath getKeyPath();

    boolean isUnique();

    boolean isMultiEntry();

    ObjectStore getObjectStore();

    /**
     * Gets the value of the first record with the given index key.
     *
     * @param key the index key
     * @return a request whose result is the value, or null
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Value> get(Key key) throws DatabaseException;

    Request<Value> get(KeyRange range) throws DatabaseException;

    /**
     * Gets the primary key of the first record with the given index key.
     *
     * @param key the index key
     * @return a request whose result is the primary key, or null
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Key> getKey(Key key) throws DatabaseException;

    Request<Key> getKey(KeyRange range) throws DatabaseException;

    Request<List<Value>> getAll() throws DatabaseException;

    Request<List<Value>> getAll(KeyRange range) throws DatabaseException;

    Request<List<Value>> getAll(KeyRange range, int count) throws DatabaseException;

    Request<List<Key>> getAllKeys() throws DatabaseException;

    Request<List<Key>> getAllKeys(KeyRange range) throws DatabaseException;

    Request<List<Key>> getAllKeys(KeyRange range, int count) throws DatabaseException;

    Request<Integer> count() throws DatabaseException;

    Request<Integer> count(KeyRange range) throws DatabaseException;

    Request<CursorWithValue> openCursor() throws DatabaseException;

    Request<CursorWithValue> openCursor(KeyRange range) throws DatabaseException;

    Request<CursorWithValue> openCursor(KeyRange range, CursorDirection direction) throws DatabaseException;

    Request<Cursor> openKeyCursor() throws DatabaseException;

    Request<Cursor> openKeyCursor(KeyRange range) throws DatabaseException;

    Request<Cursor> openKeyCursor(KeyRange range, CursorDirection direction) throws DatabaseException;
}
