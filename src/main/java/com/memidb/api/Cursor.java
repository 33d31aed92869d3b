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
 * <code>Cursor</code> iterates over the records of an {@link ObjectStore} or
 * {@link Index} within a key range, in one {@link CursorDirection}.
 * <p>
 * The cursor is the result of the request that opened it. Each movement
 * method issues that same request again; the cursor's position is updated
 * when the request is delivered. A cursor only ever moves in its direction.
 * When it runs past the last entry of the range it becomes exhausted: its
 * key is null and the request's result is null.
 * <p>
 * For a store cursor the key and the primary key are the same.
 *
 * @see CursorWithValue
 */
public interface Cursor {

    /**
     * Gets the store or index the cursor iterates over.
     *
     * @return an {@link ObjectStore} or an {@link Index}
     */
    Object getSource();

    CursorDirection getDirection();

    /**
     * Gets the key at the cursor's position.
     *
     * @return the key, or null if the cursor is exhausted
     */
    Key getKey();

    /**
     * Gets the primary key of the record at the cursor's position.
     *
     * @return the primary key, or null if the cursor is exhausted
     */
    Key getPrimaryKey();

    boolean isExhausted();

    /**
     * Gets the request that opened the cursor and is delivered again each
     * time it moves.
     */
    Request<?> getRequest();

    /**
     * Skips forward over <code>count</code> entries.
     *
     * @param count the number of entries to move, at least 1
     * @throws InvalidStateException    if the cursor is exhausted, already
     *                                  moving, or its transaction is not
     *                                  active
     * @throws IllegalArgumentException if count is not positive
     */
    void advance(int count) throws DatabaseException;

    /**
     * Moves to the next entry.
     *
     * @throws InvalidStateException if the cursor is exhausted, already
     *                               moving, or its transaction is not active
     */
    void continueCursor() throws DatabaseException;

    /**
     * Moves to the first entry at or past the given key in the cursor's
     * direction.
     *
     * @param key the key to seek
     * @throws DataException if the key is not past the current key
     */
    void continueCursor(Key key) throws DatabaseException;

    /**
     * Moves an index cursor to the first entry at or past the given index
     * key and primary key.
     *
     * @param key        the index key to seek
     * @param primaryKey the primary key to seek within that index key
     * @throws InvalidAccessException if the cursor is not on an index, or
     *                                its direction skips duplicates
     * @throws DataException          if the position is not past the current
     *                                one
     */
    void continuePrimaryKey(Key key, Key primaryKey) throws DatabaseException;

    /**
     * Replaces the value of the record at the cursor's position. The cursor
     * does not move.
     *
     * @param value the new value
     * @return a request whose result is the primary key of the record
     * @throws ReadOnlyException     if the transaction is read-only
     * @throws InvalidStateException if the cursor is moving, exhausted or was
     *                               opened without values
     * @throws DataException         if the value carries a different in-line key
     */
    Request<Key> update(Value value) throws DatabaseException;

    /**
     * Deletes the record at the cursor's position. The cursor does not move.
     *
     * @return a request with a null result
     * @throws DatabaseException if the request cannot be issued
     */
    Request<Void> delete() throws DatabaseException;
}
