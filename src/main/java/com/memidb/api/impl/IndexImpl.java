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

import com.memidb.access.IndexTable;
import com.memidb.access.Position;
import com.memidb.api.*;

import java.util.ArrayList;
import java.util.List;

public class IndexImpl implements Index {

    final ObjectStoreImpl store;
    final IndexTable table;

    IndexImpl(ObjectStoreImpl store, IndexTable table) {
        this.store = store;
        this.table = table;
    }

    @Override
    public String getName() {
        return table.getDescriptor().getName();
    }

    @Override
    public KeyPath getKeyPath() {
        return table.getDescriptor().getKeyPath();
    }

    @Override
    public boolean isUnique() {
        return table.getDescriptor().isUnique();
    }

    @Override
    public boolean isMultiEntry() {
        return table.getDescriptor().isMultiEntry();
    }

    @Override
    public ObjectStore getObjectStore() {
        return store;
    }

    @Override
    public Request<Value> get(Key key) throws DatabaseException {
        return get(KeyRange.only(key));
    }

    @Override
    public Request<Value> get(KeyRange range) throws DatabaseException {
        return execute(() -> {
            Position position = table.first(range, CursorDirection.NEXT);
            return position == null ? null : store.dataset.get(position.getPrimaryKey());
        });
    }

    @Override
    public Request<Key> getKey(Key key) throws DatabaseException {
        return getKey(KeyRange.only(key));
    }

    @Override
    public Request<Key> getKey(KeyRange range) throws DatabaseException {
        return execute(() -> {
            Position position = table.first(range, CursorDirection.NEXT);
            return position == null ? null : position.getPrimaryKey();
        });
    }

    @Override
    public Request<List<Value>> getAll() throws DatabaseException {
        return getAll(null, 0);
    }

    @Override
    public Request<List<Value>> getAll(KeyRange range) throws DatabaseException {
        return getAll(range, 0);
    }

    @Override
    public Request<List<Value>> getAll(KeyRange range, int count) throws DatabaseException {
        if (count < 0)
            throw new IllegalArgumentException("count must not be negative: " + count);
        return execute(() -> {
            List<Value> values = new ArrayList<>();
            for (Position position : table.scan(range, count))
                values.add(store.dataset.get(position.getPrimaryKey()));
            return values;
        });
    }

    @Override
    public Request<List<Key>> getAllKeys() throws DatabaseException {
        return getAllKeys(null, 0);
    }

    @Override
    public Request<List<Key>> getAllKeys(KeyRange range) throws DatabaseException {
        return getAllKeys(range, 0);
    }

    @Override
    public Request<List<Key>> getAllKeys(KeyRange range, int count) throws DatabaseException {
        if (count < 0)
            throw new IllegalArgumentException("count must not be negative: " + count);
        return execute(() -> {
            List<Key> keys = new ArrayList<>();
            for (Position position : table.scan(range, count))
                keys.add(position.getPrimaryKey());
            return keys;
        });
    }

    @Override
    public Request<Integer> count() throws DatabaseException {
        return count(null);
    }

    @Override
    public Request<Integer> count(KeyRange range) throws DatabaseException {
        return execute(() -> table.count(range));
    }

    @Override
    public Request<CursorWithValue> openCursor() throws DatabaseException {
        return openCursor(null, CursorDirection.NEXT);
    }

    @Override
    public Request<CursorWithValue> openCursor(KeyRange range) throws DatabaseException {
        return openCursor(range, CursorDirection.NEXT);
    }

    @Override
    public Request<CursorWithValue> openCursor(KeyRange range, CursorDirection direction) throws DatabaseException {
        validate();
        RequestImpl<CursorWithValue> request = store.transaction.newRequest(this);
        new CursorImpl(this, store, table, range, direction, true, request).open();
        return request;
    }

    @Override
    public Request<Cursor> openKeyCursor() throws DatabaseException {
        return openKeyCursor(null, CursorDirection.NEXT);
    }

    @Override
    public Request<Cursor> openKeyCursor(KeyRange range) throws DatabaseException {
        return openKeyCursor(range, CursorDirection.NEXT);
    }

    @Override
    public Request<Cursor> openKeyCursor(KeyRange range, CursorDirection direction) throws DatabaseException {
        validate();
        RequestImpl<Cursor> request = store.transaction.newRequest(this);
        new CursorImpl(this, store, table, range, direction, false, request).open();
        return request;
    }

    private <T> Request<T> execute(Operation<T> op) throws DatabaseException {
        validate();
        return store.execute(this, op, false);
    }

    void validate() throws InvalidStateException {
        store.validate();
        if (store.dataset.getIndex(getName()) != table)
            throw new InvalidStateException("Index " + getName() + " has been deleted");
    }

    @Override
    public String toString() {
        return "Index[" + store.getName() + "." + getName() + "]";
    }
}
