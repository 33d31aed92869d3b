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
import com.memidb.core.IndexDescriptor;
import com.memidb.storage.Dataset;
import com.memidb.storage.RecordTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ObjectStoreImpl implements ObjectStore {

    final TransactionImpl transaction;
    final Dataset dataset;
    private final Map<String, IndexImpl> indexes = new HashMap<>();

    ObjectStoreImpl(TransactionImpl transaction, Dataset dataset) {
        this.transaction = transaction;
        this.dataset = dataset;
    }

    @Override
    public String getName() {
        return dataset.getName();
    }

    @Override
    public KeyPath getKeyPath() {
        return dataset.getDescriptor().getKeyPath();
    }

    @Override
    public boolean isAutoIncrement() {
        return dataset.getDescriptor().isAutoIncrement();
    }

    @Override
    public List<String> getIndexNames() {
        return dataset.getIndexNames();
    }

    @Override
    public com.memidb.api.Transaction getTransaction() {
        return transaction;
    }

    @Override
    public Request<Key> add(Value value) throws DatabaseException {
        return add(value, null);
    }

    @Override
    public Request<Key> add(Value value, Key key) throws DatabaseException {
        checkValue(value);
        return execute(this, () -> dataset.insert(transaction.getTrans(), value, key), true);
    }

    @Override
    public Request<Key> put(Value value) throws DatabaseException {
        return put(value, null);
    }

    @Override
    public Request<Key> put(Value value, Key key) throws DatabaseException {
        checkValue(value);
        return execute(this, () -> dataset.put(transaction.getTrans(), value, key), true);
    }

    @Override
    public Request<Value> get(Key key) throws DatabaseException {
        return get(KeyRange.only(key));
    }

    @Override
    public Request<Value> get(KeyRange range) throws DatabaseException {
        return execute(this, () -> {
            Position position = records().first(range, CursorDirection.NEXT);
            return position == null ? null : dataset.get(position.getPrimaryKey());
        }, false);
    }

    @Override
    public Request<Key> getKey(Key key) throws DatabaseException {
        return getKey(KeyRange.only(key));
    }

    @Override
    public Request<Key> getKey(KeyRange range) throws DatabaseException {
        return execute(this, () -> {
            Position position = records().first(range, CursorDirection.NEXT);
            return position == null ? null : position.getPrimaryKey();
        }, false);
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
        checkCount(count);
        return execute(this, () -> {
            List<Value> values = new ArrayList<>();
            for (Position position : records().scan(range, count))
                values.add(dataset.get(position.getPrimaryKey()));
            return values;
        }, false);
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
        checkCount(count);
        return execute(this, () -> {
            List<Key> keys = new ArrayList<>();
            for (Position position : records().scan(range, count))
                keys.add(position.getPrimaryKey());
            return keys;
        }, false);
    }

    @Override
    public Request<Integer> count() throws DatabaseException {
        return count(null);
    }

    @Override
    public Request<Integer> count(KeyRange range) throws DatabaseException {
        return execute(this, () -> records().count(range), false);
    }

    @Override
    public Request<Void> delete(Key key) throws DatabaseException {
        return delete(KeyRange.only(key));
    }

    @Override
    public Request<Void> delete(KeyRange range) throws DatabaseException {
        if (range == null)
            throw new IllegalArgumentException("range must not be null");
        return execute(this, () -> {
            dataset.remove(transaction.getTrans(), range);
            return null;
        }, true);
    }

    @Override
    public Request<Void> clear() throws DatabaseException {
        return execute(this, () -> {
            dataset.clear(transaction.getTrans());
            return null;
        }, true);
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
        RequestImpl<CursorWithValue> request = transaction.newRequest(this);
        new CursorImpl(this, this, records(), range, direction, true, request).open();
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
        RequestImpl<Cursor> request = transaction.newRequest(this);
        new CursorImpl(this, this, records(), range, direction, false, request).open();
        return request;
    }

    @Override
    public Index createIndex(String name, String keyPath) throws DatabaseException {
        return createIndex(name, KeyPath.of(keyPath), new IndexOptions());
    }

    @Override
    public Index createIndex(String name, KeyPath keyPath, IndexOptions options) throws DatabaseException {
        if (name == null || keyPath == null)
            throw new IllegalArgumentException("Index name and key path must not be null");
        if (options == null)
            options = new IndexOptions();
        validateUpgrade();
        if (dataset.getIndex(name) != null)
            throw new ConstraintException("Index " + name + " already exists in object store " + getName());

        IndexTable table;
        try {
            table = dataset.createIndex(transaction.getTrans(),
                    new IndexDescriptor(name, keyPath, options.isUnique(), options.isMultiEntry()));
        } catch (ConstraintException e) {
            // existing records violate the new unique index
            transaction.transactionManager.abortTransaction(transaction.getTrans(), e);
            throw e;
        }
        return indexHandle(table);
    }

    @Override
    public void deleteIndex(String name) throws DatabaseException {
        validateUpgrade();
        dataset.deleteIndex(transaction.getTrans(), name);
        indexes.remove(name);
    }

    @Override
    public Index index(String name) throws DatabaseException {
        if (transaction.getState().isFinished())
            throw new InvalidStateException("Transaction has finished");
        validate();
        IndexTable table = dataset.getIndex(name);
        if (table == null)
            throw new NotFoundException("Index " + name + " not found in object store " + getName());
        return indexHandle(table);
    }

    /**
     * Issues a request against this store's transaction and applies the
     * operation. Failures of the operation become the request's error.
     *
     * @param source the object the request is issued against
     * @param op     the operation
     * @param write  true if the operation writes
     * @return the issued request
     * @throws InvalidStateException if the store was deleted or the
     *                               transaction is not active
     * @throws ReadOnlyException     if a write is issued in a read-only
     *                               transaction
     */
    <T> Request<T> execute(Object source, Operation<T> op, boolean write) throws DatabaseException {
        validate();
        if (write)
            transaction.getTrans().validateWrite();

        RequestImpl<T> request = transaction.newRequest(source);
        request.issue();
        try {
            request.succeed(op.execute());
        } catch (DatabaseException e) {
            request.fail(e);
        }
        return request;
    }

    void validate() throws InvalidStateException {
        if (transaction.getDatabase().getStore(getName()) != dataset)
            throw new InvalidStateException("Object store " + getName() + " has been deleted");
    }

    RecordTable records() {
        return dataset.getRecords();
    }

    private IndexImpl indexHandle(IndexTable table) {
        String name = table.getDescriptor().getName();
        IndexImpl index = indexes.get(name);
        if (index == null || index.table != table) {
            index = new IndexImpl(this, table);
            indexes.put(name, index);
        }
        return index;
    }

    private void validateUpgrade() throws DatabaseException {
        if (transaction.getMode() != TransactionMode.VERSIONCHANGE)
            throw new InvalidStateException("Indexes can only be changed while upgrading the database");
        transaction.getTrans().validate();
        validate();
    }

    private static void checkValue(Value value) {
        if (value == null)
            throw new IllegalArgumentException("value must not be null; use Value.NULL");
    }

    private static void checkCount(int count) {
        if (count < 0)
            throw new IllegalArgumentException("count must not be negative: " + count);
    }

    @Override
    public String toString() {
        return "ObjectStore[" + getName() + "]";
    }
}
