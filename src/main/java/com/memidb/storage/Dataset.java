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

package com.memidb.storage;

import com.memidb.access.IndexTable;
import com.memidb.access.KeyPathExtractor;
import com.memidb.api.ConstraintException;
import com.memidb.api.DataException;
import com.memidb.api.DatabaseException;
import com.memidb.api.InvalidAccessException;
import com.memidb.api.Key;
import com.memidb.api.KeyPath;
import com.memidb.api.KeyRange;
import com.memidb.api.NotFoundException;
import com.memidb.api.Value;
import com.memidb.core.IndexDescriptor;
import com.memidb.core.KeyGenerator;
import com.memidb.core.StoreDescriptor;
import com.memidb.transaction.Transaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Dataset is the storage of one object store: its records, its indexes and
 * its key generator.
 * <p>
 * Every write keeps the indexes consistent with the records. A write is
 * checked against the primary key and every unique index before anything is
 * changed, so a failed write leaves the dataset untouched.
 * <p>
 * Writes made on behalf of a transaction are logged to its undo log. Writes
 * without a transaction, as done when seeding fixtures, cannot be undone.
 */
public class Dataset {

    private final StoreDescriptor descriptor;
    private final RecordTable records = new RecordTable();
    private final TreeMap<String, IndexTable> indexes = new TreeMap<>();
    private final KeyGenerator keyGenerator;

    public Dataset(StoreDescriptor descriptor) {
        this.descriptor = descriptor;
        this.keyGenerator = descriptor.isAutoIncrement() ? new KeyGenerator() : null;
    }

    public StoreDescriptor getDescriptor() {
        return descriptor;
    }

    public String getName() {
        return descriptor.getName();
    }

    public RecordTable getRecords() {
        return records;
    }

    /**
     * Gets the key generator of an auto-increment store.
     *
     * @return the key generator, or null
     */
    public KeyGenerator getKeyGenerator() {
        return keyGenerator;
    }

    public Value get(Key key) {
        return records.get(key);
    }

    /**
     * Inserts a record.
     *
     * @param trans the transaction, or null
     * @param value the value
     * @param key   the explicit key, or null
     * @return the primary key of the new record
     * @throws ConstraintException if a record with the key exists, or a
     *                             unique index already holds one of the
     *                             record's index keys
     * @throws DataException       if no valid key can be resolved
     */
    public Key insert(Transaction trans, Value value, Key key) throws DatabaseException {
        return write(trans, value, key, false);
    }

    /**
     * Inserts or replaces a record.
     *
     * @param trans the transaction, or null
     * @param value the value
     * @param key   the explicit key, or null
     * @return the primary key of the record
     * @throws ConstraintException if a unique index already holds one of the
     *                             record's index keys
     * @throws DataException       if no valid key can be resolved
     */
    public Key put(Transaction trans, Value value, Key key) throws DatabaseException {
        return write(trans, value, key, true);
    }

    /**
     * Removes the records in a range.
     *
     * @param trans the transaction, or null
     * @param range the key range, or null for all records
     * @return the number of records removed
     */
    public int remove(Transaction trans, KeyRange range) {
        List<Key> keys = records.keys(range);
        for (Key key : keys) {
            Value old = records.remove(key);
            unindex(key, old);
            if (trans != null)
                trans.logUndo(() -> restore(key, old));
        }
        return keys.size();
    }

    /**
     * Removes every record.
     *
     * @param trans the transaction, or null
     */
    public void clear(Transaction trans) {
        remove(trans, null);
    }

    public List<String> getIndexNames() {
        return new ArrayList<>(indexes.keySet());
    }

    /**
     * Gets an index.
     *
     * @param name the index name
     * @return the index, or null if there is none
     */
    public IndexTable getIndex(String name) {
        return indexes.get(name);
    }

    /**
     * Creates an index and fills it from the existing records.
     *
     * @param trans      the transaction, or null
     * @param descriptor the index definition
     * @return the new index
     * @throws ConstraintException    if the index exists, or a unique index
     *                                cannot be built over the existing
     *                                records
     * @throws InvalidAccessException if a multi-entry index has a compound
     *                                key path
     */
    public IndexTable createIndex(Transaction trans, IndexDescriptor descriptor) throws DatabaseException {
        String name = descriptor.getName();
        if (indexes.containsKey(name))
            throw new ConstraintException("Index " + name + " already exists in object store " + getName());
        if (descriptor.isMultiEntry() && descriptor.getKeyPath().isCompound())
            throw new InvalidAccessException("Multi-entry index " + name + " cannot have a compound key path");

        IndexTable index = new IndexTable(descriptor);
        for (Key pk : records.keys(null)) {
            Set<Key> keys = index.keysFor(records.get(pk));
            Key collision = index.findCollision(pk, keys);
            if (collision != null)
                throw new ConstraintException("Unique index " + name + " cannot be built: key " + collision
                        + " is held by more than one record");
            index.add(pk, keys);
        }

        indexes.put(name, index);
        if (trans != null)
            trans.logUndo(() -> indexes.remove(name));
        return index;
    }

    /**
     * Deletes an index.
     *
     * @param trans the transaction, or null
     * @param name  the index name
     * @throws NotFoundException if there is no such index
     */
    public void deleteIndex(Transaction trans, String name) throws NotFoundException {
        IndexTable index = indexes.remove(name);
        if (index == null)
            throw new NotFoundException("Index " + name + " not found in object store " + getName());
        if (trans != null)
            trans.logUndo(() -> indexes.put(name, index));
    }

    private Key write(Transaction trans, Value value, Key key, boolean overwrite) throws DatabaseException {
        if (key == null) {
            key = resolveKey(value);
            if (descriptor.hasKeyPath() && KeyPathExtractor.extract(value, descriptor.getKeyPath()) == null)
                value = KeyPathExtractor.inject(value, descriptor.getKeyPath().getPath(), key);
        } else if (keyGenerator != null) {
            keyGenerator.observe(key);
        }

        Value old = records.get(key);
        if (old != null && !overwrite)
            throw new ConstraintException("Key " + key + " already exists in object store " + getName());

        Map<IndexTable, Set<Key>> indexKeys = new HashMap<>();
        for (IndexTable index : indexes.values()) {
            Set<Key> keys = index.keysFor(value);
            Key collision = index.findCollision(key, keys);
            if (collision != null)
                throw new ConstraintException("Key " + collision + " already exists in unique index "
                        + index.getDescriptor().getName());
            indexKeys.put(index, keys);
        }

        records.put(key, value);
        if (old != null)
            unindex(key, old);
        for (Map.Entry<IndexTable, Set<Key>> entry : indexKeys.entrySet())
            entry.getKey().add(key, entry.getValue());

        if (trans != null) {
            Key pk = key;
            trans.logUndo(() -> restore(pk, old));
        }
        return key;
    }

    /**
     * Resolves the primary key of a value written without an explicit key:
     * the key at the key path when there is one, otherwise a generated key.
     */
    private Key resolveKey(Value value) throws DatabaseException {
        KeyPath keyPath = descriptor.getKeyPath();
        if (keyPath != null) {
            Value inline = KeyPathExtractor.extract(value, keyPath);
            if (inline != null) {
                Key key = inline.toKey();
                if (key == null)
                    throw new DataException("Value " + inline + " at key path " + keyPath + " is not a valid key");
                if (keyGenerator != null)
                    keyGenerator.observe(key);
                return key;
            }
        }
        if (keyGenerator != null)
            return keyGenerator.next();
        if (keyPath != null)
            throw new DataException("No key at key path " + keyPath + " of " + value);
        throw new DataException("Object store " + getName() + " uses out-of-line keys and no key was given");
    }

    private void restore(Key key, Value old) {
        Value current = records.remove(key);
        if (current != null)
            unindex(key, current);
        if (old != null) {
            records.put(key, old);
            for (IndexTable index : indexes.values())
                index.add(key, index.keysFor(old));
        }
    }

    private void unindex(Key key, Value value) {
        for (IndexTable index : indexes.values())
            index.remove(key, index.keysFor(value));
    }
}
