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

package com.memidb.access;

import com.memidb.api.Key;
import com.memidb.api.Value;
import com.memidb.core.IndexDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * IndexTable maintains the entries of a secondary index: a mapping from each
 * index key to the ordered set of primary keys of the records that carry it.
 * <p>
 * The table does not read records itself. The owner of the records derives
 * the index keys of a value with {@link #keysFor} and adds or removes the
 * corresponding entries as records change.
 */
public class IndexTable extends ScanSource {

    private final IndexDescriptor descriptor;
    private final TreeMap<Key, TreeSet<Key>> entries = new TreeMap<>();
    private int size;

    public IndexTable(IndexDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    public IndexDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * Derives the index keys of a value. Values without a valid key at the
     * key path yield no keys. For a multi-entry index an array value yields
     * each distinct valid key among its elements.
     *
     * @param value the record value
     * @return the index keys, possibly empty
     */
    public Set<Key> keysFor(Value value) {
        Value indexed = KeyPathExtractor.extract(value, descriptor.getKeyPath());
        if (indexed == null)
            return Collections.emptySet();

        if (descriptor.isMultiEntry() && indexed.isArray()) {
            Set<Key> keys = new TreeSet<>();
            for (Value element : indexed.getElements()) {
                Key key = element.toKey();
                if (key != null)
                    keys.add(key);
            }
            return keys;
        }

        Key key = indexed.toKey();
        return key == null ? Collections.emptySet() : Collections.singleton(key);
    }

    /**
     * Finds an index key already held by a record other than the given one.
     * Always null for a non-unique index.
     *
     * @param primaryKey the record about to hold the keys
     * @param keys       the index keys of the record
     * @return the first colliding key, or null
     */
    public Key findCollision(Key primaryKey, Set<Key> keys) {
        if (!descriptor.isUnique())
            return null;
        for (Key key : keys) {
            TreeSet<Key> pks = entries.get(key);
            if (pks != null && (pks.size() > 1 || !pks.contains(primaryKey)))
                return key;
        }
        return null;
    }

    public void add(Key primaryKey, Set<Key> keys) {
        for (Key key : keys) {
            if (entries.computeIfAbsent(key, k -> new TreeSet<>()).add(primaryKey))
                size++;
        }
    }

    public void remove(Key primaryKey, Set<Key> keys) {
        for (Key key : keys) {
            TreeSet<Key> pks = entries.get(key);
            if (pks != null && pks.remove(primaryKey)) {
                size--;
                if (pks.isEmpty())
                    entries.remove(key);
            }
        }
    }

    public void clear() {
        entries.clear();
        size = 0;
    }

    /**
     * Gets the total number of entries.
     */
    public int size() {
        return size;
    }

    /**
     * Copies the entries of this index.
     *
     * @return the primary keys of each index key, in key order
     */
    public Map<Key, SortedSet<Key>> toMap() {
        Map<Key, SortedSet<Key>> map = new LinkedHashMap<>();
        for (Map.Entry<Key, TreeSet<Key>> entry : entries.entrySet())
            map.put(entry.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(entry.getValue())));
        return map;
    }

    @Override
    protected NavigableMap<Key, ?> keyMap() {
        return entries;
    }

    @Override
    protected NavigableSet<Key> primaryKeys(Key key) {
        return entries.get(key);
    }
}
