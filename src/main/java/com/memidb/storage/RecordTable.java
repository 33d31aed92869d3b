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

import com.memidb.access.ScanSource;
import com.memidb.api.Key;
import com.memidb.api.KeyRange;
import com.memidb.api.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * RecordTable holds the records of one object store ordered by primary key.
 */
public class RecordTable extends ScanSource {

    private final TreeMap<Key, Value> records = new TreeMap<>();

    public Value get(Key key) {
        return records.get(key);
    }

    public boolean contains(Key key) {
        return records.containsKey(key);
    }

    /**
     * Stores a record.
     *
     * @return the previous value, or null
     */
    public Value put(Key key, Value value) {
        return records.put(key, value);
    }

    /**
     * Removes a record.
     *
     * @return the removed value, or null
     */
    public Value remove(Key key) {
        return records.remove(key);
    }

    public void clear() {
        records.clear();
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Lists the primary keys in a range, in ascending order.
     *
     * @param range the key range, or null for all keys
     * @return a copy of the keys
     */
    public List<Key> keys(KeyRange range) {
        return new ArrayList<>(subMap(range).keySet());
    }

    /**
     * Copies the records of this table.
     *
     * @return an unmodifiable copy, in key order
     */
    public SortedMap<Key, Value> snapshot() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(records));
    }

    @Override
    public int count(KeyRange range) {
        return subMap(range).size();
    }

    @Override
    protected NavigableMap<Key, ?> keyMap() {
        return records;
    }

    @Override
    protected NavigableSet<Key> primaryKeys(Key key) {
        if (!records.containsKey(key))
            return null;
        TreeSet<Key> pks = new TreeSet<>();
        pks.add(key);
        return pks;
    }
}
