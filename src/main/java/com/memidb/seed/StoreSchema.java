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

package com.memidb.seed;

import com.memidb.api.Key;
import com.memidb.api.KeyPath;
import com.memidb.api.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixture definition of an object store: its key options, its indexes and the
 * records to load into it.
 *
 * <pre>
 * new StoreSchema("users")
 *         .keyPath("id")
 *         .autoIncrement()
 *         .index(new IndexSchema("email", "email").unique())
 *         .record(Value.builder().put("email", "alice@example.com").build());
 * </pre>
 */
public class StoreSchema {

    /**
     * A record to load, with an optional explicit key.
     */
    public static final class Entry {
        private final Key key;
        private final Value value;

        Entry(Key key, Value value) {
            this.key = key;
            this.value = value;
        }

        public Key getKey() {
            return key;
        }

        public Value getValue() {
            return value;
        }
    }

    private final String name;
    private KeyPath keyPath;
    private boolean autoIncrement;
    private final List<IndexSchema> indexes = new ArrayList<>();
    private final List<Entry> entries = new ArrayList<>();

    public StoreSchema(String name) {
        this.name = name;
    }

    public StoreSchema keyPath(String keyPath) {
        return keyPath(KeyPath.of(keyPath));
    }

    public StoreSchema keyPath(KeyPath keyPath) {
        this.keyPath = keyPath;
        return this;
    }

    public StoreSchema autoIncrement() {
        this.autoIncrement = true;
        return this;
    }

    public StoreSchema index(IndexSchema index) {
        indexes.add(index);
        return this;
    }

    public StoreSchema index(String name, String keyPath) {
        return index(new IndexSchema(name, keyPath));
    }

    /**
     * Adds a record whose key is taken from the value or generated.
     */
    public StoreSchema record(Value value) {
        return record(null, value);
    }

    public StoreSchema record(Key key, Value value) {
        entries.add(new Entry(key, value));
        return this;
    }

    public String getName() {
        return name;
    }

    public KeyPath getKeyPath() {
        return keyPath;
    }

    public boolean isAutoIncrement() {
        return autoIncrement;
    }

    public List<IndexSchema> getIndexes() {
        return Collections.unmodifiableList(indexes);
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }
}
