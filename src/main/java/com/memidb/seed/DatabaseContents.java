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
import com.memidb.api.Value;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;

/**
 * A copy of the version and records of a database, as read back by the
 * fixture methods of {@link com.memidb.api.MemIDB}.
 */
public class DatabaseContents {
    private final String name;
    private final long version;
    private final Map<String, SortedMap<Key, Value>> stores;

    public DatabaseContents(String name, long version, Map<String, SortedMap<Key, Value>> stores) {
        this.name = name;
        this.version = version;
        this.stores = Collections.unmodifiableMap(stores);
    }

    public String getName() {
        return name;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Gets the records of every store by store name.
     */
    public Map<String, SortedMap<Key, Value>> getStores() {
        return stores;
    }

    /**
     * Gets the records of a store.
     *
     * @param name the store name
     * @return the records in key order, or null if there is no such store
     */
    public SortedMap<Key, Value> getStore(String name) {
        return stores.get(name);
    }
}
