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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixture definition of a database, loaded with
 * {@link com.memidb.api.MemIDB#seedDatabase}.
 */
public class DatabaseSchema {
    private final String name;
    private final long version;
    private final List<StoreSchema> stores = new ArrayList<>();

    public DatabaseSchema(String name, long version) {
        if (version < 1)
            throw new IllegalArgumentException("version must be positive: " + version);
        this.name = name;
        this.version = version;
    }

    public DatabaseSchema store(StoreSchema store) {
        stores.add(store);
        return this;
    }

    /**
     * Gets the schema of a store.
     *
     * @param name the store name
     * @return the store schema, or null if there is none
     */
    public StoreSchema getStore(String name) {
        for (StoreSchema store : stores) {
            if (store.getName().equals(name))
                return store;
        }
        return null;
    }

    public String getName() {
        return name;
    }

    public long getVersion() {
        return version;
    }

    public List<StoreSchema> getStores() {
        return Collections.unmodifiableList(stores);
    }
}
