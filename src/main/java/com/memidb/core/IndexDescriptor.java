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

package com.memidb.core;

import com.memidb.api.KeyPath;

/**
 * Catalog entry of a secondary index.
 */
public class IndexDescriptor {

    private final String name; // User-assigned name of the index
    private final KeyPath keyPath; // Location of the index key in each value
    private final boolean isUnique; // Does each index key identify one record?
    private final boolean isMultiEntry; // Are array elements indexed one by one?

    public IndexDescriptor(String name, KeyPath keyPath, boolean isUnique, boolean isMultiEntry) {
        this.name = name;
        this.keyPath = keyPath;
        this.isUnique = isUnique;
        this.isMultiEntry = isMultiEntry;
    }

    public String getName() {
        return name;
    }

    public KeyPath getKeyPath() {
        return keyPath;
    }

    public boolean isUnique() {
        return isUnique;
    }

    public boolean isMultiEntry() {
        return isMultiEntry;
    }

    @Override
    public String toString() {
        return name + "(keyPath=" + keyPath + ", unique=" + isUnique + ", multiEntry=" + isMultiEntry + ")";
    }
}
