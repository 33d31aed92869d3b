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
 * Catalog entry of an object store.
 */
public class StoreDescriptor {

    private final String name; // User-assigned name of the store
    private final KeyPath keyPath; // In-line key location, null for out-of-line keys
    private final boolean autoIncrement; // Does the store own a key generator?

    public StoreDescriptor(String name, KeyPath keyPath, boolean autoIncrement) {
        this.name = name;
        this.keyPath = keyPath;
        this.autoIncrement = autoIncrement;
    }

    public String getName() {
        return name;
    }

    public KeyPath getKeyPath() {
        return keyPath;
    }

    public boolean hasKeyPath() {
        return keyPath != null;
    }

    public boolean isAutoIncrement() {
        return autoIncrement;
    }

    @Override
    public String toString() {
        return name + "(keyPath=" + keyPath + ", autoIncrement=" + autoIncrement + ")";
    }
}
