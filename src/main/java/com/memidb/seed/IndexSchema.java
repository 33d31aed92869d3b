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

import com.memidb.api.KeyPath;

/**
 * Fixture definition of an index.
 */
public class IndexSchema {
    private final String name;
    private final KeyPath keyPath;
    private boolean unique;
    private boolean multiEntry;

    public IndexSchema(String name, String keyPath) {
        this(name, KeyPath.of(keyPath));
    }

    public IndexSchema(String name, KeyPath keyPath) {
        this.name = name;
        this.keyPath = keyPath;
    }

    public IndexSchema unique() {
        this.unique = true;
        return this;
    }

    public IndexSchema multiEntry() {
        this.multiEntry = true;
        return this;
    }

    public String getName() {
        return name;
    }

    public KeyPath getKeyPath() {
        return keyPath;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isMultiEntry() {
        return multiEntry;
    }
}
