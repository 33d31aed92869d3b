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

package com.memidb.api;

/**
 * Options for {@link Connection#createObjectStore}. By default a store has no
 * key path, so keys are supplied out-of-line, and no key generator.
 */
public class StoreOptions {
    private KeyPath keyPath;
    private boolean autoIncrement;

    public KeyPath getKeyPath() {
        return keyPath;
    }

    public StoreOptions setKeyPath(KeyPath keyPath) {
        this.keyPath = keyPath;
        return this;
    }

    public StoreOptions setKeyPath(String keyPath) {
        return setKeyPath(KeyPath.of(keyPath));
    }

    public boolean isAutoIncrement() {
        return autoIncrement;
    }

    public StoreOptions setAutoIncrement(boolean autoIncrement) {
        this.autoIncrement = autoIncrement;
        return this;
    }
}
