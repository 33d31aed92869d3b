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

/**
 * A cursor position: an entry of a {@link ScanSource}, identified by its key
 * and the primary key of the record it refers to.
 */
public final class Position {
    private final Key key;
    private final Key primaryKey;

    public Position(Key key, Key primaryKey) {
        this.key = key;
        this.primaryKey = primaryKey;
    }

    public Key getKey() {
        return key;
    }

    public Key getPrimaryKey() {
        return primaryKey;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Position && key.equals(((Position) obj).key)
                && primaryKey.equals(((Position) obj).primaryKey);
    }

    @Override
    public int hashCode() {
        return key.hashCode() * 31 + primaryKey.hashCode();
    }

    @Override
    public String toString() {
        return "(" + key + ", " + primaryKey + ")";
    }
}
