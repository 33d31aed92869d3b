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
 * Options for {@link ObjectStore#createIndex}.
 */
public class IndexOptions {
    private boolean unique;
    private boolean multiEntry;

    public boolean isUnique() {
        return unique;
    }

    /**
     * Requires each index key to identify at most one record.
     *
     * @param unique the uniqueness flag (default: false)
     * @return these options
     */
    public IndexOptions setUnique(boolean unique) {
        this.unique = unique;
        return this;
    }

    public boolean isMultiEntry() {
        return multiEntry;
    }

    /**
     * Indexes each element of an array value under its own index key rather
     * than the array as a whole.
     *
     * @param multiEntry the multi-entry flag (default: false)
     * @return these options
     */
    public IndexOptions setMultiEntry(boolean multiEntry) {
        this.multiEntry = multiEntry;
        return this;
    }
}
