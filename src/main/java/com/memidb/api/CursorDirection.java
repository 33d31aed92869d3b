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
 * The direction in which a cursor traverses its source. The <i>unique</i>
 * variants visit each distinct key once, surfacing the lowest primary key for
 * that key.
 */
public enum CursorDirection {
    NEXT("next"),
    NEXTUNIQUE("nextunique"),
    PREV("prev"),
    PREVUNIQUE("prevunique");

    private final String directionName;

    CursorDirection(String directionName) {
        this.directionName = directionName;
    }

    public boolean isReverse() {
        return this == PREV || this == PREVUNIQUE;
    }

    public boolean isUnique() {
        return this == NEXTUNIQUE || this == PREVUNIQUE;
    }

    @Override
    public String toString() {
        return directionName;
    }
}
