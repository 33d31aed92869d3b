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
 * Delivered when a write would duplicate a primary key on <code>add</code> or collide
 * with an existing entry of a unique index.
 */
public class ConstraintException extends DatabaseException {

    public ConstraintException(String message) {
        super(ErrorKind.CONSTRAINT, message);
    }

    public ConstraintException(String message, Throwable cause) {
        super(ErrorKind.CONSTRAINT, message, cause);
    }
}
