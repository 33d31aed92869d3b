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
 * Thrown when schema parameters cannot be honored together, such as an
 * auto-increment store with a compound key path.
 */
public class InvalidAccessException extends DatabaseException {

    public InvalidAccessException(String message) {
        super(ErrorKind.INVALID_ACCESS, message);
    }

    public InvalidAccessException(String message, Throwable cause) {
        super(ErrorKind.INVALID_ACCESS, message, cause);
    }
}
