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
 * The root of all failures reported by the storage engine. A
 * <code>DatabaseException</code> is either thrown directly by a call that was
 * misused, or delivered later through the error state of a {@link Request}.
 *
 * @see ErrorKind
 */
public class DatabaseException extends Exception {

    private final ErrorKind kind;

    public DatabaseException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DatabaseException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets the kind of this failure.
     *
     * @return the error kind
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Gets the platform name of this failure, such as "ConstraintError".
     *
     * @return the platform error name
     */
    public String getErrorName() {
        return kind.getErrorName();
    }
}
