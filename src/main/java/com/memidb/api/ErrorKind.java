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
 * The kinds of failure a request, transaction or schema operation can report.
 * Each kind corresponds to one {@link DatabaseException} subclass.
 */
public enum ErrorKind {
    /**
     * A database, object store, index or record does not exist.
     */
    NOT_FOUND("NotFoundError"),
    /**
     * A duplicate primary key on <code>add</code> or a unique index collision.
     */
    CONSTRAINT("ConstraintError"),
    /**
     * No valid key could be resolved, or a key or range argument was invalid.
     */
    DATA("DataError"),
    /**
     * An operation was issued against a finished transaction, a closed
     * connection, or a store outside the transaction scope.
     */
    INVALID_STATE("InvalidStateError"),
    /**
     * A schema parameter combination that cannot be honored.
     */
    INVALID_ACCESS("InvalidAccessError"),
    /**
     * A write was issued in a <code>readonly</code> transaction.
     */
    READ_ONLY("ReadOnlyError"),
    /**
     * An open requested a version lower than the stored version.
     */
    VERSION("VersionError"),
    /**
     * The owning transaction was aborted.
     */
    ABORT("AbortError");

    private final String errorName;

    ErrorKind(String errorName) {
        this.errorName = errorName;
    }

    /**
     * Gets the platform name of this error kind, such as "ConstraintError".
     *
     * @return the platform error name
     */
    public String getErrorName() {
        return errorName;
    }
}
