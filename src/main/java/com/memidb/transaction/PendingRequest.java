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

package com.memidb.transaction;

import com.memidb.api.AbortException;

/**
 * A request that has been issued against a transaction but not yet
 * delivered.
 */
public interface PendingRequest {
    /**
     * Replaces the outcome of the request with the given error because its
     * transaction aborted. Has no effect on a request already delivered.
     *
     * @param error the abort error
     */
    void abortPending(AbortException error);
}
