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

import com.memidb.api.DatabaseException;
import com.memidb.api.InvalidStateException;
import com.memidb.api.ReadOnlyException;
import com.memidb.api.TransactionMode;
import com.memidb.api.TransactionState;
import com.memidb.core.DatabaseCore;

import java.util.ArrayList;
import java.util.List;

/**
 * Transaction holds the engine state of one transaction: its mode and scope,
 * its lifecycle state, the undo log of the changes it applied and the
 * requests issued against it that have not yet been delivered.
 * <p>
 * Transactions are created by the {@link TransactionManager}, which also
 * drives their state changes.
 */
public class Transaction {

    private final long transId; // Unique transaction identifier
    private final DatabaseCore database;
    private final TransactionMode mode;
    private final List<String> scope;
    private final UndoLog undoLog = new UndoLog();
    private final List<PendingRequest> pendingRequests = new ArrayList<>();
    private TransactionState state = TransactionState.ACTIVE;
    private TransactionObserver observer;
    private DatabaseException error;

    Transaction(long transId, DatabaseCore database, TransactionMode mode, List<String> scope,
                TransactionObserver observer) {
        this.transId = transId;
        this.database = database;
        this.mode = mode;
        this.scope = scope;
        this.observer = observer;
    }

    public long getTransId() {
        return transId;
    }

    public DatabaseCore getDatabase() {
        return database;
    }

    public TransactionMode getMode() {
        return mode;
    }

    public List<String> getScope() {
        return scope;
    }

    /**
     * An upgrade transaction covers every store of the database, including the
     * ones it creates.
     */
    public boolean isInScope(String storeName) {
        return mode == TransactionMode.VERSIONCHANGE || scope.contains(storeName);
    }

    public TransactionState getState() {
        return state;
    }

    void setState(TransactionState state) {
        this.state = state;
    }

    public boolean isActive() {
        return state == TransactionState.ACTIVE;
    }

    public DatabaseException getError() {
        return error;
    }

    void setError(DatabaseException error) {
        this.error = error;
    }

    public TransactionObserver getObserver() {
        return observer;
    }

    public void setObserver(TransactionObserver observer) {
        this.observer = observer;
    }

    /**
     * Ensures that new requests may be issued against this transaction.
     *
     * @throws InvalidStateException if the transaction is not active
     */
    public void validate() throws InvalidStateException {
        if (state != TransactionState.ACTIVE)
            throw new InvalidStateException("Transaction " + transId + " is " + state.name().toLowerCase());
    }

    /**
     * Ensures that writes may be issued against this transaction.
     *
     * @throws ReadOnlyException     if the transaction is read-only
     * @throws InvalidStateException if the transaction is not active
     */
    public void validateWrite() throws DatabaseException {
        validate();
        if (mode == TransactionMode.READONLY)
            throw new ReadOnlyException("Transaction " + transId + " is read-only");
    }

    /**
     * Records how to revert a change applied by this transaction.
     */
    public void logUndo(UndoAction action) {
        undoLog.add(action);
    }

    UndoLog getUndoLog() {
        return undoLog;
    }

    void addPendingRequest(PendingRequest request) {
        pendingRequests.add(request);
    }

    void removePendingRequest(PendingRequest request) {
        pendingRequests.remove(request);
    }

    List<PendingRequest> getPendingRequests() {
        return pendingRequests;
    }

    public int getPendingCount() {
        return pendingRequests.size();
    }

    @Override
    public String toString() {
        return "Transaction[" + transId + ", " + mode + ", " + scope + ", " + state + "]";
    }
}
