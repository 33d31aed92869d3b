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
import com.memidb.api.DatabaseException;
import com.memidb.api.InvalidStateException;
import com.memidb.api.TransactionMode;
import com.memidb.api.TransactionState;
import com.memidb.core.DatabaseCore;
import com.memidb.event.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * TransactionManager creates transactions and drives them through their
 * lifecycle on the {@link EventLoop}.
 * <p>
 * A transaction commits by itself in the first turn in which it is active or
 * committing and has no undelivered requests. Each delivered request that
 * leaves the transaction without outstanding work schedules such a check, as
 * does the creation of the transaction, so that a transaction that issues
 * nothing still completes.
 * <p>
 * Aborting reverts the undo log immediately, turns every undelivered request
 * into an abort error, and schedules the abort notification behind those
 * requests.
 */
public class TransactionManager {

    private static final Logger log = LoggerFactory.getLogger(TransactionManager.class);

    private final EventLoop eventLoop;
    // Next transaction identifier
    private long nextTransId = 1;

    public TransactionManager(EventLoop eventLoop) {
        this.eventLoop = eventLoop;
    }

    public EventLoop getEventLoop() {
        return eventLoop;
    }

    /**
     * Creates a new transaction.
     *
     * @param database the database the transaction operates on
     * @param mode     the access mode
     * @param scope    the names of the stores in scope, ignored for
     *                 <code>VERSIONCHANGE</code>
     * @param observer receives the outcome of the transaction
     * @return the new transaction
     * @throws InvalidStateException if the database is being upgraded
     */
    public Transaction beginTransaction(DatabaseCore database, TransactionMode mode,
                                        Collection<String> scope, TransactionObserver observer)
            throws InvalidStateException {
        if (database.getUpgradeTransaction() != null)
            throw new InvalidStateException("Database " + database.getName() + " is being upgraded");

        List<String> names = mode == TransactionMode.VERSIONCHANGE
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(scope)));
        Transaction trans = new Transaction(nextTransId++, database, mode, names, observer);
        if (mode == TransactionMode.VERSIONCHANGE)
            database.setUpgradeTransaction(trans);

        eventLoop.post(() -> maybeCommit(trans));
        return trans;
    }

    /**
     * Registers a request issued against the transaction, which keeps it
     * from committing until the request is delivered.
     *
     * @throws InvalidStateException if the transaction is not active
     */
    public void requestIssued(Transaction trans, PendingRequest request) throws InvalidStateException {
        trans.validate();
        trans.addPendingRequest(request);
    }

    /**
     * Called once the notifications of a request have run.
     *
     * @param trans     the owning transaction
     * @param request   the delivered request
     * @param unhandled the error of the request if no listener acknowledged
     *                  it, otherwise null
     */
    public void requestDelivered(Transaction trans, PendingRequest request, DatabaseException unhandled) {
        trans.removePendingRequest(request);
        if (trans.getState().isFinished())
            return;

        if (unhandled != null)
            abortTransaction(trans, unhandled);
        else if (trans.getPendingCount() == 0)
            eventLoop.post(() -> maybeCommit(trans));
    }

    /**
     * Stops the transaction from accepting requests and commits it once
     * the outstanding ones are delivered.
     *
     * @throws InvalidStateException if the transaction is not active
     */
    public void commitTransaction(Transaction trans) throws InvalidStateException {
        trans.validate();
        trans.setState(TransactionState.COMMITTING);
        eventLoop.post(() -> maybeCommit(trans));
    }

    /**
     * Aborts the transaction, reverting its changes.
     *
     * @param trans the transaction
     * @param error the cause, or null for an explicit abort
     */
    public void abortTransaction(Transaction trans, DatabaseException error) {
        if (trans.getState().isFinished())
            return;

        trans.setState(TransactionState.ABORTED);
        trans.setError(error);
        trans.getUndoLog().undo();

        AbortException abortError = new AbortException("Transaction " + trans.getTransId() + " was aborted", error);
        for (PendingRequest request : new ArrayList<>(trans.getPendingRequests()))
            request.abortPending(abortError);

        if (error == null)
            log.debug("Transaction {} aborted", trans.getTransId());
        else
            log.debug("Transaction {} aborted: {}", trans.getTransId(), error.getMessage());

        eventLoop.post(() -> {
            release(trans);
            if (trans.getObserver() != null)
                trans.getObserver().transactionAborted(trans);
        });
    }

    void maybeCommit(Transaction trans) {
        TransactionState state = trans.getState();
        if (state.isFinished() || trans.getPendingCount() > 0)
            return;

        trans.setState(TransactionState.COMMITTED);
        trans.getUndoLog().clear();
        release(trans);
        log.debug("Transaction {} committed", trans.getTransId());

        if (trans.getObserver() != null)
            trans.getObserver().transactionCompleted(trans);
    }

    private void release(Transaction trans) {
        DatabaseCore database = trans.getDatabase();
        if (database.getUpgradeTransaction() == trans)
            database.setUpgradeTransaction(null);
    }
}
