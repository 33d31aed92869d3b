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
import com.memidb.api.ConstraintException;
import com.memidb.api.DatabaseException;
import com.memidb.api.InvalidStateException;
import com.memidb.api.ReadOnlyException;
import com.memidb.api.TransactionMode;
import com.memidb.api.TransactionState;
import com.memidb.core.DatabaseCore;
import com.memidb.event.EventLoop;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TransactionManagerTest implements TransactionObserver {

    EventLoop eventLoop;
    TransactionManager transactionManager;
    DatabaseCore database;
    List<String> outcomes;

    @Before
    public void setUp() {
        eventLoop = new EventLoop();
        transactionManager = new TransactionManager(eventLoop);
        database = new DatabaseCore("db");
        outcomes = new ArrayList<>();
    }

    @Override
    public void transactionCompleted(Transaction trans) {
        outcomes.add("complete " + trans.getTransId());
    }

    @Override
    public void transactionAborted(Transaction trans) {
        outcomes.add("abort " + trans.getTransId());
    }

    @Test
    public void testAutoCommit() throws DatabaseException {
        Transaction trans = begin(TransactionMode.READWRITE, "b", "a", "b");
        assertEquals(Arrays.asList("a", "b"), trans.getScope());
        assertTrue(trans.isInScope("a"));
        assertTrue(!trans.isInScope("c"));

        TestRequest request = new TestRequest();
        transactionManager.requestIssued(trans, request);
        assertEquals(1, trans.getPendingCount());

        // the pending request holds the commit back
        eventLoop.runUntilIdle();
        assertEquals(TransactionState.ACTIVE, trans.getState());

        transactionManager.requestDelivered(trans, request, null);
        assertEquals(TransactionState.ACTIVE, trans.getState());
        eventLoop.runUntilIdle();
        assertEquals(TransactionState.COMMITTED, trans.getState());
        assertEquals(Collections.singletonList("complete " + trans.getTransId()), outcomes);

        try {
            transactionManager.requestIssued(trans, new TestRequest());
            fail("request issued against a committed transaction");
        } catch (InvalidStateException e) {
            // expected
        }
    }

    @Test
    public void testEmptyTransaction() {
        Transaction trans = begin(TransactionMode.READONLY, "a");
        eventLoop.runUntilIdle();
        assertEquals(TransactionState.COMMITTED, trans.getState());
        assertEquals(1, outcomes.size());
    }

    @Test
    public void testCommit() throws DatabaseException {
        Transaction trans = begin(TransactionMode.READWRITE, "a");
        TestRequest request = new TestRequest();
        transactionManager.requestIssued(trans, request);
        transactionManager.commitTransaction(trans);
        assertEquals(TransactionState.COMMITTING, trans.getState());

        try {
            transactionManager.requestIssued(trans, new TestRequest());
            fail("request issued against a committing transaction");
        } catch (InvalidStateException e) {
            // expected
        }
        try {
            transactionManager.commitTransaction(trans);
            fail("committed twice");
        } catch (InvalidStateException e) {
            // expected
        }

        eventLoop.runUntilIdle();
        assertEquals(TransactionState.COMMITTING, trans.getState());
        transactionManager.requestDelivered(trans, request, null);
        eventLoop.runUntilIdle();
        assertEquals(TransactionState.COMMITTED, trans.getState());
    }

    @Test
    public void testAbort() throws DatabaseException {
        Transaction trans = begin(TransactionMode.READWRITE, "a");
        List<String> undone = new ArrayList<>();
        trans.logUndo(() -> undone.add("first"));
        trans.logUndo(() -> undone.add("second"));
        TestRequest request = new TestRequest();
        transactionManager.requestIssued(trans, request);

        transactionManager.abortTransaction(trans, null);
        assertEquals(TransactionState.ABORTED, trans.getState());
        assertEquals(Arrays.asList("second", "first"), undone);
        assertTrue(request.error != null);
        assertNull(request.error.getCause());
        assertNull(trans.getError());

        // the notification follows in a later turn
        assertTrue(outcomes.isEmpty());
        transactionManager.abortTransaction(trans, null);
        eventLoop.runUntilIdle();
        assertEquals(Collections.singletonList("abort " + trans.getTransId()), outcomes);
        assertEquals(2, undone.size());

        // a late delivery changes nothing
        transactionManager.requestDelivered(trans, request, null);
        eventLoop.runUntilIdle();
        assertEquals(1, outcomes.size());
    }

    @Test
    public void testUnhandledError() throws DatabaseException {
        Transaction trans = begin(TransactionMode.READWRITE, "a");
        TestRequest failed = new TestRequest();
        TestRequest other = new TestRequest();
        transactionManager.requestIssued(trans, failed);
        transactionManager.requestIssued(trans, other);

        ConstraintException error = new ConstraintException("duplicate");
        transactionManager.requestDelivered(trans, failed, error);
        assertEquals(TransactionState.ABORTED, trans.getState());
        assertSame(error, trans.getError());
        assertSame(error, other.error.getCause());
        assertNull(failed.error);
    }

    @Test
    public void testValidation() throws DatabaseException {
        Transaction readOnly = begin(TransactionMode.READONLY, "a");
        readOnly.validate();
        try {
            readOnly.validateWrite();
            fail("write allowed in a read-only transaction");
        } catch (ReadOnlyException e) {
            // expected
        }

        transactionManager.abortTransaction(readOnly, null);
        try {
            readOnly.validateWrite();
            fail("write allowed in an aborted transaction");
        } catch (InvalidStateException e) {
            // expected
        }
    }

    @Test
    public void testUpgrade() throws DatabaseException {
        Transaction upgrade = transactionManager.beginTransaction(database, TransactionMode.VERSIONCHANGE,
                null, this);
        assertSame(upgrade, database.getUpgradeTransaction());
        assertTrue(upgrade.getScope().isEmpty());
        assertTrue(upgrade.isInScope("anything"));

        try {
            begin(TransactionMode.READONLY, "a");
            fail("transaction started during an upgrade");
        } catch (IllegalStateException e) {
            assertTrue(e.getCause() instanceof InvalidStateException);
        }

        eventLoop.runUntilIdle();
        assertEquals(TransactionState.COMMITTED, upgrade.getState());
        assertNull(database.getUpgradeTransaction());

        Transaction aborted = transactionManager.beginTransaction(database, TransactionMode.VERSIONCHANGE,
                null, this);
        transactionManager.abortTransaction(aborted, null);
        assertSame(aborted, database.getUpgradeTransaction());
        eventLoop.runUntilIdle();
        assertNull(database.getUpgradeTransaction());
    }

    private Transaction begin(TransactionMode mode, String... scope) {
        try {
            return transactionManager.beginTransaction(database, mode, Arrays.asList(scope), this);
        } catch (InvalidStateException e) {
            throw new IllegalStateException(e);
        }
    }

    static class TestRequest implements PendingRequest {
        AbortException error;

        @Override
        public void abortPending(AbortException error) {
            this.error = error;
        }
    }
}
