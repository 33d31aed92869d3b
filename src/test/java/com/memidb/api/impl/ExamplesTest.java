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

package com.memidb.api.impl;

import com.memidb.api.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExamplesTest {

    MemIDB memIDB;

    @BeforeEach
    void setUp() {
        // Each test gets a registry of its own
        memIDB = new MemIDB();
    }

    /**
     * This example creates a store named "users" whose records carry their key in the field "id", with keys
     * generated by the store, then adds two users without ids.
     */
    @Test
    public void testExample1() throws Exception {
        // Stores are created while the database is upgraded to a new version
        OpenRequest open = memIDB.open("app", 1).onUpgradeNeeded(event ->
                event.getConnection().createObjectStore("users",
                        new StoreOptions().setKeyPath("id").setAutoIncrement(true)));

        // Nothing happens until the event loop runs
        assertEquals(Request.ReadyState.PENDING, open.getReadyState());
        memIDB.runUntilIdle();
        Connection connection = open.getResult();

        // Add two users in a readwrite transaction
        Transaction tx = connection.transaction("users", TransactionMode.READWRITE);
        ObjectStore users = tx.objectStore("users");
        Request<Key> alice = users.add(Value.builder().put("name", "Alice").build());
        Request<Key> bob = users.add(Value.builder().put("name", "Bob").build());
        memIDB.runUntilIdle();

        assertEquals(Key.of(1), alice.getResult());
        assertEquals(Key.of(2), bob.getResult());
        assertEquals(TransactionState.COMMITTED, tx.getState());

        // The generated keys were written into the records
        SortedMap<Key, Value> records = memIDB.getStore("app", "users");
        assertEquals(Value.of(1), records.get(Key.of(1)).get("id"));
        assertEquals(Value.of("Alice"), records.get(Key.of(1)).get("name"));
        assertEquals(Value.of(2), records.get(Key.of(2)).get("id"));
    }

    /**
     * This example adds a unique index on "email" and shows what happens to a second user with the same email:
     * the add fails with a ConstraintError, and the transaction survives only if the failure is acknowledged.
     */
    @Test
    public void testExample2() throws Exception {
        Connection connection = openUsers();

        // Acknowledge the failure so the first add is kept
        Transaction tx = connection.transaction("users", TransactionMode.READWRITE);
        ObjectStore users = tx.objectStore("users");
        users.add(user(1, "a@x.com"));
        Request<Key> duplicate = users.add(user(2, "a@x.com")).onError(Request::preventDefault);
        memIDB.runUntilIdle();

        assertEquals(ErrorKind.CONSTRAINT, duplicate.getError().getKind());
        assertEquals(TransactionState.COMMITTED, tx.getState());
        assertEquals(Collections.singletonList(Key.of(1)), new ArrayList<>(memIDB.getStore("app", "users").keySet()));

        // Left unacknowledged, the failure aborts the whole transaction
        tx = connection.transaction("users", TransactionMode.READWRITE);
        users = tx.objectStore("users");
        Request<Key> third = users.add(user(3, "c@x.com"));
        users.add(user(4, "a@x.com"));
        memIDB.runUntilIdle();

        assertEquals(TransactionState.ABORTED, tx.getState());
        assertEquals(ErrorKind.CONSTRAINT, tx.getError().getKind());
        assertEquals(Key.of(3), third.getResult());
        assertEquals(1, memIDB.getStore("app", "users").size());
    }

    /**
     * This example walks a cursor backwards. Once it has visited every record in its range, the next continue
     * reports the cursor exhausted, with no key and no value.
     */
    @Test
    public void testExample3() throws Exception {
        Connection connection = openUsers();
        Transaction tx = connection.transaction("users", TransactionMode.READWRITE);
        tx.objectStore("users").add(user(1, "a@x.com"));
        memIDB.runUntilIdle();

        tx = connection.transaction("users");
        List<String> visited = new ArrayList<>();
        List<CursorWithValue> cursors = new ArrayList<>();
        Request<CursorWithValue> request = tx.objectStore("users")
                .openCursor(KeyRange.only(Key.of(1)), CursorDirection.PREV);
        request.onSuccess(r -> {
            CursorWithValue cursor = r.getResult();
            if (cursor == null) {
                visited.add("exhausted");
                return;
            }
            cursors.add(cursor);
            visited.add(cursor.getKey() + "=" + cursor.getValue().get("email"));
            cursor.continueCursor();
        });
        memIDB.runUntilIdle();

        assertEquals(Arrays.asList("1=\"a@x.com\"", "exhausted"), visited);
        CursorWithValue cursor = cursors.get(0);
        assertTrue(cursor.isExhausted());
        assertNull(cursor.getKey());
        assertNull(cursor.getValue());

        // A cursor over an empty range is exhausted from the start
        tx = connection.transaction("users");
        Request<CursorWithValue> empty = tx.objectStore("users")
                .openCursor(KeyRange.lowerBound(Key.of(1), true), CursorDirection.PREV);
        memIDB.runUntilIdle();
        assertNull(empty.getResult());
        assertNull(empty.getError());
    }

    /**
     * This example shows when notifications fire: a put and a get issued together notify in the order they were
     * issued, both after the issuing code has returned, and the transaction completes after both.
     */
    @Test
    public void testExample4() throws Exception {
        Connection connection = openUsers();
        List<String> trace = new ArrayList<>();

        Transaction tx = connection.transaction("users", TransactionMode.READWRITE);
        tx.onComplete(t -> trace.add("complete"));
        ObjectStore users = tx.objectStore("users");
        users.put(user(1, "a@x.com")).onSuccess(r -> trace.add("put " + r.getResult()));
        users.get(Key.of(1)).onSuccess(r -> trace.add("get " + r.getResult().get("email")));
        trace.add("returned");

        memIDB.runUntilIdle();
        assertEquals(Arrays.asList("returned", "put 1", "get \"a@x.com\"", "complete"), trace);
    }

    /**
     * This example upgrades database "shop" from version 1 to version 2, adding the store "orders", and then
     * tries to open it at the older version again.
     */
    @Test
    public void testExample5() throws Exception {
        OpenRequest v1 = memIDB.open("shop", 1);
        memIDB.runUntilIdle();
        v1.getResult().close();

        List<String> upgrades = new ArrayList<>();
        OpenRequest v2 = memIDB.open("shop", 2).onUpgradeNeeded(event -> {
            upgrades.add(event.getOldVersion() + "->" + event.getNewVersion());
            event.getConnection().createObjectStore("orders", new StoreOptions().setAutoIncrement(true));
        });
        memIDB.runUntilIdle();
        assertEquals(Collections.singletonList("1->2"), upgrades);
        assertEquals(2, v2.getResult().getVersion());
        assertEquals(Collections.singletonList("orders"), v2.getResult().getObjectStoreNames());

        // Opening at a lower version fails and leaves the database alone
        List<DatabaseException> errors = new ArrayList<>();
        OpenRequest old = memIDB.open("shop", 1).onError(r -> errors.add(r.getError()));
        memIDB.runUntilIdle();
        assertEquals(1, errors.size());
        assertSame(errors.get(0), old.getError());
        assertTrue(old.getError() instanceof VersionException);
        assertEquals("VersionError", old.getError().getErrorName());
        assertNull(old.getResult());
        assertEquals(2, memIDB.getDatabase("shop").getVersion());
        assertEquals(Collections.singletonList("orders"), new ArrayList<>(memIDB.getDatabase("shop").getStores().keySet()));
    }

    private Connection openUsers() throws DatabaseException {
        OpenRequest open = memIDB.open("app", 1).onUpgradeNeeded(event ->
                event.getConnection().createObjectStore("users", new StoreOptions().setKeyPath("id"))
                        .createIndex("email", KeyPath.of("email"), new IndexOptions().setUnique(true)));
        memIDB.runUntilIdle();
        return open.getResult();
    }

    private static Value user(int id, String email) {
        return Value.builder().put("id", id).put("email", email).build();
    }
}
