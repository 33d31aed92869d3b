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
import com.memidb.seed.DatabaseSchema;
import com.memidb.seed.IndexSchema;
import com.memidb.seed.StoreSchema;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class APITest {

    MemIDB memIDB;
    Connection connection;

    @Before
    public void setUp() throws DatabaseException {
        memIDB = new MemIDB();
        memIDB.seedDatabase(new DatabaseSchema("library", 1)
                .store(new StoreSchema("books").keyPath("isbn")
                        .index("author", "author")
                        .index(new IndexSchema("tags", "tags").multiEntry())
                        .index(new IndexSchema("title", "title").unique())
                        .record(book("1", "Dune", "Herbert", "scifi", "classic"))
                        .record(book("2", "Emma", "Austen", "classic"))
                        .record(book("3", "Persuasion", "Austen", "classic", "romance"))
                        .record(book("4", "Solaris", "Lem", "scifi"))
                        .record(Value.builder().put("title", "No ISBN").build()))
                .store(new StoreSchema("loans").autoIncrement()));
        connection = open("library", 0, null);
    }

    /**
     * List, delete and create databases.
     */
    @Test
    public void testDatabases() throws Exception {
        assertEquals(1, connection.getVersion());
        assertEquals(Arrays.asList("books", "loans"), connection.getObjectStoreNames());
        assertEquals(4, memIDB.getStore("library", "books").size());

        Request<List<DatabaseInfo>> databases = memIDB.databases();
        try {
            databases.getResult();
            fail("result available before delivery");
        } catch (InvalidStateException e) {
            // expected
        }
        memIDB.runUntilIdle();
        assertEquals(Collections.singletonList(new DatabaseInfo("library", 1)), databases.getResult());

        Request<Void> delete = memIDB.deleteDatabase("library");
        Request<Void> deleteMissing = memIDB.deleteDatabase("missing");
        memIDB.runUntilIdle();
        assertNull(delete.getError());
        assertNull(deleteMissing.getError());
        assertTrue(connection.isClosed());
        assertNull(memIDB.getDatabase("library"));
        assertTrue(memIDB.getAllDatabases().isEmpty());

        Connection fresh = open("fresh", 0, null);
        assertEquals(1, fresh.getVersion());
        assertTrue(fresh.getObjectStoreNames().isEmpty());
        assertEquals("fresh", memIDB.getAllDatabases().get(0).getName());

        assertEquals(-1, memIDB.cmp(Key.of(1), Key.of("1")));
        assertEquals(1, memIDB.cmp(Key.of("b"), Key.of("a")));
        assertEquals(0, memIDB.cmp(Key.of(Key.of(1)), Key.of(Key.of(1))));
    }

    /**
     * Read records by key, by range and through indexes.
     */
    @Test
    public void testReads() throws Exception {
        Transaction tx = connection.transaction("books");
        assertEquals(TransactionMode.READONLY, tx.getMode());
        ObjectStore books = tx.objectStore("books");
        assertEquals("isbn", books.getKeyPath().getPath());
        assertEquals(Arrays.asList("author", "tags", "title"), books.getIndexNames());

        Request<Value> dune = books.get(Key.of("1"));
        Request<Value> missing = books.get(Key.of("9"));
        Request<Key> next = books.getKey(KeyRange.lowerBound(Key.of("2"), true));
        Request<List<Value>> some = books.getAll(KeyRange.bound(Key.of("2"), Key.of("4")), 2);
        Request<List<Key>> keys = books.getAllKeys();
        Request<Integer> count = books.count(KeyRange.upperBound(Key.of("3")));

        Index author = books.index("author");
        Request<Value> austen = author.get(Key.of("Austen"));
        Request<Key> austenKey = author.getKey(Key.of("Austen"));
        Request<List<Value>> austens = author.getAll(KeyRange.only(Key.of("Austen")));
        Index tags = books.index("tags");
        Request<List<Key>> classics = tags.getAllKeys(KeyRange.only(Key.of("classic")));
        Request<Integer> tagCount = tags.count();

        try {
            books.index("year");
            fail("found a missing index");
        } catch (NotFoundException e) {
            // expected
        }

        memIDB.runUntilIdle();
        assertEquals(Value.of("Dune"), dune.getResult().get("title"));
        assertNull(missing.getResult());
        assertNull(missing.getError());
        assertEquals(Key.of("3"), next.getResult());
        assertEquals(Arrays.asList("Emma", "Persuasion"), titles(some.getResult()));
        assertEquals(Arrays.asList(Key.of("1"), Key.of("2"), Key.of("3"), Key.of("4")), keys.getResult());
        assertEquals(Integer.valueOf(3), count.getResult());
        assertEquals(Value.of("Emma"), austen.getResult().get("title"));
        assertEquals(Key.of("2"), austenKey.getResult());
        assertEquals(Arrays.asList("Emma", "Persuasion"), titles(austens.getResult()));
        assertEquals(Arrays.asList(Key.of("1"), Key.of("2"), Key.of("3")), classics.getResult());
        assertEquals(Integer.valueOf(6), tagCount.getResult());
        assertEquals(TransactionState.COMMITTED, tx.getState());
    }

    /**
     * Write records and check the failures reported through requests.
     */
    @Test
    public void testWrites() throws Exception {
        Transaction tx = connection.transaction("books", TransactionMode.READWRITE);
        ObjectStore books = tx.objectStore("books");
        Request<Key> replaced = books.put(book("2", "Emma", "Jane Austen", "classic"));
        Request<Key> duplicateTitle = books.add(book("5", "Dune", "Anonymous")).onError(Request::preventDefault);
        Request<Key> duplicateKey = books.add(book("1", "Dune II", "Herbert")).onError(Request::preventDefault);
        Request<Key> keyless = books.add(Value.builder().put("title", "Untitled").build())
                .onError(Request::preventDefault);
        books.delete(KeyRange.bound(Key.of("3"), Key.of("4")));
        Request<Integer> count = books.count();
        Request<List<Key>> austens = books.index("author").getAllKeys(KeyRange.only(Key.of("Austen")));
        memIDB.runUntilIdle();

        assertEquals(Key.of("2"), replaced.getResult());
        assertEquals(ErrorKind.CONSTRAINT, duplicateTitle.getError().getKind());
        assertEquals(ErrorKind.CONSTRAINT, duplicateKey.getError().getKind());
        assertEquals(ErrorKind.DATA, keyless.getError().getKind());
        assertNull(keyless.getResult());
        assertEquals(Integer.valueOf(2), count.getResult());
        assertTrue(austens.getResult().isEmpty());
        assertEquals(TransactionState.COMMITTED, tx.getState());
        assertEquals(Value.of("Jane Austen"), memIDB.getStore("library", "books").get(Key.of("2")).get("author"));

        tx = connection.transaction("books", TransactionMode.READWRITE);
        tx.objectStore("books").clear();
        memIDB.runUntilIdle();
        assertTrue(memIDB.getStore("library", "books").isEmpty());
    }

    /**
     * Operations that are rejected before any request is issued.
     */
    @Test
    public void testMisuse() throws Exception {
        Transaction ro = connection.transaction("books");
        ObjectStore books = ro.objectStore("books");
        try {
            books.put(book("5", "Ubik", "Dick"));
            fail("wrote in a readonly transaction");
        } catch (ReadOnlyException e) {
            assertEquals(ErrorKind.READ_ONLY, e.getKind());
        }
        try {
            ro.objectStore("loans");
            fail("used a store outside the scope");
        } catch (InvalidStateException e) {
            // expected
        }
        try {
            books.createIndex("year", "year");
            fail("created an index outside an upgrade");
        } catch (InvalidStateException e) {
            // expected
        }
        try {
            connection.createObjectStore("reviews");
            fail("created a store outside an upgrade");
        } catch (InvalidStateException e) {
            // expected
        }
        try {
            connection.transaction("reviews");
            fail("opened a transaction over a missing store");
        } catch (NotFoundException e) {
            // expected
        }
        try {
            connection.transaction(Collections.<String>emptyList(), TransactionMode.READWRITE);
            fail("opened a transaction without stores");
        } catch (InvalidAccessException e) {
            // expected
        }
        try {
            connection.transaction("books", TransactionMode.VERSIONCHANGE);
            fail("opened a versionchange transaction");
        } catch (IllegalArgumentException e) {
            // expected
        }

        memIDB.runUntilIdle();
        assertEquals(TransactionState.COMMITTED, ro.getState());
        try {
            books.get(Key.of("1"));
            fail("read from a committed transaction");
        } catch (InvalidStateException e) {
            // expected
        }

        connection.close();
        assertTrue(connection.isClosed());
        try {
            connection.transaction("books");
            fail("opened a transaction on a closed connection");
        } catch (InvalidStateException e) {
            // expected
        }
    }

    /**
     * Abort a transaction and check that its changes are reverted and its pending requests fail.
     */
    @Test
    public void testAbort() throws Exception {
        List<String> trace = new ArrayList<>();
        Transaction tx = connection.transaction("books", TransactionMode.READWRITE);
        tx.onAbort(t -> trace.add("abort"));
        tx.onComplete(t -> trace.add("complete"));
        ObjectStore books = tx.objectStore("books");
        books.put(book("5", "Ubik", "Dick")).onError(r -> trace.add("put " + r.getError().getErrorName()));
        books.delete(Key.of("1"));
        assertEquals(4, memIDB.getStore("library", "books").size());

        tx.abort();
        assertEquals(TransactionState.ABORTED, tx.getState());
        assertEquals(4, memIDB.getStore("library", "books").size());
        assertTrue(memIDB.getStore("library", "books").containsKey(Key.of("1")));
        try {
            tx.abort();
            fail("aborted twice");
        } catch (InvalidStateException e) {
            // expected
        }
        try {
            books.get(Key.of("1"));
            fail("read from an aborted transaction");
        } catch (InvalidStateException e) {
            // expected
        }

        memIDB.runUntilIdle();
        assertEquals(Arrays.asList("put AbortError", "abort"), trace);
        assertNull(tx.getError());
    }

    /**
     * A listener that throws aborts its transaction.
     */
    @Test
    public void testListenerFailure() throws Exception {
        Transaction tx = connection.transaction("books", TransactionMode.READWRITE);
        ObjectStore books = tx.objectStore("books");
        books.put(book("5", "Ubik", "Dick")).onSuccess(r -> {
            throw new IllegalStateException("listener bug");
        });
        Request<Integer> count = books.count();
        memIDB.runUntilIdle();

        assertEquals(TransactionState.ABORTED, tx.getState());
        assertEquals(ErrorKind.ABORT, tx.getError().getKind());
        assertTrue(tx.getError().getCause() instanceof IllegalStateException);
        assertEquals(ErrorKind.ABORT, count.getError().getKind());
        assertEquals(4, memIDB.getStore("library", "books").size());
    }

    /**
     * Commit explicitly and check that the transaction accepts no more requests.
     */
    @Test
    public void testCommit() throws Exception {
        List<String> trace = new ArrayList<>();
        Transaction tx = connection.transaction(Arrays.asList("loans", "books"), TransactionMode.READWRITE);
        assertEquals(Arrays.asList("books", "loans"), tx.getObjectStoreNames());
        tx.onComplete(t -> trace.add("complete"));
        ObjectStore loans = tx.objectStore("loans");
        loans.add(Value.builder().put("isbn", "1").build()).onSuccess(r -> trace.add("loan " + r.getResult()));
        tx.commit();
        assertEquals(TransactionState.COMMITTING, tx.getState());
        try {
            loans.add(Value.builder().put("isbn", "2").build());
            fail("wrote in a committing transaction");
        } catch (InvalidStateException e) {
            // expected
        }
        try {
            tx.commit();
            fail("committed twice");
        } catch (InvalidStateException e) {
            // expected
        }

        memIDB.runUntilIdle();
        assertEquals(Arrays.asList("loan 1", "complete"), trace);
        assertEquals(TransactionState.COMMITTED, tx.getState());
        assertEquals(1, memIDB.getStore("library", "loans").size());
    }

    /**
     * Walk stores and indexes with cursors in every direction.
     */
    @Test
    public void testCursors() throws Exception {
        Transaction tx = connection.transaction("books");
        ObjectStore books = tx.objectStore("books");
        Index author = books.index("author");
        Index tags = books.index("tags");

        List<Key> next = collect(books.openCursor());
        List<Key> prev = collect(books.openCursor(null, CursorDirection.PREV));
        List<Key> unique = collect(author.openCursor(null, CursorDirection.NEXTUNIQUE));
        List<Key> authorPrev = collect(author.openCursor(null, CursorDirection.PREV));
        List<Key> tagged = collect(tags.openCursor());

        List<Key> advanced = new ArrayList<>();
        books.openCursor().onSuccess(r -> {
            CursorWithValue cursor = r.getResult();
            if (cursor != null) {
                advanced.add(cursor.getPrimaryKey());
                cursor.advance(2);
            }
        });

        List<Key> skipped = new ArrayList<>();
        List<DatabaseException> errors = new ArrayList<>();
        books.openCursor().onSuccess(r -> {
            CursorWithValue cursor = r.getResult();
            if (cursor == null)
                return;
            skipped.add(cursor.getPrimaryKey());
            if (cursor.getKey().equals(Key.of("1"))) {
                try {
                    cursor.continueCursor(Key.of("1"));
                } catch (DataException e) {
                    errors.add(e);
                }
                try {
                    cursor.continuePrimaryKey(Key.of("1"), Key.of("1"));
                } catch (InvalidAccessException e) {
                    errors.add(e);
                }
                cursor.continueCursor(Key.of("3"));
            } else {
                cursor.continueCursor();
            }
        });

        List<Key> primary = new ArrayList<>();
        author.openCursor().onSuccess(r -> {
            CursorWithValue cursor = r.getResult();
            if (cursor == null)
                return;
            primary.add(cursor.getPrimaryKey());
            if (cursor.getPrimaryKey().equals(Key.of("2")))
                cursor.continuePrimaryKey(Key.of("Austen"), Key.of("4"));
            else
                cursor.continueCursor();
        });

        List<String> keyOnly = new ArrayList<>();
        author.openKeyCursor(KeyRange.only(Key.of("Austen")), CursorDirection.PREV).onSuccess(r -> {
            Cursor cursor = r.getResult();
            if (cursor != null) {
                keyOnly.add(cursor.getKey() + ":" + cursor.getPrimaryKey());
                cursor.continueCursor();
            }
        });

        memIDB.runUntilIdle();
        assertEquals(keys("1", "2", "3", "4"), next);
        assertEquals(keys("4", "3", "2", "1"), prev);
        assertEquals(keys("2", "1", "4"), unique);
        assertEquals(keys("4", "1", "3", "2"), authorPrev);
        assertEquals(keys("1", "2", "3", "3", "1", "4"), tagged);
        assertEquals(keys("1", "3"), advanced);
        assertEquals(keys("1", "3", "4"), skipped);
        assertEquals(2, errors.size());
        assertEquals(keys("2", "1", "4"), primary);
        assertEquals(Arrays.asList("\"Austen\":\"3\"", "\"Austen\":\"2\""), keyOnly);
        assertEquals(TransactionState.COMMITTED, tx.getState());
    }

    /**
     * Update and delete records through a cursor.
     */
    @Test
    public void testCursorWrites() throws Exception {
        Transaction tx = connection.transaction("books", TransactionMode.READWRITE);
        ObjectStore books = tx.objectStore("books");
        List<DatabaseException> errors = new ArrayList<>();
        List<Request<Key>> updates = new ArrayList<>();
        books.openCursor().onSuccess(r -> {
            CursorWithValue cursor = r.getResult();
            if (cursor == null)
                return;
            Value value = cursor.getValue();
            if (cursor.getKey().equals(Key.of("1"))) {
                try {
                    cursor.update(value.with("isbn", Value.of("X")));
                } catch (DataException e) {
                    errors.add(e);
                }
            } else if (cursor.getKey().equals(Key.of("2"))) {
                updates.add(cursor.update(value.with("title", Value.of("Emma (annotated)"))));
            } else if (cursor.getKey().equals(Key.of("4"))) {
                cursor.delete();
            }
            cursor.continueCursor();
        });

        books.openKeyCursor().onSuccess(r -> {
            Cursor cursor = r.getResult();
            if (cursor == null)
                return;
            try {
                cursor.delete();
            } catch (InvalidStateException e) {
                errors.add(e);
            }
        });

        memIDB.runUntilIdle();
        assertEquals(TransactionState.COMMITTED, tx.getState());
        assertEquals(2, errors.size());
        assertEquals(ErrorKind.DATA, errors.get(0).getKind());
        assertEquals(ErrorKind.INVALID_STATE, errors.get(1).getKind());
        assertEquals(Key.of("2"), updates.get(0).getResult());

        tx = connection.transaction("books");
        Request<Key> annotated = tx.objectStore("books").index("title").getKey(Key.of("Emma (annotated)"));
        Request<Key> emma = tx.objectStore("books").index("title").getKey(Key.of("Emma"));
        Request<List<Key>> keys = tx.objectStore("books").getAllKeys();
        memIDB.runUntilIdle();
        assertEquals(Key.of("2"), annotated.getResult());
        assertNull(emma.getResult());
        assertEquals(keys("1", "2", "3"), keys.getResult());
    }

    /**
     * Upgrade the schema, and abort upgrades that cannot complete.
     */
    @Test
    public void testUpgrade() throws Exception {
        // a unique index cannot be built over duplicate authors
        OpenRequest failed = memIDB.open("library", 2).onUpgradeNeeded(event ->
                event.getTransaction().objectStore("books")
                        .createIndex("byAuthor", KeyPath.of("author"), new IndexOptions().setUnique(true)));
        memIDB.runUntilIdle();
        assertEquals(ErrorKind.ABORT, failed.getError().getKind());
        assertTrue(failed.getError().getCause() instanceof ConstraintException);
        assertEquals(1, memIDB.getDatabase("library").getVersion());

        List<String> trace = new ArrayList<>();
        OpenRequest upgraded = memIDB.open("library", 2).onUpgradeNeeded(event -> {
            trace.add("upgrade from " + event.getOldVersion());
            try {
                connection.transaction("books");
            } catch (InvalidStateException e) {
                trace.add("busy");
            }
            Connection upgrading = event.getConnection();
            upgrading.deleteObjectStore("loans");
            ObjectStore books = event.getTransaction().objectStore("books");
            books.deleteIndex("tags");
            books.createIndex("year", "year");
            ObjectStore reviews = upgrading.createObjectStore("reviews",
                    new StoreOptions().setKeyPath(KeyPath.of("isbn", "reviewer")));
            reviews.put(Value.builder().put("isbn", "1").put("reviewer", "ann").put("stars", 5).build());
        }).onSuccess(r -> trace.add("open v" + r.getResult().getVersion()));
        memIDB.open("library").onSuccess(r -> trace.add("open latest v" + r.getResult().getVersion()));
        memIDB.runUntilIdle();

        assertEquals(Arrays.asList("upgrade from 1", "busy", "open v2", "open latest v2"), trace);
        assertEquals(Arrays.asList("books", "reviews"), upgraded.getResult().getObjectStoreNames());
        assertTrue(memIDB.getDatabase("library").getStore("reviews")
                .containsKey(Key.of(Key.of("1"), Key.of("ann"))));

        Transaction tx = connection.transaction("books");
        assertEquals(Arrays.asList("author", "title", "year"), tx.objectStore("books").getIndexNames());
        try {
            connection.transaction("loans");
            fail("opened a transaction over a deleted store");
        } catch (NotFoundException e) {
            // expected
        }

        OpenRequest old = memIDB.open("library", 1);
        memIDB.runUntilIdle();
        assertEquals(ErrorKind.VERSION, old.getError().getKind());
    }

    /**
     * Aborting the upgrade that creates a database removes the database again.
     */
    @Test
    public void testAbortedCreation() throws Exception {
        OpenRequest aborted = memIDB.open("scratch", 1).onUpgradeNeeded(event -> {
            event.getConnection().createObjectStore("tmp");
            event.getTransaction().abort();
        });
        memIDB.runUntilIdle();
        assertEquals(ErrorKind.ABORT, aborted.getError().getKind());
        assertNull(memIDB.getDatabase("scratch"));

        // closing the connection aborts its upgrade
        OpenRequest closed = memIDB.open("library", 3).onUpgradeNeeded(event -> {
            event.getConnection().createObjectStore("tmp");
            event.getConnection().close();
        });
        memIDB.runUntilIdle();
        assertEquals(ErrorKind.ABORT, closed.getError().getKind());
        assertEquals(1, memIDB.getDatabase("library").getVersion());
        assertEquals(Arrays.asList("books", "loans"), new ArrayList<>(memIDB.getDatabase("library").getStores().keySet()));
    }

    /**
     * Seeding replaces a database and closes its connections.
     */
    @Test
    public void testReseed() throws Exception {
        memIDB.seedDatabase(new DatabaseSchema("library", 5)
                .store(new StoreSchema("books").keyPath("isbn").record(book("9", "Ubik", "Dick"))));
        assertTrue(connection.isClosed());
        assertEquals(5, memIDB.getDatabase("library").getVersion());
        assertEquals(1, memIDB.getStore("library", "books").size());
        assertNull(memIDB.getStore("library", "loans"));

        memIDB.clearAllDatabases();
        assertTrue(memIDB.getAllDatabases().isEmpty());
        assertNull(memIDB.getStore("library", "books"));
    }

    /**
     * Clearing the registry mid-upgrade aborts the upgrade and releases the
     * open queued behind it.
     */
    @Test
    public void testClearDuringUpgrade() throws Exception {
        OpenRequest first = memIDB.open("scratch", 1).onUpgradeNeeded(event ->
                event.getConnection().createObjectStore("tmp", new StoreOptions().setAutoIncrement(true))
                        .put(Value.of("x")));
        OpenRequest second = memIDB.open("scratch", 2);
        assertTrue(memIDB.runOnce());
        assertTrue(memIDB.runOnce());
        assertEquals(Request.ReadyState.PENDING, second.getReadyState());

        memIDB.clearAllDatabases();
        memIDB.runUntilIdle();
        assertEquals(Request.ReadyState.DONE, first.getReadyState());
        assertEquals(ErrorKind.ABORT, first.getError().getKind());
        assertEquals(Request.ReadyState.DONE, second.getReadyState());
        assertNull(second.getError());
        assertEquals(2, second.getResult().getVersion());
        assertEquals(2, memIDB.getDatabase("scratch").getVersion());
        assertTrue(memIDB.getDatabase("scratch").getStores().isEmpty());
    }

    private Connection open(String name, long version, UpgradeListener upgrade) throws DatabaseException {
        OpenRequest request = version == 0 ? memIDB.open(name) : memIDB.open(name, version);
        if (upgrade != null)
            request.onUpgradeNeeded(upgrade);
        memIDB.runUntilIdle();
        if (request.getError() != null)
            throw request.getError();
        return request.getResult();
    }

    private static List<Key> collect(Request<CursorWithValue> request) {
        List<Key> keys = new ArrayList<>();
        request.onSuccess(r -> {
            CursorWithValue cursor = r.getResult();
            if (cursor != null) {
                keys.add(cursor.getPrimaryKey());
                cursor.continueCursor();
            }
        });
        return keys;
    }

    private static List<Key> keys(String... keys) {
        List<Key> list = new ArrayList<>();
        for (String key : keys)
            list.add(Key.of(key));
        return list;
    }

    private static List<String> titles(List<Value> values) {
        List<String> titles = new ArrayList<>();
        for (Value value : values)
            titles.add(value.get("title").asString());
        return titles;
    }

    private static Value book(String isbn, String title, String author, String... tags) {
        List<Value> tagValues = new ArrayList<>();
        for (String tag : tags)
            tagValues.add(Value.of(tag));
        return Value.builder()
                .put("isbn", isbn)
                .put("title", title)
                .put("author", author)
                .put("tags", Value.array(tagValues))
                .build();
    }
}
