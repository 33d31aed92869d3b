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

package com.memidb.seed;

/**
 * Ready-made schemas for common application databases, all at version 1
 * and without records. Add records to their stores before seeding:
 *
 * <pre>
 * DatabaseSchema schema = DatabasePresets.usersDatabase();
 * schema.getStore("users").record(alice);
 * memidb.seedDatabase(schema);
 * </pre>
 */
public final class DatabasePresets {

    private DatabasePresets() {
    }

    public static DatabaseSchema keyValueStore() {
        return keyValueStore("kvStore");
    }

    /**
     * A single store <code>data</code> keyed by the <code>key</code> field.
     */
    public static DatabaseSchema keyValueStore(String name) {
        return new DatabaseSchema(name, 1)
                .store(new StoreSchema("data").keyPath("key"));
    }

    public static DatabaseSchema usersDatabase() {
        return usersDatabase("usersDb");
    }

    /**
     * Stores <code>users</code>, with unique <code>email</code> and
     * <code>username</code> indexes, and <code>sessions</code>, indexed by
     * <code>userId</code> and <code>expiresAt</code>. Both generate their
     * <code>id</code> keys.
     */
    public static DatabaseSchema usersDatabase(String name) {
        return new DatabaseSchema(name, 1)
                .store(new StoreSchema("users")
                        .keyPath("id")
                        .autoIncrement()
                        .index(new IndexSchema("email", "email").unique())
                        .index(new IndexSchema("username", "username").unique()))
                .store(new StoreSchema("sessions")
                        .keyPath("id")
                        .autoIncrement()
                        .index("userId", "userId")
                        .index("expiresAt", "expiresAt"));
    }

    public static DatabaseSchema todoDatabase() {
        return todoDatabase("todoDb");
    }

    /**
     * Stores <code>todos</code>, indexed by <code>completed</code>,
     * <code>createdAt</code> and <code>priority</code>, and
     * <code>categories</code>. Both generate their <code>id</code> keys.
     */
    public static DatabaseSchema todoDatabase(String name) {
        return new DatabaseSchema(name, 1)
                .store(new StoreSchema("todos")
                        .keyPath("id")
                        .autoIncrement()
                        .index("completed", "completed")
                        .index("createdAt", "createdAt")
                        .index("priority", "priority"))
                .store(new StoreSchema("categories")
                        .keyPath("id")
                        .autoIncrement());
    }

    public static DatabaseSchema cacheDatabase() {
        return cacheDatabase("cacheDb");
    }

    /**
     * Stores <code>requests</code>, indexed by <code>timestamp</code> and
     * <code>method</code>, and <code>responses</code>, indexed by
     * <code>expiresAt</code>. Both are keyed by <code>url</code>.
     */
    public static DatabaseSchema cacheDatabase(String name) {
        return new DatabaseSchema(name, 1)
                .store(new StoreSchema("requests")
                        .keyPath("url")
                        .index("timestamp", "timestamp")
                        .index("method", "method"))
                .store(new StoreSchema("responses")
                        .keyPath("url")
                        .index("expiresAt", "expiresAt"));
    }
}
