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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <code>KeyPath</code> describes where in a stored {@link Value} its key lives.
 * A simple key path is a dot-separated list of field names, such as
 * <code>"address.zip"</code>; the empty string denotes the value itself. A
 * compound key path is a list of simple paths whose extracted values together
 * form an array key.
 */
public final class KeyPath {

    private final List<String> paths;
    private final boolean compound;

    private KeyPath(List<String> paths, boolean compound) {
        this.paths = paths;
        this.compound = compound;
    }

    /**
     * Creates a simple key path.
     *
     * @param path a dot-separated list of field names, or the empty string
     * @return the key path
     */
    public static KeyPath of(String path) {
        checkPath(path);
        return new KeyPath(Collections.singletonList(path), false);
    }

    /**
     * Creates a compound key path.
     *
     * @param paths the component paths
     * @return the key path
     */
    public static KeyPath of(String... paths) {
        return of(Arrays.asList(paths));
    }

    public static KeyPath of(List<String> paths) {
        if (paths.isEmpty())
            throw new IllegalArgumentException("A compound key path needs at least one component");
        for (String path : paths)
            checkPath(path);
        return new KeyPath(Collections.unmodifiableList(new ArrayList<>(paths)), true);
    }

    public boolean isCompound() {
        return compound;
    }

    /**
     * Gets the single path of a simple key path.
     *
     * @return the path
     * @throws IllegalStateException if this key path is compound
     */
    public String getPath() {
        if (compound)
            throw new IllegalStateException("Compound key path " + this + " has no single path");
        return paths.get(0);
    }

    public List<String> getPaths() {
        return paths;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof KeyPath && compound == ((KeyPath) obj).compound
                && paths.equals(((KeyPath) obj).paths);
    }

    @Override
    public int hashCode() {
        return paths.hashCode() * 2 + (compound ? 1 : 0);
    }

    @Override
    public String toString() {
        return compound ? paths.toString() : paths.get(0);
    }

    private static void checkPath(String path) {
        if (path == null)
            throw new IllegalArgumentException("A key path must not be null");
        if (path.isEmpty())
            return;
        for (String field : path.split("\\.", -1)) {
            if (field.isEmpty() || !Character.isJavaIdentifierStart(field.charAt(0)))
                throw new IllegalArgumentException("Invalid key path: " + path);
        }
    }
}
