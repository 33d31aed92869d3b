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

package com.memidb.access;

import com.memidb.api.DataException;
import com.memidb.api.Key;
import com.memidb.api.KeyPath;
import com.memidb.api.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolves key paths against stored values.
 * <p>
 * Each field of a dotted path selects a field of an object value. The field
 * <code>length</code> also selects the length of a string or array. An empty
 * path selects the whole value.
 */
public final class KeyPathExtractor {

    private KeyPathExtractor() {
    }

    /**
     * Extracts the value at a simple path.
     *
     * @param value the stored value
     * @param path  a dotted path, or the empty string
     * @return the value found, or null if the path does not lead anywhere
     */
    public static Value extract(Value value, String path) {
        if (path.isEmpty())
            return value;

        Value current = value;
        for (String field : path.split("\\.")) {
            if (current == null)
                return null;
            if (current.isObject())
                current = current.get(field);
            else if (field.equals("length") && current.getKind() == Value.Kind.STRING)
                current = Value.of(current.asString().length());
            else if (field.equals("length") && current.isArray())
                current = Value.of(current.getElements().size());
            else
                return null;
        }
        return current;
    }

    /**
     * Extracts the value at a key path. For a compound key path the result
     * is an array of the values at each component path.
     *
     * @param value   the stored value
     * @param keyPath the key path
     * @return the value found, or null if any path does not lead anywhere
     */
    public static Value extract(Value value, KeyPath keyPath) {
        if (!keyPath.isCompound())
            return extract(value, keyPath.getPath());

        List<Value> values = new ArrayList<>();
        for (String path : keyPath.getPaths()) {
            Value v = extract(value, path);
            if (v == null)
                return null;
            values.add(v);
        }
        return Value.array(values);
    }

    /**
     * Extracts a key at a key path.
     *
     * @param value   the stored value
     * @param keyPath the key path
     * @return the key, or null if there is no valid key at the key path
     */
    public static Key extractKey(Value value, KeyPath keyPath) {
        Value v = extract(value, keyPath);
        return v == null ? null : v.toKey();
    }

    /**
     * Returns a copy of the value with the key stored at a simple path,
     * creating intermediate objects where fields are missing.
     *
     * @param value the stored value
     * @param path  a non-empty dotted path
     * @param key   the key to store
     * @return the updated copy
     * @throws DataException if the value, or a value along the path, is not
     *                       an object
     */
    public static Value inject(Value value, String path, Key key) throws DataException {
        Value injected = inject(value, path.split("\\."), 0, key.toValue());
        if (injected == null)
            throw new DataException("Cannot store key " + key + " at key path " + path + " of " + value);
        return injected;
    }

    private static Value inject(Value value, String[] fields, int i, Value key) {
        if (!value.isObject())
            return null;
        if (i == fields.length - 1)
            return value.with(fields[i], key);

        Value child = value.get(fields[i]);
        if (child == null)
            child = Value.object(Collections.emptyMap());
        Value updated = inject(child, fields, i + 1, key);
        return updated == null ? null : value.with(fields[i], updated);
    }
}
