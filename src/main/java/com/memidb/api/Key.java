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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <code>Key</code> is a primary or index key. Keys are immutable and totally
 * ordered: numbers sort before dates, dates before strings, strings before
 * binary keys and binary keys before array keys. Within a type, numbers and
 * dates compare numerically, strings by UTF-16 code unit, binary keys as
 * unsigned bytes and arrays element by element, then by length.
 * <p>
 * Only values that can be ordered this way are valid keys. NaN is rejected.
 *
 * @see KeyRange
 * @see Value#toKey()
 */
public final class Key implements Comparable<Key> {

    /**
     * Key types in ascending sort order.
     */
    public enum Type {
        NUMBER, DATE, STRING, BINARY, ARRAY
    }

    private final Type type;
    private final double number;
    private final Object object;

    private Key(Type type, double number, Object object) {
        this.type = type;
        this.number = number;
        this.object = object;
    }

    /**
     * Creates a number key.
     *
     * @param number the key value, which must not be NaN
     * @return the key
     * @throws IllegalArgumentException if the number is NaN
     */
    public static Key of(double number) {
        if (Double.isNaN(number))
            throw new IllegalArgumentException("NaN is not a valid key");
        return new Key(Type.NUMBER, number == 0.0 ? 0.0 : number, null);
    }

    /**
     * Creates a string key.
     *
     * @param string the key value
     * @return the key
     */
    public static Key of(String string) {
        if (string == null)
            throw new IllegalArgumentException("null is not a valid key");
        return new Key(Type.STRING, 0, string);
    }

    /**
     * Creates a date key.
     *
     * @param date the key value
     * @return the key
     */
    public static Key of(Instant date) {
        if (date == null)
            throw new IllegalArgumentException("null is not a valid key");
        return new Key(Type.DATE, date.toEpochMilli(), date);
    }

    /**
     * Creates a binary key from a copy of the given bytes.
     *
     * @param bytes the key value
     * @return the key
     */
    public static Key of(byte[] bytes) {
        if (bytes == null)
            throw new IllegalArgumentException("null is not a valid key");
        return new Key(Type.BINARY, 0, bytes.clone());
    }

    /**
     * Creates an array key.
     *
     * @param elements the key elements
     * @return the key
     */
    public static Key of(Key... elements) {
        return of(Arrays.asList(elements));
    }

    /**
     * Creates an array key.
     *
     * @param elements the key elements
     * @return the key
     */
    public static Key of(List<Key> elements) {
        for (Key element : elements) {
            if (element == null)
                throw new IllegalArgumentException("null is not a valid key");
        }
        return new Key(Type.ARRAY, 0, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public Type getType() {
        return type;
    }

    public double asNumber() {
        checkType(Type.NUMBER);
        return number;
    }

    public Instant asDate() {
        checkType(Type.DATE);
        return (Instant) object;
    }

    public String asString() {
        checkType(Type.STRING);
        return (String) object;
    }

    public byte[] asBinary() {
        checkType(Type.BINARY);
        return ((byte[]) object).clone();
    }

    @SuppressWarnings("unchecked")
    public List<Key> asArray() {
        checkType(Type.ARRAY);
        return (List<Key>) object;
    }

    /**
     * Converts this key to the equivalent stored value.
     *
     * @return the value representation of this key
     */
    public Value toValue() {
        switch (type) {
            case NUMBER:
                return Value.of(number);
            case DATE:
                return Value.of((Instant) object);
            case STRING:
                return Value.of((String) object);
            case BINARY:
                return Value.of((byte[]) object);
            default:
                List<Value> values = new ArrayList<>();
                for (Key key : asArray())
                    values.add(key.toValue());
                return Value.array(values);
        }
    }

    @Override
    public int compareTo(Key o) {
        if (type != o.type)
            return type.compareTo(o.type);

        switch (type) {
            case NUMBER:
            case DATE:
                return Double.compare(number, o.number);
            case STRING:
                return ((String) object).compareTo((String) o.object);
            case BINARY:
                return Arrays.compareUnsigned((byte[]) object, (byte[]) o.object);
            default:
                List<Key> a = asArray();
                List<Key> b = o.asArray();
                int n = Math.min(a.size(), b.size());
                for (int i = 0; i < n; i++) {
                    int diff = a.get(i).compareTo(b.get(i));
                    if (diff != 0)
                        return diff;
                }
                return Integer.compare(a.size(), b.size());
        }
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Key && compareTo((Key) obj) == 0;
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NUMBER:
            case DATE:
                return 31 * type.hashCode() + Double.hashCode(number);
            case BINARY:
                return 31 * type.hashCode() + Arrays.hashCode((byte[]) object);
            default:
                return 31 * type.hashCode() + object.hashCode();
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return number == Math.rint(number) && !Double.isInfinite(number)
                        ? Long.toString((long) number) : Double.toString(number);
            case DATE:
                return object.toString();
            case STRING:
                return "\"" + object + "\"";
            case BINARY:
                return Arrays.toString((byte[]) object);
            default:
                return object.toString();
        }
    }

    private void checkType(Type expected) {
        if (type != expected)
            throw new IllegalStateException("Key is a " + type + ", not a " + expected);
    }
}
