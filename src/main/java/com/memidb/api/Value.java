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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <code>Value</code> is the structured data stored in an object store. A value
 * is one of a closed set of kinds: null, boolean, number, string, date,
 * binary, array or object. Objects map field names to values and keep the
 * order in which fields were added.
 * <p>
 * Values are immutable, so a value handed to the engine can never be changed
 * behind its back, and a value read back can be shared freely. Use
 * {@link #with} to derive a modified object, or {@link #builder} to assemble
 * one:
 *
 * <pre>
 * Value user = Value.builder()
 *         .put("name", "Alice")
 *         .put("email", "alice@example.com")
 *         .build();
 * </pre>
 */
public final class Value {

    public enum Kind {
        NULL, BOOLEAN, NUMBER, STRING, DATE, BINARY, ARRAY, OBJECT
    }

    public static final Value NULL = new Value(Kind.NULL, 0, null);
    public static final Value TRUE = new Value(Kind.BOOLEAN, 1, null);
    public static final Value FALSE = new Value(Kind.BOOLEAN, 0, null);

    private final Kind kind;
    private final double number;
    private final Object object;

    private Value(Kind kind, double number, Object object) {
        this.kind = kind;
        this.number = number;
        this.object = object;
    }

    public static Value of(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static Value of(double number) {
        return new Value(Kind.NUMBER, number, null);
    }

    public static Value of(String string) {
        return string == null ? NULL : new Value(Kind.STRING, 0, string);
    }

    public static Value of(Instant date) {
        return date == null ? NULL : new Value(Kind.DATE, 0, date);
    }

    public static Value of(byte[] bytes) {
        return bytes == null ? NULL : new Value(Kind.BINARY, 0, bytes.clone());
    }

    public static Value array(Value... elements) {
        return array(Arrays.asList(elements));
    }

    public static Value array(List<Value> elements) {
        List<Value> list = new ArrayList<>(elements.size());
        for (Value element : elements)
            list.add(element == null ? NULL : element);
        return new Value(Kind.ARRAY, 0, Collections.unmodifiableList(list));
    }

    public static Value object(Map<String, Value> fields) {
        Map<String, Value> map = new LinkedHashMap<>();
        for (Map.Entry<String, Value> entry : fields.entrySet())
            map.put(entry.getKey(), entry.getValue() == null ? NULL : entry.getValue());
        return new Value(Kind.OBJECT, 0, Collections.unmodifiableMap(map));
    }

    /**
     * Starts building an object value.
     *
     * @return a new, empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isObject() {
        return kind == Kind.OBJECT;
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    public boolean asBoolean() {
        checkKind(Kind.BOOLEAN);
        return number != 0;
    }

    public double asNumber() {
        checkKind(Kind.NUMBER);
        return number;
    }

    public String asString() {
        checkKind(Kind.STRING);
        return (String) object;
    }

    public Instant asDate() {
        checkKind(Kind.DATE);
        return (Instant) object;
    }

    public byte[] asBinary() {
        checkKind(Kind.BINARY);
        return ((byte[]) object).clone();
    }

    @SuppressWarnings("unchecked")
    public List<Value> getElements() {
        checkKind(Kind.ARRAY);
        return (List<Value>) object;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> getFields() {
        checkKind(Kind.OBJECT);
        return (Map<String, Value>) object;
    }

    /**
     * Gets the named field of an object value.
     *
     * @param field the field name
     * @return the field value, or null if this is not an object or has no
     * such field
     */
    public Value get(String field) {
        if (kind != Kind.OBJECT)
            return null;
        return getFields().get(field);
    }

    /**
     * Returns a copy of this object value with the named field set.
     *
     * @param field the field name
     * @param value the new field value
     * @return the modified copy
     * @throws IllegalStateException if this value is not an object
     */
    public Value with(String field, Value value) {
        Map<String, Value> map = new LinkedHashMap<>(getFields());
        map.put(field, value == null ? NULL : value);
        return new Value(Kind.OBJECT, 0, Collections.unmodifiableMap(map));
    }

    /**
     * Converts this value to a key, if it is one of the key kinds.
     *
     * @return the key, or null if this value is not a valid key
     */
    public Key toKey() {
        switch (kind) {
            case NUMBER:
                return Double.isNaN(number) ? null : Key.of(number);
            case STRING:
                return Key.of((String) object);
            case DATE:
                return Key.of((Instant) object);
            case BINARY:
                return Key.of((byte[]) object);
            case ARRAY:
                List<Key> keys = new ArrayList<>();
                for (Value element : getElements()) {
                    Key key = element.toKey();
                    if (key == null)
                        return null;
                    keys.add(key);
                }
                return Key.of(keys);
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Value))
            return false;
        Value o = (Value) obj;
        if (kind != o.kind)
            return false;
        switch (kind) {
            case NULL:
                return true;
            case BOOLEAN:
            case NUMBER:
                return Double.compare(number, o.number) == 0;
            case BINARY:
                return Arrays.equals((byte[]) object, (byte[]) o.object);
            default:
                return object.equals(o.object);
        }
    }

    @Override
    public int hashCode() {
        switch (kind) {
            case NULL:
                return 0;
            case BOOLEAN:
            case NUMBER:
                return Double.hashCode(number);
            case BINARY:
                return Arrays.hashCode((byte[]) object);
            default:
                return object.hashCode();
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case NULL:
                return "null";
            case BOOLEAN:
                return Boolean.toString(number != 0);
            case NUMBER:
                return number == Math.rint(number) && !Double.isInfinite(number)
                        ? Long.toString((long) number) : Double.toString(number);
            case STRING:
                return "\"" + object + "\"";
            case BINARY:
                return Arrays.toString((byte[]) object);
            default:
                return object.toString();
        }
    }

    private void checkKind(Kind expected) {
        if (kind != expected)
            throw new IllegalStateException("Value is a " + kind + ", not a " + expected);
    }

    /**
     * Assembles an object value field by field.
     */
    public static final class Builder {
        private final Map<String, Value> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String field, Value value) {
            fields.put(field, value == null ? NULL : value);
            return this;
        }

        public Builder put(String field, String value) {
            return put(field, Value.of(value));
        }

        public Builder put(String field, double value) {
            return put(field, Value.of(value));
        }

        public Builder put(String field, boolean value) {
            return put(field, Value.of(value));
        }

        public Value build() {
            return object(fields);
        }
    }
}
