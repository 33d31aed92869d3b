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

/**
 * <code>KeyRange</code> selects a continuous interval of keys. Either bound may
 * be absent, meaning the interval is unbounded on that side, and each present
 * bound may be open (exclusive) or closed (inclusive).
 * <p>
 * A range for a single key is created with {@link #only}.
 *
 * @see Key
 */
public final class KeyRange {

    private final Key lower;
    private final Key upper;
    private final boolean lowerOpen;
    private final boolean upperOpen;

    private KeyRange(Key lower, Key upper, boolean lowerOpen, boolean upperOpen) {
        this.lower = lower;
        this.upper = upper;
        this.lowerOpen = lowerOpen;
        this.upperOpen = upperOpen;
    }

    /**
     * Creates a range containing exactly one key.
     *
     * @param key the key
     * @return the range
     */
    public static KeyRange only(Key key) {
        checkKey(key);
        return new KeyRange(key, key, false, false);
    }

    public static KeyRange lowerBound(Key lower) {
        return lowerBound(lower, false);
    }

    public static KeyRange lowerBound(Key lower, boolean open) {
        checkKey(lower);
        return new KeyRange(lower, null, open, true);
    }

    public static KeyRange upperBound(Key upper) {
        return upperBound(upper, false);
    }

    public static KeyRange upperBound(Key upper, boolean open) {
        checkKey(upper);
        return new KeyRange(null, upper, true, open);
    }

    public static KeyRange bound(Key lower, Key upper) throws DataException {
        return bound(lower, upper, false, false);
    }

    /**
     * Creates a range with both bounds.
     *
     * @param lower     the lower bound
     * @param upper     the upper bound
     * @param lowerOpen true to exclude the lower bound
     * @param upperOpen true to exclude the upper bound
     * @return the range
     * @throws DataException if the lower bound is above the upper bound, or
     *                       they are equal and either bound is open
     */
    public static KeyRange bound(Key lower, Key upper, boolean lowerOpen, boolean upperOpen)
            throws DataException {
        checkKey(lower);
        checkKey(upper);
        int diff = lower.compareTo(upper);
        if (diff > 0 || (diff == 0 && (lowerOpen || upperOpen)))
            throw new DataException("The lower bound " + lower + " is not below the upper bound " + upper);
        return new KeyRange(lower, upper, lowerOpen, upperOpen);
    }

    public Key getLower() {
        return lower;
    }

    public Key getUpper() {
        return upper;
    }

    public boolean isLowerOpen() {
        return lowerOpen;
    }

    public boolean isUpperOpen() {
        return upperOpen;
    }

    /**
     * Tests whether the key falls within this range.
     *
     * @param key the key to test
     * @return true if the key is within the bounds of this range
     */
    public boolean includes(Key key) {
        if (lower != null) {
            int diff = key.compareTo(lower);
            if (diff < 0 || (diff == 0 && lowerOpen))
                return false;
        }
        if (upper != null) {
            int diff = key.compareTo(upper);
            return diff < 0 || (diff == 0 && !upperOpen);
        }
        return true;
    }

    @Override
    public String toString() {
        return (lower == null ? "(-inf" : (lowerOpen ? "(" : "[") + lower) + ", "
                + (upper == null ? "+inf)" : upper + (upperOpen ? ")" : "]"));
    }

    private static void checkKey(Key key) {
        if (key == null)
            throw new IllegalArgumentException("A key range bound must not be null");
    }
}
