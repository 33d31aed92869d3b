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

package com.memidb.core;

import com.memidb.api.ConstraintException;
import com.memidb.api.Key;

/**
 * KeyGenerator hands out the primary keys of an auto-increment store:
 * consecutive integers starting at 1. Numeric keys supplied explicitly move
 * the generator past them, so generated keys never collide with them.
 * <p>
 * Keys handed out are never taken back, not even when the transaction that
 * drew them aborts.
 */
public class KeyGenerator {

    // Largest integer a double represents exactly
    static final double MAX_KEY = 9007199254740992d;

    private double nextval = 1;
    private boolean exhausted;

    /**
     * Draws the next key.
     *
     * @return the key
     * @throws ConstraintException if the generator is exhausted
     */
    public Key next() throws ConstraintException {
        if (exhausted)
            throw new ConstraintException("Key generator exhausted");
        Key key = Key.of(nextval);
        if (nextval >= MAX_KEY)
            exhausted = true;
        else
            nextval++;
        return key;
    }

    /**
     * Moves the generator past a key supplied by the caller.
     *
     * @param key an explicit or in-line primary key
     */
    public void observe(Key key) {
        if (key.getType() != Key.Type.NUMBER)
            return;
        double value = key.asNumber();
        if (exhausted || value < nextval)
            return;
        if (value >= MAX_KEY)
            exhausted = true;
        else
            nextval = Math.floor(value) + 1;
    }

    public double getNextval() {
        return nextval;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public void reset() {
        nextval = 1;
        exhausted = false;
    }
}
