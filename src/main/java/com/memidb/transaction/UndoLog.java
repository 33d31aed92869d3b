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

import java.util.ArrayDeque;

/**
 * UndoLog records the changes made by a transaction so that they can be
 * reverted if it aborts. Actions are undone in the reverse of the order in
 * which they were logged.
 */
public class UndoLog {
    private final ArrayDeque<UndoAction> actions = new ArrayDeque<>();

    public void add(UndoAction action) {
        actions.push(action);
    }

    /**
     * Reverts every logged change, most recent first, leaving the log empty.
     */
    public void undo() {
        while (!actions.isEmpty())
            actions.pop().undo();
    }

    public void clear() {
        actions.clear();
    }

    public int size() {
        return actions.size();
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }
}
