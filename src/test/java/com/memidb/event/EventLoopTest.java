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

package com.memidb.event;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EventLoopTest {

    @Test
    public void testOrdering() {
        EventLoop loop = new EventLoop();
        List<String> trace = new ArrayList<>();

        loop.post(() -> {
            trace.add("a");
            loop.post(() -> trace.add("c"));
        });
        loop.post(() -> trace.add("b"));
        assertTrue(trace.isEmpty());
        assertEquals(2, loop.getPendingTasks());

        assertTrue(loop.runOnce());
        assertEquals(Arrays.asList("a"), trace);
        assertEquals(2, loop.getPendingTasks());

        assertEquals(2, loop.runUntilIdle());
        assertEquals(Arrays.asList("a", "b", "c"), trace);
        assertTrue(loop.isIdle());
        assertTrue(!loop.runOnce());
        assertEquals(0, loop.runUntilIdle());
    }

    @Test
    public void testReentry() {
        EventLoop loop = new EventLoop();
        List<RuntimeException> errors = new ArrayList<>();
        loop.post(() -> {
            try {
                loop.runUntilIdle();
            } catch (IllegalStateException e) {
                errors.add(e);
            }
        });
        loop.runUntilIdle();
        assertEquals(1, errors.size());

        // a failing task leaves the loop usable
        loop.post(() -> {
            throw new IllegalArgumentException("boom");
        });
        loop.post(() -> errors.add(null));
        try {
            loop.runUntilIdle();
            fail("task failure was not propagated");
        } catch (IllegalArgumentException e) {
            assertEquals("boom", e.getMessage());
        }
        assertEquals(1, loop.runUntilIdle());
        assertEquals(2, errors.size());
    }

    @Test
    public void testRunaway() {
        EventLoop loop = new EventLoop();
        loop.post(new Runnable() {
            @Override
            public void run() {
                loop.post(this);
            }
        });
        try {
            loop.runUntilIdle();
            fail("runaway loop was not stopped");
        } catch (IllegalStateException e) {
            assertEquals(1, loop.getPendingTasks());
        }
    }

    @Test
    public void testTurnLimit() {
        EventLoop loop = new EventLoop();
        assertEquals(EventLoop.DEFAULT_MAX_TURNS, loop.getMaxTurns());
        loop.setMaxTurns(10);

        List<Integer> runs = new ArrayList<>();
        for (int i = 0; i < 9; i++)
            loop.post(() -> runs.add(runs.size()));
        assertEquals(9, loop.runUntilIdle());

        loop.post(new Runnable() {
            @Override
            public void run() {
                runs.add(runs.size());
                loop.post(this);
            }
        });
        try {
            loop.runUntilIdle();
            fail("turn limit was not enforced");
        } catch (IllegalStateException e) {
            assertEquals(19, runs.size());
            assertEquals(1, loop.getPendingTasks());
        }

        try {
            loop.setMaxTurns(0);
            fail("non-positive limit accepted");
        } catch (IllegalArgumentException e) {
            // expected
        }
        assertEquals(10, loop.getMaxTurns());
    }
}
