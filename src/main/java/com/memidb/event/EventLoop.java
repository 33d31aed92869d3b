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

import java.util.ArrayDeque;

/**
 * <code>EventLoop</code> is the single-threaded cooperative scheduler that
 * delivers request notifications and transaction completions. Each posted
 * task runs in a turn of its own, in the order tasks were posted.
 * <p>
 * Nothing runs unless the owner of the loop drives it with {@link #runOnce}
 * or {@link #runUntilIdle}; code that issues requests therefore always
 * returns before any of their notifications fire.
 */
public class EventLoop {

    // Default upper bound on the turns of a single drain
    public static final int DEFAULT_MAX_TURNS = 1_000_000;

    private final ArrayDeque<Runnable> tasks = new ArrayDeque<>();
    private int maxTurns = DEFAULT_MAX_TURNS;
    private boolean running;

    public int getMaxTurns() {
        return maxTurns;
    }

    /**
     * Sets the number of turns after which {@link #runUntilIdle} gives up on
     * a loop that keeps posting work.
     *
     * @param maxTurns the limit, which must be positive
     */
    public void setMaxTurns(int maxTurns) {
        if (maxTurns <= 0)
            throw new IllegalArgumentException("maxTurns must be positive: " + maxTurns);
        this.maxTurns = maxTurns;
    }

    /**
     * Schedules a task to run in a later turn.
     *
     * @param task the task
     */
    public void post(Runnable task) {
        if (task == null)
            throw new IllegalArgumentException("task must not be null");
        tasks.addLast(task);
    }

    /**
     * Runs the oldest pending task, if any.
     *
     * @return true if a task was run
     * @throws IllegalStateException if called from within a running task
     */
    public boolean runOnce() {
        enter();
        try {
            return turn();
        } finally {
            running = false;
        }
    }

    /**
     * Runs tasks, including the ones they post, until none remain.
     *
     * @return the number of tasks run
     * @throws IllegalStateException if called from within a running task, or
     *                               if the loop does not become idle
     */
    public int runUntilIdle() {
        enter();
        try {
            int turns = 0;
            while (turn()) {
                if (++turns >= maxTurns && !tasks.isEmpty())
                    throw new IllegalStateException("Event loop still busy after " + turns + " turns");
            }
            return turns;
        } finally {
            running = false;
        }
    }

    public boolean isIdle() {
        return tasks.isEmpty();
    }

    public int getPendingTasks() {
        return tasks.size();
    }

    private void enter() {
        if (running)
            throw new IllegalStateException("The event loop cannot be run from within one of its own tasks");
        running = true;
    }

    private boolean turn() {
        Runnable task = tasks.pollFirst();
        if (task == null)
            return false;
        task.run();
        return true;
    }
}
