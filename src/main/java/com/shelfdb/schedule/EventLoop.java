/*
 * ShelfDB: Embedded Object Store for Java
 *
 * Copyright 2021 Ken Westlund
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

package com.shelfdb.schedule;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * EventLoop is a deterministic {@link Scheduler}. Scheduled tasks wait in a
 * FIFO queue until the owner of the loop turns it with {@link #runPending()}
 * or {@link #drain()}; nothing runs on a background thread.
 * <p>
 * A task scheduled while the loop is turning belongs to the next tick.
 */
public class EventLoop implements Scheduler {
    /**
     * Upper bound on the ticks run by one call to {@link #drain()}, which stops
     * a task that keeps rescheduling itself from spinning forever.
     */
    static final int MAX_TICKS = 10000;

    private final Deque<Task> queue = new ArrayDeque<>();

    @Override
    public synchronized ScheduledTask schedule(Runnable task) {
        Task t = new Task(task);
        queue.addLast(t);
        return t;
    }

    /**
     * Runs the tasks that were scheduled before this call, in the order they
     * were scheduled. Tasks scheduled by those tasks wait for the next tick.
     * If a task throws, the tasks after it stay queued and the exception
     * propagates to the caller.
     *
     * @return the number of tasks run
     */
    public int runPending() {
        Task[] tick;
        synchronized (this) {
            tick = queue.toArray(new Task[0]);
            queue.clear();
        }
        int count = 0;
        for (int i = 0; i < tick.length; i++) {
            try {
                if (tick[i].run())
                    ++count;
            } catch (RuntimeException e) {
                synchronized (this) {
                    for (int j = tick.length - 1; j > i; j--)
                        queue.addFirst(tick[j]);
                }
                throw e;
            }
        }
        return count;
    }

    /**
     * Turns the loop until no tasks remain.
     *
     * @return the number of tasks run
     * @throws IllegalStateException if tasks are still being scheduled after
     *                               {@link #MAX_TICKS} ticks
     */
    public int drain() {
        int count = 0;
        for (int tick = 0; tick < MAX_TICKS; tick++) {
            if (!hasPending())
                return count;
            count += runPending();
        }
        throw new IllegalStateException("Event loop did not become idle after " + MAX_TICKS + " ticks");
    }

    /**
     * Are there tasks waiting to run?
     */
    public synchronized boolean hasPending() {
        for (Task t : queue) {
            if (!t.isCancelled())
                return true;
        }
        return false;
    }

    private static final class Task implements ScheduledTask {
        private final Runnable runnable;
        private boolean cancelled;
        private boolean done;

        Task(Runnable runnable) {
            this.runnable = runnable;
        }

        boolean run() {
            synchronized (this) {
                if (cancelled || done)
                    return false;
                done = true;
            }
            runnable.run();
            return true;
        }

        @Override
        public synchronized void cancel() {
            if (!done)
                cancelled = true;
        }

        @Override
        public synchronized boolean isCancelled() {
            return cancelled;
        }

        @Override
        public synchronized boolean isDone() {
            return done;
        }
    }
}
