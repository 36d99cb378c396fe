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

/**
 * Scheduler defers work to a later turn of a single-threaded, cooperative
 * event loop. Every task runs to completion before the next begins.
 */
public interface Scheduler {
    /**
     * Schedules a task to run on a later turn.
     *
     * @param task the task to be run
     * @return a handle that can cancel the task before it runs
     */
    ScheduledTask schedule(Runnable task);
}
