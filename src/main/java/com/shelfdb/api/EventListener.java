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

package com.shelfdb.api;

/**
 * Receives events dispatched to an {@link EventTarget}.
 * <p>
 * A listener may freely call back into the database, for example to continue
 * a cursor or abort a transaction; the dispatcher observes such changes as
 * soon as the listener returns. An exception thrown by a listener attached to
 * a request or its ancestors aborts the request's transaction.
 */
@FunctionalInterface
public interface EventListener {
    void handleEvent(Event event) throws DatabaseException;
}
