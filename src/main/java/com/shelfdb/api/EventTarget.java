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
 * An object that dispatches {@link Event}s to registered listeners.
 */
public interface EventTarget {
    /**
     * Registers a listener for events of the given type. Registering the same
     * listener twice for one type has no further effect.
     *
     * @param type     the event type, such as {@link Event#SUCCESS}
     * @param listener the listener to be notified
     */
    void addEventListener(String type, EventListener listener);

    /**
     * Unregisters a listener previously registered for the given type.
     *
     * @param type     the event type
     * @param listener the listener to be removed
     */
    void removeEventListener(String type, EventListener listener);
}
