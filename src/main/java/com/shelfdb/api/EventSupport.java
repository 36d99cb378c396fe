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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * EventSupport keeps the listener table of one {@link EventTarget} and
 * delivers events to it, much as <code>java.beans.PropertyChangeSupport</code>
 * does for bean properties. Each support may name the support of a parent
 * target, through which bubbling events continue.
 * <p>
 * Delivery is synchronous: {@link #dispatch} returns only after every
 * listener on the propagation path has run.
 */
public final class EventSupport {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventSupport.class);

    private final EventTarget source;
    private final EventSupport parent;
    private final Map<String, List<EventListener>> listeners = new HashMap<>();

    /**
     * Creates the support for a target.
     *
     * @param source the target whose listeners are kept here
     * @param parent the support of the parent target, or null if the target
     *               has no parent
     */
    public EventSupport(EventTarget source, EventSupport parent) {
        this.source = source;
        this.parent = parent;
    }

    public synchronized void addEventListener(String type, EventListener listener) {
        List<EventListener> list = listeners.computeIfAbsent(type, k -> new ArrayList<>());
        if (!list.contains(listener))
            list.add(listener);
    }

    public synchronized void removeEventListener(String type, EventListener listener) {
        List<EventListener> list = listeners.get(type);
        if (list != null)
            list.remove(listener);
    }

    /**
     * Would an event of this type reach any listener?
     *
     * @param type    the event type
     * @param bubbles true to include the listeners of ancestor targets
     * @return true if at least one listener is registered on the path
     */
    public boolean hasListeners(String type, boolean bubbles) {
        for (EventSupport s = this; s != null; s = bubbles ? s.parent : null) {
            synchronized (s) {
                List<EventListener> list = s.listeners.get(type);
                if (list != null && !list.isEmpty())
                    return true;
            }
        }
        return false;
    }

    /**
     * Delivers an event to the listeners of this target and, if the event
     * bubbles, to the listeners of each ancestor until propagation is stopped.
     * A listener that throws does not prevent the remaining listeners from
     * being notified.
     *
     * @param event the event to be delivered
     * @return the first exception thrown by a listener, or null if every
     * listener returned normally
     */
    public Exception dispatch(Event event) {
        Exception failure = null;
        event.setTarget(source);
        for (EventSupport s = this; s != null; s = event.doesBubble() ? s.parent : null) {
            List<EventListener> snapshot;
            synchronized (s) {
                List<EventListener> list = s.listeners.get(event.getType());
                if (list == null || list.isEmpty())
                    continue;
                snapshot = new ArrayList<>(list);
            }
            event.setCurrentTarget(s.source);
            for (EventListener listener : snapshot) {
                try {
                    listener.handleEvent(event);
                } catch (Exception e) {
                    LOGGER.warn("event listener failed type={} target={}", event.getType(), s.source, e);
                    if (failure == null)
                        failure = e;
                }
            }
            if (event.isPropagationStopped())
                break;
        }
        event.setCurrentTarget(null);
        return failure;
    }
}
