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
 * Event is a named notification delivered synchronously to the listeners of
 * an {@link EventTarget}. A bubbling event is delivered first to its target
 * and then to each ancestor of the target in turn: from a {@link Request} to
 * its {@link Transaction}, then to the transaction's {@link Database}.
 *
 * @see EventTarget
 * @see VersionChangeEvent
 */
public class Event {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String BLOCKED = "blocked";
    public static final String UPGRADE_NEEDED = "upgradeneeded";
    public static final String COMPLETE = "complete";
    public static final String ABORT = "abort";
    public static final String VERSION_CHANGE = "versionchange";
    public static final String CLOSE = "close";

    private final String type;
    private final boolean bubbles;
    private final boolean cancelable;
    private EventTarget target;
    private EventTarget currentTarget;
    private boolean defaultPrevented;
    private boolean propagationStopped;

    public Event(String type, boolean bubbles, boolean cancelable) {
        this.type = type;
        this.bubbles = bubbles;
        this.cancelable = cancelable;
    }

    public String getType() {
        return type;
    }

    /**
     * Does this event propagate from its target to the target's ancestors?
     */
    public boolean doesBubble() {
        return bubbles;
    }

    public boolean isCancelable() {
        return cancelable;
    }

    /**
     * Gets the target the event was dispatched to.
     *
     * @return the target, or null before dispatch
     */
    public EventTarget getTarget() {
        return target;
    }

    /**
     * Gets the target whose listeners are currently being notified.
     *
     * @return the current target, or null outside of dispatch
     */
    public EventTarget getCurrentTarget() {
        return currentTarget;
    }

    /**
     * Cancels the default action of a cancelable event. For a request's
     * <code>error</code> event, the default action is aborting the transaction.
     */
    public void preventDefault() {
        if (cancelable)
            defaultPrevented = true;
    }

    public boolean isDefaultPrevented() {
        return defaultPrevented;
    }

    /**
     * Stops the event from reaching further ancestors once the listeners of
     * the current target have been notified.
     */
    public void stopPropagation() {
        propagationStopped = true;
    }

    boolean isPropagationStopped() {
        return propagationStopped;
    }

    void setTarget(EventTarget target) {
        this.target = target;
    }

    void setCurrentTarget(EventTarget currentTarget) {
        this.currentTarget = currentTarget;
    }

    @Override
    public String toString() {
        return "Event(" + type + ")";
    }
}
