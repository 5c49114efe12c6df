/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventledger.subscription.api;

import org.eventledger.eventstore.api.Event;

import java.util.List;

/**
 * Best-effort, in-process delivery of committed events to handlers. Events are only published after the append
 * that wrote them has committed, and a failing handler never affects the append or other handlers.
 * <p>
 * Delivery is not durable. Consumers that must see every event should read the global feed from their own
 * position instead, see {@code ReadAllEvents} and {@link SubscriptionPositionStorage}.
 * </p>
 */
public interface EventPublisher {
    String WILDCARD = "*";

    /**
     * Register a handler for an event type. When an event is published, the handlers registered for its type are invoked
     * first, then the handlers registered for {@link #WILDCARD}, each group in registration order.
     *
     * @param eventTypeOrWildcard The event type to handle, or {@link #WILDCARD} to handle all events
     * @param handler             The handler
     * @return An {@link EventSubscription} that can be used to cancel the registration
     */
    EventSubscription subscribe(String eventTypeOrWildcard, EventHandler handler);

    default EventSubscription subscribeAll(EventHandler handler) {
        return subscribe(WILDCARD, handler);
    }

    void publish(Event event);

    default void publish(List<Event> events) {
        events.forEach(this::publish);
    }
}
