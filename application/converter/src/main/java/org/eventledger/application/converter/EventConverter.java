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

package org.eventledger.application.converter;

import org.eventledger.eventstore.api.Event;
import org.eventledger.eventstore.api.PendingEvent;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An event converter interface that is used by the application services
 * to convert to and from domain events.
 *
 * @param <T> The type of your domain event
 */
public interface EventConverter<T> {

    /**
     * Convert a domain event into an event that can be appended to a stream.
     *
     * @param domainEvent The domain event to convert
     * @return The {@link PendingEvent} instance, converted from the domain event.
     */
    PendingEvent toPendingEvent(T domainEvent);

    /**
     * Convert a stored event to a domain event
     *
     * @param event The stored event to convert
     * @return The domain event instance, converted from the stored event.
     */
    T toDomainEvent(Event event);

    /**
     * Get the event type tag that is used when storing events of the given class.
     *
     * @param type The domain event class
     * @return The event type tag
     */
    String eventType(Class<? extends T> type);

    /**
     * Convert a list of domain events into pending events. Override this to add things such as a correlation id
     * that should be the same for all events appended together.
     */
    default List<PendingEvent> toPendingEvents(List<T> domainEvents) {
        if (domainEvents == null) {
            return List.of();
        }
        return domainEvents.stream().map(this::toPendingEvent).collect(Collectors.toList());
    }

    default List<T> toDomainEvents(List<Event> events) {
        if (events == null) {
            return List.of();
        }
        return events.stream().map(this::toDomainEvent).collect(Collectors.toList());
    }
}
