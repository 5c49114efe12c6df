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

package org.eventledger.subscription.inmemory;

import org.eventledger.eventstore.api.Event;
import org.eventledger.subscription.api.EventHandler;
import org.eventledger.subscription.api.EventPublisher;
import org.eventledger.subscription.api.EventSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * An in-memory {@link EventPublisher} that invokes the matching handlers synchronously in the publishing thread.
 * <p>
 * It's also a {@code Consumer<List<Event>>} so that it can be registered directly as the after commit listener of
 * an event store, for example:
 * <pre>
 * InMemoryEventPublisher publisher = new InMemoryEventPublisher();
 * EventStore eventStore = new InMemoryEventStore(publisher);
 * </pre>
 * </p>
 */
public class InMemoryEventPublisher implements EventPublisher, Consumer<List<Event>> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventPublisher.class);

    // @formatter:off
    private static final BiConsumer<Event, Throwable> NOOP_HANDLER_ERROR_LISTENER = (__, ___) -> {};
    // @formatter:on

    private final ConcurrentMap<String, CopyOnWriteArrayList<Registration>> handlers = new ConcurrentHashMap<>();
    private final BiConsumer<Event, Throwable> handlerErrorListener;

    public InMemoryEventPublisher() {
        this(NOOP_HANDLER_ERROR_LISTENER);
    }

    /**
     * @param handlerErrorListener Invoked with the event and the error when a handler fails, after the error has been logged
     */
    public InMemoryEventPublisher(BiConsumer<Event, Throwable> handlerErrorListener) {
        this.handlerErrorListener = Objects.requireNonNull(handlerErrorListener, "handlerErrorListener cannot be null");
    }

    @Override
    public EventSubscription subscribe(String eventTypeOrWildcard, EventHandler handler) {
        if (eventTypeOrWildcard == null || eventTypeOrWildcard.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be null or blank");
        }
        Objects.requireNonNull(handler, EventHandler.class.getSimpleName() + " cannot be null");
        Registration registration = new Registration(eventTypeOrWildcard, handler);
        handlers.computeIfAbsent(eventTypeOrWildcard, __ -> new CopyOnWriteArrayList<>()).add(registration);
        log.debug("Registered handler for {}", eventTypeOrWildcard);
        return registration;
    }

    @Override
    public void publish(Event event) {
        Objects.requireNonNull(event, Event.class.getSimpleName() + " cannot be null");
        if (!WILDCARD.equals(event.eventType())) {
            dispatch(event, handlers.get(event.eventType()));
        }
        dispatch(event, handlers.get(WILDCARD));
    }

    @Override
    public void accept(List<Event> events) {
        publish(events);
    }

    private void dispatch(Event event, List<Registration> registrations) {
        if (registrations == null) {
            return;
        }
        for (Registration registration : registrations) {
            if (registration.isActive()) {
                invoke(registration, event);
            }
        }
    }

    private void invoke(Registration registration, Event event) {
        try {
            registration.handler.handle(event);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.error("Handler for {} failed to handle event {} at global position {} in stream {}", registration.eventType, event.eventType(), event.globalPosition(), event.streamId(), e);
            reportHandlerError(event, e);
        }
    }

    private void reportHandlerError(Event event, Throwable error) {
        try {
            handlerErrorListener.accept(event, error);
        } catch (RuntimeException e) {
            log.warn("Handler error listener failed", e);
        }
    }

    private final class Registration implements EventSubscription {
        private final String eventType;
        private final EventHandler handler;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(String eventType, EventHandler handler) {
            this.eventType = eventType;
            this.handler = handler;
        }

        @Override
        public String eventType() {
            return eventType;
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                List<Registration> registrations = handlers.get(eventType);
                if (registrations != null) {
                    registrations.remove(this);
                }
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
