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

package org.eventledger.application.converter.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventledger.application.converter.EventConverter;
import org.eventledger.eventstore.api.Event;
import org.eventledger.eventstore.api.EventValidationException;
import org.eventledger.eventstore.api.PendingEvent;
import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventConverter} that uses a Jackson {@link ObjectMapper} to convert a domain event into the JSON object payload
 * of a {@link PendingEvent}, and back again. Each domain event class must be registered with the event type tag it is stored under,
 * which is what makes it possible to pick the right class when reading the event back.
 *
 * @param <T> The type of your domain event(s) to convert
 */
public class JacksonEventConverter<T> implements EventConverter<T> {
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Map<Class<? extends T>, String> eventTypeByClass;
    private final Map<String, Class<? extends T>> classByEventType;
    private final Function<T, Map<String, Object>> metadataMapper;
    private final Function<T, @Nullable String> tenantMapper;

    private JacksonEventConverter(ObjectMapper objectMapper, Map<Class<? extends T>, String> eventTypeByClass,
                                  Function<T, Map<String, Object>> metadataMapper, Function<T, @Nullable String> tenantMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(metadataMapper, "metadataMapper cannot be null");
        requireNonNull(tenantMapper, "tenantMapper cannot be null");
        if (eventTypeByClass.isEmpty()) {
            throw new IllegalArgumentException("At least one domain event class must be registered");
        }
        this.objectMapper = objectMapper;
        this.eventTypeByClass = Map.copyOf(eventTypeByClass);
        Map<String, Class<? extends T>> reverse = new HashMap<>();
        eventTypeByClass.forEach((type, eventType) -> {
            Class<? extends T> existing = reverse.putIfAbsent(eventType, type);
            if (existing != null) {
                throw new IllegalArgumentException("Event type " + eventType + " is registered for both " + existing.getName() + " and " + type.getName());
            }
        });
        this.classByEventType = Map.copyOf(reverse);
        this.metadataMapper = metadataMapper;
        this.tenantMapper = tenantMapper;
    }

    @Override
    public PendingEvent toPendingEvent(T domainEvent) {
        requireNonNull(domainEvent, "Domain event cannot be null");
        String eventType = eventTypeOf(domainEvent.getClass());
        final Map<String, Object> payload;
        try {
            payload = objectMapper.convertValue(domainEvent, PAYLOAD_TYPE);
        } catch (IllegalArgumentException e) {
            throw new EventValidationException("Domain event " + domainEvent.getClass().getName() + " cannot be converted into a JSON object", e);
        }
        if (payload == null) {
            throw new EventValidationException("Domain event " + domainEvent.getClass().getName() + " was converted into a JSON null");
        }
        return new PendingEvent(eventType, payload, metadataMapper.apply(domainEvent), tenantMapper.apply(domainEvent));
    }

    @Override
    public T toDomainEvent(Event event) {
        requireNonNull(event, "Event cannot be null");
        Class<? extends T> type = classByEventType.get(event.eventType());
        if (type == null) {
            throw new IllegalArgumentException("No domain event class is registered for event type " + event.eventType());
        }
        return objectMapper.convertValue(event.payload(), type);
    }

    @Override
    public String eventType(Class<? extends T> type) {
        return eventTypeOf(type);
    }

    private String eventTypeOf(Class<?> type) {
        String eventType = eventTypeByClass.get(type);
        if (eventType == null) {
            throw new EventValidationException("Domain event class " + type.getName() + " is not registered with an event type");
        }
        return eventType;
    }

    public static final class Builder<T> {
        private final ObjectMapper objectMapper;
        private final Map<Class<? extends T>, String> eventTypeByClass = new HashMap<>();
        private Function<T, Map<String, Object>> metadataMapper = __ -> Map.of();
        private Function<T, @Nullable String> tenantMapper = __ -> null;

        public Builder(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        /**
         * Register a domain event class and the event type tag it's stored under. Tags must be unique.
         */
        public Builder<T> register(String eventType, Class<? extends T> type) {
            requireNonNull(type, "Domain event class cannot be null");
            if (eventType == null || eventType.isBlank()) {
                throw new IllegalArgumentException("Event type of " + type.getName() + " cannot be blank");
            }
            eventTypeByClass.put(type, eventType);
            return this;
        }

        /**
         * @param metadataMapper A function that generates the metadata of the stored event from the domain event. By default, the metadata is empty.
         */
        public Builder<T> metadataMapper(Function<T, Map<String, Object>> metadataMapper) {
            this.metadataMapper = metadataMapper;
            return this;
        }

        /**
         * @param tenantMapper A function that extracts the tenant id from the domain event. By default, no tenant is set.
         */
        public Builder<T> tenantMapper(Function<T, @Nullable String> tenantMapper) {
            this.tenantMapper = tenantMapper;
            return this;
        }

        public JacksonEventConverter<T> build() {
            return new JacksonEventConverter<>(objectMapper, eventTypeByClass, metadataMapper, tenantMapper);
        }
    }
}
