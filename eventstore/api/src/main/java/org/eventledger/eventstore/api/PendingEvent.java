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

package org.eventledger.eventstore.api;

import org.jspecify.annotations.Nullable;

import java.util.Map;

import static org.eventledger.eventstore.api.internal.Documents.immutableCopyOf;

/**
 * An event that is about to be appended to a stream. It has no global position or stream version until it's committed.
 *
 * @param eventType The event type tag, for example {@code TaskCreated}
 * @param payload   The event payload
 * @param metadata  The event metadata, an empty map if {@code null}
 * @param tenantId  The tenant (organization) scope of the event, must be a UUID if defined
 */
public record PendingEvent(String eventType, Map<String, Object> payload, Map<String, Object> metadata, @Nullable String tenantId) {

    public PendingEvent {
        if (eventType == null || eventType.isBlank()) {
            throw new EventValidationException("Event type cannot be null or blank");
        } else if (payload == null) {
            throw new EventValidationException("Payload of event " + eventType + " cannot be null");
        }
        payload = immutableCopyOf(payload, "the payload of event " + eventType);
        metadata = metadata == null ? Map.of() : immutableCopyOf(metadata, "the metadata of event " + eventType);
    }

    public static PendingEvent of(String eventType, Map<String, Object> payload) {
        return new PendingEvent(eventType, payload, Map.of(), null);
    }

    public static PendingEvent of(String eventType, Map<String, Object> payload, Map<String, Object> metadata) {
        return new PendingEvent(eventType, payload, metadata, null);
    }

    public PendingEvent withMetadata(Map<String, Object> metadata) {
        return new PendingEvent(eventType, payload, metadata, tenantId);
    }

    public PendingEvent withTenantId(@Nullable String tenantId) {
        return new PendingEvent(eventType, payload, metadata, tenantId);
    }
}
