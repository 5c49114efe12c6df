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

import java.time.OffsetDateTime;
import java.util.Map;

import static java.util.Objects.requireNonNull;
import static org.eventledger.eventstore.api.internal.Documents.immutableCopyOf;

/**
 * An event that has been committed to a stream. Committed events are never mutated or deleted.
 *
 * @param globalPosition A strictly increasing position that is unique across all streams
 * @param streamId       The id of the stream that the event belongs to
 * @param streamVersion  The zero-based, gapless position of the event within its stream
 * @param eventType      The event type tag, for example {@code TaskCreated}
 * @param payload        The event payload
 * @param metadata       The event metadata, empty if none was supplied
 * @param tenantId       The tenant (organization) scope of the event, if any
 * @param createdAt      The time the event was appended
 */
public record Event(long globalPosition, String streamId, long streamVersion, String eventType, Map<String, Object> payload,
                    Map<String, Object> metadata, @Nullable String tenantId, OffsetDateTime createdAt) {

    public Event {
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(eventType, "Event type cannot be null");
        requireNonNull(createdAt, "createdAt cannot be null");
        payload = immutableCopyOf(requireNonNull(payload, "Payload cannot be null"), "the payload of event " + eventType);
        metadata = metadata == null ? Map.of() : immutableCopyOf(metadata, "the metadata of event " + eventType);
    }
}
