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

package org.eventledger.eventstore.api.blocking;

import org.eventledger.eventstore.api.ConcurrencyConflictException;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.PendingEvent;
import org.eventledger.eventstore.api.WriteResult;

import java.time.Duration;
import java.util.List;

/**
 * Append events to an event stream. All events supplied to a single call are committed atomically, they receive
 * consecutive stream versions and increasing global positions, or none of them are written.
 */
public interface AppendToEventStream {

    /**
     * Append events to a stream if the stream is at the expected version.
     *
     * @param streamId        The id of the stream
     * @param expectedVersion The version the stream must be at, or {@link ExpectedVersion#any()} to skip the check
     * @param events          The events to append, an empty list is a no-op
     * @return A {@link WriteResult} with the assigned stream versions and global positions
     * @throws ConcurrencyConflictException if the stream isn't at the expected version
     */
    WriteResult append(String streamId, ExpectedVersion expectedVersion, List<PendingEvent> events);

    /**
     * Same as {@link #append(String, ExpectedVersion, List)} but the append must complete within {@code timeout}, otherwise the
     * transaction is rolled back and a {@link org.eventledger.eventstore.api.TransientStorageException} is thrown.
     */
    WriteResult append(String streamId, ExpectedVersion expectedVersion, List<PendingEvent> events, Duration timeout);

    /**
     * Append events without checking the stream version.
     */
    default WriteResult append(String streamId, List<PendingEvent> events) {
        return append(streamId, ExpectedVersion.any(), events);
    }

    /**
     * Append a single event.
     *
     * @return The global position of the appended event
     */
    default long appendEvent(String streamId, ExpectedVersion expectedVersion, PendingEvent event) {
        return append(streamId, expectedVersion, List.of(event)).getGlobalPositions().get(0);
    }
}
