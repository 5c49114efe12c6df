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

import org.eventledger.eventstore.api.Event;

import java.util.Set;
import java.util.stream.Stream;

/**
 * Read events across all streams ordered by global position. The returned {@link Stream} is lazy, it fetches
 * {@code batchSize} events per round-trip and ends when no more events are available. Resume by passing the
 * global position of the last event you received as {@code afterGlobalPosition}.
 */
public interface ReadAllEvents {
    int DEFAULT_BATCH_SIZE = 100;

    default Stream<Event> readAll() {
        return readAll(0, DEFAULT_BATCH_SIZE);
    }

    default Stream<Event> readAll(long afterGlobalPosition, int batchSize) {
        return readAll(Set.of(), afterGlobalPosition, batchSize);
    }

    /**
     * @param eventTypes          Only include events of these types, an empty set includes all events
     * @param afterGlobalPosition Only include events with a global position greater than this, {@code 0} to start from the beginning
     * @param batchSize           The number of events to fetch per round-trip
     * @return A lazy stream of events, close it if it's not consumed to the end
     */
    Stream<Event> readAll(Set<String> eventTypes, long afterGlobalPosition, int batchSize);
}
