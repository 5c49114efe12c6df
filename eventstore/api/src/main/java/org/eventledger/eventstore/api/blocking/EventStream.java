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
import org.eventledger.eventstore.api.StreamVersion;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Represents (a range of) an event stream, read from a consistent snapshot.
 */
public interface EventStream extends Iterable<Event> {

    /**
     * @return The id of the event stream
     */
    String id();

    /**
     * The current version of the whole event stream when it was read, which may be greater than the version of the last event
     * in {@link #events()} when a range was requested. It is equal to {@link StreamVersion#NO_STREAM} if the stream has no events.
     *
     * @return The current version of the event stream
     */
    long version();

    /**
     * @return The events in the requested range, ordered by stream version.
     */
    List<Event> events();

    default Stream<Event> stream() {
        return events().stream();
    }

    @Override
    default Iterator<Event> iterator() {
        return events().iterator();
    }

    /**
     * @return {@code true} if the stream has no events at all, {@code false} otherwise.
     */
    default boolean isEmpty() {
        return StreamVersion.isNoStream(version());
    }
}
