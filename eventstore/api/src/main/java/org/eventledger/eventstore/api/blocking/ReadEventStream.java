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

/**
 * Read the events of a single stream, ordered by stream version. Reading a stream that doesn't exist returns an empty {@link EventStream}.
 */
public interface ReadEventStream {

    default EventStream read(String streamId) {
        return read(streamId, 0);
    }

    default EventStream read(String streamId, long fromVersion) {
        return read(streamId, fromVersion, Long.MAX_VALUE, Integer.MAX_VALUE);
    }

    /**
     * @param streamId    The id of the stream
     * @param fromVersion The first version to include
     * @param toVersion   The last version to include, {@code Long.MAX_VALUE} for no upper bound
     * @param limit       The max number of events to return, {@code Integer.MAX_VALUE} for no limit
     * @return An {@link EventStream} with the events in the range
     */
    EventStream read(String streamId, long fromVersion, long toVersion, int limit);
}
