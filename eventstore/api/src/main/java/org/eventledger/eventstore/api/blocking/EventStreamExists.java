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

import org.eventledger.eventstore.api.StreamVersion;

public interface EventStreamExists {

    /**
     * @return The current version of the stream, or {@link StreamVersion#NO_STREAM} if the stream has no events
     */
    long streamVersion(String streamId);

    /**
     * @return {@code true} if the stream has at least one event, {@code false} otherwise
     */
    default boolean exists(String streamId) {
        return !StreamVersion.isNoStream(streamVersion(streamId));
    }
}
