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

package org.eventledger.application.service.blocking;

import org.eventledger.eventstore.api.WriteResult;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * An application service reads all events of a stream, hands them to a function in the domain model that
 * decides which new events to emit, and appends the new events using the version that was read as the expected version.
 *
 * @param <T> The type of your domain events
 */
public interface ApplicationService<T> {

    /**
     * Execute a decision against the events of a stream and append the result.
     *
     * @param streamId   The id of the stream to load events from and append new events to
     * @param decision   A pure function from the domain model that returns the new events given the current ones
     * @param sideEffect An optional side effect that is invoked with the new events after they have been appended
     * @return The result of the append
     */
    WriteResult execute(String streamId, Function<List<T>, List<T>> decision, @Nullable Consumer<List<T>> sideEffect);

    default WriteResult execute(UUID streamId, Function<List<T>, List<T>> decision, @Nullable Consumer<List<T>> sideEffect) {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        return execute(streamId.toString(), decision, sideEffect);
    }

    default WriteResult execute(String streamId, Function<List<T>, List<T>> decision) {
        return execute(streamId, decision, null);
    }

    default WriteResult execute(UUID streamId, Function<List<T>, List<T>> decision) {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        return execute(streamId.toString(), decision);
    }
}
