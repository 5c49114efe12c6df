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

package org.eventledger.application.service.blocking.generic;

import org.eventledger.application.converter.EventConverter;
import org.eventledger.application.service.blocking.ApplicationService;
import org.eventledger.eventstore.api.ConcurrencyConflictException;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.PendingEvent;
import org.eventledger.eventstore.api.WriteResult;
import org.eventledger.eventstore.api.blocking.EventStore;
import org.eventledger.eventstore.api.blocking.EventStream;
import org.eventledger.retry.RetryStrategy;
import org.eventledger.retry.RetryStrategy.Retry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * An {@link ApplicationService} that reads the stream from an {@link EventStore}, converts the events with an {@link EventConverter}
 * and appends the new events with the version that was read as expected version. If another writer appended to the
 * stream in the meantime a {@link ConcurrencyConflictException} is thrown by the event store, and the whole
 * read-decide-append cycle is retried according to the {@link RetryStrategy}.
 *
 * @param <T> The type of your domain events
 */
public class GenericApplicationService<T> implements ApplicationService<T> {
    private static final Logger log = LoggerFactory.getLogger(GenericApplicationService.class);

    private final EventStore eventStore;
    private final EventConverter<T> eventConverter;
    private final RetryStrategy retryStrategy;

    public GenericApplicationService(EventStore eventStore, EventConverter<T> eventConverter) {
        this(eventStore, eventConverter, defaultRetryStrategy());
    }

    public GenericApplicationService(EventStore eventStore, EventConverter<T> eventConverter, RetryStrategy retryStrategy) {
        if (eventStore == null) throw new IllegalArgumentException(EventStore.class.getSimpleName() + " cannot be null");
        if (eventConverter == null) throw new IllegalArgumentException(EventConverter.class.getSimpleName() + " cannot be null");
        if (retryStrategy == null) throw new IllegalArgumentException(RetryStrategy.class.getSimpleName() + " cannot be null");
        this.eventStore = eventStore;
        this.eventConverter = eventConverter;
        this.retryStrategy = retryStrategy;
    }

    @Override
    public WriteResult execute(String streamId, Function<List<T>, List<T>> decision, @Nullable Consumer<List<T>> sideEffect) {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        Objects.requireNonNull(decision, "Function that calls domain model cannot be null");

        Decided<T> decided = retryStrategy.execute(() -> {
            EventStream eventStream = eventStore.read(streamId);
            List<T> eventsInStream = eventConverter.toDomainEvents(eventStream.events());

            List<T> newDomainEvents = emptyListIfNull(decision.apply(eventsInStream));
            if (newDomainEvents.isEmpty()) {
                return new Decided<>(WriteResult.nothingWritten(streamId, eventStream.version()), newDomainEvents);
            }

            List<PendingEvent> newEvents = eventConverter.toPendingEvents(newDomainEvents);
            WriteResult writeResult = eventStore.append(streamId, ExpectedVersion.of(eventStream.version()), newEvents);
            return new Decided<>(writeResult, newDomainEvents);
        });

        if (sideEffect != null && !decided.newEvents.isEmpty()) {
            sideEffect.accept(decided.newEvents);
        }
        return decided.writeResult;
    }

    private static <T> List<T> emptyListIfNull(@Nullable List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    public static Retry defaultRetryStrategy() {
        return RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0)
                .maxAttempts(5)
                .retryIf(ConcurrencyConflictException.class::isInstance)
                .onRetryableError((info, throwable) -> log.debug("Retrying after {} (attempt {})", throwable.getMessage(), info.attemptNumber()));
    }

    private static final class Decided<T> {
        private final WriteResult writeResult;
        private final List<T> newEvents;

        Decided(WriteResult writeResult, List<T> newEvents) {
            this.writeResult = writeResult;
            this.newEvents = newEvents;
        }
    }
}
