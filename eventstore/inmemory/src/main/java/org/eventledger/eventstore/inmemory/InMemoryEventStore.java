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

package org.eventledger.eventstore.inmemory;

import org.eventledger.eventstore.api.ConcurrencyConflictException;
import org.eventledger.eventstore.api.Event;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.FatalStorageException;
import org.eventledger.eventstore.api.PendingEvent;
import org.eventledger.eventstore.api.WriteResult;
import org.eventledger.eventstore.api.blocking.EventStore;
import org.eventledger.eventstore.api.blocking.EventStream;
import org.eventledger.eventstore.api.internal.EventStreamImpl;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.eventledger.eventstore.api.StreamVersion.NO_STREAM;
import static org.eventledger.eventstore.api.internal.EventValidator.validateEvents;
import static org.eventledger.eventstore.api.internal.EventValidator.validateFeedPosition;
import static org.eventledger.eventstore.api.internal.EventValidator.validateReadRange;
import static org.eventledger.eventstore.api.internal.EventValidator.validateStreamId;

/**
 * An in-memory implementation of {@link EventStore}. Appends are serialized so global positions are handed out in
 * commit order. Useful for tests and prototypes, nothing is persisted.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<Event>> streams = new HashMap<>();
    private final List<Event> globalLog = new ArrayList<>();
    private final Clock clock;
    private final Consumer<List<Event>> afterCommitListener;

    public InMemoryEventStore() {
        this(__ -> {
        });
    }

    /**
     * @param afterCommitListener Invoked with the committed events after each successful non-empty append
     */
    public InMemoryEventStore(Consumer<List<Event>> afterCommitListener) {
        this(Clock.systemUTC(), afterCommitListener);
    }

    public InMemoryEventStore(Clock clock, Consumer<List<Event>> afterCommitListener) {
        this.clock = Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.afterCommitListener = Objects.requireNonNull(afterCommitListener, "afterCommitListener cannot be null");
    }

    @Override
    public WriteResult append(String streamId, ExpectedVersion expectedVersion, List<PendingEvent> events) {
        validateStreamId(streamId);
        Objects.requireNonNull(expectedVersion, ExpectedVersion.class.getSimpleName() + " cannot be null");
        validateEvents(events);
        if (events.isEmpty()) {
            return WriteResult.nothingWritten(streamId, streamVersion(streamId));
        }

        final WriteResult writeResult;
        final List<Event> committed;
        lock.writeLock().lock();
        try {
            List<Event> stream = streams.getOrDefault(streamId, Collections.emptyList());
            long currentVersion = stream.size() - 1L;
            if (!expectedVersion.isSatisfiedBy(currentVersion)) {
                throw new ConcurrencyConflictException(streamId, expectedVersion, currentVersion);
            }

            OffsetDateTime createdAt = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
            committed = new ArrayList<>(events.size());
            List<Long> streamVersions = new ArrayList<>(events.size());
            List<Long> globalPositions = new ArrayList<>(events.size());
            for (int i = 0; i < events.size(); i++) {
                PendingEvent pending = events.get(i);
                long globalPosition = globalLog.size() + committed.size() + 1L;
                long streamVersion = currentVersion + 1 + i;
                committed.add(new Event(globalPosition, streamId, streamVersion, pending.eventType(), pending.payload(), pending.metadata(), normalizeTenantId(pending.tenantId()), createdAt));
                streamVersions.add(streamVersion);
                globalPositions.add(globalPosition);
            }
            List<Event> newStream = new ArrayList<>(stream);
            newStream.addAll(committed);
            streams.put(streamId, newStream);
            globalLog.addAll(committed);
            writeResult = new WriteResult(streamId, currentVersion, streamVersions, globalPositions);
        } finally {
            lock.writeLock().unlock();
        }

        notifyAfterCommit(committed);
        return writeResult;
    }

    @Override
    public WriteResult append(String streamId, ExpectedVersion expectedVersion, List<PendingEvent> events, Duration timeout) {
        return append(streamId, expectedVersion, events);
    }

    @Override
    public EventStream read(String streamId, long fromVersion, long toVersion, int limit) {
        validateStreamId(streamId);
        validateReadRange(fromVersion, toVersion, limit);
        lock.readLock().lock();
        try {
            List<Event> stream = streams.getOrDefault(streamId, Collections.emptyList());
            List<Event> events = stream.stream()
                    .filter(e -> e.streamVersion() >= fromVersion && e.streamVersion() <= toVersion)
                    .limit(limit)
                    .toList();
            return new EventStreamImpl(streamId, stream.size() - 1L, events);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Stream<Event> readAll(Set<String> eventTypes, long afterGlobalPosition, int batchSize) {
        Objects.requireNonNull(eventTypes, "Event types cannot be null");
        validateFeedPosition(afterGlobalPosition, batchSize);
        final List<Event> snapshot;
        lock.readLock().lock();
        try {
            // global position n lives at index n - 1
            int fromIndex = (int) Math.min(afterGlobalPosition, globalLog.size());
            snapshot = new ArrayList<>(globalLog.subList(fromIndex, globalLog.size()));
        } finally {
            lock.readLock().unlock();
        }
        return snapshot.stream().filter(e -> eventTypes.isEmpty() || eventTypes.contains(e.eventType()));
    }

    @Override
    public long streamVersion(String streamId) {
        validateStreamId(streamId);
        lock.readLock().lock();
        try {
            List<Event> stream = streams.get(streamId);
            return stream == null ? NO_STREAM : stream.size() - 1L;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void notifyAfterCommit(List<Event> committed) {
        try {
            afterCommitListener.accept(committed);
        } catch (RuntimeException e) {
            log.error("After commit listener failed for {} event(s) in stream {}, the events are committed", committed.size(), committed.get(0).streamId(), e);
        }
    }

    private static @Nullable String normalizeTenantId(@Nullable String tenantId) {
        if (tenantId == null) {
            return null;
        }
        try {
            return UUID.fromString(tenantId).toString();
        } catch (IllegalArgumentException e) {
            throw new FatalStorageException("Tenant id " + tenantId + " is not a valid UUID", e);
        }
    }
}
