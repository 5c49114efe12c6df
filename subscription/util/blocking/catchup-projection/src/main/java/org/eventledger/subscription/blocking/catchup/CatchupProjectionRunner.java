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

package org.eventledger.subscription.blocking.catchup;

import org.eventledger.eventstore.api.Event;
import org.eventledger.eventstore.api.blocking.ReadAllEvents;
import org.eventledger.subscription.api.SubscriptionPositionStorage;
import org.eventledger.subscription.internal.ExecutorShutdown;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import static org.eventledger.eventstore.api.internal.EventValidator.validateSubscriptionId;

/**
 * Keeps {@link Projection}s up to date by reading the global feed from the position stored for each projection,
 * applying the events and storing the new position. This is the durable way of consuming events, a projection
 * that has been down simply continues where it left off.
 * <p>
 * Passes can be run synchronously ({@link #catchUp(String)}, {@link #catchUpAll()}) or in the background by calling
 * {@link #start()}, which polls every {@link CatchupProjectionConfig#pollInterval}. To reduce latency, register
 * {@link #wakeUp()} as a wildcard handler of an {@code EventPublisher} so that a pass starts as soon as events are committed.
 * </p>
 */
@NullMarked
public class CatchupProjectionRunner {
    private static final Logger log = LoggerFactory.getLogger(CatchupProjectionRunner.class);

    private final ReadAllEvents eventStore;
    private final SubscriptionPositionStorage positionStorage;
    private final CatchupProjectionConfig config;
    private final Map<String, RegisteredProjection> projections = new ConcurrentHashMap<>();
    private final AtomicBoolean wakeUpPending = new AtomicBoolean();

    private volatile @Nullable ScheduledExecutorService executor;
    private volatile boolean shutdown;

    public CatchupProjectionRunner(ReadAllEvents eventStore, SubscriptionPositionStorage positionStorage) {
        this(eventStore, positionStorage, CatchupProjectionConfig.defaults());
    }

    public CatchupProjectionRunner(ReadAllEvents eventStore, SubscriptionPositionStorage positionStorage, CatchupProjectionConfig config) {
        this.eventStore = Objects.requireNonNull(eventStore, ReadAllEvents.class.getSimpleName() + " cannot be null");
        this.positionStorage = Objects.requireNonNull(positionStorage, SubscriptionPositionStorage.class.getSimpleName() + " cannot be null");
        this.config = Objects.requireNonNull(config, CatchupProjectionConfig.class.getSimpleName() + " cannot be null");
    }

    /**
     * Register a projection.
     *
     * @param subscriptionId The id under which the position of the projection is stored
     * @param eventTypes     The event types the projection is interested in, an empty set means all events
     * @param projection     The projection
     */
    public void register(String subscriptionId, Set<String> eventTypes, Projection projection) {
        validateSubscriptionId(subscriptionId);
        Objects.requireNonNull(eventTypes, "Event types cannot be null");
        Objects.requireNonNull(projection, Projection.class.getSimpleName() + " cannot be null");
        if (shutdown) {
            throw new IllegalStateException("Cannot register projection " + subscriptionId + " after shutdown");
        }
        RegisteredProjection registered = new RegisteredProjection(subscriptionId, Set.copyOf(eventTypes), projection);
        if (projections.putIfAbsent(subscriptionId, registered) != null) {
            throw new IllegalArgumentException("Projection " + subscriptionId + " is already registered");
        }
        log.info("Registered projection {} for event types {}", subscriptionId, eventTypes.isEmpty() ? "*" : eventTypes);
    }

    /**
     * Apply every event after the stored position of the projection and store the new position.
     *
     * @return The number of applied events
     */
    public long catchUp(String subscriptionId) {
        return catchUp(registered(subscriptionId), false);
    }

    /**
     * Run {@link #catchUp(String)} for every registered projection. A projection that fails doesn't prevent the others
     * from catching up, the first failure is rethrown when all projections have had their pass.
     */
    public void catchUpAll() {
        RuntimeException failure = null;
        for (RegisteredProjection projection : projections.values()) {
            try {
                catchUp(projection, false);
            } catch (RuntimeException e) {
                log.warn("Projection {} failed to catch up, it'll be retried on the next pass", projection.subscriptionId, e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Reset the projection and replay every matching event from the beginning of the global feed. The stored position
     * is deleted before the projection is reset, so if the rebuild fails part-way the next catch-up pass continues from
     * the last event that the rebuild managed to apply.
     *
     * @return The number of applied events
     */
    public long rebuild(String subscriptionId) {
        RegisteredProjection projection = registered(subscriptionId);
        log.info("Rebuilding projection {}", subscriptionId);
        return catchUp(projection, true);
    }

    /**
     * Schedule a pass for all projections as soon as possible. Calls made while a pass is pending are coalesced.
     * Does nothing if the runner hasn't been started.
     */
    public void wakeUp() {
        ScheduledExecutorService executor = this.executor;
        if (executor == null || shutdown || !wakeUpPending.compareAndSet(false, true)) {
            return;
        }
        executor.execute(() -> {
            wakeUpPending.set(false);
            runPass();
        });
    }

    /**
     * Start polling in a background thread.
     */
    public synchronized void start() {
        if (shutdown) {
            throw new IllegalStateException("Cannot start after shutdown");
        } else if (executor != null) {
            return;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "eventledger-catchup-projections");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::runPass, 0, config.pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        this.executor = executor;
        log.info("Started catch-up projection runner with {} projection(s), polling every {}", projections.size(), config.pollInterval);
    }

    public boolean isRunning() {
        return executor != null && !shutdown;
    }

    public synchronized void shutdown() {
        shutdown = true;
        ScheduledExecutorService executor = this.executor;
        if (executor != null) {
            ExecutorShutdown.shutdownSafely(executor, 5, TimeUnit.SECONDS);
        }
        log.info("Catch-up projection runner was shutdown");
    }

    private void runPass() {
        try {
            catchUpAll();
        } catch (RuntimeException e) {
            // already logged per projection, keep the schedule alive
            log.debug("Catch-up pass completed with failures", e);
        }
    }

    private long catchUp(RegisteredProjection registered, boolean fromBeginning) {
        registered.lock.lock();
        try {
            if (fromBeginning) {
                // position goes first, a failure in between leads to redelivery rather than lost events
                positionStorage.delete(registered.subscriptionId);
                registered.projection.reset();
            }
            long position = fromBeginning ? 0 : positionStorage.read(registered.subscriptionId);
            long applied = 0;
            long unsaved = 0;
            long lastApplied = position;
            try (Stream<Event> events = eventStore.readAll(registered.eventTypes, position, config.batchSize)) {
                Iterator<Event> iterator = events.iterator();
                while (!shutdown && iterator.hasNext()) {
                    Event event = iterator.next();
                    config.retryStrategy.execute(() -> registered.projection.apply(event));
                    lastApplied = event.globalPosition();
                    applied++;
                    if (++unsaved >= config.persistPositionEvery) {
                        positionStorage.save(registered.subscriptionId, lastApplied);
                        unsaved = 0;
                    }
                }
            } finally {
                if (unsaved > 0) {
                    positionStorage.save(registered.subscriptionId, lastApplied);
                }
            }
            if (applied > 0) {
                log.debug("Projection {} applied {} event(s), now at global position {}", registered.subscriptionId, applied, lastApplied);
            }
            return applied;
        } finally {
            registered.lock.unlock();
        }
    }

    private RegisteredProjection registered(String subscriptionId) {
        RegisteredProjection projection = projections.get(subscriptionId);
        if (projection == null) {
            throw new IllegalArgumentException("No projection registered with id " + subscriptionId);
        }
        return projection;
    }

    private static final class RegisteredProjection {
        private final String subscriptionId;
        private final Set<String> eventTypes;
        private final Projection projection;
        private final ReentrantLock lock = new ReentrantLock();

        private RegisteredProjection(String subscriptionId, Set<String> eventTypes, Projection projection) {
            this.subscriptionId = subscriptionId;
            this.eventTypes = eventTypes;
            this.projection = projection;
        }
    }
}
