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

package org.eventledger.eventstore.jdbc;

import org.eventledger.eventstore.api.ConcurrencyConflictException;
import org.eventledger.eventstore.api.Event;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.PendingEvent;
import org.eventledger.eventstore.api.WriteResult;
import org.eventledger.eventstore.api.blocking.EventStore;
import org.eventledger.eventstore.api.blocking.EventStream;
import org.eventledger.eventstore.api.internal.EventStreamImpl;
import org.eventledger.retry.RetryStrategy;
import org.eventledger.retry.RetryStrategy.Retry;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.JdbcTransactionManager;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import static org.eventledger.eventstore.api.internal.EventValidator.validateEvents;
import static org.eventledger.eventstore.api.internal.EventValidator.validateFeedPosition;
import static org.eventledger.eventstore.api.internal.EventValidator.validateReadRange;
import static org.eventledger.eventstore.api.internal.EventValidator.validateStreamId;
import static org.eventledger.eventstore.jdbc.EventRowMapper.EVENT_COLUMNS;
import static org.eventledger.eventstore.jdbc.StorageErrorTranslator.translate;

/**
 * An {@link EventStore} backed by a relational database through Spring JDBC. Every append runs in its own transaction
 * (or joins the current Spring managed transaction) and is protected by an optimistic version check. Two appends to
 * the same stream are serialized. Appends to different streams check their versions concurrently but take turns from
 * the first insert until commit, so that global positions become visible in the order they're handed out and the
 * global feed never skips an event that commits late.
 * <br><br>
 * The {@code events} table must exist, see {@link SqlDialect#schemaLocation()}.
 */
@NullMarked
public class JdbcEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String STREAM_VERSION_SQL = "SELECT COALESCE(MAX(stream_version), -1) FROM events WHERE stream_id = ?";
    private static final String READ_STREAM_SQL = "SELECT " + EVENT_COLUMNS + " FROM events WHERE stream_id = ? AND stream_version >= ? AND stream_version <= ? ORDER BY stream_version LIMIT ?";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;
    private final PlatformTransactionManager transactionManager;
    private final JdbcEventStoreConfig config;
    private final SqlDialect dialect;
    private final JsonDocumentCodec codec;
    private final EventRowMapper rowMapper;
    private final RetryStrategy uncheckedAppendRetryStrategy;
    private final String insertSql;

    public JdbcEventStore(DataSource dataSource) {
        this(dataSource, JdbcEventStoreConfig.defaults());
    }

    public JdbcEventStore(DataSource dataSource, JdbcEventStoreConfig config) {
        this(new JdbcTemplate(dataSource), new JdbcTransactionManager(dataSource), config);
    }

    /**
     * Create a {@link JdbcEventStore} that participates in the transactions of the supplied {@code transactionManager}.
     *
     * @param jdbcTemplate       The {@link JdbcTemplate} to use
     * @param transactionManager A transaction manager that manages transactions for the {@code DataSource} of the {@code jdbcTemplate}
     * @param config             The configuration of the event store
     */
    public JdbcEventStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager, JdbcEventStoreConfig config) {
        Objects.requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(config, JdbcEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = jdbcTemplate;
        this.namedParameterJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.transactionManager = transactionManager;
        this.config = config;
        this.dialect = config.dialect == null ? SqlDialect.detect(Objects.requireNonNull(jdbcTemplate.getDataSource(), "DataSource cannot be null")) : config.dialect;
        this.codec = new JsonDocumentCodec(config.objectMapper);
        this.rowMapper = new EventRowMapper(codec);
        this.uncheckedAppendRetryStrategy = config.uncheckedAppendRetryStrategy instanceof Retry retry ?
                retry.retryIf(DuplicateKeyException.class::isInstance)
                        .onRetryableError((info, e) -> log.debug("Unchecked append lost a race for the next stream version, retrying (attempt {})", info.attemptNumber()))
                : config.uncheckedAppendRetryStrategy;
        this.insertSql = "INSERT INTO events (stream_id, stream_version, event_type, event_data, metadata, tenant_id, created_at) VALUES (?, ?, ?, "
                + dialect.jsonParameter() + ", " + dialect.jsonParameter() + ", " + dialect.uuidParameter() + ", ?)";
    }

    @Override
    public WriteResult append(String streamId, ExpectedVersion expectedVersion, List<PendingEvent> events) {
        return append(streamId, expectedVersion, events, config.transactionTimeout);
    }

    @Override
    public WriteResult append(String streamId, ExpectedVersion expectedVersion, List<PendingEvent> events, Duration timeout) {
        validateStreamId(streamId);
        Objects.requireNonNull(expectedVersion, ExpectedVersion.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(timeout, "Timeout cannot be null");
        validateEvents(events);
        if (events.isEmpty()) {
            return WriteResult.nothingWritten(streamId, streamVersion(streamId));
        }
        List<SerializedEvent> serializedEvents = serialize(events);

        boolean joinsOuterTransaction = TransactionSynchronizationManager.isActualTransactionActive();
        TransactionTemplate transactionTemplate = newTransactionTemplate(timeout);
        RetryStrategy retryStrategy = expectedVersion.isAny() ? uncheckedAppendRetryStrategy : RetryStrategy.none();

        final AppendOutcome outcome;
        try {
            outcome = retryStrategy.execute(() -> transactionTemplate.execute(__ -> appendInTransaction(streamId, expectedVersion, serializedEvents)));
        } catch (DuplicateKeyException e) {
            long actualVersion = streamVersion(streamId);
            log.debug("Append to stream {} lost a race, expected version {} but stream is now at {}", streamId, expectedVersion, actualVersion);
            throw new ConcurrencyConflictException(streamId, expectedVersion, actualVersion);
        } catch (RuntimeException e) {
            throw translate("Append to stream " + streamId, e);
        }

        Objects.requireNonNull(outcome, "Append outcome cannot be null");
        if (joinsOuterTransaction && TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    notifyAfterCommit(outcome.events);
                }
            });
        } else {
            notifyAfterCommit(outcome.events);
        }
        return outcome.writeResult;
    }

    private AppendOutcome appendInTransaction(String streamId, ExpectedVersion expectedVersion, List<SerializedEvent> events) {
        dialect.lockStream(jdbcTemplate, streamId);
        long currentVersion = queryStreamVersion(streamId);
        if (!expectedVersion.isSatisfiedBy(currentVersion)) {
            throw new ConcurrencyConflictException(streamId, expectedVersion, currentVersion);
        }
        dialect.lockGlobalPositions(jdbcTemplate);

        OffsetDateTime createdAt = OffsetDateTime.now(config.clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
        List<Event> committed = new ArrayList<>(events.size());
        List<Long> streamVersions = new ArrayList<>(events.size());
        List<Long> globalPositions = new ArrayList<>(events.size());
        long streamVersion = currentVersion;
        for (SerializedEvent event : events) {
            streamVersion++;
            long globalPosition = insert(streamId, streamVersion, event, createdAt);
            committed.add(new Event(globalPosition, streamId, streamVersion, event.pendingEvent.eventType(), event.pendingEvent.payload(),
                    event.pendingEvent.metadata(), canonicalTenantId(event.pendingEvent), createdAt));
            streamVersions.add(streamVersion);
            globalPositions.add(globalPosition);
        }
        log.debug("Appended {} event(s) to stream {}, version {} -> {}", events.size(), streamId, currentVersion, streamVersion);
        return new AppendOutcome(new WriteResult(streamId, currentVersion, streamVersions, globalPositions), committed);
    }

    private long insert(String streamId, long streamVersion, SerializedEvent event, OffsetDateTime createdAt) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(insertSql, new String[]{dialect.generatedKeyColumn()});
            ps.setString(1, streamId);
            ps.setLong(2, streamVersion);
            ps.setString(3, event.pendingEvent.eventType());
            ps.setString(4, event.payload);
            ps.setString(5, event.metadata);
            if (event.pendingEvent.tenantId() == null) {
                ps.setNull(6, Types.VARCHAR);
            } else {
                ps.setString(6, event.pendingEvent.tenantId());
            }
            ps.setObject(7, createdAt);
            return ps;
        }, keyHolder);
        return Objects.requireNonNull(keyHolder.getKey(), "No global position was generated").longValue();
    }

    @Override
    public EventStream read(String streamId, long fromVersion, long toVersion, int limit) {
        validateStreamId(streamId);
        validateReadRange(fromVersion, toVersion, limit);
        TransactionTemplate transactionTemplate = newTransactionTemplate(config.transactionTimeout);
        transactionTemplate.setReadOnly(true);
        transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        try {
            return transactionTemplate.execute(__ -> {
                long version = queryStreamVersion(streamId);
                List<Event> events = version < fromVersion ? List.of() : jdbcTemplate.query(READ_STREAM_SQL, rowMapper, streamId, fromVersion, toVersion, limit);
                return new EventStreamImpl(streamId, version, events);
            });
        } catch (RuntimeException e) {
            throw translate("Read of stream " + streamId, e);
        }
    }

    @Override
    public Stream<Event> readAll(Set<String> eventTypes, long afterGlobalPosition, int batchSize) {
        Objects.requireNonNull(eventTypes, "Event types cannot be null");
        validateFeedPosition(afterGlobalPosition, batchSize);
        return new GlobalEventFeed(namedParameterJdbcTemplate, rowMapper, eventTypes, afterGlobalPosition, batchSize,
                e -> translate("Read of the global event feed", e)).stream();
    }

    @Override
    public long streamVersion(String streamId) {
        validateStreamId(streamId);
        try {
            return queryStreamVersion(streamId);
        } catch (RuntimeException e) {
            throw translate("Read of the version of stream " + streamId, e);
        }
    }

    public SqlDialect dialect() {
        return dialect;
    }

    private long queryStreamVersion(String streamId) {
        Long version = jdbcTemplate.queryForObject(STREAM_VERSION_SQL, Long.class, streamId);
        return Objects.requireNonNull(version, "Stream version cannot be null");
    }

    private TransactionTemplate newTransactionTemplate(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        transactionTemplate.setTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
        return transactionTemplate;
    }

    private List<SerializedEvent> serialize(List<PendingEvent> events) {
        List<SerializedEvent> serialized = new ArrayList<>(events.size());
        for (PendingEvent event : events) {
            serialized.add(new SerializedEvent(event, codec.serialize(event.eventType(), "payload", event.payload()), codec.serialize(event.eventType(), "metadata", event.metadata())));
        }
        return serialized;
    }

    // uuid columns are read back in lower case
    private static @Nullable String canonicalTenantId(PendingEvent event) {
        return event.tenantId() == null ? null : event.tenantId().toLowerCase(Locale.ROOT);
    }

    private void notifyAfterCommit(List<Event> events) {
        try {
            config.afterCommitListener.accept(events);
        } catch (RuntimeException e) {
            log.error("After commit listener failed for {} event(s) in stream {}, the events are committed", events.size(), events.get(0).streamId(), e);
        }
    }

    private record SerializedEvent(PendingEvent pendingEvent, String payload, String metadata) {
    }

    private record AppendOutcome(WriteResult writeResult, List<Event> events) {
    }

    @Override
    public String toString() {
        return JdbcEventStore.class.getSimpleName() + "[dialect=" + dialect + ", config=" + config + "]";
    }
}
