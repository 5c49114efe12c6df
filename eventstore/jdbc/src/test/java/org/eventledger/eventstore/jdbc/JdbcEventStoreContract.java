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
import org.eventledger.eventstore.api.EventValidationException;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.FatalStorageException;
import org.eventledger.eventstore.api.PendingEvent;
import org.eventledger.eventstore.api.WriteResult;
import org.eventledger.eventstore.api.blocking.EventStream;
import org.eventledger.retry.RetryStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.eventledger.eventstore.api.StreamVersion.NO_STREAM;
import static org.junit.jupiter.api.Assertions.assertAll;

/**
 * Behavior shared by every {@link SqlDialect}. Subclasses supply the {@link DataSource}.
 */
@Timeout(60)
abstract class JdbcEventStoreContract {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:15:30.123456789Z"), ZoneId.of("Europe/Stockholm"));

    CopyOnWriteArrayList<List<Event>> committed;
    JdbcEventStore eventStore;

    abstract DataSource dataSource();

    abstract SqlDialect dialect();

    @BeforeEach
    void create_event_store() {
        new ResourceDatabasePopulator(new ClassPathResource(dialect().schemaLocation())).execute(dataSource());
        committed = new CopyOnWriteArrayList<>();
        eventStore = new JdbcEventStore(dataSource(), JdbcEventStoreConfig.defaults().toBuilder()
                .dialect(dialect())
                .clock(CLOCK)
                .afterCommitListener(committed::add)
                .build());
    }

    @AfterEach
    void delete_events() {
        new JdbcTemplate(dataSource()).update("DELETE FROM events");
    }

    @Test
    void first_append_to_a_new_stream_with_no_stream_expectation_gets_version_zero() {
        // When
        long globalPosition = eventStore.appendEvent("task-1", ExpectedVersion.noStream(), taskCreated("Write docs"));

        // Then
        EventStream eventStream = eventStore.read("task-1");
        assertAll(
                () -> assertThat(eventStream.version()).isZero(),
                () -> assertThat(eventStream.events()).singleElement().satisfies(e -> {
                    assertThat(e.globalPosition()).isEqualTo(globalPosition);
                    assertThat(e.streamVersion()).isZero();
                    assertThat(e.payload()).containsEntry("title", "Write docs");
                })
        );
    }

    @Test
    void stale_expected_version_is_rejected_with_the_actual_version_and_nothing_is_written() {
        // Given
        eventStore.append("task-1", ExpectedVersion.noStream(), List.of(taskCreated("Write docs")));
        eventStore.append("task-1", ExpectedVersion.exactly(0), List.of(taskCompleted()));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.append("task-1", ExpectedVersion.exactly(0), List.of(taskCompleted())));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class)
                        .hasMessage("Concurrency conflict on stream 'task-1': expected version 0, found 1"),
                () -> assertThat(eventStore.streamVersion("task-1")).isEqualTo(1),
                () -> assertThat(committed).hasSize(2)
        );
    }

    @Test
    void no_stream_expectation_fails_when_the_stream_already_exists() {
        // Given
        eventStore.append("task-1", List.of(taskCreated("Write docs")));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.append("task-1", ExpectedVersion.noStream(), List.of(taskCreated("Again"))));

        // Then
        assertThat(throwable).isInstanceOfSatisfying(ConcurrencyConflictException.class, e -> assertThat(e.getActualVersion()).isZero());
    }

    @Test
    void all_events_of_an_append_are_committed_with_consecutive_versions() {
        // Given
        eventStore.append("task-2", List.of(taskCreated("Other")));

        // When
        WriteResult writeResult = eventStore.append("task-1", ExpectedVersion.noStream(), List.of(taskCreated("Write docs"), taskCompleted(), taskCompleted()));

        // Then
        assertAll(
                () -> assertThat(writeResult.getOldStreamVersion()).isEqualTo(NO_STREAM),
                () -> assertThat(writeResult.getNewStreamVersion()).isEqualTo(2),
                () -> assertThat(writeResult.getStreamVersions()).containsExactly(0L, 1L, 2L),
                () -> assertThat(writeResult.getGlobalPositions()).isSorted().doesNotHaveDuplicates(),
                () -> assertThat(writeResult.getGlobalPositions().get(0)).isGreaterThan(eventStore.read("task-2").events().get(0).globalPosition())
        );
    }

    @Test
    void appended_events_are_read_back_with_payload_metadata_tenant_and_timestamp() {
        // Given
        String tenantId = "3F2504E0-4F89-11D3-9A0C-0305E82C3301";
        PendingEvent event = PendingEvent.of("TaskCreated", Map.of("title", "Write docs", "tags", List.of("a", "b"), "estimate", 3), Map.of("correlationId", "abc"))
                .withTenantId(tenantId);

        // When
        eventStore.append("task-1", List.of(event));

        // Then
        Event stored = eventStore.read("task-1").events().get(0);
        assertAll(
                () -> assertThat(stored.streamId()).isEqualTo("task-1"),
                () -> assertThat(stored.eventType()).isEqualTo("TaskCreated"),
                () -> assertThat(stored.payload()).isEqualTo(Map.of("title", "Write docs", "tags", List.of("a", "b"), "estimate", 3L)),
                () -> assertThat(stored.metadata()).isEqualTo(Map.of("correlationId", "abc")),
                () -> assertThat(stored.tenantId()).isEqualTo(tenantId.toLowerCase()),
                () -> assertThat(stored.createdAt()).isEqualTo(OffsetDateTime.of(2024, 3, 1, 10, 15, 30, 123456000, ZoneOffset.UTC)),
                () -> assertThat(committed).singleElement().satisfies(events -> assertThat(events).containsExactly(stored))
        );
    }

    @Test
    void reading_a_stream_that_does_not_exist_returns_the_no_stream_sentinel() {
        EventStream eventStream = eventStore.read("unknown");

        assertAll(
                () -> assertThat(eventStream.version()).isEqualTo(NO_STREAM),
                () -> assertThat(eventStream.events()).isEmpty(),
                () -> assertThat(eventStore.exists("unknown")).isFalse()
        );
    }

    @Test
    void range_read_returns_the_requested_slice_together_with_the_current_version() {
        // Given
        eventStore.append("task-1", List.of(taskCreated("Write docs"), taskCompleted(), taskCompleted(), taskCompleted(), taskCompleted()));

        // When
        EventStream eventStream = eventStore.read("task-1", 1, 3, 2);

        // Then
        assertAll(
                () -> assertThat(eventStream.version()).isEqualTo(4),
                () -> assertThat(eventStream.events()).extracting(Event::streamVersion).containsExactly(1L, 2L)
        );
    }

    @Test
    void empty_append_writes_nothing_and_does_not_notify() {
        // When
        WriteResult writeResult = eventStore.append("task-1", ExpectedVersion.noStream(), List.of());

        // Then
        assertAll(
                () -> assertThat(writeResult.isEmpty()).isTrue(),
                () -> assertThat(writeResult.getNewStreamVersion()).isEqualTo(NO_STREAM),
                () -> assertThat(eventStore.exists("task-1")).isFalse(),
                () -> assertThat(committed).isEmpty()
        );
    }

    @Test
    void empty_append_succeeds_without_checking_the_expected_version() {
        // Given
        eventStore.append("task-1", ExpectedVersion.noStream(), List.of(taskCreated("Write docs")));
        committed.clear();

        // When
        WriteResult writeResult = eventStore.append("task-1", ExpectedVersion.exactly(7), List.of());

        // Then
        assertAll(
                () -> assertThat(writeResult.isEmpty()).isTrue(),
                () -> assertThat(writeResult.getNewStreamVersion()).isZero(),
                () -> assertThat(eventStore.streamVersion("task-1")).isZero(),
                () -> assertThat(committed).isEmpty()
        );
    }

    @Test
    void global_feed_never_shows_a_later_position_while_an_earlier_one_is_uncommitted() throws Exception {
        // Given
        DataSourceTransactionManager transactionManager = new DataSourceTransactionManager(dataSource());
        JdbcEventStore slowWriterStore = new JdbcEventStore(new JdbcTemplate(dataSource()), transactionManager, JdbcEventStoreConfig.defaults().toBuilder().dialect(dialect()).build());
        CountDownLatch slowWriterHasAppended = new CountDownLatch(1);
        CountDownLatch releaseSlowWriter = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> slowWriter = executor.submit(() -> new TransactionTemplate(transactionManager).executeWithoutResult(__ -> {
                slowWriterStore.append("task-slow", List.of(taskCreated("Slow")));
                slowWriterHasAppended.countDown();
                awaitLatch(releaseSlowWriter);
            }));
            awaitLatch(slowWriterHasAppended);

            // When
            Future<WriteResult> fastWriter = executor.submit(() -> eventStore.append("task-fast", List.of(taskCreated("Fast"))));
            Throwable fastWriterWhileSlowWriterIsInFlight = catchThrowable(() -> fastWriter.get(300, MILLISECONDS));
            List<Event> whileSlowWriterIsInFlight = eventStore.readAll().collect(Collectors.toList());
            releaseSlowWriter.countDown();
            slowWriter.get(10, SECONDS);
            fastWriter.get(10, SECONDS);
            List<Event> afterBothCommitted = eventStore.readAll().collect(Collectors.toList());

            // Then
            assertAll(
                    () -> assertThat(fastWriterWhileSlowWriterIsInFlight).isInstanceOf(TimeoutException.class),
                    () -> assertThat(whileSlowWriterIsInFlight).isEmpty(),
                    () -> assertThat(afterBothCommitted).extracting(Event::streamId).containsExactly("task-slow", "task-fast"),
                    () -> assertThat(afterBothCommitted).extracting(Event::globalPosition).isSorted()
            );
        } finally {
            releaseSlowWriter.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void invalid_events_are_rejected_before_anything_is_written() {
        // Given
        List<PendingEvent> events = List.of(taskCreated("Write docs"), PendingEvent.of("x".repeat(101), Map.of()));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.append("task-1", events));

        // Then
        assertAll(
                () -> assertThat(throwable).isInstanceOf(EventValidationException.class),
                () -> assertThat(eventStore.exists("task-1")).isFalse()
        );
    }

    @Test
    void payload_with_a_value_that_is_not_json_is_a_validation_error() {
        // When
        Throwable throwable = catchThrowable(() -> eventStore.append("task-1", List.of(PendingEvent.of("TaskCreated", Map.of("thread", new Object())))));

        // Then
        assertAll(
                () -> assertThat(throwable).isInstanceOf(EventValidationException.class).hasMessageContaining("thread"),
                () -> assertThat(eventStore.exists("task-1")).isFalse()
        );
    }

    @Test
    void numbers_and_nested_documents_are_read_back_exactly_as_they_were_appended() {
        // Given
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("small", 5);
        payload.put("big", 5_000_000_000L);
        payload.put("ratio", 0.25);
        payload.put("nested", Map.of("count", (short) 2, "items", List.of(1, 2.5f, "three")));
        payload.put("nothing", null);
        PendingEvent event = PendingEvent.of("TaskCreated", payload, Map.of("attempt", 1));

        // When
        eventStore.append("task-1", List.of(event));

        // Then
        Event stored = eventStore.read("task-1").events().get(0);
        assertAll(
                () -> assertThat(stored.payload()).isEqualTo(event.payload()),
                () -> assertThat(stored.metadata()).isEqualTo(event.metadata()),
                () -> assertThat(stored.payload().get("small")).isEqualTo(5L),
                () -> assertThat(stored.payload().get("nested")).isEqualTo(Map.of("count", 2L, "items", List.of(1L, 2.5d, "three"))),
                () -> assertThat(eventStore.readAll(0, 10).findFirst().orElseThrow().payload()).isEqualTo(event.payload())
        );
    }

    @Test
    void malformed_tenant_id_is_a_fatal_storage_error_and_rolls_back_the_whole_append() {
        // Given
        List<PendingEvent> events = List.of(taskCreated("Write docs"), taskCompleted().withTenantId("not-a-uuid"));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.append("task-1", events));

        // Then
        assertAll(
                () -> assertThat(throwable).isInstanceOfSatisfying(FatalStorageException.class, e -> assertThat(e.isRetryable()).isFalse()),
                () -> assertThat(eventStore.exists("task-1")).isFalse(),
                () -> assertThat(committed).isEmpty()
        );
    }

    @Test
    void failing_after_commit_listener_does_not_affect_the_append() {
        // Given
        JdbcEventStore eventStore = new JdbcEventStore(dataSource(), JdbcEventStoreConfig.defaults().toBuilder()
                .dialect(dialect())
                .afterCommitListener(__ -> {
                    throw new IllegalStateException("expected");
                })
                .build());

        // When
        WriteResult writeResult = eventStore.append("task-1", List.of(taskCreated("Write docs")));

        // Then
        assertAll(
                () -> assertThat(writeResult.getNewStreamVersion()).isZero(),
                () -> assertThat(eventStore.exists("task-1")).isTrue()
        );
    }

    @Test
    void read_all_returns_every_event_in_global_position_order_across_batches() {
        // Given
        for (int i = 0; i < 7; i++) {
            eventStore.append("task-" + (i % 3), List.of(taskCreated("Task " + i), taskCompleted()));
        }

        // When
        List<Event> events = eventStore.readAll(0, 3).collect(Collectors.toList());

        // Then
        assertAll(
                () -> assertThat(events).hasSize(14),
                () -> assertThat(events).extracting(Event::globalPosition).isSorted().doesNotHaveDuplicates()
        );
    }

    @Test
    void read_all_resumes_after_a_global_position_and_filters_on_event_types() {
        // Given
        List<Long> positions = eventStore.append("task-1", List.of(taskCreated("A"), taskCompleted())).getGlobalPositions();
        eventStore.append("task-2", List.of(taskCreated("B"), taskCompleted()));

        // When
        List<Event> events = eventStore.readAll(Set.of("TaskCreated"), positions.get(0), 10).collect(Collectors.toList());

        // Then
        assertThat(events).extracting(Event::streamId, Event::eventType).containsExactly(org.assertj.core.groups.Tuple.tuple("task-2", "TaskCreated"));
    }

    @Test
    void read_all_from_the_end_of_the_feed_is_empty() {
        // Given
        long last = eventStore.appendEvent("task-1", ExpectedVersion.any(), taskCreated("A"));

        // Then
        assertThat(eventStore.readAll(last, 10)).isEmpty();
    }

    @Test
    void concurrent_checked_appends_to_the_same_stream_are_serialized_without_gaps() throws Exception {
        // Given
        int threads = 4;
        int appendsPerThread = 5;
        RetryStrategy retryStrategy = RetryStrategy.fixed(5).maxAttempts(200).retryIf(ConcurrencyConflictException.class::isInstance);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // When
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < appendsPerThread; i++) {
                    retryStrategy.execute(() -> {
                        long version = eventStore.streamVersion("task-1");
                        eventStore.append("task-1", ExpectedVersion.of(version), List.of(taskCompleted()));
                    });
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(50, SECONDS);
        }
        executor.shutdown();

        // Then
        List<Event> events = eventStore.read("task-1").events();
        assertAll(
                () -> assertThat(events).extracting(Event::streamVersion).containsExactlyElementsOf(LongStream.range(0, threads * appendsPerThread).boxed().toList()),
                () -> assertThat(events).extracting(Event::globalPosition).isSorted().doesNotHaveDuplicates()
        );
    }

    @Test
    void concurrent_unchecked_appends_to_the_same_stream_all_succeed() throws Exception {
        // Given
        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // When
        List<Future<WriteResult>> futures = IntStream.range(0, threads)
                .mapToObj(i -> executor.submit(() -> {
                    start.await();
                    return eventStore.append("task-1", List.of(taskCompleted(), taskCompleted()));
                }))
                .collect(Collectors.toList());
        start.countDown();
        Set<Long> versions = new HashSet<>();
        for (Future<WriteResult> future : futures) {
            versions.addAll(future.get(50, SECONDS).getStreamVersions());
        }
        executor.shutdown();

        // Then
        assertAll(
                () -> assertThat(versions).containsExactlyInAnyOrderElementsOf(LongStream.range(0, threads * 2L).boxed().toList()),
                () -> assertThat(eventStore.streamVersion("task-1")).isEqualTo(threads * 2L - 1)
        );
    }

    @Test
    void tenant_id_is_optional() {
        // When
        eventStore.append("task-" + UUID.randomUUID(), List.of(taskCreated("No tenant")));

        // Then
        assertThat(eventStore.readAll().map(Event::tenantId)).containsOnlyNulls();
    }

    static PendingEvent taskCreated(String title) {
        return PendingEvent.of("TaskCreated", Map.of("title", title));
    }

    static PendingEvent taskCompleted() {
        return PendingEvent.of("TaskCompleted", Map.of());
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            if (!latch.await(10, SECONDS)) {
                throw new IllegalStateException("Timed out waiting for latch");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
