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

package org.eventledger.subscription.jdbc;

import org.eventledger.eventstore.api.TransientStorageException;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.jdbc.support.JdbcTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class JdbcSubscriptionPositionStorageTest {

    private DataSource dataSource;
    private JdbcSubscriptionPositionStorage storage;

    @BeforeEach
    void create_storage() {
        dataSource = new DriverManagerDataSource("jdbc:h2:mem:subscriptions-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000", "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource(JdbcSubscriptionPositionStorage.SCHEMA_LOCATION)).execute(dataSource);
        storage = new JdbcSubscriptionPositionStorage(dataSource);
    }

    @Test
    void unknown_subscription_reads_as_position_zero() {
        assertAll(
                () -> assertThat(storage.read("task-projection")).isZero(),
                () -> assertThat(storage.exists("task-projection")).isFalse()
        );
    }

    @Test
    void first_save_creates_the_position() {
        // When
        boolean saved = storage.save("task-projection", 42);

        // Then
        assertAll(
                () -> assertThat(saved).isTrue(),
                () -> assertThat(storage.exists("task-projection")).isTrue(),
                () -> assertThat(storage.read("task-projection")).isEqualTo(42)
        );
    }

    @Test
    void lower_or_equal_positions_are_ignored_without_error() {
        // Given
        storage.save("task-projection", 42);

        // When
        boolean lower = storage.save("task-projection", 40);
        boolean equal = storage.save("task-projection", 42);

        // Then
        assertAll(
                () -> assertThat(lower).isFalse(),
                () -> assertThat(equal).isFalse(),
                () -> assertThat(storage.read("task-projection")).isEqualTo(42)
        );
    }

    @Test
    void higher_position_advances_the_cursor_and_update_time() {
        // Given
        storage.save("task-projection", 42);
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);

        // When
        boolean advanced = storage.save("task-projection", 50);

        // Then
        assertAll(
                () -> assertThat(advanced).isTrue(),
                () -> assertThat(storage.read("task-projection")).isEqualTo(50),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM event_subscriptions", Integer.class)).isEqualTo(1)
        );
    }

    @Test
    void positions_of_different_subscriptions_are_independent() {
        // When
        storage.save("task-projection", 10);
        storage.save("dashboard-projection", 3);

        // Then
        assertAll(
                () -> assertThat(storage.read("task-projection")).isEqualTo(10),
                () -> assertThat(storage.read("dashboard-projection")).isEqualTo(3)
        );
    }

    @Test
    void concurrent_saves_keep_the_highest_position() throws Exception {
        // Given
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < 4; t++) {
            int offset = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (long position = 1; position <= 25; position++) {
                    storage.save("task-projection", position * 4 - offset);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(storage.read("task-projection")).isEqualTo(100);
    }

    @Test
    void deleted_position_reads_as_zero_and_is_created_again_by_a_lower_save() {
        // Given
        storage.save("task-projection", 42);

        // When
        storage.delete("task-projection");
        boolean existsAfterDelete = storage.exists("task-projection");
        boolean saved = storage.save("task-projection", 3);

        // Then
        assertAll(
                () -> assertThat(existsAfterDelete).isFalse(),
                () -> assertThat(saved).isTrue(),
                () -> assertThat(storage.read("task-projection")).isEqualTo(3)
        );
    }

    @Test
    void deleting_an_unknown_subscription_does_nothing() {
        storage.save("dashboard-projection", 7);

        storage.delete("task-projection");

        assertThat(storage.read("dashboard-projection")).isEqualTo(7);
    }

    @Test
    void failure_when_advancing_after_losing_the_create_race_is_translated() {
        // Given
        AtomicInteger updates = new AtomicInteger();
        JdbcTemplate racingJdbcTemplate = new JdbcTemplate(dataSource) {
            @Override
            public int update(String sql, @Nullable Object... args) {
                if (sql.startsWith("INSERT")) {
                    throw new DuplicateKeyException("created by a peer");
                } else if (updates.incrementAndGet() > 1) {
                    throw new DataAccessResourceFailureException("connection lost");
                }
                return super.update(sql, args);
            }
        };
        JdbcSubscriptionPositionStorage storage = new JdbcSubscriptionPositionStorage(racingJdbcTemplate, new JdbcTransactionManager(dataSource), Clock.systemUTC());

        // When
        Throwable throwable = catchThrowable(() -> storage.save("task-projection", 42));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(TransientStorageException.class).hasMessageContaining("task-projection"),
                () -> assertThat(throwable.getCause()).isInstanceOf(DataAccessResourceFailureException.class),
                () -> assertThat(throwable.getCause().getSuppressed()).hasExactlyElementsOfTypes(DuplicateKeyException.class)
        );
    }

    @Test
    void subscription_id_longer_than_the_column_is_rejected() {
        Throwable throwable = catchThrowable(() -> storage.save("x".repeat(101), 1));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
