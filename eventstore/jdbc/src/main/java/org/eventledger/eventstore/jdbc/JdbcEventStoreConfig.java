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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventledger.eventstore.api.Event;
import org.eventledger.retry.RetryStrategy;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Consumer;

/**
 * Configuration for the {@link JdbcEventStore}. Use the {@link Builder} to create an instance.
 */
@NullMarked
public class JdbcEventStoreConfig {
    public static final Duration DEFAULT_TRANSACTION_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Racing unchecked appends to the same stream are retried a few times before the conflict is surfaced.
     */
    public static final RetryStrategy DEFAULT_UNCHECKED_APPEND_RETRY_STRATEGY = RetryStrategy.exponentialBackoff(Duration.ofMillis(10), Duration.ofMillis(200), 2.0).maxAttempts(10);

    // @formatter:off
    private static final Consumer<List<Event>> NOOP_AFTER_COMMIT_LISTENER = __ -> {};
    // @formatter:on

    public final @Nullable SqlDialect dialect;
    public final ObjectMapper objectMapper;
    public final Clock clock;
    public final Consumer<List<Event>> afterCommitListener;
    public final Duration transactionTimeout;
    public final RetryStrategy uncheckedAppendRetryStrategy;

    private JdbcEventStoreConfig(@Nullable SqlDialect dialect, ObjectMapper objectMapper, Clock clock, Consumer<List<Event>> afterCommitListener,
                                 Duration transactionTimeout, RetryStrategy uncheckedAppendRetryStrategy) {
        Objects.requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(afterCommitListener, "After commit listener cannot be null");
        Objects.requireNonNull(transactionTimeout, "Transaction timeout cannot be null");
        Objects.requireNonNull(uncheckedAppendRetryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        if (transactionTimeout.isNegative() || transactionTimeout.isZero()) {
            throw new IllegalArgumentException("Transaction timeout must be positive");
        }
        this.dialect = dialect;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.afterCommitListener = afterCommitListener;
        this.transactionTimeout = transactionTimeout;
        this.uncheckedAppendRetryStrategy = uncheckedAppendRetryStrategy;
    }

    public static JdbcEventStoreConfig defaults() {
        return new Builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .dialect(dialect)
                .objectMapper(objectMapper)
                .clock(clock)
                .afterCommitListener(afterCommitListener)
                .transactionTimeout(transactionTimeout)
                .uncheckedAppendRetryStrategy(uncheckedAppendRetryStrategy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JdbcEventStoreConfig)) return false;
        JdbcEventStoreConfig that = (JdbcEventStoreConfig) o;
        return dialect == that.dialect && Objects.equals(objectMapper, that.objectMapper) && Objects.equals(clock, that.clock)
                && Objects.equals(afterCommitListener, that.afterCommitListener) && Objects.equals(transactionTimeout, that.transactionTimeout)
                && Objects.equals(uncheckedAppendRetryStrategy, that.uncheckedAppendRetryStrategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dialect, objectMapper, clock, afterCommitListener, transactionTimeout, uncheckedAppendRetryStrategy);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", JdbcEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("dialect=" + dialect)
                .add("clock=" + clock)
                .add("transactionTimeout=" + transactionTimeout)
                .add("uncheckedAppendRetryStrategy=" + uncheckedAppendRetryStrategy)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private SqlDialect dialect;
        private ObjectMapper objectMapper = new ObjectMapper();
        private Clock clock = Clock.systemUTC();
        private Consumer<List<Event>> afterCommitListener = NOOP_AFTER_COMMIT_LISTENER;
        private Duration transactionTimeout = DEFAULT_TRANSACTION_TIMEOUT;
        private RetryStrategy uncheckedAppendRetryStrategy = DEFAULT_UNCHECKED_APPEND_RETRY_STRATEGY;

        /**
         * @param dialect The {@link SqlDialect} to use, it's detected from the {@code DataSource} if {@code null}.
         * @return The builder instance
         */
        public Builder dialect(SqlDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        /**
         * @param objectMapper The {@link ObjectMapper} used to write payload and metadata as JSON
         * @return The builder instance
         */
        @NullMarked
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * @param clock The clock used to stamp {@code createdAt} on appended events
         * @return The builder instance
         */
        @NullMarked
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @param afterCommitListener Receives the events of every successful non-empty append once the transaction has committed.
         *                            Exceptions thrown by the listener are logged and never reach the caller of append.
         * @return The builder instance
         */
        @NullMarked
        public Builder afterCommitListener(Consumer<List<Event>> afterCommitListener) {
            this.afterCommitListener = afterCommitListener;
            return this;
        }

        /**
         * @param transactionTimeout The default deadline of an append or read transaction. Rounded up to whole seconds.
         * @return The builder instance
         */
        @NullMarked
        public Builder transactionTimeout(Duration transactionTimeout) {
            this.transactionTimeout = transactionTimeout;
            return this;
        }

        /**
         * @param uncheckedAppendRetryStrategy How to retry an append with {@code ExpectedVersion.any()} that lost a race to a peer.
         * @return The builder instance
         */
        @NullMarked
        public Builder uncheckedAppendRetryStrategy(RetryStrategy uncheckedAppendRetryStrategy) {
            this.uncheckedAppendRetryStrategy = uncheckedAppendRetryStrategy;
            return this;
        }

        @NullMarked
        public JdbcEventStoreConfig build() {
            return new JdbcEventStoreConfig(dialect, objectMapper, clock, afterCommitListener, transactionTimeout, uncheckedAppendRetryStrategy);
        }
    }
}
