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

import org.eventledger.retry.RetryStrategy;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration of a {@link CatchupProjectionRunner}.
 */
@NullMarked
public class CatchupProjectionConfig {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_PERSIST_POSITION_EVERY = 1;

    public final int batchSize;
    public final Duration pollInterval;
    public final int persistPositionEvery;
    public final RetryStrategy retryStrategy;

    private CatchupProjectionConfig(int batchSize, Duration pollInterval, int persistPositionEvery, RetryStrategy retryStrategy) {
        Objects.requireNonNull(pollInterval, "Poll interval cannot be null");
        Objects.requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than 0");
        } else if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        } else if (persistPositionEvery < 1) {
            throw new IllegalArgumentException("persistPositionEvery must be greater than 0");
        }
        this.batchSize = batchSize;
        this.pollInterval = pollInterval;
        this.persistPositionEvery = persistPositionEvery;
        this.retryStrategy = retryStrategy;
    }

    public static CatchupProjectionConfig defaults() {
        return new Builder().build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CatchupProjectionConfig)) return false;
        CatchupProjectionConfig that = (CatchupProjectionConfig) o;
        return batchSize == that.batchSize && persistPositionEvery == that.persistPositionEvery && Objects.equals(pollInterval, that.pollInterval) && Objects.equals(retryStrategy, that.retryStrategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(batchSize, pollInterval, persistPositionEvery, retryStrategy);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CatchupProjectionConfig.class.getSimpleName() + "[", "]")
                .add("batchSize=" + batchSize)
                .add("pollInterval=" + pollInterval)
                .add("persistPositionEvery=" + persistPositionEvery)
                .add("retryStrategy=" + retryStrategy)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private int persistPositionEvery = DEFAULT_PERSIST_POSITION_EVERY;
        private RetryStrategy retryStrategy = RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0).maxAttempts(3);

        /**
         * @param batchSize The number of events to read from the global feed per round-trip
         * @return The builder instance
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * @param pollInterval The delay between two catch-up passes when the runner is started
         * @return The builder instance
         */
        @NullMarked
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * @param persistPositionEvery Store the position after every {@code n} applied events. The position is always stored at the end of a pass.
         * @return The builder instance
         */
        public Builder persistPositionEvery(int persistPositionEvery) {
            this.persistPositionEvery = persistPositionEvery;
            return this;
        }

        /**
         * @param retryStrategy How to retry an event that a projection failed to apply. When retries are exhausted the pass
         *                      stops and the event is retried on the next pass.
         * @return The builder instance
         */
        @NullMarked
        public Builder retryStrategy(RetryStrategy retryStrategy) {
            this.retryStrategy = retryStrategy;
            return this;
        }

        @NullMarked
        public CatchupProjectionConfig build() {
            return new CatchupProjectionConfig(batchSize, pollInterval, persistPositionEvery, retryStrategy);
        }
    }
}
