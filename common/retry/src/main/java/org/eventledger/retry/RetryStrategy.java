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

package org.eventledger.retry;

import org.eventledger.retry.internal.RetryImpl;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.eventledger.retry.internal.RetryExecution.executeWithRetry;

/**
 * Retry an operation according to a backoff and a max number of attempts. Instances are immutable, every
 * configuration method returns a new instance.
 * <p>
 * Example, retry a conflicting append at most 5 times:
 * <pre>
 * RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0)
 *              .maxAttempts(5)
 *              .retryIf(ConcurrencyConflictException.class::isInstance)
 *              .execute(() -> eventStore.append(streamId, expectedVersion, events));
 * </pre>
 */
public interface RetryStrategy {

    /**
     * Create a retry strategy that retries every exception, forever, without backoff. Narrow it down using the methods in {@link Retry}.
     *
     * @return A new {@link Retry} instance.
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * @return A retry strategy that doesn't retry at all, the exception is rethrown as is.
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.exponential(initial, max, multiplier))}.
     */
    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return RetryStrategy.retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.fixed(duration))}.
     */
    static Retry fixed(Duration duration) {
        return RetryStrategy.retry().backoff(Backoff.fixed(duration));
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.fixed(millis))}.
     */
    static Retry fixed(long millis) {
        return RetryStrategy.retry().backoff(Backoff.fixed(millis));
    }

    /**
     * Execute a function that receives information about the current attempt. The last exception is rethrown when the
     * strategy is exhausted or when the exception is not retryable.
     */
    default <T> T execute(Function<RetryInfo, T> function) {
        Objects.requireNonNull(function, "Function cannot be null");
        return executeWithRetry(function, this);
    }

    default <T> T execute(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return executeWithRetry(__ -> supplier.get(), this);
    }

    default void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        executeWithRetry(__ -> {
            runnable.run();
            return null;
        }, this);
    }

    /**
     * A retry strategy that doesn't retry at all.
     */
    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    interface Retry extends RetryStrategy {

        /**
         * @return A new instance of {@link Retry} with the supplied backoff.
         */
        Retry backoff(Backoff backoff);

        /**
         * Retry an infinite number of times (this is default).
         */
        Retry infiniteAttempts();

        /**
         * Specify the max number of times the operation is invoked before giving up, including the first attempt.
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Only retry if the predicate matches the thrown exception. Replaces any previous retry predicate.
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Invoked for every exception that will be followed by another attempt, before the backoff.
         */
        Retry onRetryableError(BiConsumer<RetryInfo, Throwable> retryableErrorListener);

        default Retry onRetryableError(Consumer<Throwable> retryableErrorListener) {
            Objects.requireNonNull(retryableErrorListener, "Retryable error listener cannot be null");
            return onRetryableError((__, throwable) -> retryableErrorListener.accept(throwable));
        }
    }
}
