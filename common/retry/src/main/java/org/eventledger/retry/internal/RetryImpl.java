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

package org.eventledger.retry.internal;

import org.eventledger.retry.Backoff;
import org.eventledger.retry.MaxAttempts;
import org.eventledger.retry.RetryInfo;
import org.eventledger.retry.RetryStrategy;
import org.jspecify.annotations.NullMarked;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

import static org.eventledger.retry.MaxAttempts.Infinite.infinite;

@NullMarked
public final class RetryImpl implements RetryStrategy.Retry {
    // @formatter:off
    private static final BiConsumer<RetryInfo, Throwable> NOOP_RETRYABLE_ERROR_LISTENER = (__, ___) -> {};
    // @formatter:on

    final Backoff backoff;
    final MaxAttempts maxAttempts;
    final Predicate<Throwable> retryPredicate;
    final BiConsumer<RetryInfo, Throwable> onRetryableErrorListener;

    private RetryImpl(Backoff backoff, MaxAttempts maxAttempts, Predicate<Throwable> retryPredicate, BiConsumer<RetryInfo, Throwable> onRetryableErrorListener) {
        Objects.requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(maxAttempts, MaxAttempts.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(retryPredicate, "Retry predicate cannot be null");
        Objects.requireNonNull(onRetryableErrorListener, "Retryable error listener cannot be null");
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.retryPredicate = retryPredicate;
        this.onRetryableErrorListener = onRetryableErrorListener;
    }

    public RetryImpl() {
        this(Backoff.none(), infinite(), __ -> true, NOOP_RETRYABLE_ERROR_LISTENER);
    }

    @Override
    public Retry backoff(Backoff backoff) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, onRetryableErrorListener);
    }

    @Override
    public Retry infiniteAttempts() {
        return new RetryImpl(backoff, infinite(), retryPredicate, onRetryableErrorListener);
    }

    @Override
    public Retry maxAttempts(int maxAttempts) {
        return new RetryImpl(backoff, new MaxAttempts.Limit(maxAttempts), retryPredicate, onRetryableErrorListener);
    }

    @Override
    public Retry retryIf(Predicate<Throwable> retryPredicate) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, onRetryableErrorListener);
    }

    @Override
    public Retry onRetryableError(BiConsumer<RetryInfo, Throwable> retryableErrorListener) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, retryableErrorListener);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryImpl that)) return false;
        return Objects.equals(backoff, that.backoff) && Objects.equals(maxAttempts, that.maxAttempts) && Objects.equals(retryPredicate, that.retryPredicate) && Objects.equals(onRetryableErrorListener, that.onRetryableErrorListener);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backoff, maxAttempts, retryPredicate, onRetryableErrorListener);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryImpl.class.getSimpleName() + "[", "]")
                .add("backoff=" + backoff)
                .add("maxAttempts=" + maxAttempts)
                .toString();
    }
}
