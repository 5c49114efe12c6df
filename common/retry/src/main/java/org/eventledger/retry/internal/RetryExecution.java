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

import org.eventledger.retry.MaxAttempts;
import org.eventledger.retry.RetryInfo;
import org.eventledger.retry.RetryStrategy;
import org.eventledger.retry.RetryStrategy.DontRetry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

public class RetryExecution {

    public static <T> T executeWithRetry(Function<RetryInfo, T> fn, RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return fn.apply(new RetryInfo(1, new MaxAttempts.Limit(1), Duration.ZERO));
        } else if (!(retryStrategy instanceof RetryImpl retry)) {
            throw new IllegalArgumentException("Unsupported retry strategy: " + retryStrategy.getClass().getName());
        } else {
            return executeWithRetry(fn, retry);
        }
    }

    private static <T> T executeWithRetry(Function<RetryInfo, T> fn, RetryImpl retry) {
        int attempt = 1;
        Duration previousBackoff = Duration.ZERO;
        for (; ; ) {
            RetryInfo retryInfo = new RetryInfo(attempt, retry.maxAttempts, previousBackoff);
            try {
                return fn.apply(retryInfo);
            } catch (Throwable e) {
                if (isExhausted(attempt, retry.maxAttempts) || !retry.retryPredicate.test(e)) {
                    return SafeExceptionRethrower.safeRethrow(e);
                }
                retry.onRetryableErrorListener.accept(retryInfo, e);

                Duration backoff = retry.backoff.delayAfter(attempt);
                sleep(backoff, e);
                previousBackoff = backoff;
                attempt++;
            }
        }
    }

    private static void sleep(Duration backoff, Throwable cause) {
        long millis = backoff.toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            SafeExceptionRethrower.safeRethrow(cause);
        }
    }

    private static boolean isExhausted(int attempt, MaxAttempts maxAttempts) {
        if (maxAttempts instanceof MaxAttempts.Infinite) {
            return false;
        }
        return attempt >= ((MaxAttempts.Limit) maxAttempts).limit();
    }
}
