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

import java.time.Duration;

/**
 * Information about the current attempt of a {@link RetryStrategy}.
 *
 * @param attemptNumber The number of <i>this</i> attempt, {@code 1} if first attempt.
 * @param maxAttempts   The configured max number of attempts.
 * @param backoff       The backoff that preceded this attempt, {@link Duration#ZERO} for the first attempt.
 */
public record RetryInfo(int attemptNumber, MaxAttempts maxAttempts, Duration backoff) {

    public int retryCount() {
        return attemptNumber - 1;
    }

    public boolean isFirstAttempt() {
        return attemptNumber == 1;
    }

    public boolean isLastAttempt() {
        return maxAttempts instanceof MaxAttempts.Limit limit && attemptNumber >= limit.limit();
    }
}
