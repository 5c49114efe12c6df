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
import java.util.Objects;

/**
 * How long to wait between two attempts.
 */
public sealed interface Backoff {

    static Backoff none() {
        return None.INSTANCE;
    }

    static Backoff fixed(long millis) {
        return fixed(Duration.ofMillis(millis));
    }

    static Backoff fixed(Duration duration) {
        return new Fixed(duration);
    }

    static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    /**
     * @param attempt The attempt that just failed, {@code 1} for the first attempt.
     * @return The time to wait before the next attempt.
     */
    Duration delayAfter(int attempt);

    record None() implements Backoff {
        private static final None INSTANCE = new None();

        @Override
        public Duration delayAfter(int attempt) {
            return Duration.ZERO;
        }
    }

    record Fixed(Duration duration) implements Backoff {
        public Fixed {
            Objects.requireNonNull(duration, "Duration cannot be null");
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Duration cannot be negative");
            }
        }

        @Override
        public Duration delayAfter(int attempt) {
            return duration;
        }
    }

    record Exponential(Duration initial, Duration max, double multiplier) implements Backoff {
        public Exponential {
            Objects.requireNonNull(initial, "Initial duration cannot be null");
            Objects.requireNonNull(max, "Max duration cannot be null");
            if (initial.isNegative() || max.isNegative()) {
                throw new IllegalArgumentException("Durations cannot be negative");
            } else if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than or equal to 1");
            }
        }

        @Override
        public Duration delayAfter(int attempt) {
            double millis = initial.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
            return Duration.ofMillis(Math.round(Math.min(max.toMillis(), millis)));
        }
    }
}
