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

package org.eventledger.eventstore.api;

import static org.eventledger.eventstore.api.StreamVersion.NO_STREAM;

/**
 * The version a stream is expected to be at when appending events to it. If the expectation isn't met the events
 * are not written and a {@link ConcurrencyConflictException} is thrown.
 */
public sealed interface ExpectedVersion {

    /**
     * Skip the version check (unconditional append). New events are appended after the current head of the stream.
     */
    static ExpectedVersion any() {
        return Any.INSTANCE;
    }

    /**
     * The current version of the stream must be equal to {@code version}.
     *
     * @param version The expected version, {@code 0} or greater.
     */
    static ExpectedVersion exactly(long version) {
        return new Exactly(version);
    }

    /**
     * The stream must not contain any events.
     */
    static ExpectedVersion noStream() {
        return NoStream.INSTANCE;
    }

    /**
     * Create an {@code ExpectedVersion} from a version previously returned by the event store, i.e. {@link StreamVersion#NO_STREAM}
     * is mapped to {@link #noStream()}.
     */
    static ExpectedVersion of(long currentVersion) {
        return currentVersion == NO_STREAM ? noStream() : exactly(currentVersion);
    }

    boolean isSatisfiedBy(long currentVersion);

    default boolean isAny() {
        return this instanceof Any;
    }

    record Any() implements ExpectedVersion {
        private static final Any INSTANCE = new Any();

        @Override
        public boolean isSatisfiedBy(long currentVersion) {
            return true;
        }

        @Override
        public String toString() {
            return "any";
        }
    }

    record Exactly(long version) implements ExpectedVersion {
        public Exactly {
            if (version < 0) {
                throw new IllegalArgumentException("Expected version must be greater than or equal to 0, was " + version);
            }
        }

        @Override
        public boolean isSatisfiedBy(long currentVersion) {
            return currentVersion == version;
        }

        @Override
        public String toString() {
            return String.valueOf(version);
        }
    }

    record NoStream() implements ExpectedVersion {
        private static final NoStream INSTANCE = new NoStream();

        @Override
        public boolean isSatisfiedBy(long currentVersion) {
            return currentVersion == NO_STREAM;
        }

        @Override
        public String toString() {
            return "no stream";
        }
    }
}
