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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The expected version was not fulfilled so the events have not been written to the event store.
 * If an application reads and writes stream A from two different places at the same time, one of them
 * gets this exception. Re-read the stream and retry with the fresh version.
 */
public class ConcurrencyConflictException extends RuntimeException {
    public final String streamId;
    public final ExpectedVersion expectedVersion;
    public final long actualVersion;

    public ConcurrencyConflictException(String streamId, ExpectedVersion expectedVersion, long actualVersion) {
        super(String.format("Concurrency conflict on stream '%s': expected version %s, found %s", streamId, expectedVersion, describe(actualVersion)));
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getStreamId() {
        return streamId;
    }

    public ExpectedVersion getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    private static String describe(long version) {
        return StreamVersion.isNoStream(version) ? "no stream" : String.valueOf(version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConcurrencyConflictException)) return false;
        ConcurrencyConflictException that = (ConcurrencyConflictException) o;
        return actualVersion == that.actualVersion && Objects.equals(streamId, that.streamId) && Objects.equals(expectedVersion, that.expectedVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, expectedVersion, actualVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ConcurrencyConflictException.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("expectedVersion=" + expectedVersion)
                .add("actualVersion=" + actualVersion)
                .toString();
    }
}
