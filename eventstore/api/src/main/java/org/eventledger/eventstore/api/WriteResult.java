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

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * The result of an append to the event store.
 */
public class WriteResult {

    private final String streamId;
    private final long oldStreamVersion;
    private final List<Long> streamVersions;
    private final List<Long> globalPositions;

    public WriteResult(String streamId, long oldStreamVersion, List<Long> streamVersions, List<Long> globalPositions) {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        Objects.requireNonNull(streamVersions, "Stream versions cannot be null");
        Objects.requireNonNull(globalPositions, "Global positions cannot be null");
        if (streamVersions.size() != globalPositions.size()) {
            throw new IllegalArgumentException("Every appended event must have both a stream version and a global position");
        }
        this.streamId = streamId;
        this.oldStreamVersion = oldStreamVersion;
        this.streamVersions = List.copyOf(streamVersions);
        this.globalPositions = List.copyOf(globalPositions);
    }

    /**
     * The result of appending an empty list of events, the stream is left untouched.
     */
    public static WriteResult nothingWritten(String streamId, long currentStreamVersion) {
        return new WriteResult(streamId, currentStreamVersion, List.of(), List.of());
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * @return The version of the stream before the append, {@link StreamVersion#NO_STREAM} if the stream didn't exist.
     */
    public long getOldStreamVersion() {
        return oldStreamVersion;
    }

    /**
     * @return The version of the stream after the append.
     */
    public long getNewStreamVersion() {
        return streamVersions.isEmpty() ? oldStreamVersion : streamVersions.get(streamVersions.size() - 1);
    }

    /**
     * @return The stream versions assigned to the appended events, in append order.
     */
    public List<Long> getStreamVersions() {
        return streamVersions;
    }

    /**
     * @return The global positions assigned to the appended events, in append order.
     */
    public List<Long> getGlobalPositions() {
        return globalPositions;
    }

    public boolean isEmpty() {
        return streamVersions.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WriteResult)) return false;
        WriteResult that = (WriteResult) o;
        return oldStreamVersion == that.oldStreamVersion && Objects.equals(streamId, that.streamId) && Objects.equals(streamVersions, that.streamVersions) && Objects.equals(globalPositions, that.globalPositions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, oldStreamVersion, streamVersions, globalPositions);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", WriteResult.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("oldStreamVersion=" + oldStreamVersion)
                .add("newStreamVersion=" + getNewStreamVersion())
                .add("globalPositions=" + globalPositions)
                .toString();
    }
}
