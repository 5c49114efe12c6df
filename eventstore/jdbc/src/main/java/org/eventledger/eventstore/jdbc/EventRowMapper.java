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

import org.eventledger.eventstore.api.Event;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

class EventRowMapper implements RowMapper<Event> {
    static final String EVENT_COLUMNS = "global_position, stream_id, stream_version, event_type, event_data, metadata, tenant_id, created_at";

    private final JsonDocumentCodec codec;

    EventRowMapper(JsonDocumentCodec codec) {
        this.codec = codec;
    }

    @Override
    public Event mapRow(ResultSet rs, int rowNum) throws SQLException {
        UUID tenantId = rs.getObject("tenant_id", UUID.class);
        OffsetDateTime createdAt = rs.getObject("created_at", OffsetDateTime.class);
        return new Event(
                rs.getLong("global_position"),
                rs.getString("stream_id"),
                rs.getLong("stream_version"),
                rs.getString("event_type"),
                codec.deserialize(rs.getString("event_data")),
                codec.deserialize(rs.getString("metadata")),
                tenantId == null ? null : tenantId.toString(),
                createdAt.withOffsetSameInstant(ZoneOffset.UTC));
    }
}
