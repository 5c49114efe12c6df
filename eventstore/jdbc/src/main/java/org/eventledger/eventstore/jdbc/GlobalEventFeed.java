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
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static org.eventledger.eventstore.jdbc.EventRowMapper.EVENT_COLUMNS;

/**
 * Iterates over the events of all streams in global position order, fetching one batch per round-trip. Every batch
 * is a separate query so no connection is held between batches. The feed ends when a batch comes back short.
 */
class GlobalEventFeed implements Iterator<Event> {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final EventRowMapper rowMapper;
    private final String sql;
    private final Set<String> eventTypes;
    private final int batchSize;
    private final Function<RuntimeException, RuntimeException> errorTranslator;

    private long lastGlobalPosition;
    private Iterator<Event> currentBatch = List.<Event>of().iterator();
    private boolean exhausted;

    GlobalEventFeed(NamedParameterJdbcTemplate jdbcTemplate, EventRowMapper rowMapper, Set<String> eventTypes,
                    long afterGlobalPosition, int batchSize, Function<RuntimeException, RuntimeException> errorTranslator) {
        this.jdbcTemplate = jdbcTemplate;
        this.rowMapper = rowMapper;
        this.eventTypes = Set.copyOf(eventTypes);
        this.batchSize = batchSize;
        this.lastGlobalPosition = afterGlobalPosition;
        this.errorTranslator = errorTranslator;
        this.sql = "SELECT " + EVENT_COLUMNS + " FROM events WHERE global_position > :after"
                + (eventTypes.isEmpty() ? "" : " AND event_type IN (:eventTypes)")
                + " ORDER BY global_position LIMIT :limit";
    }

    Stream<Event> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public boolean hasNext() {
        if (currentBatch.hasNext()) {
            return true;
        } else if (exhausted) {
            return false;
        }
        List<Event> batch = fetchNextBatch();
        exhausted = batch.size() < batchSize;
        currentBatch = batch.iterator();
        return currentBatch.hasNext();
    }

    @Override
    public Event next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Event event = currentBatch.next();
        lastGlobalPosition = event.globalPosition();
        return event;
    }

    private List<Event> fetchNextBatch() {
        MapSqlParameterSource parameters = new MapSqlParameterSource()
                .addValue("after", lastGlobalPosition)
                .addValue("limit", batchSize);
        if (!eventTypes.isEmpty()) {
            parameters.addValue("eventTypes", eventTypes);
        }
        try {
            return jdbcTemplate.query(sql, parameters, rowMapper);
        } catch (RuntimeException e) {
            throw errorTranslator.apply(e);
        }
    }
}
