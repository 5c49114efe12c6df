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

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;

import javax.sql.DataSource;
import java.sql.DatabaseMetaData;
import java.util.Locale;

/**
 * The database specific parts of the event store. Everything else is plain SQL that runs on all supported databases.
 */
public enum SqlDialect {

    /**
     * PostgreSQL 13 or later. Appends to the same stream are serialized with a transaction scoped advisory lock. A
     * second, global, advisory lock is held from the first insert until commit, so global positions are handed out in
     * commit order.
     */
    POSTGRESQL("schema-postgresql.sql", "global_position", "?::jsonb", "?::uuid") {
        @Override
        void lockStream(JdbcTemplate jdbcTemplate, String streamId) {
            jdbcTemplate.query("SELECT pg_advisory_xact_lock(hashtextextended(?, 0))", rs -> null, streamId);
        }

        @Override
        void lockGlobalPositions(JdbcTemplate jdbcTemplate) {
            // the two-key form doesn't share key space with the stream locks
            jdbcTemplate.query("SELECT pg_advisory_xact_lock(hashtext('eventledger.global_position'), 0)", rs -> null);
        }
    },

    /**
     * H2 2.x, preferably in PostgreSQL compatibility mode. Mostly used for tests. Racing appends to the same stream
     * are detected by the unique constraint on stream id and version. Global positions are handed out in commit order
     * by locking the single row of {@code events_position_lock}.
     */
    H2("schema-h2.sql", "GLOBAL_POSITION", "?", "CAST(? AS UUID)") {
        @Override
        void lockStream(JdbcTemplate jdbcTemplate, String streamId) {
            // H2 has no advisory locks
        }

        @Override
        void lockGlobalPositions(JdbcTemplate jdbcTemplate) {
            jdbcTemplate.query("SELECT id FROM events_position_lock WHERE id = 1 FOR UPDATE", rs -> null);
        }
    };

    private static final String SCHEMA_LOCATION = "org/eventledger/eventstore/jdbc/";

    private final String schemaScript;
    private final String generatedKeyColumn;
    private final String jsonParameter;
    private final String uuidParameter;

    SqlDialect(String schemaScript, String generatedKeyColumn, String jsonParameter, String uuidParameter) {
        this.schemaScript = schemaScript;
        this.generatedKeyColumn = generatedKeyColumn;
        this.jsonParameter = jsonParameter;
        this.uuidParameter = uuidParameter;
    }

    abstract void lockStream(JdbcTemplate jdbcTemplate, String streamId);

    /**
     * Block until no other transaction can insert events, and keep it that way until the current transaction ends.
     * A reader of the global feed can then never see a global position while a lower one is still uncommitted.
     */
    abstract void lockGlobalPositions(JdbcTemplate jdbcTemplate);

    /**
     * @return The classpath location of the script that creates the {@code events} table and its indices
     */
    public String schemaLocation() {
        return SCHEMA_LOCATION + schemaScript;
    }

    String generatedKeyColumn() {
        return generatedKeyColumn;
    }

    String jsonParameter() {
        return jsonParameter;
    }

    String uuidParameter() {
        return uuidParameter;
    }

    /**
     * Detect the dialect from the database product name reported by the {@code dataSource}.
     *
     * @throws IllegalArgumentException if the database is not supported
     */
    public static SqlDialect detect(DataSource dataSource) {
        final String productName;
        try {
            productName = JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getDatabaseProductName);
        } catch (MetaDataAccessException e) {
            throw new IllegalStateException("Failed to detect the database product name", e);
        }
        return fromProductName(productName);
    }

    static SqlDialect fromProductName(String productName) {
        String name = productName == null ? "" : productName.toLowerCase(Locale.ROOT);
        if (name.contains("postgres")) {
            return POSTGRESQL;
        } else if (name.equals("h2")) {
            return H2;
        }
        throw new IllegalArgumentException("Unsupported database: " + productName + ", supported databases are PostgreSQL and H2");
    }
}
