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

package org.eventledger.subscription.jdbc;

import org.eventledger.subscription.api.SubscriptionPositionStorage;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.support.JdbcTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import static org.eventledger.eventstore.api.internal.EventValidator.validateSubscriptionId;
import static org.eventledger.eventstore.jdbc.StorageErrorTranslator.translate;

/**
 * Stores subscription positions in the {@code event_subscriptions} table. The statements are plain SQL that runs on
 * both PostgreSQL and H2.
 */
@NullMarked
public class JdbcSubscriptionPositionStorage implements SubscriptionPositionStorage {
    public static final String SCHEMA_LOCATION = "org/eventledger/subscription/jdbc/schema.sql";

    private static final Logger log = LoggerFactory.getLogger(JdbcSubscriptionPositionStorage.class);

    private static final String READ_SQL = "SELECT last_position FROM event_subscriptions WHERE subscription_id = ?";
    private static final String ADVANCE_SQL = "UPDATE event_subscriptions SET last_position = ?, updated_at = ? WHERE subscription_id = ? AND last_position < ?";
    private static final String CREATE_SQL = "INSERT INTO event_subscriptions (subscription_id, last_position, updated_at) "
            + "SELECT ?, ?, ? WHERE NOT EXISTS (SELECT 1 FROM event_subscriptions WHERE subscription_id = ?)";
    private static final String DELETE_SQL = "DELETE FROM event_subscriptions WHERE subscription_id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JdbcSubscriptionPositionStorage(DataSource dataSource) {
        this(new JdbcTemplate(dataSource), new JdbcTransactionManager(dataSource), Clock.systemUTC());
    }

    public JdbcSubscriptionPositionStorage(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager, Clock clock) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        this.transactionTemplate = new TransactionTemplate(Objects.requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null"));
        this.clock = Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
    }

    @Override
    public long read(String subscriptionId) {
        validateSubscriptionId(subscriptionId);
        try {
            Long position = jdbcTemplate.query(READ_SQL, rs -> rs.next() ? rs.getLong(1) : 0L, subscriptionId);
            return position == null ? 0L : position;
        } catch (RuntimeException e) {
            throw translate("Read of position of subscription " + subscriptionId, e);
        }
    }

    @Override
    public boolean save(String subscriptionId, long globalPosition) {
        validateSubscriptionId(subscriptionId);
        if (globalPosition < 0) {
            throw new IllegalArgumentException("Global position cannot be negative, was " + globalPosition);
        }
        try {
            return Boolean.TRUE.equals(transactionTemplate.execute(__ -> advanceOrCreate(subscriptionId, globalPosition)));
        } catch (DuplicateKeyException e) {
            // a peer created the row between our insert check and insert
            log.debug("Position of subscription {} was created concurrently, advancing it instead", subscriptionId);
            try {
                return Boolean.TRUE.equals(transactionTemplate.execute(__ -> advance(subscriptionId, globalPosition)));
            } catch (RuntimeException retryException) {
                retryException.addSuppressed(e);
                throw translate("Save of position of subscription " + subscriptionId, retryException);
            }
        } catch (RuntimeException e) {
            throw translate("Save of position of subscription " + subscriptionId, e);
        }
    }

    @Override
    public void delete(String subscriptionId) {
        validateSubscriptionId(subscriptionId);
        try {
            int deleted = jdbcTemplate.update(DELETE_SQL, subscriptionId);
            log.debug("Deleted position of subscription {} ({} row(s))", subscriptionId, deleted);
        } catch (RuntimeException e) {
            throw translate("Delete of position of subscription " + subscriptionId, e);
        }
    }

    @Override
    public boolean exists(String subscriptionId) {
        validateSubscriptionId(subscriptionId);
        try {
            return Boolean.TRUE.equals(jdbcTemplate.query(READ_SQL, (ResultSetExtractor<Boolean>) ResultSet::next, subscriptionId));
        } catch (RuntimeException e) {
            throw translate("Read of position of subscription " + subscriptionId, e);
        }
    }

    private boolean advanceOrCreate(String subscriptionId, long globalPosition) {
        return advance(subscriptionId, globalPosition)
                || jdbcTemplate.update(CREATE_SQL, subscriptionId, globalPosition, now(), subscriptionId) == 1;
    }

    private boolean advance(String subscriptionId, long globalPosition) {
        return jdbcTemplate.update(ADVANCE_SQL, globalPosition, now(), subscriptionId, globalPosition) == 1;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }
}
