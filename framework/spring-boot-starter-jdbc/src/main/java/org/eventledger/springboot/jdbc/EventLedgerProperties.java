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

package org.eventledger.springboot.jdbc;

import org.eventledger.eventstore.jdbc.JdbcEventStoreConfig;
import org.eventledger.eventstore.jdbc.SqlDialect;
import org.eventledger.subscription.blocking.catchup.CatchupProjectionConfig;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration of the event ledger under the {@code eventledger} prefix.
 */
@ConfigurationProperties(prefix = "eventledger")
public class EventLedgerProperties {

    private EventStoreProperties eventStore = new EventStoreProperties();
    private SubscriptionProperties subscription = new SubscriptionProperties();
    private ProjectionProperties projection = new ProjectionProperties();
    private ApplicationServiceProperties applicationService = new ApplicationServiceProperties();

    public EventStoreProperties getEventStore() {
        return eventStore;
    }

    public void setEventStore(EventStoreProperties eventStore) {
        this.eventStore = eventStore;
    }

    public SubscriptionProperties getSubscription() {
        return subscription;
    }

    public void setSubscription(SubscriptionProperties subscription) {
        this.subscription = subscription;
    }

    public ProjectionProperties getProjection() {
        return projection;
    }

    public void setProjection(ProjectionProperties projection) {
        this.projection = projection;
    }

    public ApplicationServiceProperties getApplicationService() {
        return applicationService;
    }

    public void setApplicationService(ApplicationServiceProperties applicationService) {
        this.applicationService = applicationService;
    }

    public static class EventStoreProperties {

        private boolean enabled = true;

        /**
         * The SQL dialect. Detected from the database metadata when not set.
         */
        private @Nullable SqlDialect dialect;

        /**
         * Create the events and subscriptions tables on startup if they don't exist.
         */
        private boolean initializeSchema = true;

        private Duration transactionTimeout = JdbcEventStoreConfig.DEFAULT_TRANSACTION_TIMEOUT;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public @Nullable SqlDialect getDialect() {
            return dialect;
        }

        public void setDialect(@Nullable SqlDialect dialect) {
            this.dialect = dialect;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }

        public Duration getTransactionTimeout() {
            return transactionTimeout;
        }

        public void setTransactionTimeout(Duration transactionTimeout) {
            this.transactionTimeout = transactionTimeout;
        }
    }

    public static class SubscriptionProperties {

        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class ProjectionProperties {

        private boolean enabled = true;

        private int batchSize = CatchupProjectionConfig.DEFAULT_BATCH_SIZE;

        private Duration pollInterval = CatchupProjectionConfig.DEFAULT_POLL_INTERVAL;

        private int persistPositionEvery = CatchupProjectionConfig.DEFAULT_PERSIST_POSITION_EVERY;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getPersistPositionEvery() {
            return persistPositionEvery;
        }

        public void setPersistPositionEvery(int persistPositionEvery) {
            this.persistPositionEvery = persistPositionEvery;
        }
    }

    public static class ApplicationServiceProperties {

        /**
         * Retry the read-decide-append cycle on concurrency conflicts with exponential backoff.
         */
        private boolean enableDefaultRetryStrategy = true;

        public boolean isEnableDefaultRetryStrategy() {
            return enableDefaultRetryStrategy;
        }

        public void setEnableDefaultRetryStrategy(boolean enableDefaultRetryStrategy) {
            this.enableDefaultRetryStrategy = enableDefaultRetryStrategy;
        }
    }
}
