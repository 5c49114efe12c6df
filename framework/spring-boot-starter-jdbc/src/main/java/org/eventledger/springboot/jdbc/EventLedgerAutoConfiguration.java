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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventledger.application.converter.EventConverter;
import org.eventledger.application.service.blocking.ApplicationService;
import org.eventledger.application.service.blocking.generic.GenericApplicationService;
import org.eventledger.eventstore.api.blocking.EventStore;
import org.eventledger.eventstore.jdbc.JdbcEventStore;
import org.eventledger.eventstore.jdbc.JdbcEventStoreConfig;
import org.eventledger.eventstore.jdbc.SqlDialect;
import org.eventledger.retry.RetryStrategy;
import org.eventledger.springboot.jdbc.EventLedgerProperties.EventStoreProperties;
import org.eventledger.springboot.jdbc.EventLedgerProperties.ProjectionProperties;
import org.eventledger.subscription.api.EventPublisher;
import org.eventledger.subscription.api.SubscriptionPositionStorage;
import org.eventledger.subscription.blocking.catchup.CatchupProjectionConfig;
import org.eventledger.subscription.blocking.catchup.CatchupProjectionRunner;
import org.eventledger.subscription.inmemory.InMemoryEventPublisher;
import org.eventledger.subscription.jdbc.JdbcSubscriptionPositionStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.Optional;

/**
 * Spring auto-configuration of the JDBC event store, the in-memory publisher, the subscription position storage,
 * the catch-up projection runner and the application service.
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, JdbcTemplateAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnClass({JdbcEventStore.class, JdbcTemplate.class})
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventLedgerProperties.class)
public class EventLedgerAutoConfiguration<E> {
    private static final Logger log = LoggerFactory.getLogger(EventLedgerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(name = "eventLedgerSchemaInitializer")
    @ConditionalOnProperty(name = "eventledger.event-store.initialize-schema", havingValue = "true", matchIfMissing = true)
    public DataSourceInitializer eventLedgerSchemaInitializer(DataSource dataSource, EventLedgerProperties eventLedgerProperties) {
        SqlDialect dialect = dialect(dataSource, eventLedgerProperties.getEventStore());
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        if (eventLedgerProperties.getEventStore().isEnabled()) {
            populator.addScript(new ClassPathResource(dialect.schemaLocation()));
        }
        if (eventLedgerProperties.getSubscription().isEnabled()) {
            populator.addScript(new ClassPathResource(JdbcSubscriptionPositionStorage.SCHEMA_LOCATION));
        }
        log.info("Initializing event ledger schema using {} dialect", dialect);
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);
        initializer.setDatabasePopulator(populator);
        return initializer;
    }

    @Bean
    @ConditionalOnMissingBean(EventPublisher.class)
    public InMemoryEventPublisher eventLedgerEventPublisher() {
        return new InMemoryEventPublisher();
    }

    @Bean
    @ConditionalOnMissingBean(JdbcEventStoreConfig.class)
    @ConditionalOnProperty(name = "eventledger.event-store.enabled", havingValue = "true", matchIfMissing = true)
    public JdbcEventStoreConfig eventLedgerEventStoreConfig(DataSource dataSource, EventLedgerProperties eventLedgerProperties,
                                                           Optional<ObjectMapper> objectMapper, EventPublisher eventPublisher) {
        EventStoreProperties eventStoreProperties = eventLedgerProperties.getEventStore();
        return new JdbcEventStoreConfig.Builder()
                .dialect(dialect(dataSource, eventStoreProperties))
                .objectMapper(objectMapper.orElseGet(ObjectMapper::new))
                .transactionTimeout(eventStoreProperties.getTransactionTimeout())
                .afterCommitListener(eventPublisher::publish)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    @ConditionalOnProperty(name = "eventledger.event-store.enabled", havingValue = "true", matchIfMissing = true)
    public JdbcEventStore eventLedgerEventStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager, JdbcEventStoreConfig eventStoreConfig) {
        return new JdbcEventStore(jdbcTemplate, transactionManager, eventStoreConfig);
    }

    @Bean
    @ConditionalOnMissingBean(SubscriptionPositionStorage.class)
    @ConditionalOnProperty(name = "eventledger.subscription.enabled", havingValue = "true", matchIfMissing = true)
    public JdbcSubscriptionPositionStorage eventLedgerSubscriptionPositionStorage(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        return new JdbcSubscriptionPositionStorage(jdbcTemplate, transactionManager, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean(CatchupProjectionRunner.class)
    @ConditionalOnBean({EventStore.class, SubscriptionPositionStorage.class})
    @ConditionalOnProperty(name = "eventledger.projection.enabled", havingValue = "true", matchIfMissing = true)
    public CatchupProjectionRunner eventLedgerCatchupProjectionRunner(EventStore eventStore, SubscriptionPositionStorage positionStorage, EventPublisher eventPublisher,
                                                                      EventLedgerProperties eventLedgerProperties, ObjectProvider<ProjectionRegistration> registrations) {
        ProjectionProperties projectionProperties = eventLedgerProperties.getProjection();
        CatchupProjectionConfig config = new CatchupProjectionConfig.Builder()
                .batchSize(projectionProperties.getBatchSize())
                .pollInterval(projectionProperties.getPollInterval())
                .persistPositionEvery(projectionProperties.getPersistPositionEvery())
                .build();
        CatchupProjectionRunner runner = new CatchupProjectionRunner(eventStore, positionStorage, config);
        registrations.orderedStream().forEach(registration -> runner.register(registration.subscriptionId(), registration.eventTypes(), registration.projection()));
        // Committed appends trigger a pass instead of waiting for the next poll
        eventPublisher.subscribeAll(event -> runner.wakeUp());
        return runner;
    }

    @Bean
    @ConditionalOnBean(CatchupProjectionRunner.class)
    CatchupProjectionLifecycle eventLedgerCatchupProjectionLifecycle(CatchupProjectionRunner runner) {
        return new CatchupProjectionLifecycle(runner);
    }

    @Bean
    @ConditionalOnMissingBean(ApplicationService.class)
    @ConditionalOnBean({EventStore.class, EventConverter.class})
    public ApplicationService<E> eventLedgerApplicationService(EventStore eventStore, EventConverter<E> eventConverter, EventLedgerProperties eventLedgerProperties) {
        boolean enableDefaultRetryStrategy = eventLedgerProperties.getApplicationService().isEnableDefaultRetryStrategy();
        return enableDefaultRetryStrategy ? new GenericApplicationService<>(eventStore, eventConverter) : new GenericApplicationService<>(eventStore, eventConverter, RetryStrategy.none());
    }

    private static SqlDialect dialect(DataSource dataSource, EventStoreProperties eventStoreProperties) {
        SqlDialect configured = eventStoreProperties.getDialect();
        return configured == null ? SqlDialect.detect(dataSource) : configured;
    }
}
