package com.accesslist.engine.config;

import com.accesslist.core.model.ConflictRetryPolicy;
import com.accesslist.core.repository.AccessListRepository;
import com.accesslist.engine.coordinator.AccessListCoordinator;
import com.accesslist.engine.metrics.AccessListMetrics;
import com.accesslist.engine.service.AccessListService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Core beans of the access list engine.
 */
@Configuration
@EnableConfigurationProperties(AccessListProperties.class)
public class AccessListConfiguration {

    @Bean
    public Clock accessListClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConflictRetryPolicy conflictRetryPolicy(AccessListProperties properties) {
        return properties.retry().toPolicy();
    }

    /**
     * One transaction per unit of work. In-memory persistence, or a context without a
     * transaction manager, runs units without a transaction.
     */
    @Bean
    public TransactionOperations accessListTransactions(
            AccessListProperties properties,
            ObjectProvider<PlatformTransactionManager> transactionManager) {
        PlatformTransactionManager manager = transactionManager.getIfAvailable();
        if (manager == null || AccessListProperties.MEMORY.equals(properties.persistence())) {
            return TransactionOperations.withoutTransaction();
        }
        return new TransactionTemplate(manager);
    }

    @Bean
    public AccessListService accessListService(
            AccessListRepository repository,
            TransactionOperations accessListTransactions,
            ConflictRetryPolicy conflictRetryPolicy,
            AccessListMetrics accessListMetrics,
            AccessListProperties properties) {
        return new AccessListCoordinator(repository, accessListTransactions, conflictRetryPolicy,
            accessListMetrics, properties.pageSize());
    }
}
