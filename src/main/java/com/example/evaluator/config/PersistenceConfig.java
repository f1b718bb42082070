package com.example.evaluator.config;

import com.example.evaluator.repository.AuditEventRepository;
import com.example.evaluator.repository.AuditLogger;
import com.example.evaluator.repository.CaseRepository;
import com.example.evaluator.repository.InMemoryAuditLogger;
import com.example.evaluator.repository.InMemoryPersistenceGateway;
import com.example.evaluator.repository.MongoAuditLogger;
import com.example.evaluator.repository.MongoPersistenceGateway;
import com.example.evaluator.repository.PersistenceGateway;
import com.example.evaluator.repository.TaskResultRepository;
import com.example.evaluator.repository.ValidationAttemptRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the storage backend with {@code evaluation.persistence}: {@code mongo} (default) or {@code memory}.
 */
@Configuration
public class PersistenceConfig {

    @Configuration
    @ConditionalOnProperty(name = "evaluation.persistence", havingValue = "mongo", matchIfMissing = true)
    static class Mongo {

        @Bean
        PersistenceGateway persistenceGateway(CaseRepository cases,
                                              TaskResultRepository results,
                                              ValidationAttemptRepository attempts) {
            return new MongoPersistenceGateway(cases, results, attempts);
        }

        @Bean
        AuditLogger auditLogger(AuditEventRepository events) {
            return new MongoAuditLogger(events);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "evaluation.persistence", havingValue = "memory")
    static class InMemory {

        @Bean
        PersistenceGateway persistenceGateway() {
            return new InMemoryPersistenceGateway();
        }

        @Bean
        AuditLogger auditLogger() {
            return new InMemoryAuditLogger();
        }
    }
}
