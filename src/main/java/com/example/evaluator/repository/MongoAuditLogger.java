package com.example.evaluator.repository;

import com.example.evaluator.model.AuditEvent;
import com.example.evaluator.model.AuditEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Appends audit events to the {@code audit_events} collection and mirrors them to the log.
 * A failed write is logged and does not interrupt the pipeline.
 */
public class MongoAuditLogger implements AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(MongoAuditLogger.class);

    private final AuditEventRepository repository;

    public MongoAuditLogger(AuditEventRepository repository) {
        this.repository = repository;
    }

    @Override
    public void logEvent(String caseId, AuditEventType type, Map<String, Object> payload, Instant timestamp) {
        AuditEvent event = new AuditEvent(null, caseId, type, payload, timestamp);
        log.debug("audit {} {} {}", caseId, type.wireName(), event.payload());
        try {
            repository.insert(event);
        } catch (DataAccessException e) {
            log.warn("Audit write failed for case {} ({}): {}", caseId, type.wireName(), e.getMessage());
        }
    }

    @Override
    public List<AuditEvent> events(String caseId) {
        try {
            return repository.findByCaseIdOrderByTimestampAsc(caseId);
        } catch (DataAccessException e) {
            throw new PersistenceUnavailableException("MongoDB unavailable, could not read audit trail of " + caseId, e);
        }
    }
}
