package com.example.evaluator.repository;

import com.example.evaluator.model.AuditEvent;
import com.example.evaluator.model.AuditEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local audit trail, paired with {@link InMemoryPersistenceGateway}.
 */
public class InMemoryAuditLogger implements AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditLogger.class);

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void logEvent(String caseId, AuditEventType type, Map<String, Object> payload, Instant timestamp) {
        AuditEvent event = new AuditEvent(null, caseId, type, payload, timestamp);
        events.add(event);
        log.debug("audit {} {} {}", caseId, type.wireName(), event.payload());
    }

    @Override
    public List<AuditEvent> events(String caseId) {
        return events.stream().filter(e -> e.caseId().equals(caseId)).toList();
    }

    public List<AuditEvent> events(String caseId, AuditEventType type) {
        return events.stream().filter(e -> e.caseId().equals(caseId) && e.type() == type).toList();
    }
}
