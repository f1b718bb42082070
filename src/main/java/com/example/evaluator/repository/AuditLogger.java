package com.example.evaluator.repository;

import com.example.evaluator.model.AuditEvent;
import com.example.evaluator.model.AuditEventType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only sink for pipeline decision points.
 */
public interface AuditLogger {

    void logEvent(String caseId, AuditEventType type, Map<String, Object> payload, Instant timestamp);

    default void logEvent(String caseId, AuditEventType type, Map<String, Object> payload) {
        logEvent(caseId, type, payload, Instant.now());
    }

    /** Events of a case in the order they were logged. */
    List<AuditEvent> events(String caseId);
}
