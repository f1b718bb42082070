package com.example.evaluator.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit record. Never updated or deleted.
 */
@Document(collection = "audit_events")
public record AuditEvent(
        @Id String id,
        String caseId,
        AuditEventType type,
        Map<String, Object> payload,
        Instant timestamp
) {
    public AuditEvent {
        if (id == null) id = UUID.randomUUID().toString();
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (timestamp == null) timestamp = Instant.now();
    }
}
