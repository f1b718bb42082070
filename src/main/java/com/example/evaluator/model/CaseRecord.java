package com.example.evaluator.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Durable case record. {@code sourceText} is fixed once the case exists;
 * only the orchestrator changes {@code status}.
 *
 * @param caseId     stable identifier
 * @param sourceText raw text of the case documents
 * @param sourceName original file name, when the case came from an upload
 * @param status     lifecycle status
 * @param createdAt  creation time
 * @param updatedAt  time of the last status change
 */
@Document(collection = "cases")
public record CaseRecord(
        @Id String caseId,
        String sourceText,
        String sourceName,
        CaseStatus status,
        Instant createdAt,
        Instant updatedAt
) {
    public static CaseRecord placeholder(String caseId, String sourceText, String sourceName) {
        Instant now = Instant.now();
        return new CaseRecord(caseId, sourceText, sourceName, CaseStatus.PENDING, now, now);
    }

    public CaseRecord withStatus(CaseStatus newStatus) {
        return new CaseRecord(caseId, sourceText, sourceName, newStatus, createdAt, Instant.now());
    }
}
