package com.example.evaluator.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * One rejected round of the checkpoint loop. Written when the validator asks the producer
 * for remediation; an accepted output produces no record.
 *
 * @param id              storage key
 * @param caseId          owning case
 * @param producer        task whose output was validated
 * @param validator       validator that rejected it
 * @param attemptNumber   1..maxAttempts
 * @param producerOutput  the rejected payload
 * @param verdict         validator verdict
 * @param remediationHint feedback passed to the next producer run
 * @param recordedAt      when the attempt was recorded
 */
@Document(collection = "validation_attempts")
public record ValidationAttempt(
        @Id String id,
        String caseId,
        String producer,
        String validator,
        int attemptNumber,
        Map<String, Object> producerOutput,
        ValidationVerdict verdict,
        RemediationHint remediationHint,
        Instant recordedAt
) {
    public ValidationAttempt {
        if (recordedAt == null) recordedAt = Instant.now();
        if (id == null) id = caseId + ":" + producer + ":" + attemptNumber + ":" + recordedAt.toEpochMilli();
    }
}
