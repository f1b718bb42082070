package com.example.evaluator.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one task for one case. Results are never updated in place: a retry or a
 * remediation produces a new result with a higher {@code revision} that supersedes the previous one.
 *
 * @param id           storage key, {@code caseId:taskName:revision}
 * @param caseId       owning case
 * @param taskName     task that produced the result (its output slot)
 * @param status       outcome of the task
 * @param payload      task-specific structured data (empty when failed or skipped)
 * @param confidence   ordinal confidence
 * @param errorMessage failure reason, present only when {@code status} is FAILED
 * @param note         why the result was skipped or degraded, if it was
 * @param revision     1-based revision within the (case, task) slot, assigned on save
 * @param producedAt   when the result was produced
 */
@Document(collection = "task_results")
public record TaskResult(
        @Id String id,
        String caseId,
        String taskName,
        TaskStatus status,
        Map<String, Object> payload,
        Confidence confidence,
        String errorMessage,
        String note,
        int revision,
        Instant producedAt
) {
    public TaskResult {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (confidence == null) confidence = Confidence.NONE;
        if (status != TaskStatus.FAILED) errorMessage = null;
        if (producedAt == null) producedAt = Instant.now();
        id = caseId + ":" + taskName + ":" + revision;
    }

    public static TaskResult success(String caseId, String taskName, TaskOutput output) {
        return new TaskResult(null, caseId, taskName, TaskStatus.SUCCESS, output.payload(),
                output.confidence(), null, null, 0, Instant.now());
    }

    public static TaskResult failed(String caseId, String taskName, String errorMessage) {
        String message = errorMessage == null || errorMessage.isBlank() ? "unknown error" : errorMessage;
        return new TaskResult(null, caseId, taskName, TaskStatus.FAILED, Map.of(),
                Confidence.NONE, message, null, 0, Instant.now());
    }

    public static TaskResult skipped(String caseId, String taskName, String reason) {
        return new TaskResult(null, caseId, taskName, TaskStatus.SKIPPED, Map.of(),
                Confidence.NONE, null, reason, 0, Instant.now());
    }

    /**
     * Downgrades a usable result: status DEGRADED, confidence capped at LOW. The reason is
     * appended to any earlier one.
     */
    public TaskResult degrade(String reason) {
        String combined = note == null || note.isBlank() ? reason : note + "; " + reason;
        return new TaskResult(null, caseId, taskName, TaskStatus.DEGRADED, payload,
                confidence.atMost(Confidence.LOW), null, combined, 0, Instant.now());
    }

    /** Copy stamped with the revision assigned by the persistence gateway. */
    public TaskResult withRevision(int newRevision) {
        return new TaskResult(null, caseId, taskName, status, payload, confidence,
                errorMessage, note, newRevision, producedAt);
    }

    /** Failure, skip or degradation reason, whichever applies. */
    public String reason() {
        return errorMessage != null ? errorMessage : note;
    }
}
