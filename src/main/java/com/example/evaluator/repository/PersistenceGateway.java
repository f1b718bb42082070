package com.example.evaluator.repository;

import com.example.evaluator.model.CaseRecord;
import com.example.evaluator.model.CaseStatus;
import com.example.evaluator.model.TaskResult;
import com.example.evaluator.model.ValidationAttempt;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of cases, task results and checkpoint attempts.
 * <p>
 * Task results are append-only: {@link #saveResult} always stores a new revision and
 * {@link #getResult} returns the latest one. Implementations report storage failures as
 * {@link PersistenceUnavailableException}.
 */
public interface PersistenceGateway {

    /**
     * Stores a placeholder case record.
     *
     * @param caseId     requested id, or {@code null} to generate one
     * @param sourceText raw case text
     * @param sourceName original file name, may be {@code null}
     * @return the stored record, status PENDING
     */
    CaseRecord createCase(String caseId, String sourceText, String sourceName);

    Optional<CaseRecord> findCase(String caseId);

    CaseRecord setCaseStatus(String caseId, CaseStatus status);

    /**
     * Appends a result to its (case, task) slot.
     *
     * @return the stored result, stamped with its revision
     */
    TaskResult saveResult(TaskResult result);

    /** Current (latest) result for the slot. */
    Optional<TaskResult> getResult(String caseId, String taskName);

    /** Every revision of the slot, oldest first. */
    List<TaskResult> getResultHistory(String caseId, String taskName);

    /** Current result of every slot of the case. */
    List<TaskResult> latestResults(String caseId);

    ValidationAttempt saveValidationAttempt(ValidationAttempt attempt);

    List<ValidationAttempt> validationAttempts(String caseId);

    /** Short label for health output, e.g. {@code mongo} or {@code memory}. */
    String mode();
}
