package com.example.evaluator.model;

import java.util.List;
import java.util.Optional;

/**
 * What {@code process} returns for every case, whatever happened to its tasks.
 *
 * @param caseId             the case
 * @param status             COMPLETE or PARTIAL
 * @param results            current result of every task that has one, in stage order
 * @param issues             degraded, failed and skipped tasks with their reasons
 * @param validationAttempts number of rejected checkpoint rounds in this run
 * @param elapsedMillis      wall-clock duration of the run
 * @param notScheduled       tasks left out of this run that have no result yet
 */
public record CaseOutcome(
        String caseId,
        CaseStatus status,
        List<TaskResult> results,
        List<TaskIssue> issues,
        int validationAttempts,
        long elapsedMillis,
        List<String> notScheduled
) {
    public CaseOutcome {
        results = List.copyOf(results);
        issues = List.copyOf(issues);
        notScheduled = notScheduled == null ? List.of() : List.copyOf(notScheduled);
    }

    public CaseOutcome(String caseId, CaseStatus status, List<TaskResult> results, List<TaskIssue> issues,
                       int validationAttempts, long elapsedMillis) {
        this(caseId, status, results, issues, validationAttempts, elapsedMillis, List.of());
    }

    public Optional<TaskResult> result(String taskName) {
        return results.stream().filter(r -> r.taskName().equals(taskName)).findFirst();
    }

    public List<String> tasksWithStatus(TaskStatus status) {
        return issues.stream()
                .filter(i -> i.status() == status)
                .map(TaskIssue::taskName)
                .toList();
    }
}
