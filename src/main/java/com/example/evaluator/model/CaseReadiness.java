package com.example.evaluator.model;

import java.util.List;

/**
 * What is available for a case and what should be uploaded next.
 *
 * @param caseId             the case
 * @param tasks              readiness of every task, in stage order
 * @param readyCount         tasks that are ready
 * @param totalCount         all tasks
 * @param percentage         {@code readyCount} as a percentage of {@code totalCount}
 * @param overallStatus      {@code ready}, {@code partial} or {@code not_ready}
 * @param missingInformation distinct documents still missing
 * @param canProceed         whether enough tasks are ready for a useful evaluation
 * @param recommendation     what to upload next
 */
public record CaseReadiness(
        String caseId,
        List<TaskReadiness> tasks,
        int readyCount,
        int totalCount,
        int percentage,
        String overallStatus,
        List<String> missingInformation,
        boolean canProceed,
        String recommendation
) {
    public CaseReadiness {
        tasks = List.copyOf(tasks);
        missingInformation = List.copyOf(missingInformation);
    }
}
