package com.example.evaluator.model;

import java.util.List;

/**
 * Read model of a stored case: record, current task results and the checkpoint history.
 */
public record CaseView(
        CaseRecord caseRecord,
        List<TaskResult> results,
        List<ValidationAttempt> validationAttempts
) {}
