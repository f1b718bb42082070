package com.example.evaluator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Decision points recorded in the audit trail.
 */
public enum AuditEventType {
    CASE_CREATED("case-created"),
    PIPELINE_STARTED("pipeline-started"),
    TASK_STARTED("task-started"),
    TASK_COMPLETED("task-completed"),
    TASK_FAILED("task-failed"),
    TASK_SKIPPED("task-skipped"),
    TASK_REUSED("task-reused"),
    TASK_NOT_SCHEDULED("task-not-scheduled"),
    VALIDATION_ATTEMPT("validation-attempt"),
    CHECKPOINT_RESOLVED("checkpoint-resolved"),
    PIPELINE_COMPLETED("pipeline-completed"),
    PIPELINE_PARTIAL("pipeline-partial");

    private final String wireName;

    AuditEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
