package com.example.evaluator.model;

/**
 * Lifecycle of a case: {@code PENDING -> IN_PROGRESS -> COMPLETE | PARTIAL}.
 */
public enum CaseStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETE,
    PARTIAL;

    public boolean isTerminal() {
        return this == COMPLETE || this == PARTIAL;
    }
}
