package com.example.evaluator.model;

/**
 * Outcome of a single task for a single case.
 */
public enum TaskStatus {
    SUCCESS,
    FAILED,
    SKIPPED,
    DEGRADED;

    /** Whether downstream tasks may consume this result as real data. */
    public boolean isUsable() {
        return this == SUCCESS || this == DEGRADED;
    }
}
