package com.example.evaluator.model;

public enum ProgressState {
    STARTED,
    COMPLETED,
    DEGRADED,
    FAILED,
    SKIPPED,
    REUSED,
    REMEDIATING,
    CASE_COMPLETE,
    CASE_PARTIAL
}
