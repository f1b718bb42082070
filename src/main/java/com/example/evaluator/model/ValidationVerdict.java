package com.example.evaluator.model;

public enum ValidationVerdict {
    ACCEPTED,
    NEEDS_REMEDIATION
}
