package com.example.evaluator.model;

/**
 * A task that did not end in plain success, and why.
 */
public record TaskIssue(
        String taskName,
        TaskStatus status,
        String reason
) {}
