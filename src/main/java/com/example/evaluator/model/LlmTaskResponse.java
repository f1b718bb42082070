package com.example.evaluator.model;

import java.util.Map;

/**
 * Structured response expected from every LLM-backed task.
 *
 * @param fields     task-specific extracted or computed fields
 * @param summary    short human-readable summary
 * @param confidence one of none, low, medium, high, very-high
 */
public record LlmTaskResponse(
        Map<String, Object> fields,
        String summary,
        String confidence
) {}
