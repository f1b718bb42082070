package com.example.evaluator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw output of a task capability, before the orchestrator wraps it into a {@link TaskResult}.
 *
 * @param payload    task-specific structured data
 * @param confidence how much the task trusts its own output
 */
public record TaskOutput(
        Map<String, Object> payload,
        Confidence confidence
) {
    public TaskOutput {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (confidence == null) confidence = Confidence.LOW;
    }
}
