package com.example.evaluator.model;

import java.util.List;

/**
 * Structured feedback from a checkpoint validator, handed back to the producer on the next attempt.
 *
 * @param missingFields    payload fields that were absent or blank
 * @param inconsistencies  human-readable mismatches against upstream data
 * @param instructions     targeted instruction for the producer
 */
public record RemediationHint(
        List<String> missingFields,
        List<String> inconsistencies,
        String instructions
) {
    public RemediationHint {
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
        inconsistencies = inconsistencies == null ? List.of() : List.copyOf(inconsistencies);
    }

    public boolean isEmpty() {
        return missingFields.isEmpty() && inconsistencies.isEmpty();
    }
}
