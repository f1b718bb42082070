package com.example.evaluator.model;

import java.time.Instant;

/**
 * Fire-and-forget progress notification for display layers.
 *
 * @param caseId   case being processed
 * @param taskName task concerned, or {@link #PIPELINE} for case-level events
 * @param state    new state
 * @param at       emission time
 */
public record ProgressEvent(
        String caseId,
        String taskName,
        ProgressState state,
        Instant at
) {
    public static final String PIPELINE = "pipeline";

    public static ProgressEvent of(String caseId, String taskName, ProgressState state) {
        return new ProgressEvent(caseId, taskName, state, Instant.now());
    }

    public boolean isTerminal() {
        return state == ProgressState.CASE_COMPLETE || state == ProgressState.CASE_PARTIAL;
    }
}
