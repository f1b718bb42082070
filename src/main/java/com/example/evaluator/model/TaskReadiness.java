package com.example.evaluator.model;

import java.util.List;

/**
 * Whether one task has what it needs.
 *
 * @param taskName   the task
 * @param state      ready, missing information, or waiting on upstream tasks
 * @param dataSource {@code already_processed}, {@code source_text}, {@code upstream}, or {@code null}
 * @param missing    documents the task still needs
 * @param waitingOn  upstream tasks that are not ready yet
 */
public record TaskReadiness(
        String taskName,
        ReadinessState state,
        String dataSource,
        List<String> missing,
        List<String> waitingOn
) {
    public TaskReadiness {
        missing = List.copyOf(missing);
        waitingOn = List.copyOf(waitingOn);
    }

    public boolean isReady() {
        return state == ReadinessState.READY;
    }
}
