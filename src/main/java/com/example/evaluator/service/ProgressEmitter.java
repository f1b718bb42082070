package com.example.evaluator.service;

import com.example.evaluator.model.ProgressEvent;

/**
 * Outbound stream of progress events for display layers.
 * Implementations must return immediately whether or not anyone is listening.
 */
@FunctionalInterface
public interface ProgressEmitter {

    void emit(ProgressEvent event);

    static ProgressEmitter noop() {
        return event -> { };
    }
}
