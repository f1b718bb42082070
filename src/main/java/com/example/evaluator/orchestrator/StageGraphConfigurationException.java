package com.example.evaluator.orchestrator;

/**
 * Invalid pipeline configuration (cycle, unknown task, missing capability).
 * Raised while the application context starts, never while a case is processed.
 */
public class StageGraphConfigurationException extends RuntimeException {

    public StageGraphConfigurationException(String message) {
        super(message);
    }
}
