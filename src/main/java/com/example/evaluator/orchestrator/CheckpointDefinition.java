package com.example.evaluator.orchestrator;

/**
 * Producer/validator pair that must agree before the pipeline moves past the producer's stage.
 *
 * @param producer    task whose output is validated and remediated
 * @param validator   name of the {@link com.example.evaluator.agent.CheckpointValidator}
 * @param maxAttempts maximum number of remediation rounds
 */
public record CheckpointDefinition(
        String producer,
        String validator,
        int maxAttempts
) {}
