package com.example.evaluator.agent;

import com.example.evaluator.model.TaskResult;
import com.example.evaluator.model.ValidationDecision;
import com.example.evaluator.orchestrator.CaseContext;

/**
 * Consumer-side check on a producer task's output at a checkpoint.
 */
public interface CheckpointValidator {

    String name();

    /**
     * @param context        the producer's context (source text and the producer's upstream results)
     * @param producerResult the producer's current, usable result
     * @return accepted, or needs-remediation with a hint describing what to fix
     */
    ValidationDecision validate(CaseContext context, TaskResult producerResult);
}
