package com.example.evaluator.agent;

import com.example.evaluator.model.TaskOutput;
import com.example.evaluator.orchestrator.CaseContext;

/**
 * A single analysis capability. Implementations only read the source text and the upstream
 * results carried by the context, and only produce their own output.
 * <p>
 * Transient failures are retried inside the implementation; whatever it still throws is
 * recorded by the orchestrator as a failed result.
 */
public interface EvaluationTask {

    /** Task name, as referenced by the stage graph configuration. */
    String name();

    TaskOutput run(CaseContext context);
}
