package com.example.evaluator.orchestrator;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Node of the stage graph.
 *
 * @param name     task name; must match a registered {@link com.example.evaluator.agent.EvaluationTask}
 * @param requires tasks whose usable output is mandatory; if one is missing this task is skipped
 * @param prefers  tasks whose output is used when available; if one is missing this task is degraded
 * @param required whether a failure of this task makes the whole case partial
 */
public record TaskDefinition(
        String name,
        Set<String> requires,
        Set<String> prefers,
        boolean required
) {
    public TaskDefinition {
        requires = requires == null ? Set.of() : Set.copyOf(requires);
        prefers = prefers == null ? Set.of() : Set.copyOf(prefers);
    }

    public static TaskDefinition of(String name, Set<String> requires, Set<String> prefers) {
        return new TaskDefinition(name, requires, prefers, true);
    }

    /** All tasks this one consumes, mandatory or not. */
    public Set<String> dependencies() {
        Set<String> all = new LinkedHashSet<>(requires);
        all.addAll(prefers);
        return all;
    }
}
