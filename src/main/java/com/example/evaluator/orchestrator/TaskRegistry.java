package com.example.evaluator.orchestrator;

import com.example.evaluator.agent.CheckpointValidator;
import com.example.evaluator.agent.EvaluationTask;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name-indexed registry of task capabilities and checkpoint validators.
 * Every name the stage graph mentions must resolve here, checked at startup.
 */
public final class TaskRegistry {

    private final Map<String, EvaluationTask> tasks;
    private final Map<String, CheckpointValidator> validators;

    public TaskRegistry(Collection<? extends EvaluationTask> tasks,
                        Collection<? extends CheckpointValidator> validators) {
        Map<String, EvaluationTask> taskMap = new LinkedHashMap<>();
        for (EvaluationTask task : tasks) {
            if (taskMap.put(task.name(), task) != null) {
                throw new StageGraphConfigurationException("Two task capabilities named '" + task.name() + "'");
            }
        }
        Map<String, CheckpointValidator> validatorMap = new LinkedHashMap<>();
        for (CheckpointValidator validator : validators) {
            if (validatorMap.put(validator.name(), validator) != null) {
                throw new StageGraphConfigurationException("Two validators named '" + validator.name() + "'");
            }
        }
        this.tasks = Collections.unmodifiableMap(taskMap);
        this.validators = Collections.unmodifiableMap(validatorMap);
    }

    /**
     * Fails fast if the graph references a task or validator with no registered implementation.
     */
    public TaskRegistry verifyCovers(StageGraph graph) {
        for (TaskDefinition def : graph.tasks()) {
            if (!tasks.containsKey(def.name())) {
                throw new StageGraphConfigurationException(
                        "No task capability registered for '" + def.name() + "'; known: " + tasks.keySet());
            }
        }
        graph.checkpoint().ifPresent(cp -> {
            if (!validators.containsKey(cp.validator())) {
                throw new StageGraphConfigurationException(
                        "No checkpoint validator registered for '" + cp.validator() + "'; known: " + validators.keySet());
            }
        });
        return this;
    }

    public EvaluationTask task(String name) {
        EvaluationTask task = tasks.get(name);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task '" + name + "'");
        }
        return task;
    }

    public CheckpointValidator validator(String name) {
        CheckpointValidator validator = validators.get(name);
        if (validator == null) {
            throw new IllegalArgumentException("Unknown validator '" + name + "'");
        }
        return validator;
    }

    public Set<String> taskNames() {
        return tasks.keySet();
    }
}
