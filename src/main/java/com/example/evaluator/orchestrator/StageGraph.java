package com.example.evaluator.orchestrator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Static description of the pipeline: which tasks exist, what each consumes, and the stages
 * they fall into.
 * <p>
 * Stages are derived from the dependency edges: a task belongs to the first stage in which all
 * of its dependencies have already run. Tasks of one stage run concurrently; stages run one
 * after the other. The graph is validated once, at construction.
 */
public final class StageGraph {

    private final Map<String, TaskDefinition> tasks;
    private final List<List<TaskDefinition>> stages;
    private final Map<String, Integer> stageIndex;
    private final CheckpointDefinition checkpoint;

    private StageGraph(Map<String, TaskDefinition> tasks,
                       List<List<TaskDefinition>> stages,
                       CheckpointDefinition checkpoint) {
        this.tasks = tasks;
        this.stages = stages;
        this.checkpoint = checkpoint;
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < stages.size(); i++) {
            for (TaskDefinition def : stages.get(i)) {
                index.put(def.name(), i);
            }
        }
        this.stageIndex = Collections.unmodifiableMap(index);
    }

    /**
     * Builds and validates a graph.
     *
     * @param definitions task nodes, in declaration order (used to order tasks inside a stage)
     * @param checkpoint  optional producer/validator checkpoint, may be {@code null}
     * @throws StageGraphConfigurationException on duplicate or unknown names, self-references or cycles
     */
    public static StageGraph of(Collection<TaskDefinition> definitions, CheckpointDefinition checkpoint) {
        if (definitions == null || definitions.isEmpty()) {
            throw new StageGraphConfigurationException("Stage graph declares no tasks");
        }

        Map<String, TaskDefinition> byName = new LinkedHashMap<>();
        for (TaskDefinition def : definitions) {
            if (def.name() == null || def.name().isBlank()) {
                throw new StageGraphConfigurationException("Task with blank name in stage graph");
            }
            if (byName.put(def.name(), def) != null) {
                throw new StageGraphConfigurationException("Duplicate task '" + def.name() + "'");
            }
        }

        for (TaskDefinition def : byName.values()) {
            for (String dep : def.dependencies()) {
                if (dep.equals(def.name())) {
                    throw new StageGraphConfigurationException("Task '" + def.name() + "' depends on itself");
                }
                if (!byName.containsKey(dep)) {
                    throw new StageGraphConfigurationException(
                            "Task '" + def.name() + "' references unknown task '" + dep + "'");
                }
            }
            if (!Collections.disjoint(def.requires(), def.prefers())) {
                throw new StageGraphConfigurationException(
                        "Task '" + def.name() + "' lists the same dependency as required and preferred");
            }
        }

        if (checkpoint != null) {
            if (!byName.containsKey(checkpoint.producer())) {
                throw new StageGraphConfigurationException(
                        "Checkpoint producer '" + checkpoint.producer() + "' is not a task of the graph");
            }
            if (checkpoint.validator() == null || checkpoint.validator().isBlank()) {
                throw new StageGraphConfigurationException("Checkpoint has no validator");
            }
            if (checkpoint.maxAttempts() < 0) {
                throw new StageGraphConfigurationException(
                        "Checkpoint max-attempts must not be negative, got " + checkpoint.maxAttempts());
            }
        }

        return new StageGraph(Collections.unmodifiableMap(byName), layer(byName), checkpoint);
    }

    /** Kahn's algorithm, one layer at a time. */
    private static List<List<TaskDefinition>> layer(Map<String, TaskDefinition> byName) {
        Map<String, Integer> pending = new LinkedHashMap<>();
        byName.values().forEach(def -> pending.put(def.name(), def.dependencies().size()));

        List<List<TaskDefinition>> layers = new ArrayList<>();
        while (!pending.isEmpty()) {
            List<TaskDefinition> ready = pending.entrySet().stream()
                    .filter(e -> e.getValue() == 0)
                    .map(e -> byName.get(e.getKey()))
                    .toList();
            if (ready.isEmpty()) {
                throw new StageGraphConfigurationException(
                        "Cycle detected among tasks " + pending.keySet().stream().sorted().toList());
            }
            ready.forEach(def -> pending.remove(def.name()));
            for (TaskDefinition waiting : byName.values()) {
                if (!pending.containsKey(waiting.name())) continue;
                long satisfied = ready.stream().filter(r -> waiting.dependencies().contains(r.name())).count();
                pending.computeIfPresent(waiting.name(), (k, v) -> v - (int) satisfied);
            }
            layers.add(List.copyOf(ready));
        }
        return List.copyOf(layers);
    }

    public List<List<TaskDefinition>> stages() {
        return stages;
    }

    public Collection<TaskDefinition> tasks() {
        return tasks.values();
    }

    public Optional<TaskDefinition> task(String name) {
        return Optional.ofNullable(tasks.get(name));
    }

    public int stageOf(String name) {
        Integer index = stageIndex.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Unknown task '" + name + "'");
        }
        return index;
    }

    public Optional<CheckpointDefinition> checkpoint() {
        return Optional.ofNullable(checkpoint);
    }

    /** Tasks that declare {@code name} as a dependency. */
    public List<TaskDefinition> dependents(String name) {
        return tasks.values().stream()
                .filter(def -> def.dependencies().contains(name))
                .sorted(Comparator.comparing(TaskDefinition::name))
                .toList();
    }

    /** Compact layout, e.g. {@code [a] -> [b, c] -> [d]}. */
    public String describe() {
        return stages.stream()
                .map(stage -> stage.stream().map(TaskDefinition::name).collect(Collectors.joining(", ", "[", "]")))
                .collect(Collectors.joining(" -> "));
    }
}
