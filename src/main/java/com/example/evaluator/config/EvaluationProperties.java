package com.example.evaluator.config;

import com.example.evaluator.model.DocumentCategory;
import com.example.evaluator.orchestrator.CheckpointDefinition;
import com.example.evaluator.orchestrator.TaskDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Configuration of the evaluation pipeline.
 *
 * @param tasks                    stage graph nodes
 * @param checkpoint               producer/validator checkpoint, optional
 * @param taskTimeout              per-call timeout of a task capability
 * @param degradedCountsAsComplete whether a DEGRADED required task still allows COMPLETE
 * @param resumePersistedResults   whether a re-run reuses persisted usable results
 * @param persistence              {@code mongo} or {@code memory}
 * @param routing                  which tasks an upload triggers, optional
 */
@ConfigurationProperties(prefix = "evaluation")
public record EvaluationProperties(
        List<Task> tasks,
        Checkpoint checkpoint,
        Duration taskTimeout,
        Boolean degradedCountsAsComplete,
        Boolean resumePersistedResults,
        String persistence,
        Routing routing
) {

    public EvaluationProperties {
        if (tasks == null) tasks = List.of();
        if (taskTimeout == null) taskTimeout = Duration.ofSeconds(90);
        if (degradedCountsAsComplete == null) degradedCountsAsComplete = Boolean.TRUE;
        if (resumePersistedResults == null) resumePersistedResults = Boolean.TRUE;
        if (persistence == null || persistence.isBlank()) persistence = "mongo";
    }

    /**
     * One stage graph node.
     *
     * @param name     task name
     * @param requires mandatory upstream tasks
     * @param prefers  optional upstream tasks
     * @param required whether this task's failure makes the case partial (default true)
     */
    public record Task(String name, List<String> requires, List<String> prefers, Boolean required) {

        public TaskDefinition toDefinition() {
            return new TaskDefinition(name,
                    requires == null ? null : new LinkedHashSet<>(requires),
                    prefers == null ? null : new LinkedHashSet<>(prefers),
                    required == null || required);
        }
    }

    /**
     * @param producer       producer task
     * @param validator      validator name
     * @param maxAttempts    remediation bound (default 2)
     * @param requiredFields payload fields the validator insists on
     */
    public record Checkpoint(String producer, String validator, Integer maxAttempts, List<String> requiredFields) {

        public Checkpoint {
            if (maxAttempts == null) maxAttempts = 2;
            if (requiredFields == null) requiredFields = List.of();
        }

        public CheckpointDefinition toDefinition() {
            return new CheckpointDefinition(producer, validator, maxAttempts);
        }
    }

    /**
     * Upload routing. Each category lists the tasks an upload of that kind triggers; the final
     * tasks run only when an upload combines an application with grades or letters, or when
     * forced. Tasks named nowhere here always run.
     */
    public record Routing(List<String> application,
                          List<String> transcript,
                          List<String> recommendation,
                          List<String> finalTasks) {

        public Routing {
            application = application == null ? List.of() : List.copyOf(application);
            transcript = transcript == null ? List.of() : List.copyOf(transcript);
            recommendation = recommendation == null ? List.of() : List.copyOf(recommendation);
            finalTasks = finalTasks == null ? List.of() : List.copyOf(finalTasks);
        }

        public List<String> tasksFor(DocumentCategory category) {
            return switch (category) {
                case APPLICATION -> application;
                case TRANSCRIPT -> transcript;
                case RECOMMENDATION -> recommendation;
            };
        }
    }

    public List<TaskDefinition> taskDefinitions() {
        return tasks.stream().map(Task::toDefinition).toList();
    }

    public CheckpointDefinition checkpointDefinition() {
        return checkpoint == null ? null : checkpoint.toDefinition();
    }
}
