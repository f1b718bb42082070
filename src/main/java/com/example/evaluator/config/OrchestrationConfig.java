package com.example.evaluator.config;

import com.example.evaluator.agent.CheckpointValidator;
import com.example.evaluator.agent.EvaluationTask;
import com.example.evaluator.orchestrator.StageGraph;
import com.example.evaluator.orchestrator.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the stage graph from {@code evaluation.tasks} and binds it to the task beans.
 * Both fail the application context on a malformed graph.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationConfig.class);

    @Bean
    public StageGraph stageGraph(EvaluationProperties properties) {
        StageGraph graph = StageGraph.of(properties.taskDefinitions(), properties.checkpointDefinition());
        log.info("Stage graph: {}", graph.describe());
        graph.checkpoint().ifPresent(cp -> log.info("Checkpoint: {} validated by {} (max {} remediation attempts)",
                cp.producer(), cp.validator(), cp.maxAttempts()));
        return graph;
    }

    @Bean
    public TaskRegistry taskRegistry(List<EvaluationTask> tasks,
                                     List<CheckpointValidator> validators,
                                     StageGraph stageGraph) {
        return new TaskRegistry(tasks, validators).verifyCovers(stageGraph);
    }
}
