package com.example.evaluator.service;

import com.example.evaluator.model.CaseReadiness;
import com.example.evaluator.model.CaseRecord;
import com.example.evaluator.model.DocumentCategory;
import com.example.evaluator.model.ReadinessState;
import com.example.evaluator.model.TaskReadiness;
import com.example.evaluator.model.TaskResult;
import com.example.evaluator.orchestrator.DocumentRouter;
import com.example.evaluator.orchestrator.StageGraph;
import com.example.evaluator.orchestrator.TaskDefinition;
import com.example.evaluator.repository.PersistenceGateway;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reports, per task, whether a case already has what the task needs and what to upload next.
 * <p>
 * A task with a usable persisted result is ready. A task fed by uploads is ready when the case
 * text shows evidence of one of its document categories. Any other task is ready when all of its
 * required inputs are ready and, if it has preferred inputs, at least one of them is.
 */
@Service
public class CaseReadinessService {

    static final int MIN_READY_TO_PROCEED = 2;

    private final StageGraph graph;
    private final DocumentRouter router;
    private final PersistenceGateway persistence;

    public CaseReadinessService(StageGraph graph, DocumentRouter router, PersistenceGateway persistence) {
        this.graph = graph;
        this.router = router;
        this.persistence = persistence;
    }

    /**
     * @return the readiness report, or empty if the case is unknown
     * @throws com.example.evaluator.repository.PersistenceUnavailableException if storage fails
     */
    public Optional<CaseReadiness> assess(String caseId) {
        Optional<CaseRecord> record = persistence.findCase(caseId);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        String text = record.get().sourceText();

        Map<String, TaskResult> latest = new LinkedHashMap<>();
        for (TaskResult r : persistence.latestResults(caseId)) {
            latest.put(r.taskName(), r);
        }

        Map<String, TaskReadiness> byTask = new LinkedHashMap<>();
        for (List<TaskDefinition> stage : graph.stages()) {
            for (TaskDefinition def : stage) {
                byTask.put(def.name(), assessTask(def, text, latest.get(def.name()), byTask));
            }
        }

        List<TaskReadiness> tasks = List.copyOf(byTask.values());
        int ready = (int) tasks.stream().filter(TaskReadiness::isReady).count();
        int total = tasks.size();
        Set<String> missing = new LinkedHashSet<>();
        tasks.forEach(t -> missing.addAll(t.missing()));

        String overall = ready == total ? "ready" : ready > 0 ? "partial" : "not_ready";
        return Optional.of(new CaseReadiness(caseId, tasks, ready, total,
                total == 0 ? 100 : ready * 100 / total, overall,
                List.copyOf(missing), ready >= MIN_READY_TO_PROCEED, recommendation(missing)));
    }

    private TaskReadiness assessTask(TaskDefinition def, String text, TaskResult persisted,
                                     Map<String, TaskReadiness> upstream) {
        String name = def.name();
        if (persisted != null && persisted.status().isUsable()) {
            return new TaskReadiness(name, ReadinessState.READY, "already_processed", List.of(), List.of());
        }

        List<DocumentCategory> feeding = router.categoriesFeeding(name);
        if (!feeding.isEmpty()) {
            if (feeding.stream().anyMatch(c -> c.foundIn(text))) {
                return new TaskReadiness(name, ReadinessState.READY, "source_text", List.of(), List.of());
            }
            return new TaskReadiness(name, ReadinessState.MISSING_INFO, null,
                    feeding.stream().map(DocumentCategory::missingItem).toList(), List.of());
        }

        List<String> requiredNotReady = notReady(def.requires(), upstream);
        List<String> preferredNotReady = notReady(def.prefers(), upstream);
        boolean somePreferred = def.prefers().isEmpty() || preferredNotReady.size() < def.prefers().size();
        if (requiredNotReady.isEmpty() && somePreferred) {
            return new TaskReadiness(name, ReadinessState.READY,
                    def.dependencies().isEmpty() ? "source_text" : "upstream", List.of(), List.of());
        }
        return new TaskReadiness(name, ReadinessState.WAITING, null, List.of(),
                requiredNotReady.isEmpty() ? preferredNotReady : requiredNotReady);
    }

    private static List<String> notReady(Set<String> names, Map<String, TaskReadiness> upstream) {
        List<String> result = new ArrayList<>();
        for (String dep : names) {
            TaskReadiness r = upstream.get(dep);
            if (r == null || !r.isReady()) {
                result.add(dep);
            }
        }
        result.sort(null);
        return result;
    }

    private static String recommendation(Set<String> missing) {
        if (missing.isEmpty()) {
            return "All required information is available. Ready to process.";
        }
        for (DocumentCategory category : DocumentCategory.UPLOAD_PRIORITY) {
            if (missing.contains(category.missingItem())) {
                return category.uploadHint();
            }
        }
        return "Upload missing documents: " + String.join(", ", missing.stream().limit(2).toList());
    }
}
