package com.example.evaluator.orchestrator;

import com.example.evaluator.config.EvaluationProperties;
import com.example.evaluator.model.DocumentCategory;
import com.example.evaluator.model.RoutingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which tasks an uploaded document triggers.
 * <p>
 * The upload is classified by keyword score; every category sharing the top score is kept, and
 * an upload with no keyword at all is treated as an application. Only tasks named in the routing
 * table are ever excluded.
 */
@Component
public class DocumentRouter {

    private static final Logger log = LoggerFactory.getLogger(DocumentRouter.class);

    private final EvaluationProperties.Routing routing;
    private final Set<String> routedTasks = new LinkedHashSet<>();

    public DocumentRouter(StageGraph graph, EvaluationProperties properties) {
        this.routing = properties.routing() != null
                ? properties.routing()
                : new EvaluationProperties.Routing(null, null, null, null);
        for (DocumentCategory category : DocumentCategory.values()) {
            routedTasks.addAll(routing.tasksFor(category));
        }
        routedTasks.addAll(routing.finalTasks());
        for (String task : routedTasks) {
            if (graph.task(task).isEmpty()) {
                throw new StageGraphConfigurationException("Routing names unknown task '" + task + "'");
            }
        }
    }

    public Set<DocumentCategory> classify(String fileName, String text) {
        Map<DocumentCategory, Integer> scores = new EnumMap<>(DocumentCategory.class);
        int best = 0;
        for (DocumentCategory category : DocumentCategory.values()) {
            int score = category.score(fileName, text);
            scores.put(category, score);
            best = Math.max(best, score);
        }
        if (best == 0) {
            return EnumSet.of(DocumentCategory.APPLICATION);
        }
        Set<DocumentCategory> categories = EnumSet.noneOf(DocumentCategory.class);
        for (Map.Entry<DocumentCategory, Integer> e : scores.entrySet()) {
            if (e.getValue() == best) {
                categories.add(e.getKey());
            }
        }
        return categories;
    }

    /**
     * @param fileName   original file name, may be {@code null}
     * @param text       upload content
     * @param forceFinal run the final tasks whatever the upload contains
     */
    public RoutingDecision route(String fileName, String text, boolean forceFinal) {
        Set<DocumentCategory> categories = classify(fileName, text);
        Set<String> scheduled = new LinkedHashSet<>();
        for (DocumentCategory category : categories) {
            scheduled.addAll(routing.tasksFor(category));
        }
        if (forceFinal || includesFinal(categories)) {
            scheduled.addAll(routing.finalTasks());
        }
        Set<String> excluded = new LinkedHashSet<>(routedTasks);
        excluded.removeAll(scheduled);

        log.info("Upload '{}' classified as {} — scheduling {}, leaving out {}",
                fileName, categories, scheduled, excluded);
        return new RoutingDecision(categories, scheduled, excluded);
    }

    /** Tasks that appear anywhere in the routing table. */
    public Set<String> routedTasks() {
        return Set.copyOf(routedTasks);
    }

    /** Categories whose uploads feed the given task. */
    public List<DocumentCategory> categoriesFeeding(String taskName) {
        return EnumSet.allOf(DocumentCategory.class).stream()
                .filter(c -> routing.tasksFor(c).contains(taskName))
                .toList();
    }

    private static boolean includesFinal(Set<DocumentCategory> categories) {
        return categories.contains(DocumentCategory.APPLICATION)
                && (categories.contains(DocumentCategory.TRANSCRIPT)
                || categories.contains(DocumentCategory.RECOMMENDATION));
    }
}
