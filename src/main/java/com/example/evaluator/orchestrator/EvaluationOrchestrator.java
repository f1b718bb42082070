package com.example.evaluator.orchestrator;

import com.example.evaluator.config.EvaluationProperties;
import com.example.evaluator.model.AuditEvent;
import com.example.evaluator.model.AuditEventType;
import com.example.evaluator.model.CaseOutcome;
import com.example.evaluator.model.CaseRecord;
import com.example.evaluator.model.CaseStatus;
import com.example.evaluator.model.ProgressEvent;
import com.example.evaluator.model.ProgressState;
import com.example.evaluator.model.TaskIssue;
import com.example.evaluator.model.TaskResult;
import com.example.evaluator.model.TaskStatus;
import com.example.evaluator.repository.AuditLogger;
import com.example.evaluator.repository.PersistenceGateway;
import com.example.evaluator.service.ProgressEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a case through the stage graph.
 * <p>
 * Pipeline, per case:
 * 1. Ensure a durable case record (placeholder with a generated id when none is given)
 * 2. For each stage, in order: run all its tasks concurrently and wait for all of them
 * 3. Each task's result is persisted as soon as it is produced
 * 4. The checkpoint producer runs the validation/remediation loop before its stage settles
 * 5. Persist COMPLETE or PARTIAL
 * <p>
 * A caller may leave tasks out of a run. Such a task keeps its latest persisted result, if it has
 * one, and its dependants see that result; without one it counts as missing.
 * <p>
 * Task failures never escape {@link #process}: they are recorded as FAILED results, dependants
 * that require the output are SKIPPED, dependants that only prefer it are DEGRADED. Only
 * persistence failures are fatal.
 */
@Service
public class EvaluationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);
    private static final String BANNER = "═══════════════════════════════════════════════";

    private final StageGraph graph;
    private final TaskRegistry registry;
    private final TaskInvoker invoker;
    private final ValidationRemediationLoop checkpointLoop;
    private final PersistenceGateway persistence;
    private final AuditLogger audit;
    private final ProgressEmitter progress;
    private final Executor agentExecutor;
    private final EvaluationProperties properties;

    public EvaluationOrchestrator(StageGraph graph,
                                  TaskRegistry registry,
                                  TaskInvoker invoker,
                                  ValidationRemediationLoop checkpointLoop,
                                  PersistenceGateway persistence,
                                  AuditLogger audit,
                                  ProgressEmitter progress,
                                  @Qualifier("agentExecutor") Executor agentExecutor,
                                  EvaluationProperties properties) {
        this.graph = graph;
        this.registry = registry;
        this.invoker = invoker;
        this.checkpointLoop = checkpointLoop;
        this.persistence = persistence;
        this.audit = audit;
        this.progress = progress;
        this.agentExecutor = agentExecutor;
        this.properties = properties;
    }

    /** Per-run, per-case state. Never shared between cases. */
    private static final class Run {
        final CaseRecord caseRecord;
        final boolean resumed;
        final Set<String> excluded;
        final Map<String, TaskResult> results = new ConcurrentHashMap<>();
        final Set<String> executed = ConcurrentHashMap.newKeySet();
        final AtomicInteger validationAttempts = new AtomicInteger();

        Run(CaseRecord caseRecord, boolean resumed, Set<String> excluded) {
            this.caseRecord = caseRecord;
            this.resumed = resumed;
            this.excluded = Set.copyOf(excluded);
        }

        String caseId() {
            return caseRecord.caseId();
        }
    }

    public CaseOutcome process(String caseId, String sourceText) {
        return process(caseId, sourceText, null, Set.of());
    }

    public CaseOutcome process(String caseId, String sourceText, String sourceName) {
        return process(caseId, sourceText, sourceName, Set.of());
    }

    /**
     * Evaluates a case.
     *
     * @param caseId     existing or caller-chosen id; {@code null} to generate one
     * @param sourceText case text; ignored when the case already exists
     * @param sourceName original file name, may be {@code null}
     * @param excluded   tasks not to run this time
     * @return final status and the current result of every task
     * @throws com.example.evaluator.repository.PersistenceUnavailableException if storage fails
     * @throws IllegalArgumentException if a new case has no source text
     */
    public CaseOutcome process(String caseId, String sourceText, String sourceName, Set<String> excluded) {
        long started = System.currentTimeMillis();
        Run run = open(caseId, sourceText, sourceName, excluded);
        MDC.put("caseId", run.caseId());
        try {
            log.info(BANNER);
            log.info("Starting evaluation of case {} ({}){}", run.caseId(), graph.describe(),
                    run.resumed ? " — resuming" : "");
            if (!run.excluded.isEmpty()) {
                log.info("Not scheduled in this run: {}", run.excluded);
            }
            log.info(BANNER);

            List<List<TaskDefinition>> stages = graph.stages();
            for (int i = 0; i < stages.size(); i++) {
                List<TaskDefinition> stage = stages.get(i);
                log.info("[{}/{}] Running {}", i + 1, stages.size(),
                        stage.stream().map(TaskDefinition::name).toList());
                runStage(run, stage);
            }

            CaseStatus status = decideStatus(run);
            persistence.setCaseStatus(run.caseId(), status);
            CaseOutcome outcome = outcome(run, status, System.currentTimeMillis() - started);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("status", status.name());
            payload.put("issues", outcome.issues().stream().map(TaskIssue::taskName).toList());
            payload.put("validationAttempts", outcome.validationAttempts());
            payload.put("elapsedMillis", outcome.elapsedMillis());
            audit.logEvent(run.caseId(), status == CaseStatus.COMPLETE
                    ? AuditEventType.PIPELINE_COMPLETED : AuditEventType.PIPELINE_PARTIAL, payload);
            progress.emit(ProgressEvent.of(run.caseId(), ProgressEvent.PIPELINE,
                    status == CaseStatus.COMPLETE ? ProgressState.CASE_COMPLETE : ProgressState.CASE_PARTIAL));

            log.info(BANNER);
            log.info("Case {} finished {} in {}ms — issues: {}", run.caseId(), status,
                    outcome.elapsedMillis(), outcome.issues());
            log.info(BANNER);
            return outcome;
        } catch (RuntimeException e) {
            log.error("Evaluation of case {} aborted", run.caseId(), e);
            markPartial(run.caseId(), e);
            throw e;
        } finally {
            MDC.remove("caseId");
        }
    }

    private Run open(String caseId, String sourceText, String sourceName, Set<String> excluded) {
        Optional<CaseRecord> existing = caseId == null || caseId.isBlank()
                ? Optional.empty()
                : persistence.findCase(caseId);

        CaseRecord record;
        boolean resumed = existing.isPresent();
        if (resumed) {
            record = existing.get();
            if (sourceText != null && !sourceText.isBlank() && !sourceText.equals(record.sourceText())) {
                log.warn("Case {} already exists; ignoring the new source text", caseId);
            }
        } else {
            if (sourceText == null || sourceText.isBlank()) {
                throw new IllegalArgumentException("A new case needs source text");
            }
            record = persistence.createCase(caseId, sourceText, sourceName);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("generatedId", caseId == null || caseId.isBlank());
            payload.put("sourceLength", sourceText.length());
            if (sourceName != null) payload.put("sourceName", sourceName);
            audit.logEvent(record.caseId(), AuditEventType.CASE_CREATED, payload);
        }

        record = persistence.setCaseStatus(record.caseId(), CaseStatus.IN_PROGRESS);
        audit.logEvent(record.caseId(), AuditEventType.PIPELINE_STARTED,
                Map.of("resumed", resumed, "stages", graph.describe(), "excluded", List.copyOf(excluded)));
        return new Run(record, resumed, excluded);
    }

    /** Fan-out over the stage's tasks, then a barrier on all of them. */
    private void runStage(Run run, List<TaskDefinition> stage) {
        CompletableFuture<?>[] futures = stage.stream()
                .map(def -> CompletableFuture.supplyAsync(() -> runTask(run, def), agentExecutor))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Stage failed", cause);
        }
    }

    private TaskResult runTask(Run run, TaskDefinition def) {
        String caseId = run.caseId();
        String name = def.name();

        if (run.excluded.contains(name)) {
            return carryOver(run, def);
        }

        Optional<CheckpointDefinition> checkpoint = graph.checkpoint().filter(cp -> cp.producer().equals(name));
        Optional<TaskResult> reusable = reusable(run, def);
        if (reusable.isPresent()) {
            TaskResult result = reusable.get();
            log.info("{}: reusing persisted revision {} ({})", name, result.revision(), result.status());
            audit.logEvent(caseId, AuditEventType.TASK_REUSED,
                    Map.of("task", name, "revision", result.revision(), "status", result.status().name()));
            progress.emit(ProgressEvent.of(caseId, name, ProgressState.REUSED));
            if (checkpoint.isPresent() && !checkpointResolved(caseId, checkpoint.get(), result)) {
                log.info("{}: revision {} never passed {}, resuming its checkpoint",
                        name, result.revision(), checkpoint.get().validator());
                TaskResult settled = settleCheckpoint(run, checkpoint.get(), result,
                        context(run, def), shortfall(run, def));
                if (settled != result) {
                    run.executed.add(name);
                }
                run.results.put(name, settled);
                return settled;
            }
            run.results.put(name, result);
            return result;
        }
        run.executed.add(name);

        List<String> missingRequired = unusable(run, def.requires());
        if (!missingRequired.isEmpty()) {
            String reason = "required input unavailable: " + String.join(", ", missingRequired);
            TaskResult skipped = persistence.saveResult(TaskResult.skipped(caseId, name, reason));
            log.warn("{}: skipped — {}", name, reason);
            audit.logEvent(caseId, AuditEventType.TASK_SKIPPED, Map.of("task", name, "reason", reason));
            progress.emit(ProgressEvent.of(caseId, name, ProgressState.SKIPPED));
            run.results.put(name, skipped);
            return skipped;
        }

        CaseContext context = context(run, def);
        audit.logEvent(caseId, AuditEventType.TASK_STARTED,
                Map.of("task", name, "stage", graph.stageOf(name) + 1, "inputs", List.copyOf(context.upstream().keySet())));
        progress.emit(ProgressEvent.of(caseId, name, ProgressState.STARTED));

        TaskResult result = invoker.invoke(registry.task(name), context);
        String shortfall = shortfall(run, def);
        if (result.status() == TaskStatus.SUCCESS && shortfall != null) {
            result = result.degrade(shortfall);
        }
        TaskResult stored = persistence.saveResult(result);
        recordCompletion(caseId, stored);

        if (checkpoint.isPresent()) {
            stored = settleCheckpoint(run, checkpoint.get(), stored, context, shortfall);
        }

        run.results.put(name, stored);
        return stored;
    }

    private TaskResult settleCheckpoint(Run run, CheckpointDefinition checkpoint, TaskResult stored,
                                        CaseContext context, String shortfall) {
        ValidationRemediationLoop.CheckpointOutcome outcome = checkpointLoop.validateAndRemediate(
                checkpoint, stored, context, registry.task(checkpoint.producer()),
                registry.validator(checkpoint.validator()), shortfall);
        run.validationAttempts.addAndGet(outcome.attempts());
        if (outcome.result() != stored) {
            recordCompletion(run.caseId(), outcome.result());
        }
        return outcome.result();
    }

    private TaskResult carryOver(Run run, TaskDefinition def) {
        String name = def.name();
        Optional<TaskResult> persisted = persistence.getResult(run.caseId(), name);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task", name);
        persisted.ifPresent(r -> {
            payload.put("revision", r.revision());
            payload.put("status", r.status().name());
            run.results.put(name, r);
        });
        log.info("{}: not scheduled{}", name, persisted
                .map(r -> ", keeping revision " + r.revision() + " (" + r.status() + ")")
                .orElse(", no earlier result"));
        audit.logEvent(run.caseId(), AuditEventType.TASK_NOT_SCHEDULED, payload);
        return persisted.orElse(null);
    }

    private CaseContext context(Run run, TaskDefinition def) {
        Map<String, TaskResult> upstream = new LinkedHashMap<>();
        for (String dep : def.dependencies()) {
            TaskResult r = run.results.get(dep);
            if (r != null) upstream.put(dep, r);
        }
        return new CaseContext(run.caseId(), run.caseRecord.sourceText(), def.dependencies(), upstream);
    }

    /** Why a successful result of this task must be degraded, or {@code null}. */
    private static String shortfall(Run run, TaskDefinition def) {
        List<String> missingPreferred = unusable(run, def.prefers());
        return missingPreferred.isEmpty()
                ? null
                : "preferred input unavailable: " + String.join(", ", missingPreferred);
    }

    /**
     * A persisted usable result is reused on a resumed run unless one of its inputs was
     * recomputed in this run.
     */
    private Optional<TaskResult> reusable(Run run, TaskDefinition def) {
        if (!run.resumed || !properties.resumePersistedResults()) {
            return Optional.empty();
        }
        if (def.dependencies().stream().anyMatch(run.executed::contains)) {
            return Optional.empty();
        }
        return persistence.getResult(run.caseId(), def.name()).filter(r -> r.status().isUsable());
    }

    /** Whether the audit trail shows the checkpoint settling on exactly this revision. */
    private boolean checkpointResolved(String caseId, CheckpointDefinition checkpoint, TaskResult result) {
        try {
            return audit.events(caseId).stream()
                    .filter(e -> e.type() == AuditEventType.CHECKPOINT_RESOLVED)
                    .map(AuditEvent::payload)
                    .anyMatch(p -> checkpoint.producer().equals(p.get("producer"))
                            && p.get("revision") instanceof Number n
                            && n.intValue() == result.revision());
        } catch (RuntimeException e) {
            log.warn("Could not read the audit trail of case {}, re-validating {}: {}",
                    caseId, checkpoint.producer(), e.getMessage());
            return false;
        }
    }

    private static List<String> unusable(Run run, Set<String> names) {
        return names.stream()
                .filter(dep -> {
                    TaskResult r = run.results.get(dep);
                    return r == null || !r.status().isUsable();
                })
                .sorted()
                .toList();
    }

    private void recordCompletion(String caseId, TaskResult result) {
        String name = result.taskName();
        if (result.status() == TaskStatus.FAILED) {
            log.warn("{}: failed — {}", name, result.errorMessage());
            audit.logEvent(caseId, AuditEventType.TASK_FAILED,
                    Map.of("task", name, "error", result.errorMessage(), "revision", result.revision()));
            progress.emit(ProgressEvent.of(caseId, name, ProgressState.FAILED));
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task", name);
        payload.put("status", result.status().name());
        payload.put("confidence", result.confidence().name());
        payload.put("revision", result.revision());
        if (result.note() != null) payload.put("note", result.note());
        log.info("{}: {} (confidence {}, revision {})", name, result.status(), result.confidence(), result.revision());
        audit.logEvent(caseId, AuditEventType.TASK_COMPLETED, payload);
        progress.emit(ProgressEvent.of(caseId, name,
                result.status() == TaskStatus.DEGRADED ? ProgressState.DEGRADED : ProgressState.COMPLETED));
    }

    private CaseStatus decideStatus(Run run) {
        for (TaskDefinition def : graph.tasks()) {
            if (!def.required()) continue;
            TaskResult r = run.results.get(def.name());
            if (r == null || !r.status().isUsable()) {
                return CaseStatus.PARTIAL;
            }
            if (r.status() == TaskStatus.DEGRADED && !properties.degradedCountsAsComplete()) {
                return CaseStatus.PARTIAL;
            }
        }
        return CaseStatus.COMPLETE;
    }

    private CaseOutcome outcome(Run run, CaseStatus status, long elapsedMillis) {
        List<TaskResult> ordered = new ArrayList<>();
        List<TaskIssue> issues = new ArrayList<>();
        for (List<TaskDefinition> stage : graph.stages()) {
            stage.stream()
                    .map(def -> run.results.get(def.name()))
                    .filter(Objects::nonNull)
                    .forEach(r -> {
                        ordered.add(r);
                        if (r.status() != TaskStatus.SUCCESS) {
                            issues.add(new TaskIssue(r.taskName(), r.status(), r.reason()));
                        }
                    });
        }
        List<String> notScheduled = graph.tasks().stream()
                .map(TaskDefinition::name)
                .filter(name -> run.excluded.contains(name) && !run.results.containsKey(name))
                .toList();
        return new CaseOutcome(run.caseId(), status, ordered, issues, run.validationAttempts.get(),
                elapsedMillis, notScheduled);
    }

    private void markPartial(String caseId, RuntimeException failure) {
        try {
            persistence.setCaseStatus(caseId, CaseStatus.PARTIAL);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
            log.warn("Could not mark case {} partial: {}", caseId, e.getMessage());
        }
    }
}
