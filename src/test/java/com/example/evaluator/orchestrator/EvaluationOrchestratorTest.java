package com.example.evaluator.orchestrator;

import com.example.evaluator.config.EvaluationProperties;
import com.example.evaluator.model.AuditEvent;
import com.example.evaluator.model.AuditEventType;
import com.example.evaluator.model.CaseOutcome;
import com.example.evaluator.model.CaseRecord;
import com.example.evaluator.model.CaseStatus;
import com.example.evaluator.model.ProgressEvent;
import com.example.evaluator.model.ProgressState;
import com.example.evaluator.model.TaskResult;
import com.example.evaluator.model.TaskStatus;
import com.example.evaluator.repository.InMemoryAuditLogger;
import com.example.evaluator.repository.InMemoryPersistenceGateway;
import com.example.evaluator.repository.PersistenceUnavailableException;
import com.example.evaluator.service.TaskExecutionMonitor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationOrchestratorTest {

    private static final String CANON = "document_canonicalizer";
    private static final String APPLICATION = "application_reader";
    private static final String GRADES = "grade_reader";
    private static final String SCHOOL = "school_context";
    private static final String RECOMMENDATION = "recommendation_reader";
    private static final String SYNTHESIS = "student_evaluator";
    private static final String REPORT = "report_formatter";
    private static final List<String> STAGE_TWO = List.of(APPLICATION, GRADES, SCHOOL, RECOMMENDATION);

    private ExecutorService executor;
    private InMemoryPersistenceGateway persistence;
    private InMemoryAuditLogger audit;
    private List<ProgressEvent> progress;
    private Map<String, FakeTask> tasks;
    private FakeValidator validator;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        persistence = new InMemoryPersistenceGateway();
        audit = new InMemoryAuditLogger();
        progress = new CopyOnWriteArrayList<>();
        validator = FakeValidator.accepting();
        tasks = new LinkedHashMap<>();
        for (TaskDefinition def : StageGraphTest.catalogue()) {
            tasks.put(def.name(), FakeTask.ok(def.name()));
        }
        tasks.put(SCHOOL, FakeTask.ok(SCHOOL, Map.of("school_name", "Lincoln High", "state_code", "GA")));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private EvaluationOrchestrator orchestrator() {
        return orchestrator(Duration.ofSeconds(5), true, true);
    }

    private EvaluationOrchestrator orchestrator(Duration timeout, boolean degradedCountsAsComplete) {
        return orchestrator(timeout, degradedCountsAsComplete, true);
    }

    private EvaluationOrchestrator orchestrator(Duration timeout, boolean degradedCountsAsComplete, boolean resume) {
        StageGraph graph = StageGraph.of(StageGraphTest.catalogue(),
                new CheckpointDefinition(SCHOOL, FakeValidator.NAME, 2));
        TaskRegistry registry = new TaskRegistry(tasks.values(), List.of(validator)).verifyCovers(graph);
        TaskInvoker invoker = new TaskInvoker(executor, timeout, new TaskExecutionMonitor());
        ValidationRemediationLoop loop = new ValidationRemediationLoop(invoker, persistence, audit, progress::add);
        EvaluationProperties properties = new EvaluationProperties(
                List.of(), null, timeout, degradedCountsAsComplete, resume, "memory", null);
        return new EvaluationOrchestrator(graph, registry, invoker, loop, persistence, audit,
                progress::add, executor, properties);
    }

    private FakeTask task(String name) {
        return tasks.get(name);
    }

    @Test
    void allTasksSucceedingCompletesTheCase() {
        CaseOutcome outcome = orchestrator().process("case-1", "application packet");

        assertThat(outcome.status()).isEqualTo(CaseStatus.COMPLETE);
        assertThat(outcome.issues()).isEmpty();
        assertThat(outcome.validationAttempts()).isZero();
        assertThat(outcome.results()).extracting(TaskResult::taskName).containsExactly(
                CANON, APPLICATION, GRADES, SCHOOL, RECOMMENDATION, SYNTHESIS, REPORT);
        assertThat(outcome.results()).allSatisfy(r -> {
            assertThat(r.status()).isEqualTo(TaskStatus.SUCCESS);
            assertThat(persistence.getResult("case-1", r.taskName())).contains(r);
        });
        assertThat(persistence.findCase("case-1")).get()
                .extracting(CaseRecord::status).isEqualTo(CaseStatus.COMPLETE);
        assertThat(validator.calls).hasValue(1);
    }

    @Test
    void auditTrailIsBracketedByCaseCreationAndCompletion() {
        orchestrator().process("case-1", "application packet");

        List<AuditEvent> events = audit.events("case-1");
        assertThat(events.get(0).type()).isEqualTo(AuditEventType.CASE_CREATED);
        assertThat(events.get(1).type()).isEqualTo(AuditEventType.PIPELINE_STARTED);
        assertThat(events.get(events.size() - 1).type()).isEqualTo(AuditEventType.PIPELINE_COMPLETED);
        assertThat(audit.events("case-1", AuditEventType.TASK_COMPLETED)).hasSize(7);
        assertThat(audit.events("case-1", AuditEventType.CHECKPOINT_RESOLVED)).hasSize(1);

        assertThat(progress.get(progress.size() - 1).state()).isEqualTo(ProgressState.CASE_COMPLETE);
        assertThat(progress).filteredOn(e -> e.state() == ProgressState.STARTED).hasSize(7);
    }

    @Test
    void stagesRunInDependencyOrder() {
        orchestrator().process("case-1", "application packet");

        for (String name : STAGE_TWO) {
            assertThat(task(name).startedNanos).isGreaterThanOrEqualTo(task(CANON).finishedNanos);
            assertThat(task(SYNTHESIS).startedNanos).isGreaterThanOrEqualTo(task(name).finishedNanos);
        }
        assertThat(task(REPORT).startedNanos).isGreaterThanOrEqualTo(task(SYNTHESIS).finishedNanos);
    }

    @Test
    void everyTaskStartsAfterItsDependenciesArePersisted() {
        Map<String, Long> savedNanos = new ConcurrentHashMap<>();
        persistence = new InMemoryPersistenceGateway() {
            @Override
            public TaskResult saveResult(TaskResult result) {
                TaskResult stored = super.saveResult(result);
                savedNanos.put(result.taskName(), System.nanoTime());
                return stored;
            }
        };

        orchestrator().process("case-1", "application packet");

        for (TaskDefinition def : StageGraphTest.catalogue()) {
            for (String dep : def.dependencies()) {
                assertThat(task(def.name()).startedNanos)
                        .as("%s invoked after %s was saved", def.name(), dep)
                        .isGreaterThan(savedNanos.get(dep));
            }
        }
    }

    @Test
    void stageTwoTasksRunConcurrently() {
        for (String name : STAGE_TWO) {
            tasks.put(name, FakeTask.sleeping(name, 400));
        }

        orchestrator().process("case-1", "application packet");

        long lastStart = STAGE_TWO.stream().mapToLong(n -> task(n).startedNanos).max().orElseThrow();
        long firstEnd = STAGE_TWO.stream().mapToLong(n -> task(n).finishedNanos).min().orElseThrow();
        assertThat(lastStart).as("all four were running at the same time").isLessThan(firstEnd);
    }

    @Test
    void tasksSeeOnlyTheirDeclaredDependencies() {
        orchestrator().process("case-1", "application packet");

        assertThat(task(CANON).lastContext().upstream()).isEmpty();
        assertThat(task(APPLICATION).lastContext().upstream()).containsOnlyKeys(CANON);
        assertThat(task(SYNTHESIS).lastContext().upstream()).containsOnlyKeys(STAGE_TWO.toArray(String[]::new));
        assertThat(task(REPORT).lastContext().upstream()).containsOnlyKeys(SYNTHESIS);
        assertThat(task(APPLICATION).lastContext().sourceText()).isEqualTo("application packet");
    }

    @Test
    void failingTaskIsIsolatedAndDegradesItsConsumer() {
        tasks.put(GRADES, FakeTask.failing(GRADES, "transcript unreadable"));

        CaseOutcome outcome = orchestrator().process("case-1", "application packet");

        assertThat(outcome.status()).isEqualTo(CaseStatus.PARTIAL);
        TaskResult grades = outcome.result(GRADES).orElseThrow();
        assertThat(grades.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(grades.errorMessage()).contains("transcript unreadable");
        assertThat(persistence.getResult("case-1", GRADES)).contains(grades);

        for (String sibling : List.of(APPLICATION, SCHOOL, RECOMMENDATION)) {
            assertThat(outcome.result(sibling)).get().extracting(TaskResult::status).isEqualTo(TaskStatus.SUCCESS);
        }

        TaskResult synthesis = outcome.result(SYNTHESIS).orElseThrow();
        assertThat(synthesis.status()).isEqualTo(TaskStatus.DEGRADED);
        assertThat(synthesis.note()).contains(GRADES);
        assertThat(task(SYNTHESIS).lastContext().contribution(GRADES))
                .containsEntry("summary", CaseContext.UNKNOWN);

        assertThat(outcome.result(REPORT)).get().extracting(TaskResult::status).isEqualTo(TaskStatus.SUCCESS);
        assertThat(outcome.tasksWithStatus(TaskStatus.FAILED)).containsExactly(GRADES);
        assertThat(outcome.tasksWithStatus(TaskStatus.DEGRADED)).containsExactly(SYNTHESIS);
        assertThat(audit.events("case-1", AuditEventType.TASK_FAILED)).hasSize(1);
        assertThat(audit.events("case-1").get(audit.events("case-1").size() - 1).type())
                .isEqualTo(AuditEventType.PIPELINE_PARTIAL);
    }

    @Test
    void timedOutTaskBecomesUnknownDownstream() {
        tasks.put(SCHOOL, FakeTask.sleeping(SCHOOL, 1500));

        CaseOutcome outcome = orchestrator(Duration.ofMillis(300), true).process("case-1", "application packet");

        TaskResult school = outcome.result(SCHOOL).orElseThrow();
        assertThat(school.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(school.errorMessage()).isEqualTo("timed out after 300ms");
        assertThat(validator.calls).hasValue(0);
        assertThat(task(SYNTHESIS).lastContext().contribution(SCHOOL))
                .containsEntry("summary", "unknown — data unavailable");
        assertThat(outcome.result(SYNTHESIS)).get().extracting(TaskResult::status).isEqualTo(TaskStatus.DEGRADED);
        assertThat(outcome.status()).isEqualTo(CaseStatus.PARTIAL);
    }

    @Test
    void optionalTaskFailureStillCompletesWhenDegradedCounts() {
        tasks.put(RECOMMENDATION, FakeTask.failing(RECOMMENDATION, "no letters"));

        CaseOutcome outcome = orchestrator().process("case-1", "application packet");

        assertThat(outcome.status()).isEqualTo(CaseStatus.COMPLETE);
        assertThat(outcome.tasksWithStatus(TaskStatus.FAILED)).containsExactly(RECOMMENDATION);
        assertThat(outcome.tasksWithStatus(TaskStatus.DEGRADED)).containsExactly(SYNTHESIS);
    }

    @Test
    void degradedRequiredTaskIsPartialWhenPolicySaysSo() {
        tasks.put(RECOMMENDATION, FakeTask.failing(RECOMMENDATION, "no letters"));

        CaseOutcome outcome = orchestrator(Duration.ofSeconds(5), false).process("case-1", "application packet");

        assertThat(outcome.status()).isEqualTo(CaseStatus.PARTIAL);
    }

    @Test
    void missingRequiredInputSkipsTheTask() {
        tasks.put(SYNTHESIS, FakeTask.failing(SYNTHESIS, "model refused"));

        CaseOutcome outcome = orchestrator().process("case-1", "application packet");

        TaskResult report = outcome.result(REPORT).orElseThrow();
        assertThat(report.status()).isEqualTo(TaskStatus.SKIPPED);
        assertThat(report.note()).contains(SYNTHESIS);
        assertThat(task(REPORT).callCount()).isZero();
        assertThat(persistence.getResult("case-1", REPORT)).contains(report);
        assertThat(audit.events("case-1", AuditEventType.TASK_SKIPPED)).hasSize(1);
        assertThat(outcome.status()).isEqualTo(CaseStatus.PARTIAL);
    }

    @Test
    void checkpointRemediationFeedsTheRevisedOutputDownstream() {
        validator = FakeValidator.rejecting(1);

        CaseOutcome outcome = orchestrator().process("case-1", "application packet");

        assertThat(outcome.validationAttempts()).isEqualTo(1);
        assertThat(task(SCHOOL).callCount()).isEqualTo(2);
        assertThat(task(SCHOOL).lastContext().remediationHint()).isPresent();
        assertThat(outcome.result(SCHOOL)).get().extracting(TaskResult::revision).isEqualTo(2);
        assertThat(task(SYNTHESIS).lastContext().upstream(SCHOOL)).get()
                .extracting(TaskResult::revision).isEqualTo(2);
        assertThat(persistence.validationAttempts("case-1")).hasSize(1);
        assertThat(outcome.status()).isEqualTo(CaseStatus.COMPLETE);
    }

    @Test
    void remediatedOutputStaysDegradedWhenAPreferredInputIsMissing() {
        tasks.put(CANON, FakeTask.failing(CANON, "unreadable scan"));
        validator = FakeValidator.rejecting(1);

        CaseOutcome outcome = orchestrator().process("case-1", "application packet");

        TaskResult school = outcome.result(SCHOOL).orElseThrow();
        assertThat(school.revision()).isEqualTo(2);
        assertThat(school.status()).isEqualTo(TaskStatus.DEGRADED);
        assertThat(school.note()).isEqualTo("preferred input unavailable: " + CANON);
        assertThat(persistence.getResult("case-1", SCHOOL)).contains(school);
        assertThat(outcome.tasksWithStatus(TaskStatus.DEGRADED)).contains(SCHOOL, APPLICATION);
    }

    @Test
    void exhaustedCheckpointKeepsEveryDegradationReason() {
        tasks.put(CANON, FakeTask.failing(CANON, "unreadable scan"));
        validator = FakeValidator.alwaysRejecting();

        CaseOutcome outcome = orchestrator().process("case-1", "application packet");

        assertThat(outcome.result(SCHOOL).orElseThrow().note())
                .contains("preferred input unavailable: " + CANON)
                .contains("not accepted by " + FakeValidator.NAME);
    }

    @Test
    void exhaustedCheckpointContinuesWithDegradedOutput() {
        validator = FakeValidator.alwaysRejecting();

        CaseOutcome outcome = orchestrator().process("case-1", "application packet");

        assertThat(outcome.validationAttempts()).isEqualTo(2);
        assertThat(validator.calls).hasValue(3);
        assertThat(outcome.result(SCHOOL)).get().extracting(TaskResult::status).isEqualTo(TaskStatus.DEGRADED);
        assertThat(task(SYNTHESIS).callCount()).isEqualTo(1);
        assertThat(outcome.status()).isEqualTo(CaseStatus.COMPLETE);
    }

    @Test
    void exhaustedCheckpointIsPartialWhenDegradedDoesNotCount() {
        validator = FakeValidator.alwaysRejecting();

        CaseOutcome outcome = orchestrator(Duration.ofSeconds(5), false).process("case-1", "application packet");

        assertThat(outcome.status()).isEqualTo(CaseStatus.PARTIAL);
        assertThat(outcome.tasksWithStatus(TaskStatus.DEGRADED)).containsExactly(SCHOOL);
    }

    @Test
    void rerunReusesUsableResultsAndRecomputesTheRest() {
        tasks.put(GRADES, FakeTask.failing(GRADES, "timeout upstream"));
        EvaluationOrchestrator orchestrator = orchestrator();
        assertThat(orchestrator.process("case-1", "application packet").status()).isEqualTo(CaseStatus.PARTIAL);

        task(GRADES).behave(ctx -> FakeTask.output(Map.of("gpa", "3.9")));
        CaseOutcome second = orchestrator.process("case-1", null);

        assertThat(second.status()).isEqualTo(CaseStatus.COMPLETE);
        assertThat(task(CANON).callCount()).isEqualTo(1);
        assertThat(task(APPLICATION).callCount()).isEqualTo(1);
        assertThat(task(SCHOOL).callCount()).isEqualTo(1);
        assertThat(validator.calls).hasValue(1);
        assertThat(task(GRADES).callCount()).isEqualTo(2);
        assertThat(task(SYNTHESIS).callCount()).isEqualTo(2);
        assertThat(task(REPORT).callCount()).isEqualTo(2);
        assertThat(second.result(GRADES)).get().extracting(TaskResult::revision).isEqualTo(2);
        assertThat(audit.events("case-1", AuditEventType.TASK_REUSED)).hasSize(4);
        assertThat(audit.events("case-1", AuditEventType.CASE_CREATED)).hasSize(1);
    }

    @Test
    void resumeValidatesAProducerResultItsCheckpointNeverSettled() {
        persistence.createCase("case-1", "application packet", null);
        persistence.saveResult(TaskResult.success("case-1", CANON, FakeTask.output(Map.of("by", CANON))));
        persistence.saveResult(TaskResult.success("case-1", SCHOOL,
                FakeTask.output(Map.of("school_name", "Lincoln High"))));
        validator = FakeValidator.alwaysRejecting();

        CaseOutcome outcome = orchestrator().process("case-1", null);

        assertThat(validator.calls).hasValue(3);
        assertThat(outcome.validationAttempts()).isEqualTo(2);
        assertThat(task(CANON).callCount()).isZero();
        assertThat(task(SCHOOL).callCount()).isEqualTo(2);
        assertThat(task(SCHOOL).calls).allSatisfy(ctx -> assertThat(ctx.remediationHint()).isPresent());
        TaskResult school = outcome.result(SCHOOL).orElseThrow();
        assertThat(school.status()).isEqualTo(TaskStatus.DEGRADED);
        assertThat(school.revision()).isEqualTo(4);
        assertThat(task(SYNTHESIS).lastContext().upstream(SCHOOL)).contains(school);
        assertThat(audit.events("case-1", AuditEventType.CHECKPOINT_RESOLVED)).hasSize(1);
    }

    @Test
    void resumeTrustsAProducerResultItsCheckpointSettled() {
        EvaluationOrchestrator orchestrator = orchestrator();
        orchestrator.process("case-1", "application packet");
        validator.calls.set(0);

        orchestrator.process("case-1", null);

        assertThat(validator.calls).hasValue(0);
        assertThat(task(SCHOOL).callCount()).isEqualTo(1);
    }

    @Test
    void excludedTasksKeepTheirEarlierResults() {
        orchestrator().process("case-1", "application packet");

        CaseOutcome second = orchestrator(Duration.ofSeconds(5), true, false).process("case-1", null,
                "letters.txt", Set.of(APPLICATION, GRADES, SCHOOL, SYNTHESIS, REPORT));

        assertThat(task(RECOMMENDATION).callCount()).isEqualTo(2);
        for (String name : List.of(APPLICATION, GRADES, SCHOOL, SYNTHESIS, REPORT)) {
            assertThat(task(name).callCount()).as(name).isEqualTo(1);
            assertThat(second.result(name)).as(name).get().extracting(TaskResult::revision).isEqualTo(1);
        }
        assertThat(second.notScheduled()).isEmpty();
        assertThat(second.status()).isEqualTo(CaseStatus.COMPLETE);
        assertThat(audit.events("case-1", AuditEventType.TASK_NOT_SCHEDULED)).hasSize(5);
    }

    @Test
    void excludedTasksWithoutResultsLeaveTheCasePartial() {
        CaseOutcome outcome = orchestrator().process("case-2", "Transcript: GPA 3.9", "transcript.txt",
                Set.of(APPLICATION, RECOMMENDATION, SYNTHESIS, REPORT));

        for (String name : List.of(APPLICATION, RECOMMENDATION, SYNTHESIS, REPORT)) {
            assertThat(task(name).callCount()).as(name).isZero();
            assertThat(persistence.getResult("case-2", name)).as(name).isEmpty();
        }
        assertThat(task(GRADES).callCount()).isEqualTo(1);
        assertThat(task(SCHOOL).callCount()).isEqualTo(1);
        assertThat(outcome.notScheduled()).containsExactlyInAnyOrder(APPLICATION, RECOMMENDATION, SYNTHESIS, REPORT);
        assertThat(outcome.status()).isEqualTo(CaseStatus.PARTIAL);
    }

    @Test
    void existingCaseKeepsItsSourceText() {
        orchestrator().process("case-1", "original packet");

        orchestrator(Duration.ofSeconds(5), true, false).process("case-1", "replacement packet");

        assertThat(task(CANON).callCount()).isEqualTo(2);
        assertThat(task(CANON).lastContext().sourceText()).isEqualTo("original packet");
        assertThat(persistence.getResult("case-1", CANON)).get()
                .extracting(TaskResult::revision).isEqualTo(2);
    }

    @Test
    void generatesACaseIdWhenNoneIsGiven() {
        CaseOutcome outcome = orchestrator().process(null, "application packet");

        assertThat(outcome.caseId()).isNotBlank();
        assertThat(persistence.findCase(outcome.caseId())).isPresent();
    }

    @Test
    void newCaseWithoutTextIsRejected() {
        assertThatThrownBy(() -> orchestrator().process("case-1", "  "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(persistence.findCase("case-1")).isEmpty();
    }

    @Test
    void storageFailureAbortsTheRunAndMarksTheCasePartial() {
        persistence = new InMemoryPersistenceGateway() {
            @Override
            public TaskResult saveResult(TaskResult result) {
                if (result.taskName().equals(GRADES)) {
                    throw new PersistenceUnavailableException("write refused", null);
                }
                return super.saveResult(result);
            }
        };

        assertThatThrownBy(() -> orchestrator().process("case-1", "application packet"))
                .isInstanceOf(PersistenceUnavailableException.class)
                .hasMessageContaining("write refused");

        assertThat(persistence.findCase("case-1")).get()
                .extracting(CaseRecord::status).isEqualTo(CaseStatus.PARTIAL);
        assertThat(task(SYNTHESIS).callCount()).isZero();
        assertThat(audit.events("case-1", AuditEventType.PIPELINE_COMPLETED)).isEmpty();
    }
}
