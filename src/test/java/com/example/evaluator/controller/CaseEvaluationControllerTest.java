package com.example.evaluator.controller;

import com.example.evaluator.config.EvaluationProperties;
import com.example.evaluator.model.CaseOutcome;
import com.example.evaluator.model.CaseStatus;
import com.example.evaluator.model.Confidence;
import com.example.evaluator.model.TaskOutput;
import com.example.evaluator.model.TaskResult;
import com.example.evaluator.orchestrator.DocumentRouter;
import com.example.evaluator.orchestrator.EvaluationOrchestrator;
import com.example.evaluator.orchestrator.StageGraph;
import com.example.evaluator.orchestrator.TaskDefinition;
import com.example.evaluator.orchestrator.TaskRegistry;
import com.example.evaluator.repository.InMemoryPersistenceGateway;
import com.example.evaluator.repository.PersistenceUnavailableException;
import com.example.evaluator.service.CaseReadinessService;
import com.example.evaluator.service.SseProgressBroadcaster;
import com.example.evaluator.service.TaskExecutionMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CaseEvaluationControllerTest {

    private EvaluationOrchestrator orchestrator;
    private InMemoryPersistenceGateway persistence;
    private MockMvc mvc;

    private static final EvaluationProperties.Routing ROUTING = new EvaluationProperties.Routing(
            List.of("application_reader"),
            List.of("grade_reader", "school_context"),
            List.of("recommendation_reader"),
            List.of("student_evaluator", "report_formatter"));

    @BeforeEach
    void setUp() {
        orchestrator = mock(EvaluationOrchestrator.class);
        persistence = new InMemoryPersistenceGateway();
        StageGraph graph = StageGraph.of(List.of(
                TaskDefinition.of("document_canonicalizer", Set.of(), Set.of()),
                TaskDefinition.of("application_reader", Set.of(), Set.of("document_canonicalizer")),
                TaskDefinition.of("grade_reader", Set.of(), Set.of("document_canonicalizer")),
                TaskDefinition.of("school_context", Set.of(), Set.of("document_canonicalizer")),
                new TaskDefinition("recommendation_reader", Set.of(), Set.of("document_canonicalizer"), false),
                TaskDefinition.of("student_evaluator", Set.of(),
                        Set.of("application_reader", "grade_reader", "school_context", "recommendation_reader")),
                TaskDefinition.of("report_formatter", Set.of("student_evaluator"), Set.of())), null);
        TaskRegistry registry = new TaskRegistry(List.of(), List.of());
        DocumentRouter router = new DocumentRouter(graph,
                new EvaluationProperties(List.of(), null, null, null, null, "memory", ROUTING));
        CaseEvaluationController controller = new CaseEvaluationController(orchestrator, persistence,
                new SseProgressBroadcaster(), new TaskExecutionMonitor(), graph, registry,
                router, new CaseReadinessService(graph, router, persistence));
        mvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    private static CaseOutcome outcome(String caseId) {
        TaskResult grades = TaskResult.success(caseId, "grade_reader",
                new TaskOutput(Map.of("gpa", "3.8"), Confidence.HIGH)).withRevision(1);
        return new CaseOutcome(caseId, CaseStatus.COMPLETE, List.of(grades), List.of(), 0, 12);
    }

    @Test
    void evaluatesSubmittedCase() throws Exception {
        when(orchestrator.process("c1", "packet text", null, Set.of())).thenReturn(outcome("c1"));

        mvc.perform(post("/api/cases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"caseId\":\"c1\",\"sourceText\":\"packet text\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.caseId").value("c1"))
                .andExpect(jsonPath("$.status").value("COMPLETE"))
                .andExpect(jsonPath("$.results[0].taskName").value("grade_reader"))
                .andExpect(jsonPath("$.results[0].payload.gpa").value("3.8"));
    }

    @Test
    void blankTextIsABadRequest() throws Exception {
        when(orchestrator.process(isNull(), eq(""), isNull(), eq(Set.of())))
                .thenThrow(new IllegalArgumentException("A new case needs source text"));

        mvc.perform(post("/api/cases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceText\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("A new case needs source text"));
    }

    @Test
    void storageOutageIsServiceUnavailable() throws Exception {
        when(orchestrator.process(any(), any(), any(), any()))
                .thenThrow(new PersistenceUnavailableException("MongoDB unavailable, could not create case c1", null));

        mvc.perform(post("/api/cases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"caseId\":\"c1\",\"sourceText\":\"packet\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Storage unavailable"));
    }

    @Test
    void transcriptUploadRunsOnlyTheTranscriptTasks() throws Exception {
        when(orchestrator.process(any(), any(), any(), any())).thenReturn(outcome("generated"));
        MockMultipartFile file = new MockMultipartFile("file", "packet.txt", "text/plain",
                "Transcript: GPA 3.8".getBytes());

        mvc.perform(multipart("/api/cases/upload").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.caseId").value("generated"));

        verify(orchestrator).process(null, "Transcript: GPA 3.8", "packet.txt",
                Set.of("application_reader", "recommendation_reader", "student_evaluator", "report_formatter"));
    }

    @Test
    void forcedFinalEvaluationKeepsTheFinalTasks() throws Exception {
        when(orchestrator.process(any(), any(), any(), any())).thenReturn(outcome("c7"));
        MockMultipartFile file = new MockMultipartFile("file", "essay.txt", "text/plain",
                "My personal statement".getBytes());

        mvc.perform(multipart("/api/cases/upload").file(file)
                        .param("caseId", "c7")
                        .param("forceFinalEvaluation", "true"))
                .andExpect(status().isOk());

        verify(orchestrator).process("c7", "My personal statement", "essay.txt",
                Set.of("grade_reader", "school_context", "recommendation_reader"));
    }

    @Test
    void uploadRejectsEmptyAndBinaryFiles() throws Exception {
        mvc.perform(multipart("/api/cases/upload")
                        .file(new MockMultipartFile("file", "empty.txt", "text/plain", new byte[0])))
                .andExpect(status().isBadRequest());
        mvc.perform(multipart("/api/cases/upload")
                        .file(new MockMultipartFile("file", "scan.pdf", "application/pdf", new byte[]{1, 2})))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownCaseIsNotFound() throws Exception {
        mvc.perform(get("/api/cases/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Unknown case 'nope'"));
    }

    @Test
    void storedCaseShowsLatestResults() throws Exception {
        persistence.createCase("c1", "packet", null);
        persistence.saveResult(TaskResult.failed("c1", "grade_reader", "boom"));
        persistence.saveResult(TaskResult.success("c1", "grade_reader", new TaskOutput(Map.of(), Confidence.LOW)));

        mvc.perform(get("/api/cases/c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.caseRecord.caseId").value("c1"))
                .andExpect(jsonPath("$.results.length()").value(1))
                .andExpect(jsonPath("$.results[0].revision").value(2))
                .andExpect(jsonPath("$.validationAttempts").isEmpty());
    }

    @Test
    void requirementsTellWhatToUploadNext() throws Exception {
        persistence.createCase("c1", "Personal statement: I want to build robots.", null);

        mvc.perform(get("/api/cases/c1/requirements"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tasks.length()").value(7))
                .andExpect(jsonPath("$.tasks[0].taskName").value("document_canonicalizer"))
                .andExpect(jsonPath("$.tasks[0].state").value("READY"))
                .andExpect(jsonPath("$.tasks[2].taskName").value("grade_reader"))
                .andExpect(jsonPath("$.tasks[2].state").value("MISSING_INFO"))
                .andExpect(jsonPath("$.readyCount").value(4))
                .andExpect(jsonPath("$.overallStatus").value("partial"))
                .andExpect(jsonPath("$.canProceed").value(true))
                .andExpect(jsonPath("$.recommendation").value(
                        "Upload the transcript next: grades and the school are read from it."));
    }

    @Test
    void requirementsOfUnknownCaseAreNotFound() throws Exception {
        mvc.perform(get("/api/cases/nope/requirements"))
                .andExpect(status().isNotFound());
    }

    @Test
    void healthReportsLayoutAndBackend() throws Exception {
        mvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.stages").value(
                        "[document_canonicalizer] -> [application_reader, grade_reader, school_context,"
                                + " recommendation_reader] -> [student_evaluator] -> [report_formatter]"))
                .andExpect(jsonPath("$.persistence").value("memory"));
    }

    @Test
    void monitorExposesExecutionCounters() throws Exception {
        mvc.perform(get("/api/monitor"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executions.totalCalls").value(0))
                .andExpect(jsonPath("$.droppedProgressEvents").value(0));
    }
}
