package com.example.evaluator.controller;

import com.example.evaluator.model.CaseOutcome;
import com.example.evaluator.model.CaseReadiness;
import com.example.evaluator.model.CaseRecord;
import com.example.evaluator.model.CaseSubmission;
import com.example.evaluator.model.CaseView;
import com.example.evaluator.model.RoutingDecision;
import com.example.evaluator.orchestrator.DocumentRouter;
import com.example.evaluator.orchestrator.EvaluationOrchestrator;
import com.example.evaluator.orchestrator.StageGraph;
import com.example.evaluator.orchestrator.TaskRegistry;
import com.example.evaluator.repository.PersistenceGateway;
import com.example.evaluator.repository.PersistenceUnavailableException;
import com.example.evaluator.service.CaseReadinessService;
import com.example.evaluator.service.SseProgressBroadcaster;
import com.example.evaluator.service.TaskExecutionMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * REST controller for case evaluation.
 */
@RestController
@RequestMapping("/api")
public class CaseEvaluationController {

    private static final Logger log = LoggerFactory.getLogger(CaseEvaluationController.class);

    static final long MAX_UPLOAD_BYTES = 10L * 1024 * 1024;

    private final EvaluationOrchestrator orchestrator;
    private final PersistenceGateway persistence;
    private final SseProgressBroadcaster broadcaster;
    private final TaskExecutionMonitor monitor;
    private final StageGraph stageGraph;
    private final TaskRegistry registry;
    private final DocumentRouter router;
    private final CaseReadinessService readiness;

    public CaseEvaluationController(EvaluationOrchestrator orchestrator,
                                    PersistenceGateway persistence,
                                    SseProgressBroadcaster broadcaster,
                                    TaskExecutionMonitor monitor,
                                    StageGraph stageGraph,
                                    TaskRegistry registry,
                                    DocumentRouter router,
                                    CaseReadinessService readiness) {
        this.orchestrator = orchestrator;
        this.persistence = persistence;
        this.broadcaster = broadcaster;
        this.monitor = monitor;
        this.stageGraph = stageGraph;
        this.registry = registry;
        this.router = router;
        this.readiness = readiness;
    }

    /**
     * Evaluates a case synchronously and returns its outcome.
     *
     * <p>Endpoint: POST /api/cases
     * <p>Body: {@code {"caseId": optional, "sourceText": "..."}}
     */
    @PostMapping(value = "/cases", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> evaluate(@RequestBody CaseSubmission submission) {
        if (submission == null) {
            return badRequest("Missing request body.");
        }
        log.info("Received evaluation request for case {}",
                submission.caseId() != null ? submission.caseId() : "(new)");
        return run(submission.caseId(), submission.sourceText(), null, Set.of());
    }

    /**
     * Evaluates an uploaded plain-text document. The document is classified (application,
     * transcript, recommendation) and only the tasks fed by that kind of document run, plus
     * the final evaluation when the upload warrants it or {@code forceFinalEvaluation} is set.
     *
     * <p>Endpoint: POST /api/cases/upload
     * <p>Content-Type: multipart/form-data
     * <p>Parameters: file, caseId (optional), forceFinalEvaluation (optional)
     */
    @PostMapping(value = "/cases/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> upload(@RequestParam("file") MultipartFile file,
                                    @RequestParam(value = "caseId", required = false) String caseId,
                                    @RequestParam(value = "forceFinalEvaluation", defaultValue = "false")
                                    boolean forceFinalEvaluation) {
        if (file.isEmpty()) {
            return badRequest("Empty file. Please upload a text document.");
        }
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            return badRequest("File too large. Maximum size: 10MB.");
        }
        String contentType = file.getContentType();
        if (contentType != null && !contentType.startsWith("text/")
                && !MediaType.APPLICATION_OCTET_STREAM_VALUE.equals(contentType)) {
            return badRequest("Invalid format. Only plain-text documents accepted.");
        }

        String text;
        try {
            text = new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Could not read upload '{}'", file.getOriginalFilename(), e);
            return badRequest("Unreadable file: " + e.getMessage());
        }
        log.info("Received upload '{}' ({} bytes)", file.getOriginalFilename(), file.getSize());
        RoutingDecision routing = router.route(file.getOriginalFilename(), text, forceFinalEvaluation);
        return run(caseId, text, file.getOriginalFilename(), routing.excluded());
    }

    /**
     * Stored state of a case.
     *
     * <p>Endpoint: GET /api/cases/{caseId}
     */
    @GetMapping("/cases/{caseId}")
    public ResponseEntity<?> getCase(@PathVariable String caseId) {
        try {
            Optional<CaseRecord> record = persistence.findCase(caseId);
            if (record.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Unknown case '" + caseId + "'"));
            }
            return ResponseEntity.ok(new CaseView(record.get(),
                    persistence.latestResults(caseId),
                    persistence.validationAttempts(caseId)));
        } catch (PersistenceUnavailableException e) {
            return unavailable(e);
        }
    }

    /**
     * What each task has to work with and what to upload next.
     *
     * <p>Endpoint: GET /api/cases/{caseId}/requirements
     */
    @GetMapping("/cases/{caseId}/requirements")
    public ResponseEntity<?> requirements(@PathVariable String caseId) {
        try {
            Optional<CaseReadiness> report = readiness.assess(caseId);
            if (report.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Unknown case '" + caseId + "'"));
            }
            return ResponseEntity.ok(report.get());
        } catch (PersistenceUnavailableException e) {
            return unavailable(e);
        }
    }

    /**
     * Live progress of a case as Server-Sent Events. The stream ends when the case finishes.
     *
     * <p>Endpoint: GET /api/cases/{caseId}/progress
     */
    @GetMapping(value = "/cases/{caseId}/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter progress(@PathVariable String caseId) {
        return broadcaster.subscribe(caseId);
    }

    /**
     * <p>Endpoint: GET /api/monitor
     */
    @GetMapping("/monitor")
    public ResponseEntity<Map<String, Object>> monitor() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("executions", monitor.snapshot());
        body.put("droppedProgressEvents", broadcaster.droppedEvents());
        return ResponseEntity.ok(body);
    }

    /**
     * Registered tasks, stage layout and storage backend.
     *
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", "case-evaluator");
        body.put("tasks", registry.taskNames());
        body.put("stages", stageGraph.describe());
        body.put("persistence", persistence.mode());
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<?> run(String caseId, String sourceText, String sourceName, Set<String> excluded) {
        try {
            CaseOutcome outcome = orchestrator.process(caseId, sourceText, sourceName, excluded);
            return ResponseEntity.ok(outcome);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (PersistenceUnavailableException e) {
            return unavailable(e);
        } catch (Exception e) {
            log.error("Error during evaluation of case {}", caseId, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during evaluation",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private ResponseEntity<Map<String, String>> unavailable(PersistenceUnavailableException e) {
        log.error("Storage unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of(
                        "error", "Storage unavailable",
                        "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                ));
    }
}
