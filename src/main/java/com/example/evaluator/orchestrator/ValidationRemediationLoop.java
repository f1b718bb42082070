package com.example.evaluator.orchestrator;

import com.example.evaluator.agent.CheckpointValidator;
import com.example.evaluator.agent.EvaluationTask;
import com.example.evaluator.model.AuditEventType;
import com.example.evaluator.model.ProgressEvent;
import com.example.evaluator.model.ProgressState;
import com.example.evaluator.model.RemediationHint;
import com.example.evaluator.model.TaskResult;
import com.example.evaluator.model.TaskStatus;
import com.example.evaluator.model.ValidationAttempt;
import com.example.evaluator.model.ValidationDecision;
import com.example.evaluator.model.ValidationVerdict;
import com.example.evaluator.repository.AuditLogger;
import com.example.evaluator.repository.PersistenceGateway;
import com.example.evaluator.service.ProgressEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded agreement protocol between a producer task and a checkpoint validator.
 * <p>
 * The validator judges the producer's current output. Each rejection is recorded as a
 * {@link ValidationAttempt} and the producer is re-run with the validator's hint, at most
 * {@code maxAttempts} times, so the validator is called at most {@code maxAttempts + 1} times.
 * If the last output is still rejected the best available output is kept and tagged DEGRADED.
 * Every produced result is persisted before the validator sees it.
 */
@Component
public class ValidationRemediationLoop {

    private static final Logger log = LoggerFactory.getLogger(ValidationRemediationLoop.class);

    private final TaskInvoker invoker;
    private final PersistenceGateway persistence;
    private final AuditLogger audit;
    private final ProgressEmitter progress;

    /**
     * Final state of a checkpoint.
     *
     * @param result         the producer's current, persisted result
     * @param accepted       whether the validator accepted it
     * @param attempts       number of rejected rounds recorded
     * @param validatorCalls number of validator invocations
     */
    public record CheckpointOutcome(TaskResult result, boolean accepted, int attempts, int validatorCalls) {}

    public ValidationRemediationLoop(TaskInvoker invoker,
                                     PersistenceGateway persistence,
                                     AuditLogger audit,
                                     ProgressEmitter progress) {
        this.invoker = invoker;
        this.persistence = persistence;
        this.audit = audit;
        this.progress = progress;
    }

    public CheckpointOutcome validateAndRemediate(CheckpointDefinition checkpoint,
                                                  TaskResult producerResult,
                                                  CaseContext context,
                                                  EvaluationTask producer,
                                                  CheckpointValidator validator) {
        return validateAndRemediate(checkpoint, producerResult, context, producer, validator, null);
    }

    /**
     * @param checkpoint     producer/validator pair and attempt bound
     * @param producerResult the producer's first persisted result
     * @param context        the context the producer ran with
     * @param producer       producer capability, re-invoked on remediation
     * @param validator      consumer-side validator
     * @param inputShortfall why the producer's inputs are incomplete, or {@code null}; a successful
     *                       remediated result is degraded with this reason before it is saved
     */
    public CheckpointOutcome validateAndRemediate(CheckpointDefinition checkpoint,
                                                  TaskResult producerResult,
                                                  CaseContext context,
                                                  EvaluationTask producer,
                                                  CheckpointValidator validator,
                                                  String inputShortfall) {
        String caseId = context.caseId();
        if (!producerResult.status().isUsable()) {
            log.info("Checkpoint {}: producer ended {}, nothing to validate", checkpoint.producer(), producerResult.status());
            resolved(caseId, checkpoint, producerResult, false, 0, "producer " + producerResult.status().name().toLowerCase());
            return new CheckpointOutcome(producerResult, false, 0, 0);
        }

        TaskResult best = producerResult;
        int attempts = 0;
        int validatorCalls = 0;

        while (true) {
            ValidationDecision decision = judge(validator, context, best);
            validatorCalls++;
            if (decision.isAccepted()) {
                log.info("Checkpoint {}: accepted by {} after {} remediation(s)",
                        checkpoint.producer(), validator.name(), attempts);
                resolved(caseId, checkpoint, best, true, attempts, "accepted");
                return new CheckpointOutcome(best, true, attempts, validatorCalls);
            }
            if (attempts >= checkpoint.maxAttempts()) {
                break;
            }

            attempts++;
            RemediationHint hint = decision.hint();
            persistence.saveValidationAttempt(new ValidationAttempt(null, caseId, checkpoint.producer(),
                    validator.name(), attempts, best.payload(), ValidationVerdict.NEEDS_REMEDIATION, hint, null));
            audit.logEvent(caseId, AuditEventType.VALIDATION_ATTEMPT, attemptPayload(checkpoint, attempts, hint));
            progress.emit(ProgressEvent.of(caseId, checkpoint.producer(), ProgressState.REMEDIATING));
            log.info("Checkpoint {}: attempt {}/{} rejected ({}), remediating",
                    checkpoint.producer(), attempts, checkpoint.maxAttempts(), summarize(hint));

            TaskResult remediated = invoker.invoke(producer, context.withRemediation(hint, attempts));
            if (remediated.status() == TaskStatus.SUCCESS && inputShortfall != null) {
                remediated = remediated.degrade(inputShortfall);
            }
            TaskResult stored = persistence.saveResult(remediated);
            if (stored.status().isUsable()) {
                best = stored;
            } else {
                log.warn("Checkpoint {}: remediation attempt {} failed — {}",
                        checkpoint.producer(), attempts, stored.errorMessage());
            }
        }

        TaskResult degraded = persistence.saveResult(best.degrade(
                "not accepted by " + validator.name() + " after " + attempts + " remediation attempt(s)"));
        log.warn("Checkpoint {}: bound of {} reached without agreement, continuing with degraded output",
                checkpoint.producer(), checkpoint.maxAttempts());
        resolved(caseId, checkpoint, degraded, false, attempts, "attempt bound reached");
        return new CheckpointOutcome(degraded, false, attempts, validatorCalls);
    }

    private ValidationDecision judge(CheckpointValidator validator, CaseContext context, TaskResult result) {
        try {
            ValidationDecision decision = validator.validate(context, result);
            if (decision == null) {
                return ValidationDecision.needsRemediation(
                        new RemediationHint(null, null, "validator returned no verdict"));
            }
            return decision;
        } catch (RuntimeException e) {
            log.warn("Validator {} failed: {}", validator.name(), e.getMessage());
            return ValidationDecision.needsRemediation(
                    new RemediationHint(null, null, "validator error: " + e.getMessage()));
        }
    }

    private void resolved(String caseId, CheckpointDefinition checkpoint, TaskResult result,
                          boolean accepted, int attempts, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("producer", checkpoint.producer());
        payload.put("validator", checkpoint.validator());
        payload.put("accepted", accepted);
        payload.put("attempts", attempts);
        payload.put("status", result.status().name());
        payload.put("revision", result.revision());
        payload.put("reason", reason);
        audit.logEvent(caseId, AuditEventType.CHECKPOINT_RESOLVED, payload);
    }

    private static Map<String, Object> attemptPayload(CheckpointDefinition checkpoint, int attempt, RemediationHint hint) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("producer", checkpoint.producer());
        payload.put("validator", checkpoint.validator());
        payload.put("attempt", attempt);
        payload.put("maxAttempts", checkpoint.maxAttempts());
        if (hint != null) {
            payload.put("missingFields", hint.missingFields());
            payload.put("inconsistencies", hint.inconsistencies());
        }
        return payload;
    }

    private static String summarize(RemediationHint hint) {
        if (hint == null) return "no hint";
        return "missing=" + hint.missingFields() + ", inconsistent=" + hint.inconsistencies().size();
    }
}
