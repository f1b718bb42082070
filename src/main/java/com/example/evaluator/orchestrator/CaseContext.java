package com.example.evaluator.orchestrator;

import com.example.evaluator.model.RemediationHint;
import com.example.evaluator.model.TaskResult;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of a case handed to one task invocation.
 * <p>
 * Carries the source text, the names of the task's declared dependencies and the current results
 * of those dependencies only; a task never sees results it did not declare. On a remediation round the context also
 * carries the validator's hint.
 */
public final class CaseContext {

    /** Contribution of an upstream task that failed, was skipped or never ran. */
    public static final String UNKNOWN = "unknown — data unavailable";

    private final String caseId;
    private final String sourceText;
    private final List<String> inputs;
    private final Map<String, TaskResult> upstream;
    private final RemediationHint remediationHint;
    private final int attempt;

    public CaseContext(String caseId, String sourceText, Map<String, TaskResult> upstream) {
        this(caseId, sourceText, upstream.keySet(), upstream);
    }

    /**
     * @param inputs   declared dependencies, whether or not they have a result
     * @param upstream current results of those dependencies
     */
    public CaseContext(String caseId, String sourceText, Collection<String> inputs, Map<String, TaskResult> upstream) {
        this(caseId, sourceText, inputs.stream().sorted().toList(), upstream, null, 0);
    }

    private CaseContext(String caseId, String sourceText, List<String> inputs, Map<String, TaskResult> upstream,
                        RemediationHint remediationHint, int attempt) {
        this.caseId = caseId;
        this.sourceText = sourceText == null ? "" : sourceText;
        this.inputs = inputs;
        this.upstream = Collections.unmodifiableMap(new LinkedHashMap<>(upstream));
        this.remediationHint = remediationHint;
        this.attempt = attempt;
    }

    /** Same inputs plus the validator's feedback for remediation round {@code attemptNumber}. */
    public CaseContext withRemediation(RemediationHint hint, int attemptNumber) {
        return new CaseContext(caseId, sourceText, inputs, upstream, hint, attemptNumber);
    }

    public String caseId() {
        return caseId;
    }

    public String sourceText() {
        return sourceText;
    }

    /** Declared dependencies, sorted by name. */
    public List<String> inputs() {
        return inputs;
    }

    public Map<String, TaskResult> upstream() {
        return upstream;
    }

    public Optional<TaskResult> upstream(String taskName) {
        return Optional.ofNullable(upstream.get(taskName));
    }

    /**
     * Payload of a usable upstream result, or a single {@code summary -> UNKNOWN} entry when the
     * upstream task failed, was skipped or is absent.
     */
    public Map<String, Object> contribution(String taskName) {
        TaskResult result = upstream.get(taskName);
        if (result == null || !result.status().isUsable()) {
            return Map.of("status", "unknown", "summary", UNKNOWN);
        }
        return result.payload();
    }

    /** Upstream value of a single payload field, if that upstream result is usable. */
    public Optional<Object> upstreamField(String taskName, String field) {
        return upstream(taskName)
                .filter(r -> r.status().isUsable())
                .map(r -> r.payload().get(field));
    }

    public Optional<RemediationHint> remediationHint() {
        return Optional.ofNullable(remediationHint);
    }

    /** 0 for the first run, n for the n-th remediation round. */
    public int attempt() {
        return attempt;
    }
}
