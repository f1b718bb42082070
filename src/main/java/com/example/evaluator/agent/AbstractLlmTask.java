package com.example.evaluator.agent;

import com.example.evaluator.model.Confidence;
import com.example.evaluator.model.LlmTaskResponse;
import com.example.evaluator.model.RemediationHint;
import com.example.evaluator.model.TaskOutput;
import com.example.evaluator.orchestrator.CaseContext;
import com.example.evaluator.service.ResilientLlmCaller;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of the model-backed tasks.
 * <p>
 * Builds one user prompt out of the case document, the contribution of every declared input
 * (or the "unknown" marker when that input is unavailable) and, on a remediation round, the
 * reviewer's feedback. The model answers with a {@link LlmTaskResponse}.
 */
public abstract class AbstractLlmTask implements EvaluationTask {

    private static final Logger log = LoggerFactory.getLogger(AbstractLlmTask.class);

    static final int MAX_SOURCE_CHARS = 60_000;

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;

    protected AbstractLlmTask(ChatClient chatClient, ObjectMapper objectMapper) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
    }

    protected abstract String systemPrompt();

    /** What this task must produce, placed at the top of the user prompt. */
    protected abstract String instructions();

    @Override
    public TaskOutput run(CaseContext context) {
        log.info("{}: analysing case {}{}", name(), context.caseId(),
                context.attempt() > 0 ? " (remediation " + context.attempt() + ")" : "");

        LlmTaskResponse response = ResilientLlmCaller.callEntity(
                chatClient, systemPrompt(), buildUserPrompt(context), LlmTaskResponse.class, name());

        Map<String, Object> payload = new LinkedHashMap<>();
        if (response.fields() != null) {
            payload.putAll(response.fields());
        }
        if (response.summary() != null && !response.summary().isBlank()) {
            payload.put("summary", response.summary());
        }
        return new TaskOutput(payload, Confidence.fromLabel(response.confidence()));
    }

    String buildUserPrompt(CaseContext context) {
        StringBuilder prompt = new StringBuilder(instructions().strip()).append("\n\n");

        prompt.append("CASE DOCUMENT:\n===BEGIN===\n")
                .append(truncate(context.sourceText(), MAX_SOURCE_CHARS))
                .append("\n===END===\n");

        for (String input : context.inputs()) {
            prompt.append("\nINPUT FROM ").append(input).append(":\n")
                    .append(toJson(context.contribution(input)))
                    .append('\n');
        }

        context.remediationHint().ifPresent(hint -> appendFeedback(prompt, hint, context.attempt()));
        return prompt.toString();
    }

    private static void appendFeedback(StringBuilder prompt, RemediationHint hint, int attempt) {
        prompt.append("\nREVIEWER FEEDBACK (revision ").append(attempt).append("):\n");
        if (!hint.missingFields().isEmpty()) {
            prompt.append("- Missing or empty fields: ").append(String.join(", ", hint.missingFields())).append('\n');
        }
        for (String inconsistency : hint.inconsistencies()) {
            prompt.append("- Inconsistency: ").append(inconsistency).append('\n');
        }
        if (hint.instructions() != null && !hint.instructions().isBlank()) {
            prompt.append("- ").append(hint.instructions()).append('\n');
        }
        prompt.append("Produce a corrected answer that resolves every point above.\n");
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max) + "\n[...truncated...]";
    }
}
