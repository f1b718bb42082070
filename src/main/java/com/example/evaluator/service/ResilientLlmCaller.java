package com.example.evaluator.service;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;

/**
 * Structured LLM calls with lenient JSON parsing and automatic retry.
 * <p>
 * Models regularly answer with trailing commas, comments, single quotes or extra fields.
 * The {@link BeanOutputConverter} here uses a lenient {@link ObjectMapper} and the call is
 * retried up to {@value #MAX_RETRIES} times, with a linear back-off, before giving up.
 */
public final class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);
    private static final int MAX_RETRIES = 2;
    private static final long BACKOFF_MS = 2000L;

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ResilientLlmCaller() {
    }

    /**
     * Calls the model and parses its answer into {@code type}.
     * <p>
     * The converter's format instructions are appended to the user prompt.
     *
     * @param chatClient   the LLM client to use
     * @param systemPrompt the system prompt
     * @param userPrompt   the user prompt
     * @param type         the target class for parsing
     * @param taskName     task name, for logging
     * @return the parsed response
     * @throws TaskExecutionException if every attempt fails
     */
    public static <T> T callEntity(ChatClient chatClient, String systemPrompt, String userPrompt,
                                   Class<T> type, String taskName) {
        var converter = new BeanOutputConverter<>(type, LENIENT_MAPPER);
        String fullUserPrompt = userPrompt + "\n\n" + converter.getFormat();

        Exception lastError = null;
        for (int attempt = 1; attempt <= MAX_RETRIES + 1; attempt++) {
            try {
                ChatResponse chatResponse = chatClient.prompt()
                        .system(systemPrompt)
                        .user(fullUserPrompt)
                        .call()
                        .chatResponse();

                String content = (chatResponse != null && chatResponse.getResult() != null)
                        ? chatResponse.getResult().getOutput().getText()
                        : null;
                if (content == null || content.isBlank()) {
                    throw new TaskExecutionException("Empty or null content in LLM response");
                }
                T parsed = converter.convert(content);
                if (parsed == null) {
                    throw new TaskExecutionException("LLM response parsed to null");
                }
                return parsed;
            } catch (Exception e) {
                lastError = e;
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("{}: interrupted, giving up after attempt {}", taskName, attempt);
                    break;
                }
                if (attempt <= MAX_RETRIES) {
                    long delay = attempt * BACKOFF_MS;
                    log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                            taskName, attempt, MAX_RETRIES + 1, rootCauseMessage(e), delay);
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        throw new TaskExecutionException("Error in " + taskName + " after " + (MAX_RETRIES + 1)
                + " attempts: " + rootCauseMessage(lastError), lastError);
    }

    private static String rootCauseMessage(Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
