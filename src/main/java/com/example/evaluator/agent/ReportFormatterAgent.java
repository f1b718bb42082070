package com.example.evaluator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Last stage: turns the synthesis into a reviewer-facing report. Runs on the report model.
 */
@Service
public class ReportFormatterAgent extends AbstractLlmTask {

    public static final String NAME = "report_formatter";

    private static final String SYSTEM_PROMPT = """
            You format evaluation results into a clear, professional report for the review committee.

            RULES:
            - Acknowledge the student as a whole person; tone is respectful, encouraging and honest
            - Restate the recommendation exactly as given; never change scores
            - Keep the report in Markdown, at most one page
            """;

    public ReportFormatterAgent(@Qualifier("reportChatClient") ChatClient chatClient,
                                ObjectMapper objectMapper) {
        super(chatClient, objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String instructions() {
        return """
                Write the committee report for the evaluation below.
                Return in "fields": headline, report_markdown and highlights (list).
                """;
    }
}
