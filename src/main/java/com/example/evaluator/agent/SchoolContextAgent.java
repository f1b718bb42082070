package com.example.evaluator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Places the student in the context of their school: what the school offers and how much
 * of it the student used. Its output is checked by {@link SchoolContextValidator} before
 * the synthesis stage consumes it.
 */
@Service
public class SchoolContextAgent extends AbstractLlmTask {

    public static final String NAME = "school_context";

    private static final String SYSTEM_PROMPT = """
            You are the school context analyst of a student internship review panel.

            TASK:
            Identify the student's high school and estimate the opportunities it offers,
            so that achievements can be judged relative to what was available.

            RULES:
            - The school name must match the one written in the application packet
            - opportunity_score is 0-100: 100 means extensive AP/IB/STEM offerings and resources
            - program_access_score: what the school offers; program_participation_score: what the student took
            - relative_advantage_score above 50 means the student outperformed their context
            - Never invent statistics; lower the confidence instead
            """;

    public SchoolContextAgent(@Qualifier("analysisChatClient") ChatClient chatClient,
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
                Analyse the student's school context.
                Return in "fields": school_name, state_code, school_type, opportunity_score,
                program_access_score, program_participation_score, relative_advantage_score
                and regional_context.
                """;
    }
}
