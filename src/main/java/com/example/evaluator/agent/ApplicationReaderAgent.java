package com.example.evaluator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class ApplicationReaderAgent extends AbstractLlmTask {

    public static final String NAME = "application_reader";

    private static final String SYSTEM_PROMPT = """
            You are the application content specialist of a student internship review panel.

            TASK:
            Read the student's own application writing and assess it.

            RULES:
            - Ground every observation in a short quote from the essay
            - Look for genuine interest in research, initiative and clarity of goals
            - Flag anything that suggests exaggeration or text not written by the student
            - Do not judge grades or recommendations: other reviewers cover them
            """;

    public ApplicationReaderAgent(@Qualifier("analysisChatClient") ChatClient chatClient,
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
                Evaluate the application essay.
                Return in "fields": interests (list), motivation, readiness_score (0-100),
                strengths (list), concerns (list) and evidence_quotes (list).
                """;
    }
}
