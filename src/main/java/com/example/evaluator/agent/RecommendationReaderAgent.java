package com.example.evaluator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class RecommendationReaderAgent extends AbstractLlmTask {

    public static final String NAME = "recommendation_reader";

    private static final String SYSTEM_PROMPT = """
            You are the recommendation letter specialist of a student internship review panel.

            TASK:
            Read every recommendation letter in the packet and weigh it.

            RULES:
            - Distinguish specific anecdotes from generic praise
            - Record the recommender's relationship to the student; note letters written by relatives
            - Multiple strong, specific letters weigh more than one glowing generic letter
            - If the packet has no recommendation, return an empty list and low confidence
            """;

    public RecommendationReaderAgent(@Qualifier("analysisChatClient") ChatClient chatClient,
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
                Assess the recommendation letters.
                Return in "fields": recommenders (list of {name, role, relationship}),
                endorsement_strength (weak/moderate/strong), specific_examples (list)
                and recommendation_score (0-100).
                """;
    }
}
