package com.example.evaluator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Combines the four specialist readings into one recommendation.
 * Any reading that is unavailable reaches the model as the "unknown" marker, and the model is
 * told to treat it as missing evidence.
 */
@Service
public class StudentSynthesisAgent extends AbstractLlmTask {

    public static final String NAME = "student_evaluator";

    private static final String SYSTEM_PROMPT = """
            You are the synthesis expert of a student internship review panel.

            TASK:
            Combine the specialist readings into an overall, evidence-based recommendation.

            RULES:
            - Use only the specialist inputs and the packet; do not re-grade from scratch
            - Judge achievements relative to the school context
            - An input marked "unknown — data unavailable" is missing evidence: do not guess it,
              mention it among the open questions and lower the confidence
            - Be decisive: name the top three decision drivers and the single biggest risk
            """;

    public StudentSynthesisAgent(@Qualifier("analysisChatClient") ChatClient chatClient,
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
                Produce the overall evaluation of this student.
                Return in "fields": overall_score (0-100), recommendation
                (strongly_recommend/recommend/consider/decline), decision_drivers (list),
                biggest_risk and open_questions (list).
                """;
    }
}
