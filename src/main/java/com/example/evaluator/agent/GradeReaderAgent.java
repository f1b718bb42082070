package com.example.evaluator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Academic record reader: GPA, course rigor, STEM coursework.
 */
@Service
public class GradeReaderAgent extends AbstractLlmTask {

    public static final String NAME = "grade_reader";

    private static final String SYSTEM_PROMPT = """
            You are the academic record specialist of a student internship review panel.

            TASK:
            Extract and interpret the transcript contained in the packet.

            RULES:
            - Copy grades exactly as written; do not convert scales unless the transcript states both
            - Rigor: count AP, IB, honors and dual-enrollment courses
            - Note upward or downward trends across terms
            - If there is no transcript in the packet, say so and return low confidence
            """;

    public GradeReaderAgent(@Qualifier("analysisChatClient") ChatClient chatClient,
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
                Read the academic record.
                Return in "fields": gpa, gpa_scale, course_rigor (low/medium/high),
                advanced_courses (list), stem_courses (list), trend and academic_score (0-100).
                """;
    }
}
