package com.example.evaluator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * First stage: reads the raw application packet and identifies what is in it.
 * Its {@code school_name} is the reference the school context checkpoint compares against.
 */
@Service
public class DocumentCanonicalizerAgent extends AbstractLlmTask {

    public static final String NAME = "document_canonicalizer";

    private static final String SYSTEM_PROMPT = """
            You are the document intelligence specialist of a student application review panel.

            TASK:
            Read the application packet and describe what it actually contains.

            RULES:
            - Report only what the text says; never infer a name or a school that is not written
            - Split the packet into its sections (application essay, transcript, recommendation, other)
            - If a value cannot be found, return null for it
            """;

    public DocumentCanonicalizerAgent(@Qualifier("analysisChatClient") ChatClient chatClient,
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
                Identify the documents in this application packet.
                Return in "fields": student_name, school_name, state_code (two-letter US code),
                graduation_year, document_types (list) and sections (list of {type, excerpt}).
                """;
    }
}
