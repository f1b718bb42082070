package com.example.evaluator.config;

import com.example.evaluator.service.MdcPropagatingExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ChatClients for the two LLM providers, plus the executor the tasks run on.
 * <p>
 * - analysisChatClient (OpenAI): reading, context and synthesis tasks
 * - reportChatClient (Anthropic): the report formatter
 */
@Configuration
public class AiConfig {

    @Bean("analysisChatClient")
    public ChatClient analysisChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    @Bean("reportChatClient")
    public ChatClient reportChatClient(AnthropicChatModel anthropicChatModel) {
        return ChatClient.builder(anthropicChatModel).build();
    }

    /**
     * Unbounded pool: a stage node and the task call it waits on each hold a thread,
     * so a fixed pool could starve itself.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentThreadPool() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "agent-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(threads);
    }

    /**
     * Executor for parallel task execution; carries the case id into worker logs.
     */
    @Bean("agentExecutor")
    public Executor agentExecutor(@Qualifier("agentThreadPool") ExecutorService agentThreadPool) {
        return new MdcPropagatingExecutor(agentThreadPool);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
