package com.example.evaluator.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class MdcPropagatingExecutorTest {

    private final ExecutorService pool = Executors.newSingleThreadExecutor();
    private final MdcPropagatingExecutor executor = new MdcPropagatingExecutor(pool);

    @AfterEach
    void tearDown() {
        MDC.clear();
        pool.shutdownNow();
    }

    @Test
    void workerSeesTheSubmittersCaseId() {
        MDC.put("caseId", "c-42");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("caseId"), executor).join();

        assertThat(seen).isEqualTo("c-42");
    }

    @Test
    void workerContextIsClearedAfterwards() {
        MDC.put("caseId", "c-42");
        CompletableFuture.runAsync(() -> { }, executor).join();
        MDC.clear();

        String leftover = CompletableFuture.supplyAsync(() -> MDC.get("caseId"), pool).join();

        assertThat(leftover).isNull();
    }
}
