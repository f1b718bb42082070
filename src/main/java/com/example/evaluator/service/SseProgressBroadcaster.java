package com.example.evaluator.service;

import com.example.evaluator.model.ProgressEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pushes progress events to per-case Server-Sent-Events subscribers.
 * <p>
 * {@link #emit} only enqueues. Delivery happens on a single dispatcher thread fed by a bounded
 * queue; when the queue is full the oldest pending event is dropped, so a slow or stuck
 * subscriber costs events, never pipeline time.
 */
@Component
public class SseProgressBroadcaster implements ProgressEmitter {

    private static final Logger log = LoggerFactory.getLogger(SseProgressBroadcaster.class);

    static final int QUEUE_CAPACITY = 1024;
    private static final long SUBSCRIPTION_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(30);

    private final Map<String, List<SseEmitter>> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong dropped = new AtomicLong();
    private final ThreadPoolExecutor dispatcher;

    public SseProgressBroadcaster() {
        this.dispatcher = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(QUEUE_CAPACITY),
                r -> {
                    Thread t = new Thread(r, "progress-dispatch");
                    t.setDaemon(true);
                    return t;
                },
                (task, executor) -> {
                    dropped.incrementAndGet();
                    if (!executor.isShutdown()) {
                        executor.getQueue().poll();
                        executor.getQueue().offer(task);
                    }
                });
    }

    @Override
    public void emit(ProgressEvent event) {
        if (!subscribers.containsKey(event.caseId())) {
            return;
        }
        dispatcher.execute(() -> deliver(event));
    }

    /** Opens a stream for one case; it completes when the case reaches a terminal status. */
    public SseEmitter subscribe(String caseId) {
        return register(caseId, new SseEmitter(SUBSCRIPTION_TIMEOUT_MS));
    }

    SseEmitter register(String caseId, SseEmitter emitter) {
        List<SseEmitter> list = subscribers.computeIfAbsent(caseId, k -> new CopyOnWriteArrayList<>());
        list.add(emitter);
        emitter.onCompletion(() -> unregister(caseId, emitter));
        emitter.onTimeout(() -> unregister(caseId, emitter));
        emitter.onError(e -> unregister(caseId, emitter));
        return emitter;
    }

    /** Events discarded because the dispatch queue was full. */
    public long droppedEvents() {
        return dropped.get();
    }

    private void deliver(ProgressEvent event) {
        List<SseEmitter> list = subscribers.get(event.caseId());
        if (list == null) {
            return;
        }
        for (SseEmitter emitter : list) {
            try {
                emitter.send(SseEmitter.event()
                        .name(event.state().name().toLowerCase())
                        .data(event));
                if (event.isTerminal()) {
                    emitter.complete();
                }
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping progress subscriber of case {}: {}", event.caseId(), e.getMessage());
                unregister(event.caseId(), emitter);
            }
        }
    }

    private void unregister(String caseId, SseEmitter emitter) {
        subscribers.computeIfPresent(caseId, (k, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
    }

    @PreDestroy
    void shutdown() {
        dispatcher.shutdownNow();
    }
}
