package com.example.evaluator.service;

import com.example.evaluator.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Process-wide view of task executions: what is running now, recent history, error counts.
 * Thread-safe; all state is guarded by the monitor's own lock.
 */
@Component
public class TaskExecutionMonitor {

    static final int MAX_HISTORY = 100;
    private static final int RECENT = 10;

    private final Map<String, Instant> running = new LinkedHashMap<>();
    private final Deque<ExecutionRecord> history = new ArrayDeque<>();
    private long totalCalls;
    private long totalErrors;

    /**
     * A finished execution.
     *
     * @param caseId     case the task ran for
     * @param taskName   task
     * @param status     final status
     * @param durationMs wall-clock duration
     * @param error      failure message, if any
     * @param finishedAt completion time
     */
    public record ExecutionRecord(String caseId, String taskName, TaskStatus status,
                                  long durationMs, String error, Instant finishedAt) {}

    /**
     * @param totalCalls        executions started since startup
     * @param totalErrors       executions that failed
     * @param running           currently running task counts by task name
     * @param recent            last executions, oldest first
     * @param averageDurationMs mean duration of the recent successful executions
     */
    public record Snapshot(long totalCalls, long totalErrors, Map<String, Integer> running,
                           List<ExecutionRecord> recent, double averageDurationMs) {}

    public synchronized void started(String caseId, String taskName) {
        running.put(key(caseId, taskName), Instant.now());
        totalCalls++;
    }

    public synchronized void finished(String caseId, String taskName, TaskStatus status, String error) {
        Instant start = running.remove(key(caseId, taskName));
        Instant now = Instant.now();
        long duration = start != null ? now.toEpochMilli() - start.toEpochMilli() : 0L;
        if (status == TaskStatus.FAILED) {
            totalErrors++;
        }
        history.addLast(new ExecutionRecord(caseId, taskName, status, duration, error, now));
        while (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
    }

    public synchronized Snapshot snapshot() {
        Map<String, Integer> runningByTask = new TreeMap<>();
        running.keySet().forEach(k -> runningByTask.merge(k.substring(k.indexOf('/') + 1), 1, Integer::sum));

        List<ExecutionRecord> all = List.copyOf(history);
        List<ExecutionRecord> recent = all.subList(Math.max(0, all.size() - RECENT), all.size());
        double avg = recent.stream()
                .filter(r -> r.status() == TaskStatus.SUCCESS)
                .mapToLong(ExecutionRecord::durationMs)
                .average()
                .orElse(0.0);
        return new Snapshot(totalCalls, totalErrors, runningByTask, List.copyOf(recent), avg);
    }

    public synchronized List<ExecutionRecord> history(String taskName) {
        return history.stream().filter(r -> r.taskName().equals(taskName)).toList();
    }

    private static String key(String caseId, String taskName) {
        return caseId + "/" + taskName;
    }
}
