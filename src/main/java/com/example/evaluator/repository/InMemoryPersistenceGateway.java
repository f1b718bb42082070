package com.example.evaluator.repository;

import com.example.evaluator.model.CaseRecord;
import com.example.evaluator.model.CaseStatus;
import com.example.evaluator.model.TaskResult;
import com.example.evaluator.model.ValidationAttempt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local {@link PersistenceGateway}, selected with {@code evaluation.persistence=memory}.
 * Keeps every revision; nothing survives a restart.
 */
public class InMemoryPersistenceGateway implements PersistenceGateway {

    private final Map<String, CaseRecord> cases = new ConcurrentHashMap<>();
    private final Map<String, List<TaskResult>> results = new ConcurrentHashMap<>();
    private final Map<String, List<ValidationAttempt>> attempts = new ConcurrentHashMap<>();

    @Override
    public CaseRecord createCase(String caseId, String sourceText, String sourceName) {
        String id = caseId != null && !caseId.isBlank() ? caseId : UUID.randomUUID().toString();
        CaseRecord record = CaseRecord.placeholder(id, sourceText, sourceName);
        if (cases.putIfAbsent(id, record) != null) {
            throw new IllegalStateException("Case '" + id + "' already exists");
        }
        return record;
    }

    @Override
    public Optional<CaseRecord> findCase(String caseId) {
        return Optional.ofNullable(cases.get(caseId));
    }

    @Override
    public CaseRecord setCaseStatus(String caseId, CaseStatus status) {
        CaseRecord updated = cases.computeIfPresent(caseId, (id, current) -> current.withStatus(status));
        if (updated == null) {
            throw new IllegalArgumentException("Unknown case '" + caseId + "'");
        }
        return updated;
    }

    @Override
    public TaskResult saveResult(TaskResult result) {
        List<TaskResult> slot = results.computeIfAbsent(slotKey(result.caseId(), result.taskName()),
                k -> new ArrayList<>());
        synchronized (slot) {
            TaskResult stored = result.withRevision(slot.size() + 1);
            slot.add(stored);
            return stored;
        }
    }

    @Override
    public Optional<TaskResult> getResult(String caseId, String taskName) {
        List<TaskResult> slot = results.get(slotKey(caseId, taskName));
        if (slot == null) {
            return Optional.empty();
        }
        synchronized (slot) {
            return slot.isEmpty() ? Optional.empty() : Optional.of(slot.get(slot.size() - 1));
        }
    }

    @Override
    public List<TaskResult> getResultHistory(String caseId, String taskName) {
        List<TaskResult> slot = results.get(slotKey(caseId, taskName));
        if (slot == null) {
            return List.of();
        }
        synchronized (slot) {
            return List.copyOf(slot);
        }
    }

    @Override
    public List<TaskResult> latestResults(String caseId) {
        String prefix = caseId + "\u0000";
        return results.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .map(e -> getResult(caseId, e.getKey().substring(prefix.length())))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(TaskResult::producedAt))
                .toList();
    }

    @Override
    public ValidationAttempt saveValidationAttempt(ValidationAttempt attempt) {
        attempts.computeIfAbsent(attempt.caseId(), k -> new CopyOnWriteArrayList<>()).add(attempt);
        return attempt;
    }

    @Override
    public List<ValidationAttempt> validationAttempts(String caseId) {
        return List.copyOf(attempts.getOrDefault(caseId, List.of()));
    }

    @Override
    public String mode() {
        return "memory";
    }

    private static String slotKey(String caseId, String taskName) {
        return caseId + "\u0000" + taskName;
    }
}
