package com.example.evaluator.repository;

import com.example.evaluator.model.CaseRecord;
import com.example.evaluator.model.CaseStatus;
import com.example.evaluator.model.TaskResult;
import com.example.evaluator.model.ValidationAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link PersistenceGateway} on MongoDB through Spring Data repositories.
 * <p>
 * Task results are written with {@code insert}, never {@code save}: the id embeds the revision,
 * so an existing revision can not be overwritten. A concurrent writer on the same slot makes the
 * insert collide and the revision is recomputed.
 */
public class MongoPersistenceGateway implements PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(MongoPersistenceGateway.class);
    private static final int MAX_REVISION_RETRIES = 3;

    private final CaseRepository caseRepository;
    private final TaskResultRepository taskResultRepository;
    private final ValidationAttemptRepository validationAttemptRepository;

    public MongoPersistenceGateway(CaseRepository caseRepository,
                                   TaskResultRepository taskResultRepository,
                                   ValidationAttemptRepository validationAttemptRepository) {
        this.caseRepository = caseRepository;
        this.taskResultRepository = taskResultRepository;
        this.validationAttemptRepository = validationAttemptRepository;
    }

    @Override
    public CaseRecord createCase(String caseId, String sourceText, String sourceName) {
        String id = caseId != null && !caseId.isBlank() ? caseId : UUID.randomUUID().toString();
        return access("create case " + id, () -> {
            try {
                return caseRepository.insert(CaseRecord.placeholder(id, sourceText, sourceName));
            } catch (DuplicateKeyException e) {
                throw new IllegalStateException("Case '" + id + "' already exists", e);
            }
        });
    }

    @Override
    public Optional<CaseRecord> findCase(String caseId) {
        return access("find case " + caseId, () -> caseRepository.findById(caseId));
    }

    @Override
    public CaseRecord setCaseStatus(String caseId, CaseStatus status) {
        return access("update status of case " + caseId, () -> {
            CaseRecord current = caseRepository.findById(caseId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown case '" + caseId + "'"));
            return caseRepository.save(current.withStatus(status));
        });
    }

    @Override
    public TaskResult saveResult(TaskResult result) {
        return access("save " + result.taskName() + " for case " + result.caseId(), () -> {
            DuplicateKeyException lastCollision = null;
            for (int i = 0; i < MAX_REVISION_RETRIES; i++) {
                int next = taskResultRepository
                        .findFirstByCaseIdAndTaskNameOrderByRevisionDesc(result.caseId(), result.taskName())
                        .map(TaskResult::revision)
                        .orElse(0) + 1;
                try {
                    return taskResultRepository.insert(result.withRevision(next));
                } catch (DuplicateKeyException e) {
                    lastCollision = e;
                    log.debug("Revision {} of {}:{} already taken, retrying", next, result.caseId(), result.taskName());
                }
            }
            throw lastCollision;
        });
    }

    @Override
    public Optional<TaskResult> getResult(String caseId, String taskName) {
        return access("read " + taskName + " for case " + caseId,
                () -> taskResultRepository.findFirstByCaseIdAndTaskNameOrderByRevisionDesc(caseId, taskName));
    }

    @Override
    public List<TaskResult> getResultHistory(String caseId, String taskName) {
        return access("read history of " + taskName + " for case " + caseId,
                () -> taskResultRepository.findByCaseIdAndTaskNameOrderByRevisionAsc(caseId, taskName));
    }

    @Override
    public List<TaskResult> latestResults(String caseId) {
        return access("read results of case " + caseId, () -> {
            Map<String, TaskResult> latest = new LinkedHashMap<>();
            taskResultRepository.findByCaseIdOrderByRevisionAsc(caseId)
                    .forEach(r -> latest.put(r.taskName(), r));
            return new ArrayList<>(latest.values());
        });
    }

    @Override
    public ValidationAttempt saveValidationAttempt(ValidationAttempt attempt) {
        return access("save validation attempt for case " + attempt.caseId(),
                () -> validationAttemptRepository.insert(attempt));
    }

    @Override
    public List<ValidationAttempt> validationAttempts(String caseId) {
        return access("read validation attempts of case " + caseId,
                () -> validationAttemptRepository.findByCaseIdOrderByRecordedAtAsc(caseId));
    }

    @Override
    public String mode() {
        return "mongo";
    }

    private static <T> T access(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new PersistenceUnavailableException("MongoDB unavailable, could not " + operation, e);
        }
    }
}
