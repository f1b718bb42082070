package com.example.evaluator.repository;

import com.example.evaluator.model.TaskResult;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Every revision of every task result (collection {@code task_results}).
 */
public interface TaskResultRepository extends MongoRepository<TaskResult, String> {

    Optional<TaskResult> findFirstByCaseIdAndTaskNameOrderByRevisionDesc(String caseId, String taskName);

    List<TaskResult> findByCaseIdAndTaskNameOrderByRevisionAsc(String caseId, String taskName);

    List<TaskResult> findByCaseIdOrderByRevisionAsc(String caseId);
}
