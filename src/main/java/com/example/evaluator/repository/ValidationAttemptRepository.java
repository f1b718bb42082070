package com.example.evaluator.repository;

import com.example.evaluator.model.ValidationAttempt;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ValidationAttemptRepository extends MongoRepository<ValidationAttempt, String> {

    List<ValidationAttempt> findByCaseIdOrderByRecordedAtAsc(String caseId);
}
