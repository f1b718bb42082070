package com.example.evaluator.repository;

import com.example.evaluator.model.CaseRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Case records (collection {@code cases}).
 */
public interface CaseRepository extends MongoRepository<CaseRecord, String> {
}
