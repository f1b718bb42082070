package com.example.evaluator.repository;

import com.example.evaluator.model.AuditEvent;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AuditEventRepository extends MongoRepository<AuditEvent, String> {

    List<AuditEvent> findByCaseIdOrderByTimestampAsc(String caseId);
}
