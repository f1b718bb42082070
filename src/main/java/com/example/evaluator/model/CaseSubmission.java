package com.example.evaluator.model;

/**
 * Request body of {@code POST /api/cases}.
 *
 * @param caseId     existing or caller-chosen case id; generated when absent
 * @param sourceText raw text of the case documents
 */
public record CaseSubmission(
        String caseId,
        String sourceText
) {}
