package com.example.evaluator.agent;

import com.example.evaluator.config.EvaluationProperties;
import com.example.evaluator.model.RemediationHint;
import com.example.evaluator.model.TaskResult;
import com.example.evaluator.model.ValidationDecision;
import com.example.evaluator.orchestrator.CaseContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Checks the school context before the synthesis stage relies on it.
 * <p>
 * Rejects when a required field is missing or blank, when {@code opportunity_score} is not a
 * number in 0-100, or when the school name disagrees with the one read from the packet.
 */
@Service
public class SchoolContextValidator implements CheckpointValidator {

    public static final String NAME = "school_context_validator";

    static final List<String> DEFAULT_REQUIRED_FIELDS = List.of("school_name", "state_code", "opportunity_score");

    private final List<String> requiredFields;

    @Autowired
    public SchoolContextValidator(EvaluationProperties properties) {
        this(properties.checkpoint() == null ? List.of() : properties.checkpoint().requiredFields());
    }

    SchoolContextValidator(Collection<String> requiredFields) {
        this.requiredFields = requiredFields == null || requiredFields.isEmpty()
                ? DEFAULT_REQUIRED_FIELDS
                : List.copyOf(requiredFields);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ValidationDecision validate(CaseContext context, TaskResult producerResult) {
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            if (isBlank(producerResult.payload().get(field))) {
                missing.add(field);
            }
        }

        List<String> inconsistencies = new ArrayList<>();
        Object score = producerResult.payload().get("opportunity_score");
        if (!isBlank(score) && !isScore(score)) {
            inconsistencies.add("opportunity_score must be a number between 0 and 100, got '" + score + "'");
        }

        Object schoolName = producerResult.payload().get("school_name");
        context.upstreamField(DocumentCanonicalizerAgent.NAME, "school_name")
                .filter(expected -> !isBlank(expected) && !isBlank(schoolName))
                .filter(expected -> !sameSchool(expected.toString(), schoolName.toString()))
                .ifPresent(expected -> inconsistencies.add(
                        "school_name '" + schoolName + "' does not match the packet's school '" + expected + "'"));

        if (missing.isEmpty() && inconsistencies.isEmpty()) {
            return ValidationDecision.accepted();
        }
        return ValidationDecision.needsRemediation(new RemediationHint(missing, inconsistencies,
                "Use the school named in the application packet and fill every required field."));
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }

    private static boolean isScore(Object value) {
        double score;
        if (value instanceof Number n) {
            score = n.doubleValue();
        } else {
            try {
                score = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return score >= 0 && score <= 100;
    }

    /** Lenient match: case, punctuation and a "High School" suffix are ignored. */
    static boolean sameSchool(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        return left.equals(right) || left.contains(right) || right.contains(left);
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9 ]", " ")
                .replaceAll("\\bhigh school\\b|\\bhs\\b", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
