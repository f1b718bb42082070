package com.example.evaluator.model;

/**
 * Verdict of a checkpoint validator on the producer's current output.
 */
public record ValidationDecision(
        ValidationVerdict verdict,
        RemediationHint hint
) {
    public static ValidationDecision accepted() {
        return new ValidationDecision(ValidationVerdict.ACCEPTED, null);
    }

    public static ValidationDecision needsRemediation(RemediationHint hint) {
        return new ValidationDecision(ValidationVerdict.NEEDS_REMEDIATION, hint);
    }

    public boolean isAccepted() {
        return verdict == ValidationVerdict.ACCEPTED;
    }
}
