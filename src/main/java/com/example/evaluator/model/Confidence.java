package com.example.evaluator.model;

import java.util.Locale;

/**
 * Ordinal confidence attached to every task result.
 * Declaration order matters: later constants are more confident.
 */
public enum Confidence {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    /**
     * Parses the label a model returns ("high", "very-high", "Very High", "0.8"...).
     * Unknown or missing labels map to {@link #LOW}.
     */
    public static Confidence fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return LOW;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Confidence c : values()) {
            if (c.name().equals(normalized)) {
                return c;
            }
        }
        try {
            return fromScore(Double.parseDouble(normalized));
        } catch (NumberFormatException e) {
            return LOW;
        }
    }

    /** Maps a 0.0-1.0 score onto the ordinal scale. */
    public static Confidence fromScore(double score) {
        if (score <= 0.0) return NONE;
        if (score < 0.5) return LOW;
        if (score < 0.75) return MEDIUM;
        if (score < 0.9) return HIGH;
        return VERY_HIGH;
    }

    /** Returns this confidence, lowered to {@code cap} if it is above it. */
    public Confidence atMost(Confidence cap) {
        return compareTo(cap) > 0 ? cap : this;
    }
}
