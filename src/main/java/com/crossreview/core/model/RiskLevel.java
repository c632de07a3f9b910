package com.crossreview.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk bucket a changed file is sorted into before deep review.
 */
public enum RiskLevel {
    LOW_RISK("low-risk"),
    HIGH_RISK("high-risk");

    private final String wireName;

    RiskLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Lenient lookup accepting {@code low-risk}, {@code LOW_RISK}, {@code low} and friends.
     *
     * @return the matching level, or {@code null} when the text is not recognised
     */
    @JsonCreator
    public static RiskLevel fromWire(String raw) {
        if (raw == null) return null;
        String normalized = raw.trim().toLowerCase().replace('_', '-').replace(' ', '-');
        return switch (normalized) {
            case "low-risk", "low" -> LOW_RISK;
            case "high-risk", "high" -> HIGH_RISK;
            default -> null;
        };
    }
}
