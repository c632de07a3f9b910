package com.crossreview.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum Severity {
    CRITICAL,
    ERROR,
    WARNING,
    SUGGESTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<Severity> fromWire(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
