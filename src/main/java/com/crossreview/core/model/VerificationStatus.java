package com.crossreview.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of the accuracy check on a consolidated high-risk finding.
 */
public enum VerificationStatus {
    VERIFIED,
    REJECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
