package com.crossreview.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-file progress reported while a high-risk file moves through the multi-agent protocol.
 */
public enum HighRiskStatus {
    REVIEWING,
    COORDINATING,
    VERIFYING,
    COMPLETE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
