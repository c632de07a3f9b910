package com.crossreview.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * SHA-256 (lowercase hex) of a file's pending diff. Changes whenever the diff changes.
 */
public record ContentFingerprint(String hex) implements Serializable {

    public ContentFingerprint {
        if (hex == null || hex.length() != 64) {
            throw new IllegalArgumentException("Fingerprint must be a 64-character SHA-256 hex digest");
        }
    }

    @JsonValue
    @Override
    public String hex() {
        return hex;
    }

    public String shortHex() {
        return hex.substring(0, 8);
    }

    @Override
    public String toString() {
        return hex;
    }
}
