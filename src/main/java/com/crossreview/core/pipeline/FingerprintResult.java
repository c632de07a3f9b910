package com.crossreview.core.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * @param fingerprints normalized path to lowercase hex SHA-256 of its pending diff, in input order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FingerprintResult(
    boolean success,
    Map<String, String> fingerprints,
    ReviewError error,
    String message
) {

    public static FingerprintResult success(Map<String, String> fingerprints) {
        return new FingerprintResult(true, fingerprints, null, null);
    }

    public static FingerprintResult failure(ReviewError error, String message) {
        return new FingerprintResult(false, null, error, message);
    }
}
