package com.crossreview.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Independent accuracy check of a single consolidated finding.
 *
 * @param findingId  id of the finding that was checked
 * @param accurate   whether the issue is real and lies in modified code
 * @param confidence verifier confidence in [0, 1]
 * @param reasoning  verifier explanation
 */
public record VerificationResult(
    String findingId,
    @JsonProperty("isAccurate") boolean accurate,
    double confidence,
    String reasoning
) implements Serializable {}
