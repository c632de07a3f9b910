package com.crossreview.core.model;

import java.io.Serializable;

/**
 * Risk classification of one changed file.
 *
 * @param fileIdentity identity of the file (always present; derived from {@code path} when the LLM omits it)
 * @param path         normalized project-relative path
 * @param riskLevel    low-risk or high-risk
 * @param reasoning    short justification, reused as context for the high-risk reviewers
 * @param cached       true when served from the review cache rather than a fresh LLM call
 */
public record FileClassification(
    FileIdentity fileIdentity,
    String path,
    RiskLevel riskLevel,
    String reasoning,
    boolean cached
) implements Serializable {

    public FileClassification asCached() {
        return new FileClassification(fileIdentity, path, riskLevel, reasoning, true);
    }
}
