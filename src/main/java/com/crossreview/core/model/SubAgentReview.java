package com.crossreview.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Raw findings from one of the independent reviewer slots of a high-risk file.
 * A reviewer that failed or produced unparseable output is represented with an empty list.
 */
public record SubAgentReview(
    String agentId,
    List<Finding> findings,
    Instant producedAt
) implements Serializable {

    public SubAgentReview {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static SubAgentReview empty(String agentId) {
        return new SubAgentReview(agentId, List.of(), Instant.now());
    }
}
