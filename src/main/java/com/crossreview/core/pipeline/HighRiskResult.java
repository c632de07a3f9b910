package com.crossreview.core.pipeline;

import com.crossreview.core.model.Finding;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one {@code advanceHighRisk} step.
 *
 * @param complete true once no high-risk files remain after this step
 * @param file     the file processed by this step, null when there was nothing left to process
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HighRiskResult(
    boolean success,
    @JsonProperty("session_id") String sessionId,
    boolean complete,
    @JsonProperty("finding_count") int findingCount,
    String file,
    List<Finding> findings,
    ReviewError error,
    String message
) {

    public static HighRiskResult success(String sessionId, boolean complete, String file, List<Finding> findings) {
        return new HighRiskResult(true, sessionId, complete, findings.size(), file, List.copyOf(findings), null, null);
    }

    public static HighRiskResult alreadyComplete(String sessionId) {
        return new HighRiskResult(true, sessionId, true, 0, null, List.of(), null, null);
    }

    public static HighRiskResult failure(String sessionId, ReviewError error, String message) {
        return new HighRiskResult(false, sessionId, false, 0, null, null, error, message);
    }
}
