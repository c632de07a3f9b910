package com.crossreview.core.pipeline;

import com.crossreview.core.model.Finding;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LowRiskResult(
    boolean success,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("finding_count") int findingCount,
    List<Finding> findings,
    ReviewError error,
    String message
) {

    public static LowRiskResult success(String sessionId, List<Finding> findings) {
        return new LowRiskResult(true, sessionId, findings.size(), List.copyOf(findings), null, null);
    }

    public static LowRiskResult failure(String sessionId, ReviewError error, String message) {
        return new LowRiskResult(false, sessionId, 0, null, error, message);
    }
}
