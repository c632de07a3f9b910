package com.crossreview.core.pipeline;

import com.crossreview.core.model.FileClassification;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StartResult(
    boolean success,
    @JsonProperty("session_id") String sessionId,
    List<FileClassification> classifications,
    ReviewError error,
    String message
) {

    public static StartResult success(String sessionId, List<FileClassification> classifications) {
        return new StartResult(true, sessionId, List.copyOf(classifications), null, null);
    }

    public static StartResult failure(String sessionId, ReviewError error, String message) {
        return new StartResult(false, sessionId, null, error, message);
    }
}
