package com.crossreview.core.session;

import com.crossreview.core.model.FileClassification;
import com.crossreview.core.model.Finding;
import com.crossreview.core.model.ReviewStage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of a {@link ReviewSession}, safe to serialize.
 */
public record SessionSnapshot(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("project_path") String projectPath,
    List<String> files,
    ReviewStage stage,
    List<FileClassification> classifications,
    @JsonProperty("low_risk_files") List<String> lowRiskFiles,
    @JsonProperty("high_risk_files") List<String> highRiskFiles,
    @JsonProperty("high_risk_cursor") int highRiskCursor,
    List<Finding> findings,
    @JsonProperty("last_error") String lastError,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {}
