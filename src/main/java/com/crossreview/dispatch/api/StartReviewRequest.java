package com.crossreview.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/reviews.
 *
 * @param projectPath absolute path to the project (git working tree)
 * @param files       changed files, relative to the project
 * @param sessionId   caller-chosen session id; nullable, generated when absent
 */
public record StartReviewRequest(
    @JsonProperty("project_path") String projectPath,
    List<String> files,
    @JsonProperty("session_id") String sessionId
) {}
