package com.crossreview.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for the fingerprint and cache invalidation endpoints.
 *
 * @param files nullable for invalidation, meaning every cached file of the project
 */
public record ProjectFilesRequest(
    @JsonProperty("project_path") String projectPath,
    List<String> files
) {}
