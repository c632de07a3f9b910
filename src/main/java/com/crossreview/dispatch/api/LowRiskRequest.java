package com.crossreview.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/reviews/{id}/low-risk: the confirmed risk partition.
 */
public record LowRiskRequest(
    @JsonProperty("low_risk_files") List<String> lowRiskFiles,
    @JsonProperty("high_risk_files") List<String> highRiskFiles
) {}
