package com.crossreview.core.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param cancelledTasks number of in-flight runner tasks a cancel signal was sent to
 */
public record CancelResult(
    boolean success,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("cancelled_tasks") int cancelledTasks
) {}
