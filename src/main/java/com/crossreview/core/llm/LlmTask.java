package com.crossreview.core.llm;

import java.time.Duration;

/**
 * A single prompt sent to the external LLM task runner.
 *
 * @param taskId      unique id, namespaced under the owning session id ({@code <sessionId>-...})
 * @param stage       pipeline stage label used for logging and metrics
 * @param prompt      full prompt text
 * @param projectPath working directory for runners that execute inside the project
 * @param timeout     hard limit after which the task is abandoned
 */
public record LlmTask(
    String taskId,
    String stage,
    String prompt,
    String projectPath,
    Duration timeout
) {}
