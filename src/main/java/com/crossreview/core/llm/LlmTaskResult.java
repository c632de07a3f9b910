package com.crossreview.core.llm;

/**
 * Outcome of an {@link LlmTask}. Runners never throw for task-level failures; they report them here.
 *
 * @param taskId     the task this result belongs to
 * @param success    true when the runner produced non-empty output
 * @param output     raw model output (null on failure)
 * @param error      failure description (null on success)
 * @param durationMs wall-clock duration
 */
public record LlmTaskResult(
    String taskId,
    boolean success,
    String output,
    String error,
    long durationMs
) {

    public static LlmTaskResult success(String taskId, String output, long durationMs) {
        return new LlmTaskResult(taskId, true, output, null, durationMs);
    }

    public static LlmTaskResult failure(String taskId, String error, long durationMs) {
        return new LlmTaskResult(taskId, false, null, error, durationMs);
    }
}
