package com.crossreview.core.llm;

import java.util.Set;

/**
 * External collaborator that executes one prompt against a language model.
 */
public interface LlmTaskRunner {

    /**
     * Runs the task to completion, timeout, failure or cancellation. Blocks the calling thread.
     * Never throws for task-level problems; those come back as {@link LlmTaskResult#failure}.
     */
    LlmTaskResult run(LlmTask task, CancellationToken token);

    /**
     * Best-effort cancellation of an active task. Unknown ids are ignored.
     */
    void cancel(String taskId);

    /**
     * Ids of tasks currently executing.
     */
    Set<String> activeTaskIds();
}
