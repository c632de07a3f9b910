package com.crossreview.core.llm;

/**
 * Thrown by a runner backend when the model invocation itself fails.
 */
public class LlmTaskException extends RuntimeException {
    public LlmTaskException(String message) {
        super(message);
    }

    public LlmTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
