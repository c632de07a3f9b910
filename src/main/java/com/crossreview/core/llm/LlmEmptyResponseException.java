package com.crossreview.core.llm;

/**
 * Thrown when the LLM returns null or blank content.
 */
public class LlmEmptyResponseException extends LlmTaskException {
    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
