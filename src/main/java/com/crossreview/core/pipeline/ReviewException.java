package com.crossreview.core.pipeline;

/**
 * Aborts a pipeline operation with a typed {@link ReviewError}.
 */
public class ReviewException extends RuntimeException {

    private final ReviewError error;

    public ReviewException(ReviewError error, String message) {
        super(message);
        this.error = error;
    }

    public ReviewError getError() {
        return error;
    }
}
