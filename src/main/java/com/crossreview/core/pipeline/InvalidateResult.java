package com.crossreview.core.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvalidateResult(
    boolean success,
    int invalidated,
    ReviewError error,
    String message
) {

    public static InvalidateResult success(int invalidated) {
        return new InvalidateResult(true, invalidated, null, null);
    }

    public static InvalidateResult failure(ReviewError error, String message) {
        return new InvalidateResult(false, 0, error, message);
    }
}
