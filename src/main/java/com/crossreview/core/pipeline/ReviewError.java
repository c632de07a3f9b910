package com.crossreview.core.pipeline;

/**
 * Typed failure codes returned by pipeline operations.
 */
public enum ReviewError {
    /** Unknown or cancelled session id; the call had no side effects. */
    SESSION_NOT_FOUND,
    /** Malformed input, e.g. an empty file list or an incomplete risk partition. */
    INVALID_REQUEST,
    /** The session is not in a stage that accepts this call. */
    INVALID_STATE,
    /** A fatal-to-call stage error (unparseable classification or coordinator output); retryable. */
    STAGE_FAILED,
    /** Unexpected error; the session has been moved to FAILED. */
    INTERNAL_ERROR
}
