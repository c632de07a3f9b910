package com.crossreview.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A notification emitted while a review session progresses, used for SSE streaming and CLI output.
 *
 * @param eventType one of the {@code TYPE_*} constants
 * @param sessionId the session this event belongs to
 * @param file      the file this event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ReviewEvent(
    String eventType,
    String sessionId,
    String file,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TYPE_CLASSIFICATIONS = "review.classifications";
    public static final String TYPE_LOW_RISK_FINDINGS = "review.low-risk-findings";
    public static final String TYPE_HIGH_RISK_STATUS = "review.high-risk-status";
    public static final String TYPE_HIGH_RISK_FINDINGS = "review.high-risk-findings";
    public static final String TYPE_FAILED = "review.failed";
    public static final String TYPE_CANCELLED = "review.cancelled";

    /** Payload flag on findings events: the session has no further step. */
    public static final String KEY_COMPLETE = "complete";
    /** Payload flag on failed events: the session moved to FAILED and cannot be retried. */
    public static final String KEY_FATAL = "fatal";

    public static ReviewEvent of(String eventType, String sessionId, String file, Map<String, Object> payload) {
        return new ReviewEvent(eventType, sessionId, file, payload, Instant.now());
    }

    /**
     * True when no further event will follow for this session.
     */
    public boolean endsSession() {
        if (TYPE_CANCELLED.equals(eventType)) {
            return true;
        }
        if (payload == null) {
            return false;
        }
        if (TYPE_FAILED.equals(eventType)) {
            return Boolean.TRUE.equals(payload.get(KEY_FATAL));
        }
        return Boolean.TRUE.equals(payload.get(KEY_COMPLETE));
    }
}
