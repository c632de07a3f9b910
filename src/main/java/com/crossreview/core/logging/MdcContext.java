package com.crossreview.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing review-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setStage(String sessionId, String stage) {
        MDC.put("sessionId", sessionId);
        MDC.put("stage", stage);
    }

    public static void setTask(String sessionId, String taskId, String agentId) {
        MDC.put("sessionId", sessionId);
        MDC.put("taskId", taskId);
        if (agentId != null) {
            MDC.put("agentId", agentId);
        }
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("agentId");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("taskId");
        MDC.remove("agentId");
        MDC.remove("stage");
    }
}
