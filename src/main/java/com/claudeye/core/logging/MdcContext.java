package com.claudeye.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Claudeye-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String projectName, String sessionId) {
        MDC.put("projectName", projectName);
        MDC.put("sessionId", sessionId);
    }

    public static void setWorkItem(String workType, String projectName, String sessionId, String itemName) {
        setSession(projectName, sessionId);
        MDC.put("workType", workType);
        MDC.put("itemName", itemName);
    }

    public static void clear() {
        MDC.remove("projectName");
        MDC.remove("sessionId");
        MDC.remove("workType");
        MDC.remove("itemName");
    }
}
