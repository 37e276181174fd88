package com.claudeye.dispatch.api;

/**
 * Body of {@code POST /api/queue-item}. {@code agentId} targets a subagent of the session.
 */
public record QueueItemRequest(
    String type,
    String projectName,
    String sessionId,
    String itemName,
    Boolean forceRefresh,
    String agentId,
    String subagentType,
    String subagentDescription
) {
    public boolean isForceRefresh() {
        return Boolean.TRUE.equals(forceRefresh);
    }

    public boolean isSubagent() {
        return agentId != null && !agentId.isBlank();
    }

    public boolean hasRequiredFields() {
        return notBlank(type) && notBlank(projectName) && notBlank(sessionId) && notBlank(itemName);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
