package com.claudeye.core.processing;

import com.claudeye.core.transcript.SubagentFiles;

/**
 * The transcript a unit of work runs against: a session, or a subagent of
 * a session when {@code agentId} is set.
 */
public record WorkTarget(
    String projectName,
    String sessionId,
    String agentId,
    String subagentType,
    String subagentDescription
) {
    public static WorkTarget session(String projectName, String sessionId) {
        return new WorkTarget(projectName, sessionId, null, null, null);
    }

    public static WorkTarget subagent(String projectName, String sessionId, String agentId,
                                      String subagentType, String subagentDescription) {
        return new WorkTarget(projectName, sessionId, agentId, subagentType, subagentDescription);
    }

    public boolean isSubagent() {
        return agentId != null && !agentId.isBlank();
    }

    /** Cache and queue namespace: the session id, or {@code sessionId/agent-{agentId}}. */
    public String sessionKey() {
        return isSubagent() ? SubagentFiles.sessionKey(sessionId, agentId) : sessionId;
    }
}
