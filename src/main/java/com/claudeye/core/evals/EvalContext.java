package com.claudeye.core.evals;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * What a registered item sees: the parsed transcript entries plus identifying
 * details of the session or subagent they came from.
 *
 * @param scope {@link ItemScope#SESSION} or {@link ItemScope#SUBAGENT}, never {@code BOTH}
 */
public record EvalContext(
    List<JsonNode> entries,
    LogStats stats,
    String projectName,
    String sessionId,
    ItemScope scope,
    String subagentId,
    String subagentType,
    String subagentDescription,
    String parentSessionId
) {
    public EvalContext {
        entries = entries == null ? List.of() : List.copyOf(entries);
        stats = stats == null ? LogStats.EMPTY : stats;
    }

    public static EvalContext forSession(List<JsonNode> entries, LogStats stats,
                                         String projectName, String sessionId) {
        return new EvalContext(entries, stats, projectName, sessionId, ItemScope.SESSION,
                null, null, null, null);
    }

    public static EvalContext forSubagent(List<JsonNode> entries, LogStats stats, String projectName,
                                          String parentSessionId, String agentId,
                                          String subagentType, String subagentDescription) {
        return new EvalContext(entries, stats, projectName, parentSessionId, ItemScope.SUBAGENT,
                agentId, subagentType, subagentDescription, parentSessionId);
    }
}
