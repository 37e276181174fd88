package com.claudeye.core.transcript;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Resolves where a subagent transcript lives. Claude Code has written them to
 * three different places over time, so each is tried in order.
 */
public final class SubagentFiles {

    private SubagentFiles() {}

    public static List<Path> candidates(Path projectsRoot, String projectName, String sessionId, String agentId) {
        String fileName = "agent-" + agentId + ".jsonl";
        Path projectDir = projectsRoot.resolve(projectName);
        return List.of(
                projectDir.resolve(fileName),
                projectDir.resolve(sessionId).resolve(fileName),
                projectDir.resolve(sessionId).resolve("subagents").resolve(fileName)
        );
    }

    public static Optional<Path> locate(Path projectsRoot, String projectName, String sessionId, String agentId) {
        return candidates(projectsRoot, projectName, sessionId, agentId).stream()
                .filter(Files::isRegularFile)
                .findFirst();
    }

    /** Cache and queue namespace for a subagent: {@code sessionId/agent-{agentId}}. */
    public static String sessionKey(String sessionId, String agentId) {
        return sessionId + "/agent-" + agentId;
    }
}
