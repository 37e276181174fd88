package com.claudeye.core.transcript;

import java.io.IOException;

/**
 * Reads transcripts from wherever they are stored.
 */
public interface SessionLogLoader {

    SessionLog load(String projectName, String sessionId) throws IOException;

    /** @throws java.io.FileNotFoundException when no candidate location holds the subagent log */
    SessionLog loadSubagent(String projectName, String sessionId, String agentId) throws IOException;
}
