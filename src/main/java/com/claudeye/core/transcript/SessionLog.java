package com.claudeye.core.transcript;

import com.claudeye.core.evals.LogStats;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A parsed transcript: one JSON node per parseable line, the raw lines, and
 * summary statistics.
 */
public record SessionLog(List<JsonNode> entries, List<String> rawLines, LogStats stats) {
    public SessionLog {
        entries = List.copyOf(entries);
        rawLines = List.copyOf(rawLines);
    }
}
