package com.claudeye.core.evals;

/**
 * Passed to alert callbacks once a session's evals and enrichments are all available.
 */
public record AlertContext(
    String projectName,
    String sessionId,
    EvalRunSummary evalSummary,
    EnrichRunSummary enrichSummary
) {}
