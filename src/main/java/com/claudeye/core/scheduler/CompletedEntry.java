package com.claudeye.core.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompletedEntry(
    String key,
    WorkType type,
    String projectName,
    String sessionId,
    String itemName,
    long completedAt,
    long durationMs,
    boolean success,
    String error
) {}
