package com.claudeye.core.scheduler;

public record ProcessingEntry(
    String key,
    WorkType type,
    String projectName,
    String sessionId,
    String itemName,
    int priority,
    long startedAt
) {}
