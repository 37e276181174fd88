package com.claudeye.core.scheduler;

public record PendingEntry(
    String key,
    WorkType type,
    String projectName,
    String sessionId,
    String itemName,
    int priority,
    String priorityLabel,
    long addedAt
) {}
