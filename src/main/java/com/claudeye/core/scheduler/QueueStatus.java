package com.claudeye.core.scheduler;

import java.util.List;

/**
 * Point-in-time copy of the scheduler state. Completed entries are newest first.
 *
 * @param scannedAt epoch millis of the last background scan, 0 if none ran
 */
public record QueueStatus(
    List<PendingEntry> pending,
    List<ProcessingEntry> processing,
    List<CompletedEntry> completed,
    long scannedAt,
    boolean backgroundRunning,
    List<QueueError> recentErrors
) {}
