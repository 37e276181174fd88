package com.claudeye.core.scheduler;

import java.util.Comparator;
import java.util.concurrent.CompletableFuture;

/**
 * A pending unit of work. Lives from enqueue until its task starts. The
 * priority is mutable so a later, more urgent request can promote it; it is
 * only changed under the scheduler's lock.
 */
final class QueueEntry {

    /** Priority ascending, then enqueue order. */
    static final Comparator<QueueEntry> ORDER = Comparator
            .comparingInt(QueueEntry::priority)
            .thenComparingLong(QueueEntry::addedAt)
            .thenComparingLong(QueueEntry::sequence);

    private final String key;
    private final WorkType type;
    private final String projectName;
    private final String sessionId;
    private final String itemName;
    private final long addedAt;
    private final long sequence;
    private final WorkTask<?> task;
    private final CompletableFuture<Object> future;
    private int priority;

    QueueEntry(String key, WorkType type, String projectName, String sessionId, String itemName,
               int priority, long addedAt, long sequence, WorkTask<?> task, CompletableFuture<Object> future) {
        this.key = key;
        this.type = type;
        this.projectName = projectName;
        this.sessionId = sessionId;
        this.itemName = itemName;
        this.priority = priority;
        this.addedAt = addedAt;
        this.sequence = sequence;
        this.task = task;
        this.future = future;
    }

    String key() { return key; }
    WorkType type() { return type; }
    String projectName() { return projectName; }
    String sessionId() { return sessionId; }
    String itemName() { return itemName; }
    int priority() { return priority; }
    long addedAt() { return addedAt; }
    long sequence() { return sequence; }
    WorkTask<?> task() { return task; }
    CompletableFuture<Object> future() { return future; }

    void upgradePriority(int priority) {
        this.priority = priority;
    }

    PendingEntry snapshot() {
        return new PendingEntry(key, type, projectName, sessionId, itemName, priority,
                Priority.label(priority), addedAt);
    }
}
