package com.claudeye.core.scheduler;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * What one background scan did.
 *
 * @param enqueued futures of the work it scheduled, for callers that want to wait
 */
public record ScanResult(int sessionsScanned, List<CompletableFuture<?>> enqueued) {

    public static final ScanResult EMPTY = new ScanResult(0, List.of());

    public int enqueuedCount() {
        return enqueued.size();
    }
}
