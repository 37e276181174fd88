package com.claudeye.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the work queue and the result cache.
 */
@Service
public class ClaudeyeMetrics {

    private final MeterRegistry registry;

    public ClaudeyeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskDuration(String type, boolean success, long ms) {
        Timer.builder("claudeye.queue.task.duration")
                .tag("type", type)
                .tag("outcome", success ? "success" : "error")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a request that was answered by work already in flight instead
     * of starting a new execution.
     */
    public void recordCoalesced(String type) {
        Counter.builder("claudeye.queue.coalesced")
                .description("Requests merged into an in-flight execution")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordPriorityUpgrade() {
        Counter.builder("claudeye.queue.priority_upgrades")
                .description("Pending entries promoted to a higher priority")
                .register(registry)
                .increment();
    }

    /**
     * @param kind        cache namespace ({@code evals}, {@code enrichments}, ...)
     * @param granularity {@code whole} or {@code item}
     * @param hit         whether a valid entry was found
     */
    public void recordCacheLookup(String kind, String granularity, boolean hit) {
        Counter.builder("claudeye.cache.lookups")
                .tag("kind", kind)
                .tag("granularity", granularity)
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordScanEnqueued(int count) {
        DistributionSummary.builder("claudeye.scan.enqueued")
                .description("Items enqueued by one background scan")
                .register(registry)
                .record(count);
    }
}
