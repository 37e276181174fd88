package com.claudeye.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "claudeye.queue")
public class QueueProperties {

    static final int DEFAULT_CONCURRENCY = 2;

    private int concurrency = DEFAULT_CONCURRENCY;
    private int intervalSeconds = 0;
    private int historyTtlSeconds = 3600;
    private int maxSessions = 0;

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    public int getIntervalSeconds() { return intervalSeconds; }
    public void setIntervalSeconds(int intervalSeconds) { this.intervalSeconds = intervalSeconds; }
    public int getHistoryTtlSeconds() { return historyTtlSeconds; }
    public void setHistoryTtlSeconds(int historyTtlSeconds) { this.historyTtlSeconds = historyTtlSeconds; }
    public int getMaxSessions() { return maxSessions; }
    public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }

    /** Worker count; non-positive values fall back to the default of 2. */
    public int effectiveConcurrency() {
        return concurrency > 0 ? concurrency : DEFAULT_CONCURRENCY;
    }

    public int effectiveHistoryTtlSeconds() {
        return historyTtlSeconds > 0 ? historyTtlSeconds : 3600;
    }
}
