package com.claudeye.core.evals;

import java.util.List;

@FunctionalInterface
public interface SummaryBuilder<R, S> {
    S build(List<R> results, long totalDurationMs);
}
