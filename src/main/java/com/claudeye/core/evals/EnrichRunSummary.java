package com.claudeye.core.evals;

import java.util.List;

public record EnrichRunSummary(
    List<EnrichRunResult> results,
    long totalDurationMs,
    int errorCount,
    int skippedCount
) {
    public static EnrichRunSummary of(List<EnrichRunResult> results, long totalDurationMs) {
        int errors = 0, skipped = 0;
        for (var r : results) {
            if (r.skipped()) skipped++;
            else if (r.error() != null) errors++;
        }
        return new EnrichRunSummary(List.copyOf(results), totalDurationMs, errors, skipped);
    }
}
