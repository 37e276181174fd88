package com.claudeye.core.evals;

import java.util.List;

public record ActionRunSummary(
    List<ActionRunResult> results,
    long totalDurationMs,
    int errorCount,
    int skippedCount
) {
    public static ActionRunSummary of(List<ActionRunResult> results, long totalDurationMs) {
        int errors = 0, skipped = 0;
        for (var r : results) {
            if (r.skipped()) skipped++;
            else if (r.error() != null || ActionResult.ERROR.equals(r.status())) errors++;
        }
        return new ActionRunSummary(List.copyOf(results), totalDurationMs, errors, skipped);
    }
}
