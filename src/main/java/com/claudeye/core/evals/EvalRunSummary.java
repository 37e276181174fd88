package com.claudeye.core.evals;

import java.util.List;

public record EvalRunSummary(
    List<EvalRunResult> results,
    long totalDurationMs,
    int passCount,
    int failCount,
    int errorCount,
    int skippedCount
) {
    /** Counts each result once: skipped first, then error, then pass or fail. */
    public static EvalRunSummary of(List<EvalRunResult> results, long totalDurationMs) {
        int pass = 0, fail = 0, errors = 0, skipped = 0;
        for (var r : results) {
            if (r.skipped()) skipped++;
            else if (r.error() != null) errors++;
            else if (r.pass()) pass++;
            else fail++;
        }
        return new EvalRunSummary(List.copyOf(results), totalDurationMs, pass, fail, errors, skipped);
    }
}
