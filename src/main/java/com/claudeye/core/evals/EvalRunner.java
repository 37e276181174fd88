package com.claudeye.core.evals;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs evals through {@link BatchExecutionHarness}. Scores are clamped into
 * {@code [0, 1]} and a missing score counts as a full score.
 */
@Component
public class EvalRunner {

    private static final ResultShaper<EvalResult, EvalRunResult> SHAPER = new ResultShaper<>() {
        @Override
        public EvalRunResult skipped(String name) {
            return new EvalRunResult(name, false, 0, null, null, 0, null, true);
        }

        @Override
        public EvalRunResult success(String name, EvalResult value, long durationMs) {
            if (value == null) {
                return error(name, "Eval returned no result", durationMs);
            }
            return new EvalRunResult(name, value.pass(), clampScore(value.score()),
                    value.message(), value.metadata(), durationMs, null, false);
        }

        @Override
        public EvalRunResult error(String name, String message, long durationMs) {
            return new EvalRunResult(name, false, 0, null, null, durationMs, message, false);
        }
    };

    private final EvalRegistry registry;

    public EvalRunner(EvalRegistry registry) {
        this.registry = registry;
    }

    public EvalRunSummary run(List<RegisteredEval> evals, EvalContext context) {
        return BatchExecutionHarness.runAll(evals, context, registry.globalCondition(),
                SHAPER, EvalRunSummary::of);
    }

    static double clampScore(Double score) {
        if (score == null || score.isNaN()) {
            return 1;
        }
        return Math.max(0, Math.min(1, score));
    }
}
