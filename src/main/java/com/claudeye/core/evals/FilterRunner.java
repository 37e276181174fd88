package com.claudeye.core.evals;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Computes dashboard filter values; a skipped or failed filter yields {@code false}.
 * Numbers are widened to {@code double} so a value read back from the cache
 * equals the freshly computed one.
 */
@Component
public class FilterRunner {

    private static final ResultShaper<Object, FilterComputeResult> SHAPER = new ResultShaper<>() {
        @Override
        public FilterComputeResult skipped(String name) {
            return new FilterComputeResult(name, false, 0, null, true);
        }

        @Override
        public FilterComputeResult success(String name, Object value, long durationMs) {
            if (!(value instanceof Boolean || value instanceof Number || value instanceof String)) {
                return error(name, "Filter must return a boolean, number or string", durationMs);
            }
            if (value instanceof Number number) {
                double normalized = number.doubleValue();
                if (!Double.isFinite(normalized)) {
                    return error(name, "Filter returned a non-finite number", durationMs);
                }
                return new FilterComputeResult(name, normalized, durationMs, null, false);
            }
            return new FilterComputeResult(name, value, durationMs, null, false);
        }

        @Override
        public FilterComputeResult error(String name, String message, long durationMs) {
            return new FilterComputeResult(name, false, durationMs, message, false);
        }
    };

    private final EvalRegistry registry;

    public FilterRunner(EvalRegistry registry) {
        this.registry = registry;
    }

    public FilterComputeSummary run(List<RegisteredFilter> filters, EvalContext context) {
        return BatchExecutionHarness.runAll(filters, context, registry.globalCondition(),
                SHAPER, FilterComputeSummary::of);
    }
}
