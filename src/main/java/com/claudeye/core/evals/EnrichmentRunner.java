package com.claudeye.core.evals;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class EnrichmentRunner {

    private static final ResultShaper<Map<String, Object>, EnrichRunResult> SHAPER = new ResultShaper<>() {
        @Override
        public EnrichRunResult skipped(String name) {
            return new EnrichRunResult(name, Map.of(), 0, null, true);
        }

        @Override
        public EnrichRunResult success(String name, Map<String, Object> value, long durationMs) {
            return new EnrichRunResult(name, value, durationMs, null, false);
        }

        @Override
        public EnrichRunResult error(String name, String message, long durationMs) {
            return new EnrichRunResult(name, Map.of(), durationMs, message, false);
        }
    };

    private final EvalRegistry registry;

    public EnrichmentRunner(EvalRegistry registry) {
        this.registry = registry;
    }

    public EnrichRunSummary run(List<RegisteredEnricher> enrichers, EvalContext context) {
        return BatchExecutionHarness.runAll(enrichers, context, registry.globalCondition(),
                SHAPER, EnrichRunSummary::of);
    }
}
