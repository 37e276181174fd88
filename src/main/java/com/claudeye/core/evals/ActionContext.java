package com.claudeye.core.evals;

import java.util.Map;

/**
 * An {@link EvalContext} extended with whatever eval and enrichment results
 * are already cached for the same transcript, keyed by item name.
 */
public record ActionContext(
    EvalContext context,
    Map<String, EvalRunResult> evalResults,
    Map<String, EnrichRunResult> enrichmentResults
) {
    public ActionContext {
        evalResults = evalResults == null ? Map.of() : Map.copyOf(evalResults);
        enrichmentResults = enrichmentResults == null ? Map.of() : Map.copyOf(enrichmentResults);
    }
}
