package com.claudeye.core.evals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnrichmentRunnerTest {

    private final EnrichmentRunner runner = new EnrichmentRunner(new EvalRegistry());

    @Test
    @DisplayName("enricher data is collected and failures yield empty data")
    void collectsData() {
        var context = EvalContext.forSession(List.of(), new LogStats(4, 2, 2, 1, 0, "1m 0s", List.of()),
                "proj", "sess");

        var summary = runner.run(List.of(
                RegisteredEnricher.of("turns", ctx -> Map.of("turns", ctx.stats().turnCount())),
                RegisteredEnricher.of("broken", ctx -> { throw new IllegalStateException("boom"); }),
                RegisteredEnricher.of("gated", ctx -> Map.of("x", true)).withCondition(ctx -> false)), context);

        assertEquals(Map.of("turns", 4), summary.results().get(0).data());
        assertEquals(Map.of(), summary.results().get(1).data());
        assertEquals("boom", summary.results().get(1).error());
        assertTrue(summary.results().get(2).skipped());
        assertEquals(1, summary.errorCount());
        assertEquals(1, summary.skippedCount());
    }

    @Test
    @DisplayName("a null map becomes empty data")
    void nullData() {
        var summary = runner.run(List.of(RegisteredEnricher.of("nothing", ctx -> null)),
                EvalContext.forSession(List.of(), LogStats.EMPTY, "proj", "sess"));

        assertEquals(Map.of(), summary.results().get(0).data());
        assertNull(summary.results().get(0).error());
    }
}
