package com.claudeye.core.evals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterRunnerTest {

    private static final EvalContext CONTEXT = EvalContext.forSession(List.of(), LogStats.EMPTY, "proj", "sess");

    private final FilterRunner runner = new FilterRunner(new EvalRegistry());

    @Test
    @DisplayName("boolean, number and string values pass through")
    void scalarValues() {
        var summary = runner.run(List.of(
                RegisteredFilter.of("default", "bool", ctx -> true),
                RegisteredFilter.of("default", "num", ctx -> 42),
                RegisteredFilter.of("default", "str", ctx -> "opus")), CONTEXT);

        assertEquals(true, summary.results().get(0).value());
        assertEquals(42.0, summary.results().get(1).value());
        assertEquals("opus", summary.results().get(2).value());
        assertEquals(0, summary.errorCount());
    }

    @Test
    @DisplayName("numbers of any type are widened to double")
    void numbersAreNormalized() {
        var summary = runner.run(List.of(
                RegisteredFilter.of("default", "long", ctx -> 7L),
                RegisteredFilter.of("default", "float", ctx -> 0.5f),
                RegisteredFilter.of("default", "nan", ctx -> Double.NaN)), CONTEXT);

        assertEquals(7.0, summary.results().get(0).value());
        assertEquals(0.5, summary.results().get(1).value());
        assertEquals(false, summary.results().get(2).value());
        assertEquals("Filter returned a non-finite number", summary.results().get(2).error());
    }

    @Test
    @DisplayName("unsupported values, failures and skips all yield false")
    void failuresYieldFalse() {
        var summary = runner.run(List.of(
                RegisteredFilter.of("default", "list", ctx -> List.of(1)),
                RegisteredFilter.of("default", "throws", ctx -> { throw new IllegalStateException("boom"); }),
                new RegisteredFilter("gated", ctx -> true, null, ctx -> false, "default")), CONTEXT);

        assertEquals(false, summary.results().get(0).value());
        assertNotNull(summary.results().get(0).error());
        assertEquals(false, summary.results().get(1).value());
        assertEquals("boom", summary.results().get(1).error());
        assertEquals(false, summary.results().get(2).value());
        assertTrue(summary.results().get(2).skipped());
        assertEquals(2, summary.errorCount());
        assertEquals(1, summary.skippedCount());
    }

    @Test
    @DisplayName("label and view default sensibly")
    void registeredFilterDefaults() {
        var filter = new RegisteredFilter("model", ctx -> "x", " ", null, null);

        assertEquals("model", filter.label());
        assertEquals(RegisteredFilter.DEFAULT_VIEW, filter.view());
    }
}
