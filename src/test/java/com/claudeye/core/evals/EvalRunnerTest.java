package com.claudeye.core.evals;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvalRunnerTest {

    private static final EvalContext CONTEXT = EvalContext.forSession(List.of(), LogStats.EMPTY, "proj", "sess");

    private EvalRegistry registry;
    private EvalRunner runner;

    @BeforeEach
    void setUp() {
        registry = new EvalRegistry();
        runner = new EvalRunner(registry);
    }

    @Test
    @DisplayName("EvalResult.passing() is a pass with full score")
    void passingFactory() {
        EvalResult passing = EvalResult.passing();
        assertTrue(passing.pass());
        assertNull(passing.score());

        var result = runner.run(List.of(RegisteredEval.of("ok", ctx -> passing)), CONTEXT).results().get(0);

        assertTrue(result.pass());
        assertEquals(1.0, result.score());
        assertNull(result.error());
    }

    @Test
    @DisplayName("scores are clamped into [0, 1] and a missing score counts as 1")
    void scoresAreClamped() {
        var summary = runner.run(List.of(
                RegisteredEval.of("high", ctx -> EvalResult.of(true, 1.7, null)),
                RegisteredEval.of("low", ctx -> EvalResult.of(false, -0.3, "bad")),
                RegisteredEval.of("none", ctx -> EvalResult.passing())), CONTEXT);

        assertEquals(1.0, summary.results().get(0).score());
        assertEquals(0.0, summary.results().get(1).score());
        assertEquals(1.0, summary.results().get(2).score());
        assertEquals(0.5, EvalRunner.clampScore(0.5));
        assertEquals(1.0, EvalRunner.clampScore(Double.NaN));
    }

    @Test
    @DisplayName("summary counts pass, fail, error and skipped once each")
    void summaryCounts() {
        var summary = runner.run(List.of(
                RegisteredEval.of("pass", ctx -> EvalResult.passing()),
                RegisteredEval.of("fail", ctx -> EvalResult.fail("nope")),
                RegisteredEval.of("error", ctx -> { throw new IllegalStateException("boom"); }),
                RegisteredEval.of("skip", ctx -> EvalResult.passing()).withCondition(ctx -> false)), CONTEXT);

        assertEquals(1, summary.passCount());
        assertEquals(1, summary.failCount());
        assertEquals(1, summary.errorCount());
        assertEquals(1, summary.skippedCount());
    }

    @Test
    @DisplayName("error and skipped results carry pass=false and score 0")
    void errorAndSkippedShape() {
        var summary = runner.run(List.of(
                RegisteredEval.of("error", ctx -> { throw new IllegalStateException("boom"); }),
                RegisteredEval.of("skip", ctx -> EvalResult.passing()).withCondition(ctx -> false)), CONTEXT);

        EvalRunResult error = summary.results().get(0);
        assertFalse(error.pass());
        assertEquals(0.0, error.score());
        assertEquals("boom", error.error());

        EvalRunResult skipped = summary.results().get(1);
        assertTrue(skipped.skipped());
        assertFalse(skipped.pass());
        assertEquals(0, skipped.durationMs());
    }

    @Test
    @DisplayName("a null result is reported as an error")
    void nullResultIsError() {
        var summary = runner.run(List.of(RegisteredEval.of("null", ctx -> null)), CONTEXT);

        assertEquals("Eval returned no result", summary.results().get(0).error());
    }

    @Test
    @DisplayName("message and metadata are carried through")
    void messageAndMetadata() {
        var summary = runner.run(List.of(RegisteredEval.of("meta",
                ctx -> new EvalResult(true, 0.8, "fine", Map.of("turns", 3)))), CONTEXT);

        EvalRunResult result = summary.results().get(0);
        assertEquals("fine", result.message());
        assertEquals(Map.of("turns", 3), result.metadata());
        assertEquals(0.8, result.score());
    }

    @Test
    @DisplayName("registered global condition gates the batch")
    void globalConditionFromRegistry() {
        registry.setGlobalCondition(ctx -> ctx.projectName().equals("other"));

        var summary = runner.run(List.of(RegisteredEval.of("a", ctx -> EvalResult.passing())), CONTEXT);

        assertEquals(1, summary.skippedCount());
        assertEquals(0, summary.totalDurationMs());
    }
}
