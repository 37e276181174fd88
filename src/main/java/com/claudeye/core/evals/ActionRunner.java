package com.claudeye.core.evals;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs actions through {@link BatchExecutionHarness}. Each action function is
 * bound to the {@link ActionContext} so the harness can treat it like any
 * other item; conditions still see the plain {@link EvalContext}.
 */
@Component
public class ActionRunner {

    private static final ResultShaper<ActionResult, ActionRunResult> SHAPER = new ResultShaper<>() {
        @Override
        public ActionRunResult skipped(String name) {
            return new ActionRunResult(name, null, null, ActionResult.SUCCESS, null, 0, null, true);
        }

        @Override
        public ActionRunResult success(String name, ActionResult value, long durationMs) {
            if (value == null) {
                return new ActionRunResult(name, null, null, ActionResult.SUCCESS, null, durationMs, null, false);
            }
            String status = value.status() == null ? ActionResult.SUCCESS : value.status();
            return new ActionRunResult(name, value.output(), value.data(), status, value.message(),
                    durationMs, null, false);
        }

        @Override
        public ActionRunResult error(String name, String message, long durationMs) {
            return new ActionRunResult(name, null, null, ActionResult.ERROR, null, durationMs, message, false);
        }
    };

    private final EvalRegistry registry;

    public ActionRunner(EvalRegistry registry) {
        this.registry = registry;
    }

    public ActionRunSummary run(List<RegisteredAction> actions, ActionContext context) {
        List<BoundAction> bound = actions.stream()
                .map(a -> new BoundAction(a.name(), ctx -> a.fn().apply(context), a.condition()))
                .toList();
        return BatchExecutionHarness.runAll(bound, context.context(), registry.globalCondition(),
                SHAPER, ActionRunSummary::of);
    }

    private record BoundAction(String name, ItemFunction<ActionResult> fn, ItemCondition condition)
            implements RunnableItem<ActionResult> {}
}
