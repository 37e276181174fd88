package com.claudeye.core.evals;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a batch of items against one context with per-item failure isolation.
 * <p>
 * The global condition is checked once: if it returns false or throws, every
 * item is skipped with zero duration and no item code runs. Otherwise each item
 * is handled on its own. A per-item condition returning false skips just that
 * item; a condition that throws is an error result, not a skip. Item functions
 * that throw become error results and never stop their siblings.
 * <p>
 * Items run sequentially on the calling thread.
 */
public final class BatchExecutionHarness {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutionHarness.class);

    private BatchExecutionHarness() {}

    public static <V, R, S> S runAll(List<? extends RunnableItem<V>> items,
                                     EvalContext context,
                                     ItemCondition globalCondition,
                                     ResultShaper<V, R> shaper,
                                     SummaryBuilder<R, S> summaryBuilder) {
        long batchStart = System.currentTimeMillis();

        if (globalCondition != null && !globalConditionPasses(globalCondition, context)) {
            List<R> skipped = new ArrayList<>(items.size());
            for (var item : items) {
                skipped.add(shaper.skipped(item.name()));
            }
            return summaryBuilder.build(skipped, 0);
        }

        List<R> results = new ArrayList<>(items.size());
        for (var item : items) {
            results.add(runOne(item, context, shaper));
        }
        return summaryBuilder.build(results, System.currentTimeMillis() - batchStart);
    }

    private static <V, R> R runOne(RunnableItem<V> item, EvalContext context, ResultShaper<V, R> shaper) {
        if (item.condition() != null) {
            try {
                if (!item.condition().test(context)) {
                    return shaper.skipped(item.name());
                }
            } catch (Throwable e) {
                rethrowIfFatal(e);
                log.warn("Condition for '{}' threw: {}", item.name(), describe(e));
                return shaper.error(item.name(), "Condition error: " + describe(e), 0);
            }
        }

        long start = System.currentTimeMillis();
        try {
            V value = item.fn().apply(context);
            return shaper.success(item.name(), value, System.currentTimeMillis() - start);
        } catch (Throwable e) {
            rethrowIfFatal(e);
            long duration = System.currentTimeMillis() - start;
            log.debug("Item '{}' failed after {}ms: {}", item.name(), duration, describe(e));
            return shaper.error(item.name(), describe(e), duration);
        }
    }

    private static boolean globalConditionPasses(ItemCondition condition, EvalContext context) {
        try {
            return condition.test(context);
        } catch (Throwable e) {
            rethrowIfFatal(e);
            log.warn("Global condition threw, skipping batch for {}/{}: {}",
                    context.projectName(), context.sessionId(), describe(e));
            return false;
        }
    }

    /** A blown stack has already unwound by the time it is caught, so only the other VM errors are fatal. */
    private static void rethrowIfFatal(Throwable e) {
        if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
            throw (VirtualMachineError) e;
        }
    }

    /** Exception message, or the exception itself when it carries none. */
    static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }
}
