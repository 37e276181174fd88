package com.claudeye.core.evals;

/**
 * A named function with an optional per-item condition, as consumed by
 * {@link BatchExecutionHarness}.
 */
public interface RunnableItem<V> {

    String name();

    ItemFunction<V> fn();

    /** Null when the item always runs. */
    ItemCondition condition();
}
