package com.claudeye.core.evals;

/**
 * A dashboard filter. Filters belong to a named view and always run at session scope.
 */
public record RegisteredFilter(
    String name,
    ItemFunction<Object> fn,
    String label,
    ItemCondition condition,
    String view
) implements RunnableItem<Object> {

    public static final String DEFAULT_VIEW = "default";

    public RegisteredFilter {
        label = label == null || label.isBlank() ? name : label;
        view = view == null || view.isBlank() ? DEFAULT_VIEW : view;
    }

    public static RegisteredFilter of(String view, String name, ItemFunction<Object> fn) {
        return new RegisteredFilter(name, fn, null, null, view);
    }
}
