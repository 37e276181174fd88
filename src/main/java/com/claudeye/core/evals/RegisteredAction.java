package com.claudeye.core.evals;

/**
 * Actions are triggered on demand. Their results are cached only when
 * {@code cache} is true, since they may have side effects.
 */
public record RegisteredAction(
    String name,
    ActionFunction fn,
    ItemCondition condition,
    ItemScope scope,
    String subagentType,
    boolean cache
) {
    public RegisteredAction {
        scope = scope == null ? ItemScope.SESSION : scope;
    }

    public static RegisteredAction of(String name, ActionFunction fn) {
        return new RegisteredAction(name, fn, null, ItemScope.SESSION, null, false);
    }

    public RegisteredAction withCondition(ItemCondition condition) {
        return new RegisteredAction(name, fn, condition, scope, subagentType, cache);
    }

    public RegisteredAction withScope(ItemScope scope, String subagentType) {
        return new RegisteredAction(name, fn, condition, scope, subagentType, cache);
    }

    public RegisteredAction cached() {
        return new RegisteredAction(name, fn, condition, scope, subagentType, true);
    }
}
