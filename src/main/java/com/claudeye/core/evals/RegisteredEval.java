package com.claudeye.core.evals;

/**
 * @param subagentType when set, restricts a subagent-scoped eval to subagents of that type
 */
public record RegisteredEval(
    String name,
    ItemFunction<EvalResult> fn,
    ItemCondition condition,
    ItemScope scope,
    String subagentType
) implements RunnableItem<EvalResult> {

    public RegisteredEval {
        scope = scope == null ? ItemScope.SESSION : scope;
    }

    public static RegisteredEval of(String name, ItemFunction<EvalResult> fn) {
        return new RegisteredEval(name, fn, null, ItemScope.SESSION, null);
    }

    public RegisteredEval withCondition(ItemCondition condition) {
        return new RegisteredEval(name, fn, condition, scope, subagentType);
    }

    public RegisteredEval withScope(ItemScope scope, String subagentType) {
        return new RegisteredEval(name, fn, condition, scope, subagentType);
    }
}
