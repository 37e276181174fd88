package com.claudeye.core.evals;

import java.util.Map;

public record RegisteredEnricher(
    String name,
    ItemFunction<Map<String, Object>> fn,
    ItemCondition condition,
    ItemScope scope,
    String subagentType
) implements RunnableItem<Map<String, Object>> {

    public RegisteredEnricher {
        scope = scope == null ? ItemScope.SESSION : scope;
    }

    public static RegisteredEnricher of(String name, ItemFunction<Map<String, Object>> fn) {
        return new RegisteredEnricher(name, fn, null, ItemScope.SESSION, null);
    }

    public RegisteredEnricher withCondition(ItemCondition condition) {
        return new RegisteredEnricher(name, fn, condition, scope, subagentType);
    }

    public RegisteredEnricher withScope(ItemScope scope, String subagentType) {
        return new RegisteredEnricher(name, fn, condition, scope, subagentType);
    }
}
