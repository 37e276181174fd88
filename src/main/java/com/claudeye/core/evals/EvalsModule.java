package com.claudeye.core.evals;

/**
 * Entry point of an operator's evaluation module. Implementations are picked
 * up as Spring beans, or from the jar named by {@code claudeye.evals.module}
 * through {@code META-INF/services/com.claudeye.core.evals.EvalsModule}.
 */
public interface EvalsModule {
    void register(EvalRegistry registry);
}
