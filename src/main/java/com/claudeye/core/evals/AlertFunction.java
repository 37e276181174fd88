package com.claudeye.core.evals;

@FunctionalInterface
public interface AlertFunction {
    void fire(AlertContext context) throws Exception;
}
