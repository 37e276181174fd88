package com.claudeye.core.scheduler;

/**
 * Unit of work handed to {@link WorkScheduler}. The scheduler knows nothing
 * about what it does.
 */
@FunctionalInterface
public interface WorkTask<T> {
    T call() throws Exception;
}
