package com.claudeye.core.evals;

/**
 * Turns the outcome of one item into the runner's result type.
 *
 * @param <V> what the item function returns
 * @param <R> the per-item result record
 */
public interface ResultShaper<V, R> {

    R skipped(String name);

    R success(String name, V value, long durationMs);

    R error(String name, String message, long durationMs);
}
