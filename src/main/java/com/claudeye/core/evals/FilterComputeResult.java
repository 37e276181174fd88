package com.claudeye.core.evals;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param value a boolean, number or string; {@code false} for skipped or failed filters
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterComputeResult(
    String name,
    Object value,
    long durationMs,
    String error,
    boolean skipped
) {}
