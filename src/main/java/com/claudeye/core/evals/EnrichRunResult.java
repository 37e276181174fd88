package com.claudeye.core.evals;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * @param data key/value metadata; values are strings, numbers or booleans
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnrichRunResult(
    String name,
    Map<String, Object> data,
    long durationMs,
    String error,
    boolean skipped
) {
    public EnrichRunResult {
        data = data == null ? Map.of() : data;
    }
}
