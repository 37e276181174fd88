package com.claudeye.core.evals;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionRunResult(
    String name,
    String output,
    Map<String, Object> data,
    String status,
    String message,
    long durationMs,
    String error,
    boolean skipped
) {}
