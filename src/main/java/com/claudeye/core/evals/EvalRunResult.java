package com.claudeye.core.evals;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvalRunResult(
    String name,
    boolean pass,
    double score,
    String message,
    Map<String, Object> metadata,
    long durationMs,
    String error,
    boolean skipped
) {}
