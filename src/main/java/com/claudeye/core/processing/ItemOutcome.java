package com.claudeye.core.processing;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of processing one item: either {@code ok} with a result or not
 * {@code ok} with an error message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemOutcome<R>(boolean ok, R result, String error) {

    public static <R> ItemOutcome<R> success(R result) {
        return new ItemOutcome<>(true, result, null);
    }

    public static <R> ItemOutcome<R> failure(String error) {
        return new ItemOutcome<>(false, null, error);
    }
}
