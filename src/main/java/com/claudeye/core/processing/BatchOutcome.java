package com.claudeye.core.processing;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a whole-batch run for one session.
 *
 * @param hasItems false when nothing of this kind is registered; {@code summary} is then null
 * @param cached   true when the summary came from the whole-result cache
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchOutcome<S>(boolean ok, S summary, boolean hasItems, boolean cached, String error) {

    public static <S> BatchOutcome<S> computed(S summary) {
        return new BatchOutcome<>(true, summary, true, false, null);
    }

    public static <S> BatchOutcome<S> fromCache(S summary) {
        return new BatchOutcome<>(true, summary, true, true, null);
    }

    public static <S> BatchOutcome<S> nothingRegistered() {
        return new BatchOutcome<>(true, null, false, false, null);
    }

    public static <S> BatchOutcome<S> failure(String error) {
        return new BatchOutcome<>(false, null, true, false, error);
    }
}
