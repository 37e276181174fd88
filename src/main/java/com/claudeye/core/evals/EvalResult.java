package com.claudeye.core.evals;

import java.util.Map;

/**
 * What an eval function returns. A null score counts as 1.
 */
public record EvalResult(boolean pass, Double score, String message, Map<String, Object> metadata) {

    public static EvalResult passing() {
        return new EvalResult(true, null, null, null);
    }

    public static EvalResult fail(String message) {
        return new EvalResult(false, 0.0, message, null);
    }

    public static EvalResult of(boolean pass, double score, String message) {
        return new EvalResult(pass, score, message, null);
    }
}
