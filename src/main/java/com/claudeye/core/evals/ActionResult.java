package com.claudeye.core.evals;

import java.util.Map;

/**
 * Free-form action output.
 *
 * @param status {@code success} or {@code error}; null is read as {@code success}
 */
public record ActionResult(String output, Map<String, Object> data, String status, String message) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static ActionResult output(String output) {
        return new ActionResult(output, null, SUCCESS, null);
    }
}
