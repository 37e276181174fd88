package com.claudeye.core.evals;

import java.io.Serializable;

/**
 * Gate evaluated before an item (or, as the global condition, before a whole batch).
 * Returning false skips; throwing is reported as an error.
 */
@FunctionalInterface
public interface ItemCondition extends Serializable {
    boolean test(EvalContext context) throws Exception;
}
