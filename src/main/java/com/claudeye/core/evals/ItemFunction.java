package com.claudeye.core.evals;

import java.io.Serializable;

/**
 * Operator-authored code run against one transcript. May throw anything;
 * the harness turns a thrown exception into an error result.
 * Serializable so the cache can hash a lambda's own implementation method.
 */
@FunctionalInterface
public interface ItemFunction<V> extends Serializable {
    V apply(EvalContext context) throws Exception;
}
