package com.claudeye.core.evals;

import java.io.Serializable;

@FunctionalInterface
public interface ActionFunction extends Serializable {
    ActionResult apply(ActionContext context) throws Exception;
}
