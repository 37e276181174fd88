package com.claudeye.core.evals;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Calls every registered alert. A failing alert is logged and never stops the others.
 */
@Component
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final EvalRegistry registry;

    public AlertDispatcher(EvalRegistry registry) {
        this.registry = registry;
    }

    public void fire(AlertContext context) {
        if (!registry.hasAlerts()) {
            return;
        }
        for (RegisteredAlert alert : registry.alerts()) {
            deliverSafely(alert, context);
        }
    }

    private void deliverSafely(RegisteredAlert alert, AlertContext context) {
        try {
            alert.fn().fire(context);
        } catch (Exception e) {
            log.warn("Alert '{}' threw processing session {}/{}: {}",
                    alert.name(), context.projectName(), context.sessionId(), e.getMessage(), e);
        }
    }
}
