package com.claudeye.core.scheduler;

/**
 * Notified, debounced per session, after work for a session completes successfully.
 */
@FunctionalInterface
public interface SessionSettledListener {
    void onSessionSettled(String projectName, String sessionId);
}
