package com.claudeye.core.scheduler;

/**
 * Queue priorities. Lower numbers run first.
 */
public final class Priority {

    /** Interactive requests. */
    public static final int HIGH = 0;
    /** Background scan work. */
    public static final int LOW = 10;

    private Priority() {}

    public static String label(int priority) {
        return priority <= HIGH ? "HIGH" : "LOW";
    }
}
