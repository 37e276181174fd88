package com.claudeye.core.scheduler;

/**
 * @param forceRefresh run again even if the same work is already in flight,
 *                     after that run settles
 */
public record ScheduleOptions(int priority, boolean forceRefresh) {

    public static ScheduleOptions high() {
        return new ScheduleOptions(Priority.HIGH, false);
    }

    public static ScheduleOptions low() {
        return new ScheduleOptions(Priority.LOW, false);
    }

    public ScheduleOptions withForceRefresh(boolean forceRefresh) {
        return new ScheduleOptions(priority, forceRefresh);
    }
}
