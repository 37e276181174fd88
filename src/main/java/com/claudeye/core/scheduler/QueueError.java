package com.claudeye.core.scheduler;

public record QueueError(String key, String error, long at) {}
