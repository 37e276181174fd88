package com.claudeye.core.evals;

public record RegisteredAlert(String name, AlertFunction fn) {}
