package com.claudeye.core.transcript;

import java.time.Instant;

public record SessionRef(String projectName, String sessionId, Instant lastModified) {}
