package com.claudeye.core.evals;

import java.util.List;

/**
 * Summary figures for one transcript, handed to every item through {@link EvalContext}.
 */
public record LogStats(
    int turnCount,
    int userCount,
    int assistantCount,
    int toolCallCount,
    int subagentCount,
    String duration,
    List<String> models
) {
    public static final LogStats EMPTY = new LogStats(0, 0, 0, 0, 0, "", List.of());

    public LogStats {
        models = models == null ? List.of() : List.copyOf(models);
    }
}
