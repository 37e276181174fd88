package com.claudeye.core.evals;

/** Where a registered item runs: top-level sessions, subagent transcripts, or both. */
public enum ItemScope {
    SESSION,
    SUBAGENT,
    BOTH;

    public boolean includesSession() {
        return this == SESSION || this == BOTH;
    }

    public boolean includesSubagent() {
        return this == SUBAGENT || this == BOTH;
    }
}
