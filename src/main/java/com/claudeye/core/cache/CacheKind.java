package com.claudeye.core.cache;

/**
 * Top-level cache namespace. Results of different runner kinds never share
 * a key, even for the same project and session.
 */
public enum CacheKind {
    EVALS("evals"),
    ENRICHMENTS("enrichments"),
    ACTIONS("actions"),
    FILTERS("filters");

    private final String segment;

    CacheKind(String segment) {
        this.segment = segment;
    }

    /** The first path segment of every key in this namespace. */
    public String segment() {
        return segment;
    }
}
