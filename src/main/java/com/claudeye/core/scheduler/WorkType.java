package com.claudeye.core.scheduler;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum WorkType {
    EVAL("eval"),
    ENRICHMENT("enrichment"),
    ACTION("action");

    private final String label;

    WorkType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<WorkType> fromLabel(String label) {
        return Arrays.stream(values()).filter(t -> t.label.equals(label)).findFirst();
    }
}
