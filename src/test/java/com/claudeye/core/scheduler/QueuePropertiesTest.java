package com.claudeye.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueuePropertiesTest {

    @Test
    @DisplayName("non-positive values fall back to defaults")
    void effectiveValues() {
        var properties = new QueueProperties();
        assertEquals(2, properties.effectiveConcurrency());
        assertEquals(3600, properties.effectiveHistoryTtlSeconds());

        properties.setConcurrency(-1);
        properties.setHistoryTtlSeconds(0);
        assertEquals(2, properties.effectiveConcurrency());
        assertEquals(3600, properties.effectiveHistoryTtlSeconds());

        properties.setConcurrency(6);
        assertEquals(6, properties.effectiveConcurrency());
    }

    @Test
    @DisplayName("work types round-trip through their labels")
    void workTypeLabels() {
        assertEquals(WorkType.ENRICHMENT, WorkType.fromLabel("enrichment").orElseThrow());
        assertEquals("action", WorkType.ACTION.label());
        assertTrue(WorkType.fromLabel("filter").isEmpty());
    }
}
