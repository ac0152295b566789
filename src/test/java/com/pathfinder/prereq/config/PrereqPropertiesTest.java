package com.pathfinder.prereq.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PrereqPropertiesTest {
    @Test
    void unsetSectionsFallBackToDefaults() {
        PrereqProperties properties = PrereqProperties.defaults();

        assertEquals(0.75, properties.confidenceThreshold());
        assertFalse(properties.structuring().enabled());
        assertEquals(Duration.ofMillis(1500), properties.structuring().backoff());
        assertEquals(5, properties.reconcile().maxAttempts());
        assertEquals(8, properties.sync().concurrency());
        assertEquals(100, properties.graph().maxPrereqDepth());
    }

    @Test
    void zeroThresholdIsKept() {
        assertEquals(0.0, new PrereqProperties(0.0, null, null, null, null).confidenceThreshold());
    }

    @Test
    void thresholdOutsideUnitIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PrereqProperties(1.5, null, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new PrereqProperties(-0.1, null, null, null, null));
    }
}
