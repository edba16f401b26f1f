package com.example.sourcesync.application.loop;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.sourcesync.common.config.AppLoopDetectionProperties;
import com.example.sourcesync.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class LoopDetectorRegistryTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    @Test
    void sameUserShouldShareOneDetector() {
        LoopDetectorRegistry registry = new LoopDetectorRegistry(new AppLoopDetectionProperties(), null, clock);

        assertSame(registry.forUser(1L), registry.forUser(1L));
        assertNotSame(registry.forUser(1L), registry.forUser(2L));
        assertEquals("user-1", registry.forUser(1L).getName());
    }

    @Test
    void stateOfOneUserShouldNotAffectAnother() {
        LoopDetectorRegistry registry = new LoopDetectorRegistry(new AppLoopDetectionProperties(), null, clock);
        registry.forUser(1L).startAccess("/music", "run-1");

        registry.forUser(2L).startAccess("/music", "run-1");

        assertEquals(1, registry.forUser(1L).getMetrics().getActiveAccesses());
        assertEquals(1, registry.forUser(2L).getMetrics().getActiveAccesses());
    }

    @Test
    void presetAndOverridesShouldShapeNewDetectors() {
        AppLoopDetectionProperties properties = new AppLoopDetectionProperties();
        properties.setPreset("production");
        properties.setMaxAccessCount(7);
        properties.setEnabled(false);
        LoopDetectorRegistry registry = new LoopDetectorRegistry(properties, new SimpleMeterRegistry(), clock);

        LoopDetectionConfig config = registry.forUser(9L).getConfig();

        assertEquals(7, config.getMaxAccessCount());
        assertEquals(10L, config.getMinScanIntervalSecs());
        assertEquals(500, config.getMaxTrackedDirectories());
        assertEquals(3, config.getCircuitBreakerFailureThreshold());
        assertEquals(200L, config.getMutexTimeoutMs());
        assertFalse(config.isEnabled());
    }

    @Test
    void resilienceOverridesShouldApplyOnTopOfPreset() {
        AppLoopDetectionProperties properties = new AppLoopDetectionProperties();
        properties.setPreset("minimal");
        properties.setEnableGracefulDegradation(false);
        properties.setMutexTimeoutMs(20L);
        LoopDetectorRegistry registry = new LoopDetectorRegistry(properties, null, clock);

        LoopDetectionConfig config = registry.forUser(9L).getConfig();

        assertEquals(10, config.getCircuitBreakerFailureThreshold());
        assertEquals(600L, config.getCircuitBreakerTimeoutSecs());
        assertFalse(config.isEnableGracefulDegradation());
        assertEquals(20L, config.getMutexTimeoutMs());
    }

    @Test
    void unknownPresetShouldFail() {
        AppLoopDetectionProperties properties = new AppLoopDetectionProperties();
        properties.setPreset("turbo");
        LoopDetectorRegistry registry = new LoopDetectorRegistry(properties, null, clock);

        assertThrows(IllegalArgumentException.class, () -> registry.forUser(1L));
    }

    @Test
    void missingUserShouldBeRefused() {
        LoopDetectorRegistry registry = new LoopDetectorRegistry(new AppLoopDetectionProperties(), null, clock);

        assertThrows(IllegalArgumentException.class, () -> registry.forUser(null));
    }
}
