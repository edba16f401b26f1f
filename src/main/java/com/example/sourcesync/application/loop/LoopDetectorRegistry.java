package com.example.sourcesync.application.loop;

import com.example.sourcesync.common.config.AppLoopDetectionProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * One {@link LoopDetector} per user, so counters and history of different tenants never mix.
 */
@Component
public class LoopDetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(LoopDetectorRegistry.class);

    private final AppLoopDetectionProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ConcurrentMap<Long, LoopDetector> detectorsByUser = new ConcurrentHashMap<>();

    @Autowired
    public LoopDetectorRegistry(AppLoopDetectionProperties properties,
                                ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(properties, meterRegistryProvider.getIfAvailable(), Clock.systemUTC());
    }

    public LoopDetectorRegistry(AppLoopDetectionProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public LoopDetector forUser(Long userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        return detectorsByUser.computeIfAbsent(userId, id -> {
            LoopDetectionConfig config = properties.toConfig();
            log.info("LOOP_DETECTOR_CREATED userId={} preset={} enabled={}", id, properties.getPreset(),
                    config.isEnabled());
            return new LoopDetector("user-" + id, config, clock, meterRegistry);
        });
    }
}
