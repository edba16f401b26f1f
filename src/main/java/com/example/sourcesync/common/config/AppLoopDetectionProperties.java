package com.example.sourcesync.common.config;

import com.example.sourcesync.application.loop.LoopDetectionConfig;
import java.util.Locale;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sync.loop-detection")
public class AppLoopDetectionProperties {

    /**
     * Base preset: default, production, development or minimal.
     * Explicitly configured fields below override the preset.
     */
    private String preset = "default";

    private Boolean enabled;

    private Integer maxAccessCount;

    private Long timeWindowSecs;

    private Long maxScanDurationSecs;

    private Long minScanIntervalSecs;

    private Integer maxPatternDepth;

    private Integer maxTrackedDirectories;

    private Boolean enablePatternAnalysis;

    /**
     * Reject accesses that close a suspected cycle instead of only alerting.
     */
    private Boolean rejectOnPattern;

    private String logLevel;

    private Integer circuitBreakerFailureThreshold;

    private Long circuitBreakerTimeoutSecs;

    private Boolean enableGracefulDegradation;

    private Long mutexTimeoutMs;

    public LoopDetectionConfig toConfig() {
        LoopDetectionConfig config = basePreset();
        if (enabled != null) {
            config.setEnabled(enabled);
        }
        if (maxAccessCount != null) {
            config.setMaxAccessCount(maxAccessCount);
        }
        if (timeWindowSecs != null) {
            config.setTimeWindowSecs(timeWindowSecs);
        }
        if (maxScanDurationSecs != null) {
            config.setMaxScanDurationSecs(maxScanDurationSecs);
        }
        if (minScanIntervalSecs != null) {
            config.setMinScanIntervalSecs(minScanIntervalSecs);
        }
        if (maxPatternDepth != null) {
            config.setMaxPatternDepth(maxPatternDepth);
        }
        if (maxTrackedDirectories != null) {
            config.setMaxTrackedDirectories(maxTrackedDirectories);
        }
        if (enablePatternAnalysis != null) {
            config.setEnablePatternAnalysis(enablePatternAnalysis);
        }
        if (rejectOnPattern != null) {
            config.setRejectOnPattern(rejectOnPattern);
        }
        if (logLevel != null && !logLevel.trim().isEmpty()) {
            config.setLogLevel(logLevel.trim());
        }
        if (circuitBreakerFailureThreshold != null) {
            config.setCircuitBreakerFailureThreshold(circuitBreakerFailureThreshold);
        }
        if (circuitBreakerTimeoutSecs != null) {
            config.setCircuitBreakerTimeoutSecs(circuitBreakerTimeoutSecs);
        }
        if (enableGracefulDegradation != null) {
            config.setEnableGracefulDegradation(enableGracefulDegradation);
        }
        if (mutexTimeoutMs != null) {
            config.setMutexTimeoutMs(mutexTimeoutMs);
        }
        config.validate();
        return config;
    }

    private LoopDetectionConfig basePreset() {
        String normalized = preset == null ? "default" : preset.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "production":
                return LoopDetectionConfig.production();
            case "development":
                return LoopDetectionConfig.development();
            case "minimal":
                return LoopDetectionConfig.minimal();
            case "default":
            case "":
                return LoopDetectionConfig.defaults();
            default:
                throw new IllegalArgumentException("Unknown loop detection preset: " + preset);
        }
    }
}
