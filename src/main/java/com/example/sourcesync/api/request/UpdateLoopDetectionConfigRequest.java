package com.example.sourcesync.api.request;

import com.example.sourcesync.application.loop.LoopDetectionConfig;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.Pattern;
import lombok.Data;

/**
 * Partial update: null fields keep the detector's current value.
 */
@Data
public class UpdateLoopDetectionConfigRequest {

    private Boolean enabled;

    @Min(1)
    private Integer maxAccessCount;

    @Min(1)
    @Max(LoopDetectionConfig.MAX_DURATION_SECS)
    private Long timeWindowSecs;

    @Min(1)
    @Max(LoopDetectionConfig.MAX_DURATION_SECS)
    private Long maxScanDurationSecs;

    @Min(0)
    @Max(LoopDetectionConfig.MAX_DURATION_SECS)
    private Long minScanIntervalSecs;

    private Boolean enablePatternAnalysis;

    @Min(1)
    private Integer maxPatternDepth;

    @Min(1)
    private Integer maxTrackedDirectories;

    private Boolean rejectOnPattern;

    @Pattern(regexp = "(?i)error|warn|info|debug")
    private String logLevel;

    @Min(1)
    private Integer circuitBreakerFailureThreshold;

    @Min(0)
    @Max(LoopDetectionConfig.MAX_DURATION_SECS)
    private Long circuitBreakerTimeoutSecs;

    private Boolean enableGracefulDegradation;

    @Min(0)
    @Max(LoopDetectionConfig.MAX_MUTEX_TIMEOUT_MS)
    private Long mutexTimeoutMs;
}
