package com.example.sourcesync.api.controller;

import com.example.sourcesync.api.request.UpdateLoopDetectionConfigRequest;
import com.example.sourcesync.api.response.ApiResponse;
import com.example.sourcesync.application.loop.LoopDetectionConfig;
import com.example.sourcesync.application.loop.LoopDetectionMetrics;
import com.example.sourcesync.application.loop.LoopDetector;
import com.example.sourcesync.application.loop.LoopDetectorRegistry;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/sync/loop-detection")
public class LoopDetectionController {

    private final LoopDetectorRegistry loopDetectorRegistry;

    public LoopDetectionController(LoopDetectorRegistry loopDetectorRegistry) {
        this.loopDetectorRegistry = loopDetectorRegistry;
    }

    @GetMapping("/metrics")
    public ApiResponse<LoopDetectionMetrics> metrics(@RequestParam("userId") Long userId) {
        return ApiResponse.success(loopDetectorRegistry.forUser(userId).getMetrics());
    }

    @GetMapping("/config")
    public ApiResponse<LoopDetectionConfig> config(@RequestParam("userId") Long userId) {
        return ApiResponse.success(loopDetectorRegistry.forUser(userId).getConfig());
    }

    /**
     * Partial update: absent fields keep their current value.
     */
    @PutMapping("/config")
    public ApiResponse<LoopDetectionConfig> updateConfig(@RequestParam("userId") Long userId,
                                                         @Valid @RequestBody UpdateLoopDetectionConfigRequest request) {
        LoopDetector detector = loopDetectorRegistry.forUser(userId);
        LoopDetectionConfig merged = merge(detector.getConfig().copy(), request);
        detector.updateConfig(merged);
        return ApiResponse.success(detector.getConfig());
    }

    @PostMapping("/clear")
    public ApiResponse<String> clear(@RequestParam("userId") Long userId) {
        loopDetectorRegistry.forUser(userId).clearState();
        return ApiResponse.success("CLEARED");
    }

    static LoopDetectionConfig merge(LoopDetectionConfig config, UpdateLoopDetectionConfigRequest request) {
        if (request.getEnabled() != null) {
            config.setEnabled(request.getEnabled());
        }
        if (request.getMaxAccessCount() != null) {
            config.setMaxAccessCount(request.getMaxAccessCount());
        }
        if (request.getTimeWindowSecs() != null) {
            config.setTimeWindowSecs(request.getTimeWindowSecs());
        }
        if (request.getMaxScanDurationSecs() != null) {
            config.setMaxScanDurationSecs(request.getMaxScanDurationSecs());
        }
        if (request.getMinScanIntervalSecs() != null) {
            config.setMinScanIntervalSecs(request.getMinScanIntervalSecs());
        }
        if (request.getEnablePatternAnalysis() != null) {
            config.setEnablePatternAnalysis(request.getEnablePatternAnalysis());
        }
        if (request.getMaxPatternDepth() != null) {
            config.setMaxPatternDepth(request.getMaxPatternDepth());
        }
        if (request.getMaxTrackedDirectories() != null) {
            config.setMaxTrackedDirectories(request.getMaxTrackedDirectories());
        }
        if (request.getRejectOnPattern() != null) {
            config.setRejectOnPattern(request.getRejectOnPattern());
        }
        if (request.getLogLevel() != null) {
            config.setLogLevel(request.getLogLevel());
        }
        if (request.getCircuitBreakerFailureThreshold() != null) {
            config.setCircuitBreakerFailureThreshold(request.getCircuitBreakerFailureThreshold());
        }
        if (request.getCircuitBreakerTimeoutSecs() != null) {
            config.setCircuitBreakerTimeoutSecs(request.getCircuitBreakerTimeoutSecs());
        }
        if (request.getEnableGracefulDegradation() != null) {
            config.setEnableGracefulDegradation(request.getEnableGracefulDegradation());
        }
        if (request.getMutexTimeoutMs() != null) {
            config.setMutexTimeoutMs(request.getMutexTimeoutMs());
        }
        return config;
    }
}
