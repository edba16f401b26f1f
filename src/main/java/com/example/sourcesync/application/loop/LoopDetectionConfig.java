package com.example.sourcesync.application.loop;

import lombok.Data;

/**
 * Thresholds for one loop detector. Instances handed to a detector are copied, so later
 * mutation of the caller's object has no effect until {@link LoopDetector#updateConfig} is called.
 */
@Data
public class LoopDetectionConfig {

    /** Upper bound for every seconds-valued threshold (365 days). */
    public static final long MAX_DURATION_SECS = 31_536_000L;

    public static final long MAX_MUTEX_TIMEOUT_MS = 60_000L;

    private boolean enabled = true;

    /** Accesses to one path allowed inside {@link #timeWindowSecs} before rejecting. */
    private int maxAccessCount = 3;

    private long timeWindowSecs = 300;

    /** Advisory only; completions slower than this are reported as stuck scans. */
    private long maxScanDurationSecs = 60;

    /** Minimum gap between the completion of one access and the start of the next. */
    private long minScanIntervalSecs = 5;

    /** Number of recent paths per scan label considered for cycle analysis. */
    private int maxPatternDepth = 10;

    private int maxTrackedDirectories = 1000;

    private boolean enablePatternAnalysis = true;

    /** Turns a suspected cycle into a hard rejection instead of an alert. */
    private boolean rejectOnPattern = false;

    private String logLevel = "warn";

    /** Consecutive internal failures (lock timeouts, interrupts) that open the circuit. */
    private int circuitBreakerFailureThreshold = 5;

    /** How long an open circuit bypasses detection before it closes again. */
    private long circuitBreakerTimeoutSecs = 300;

    /** Hand out untracked handles instead of failing when the detector itself is unavailable. */
    private boolean enableGracefulDegradation = true;

    private long mutexTimeoutMs = 100;

    public static LoopDetectionConfig defaults() {
        return new LoopDetectionConfig();
    }

    public static LoopDetectionConfig production() {
        LoopDetectionConfig config = new LoopDetectionConfig();
        config.setMaxAccessCount(3);
        config.setTimeWindowSecs(300);
        config.setMaxScanDurationSecs(120);
        config.setMinScanIntervalSecs(10);
        config.setMaxPatternDepth(5);
        config.setMaxTrackedDirectories(500);
        config.setCircuitBreakerFailureThreshold(3);
        config.setCircuitBreakerTimeoutSecs(300);
        config.setMutexTimeoutMs(200);
        return config;
    }

    public static LoopDetectionConfig development() {
        LoopDetectionConfig config = new LoopDetectionConfig();
        config.setMaxAccessCount(5);
        config.setTimeWindowSecs(180);
        config.setMaxScanDurationSecs(60);
        config.setMinScanIntervalSecs(2);
        config.setMaxPatternDepth(10);
        config.setMaxTrackedDirectories(100);
        config.setLogLevel("debug");
        config.setCircuitBreakerFailureThreshold(5);
        config.setCircuitBreakerTimeoutSecs(60);
        config.setMutexTimeoutMs(500);
        return config;
    }

    public static LoopDetectionConfig minimal() {
        LoopDetectionConfig config = new LoopDetectionConfig();
        config.setMaxAccessCount(10);
        config.setTimeWindowSecs(600);
        config.setMaxScanDurationSecs(300);
        config.setMinScanIntervalSecs(1);
        config.setMaxPatternDepth(3);
        config.setMaxTrackedDirectories(50);
        config.setEnablePatternAnalysis(false);
        config.setLogLevel("error");
        config.setCircuitBreakerFailureThreshold(10);
        config.setCircuitBreakerTimeoutSecs(600);
        config.setMutexTimeoutMs(50);
        return config;
    }

    public LoopDetectionConfig copy() {
        LoopDetectionConfig copy = new LoopDetectionConfig();
        copy.setEnabled(enabled);
        copy.setMaxAccessCount(maxAccessCount);
        copy.setTimeWindowSecs(timeWindowSecs);
        copy.setMaxScanDurationSecs(maxScanDurationSecs);
        copy.setMinScanIntervalSecs(minScanIntervalSecs);
        copy.setMaxPatternDepth(maxPatternDepth);
        copy.setMaxTrackedDirectories(maxTrackedDirectories);
        copy.setEnablePatternAnalysis(enablePatternAnalysis);
        copy.setRejectOnPattern(rejectOnPattern);
        copy.setLogLevel(logLevel);
        copy.setCircuitBreakerFailureThreshold(circuitBreakerFailureThreshold);
        copy.setCircuitBreakerTimeoutSecs(circuitBreakerTimeoutSecs);
        copy.setEnableGracefulDegradation(enableGracefulDegradation);
        copy.setMutexTimeoutMs(mutexTimeoutMs);
        return copy;
    }

    public void validate() {
        if (maxAccessCount < 1) {
            throw new IllegalArgumentException("maxAccessCount must be >= 1");
        }
        if (timeWindowSecs <= 0) {
            throw new IllegalArgumentException("timeWindowSecs must be > 0");
        }
        if (minScanIntervalSecs < 0 || maxScanDurationSecs < 0) {
            throw new IllegalArgumentException("scan interval and duration must not be negative");
        }
        checkAtMostOneYear("timeWindowSecs", timeWindowSecs);
        checkAtMostOneYear("minScanIntervalSecs", minScanIntervalSecs);
        checkAtMostOneYear("maxScanDurationSecs", maxScanDurationSecs);
        if (maxPatternDepth < 2) {
            throw new IllegalArgumentException("maxPatternDepth must be >= 2");
        }
        if (maxTrackedDirectories < 1) {
            throw new IllegalArgumentException("maxTrackedDirectories must be >= 1");
        }
        if (circuitBreakerFailureThreshold < 1) {
            throw new IllegalArgumentException("circuitBreakerFailureThreshold must be >= 1");
        }
        if (circuitBreakerTimeoutSecs < 0) {
            throw new IllegalArgumentException("circuitBreakerTimeoutSecs must not be negative");
        }
        checkAtMostOneYear("circuitBreakerTimeoutSecs", circuitBreakerTimeoutSecs);
        if (mutexTimeoutMs < 0 || mutexTimeoutMs > MAX_MUTEX_TIMEOUT_MS) {
            throw new IllegalArgumentException("mutexTimeoutMs must be between 0 and " + MAX_MUTEX_TIMEOUT_MS);
        }
    }

    private static void checkAtMostOneYear(String field, long seconds) {
        if (seconds > MAX_DURATION_SECS) {
            throw new IllegalArgumentException(field + " must be <= " + MAX_DURATION_SECS);
        }
    }
}
