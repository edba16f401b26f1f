package com.example.sourcesync.application.loop;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoopDetectionMetrics {

    private boolean enabled;

    private long totalAccesses;

    private long totalLoopsDetected;

    private int activeAccesses;

    private int historySize;

    private long patternAlerts;

    private long stuckScans;

    private boolean circuitBreakerOpen;

    /** Consecutive internal failures since the last successful lock acquisition. */
    private int circuitBreakerFailures;

    private Instant circuitBreakerLastFailureAt;

    /** Degraded accesses handed out untracked because of a lock timeout or an open circuit. */
    private long degradedAccesses;

    private long totalOperations;

    private double averageOperationMicros;

    private double maxOperationMicros;

    private LoopDetectionConfig config;
}
