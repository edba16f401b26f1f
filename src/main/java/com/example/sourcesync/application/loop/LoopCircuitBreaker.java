package com.example.sourcesync.application.loop;

import java.time.Duration;
import java.time.Instant;

/**
 * Counts consecutive internal failures of a {@link LoopDetector}. Once open, detection is bypassed
 * until {@code circuitBreakerTimeoutSecs} have passed since the last failure.
 *
 * <p>Guarded by its own monitor: failures are recorded exactly when the detector lock could not be taken.
 */
class LoopCircuitBreaker {

    private int failures;
    private boolean open;
    private Instant lastFailureAt;

    /**
     * @return true when the circuit is open at {@code now}; an expired open circuit is closed first
     */
    synchronized boolean isOpen(Instant now, LoopDetectionConfig config) {
        if (!open) {
            return false;
        }
        Duration sinceFailure = Duration.between(lastFailureAt, now);
        if (sinceFailure.compareTo(Duration.ofSeconds(config.getCircuitBreakerTimeoutSecs())) > 0) {
            open = false;
            failures = 0;
            return false;
        }
        return true;
    }

    /**
     * @return true when this failure opened the circuit
     */
    synchronized boolean recordFailure(Instant now, LoopDetectionConfig config) {
        failures++;
        lastFailureAt = now;
        if (!open && failures >= config.getCircuitBreakerFailureThreshold()) {
            open = true;
            return true;
        }
        return false;
    }

    synchronized void recordSuccess() {
        if (!open) {
            failures = 0;
        }
    }

    synchronized void reset() {
        failures = 0;
        open = false;
        lastFailureAt = null;
    }

    synchronized int getFailures() {
        return failures;
    }

    synchronized boolean isOpenNow() {
        return open;
    }

    synchronized Instant getLastFailureAt() {
        return lastFailureAt;
    }
}
