package com.example.sourcesync.application.service;

import com.example.sourcesync.domain.enumtype.RetryStrategy;

/**
 * Delay until the next retry, computed from the base delay and the number of consecutive failures.
 */
public final class RetryBackoff {

    public static final long MAX_DELAY_SECONDS = 86_400L;

    private static final int MAX_EXPONENT = 10;

    private RetryBackoff() {
    }

    public static long delaySeconds(RetryStrategy strategy, int baseDelaySeconds, int consecutiveFailures) {
        long base = Math.max(0, baseDelaySeconds);
        int n = Math.max(1, consecutiveFailures);
        long delay;
        switch (strategy == null ? RetryStrategy.EXPONENTIAL : strategy) {
            case LINEAR:
                delay = base * n;
                break;
            case FIXED:
                delay = base;
                break;
            case EXPONENTIAL:
            default:
                delay = base << Math.min(n - 1, MAX_EXPONENT);
                break;
        }
        return Math.min(delay, MAX_DELAY_SECONDS);
    }
}
