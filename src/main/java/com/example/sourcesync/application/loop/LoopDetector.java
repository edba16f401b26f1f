package com.example.sourcesync.application.loop;

import com.example.sourcesync.common.exception.LoopDetectedException;
import com.example.sourcesync.domain.enumtype.LoopType;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks directory accesses of one sync engine and rejects accesses that look like traversal loops.
 *
 * <p>All state sits behind a single lock. The check and the registration in {@link #startAccess} are
 * one critical section, so of several concurrent calls for the same path exactly one succeeds.
 * Callers perform their I/O between {@link #startAccess} and {@link #completeAccess} without holding
 * anything, and must call {@link #completeAccess} from a {@code finally} block.
 *
 * <p>{@link #startAccess} waits at most {@code mutexTimeoutMs} for the lock. A timeout or an interrupt
 * counts as an internal failure; with graceful degradation enabled the caller gets an untracked handle
 * and proceeds without detection. {@code circuitBreakerFailureThreshold} consecutive failures open a
 * circuit that bypasses detection for {@code circuitBreakerTimeoutSecs}.
 */
public class LoopDetector {

    private static final Logger log = LoggerFactory.getLogger(LoopDetector.class);

    private static final String DEFAULT_SCAN_LABEL = "default";

    private final String name;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    final ReentrantLock lock = new ReentrantLock();
    private final LoopCircuitBreaker circuitBreaker = new LoopCircuitBreaker();

    // written under the lock, read without it before acquisition
    private volatile LoopDetectionConfig config;

    private final Map<String, AccessRecord> activeByPath = new HashMap<>();
    private final Map<UUID, AccessRecord> activeById = new HashMap<>();
    // completion order
    private final Deque<AccessRecord> history = new ArrayDeque<>();
    private final LinkedHashMap<String, Instant> lastCompletionByPath = new LinkedHashMap<>();
    private final LinkedHashMap<String, Deque<String>> recentPathsByScan = new LinkedHashMap<>(16, 0.75f, true);

    private long totalAccesses;
    private long totalLoopsDetected;
    private long patternAlerts;
    private long stuckScans;
    private final AtomicLong degradedAccesses = new AtomicLong();
    private long totalOperations;
    private long totalOperationNanos;
    private long maxOperationNanos;

    public LoopDetector(LoopDetectionConfig config) {
        this("default", config, Clock.systemUTC(), null);
    }

    public LoopDetector(String name, LoopDetectionConfig config, Clock clock, MeterRegistry meterRegistry) {
        Objects.requireNonNull(config, "config");
        config.validate();
        this.name = name;
        this.config = config.copy();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Registers an access to {@code path} or rejects it.
     *
     * @throws LoopDetectedException when the access looks like a loop; nothing is registered
     * @throws IllegalStateException when the lock cannot be taken and graceful degradation is off
     */
    public AccessHandle startAccess(String path, String scanLabel) {
        Objects.requireNonNull(path, "path");
        String label = scanLabel == null || scanLabel.trim().isEmpty() ? DEFAULT_SCAN_LABEL : scanLabel;
        LoopDetectedException rejection;
        List<String> suspectedCycle = null;
        LoopDetectionConfig current = config;

        Instant requestedAt = clock.instant();
        if (!current.isEnabled()) {
            return new AccessHandle(UUID.randomUUID(), path, label, requestedAt, false);
        }
        if (circuitBreaker.isOpen(requestedAt, current)) {
            log.debug("LOOP_CIRCUIT_OPEN detector={} path={} scan={}", name, path, label);
            return degraded(path, label, requestedAt);
        }
        if (!acquire(path, current)) {
            return degraded(path, label, requestedAt);
        }
        long startNanos = System.nanoTime();
        try {
            circuitBreaker.recordSuccess();
            current = config;
            Instant now = clock.instant();
            if (!current.isEnabled()) {
                return new AccessHandle(UUID.randomUUID(), path, label, now, false);
            }
            evictExpired(now, current);

            rejection = checkConcurrent(path);
            if (rejection == null) {
                rejection = checkTooSoon(path, now, current);
            }
            if (rejection == null) {
                rejection = checkFrequency(path, now, current);
            }
            if (rejection == null && current.isEnablePatternAnalysis()) {
                suspectedCycle = findCycle(path, label);
                if (suspectedCycle != null && current.isRejectOnPattern()) {
                    rejection = new LoopDetectedException(LoopType.PATTERN_CYCLE, path,
                            "Circular access pattern detected: " + String.join(" -> ", suspectedCycle),
                            Arrays.asList(
                                    "Check these directories for symbolic links or aliases: "
                                            + String.join(", ", suspectedCycle),
                                    "Consider excluding one of the directories from sync"));
                } else if (suspectedCycle != null) {
                    patternAlerts++;
                }
            }

            if (rejection != null) {
                totalLoopsDetected++;
            } else {
                AccessHandle handle = new AccessHandle(UUID.randomUUID(), path, label, now, true);
                AccessRecord record = new AccessRecord(handle);
                activeByPath.put(path, record);
                activeById.put(handle.getId(), record);
                rememberScanPath(label, path, current);
                totalAccesses++;
                if (suspectedCycle != null) {
                    logPatternAlert(path, label, suspectedCycle, current);
                    incrementCounter("sync.loop.pattern_alert", "detector", name);
                }
                log.debug("LOOP_ACCESS_STARTED detector={} path={} scan={} id={}",
                        name, path, label, handle.getId());
                return handle;
            }
        } finally {
            recordOperation(startNanos);
            lock.unlock();
        }

        logRejection(rejection, current);
        incrementCounter("sync.loop.rejected", "detector", name, "type", rejection.getLoopType().name());
        throw rejection;
    }

    /**
     * Closes an access opened by {@link #startAccess}.
     *
     * @throws IllegalStateException when the handle is not open on this detector
     */
    public void completeAccess(AccessHandle handle, int filesFound, int dirsFound, String error) {
        Objects.requireNonNull(handle, "handle");
        if (!handle.isTracked()) {
            return;
        }
        AccessRecord record;
        boolean stuck;
        LoopDetectionConfig current;

        // unbounded wait: a dropped completion would leave the path blocked as concurrent
        lock.lock();
        long startNanos = System.nanoTime();
        try {
            current = config;
            record = activeById.remove(handle.getId());
            if (record == null) {
                throw new IllegalStateException("No open access for handle " + handle.getId()
                        + " path=" + handle.getPath() + " (already completed, cleared or foreign)");
            }
            activeByPath.remove(record.getPath(), record);

            Instant now = clock.instant();
            record.setCompletedAt(now);
            record.setFilesFound(filesFound);
            record.setDirsFound(dirsFound);
            record.setError(error);

            history.addLast(record);
            lastCompletionByPath.remove(record.getPath());
            lastCompletionByPath.put(record.getPath(), now);
            trimToCapacity(current);

            stuck = record.duration().compareTo(Duration.ofSeconds(current.getMaxScanDurationSecs())) > 0;
            if (stuck) {
                stuckScans++;
            }
        } finally {
            recordOperation(startNanos);
            lock.unlock();
        }

        if (stuck) {
            logAtLevel(current.getLogLevel(),
                    "LOOP_STUCK_SCAN detector={} path={} durationMs={} maxScanDurationSecs={}",
                    name, record.getPath(), record.duration().toMillis(), current.getMaxScanDurationSecs());
            incrementCounter("sync.loop.stuck_scan", "detector", name);
        }
        log.debug("LOOP_ACCESS_COMPLETED detector={} path={} files={} dirs={} error={}",
                name, record.getPath(), filesFound, dirsFound, error);
    }

    public LoopDetectionMetrics getMetrics() {
        lock.lock();
        try {
            return new LoopDetectionMetrics(
                    config.isEnabled(),
                    totalAccesses,
                    totalLoopsDetected,
                    activeById.size(),
                    history.size(),
                    patternAlerts,
                    stuckScans,
                    circuitBreaker.isOpenNow(),
                    circuitBreaker.getFailures(),
                    circuitBreaker.getLastFailureAt(),
                    degradedAccesses.get(),
                    totalOperations,
                    totalOperations == 0 ? 0.0D : totalOperationNanos / 1000.0D / totalOperations,
                    maxOperationNanos / 1000.0D,
                    config.copy());
        } finally {
            lock.unlock();
        }
    }

    public PathAccessMetrics pathMetrics(String path) {
        List<AccessRecord> matches = new ArrayList<>();
        lock.lock();
        try {
            for (AccessRecord record : history) {
                if (record.getPath().equals(path)) {
                    matches.add(record);
                }
            }
        } finally {
            lock.unlock();
        }
        if (matches.isEmpty()) {
            return new PathAccessMetrics();
        }
        Instant first = matches.get(0).getStartedAt();
        Instant last = first;
        long totalDurationMs = 0;
        long files = 0;
        long subdirs = 0;
        int failed = 0;
        for (AccessRecord record : matches) {
            if (record.getStartedAt().isBefore(first)) {
                first = record.getStartedAt();
            }
            if (record.getStartedAt().isAfter(last)) {
                last = record.getStartedAt();
            }
            totalDurationMs += record.duration().toMillis();
            files += record.getFilesFound();
            subdirs += record.getDirsFound();
            if (record.getError() != null) {
                failed++;
            }
        }
        return new PathAccessMetrics(
                matches.size(),
                Duration.between(first, last).toMillis() / 1000.0D,
                totalDurationMs / 1000.0D / matches.size(),
                files,
                subdirs,
                failed);
    }

    public LoopDetectionConfig getConfig() {
        lock.lock();
        try {
            return config.copy();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEnabled() {
        lock.lock();
        try {
            return config.isEnabled();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the thresholds. Open accesses are not re-evaluated.
     */
    public void updateConfig(LoopDetectionConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig");
        newConfig.validate();
        lock.lock();
        try {
            this.config = newConfig.copy();
            trimToCapacity(config);
        } finally {
            lock.unlock();
        }
        log.info("LOOP_CONFIG_UPDATED detector={} enabled={} maxAccessCount={} timeWindowSecs={} "
                        + "minScanIntervalSecs={} patternAnalysis={}",
                name, newConfig.isEnabled(), newConfig.getMaxAccessCount(), newConfig.getTimeWindowSecs(),
                newConfig.getMinScanIntervalSecs(), newConfig.isEnablePatternAnalysis());
    }

    public void clearState() {
        int dropped;
        lock.lock();
        try {
            dropped = activeById.size();
            activeByPath.clear();
            activeById.clear();
            history.clear();
            lastCompletionByPath.clear();
            recentPathsByScan.clear();
            totalAccesses = 0;
            totalLoopsDetected = 0;
            patternAlerts = 0;
            stuckScans = 0;
            totalOperations = 0;
            totalOperationNanos = 0;
            maxOperationNanos = 0;
            degradedAccesses.set(0);
            circuitBreaker.reset();
        } finally {
            lock.unlock();
        }
        log.info("LOOP_STATE_CLEARED detector={} droppedActive={}", name, dropped);
    }

    public String getName() {
        return name;
    }

    // ════════════════════════════════════════════════════════════════════════
    // Lock acquisition and degradation
    // ════════════════════════════════════════════════════════════════════════

    private boolean acquire(String path, LoopDetectionConfig current) {
        String reason;
        try {
            if (lock.tryLock(current.getMutexTimeoutMs(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            reason = "lock timeout after " + current.getMutexTimeoutMs() + "ms";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reason = "interrupted while waiting for lock";
        }
        if (circuitBreaker.recordFailure(clock.instant(), current)) {
            log.warn("LOOP_CIRCUIT_OPENED detector={} failures={} reopenAfterSecs={}",
                    name, circuitBreaker.getFailures(), current.getCircuitBreakerTimeoutSecs());
            incrementCounter("sync.loop.circuit_opened", "detector", name);
        }
        if (!current.isEnableGracefulDegradation()) {
            throw new IllegalStateException("Loop detection unavailable for '" + path + "': " + reason);
        }
        log.warn("LOOP_DETECTION_DEGRADED detector={} path={} reason={}", name, path, reason);
        return false;
    }

    private AccessHandle degraded(String path, String label, Instant now) {
        degradedAccesses.incrementAndGet();
        incrementCounter("sync.loop.degraded", "detector", name);
        return new AccessHandle(UUID.randomUUID(), path, label, now, false);
    }

    private void recordOperation(long startNanos) {
        long elapsed = System.nanoTime() - startNanos;
        totalOperations++;
        totalOperationNanos += elapsed;
        if (elapsed > maxOperationNanos) {
            maxOperationNanos = elapsed;
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // Checks (lock held)
    // ════════════════════════════════════════════════════════════════════════

    private LoopDetectedException checkConcurrent(String path) {
        AccessRecord open = activeByPath.get(path);
        if (open == null) {
            return null;
        }
        return new LoopDetectedException(LoopType.CONCURRENT_ACCESS, path,
                "Directory '" + path + "' is already being scanned (scan=" + open.getHandle().getScanLabel() + ")",
                Arrays.asList(
                        "Stop any other running sync operation for this source",
                        "Review the sync schedule to prevent overlapping runs"));
    }

    private LoopDetectedException checkTooSoon(String path, Instant now, LoopDetectionConfig current) {
        Instant lastCompletion = lastCompletionByPath.get(path);
        if (lastCompletion == null) {
            return null;
        }
        Duration elapsed = Duration.between(lastCompletion, now);
        if (elapsed.compareTo(Duration.ofSeconds(current.getMinScanIntervalSecs())) >= 0) {
            return null;
        }
        return new LoopDetectedException(LoopType.TOO_SOON, path,
                String.format(Locale.ROOT, "Directory '%s' re-accessed after only %.2fs (minimum interval: %ds)",
                        path, elapsed.toMillis() / 1000.0D, current.getMinScanIntervalSecs()),
                Arrays.asList(
                        "Wait at least " + current.getMinScanIntervalSecs()
                                + " seconds before rescanning the same directory",
                        "Check whether multiple sync processes are running"),
                elapsed.toMillis(),
                null);
    }

    private LoopDetectedException checkFrequency(String path, Instant now, LoopDetectionConfig current) {
        Instant windowStart = now.minusSeconds(current.getTimeWindowSecs());
        int count = 0;
        for (AccessRecord record : history) {
            if (record.getPath().equals(path) && !record.getStartedAt().isBefore(windowStart)) {
                count++;
            }
        }
        if (count < current.getMaxAccessCount()) {
            return null;
        }
        return new LoopDetectedException(LoopType.TOO_FREQUENT, path,
                "Directory '" + path + "' accessed " + count + " times in the last "
                        + current.getTimeWindowSecs() + " seconds",
                Arrays.asList(
                        "Check for symbolic links or aliases that point back to a parent directory",
                        "Increase the sync interval for this source"),
                null,
                count);
    }

    private List<String> findCycle(String path, String label) {
        Deque<String> recent = recentPathsByScan.get(label);
        if (recent == null || recent.size() < 2) {
            return null;
        }
        List<String> sequence = new ArrayList<>(recent);
        int lastIndex = sequence.lastIndexOf(path);
        if (lastIndex < 0 || lastIndex >= sequence.size() - 1) {
            return null;
        }
        List<String> cycle = new ArrayList<>(sequence.subList(lastIndex, sequence.size()));
        cycle.add(path);
        return cycle;
    }

    // ════════════════════════════════════════════════════════════════════════
    // Bookkeeping (lock held)
    // ════════════════════════════════════════════════════════════════════════

    private void rememberScanPath(String label, String path, LoopDetectionConfig current) {
        Deque<String> recent = recentPathsByScan.get(label);
        if (recent == null) {
            recent = new ArrayDeque<>();
            recentPathsByScan.put(label, recent);
        }
        recent.addLast(path);
        while (recent.size() > current.getMaxPatternDepth()) {
            recent.removeFirst();
        }
    }

    private void evictExpired(Instant now, LoopDetectionConfig current) {
        Instant windowStart = now.minusSeconds(current.getTimeWindowSecs());
        Iterator<AccessRecord> historyIt = history.iterator();
        while (historyIt.hasNext()) {
            if (historyIt.next().getStartedAt().isBefore(windowStart)) {
                historyIt.remove();
            }
        }
        long keepSecs = Math.max(current.getTimeWindowSecs(), current.getMinScanIntervalSecs());
        Instant completionCutoff = now.minusSeconds(keepSecs);
        Iterator<Map.Entry<String, Instant>> completionIt = lastCompletionByPath.entrySet().iterator();
        while (completionIt.hasNext()) {
            if (completionIt.next().getValue().isBefore(completionCutoff)) {
                completionIt.remove();
            } else {
                break;
            }
        }
    }

    private void trimToCapacity(LoopDetectionConfig current) {
        int capacity = current.getMaxTrackedDirectories();
        while (history.size() > capacity) {
            history.removeFirst();
        }
        Iterator<String> completionIt = lastCompletionByPath.keySet().iterator();
        while (lastCompletionByPath.size() > capacity && completionIt.hasNext()) {
            completionIt.next();
            completionIt.remove();
        }
        Iterator<String> scanIt = recentPathsByScan.keySet().iterator();
        while (recentPathsByScan.size() > capacity && scanIt.hasNext()) {
            scanIt.next();
            scanIt.remove();
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // Reporting (lock released)
    // ════════════════════════════════════════════════════════════════════════

    private void logRejection(LoopDetectedException rejection, LoopDetectionConfig current) {
        String suggestion = rejection.getRecommendations().isEmpty()
                ? "Review sync configuration"
                : rejection.getRecommendations().get(0);
        if (rejection.getLoopType().isCritical()) {
            log.error("LOOP_REJECTED detector={} type={} path={} msg={} action={}",
                    name, rejection.getLoopType(), rejection.getPath(), rejection.getMessage(), suggestion);
            return;
        }
        logAtLevel(current.getLogLevel(), "LOOP_REJECTED detector={} type={} path={} msg={} action={}",
                name, rejection.getLoopType(), rejection.getPath(), rejection.getMessage(), suggestion);
    }

    private void logPatternAlert(String path, String label, List<String> cycle, LoopDetectionConfig current) {
        logAtLevel(current.getLogLevel(), "LOOP_PATTERN_SUSPECTED detector={} path={} scan={} cycle={}",
                name, path, label, String.join(" -> ", cycle));
    }

    private void logAtLevel(String level, String format, Object... args) {
        String normalized = level == null ? "warn" : level.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "error":
                log.error(format, args);
                break;
            case "info":
                log.info(format, args);
                break;
            case "debug":
                log.debug(format, args);
                break;
            default:
                log.warn(format, args);
                break;
        }
    }

    private void incrementCounter(String metricName, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(metricName, tags).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", metricName, e);
        }
    }
}
