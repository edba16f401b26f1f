package com.example.sourcesync.application.service;

import com.example.sourcesync.application.classifier.SourceErrorClassifier;
import com.example.sourcesync.application.classifier.SourceErrorClassifierRegistry;
import com.example.sourcesync.common.config.AppSyncProperties;
import com.example.sourcesync.common.util.HashUtil;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.model.ErrorClassification;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.example.sourcesync.infrastructure.persistence.mapper.SourceScanFailureMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Persists scan failures per (user, source type, path) and answers whether a resource is due for
 * another attempt. Recording and resolving never throw: a broken failure store must not break a sync.
 */
@Service
public class SourceFailureTracker {

    private static final Logger log = LoggerFactory.getLogger(SourceFailureTracker.class);

    public static final String RESOLUTION_SUCCESSFUL_SCAN = "successful_scan";

    private static final int MAX_ERROR_MESSAGE_LENGTH = 4000;

    private final SourceScanFailureMapper sourceScanFailureMapper;
    private final SourceErrorClassifierRegistry classifierRegistry;
    private final ObjectMapper objectMapper;
    private final AppSyncProperties appSyncProperties;
    private final Clock clock;

    @Autowired
    public SourceFailureTracker(SourceScanFailureMapper sourceScanFailureMapper,
                                SourceErrorClassifierRegistry classifierRegistry,
                                ObjectMapper objectMapper,
                                AppSyncProperties appSyncProperties) {
        this(sourceScanFailureMapper, classifierRegistry, objectMapper, appSyncProperties, Clock.systemUTC());
    }

    SourceFailureTracker(SourceScanFailureMapper sourceScanFailureMapper,
                         SourceErrorClassifierRegistry classifierRegistry,
                         ObjectMapper objectMapper,
                         AppSyncProperties appSyncProperties,
                         Clock clock) {
        this.sourceScanFailureMapper = sourceScanFailureMapper;
        this.classifierRegistry = classifierRegistry;
        this.objectMapper = objectMapper;
        this.appSyncProperties = appSyncProperties;
        this.clock = clock;
    }

    public ErrorClassification trackScanError(Long userId,
                                              ErrorSourceType sourceType,
                                              String resourcePath,
                                              Throwable error,
                                              Duration responseTime,
                                              Long responseSizeBytes,
                                              String serverType) {
        ErrorContext context = ErrorContext.of(resourcePath)
                .withOperation("scan_directory")
                .withResponseTime(responseTime)
                .withResponseSize(responseSizeBytes)
                .withServerInfo(serverType, null);
        return trackScanError(userId, sourceType, null, resourcePath, error, context);
    }

    /**
     * Classifies the error and records one more occurrence for the resource.
     *
     * @return the classification, also when persisting it failed
     */
    public ErrorClassification trackScanError(Long userId,
                                              ErrorSourceType sourceType,
                                              Long sourceId,
                                              String resourcePath,
                                              Throwable error,
                                              ErrorContext context) {
        SourceErrorClassifier classifier = classifierRegistry.get(sourceType);
        ErrorContext ctx = context == null ? ErrorContext.of(resourcePath) : context;
        if (sourceId != null) {
            ctx = ctx.withSourceId(sourceId);
        }
        ErrorClassification classification = classifier.classify(error, ctx);
        try {
            upsert(userId, sourceType, ctx.getSourceId(), resourcePath, error, ctx, classification);
        } catch (RuntimeException e) {
            log.warn("SOURCE_FAILURE_TRACK_FAILED userId={} sourceType={} path={} reason={}",
                    userId, sourceType.getCode(), resourcePath, e.getMessage());
        }
        return classification;
    }

    private void upsert(Long userId, ErrorSourceType sourceType, Long sourceId, String resourcePath,
                        Throwable error, ErrorContext ctx, ErrorClassification classification) {
        int maxAttempts = Math.max(1, appSyncProperties.getTrackMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            LocalDateTime now = now();
            SourceScanFailureEntity existing =
                    sourceScanFailureMapper.selectByKey(userId, sourceType.getCode(), HashUtil.md5Hex(resourcePath));
            if (existing == null) {
                SourceScanFailureEntity entity = new SourceScanFailureEntity();
                entity.setUserId(userId);
                entity.setSourceType(sourceType.getCode());
                entity.setResourcePath(resourcePath);
                entity.setResourcePathMd5(HashUtil.md5Hex(resourcePath));
                entity.setFailureCount(1);
                entity.setConsecutiveFailures(1);
                entity.setFirstFailureAt(now);
                applyOccurrence(entity, sourceId, error, ctx, classification, now);
                try {
                    sourceScanFailureMapper.insert(entity);
                    log.info("SOURCE_FAILURE_RECORDED userId={} sourceType={} path={} type={} severity={}",
                            userId, sourceType.getCode(), resourcePath, entity.getErrorType(),
                            entity.getErrorSeverity());
                    return;
                } catch (DuplicateKeyException e) {
                    log.debug("SOURCE_FAILURE_INSERT_RACE userId={} path={} attempt={}", userId, resourcePath, attempt);
                    continue;
                }
            }
            int expectedFailureCount = existing.failureCountOrZero();
            existing.setFailureCount(expectedFailureCount + 1);
            existing.setConsecutiveFailures(existing.consecutiveFailuresOrZero() + 1);
            applyOccurrence(existing, sourceId == null ? existing.getSourceId() : sourceId,
                    error, ctx, classification, now);
            if (sourceScanFailureMapper.updateOccurrence(existing, expectedFailureCount) > 0) {
                log.info("SOURCE_FAILURE_UPDATED userId={} sourceType={} path={} failureCount={} consecutive={} "
                                + "nextRetryAt={}", userId, sourceType.getCode(), resourcePath,
                        existing.getFailureCount(), existing.getConsecutiveFailures(), existing.getNextRetryAt());
                return;
            }
            log.debug("SOURCE_FAILURE_UPDATE_RACE userId={} path={} attempt={}", userId, resourcePath, attempt);
        }
        log.warn("SOURCE_FAILURE_TRACK_CONTENDED userId={} sourceType={} path={} attempts={}",
                userId, sourceType.getCode(), resourcePath, maxAttempts);
    }

    private void applyOccurrence(SourceScanFailureEntity entity, Long sourceId, Throwable error, ErrorContext ctx,
                                 ErrorClassification classification, LocalDateTime now) {
        entity.setSourceId(sourceId);
        entity.setErrorType(classification.getErrorType().getCode());
        entity.setErrorSeverity(classification.getSeverity().getCode());
        entity.setRetryStrategy(classification.getRetryStrategy().getCode());
        entity.setRetryDelaySeconds(classification.getRetryDelaySeconds());
        entity.setMaxRetries(classification.getMaxRetries());
        entity.setLastFailureAt(now);
        long delay = RetryBackoff.delaySeconds(classification.getRetryStrategy(),
                classification.getRetryDelaySeconds(), entity.consecutiveFailuresOrZero());
        entity.setNextRetryAt(now.plusSeconds(delay));
        entity.setErrorMessage(truncate(errorMessage(error)));
        entity.setErrorCode(classification.getErrorCode());
        entity.setHttpStatusCode(classification.getHttpStatusCode());
        entity.setResponseTimeMs(ctx.getResponseTimeMs());
        entity.setResponseSizeBytes(ctx.getResponseSizeBytes());
        entity.setResourceDepth(depthOf(entity.getResourcePath()));
        JsonNode diagnostics = classification.getDiagnostics();
        if (diagnostics != null) {
            JsonNode itemCount = diagnostics.get("estimated_item_count");
            entity.setEstimatedItemCount(itemCount != null && itemCount.canConvertToInt() ? itemCount.asInt() : null);
            try {
                entity.setDiagnosticData(objectMapper.writeValueAsString(diagnostics));
            } catch (JsonProcessingException e) {
                log.debug("SOURCE_FAILURE_DIAGNOSTICS_SKIPPED path={} reason={}", entity.getResourcePath(),
                        e.getOriginalMessage());
                entity.setDiagnosticData(null);
            }
        }
    }

    /**
     * True when the resource is excluded, or still cooling down, or out of automatic retries.
     * Lookup errors let the scan proceed.
     */
    public boolean shouldSkipDirectory(Long userId, ErrorSourceType sourceType, String resourcePath) {
        try {
            SourceScanFailureEntity failure =
                    sourceScanFailureMapper.selectByKey(userId, sourceType.getCode(), HashUtil.md5Hex(resourcePath));
            if (failure == null) {
                return false;
            }
            if (failure.isUserExcludedFlag()) {
                log.debug("SOURCE_FAILURE_SKIP_EXCLUDED userId={} path={}", userId, resourcePath);
                return true;
            }
            if (failure.isResolvedFlag()) {
                return false;
            }
            LocalDateTime nextRetryAt = failure.getNextRetryAt();
            if (nextRetryAt != null && nextRetryAt.isAfter(now())) {
                log.debug("SOURCE_FAILURE_SKIP_COOLDOWN userId={} path={} nextRetryAt={}",
                        userId, resourcePath, nextRetryAt);
                return true;
            }
            if (isManualRetryPending(failure)) {
                return false;
            }
            boolean exhausted = !classifierRegistry.get(sourceType).shouldRetry(failure);
            if (exhausted) {
                log.debug("SOURCE_FAILURE_SKIP_EXHAUSTED userId={} path={} severity={} failureCount={}",
                        userId, resourcePath, failure.getErrorSeverity(), failure.getFailureCount());
            }
            return exhausted;
        } catch (RuntimeException e) {
            log.warn("SOURCE_FAILURE_SKIP_CHECK_FAILED userId={} sourceType={} path={} reason={}",
                    userId, sourceType.getCode(), resourcePath, e.getMessage());
            return false;
        }
    }

    public void markScanSuccessful(Long userId, ErrorSourceType sourceType, String resourcePath) {
        try {
            int updated = sourceScanFailureMapper.resolveByKey(userId, sourceType.getCode(),
                    HashUtil.md5Hex(resourcePath), RESOLUTION_SUCCESSFUL_SCAN, null, now());
            if (updated > 0) {
                log.info("SOURCE_FAILURE_RESOLVED userId={} sourceType={} path={} method={}",
                        userId, sourceType.getCode(), resourcePath, RESOLUTION_SUCCESSFUL_SCAN);
            }
        } catch (RuntimeException e) {
            log.warn("SOURCE_FAILURE_RESOLVE_FAILED userId={} sourceType={} path={} reason={}",
                    userId, sourceType.getCode(), resourcePath, e.getMessage());
        }
    }

    public List<SourceScanFailureEntity> getRetryCandidates(Long userId, ErrorSourceType sourceType, int limit) {
        int effectiveLimit = limit > 0 ? limit : appSyncProperties.getRetryCandidateLimit();
        try {
            List<SourceScanFailureEntity> rows = sourceScanFailureMapper.selectRetryCandidates(userId,
                    sourceType == null ? null : sourceType.getCode(), now(), effectiveLimit);
            return rows == null ? Collections.<SourceScanFailureEntity>emptyList() : rows;
        } catch (RuntimeException e) {
            log.warn("SOURCE_FAILURE_RETRY_QUERY_FAILED userId={} reason={}", userId, e.getMessage());
            return Collections.emptyList();
        }
    }

    public List<String> getRetryCandidatePaths(Long userId, ErrorSourceType sourceType, int limit) {
        List<SourceScanFailureEntity> candidates = getRetryCandidates(userId, sourceType, limit);
        List<String> paths = new ArrayList<String>(candidates.size());
        for (SourceScanFailureEntity candidate : candidates) {
            paths.add(candidate.getResourcePath());
        }
        return paths;
    }

    // user retry after the latest failure lifts the retry budget until the next failure
    private static boolean isManualRetryPending(SourceScanFailureEntity failure) {
        LocalDateTime lastRetryAt = failure.getLastRetryAt();
        LocalDateTime lastFailureAt = failure.getLastFailureAt();
        return lastRetryAt != null && (lastFailureAt == null || !lastRetryAt.isBefore(lastFailureAt));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String errorMessage(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        if (!StringUtils.hasText(message)) {
            message = error.getClass().getSimpleName();
        }
        Throwable cause = error.getCause();
        if (cause != null && cause != error && StringUtils.hasText(cause.getMessage())
                && !message.contains(cause.getMessage())) {
            message = message + ": " + cause.getMessage();
        }
        return message;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }

    private static Integer depthOf(String path) {
        if (path == null) {
            return 0;
        }
        int depth = 0;
        for (String part : stripUrlAuthority(path).split("/")) {
            if (!part.isEmpty()) {
                depth++;
            }
        }
        return depth;
    }

    // "https://host/a/b" has depth 2
    static String stripUrlAuthority(String path) {
        int scheme = path.indexOf("://");
        if (scheme < 0) {
            return path;
        }
        int slash = path.indexOf('/', scheme + 3);
        return slash < 0 ? "" : path.substring(slash);
    }
}
