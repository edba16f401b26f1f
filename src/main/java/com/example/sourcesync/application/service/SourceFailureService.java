package com.example.sourcesync.application.service;

import com.example.sourcesync.api.response.SourceFailureStatsResponse;
import com.example.sourcesync.api.response.SourceScanFailureResponse;
import com.example.sourcesync.application.classifier.SourceErrorClassifier;
import com.example.sourcesync.application.classifier.SourceErrorClassifierRegistry;
import com.example.sourcesync.common.exception.BusinessException;
import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.example.sourcesync.infrastructure.persistence.mapper.SourceScanFailureMapper;
import com.example.sourcesync.infrastructure.persistence.model.FailureCountRow;
import com.example.sourcesync.infrastructure.persistence.model.FailureSummaryRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * User-facing management of recorded scan failures: listing, retry, exclusion, manual resolution and stats.
 */
@Service
public class SourceFailureService {

    private static final Logger log = LoggerFactory.getLogger(SourceFailureService.class);

    public static final String RESOLUTION_MANUAL = "manual";

    private static final int MAX_PAGE_SIZE = 200;

    private final SourceScanFailureMapper sourceScanFailureMapper;
    private final SourceErrorClassifierRegistry classifierRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public SourceFailureService(SourceScanFailureMapper sourceScanFailureMapper,
                                SourceErrorClassifierRegistry classifierRegistry,
                                ObjectMapper objectMapper) {
        this(sourceScanFailureMapper, classifierRegistry, objectMapper, Clock.systemUTC());
    }

    SourceFailureService(SourceScanFailureMapper sourceScanFailureMapper,
                         SourceErrorClassifierRegistry classifierRegistry,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.sourceScanFailureMapper = sourceScanFailureMapper;
        this.classifierRegistry = classifierRegistry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public List<SourceScanFailureResponse> listFailures(Long userId, String sourceType, String errorType,
                                                        String severity, boolean includeResolved,
                                                        boolean includeExcluded, int limit, int offset) {
        String sourceCode = sourceType == null ? null : parseSourceType(sourceType).getCode();
        String errorCode;
        String severityCode;
        try {
            errorCode = errorType == null ? null : SourceErrorType.fromCode(errorType).getCode();
            severityCode = severity == null ? null : ErrorSeverity.fromCode(severity).getCode();
        } catch (IllegalArgumentException e) {
            throw new BusinessException("INVALID_FILTER", e.getMessage());
        }
        int safeLimit = Math.min(Math.max(1, limit), MAX_PAGE_SIZE);
        int safeOffset = Math.max(0, offset);
        List<SourceScanFailureEntity> rows = sourceScanFailureMapper.selectPage(userId, sourceCode, errorCode,
                severityCode, includeResolved, includeExcluded, safeLimit, safeOffset);
        List<SourceScanFailureResponse> responses = new ArrayList<>(rows.size());
        for (SourceScanFailureEntity row : rows) {
            responses.add(toResponse(row, false));
        }
        return responses;
    }

    public SourceScanFailureResponse getFailure(Long userId, Long id) {
        return toResponse(requireFailure(userId, id), true);
    }

    /**
     * Makes the failure due immediately and lifts a user exclusion.
     */
    public SourceScanFailureResponse retryFailure(Long userId, Long id, String notes) {
        SourceScanFailureEntity failure = requireFailure(userId, id);
        if (failure.isResolvedFlag()) {
            throw new BusinessException("FAILURE_ALREADY_RESOLVED", "Failure " + id + " is already resolved",
                    "No retry needed; the resource scanned successfully");
        }
        sourceScanFailureMapper.resetForRetry(userId, id, trimToNull(notes), now());
        log.info("SOURCE_FAILURE_RETRY_REQUESTED userId={} id={} path={}", userId, id, failure.getResourcePath());
        return getFailure(userId, id);
    }

    public SourceScanFailureResponse excludeResource(Long userId, Long id, String notes) {
        SourceScanFailureEntity failure = requireFailure(userId, id);
        sourceScanFailureMapper.updateExcluded(userId, id, true, trimToNull(notes));
        log.info("SOURCE_FAILURE_EXCLUDED userId={} id={} path={}", userId, id, failure.getResourcePath());
        return getFailure(userId, id);
    }

    public SourceScanFailureResponse resolveFailure(Long userId, Long id, String notes) {
        SourceScanFailureEntity failure = requireFailure(userId, id);
        int updated = sourceScanFailureMapper.resolveById(userId, id, RESOLUTION_MANUAL, trimToNull(notes), now());
        if (updated > 0) {
            log.info("SOURCE_FAILURE_RESOLVED userId={} id={} path={} method={}",
                    userId, id, failure.getResourcePath(), RESOLUTION_MANUAL);
        }
        return getFailure(userId, id);
    }

    public SourceFailureStatsResponse getStats(Long userId, String sourceType) {
        String sourceCode = sourceType == null ? null : parseSourceType(sourceType).getCode();
        SourceFailureStatsResponse stats = new SourceFailureStatsResponse();
        FailureSummaryRow summary = sourceScanFailureMapper.selectSummary(userId, sourceCode, now());
        if (summary != null) {
            stats.setActiveFailures(orZero(summary.getActiveFailures()));
            stats.setResolvedFailures(orZero(summary.getResolvedFailures()));
            stats.setExcludedResources(orZero(summary.getExcludedResources()));
            stats.setCriticalFailures(orZero(summary.getCriticalFailures()));
            stats.setHighFailures(orZero(summary.getHighFailures()));
            stats.setMediumFailures(orZero(summary.getMediumFailures()));
            stats.setLowFailures(orZero(summary.getLowFailures()));
            stats.setReadyForRetry(orZero(summary.getReadyForRetry()));
        }
        for (FailureCountRow row : sourceScanFailureMapper.countActiveBySourceType(userId)) {
            stats.getBySourceType().put(row.getGroupKey(), orZero(row.getTotal()));
        }
        for (FailureCountRow row : sourceScanFailureMapper.countActiveByErrorType(userId, sourceCode)) {
            stats.getByErrorType().put(row.getGroupKey(), orZero(row.getTotal()));
        }
        return stats;
    }

    private SourceScanFailureEntity requireFailure(Long userId, Long id) {
        SourceScanFailureEntity failure = sourceScanFailureMapper.selectById(userId, id);
        if (failure == null) {
            throw new BusinessException("404", "Source failure not found: " + id);
        }
        return failure;
    }

    SourceScanFailureResponse toResponse(SourceScanFailureEntity entity, boolean withDiagnostics) {
        SourceErrorClassifier classifier = classifierRegistry.get(resolveSourceType(entity.getSourceType()));
        SourceScanFailureResponse response = new SourceScanFailureResponse();
        response.setId(entity.getId());
        response.setSourceType(entity.getSourceType());
        response.setSourceId(entity.getSourceId());
        response.setResourcePath(entity.getResourcePath());
        response.setErrorType(entity.getErrorType());
        response.setErrorSeverity(entity.getErrorSeverity());
        response.setFailureCount(entity.getFailureCount());
        response.setConsecutiveFailures(entity.getConsecutiveFailures());
        response.setFirstFailureAt(entity.getFirstFailureAt());
        response.setLastFailureAt(entity.getLastFailureAt());
        response.setLastRetryAt(entity.getLastRetryAt());
        response.setNextRetryAt(entity.getNextRetryAt());
        response.setErrorMessage(entity.getErrorMessage());
        response.setErrorCode(entity.getErrorCode());
        response.setHttpStatusCode(entity.getHttpStatusCode());
        response.setResponseTimeMs(entity.getResponseTimeMs());
        response.setResponseSizeBytes(entity.getResponseSizeBytes());
        response.setResourceDepth(entity.getResourceDepth());
        response.setEstimatedItemCount(entity.getEstimatedItemCount());
        response.setUserExcluded(entity.isUserExcludedFlag());
        response.setUserNotes(entity.getUserNotes());
        response.setRetryStrategy(entity.getRetryStrategy());
        response.setMaxRetries(entity.getMaxRetries());
        response.setResolved(entity.isResolvedFlag());
        response.setResolvedAt(entity.getResolvedAt());
        response.setResolutionMethod(entity.getResolutionMethod());
        response.setResolutionNotes(entity.getResolutionNotes());
        response.setUserMessage(classifier.buildUserFriendlyMessage(entity));
        response.setRecommendedAction(classifier.recommendedAction(entity));
        response.setCanRetry(!entity.isResolvedFlag() && !entity.isUserExcludedFlag()
                && classifier.shouldRetry(entity));
        response.setUserActionRequired(isUserActionRequired(entity));
        if (withDiagnostics && StringUtils.hasText(entity.getDiagnosticData())) {
            try {
                response.setDiagnostics(objectMapper.readTree(entity.getDiagnosticData()));
            } catch (JsonProcessingException e) {
                log.debug("SOURCE_FAILURE_DIAGNOSTICS_UNREADABLE id={} reason={}", entity.getId(),
                        e.getOriginalMessage());
            }
        }
        return response;
    }

    private static boolean isUserActionRequired(SourceScanFailureEntity entity) {
        if (entity.isResolvedFlag()) {
            return false;
        }
        return ErrorSeverity.CRITICAL.getCode().equals(entity.getErrorSeverity())
                || SourceErrorType.PERMISSION_DENIED.getCode().equals(entity.getErrorType());
    }

    private static ErrorSourceType parseSourceType(String code) {
        try {
            return ErrorSourceType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new BusinessException("INVALID_FILTER", e.getMessage(),
                    "Use one of webdav, s3, local, dropbox, gdrive, onedrive");
        }
    }

    private static ErrorSourceType resolveSourceType(String code) {
        try {
            return ErrorSourceType.fromCode(code);
        } catch (IllegalArgumentException e) {
            return ErrorSourceType.WEBDAV;
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
