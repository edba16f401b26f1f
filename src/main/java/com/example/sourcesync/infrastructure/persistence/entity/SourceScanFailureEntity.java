package com.example.sourcesync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SourceScanFailureEntity {

    private Long id;

    private Long userId;

    private String sourceType;

    private Long sourceId;

    private String resourcePath;

    /** Lookup key; paths can exceed any indexable column width. */
    private String resourcePathMd5;

    private String errorType;

    private String errorSeverity;

    private Integer failureCount;

    private Integer consecutiveFailures;

    private LocalDateTime firstFailureAt;

    private LocalDateTime lastFailureAt;

    private LocalDateTime lastRetryAt;

    private LocalDateTime nextRetryAt;

    private String errorMessage;

    private String errorCode;

    private Integer httpStatusCode;

    private Long responseTimeMs;

    private Long responseSizeBytes;

    private Integer resourceDepth;

    private Integer estimatedItemCount;

    /** JSON text. */
    private String diagnosticData;

    private Boolean userExcluded;

    private String userNotes;

    private String retryStrategy;

    private Integer maxRetries;

    private Integer retryDelaySeconds;

    private Boolean resolved;

    private LocalDateTime resolvedAt;

    private String resolutionMethod;

    private String resolutionNotes;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isResolvedFlag() {
        return Boolean.TRUE.equals(resolved);
    }

    public boolean isUserExcludedFlag() {
        return Boolean.TRUE.equals(userExcluded);
    }

    public int failureCountOrZero() {
        return failureCount == null ? 0 : failureCount;
    }

    public int consecutiveFailuresOrZero() {
        return consecutiveFailures == null ? 0 : consecutiveFailures;
    }
}
