package com.example.sourcesync.application.classifier;

import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.model.ErrorClassification;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Maps raw failures of one source type into the shared taxonomy.
 *
 * <p>Implementations must never throw from {@link #classify} or {@link #extractDiagnostics}:
 * unrecognized input resolves to {@code UNKNOWN}.
 */
public interface SourceErrorClassifier {

    ErrorSourceType sourceType();

    ErrorClassification classify(Throwable error, ErrorContext context);

    ObjectNode extractDiagnostics(Throwable error, ErrorContext context);

    /**
     * Message for display, rebuilt from the stored row without the original exception.
     */
    String buildUserFriendlyMessage(SourceScanFailureEntity failure);

    String recommendedAction(SourceScanFailureEntity failure);

    /**
     * Retry eligibility by severity and lifetime failure count.
     */
    default boolean shouldRetry(SourceScanFailureEntity failure) {
        ErrorSeverity severity;
        try {
            severity = ErrorSeverity.fromCode(failure.getErrorSeverity());
        } catch (IllegalArgumentException e) {
            return true;
        }
        int failureCount = failure.failureCountOrZero();
        switch (severity) {
            case CRITICAL:
                return false;
            case HIGH:
                return failureCount < 2;
            case MEDIUM:
                return failureCount < 5;
            case LOW:
            default:
                return failureCount < 10;
        }
    }
}
