package com.example.sourcesync.application.classifier;

import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.enumtype.RetryStrategy;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Fallback for source types without a dedicated classifier. Not a bean: one instance is
 * created per uncovered {@link ErrorSourceType} by {@link SourceErrorClassifierRegistry}.
 */
public class GenericErrorClassifier extends AbstractSourceErrorClassifier {

    private final ErrorSourceType sourceType;

    public GenericErrorClassifier(ErrorSourceType sourceType, ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
        this.sourceType = sourceType;
    }

    @Override
    public ErrorSourceType sourceType() {
        return sourceType;
    }

    @Override
    protected SourceErrorType classifyType(Throwable error, String text, Integer httpStatus) {
        SourceErrorType byException = classifyByExceptionType(error);
        if (byException != null) {
            return byException;
        }
        if (containsAny(text, "timeout", "timed out")) {
            return SourceErrorType.TIMEOUT;
        }
        if (containsAny(text, "permission denied", "forbidden", "401", "403")) {
            return SourceErrorType.PERMISSION_DENIED;
        }
        if (containsAny(text, "not found", "404")) {
            return SourceErrorType.NOT_FOUND;
        }
        if (containsAny(text, "connection refused", "network", "dns")) {
            return SourceErrorType.NETWORK_ERROR;
        }
        if (containsAny(text, "500", "502", "503", "504")) {
            return SourceErrorType.SERVER_ERROR;
        }
        if (containsAny(text, "too many", "rate limit", "429")) {
            return SourceErrorType.RATE_LIMITED;
        }
        return SourceErrorType.UNKNOWN;
    }

    @Override
    protected ErrorSeverity classifySeverity(SourceErrorType type, String text, Integer httpStatus,
                                             ErrorContext context) {
        switch (type) {
            case NOT_FOUND:
                return ErrorSeverity.CRITICAL;
            case PERMISSION_DENIED:
                return ErrorSeverity.HIGH;
            case NETWORK_ERROR:
            case RATE_LIMITED:
                return ErrorSeverity.LOW;
            default:
                return ErrorSeverity.MEDIUM;
        }
    }

    @Override
    protected RetryStrategy retryStrategy(SourceErrorType type) {
        return type == SourceErrorType.RATE_LIMITED ? RetryStrategy.LINEAR : RetryStrategy.EXPONENTIAL;
    }

    @Override
    protected int retryDelaySeconds(SourceErrorType type) {
        switch (type) {
            case RATE_LIMITED:
                return 600;
            case NETWORK_ERROR:
                return 60;
            case TIMEOUT:
                return 900;
            default:
                return 300;
        }
    }

    @Override
    protected int maxRetries(ErrorSeverity severity) {
        return 5;
    }

    @Override
    protected String userMessage(SourceErrorType type, String path, String errorMessage, Integer httpStatus) {
        String source = sourceType.getCode();
        switch (type) {
            case TIMEOUT:
                return String.format("The %s resource '%s' is taking too long to access. "
                        + "This might be due to a large size or slow connection.", source, path);
            case PERMISSION_DENIED:
                return String.format("Access denied to %s resource '%s'. Please check your permissions.",
                        source, path);
            case NOT_FOUND:
                return String.format("%s resource '%s' was not found. It may have been deleted or moved.",
                        source, path);
            case NETWORK_ERROR:
                return String.format("Network error accessing %s resource '%s'. Will retry automatically.",
                        source, path);
            default:
                return String.format("Error accessing %s resource '%s': %s", source, path,
                        errorMessage == null || errorMessage.isEmpty() ? "Unknown error" : errorMessage);
        }
    }

    @Override
    public String buildUserFriendlyMessage(SourceScanFailureEntity failure) {
        StringBuilder sb = new StringBuilder(super.buildUserFriendlyMessage(failure));
        int consecutive = failure.consecutiveFailuresOrZero();
        if (consecutive > 1) {
            sb.append(" This has failed ").append(consecutive).append(" times.");
        }
        LocalDateTime nextRetryAt = failure.getNextRetryAt();
        if (nextRetryAt != null && !failure.isUserExcludedFlag() && !failure.isResolvedFlag()) {
            LocalDateTime now = LocalDateTime.ofInstant(Instant.now(clock), ZoneOffset.UTC);
            if (nextRetryAt.isAfter(now)) {
                long minutes = Math.max(1L, Duration.between(now, nextRetryAt).toMinutes());
                sb.append(" Will retry in ").append(minutes).append(" minutes.");
            } else {
                sb.append(" Ready for retry.");
            }
        }
        return sb.toString();
    }

    @Override
    public String recommendedAction(SourceScanFailureEntity failure) {
        if (SourceErrorType.TIMEOUT.getCode().equals(failure.getErrorType()) && failure.failureCountOrZero() > 3) {
            return "Repeated timeouts. Resource may be too large or source is slow.";
        }
        return super.recommendedAction(failure);
    }

    @Override
    protected String recommendedAction(SourceErrorType type, ErrorSeverity severity) {
        switch (type) {
            case NOT_FOUND:
                return "Resource not found. It may have been deleted or moved.";
            case PERMISSION_DENIED:
                return "Access denied. Check permissions for this resource.";
            case NETWORK_ERROR:
                return "Network error. Will retry automatically.";
            case RATE_LIMITED:
                return "Rate limited. Will retry with longer delays.";
            default:
                break;
        }
        if (severity == ErrorSeverity.CRITICAL) {
            return "Critical error that requires manual intervention.";
        }
        return "Temporary error. Will retry automatically.";
    }
}
