package com.example.sourcesync.application.classifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.RetryStrategy;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.example.sourcesync.domain.model.ErrorClassification;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.example.sourcesync.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.sardine.impl.SardineException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebDavErrorClassifierTest {

    private MutableClock clock;
    private WebDavErrorClassifier classifier;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        classifier = new WebDavErrorClassifier(new ObjectMapper(), clock);
    }

    @Test
    void missingDirectoryShouldBeCriticalNotFound() {
        SardineException cause = new SardineException("Unexpected response", 404, "Not Found");
        IllegalStateException error = new IllegalStateException("WebDAV directory not found, status=404", cause);

        ErrorClassification result = classifier.classify(error, ErrorContext.of("/music/old"));

        assertEquals(SourceErrorType.NOT_FOUND, result.getErrorType());
        assertEquals(ErrorSeverity.CRITICAL, result.getSeverity());
        assertEquals(404, result.getHttpStatusCode().intValue());
        assertEquals(1, result.getMaxRetries());
        assertTrue(result.getUserMessage().contains("'/music/old' was not found on the server"));
        assertEquals("Manual intervention required. This error cannot be resolved automatically.",
                result.getRecommendedAction());
    }

    @Test
    void serverErrorStatusShouldBeMediumWithExponentialBackoff() {
        ErrorClassification result = classifier.classify(
                new IllegalStateException("WebDAV listing failed, status=503"), ErrorContext.of("/music"));

        assertEquals(SourceErrorType.SERVER_ERROR, result.getErrorType());
        assertEquals(ErrorSeverity.MEDIUM, result.getSeverity());
        assertEquals(RetryStrategy.EXPONENTIAL, result.getRetryStrategy());
        assertEquals(300, result.getRetryDelaySeconds());
        assertEquals(5, result.getMaxRetries());
        assertTrue(result.getUserMessage().contains("(HTTP 503)"));
    }

    @Test
    void socketTimeoutInCauseChainShouldBeTimeout() {
        IllegalStateException error = new IllegalStateException("WebDAV listing failed",
                new SocketTimeoutException("Read timed out"));

        ErrorClassification result = classifier.classify(error, ErrorContext.of("/big"));

        assertEquals(SourceErrorType.TIMEOUT, result.getErrorType());
        assertEquals(ErrorSeverity.MEDIUM, result.getSeverity());
        assertEquals(900, result.getRetryDelaySeconds());
    }

    @Test
    void connectFailureShouldBeLowSeverityNetworkError() {
        ErrorClassification result = classifier.classify(
                new IllegalStateException("WebDAV listing failed", new ConnectException("Connection refused")),
                ErrorContext.of("/music"));

        assertEquals(SourceErrorType.NETWORK_ERROR, result.getErrorType());
        assertEquals(ErrorSeverity.LOW, result.getSeverity());
        assertEquals(60, result.getRetryDelaySeconds());
        assertEquals(10, result.getMaxRetries());
    }

    @Test
    void malformedResponseShouldRetryLinearly() {
        ErrorClassification result = classifier.classify(
                new RuntimeException("Failed to parse PROPFIND XML response"), ErrorContext.of("/music"));

        assertEquals(SourceErrorType.XML_PARSE_ERROR, result.getErrorType());
        assertEquals(ErrorSeverity.HIGH, result.getSeverity());
        assertEquals(RetryStrategy.LINEAR, result.getRetryStrategy());
        assertEquals(600, result.getRetryDelaySeconds());
        assertEquals(3, result.getMaxRetries());
    }

    @Test
    void rateLimitStatusShouldBeLowSeverity() {
        ErrorClassification result = classifier.classify(
                new IllegalStateException("WebDAV listing failed, status=429"), ErrorContext.of("/music"));

        assertEquals(SourceErrorType.RATE_LIMITED, result.getErrorType());
        assertEquals(ErrorSeverity.LOW, result.getSeverity());
        assertEquals(600, result.getRetryDelaySeconds());
    }

    @Test
    void oversizedDirectoryShouldReportEstimatedItemCount() {
        ErrorClassification result = classifier.classify(
                new RuntimeException("Directory holds 250000 items, limit exceeded"), ErrorContext.of("/dump"));

        assertEquals(SourceErrorType.TOO_MANY_ITEMS, result.getErrorType());
        assertNull(result.getHttpStatusCode());
        assertEquals(250000, result.getDiagnostics().get("estimated_item_count").asInt());
    }

    @Test
    void unrecognizedErrorShouldFallBackToUnknown() {
        ErrorClassification result = classifier.classify(new RuntimeException("something odd"),
                ErrorContext.of("/music"));

        assertEquals(SourceErrorType.UNKNOWN, result.getErrorType());
        assertEquals(ErrorSeverity.MEDIUM, result.getSeverity());
    }

    @Test
    void nullErrorShouldStillClassify() {
        ErrorClassification result = classifier.classify(null, null);

        assertEquals(SourceErrorType.UNKNOWN, result.getErrorType());
        assertEquals(0, result.getDiagnostics().get("error_chain").size());
    }

    @Test
    void diagnosticsShouldCarryContextAndServerInfo() {
        ErrorContext context = ErrorContext.of("/music/rock/80s")
                .withOperation("scan_directory")
                .withResponseTime(Duration.ofMillis(1500))
                .withServerInfo("nextcloud", "27.1")
                .withContext("attempt", "2");

        ObjectNode diagnostics = classifier.extractDiagnostics(
                new IllegalStateException("outer", new RuntimeException("inner")), context);

        assertEquals("webdav", diagnostics.get("source_type").asText());
        assertEquals("scan_directory", diagnostics.get("operation").asText());
        assertEquals(3, diagnostics.get("path_depth").asInt());
        assertEquals(1500L, diagnostics.get("response_time_ms").asLong());
        assertEquals("nextcloud", diagnostics.get("server_type").asText());
        assertEquals("27.1", diagnostics.get("server_version").asText());
        assertEquals("2", diagnostics.get("context").get("attempt").asText());
        assertEquals("2024-05-01T10:00:00Z", diagnostics.get("timestamp").asText());
        assertEquals(2, diagnostics.get("error_chain").size());
        assertEquals("inner", diagnostics.get("error_chain").get(1).asText());
    }

    @Test
    void sameInputUnderFixedClockShouldClassifyIdentically() {
        RuntimeException error = new IllegalStateException("WebDAV listing failed, status=502");
        ErrorContext context = ErrorContext.of("/music").withOperation("scan_directory");

        assertEquals(classifier.classify(error, context), classifier.classify(error, context));
    }

    @Test
    void repeatedTimeoutsShouldRecommendExclusion() {
        SourceScanFailureEntity failure = new SourceScanFailureEntity();
        failure.setErrorType("timeout");
        failure.setErrorSeverity("medium");
        failure.setFailureCount(4);

        assertEquals("Consider excluding this directory from scanning due to repeated timeouts.",
                classifier.recommendedAction(failure));

        failure.setFailureCount(2);
        assertEquals("The system will retry this operation automatically with increasing delays.",
                classifier.recommendedAction(failure));
    }

    @Test
    void retryBudgetShouldDependOnSeverity() {
        assertFalse(classifier.shouldRetry(failure("critical", 0)));
        assertTrue(classifier.shouldRetry(failure("high", 1)));
        assertFalse(classifier.shouldRetry(failure("high", 2)));
        assertTrue(classifier.shouldRetry(failure("medium", 4)));
        assertFalse(classifier.shouldRetry(failure("medium", 5)));
        assertTrue(classifier.shouldRetry(failure("low", 9)));
        assertFalse(classifier.shouldRetry(failure("low", 10)));
        assertTrue(classifier.shouldRetry(failure("bogus", 50)));
    }

    @Test
    void errorCodeShouldPreferOsErrorNumbers() {
        assertEquals("OS_13", AbstractSourceErrorClassifier.extractErrorCode(null, "Permission denied (os error 13)"));
        assertEquals("ENOENT", AbstractSourceErrorClassifier.extractErrorCode(null, "Error: ENOENT while listing"));
        assertNull(AbstractSourceErrorClassifier.extractErrorCode(null, "an error occurred"));
    }

    private static SourceScanFailureEntity failure(String severity, int failureCount) {
        SourceScanFailureEntity failure = new SourceScanFailureEntity();
        failure.setErrorType("unknown");
        failure.setErrorSeverity(severity);
        failure.setFailureCount(failureCount);
        return failure;
    }
}
