package com.example.sourcesync.application.classifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.RetryStrategy;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.example.sourcesync.domain.model.ErrorClassification;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.ConnectException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class S3ErrorClassifierTest {

    private S3ErrorClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new S3ErrorClassifier(new ObjectMapper(), MutableClock.startingAt("2024-05-01T10:00:00Z"));
    }

    @Test
    void missingBucketShouldBeCritical() {
        ErrorClassification result = classifier.classify(
                new RuntimeException("NoSuchBucket: The specified bucket does not exist"),
                ErrorContext.of("/photos"));

        assertEquals(SourceErrorType.NOT_FOUND, result.getErrorType());
        assertEquals(ErrorSeverity.CRITICAL, result.getSeverity());
        assertEquals("NoSuchBucket", result.getErrorCode());
        assertEquals("S3 bucket for path '/photos' does not exist or is not accessible.", result.getUserMessage());
        assertEquals("Verify the S3 bucket name and region configuration.", result.getRecommendedAction());
    }

    @Test
    void missingKeyShouldOnlyBeMedium() {
        ErrorClassification result = classifier.classify(
                new RuntimeException("NoSuchKey: The specified key does not exist"),
                ErrorContext.of("/photos/2023/a.jpg"));

        assertEquals(SourceErrorType.NOT_FOUND, result.getErrorType());
        assertEquals(ErrorSeverity.MEDIUM, result.getSeverity());
        assertTrue(result.getUserMessage().startsWith("S3 object '/photos/2023/a.jpg' was not found"));
    }

    @Test
    void slowDownShouldBeRateLimitedWithLongDelay() {
        ErrorClassification result = classifier.classify(
                new RuntimeException("SlowDown: Please reduce your request rate."), ErrorContext.of("/photos"));

        assertEquals(SourceErrorType.RATE_LIMITED, result.getErrorType());
        assertEquals(ErrorSeverity.LOW, result.getSeverity());
        assertEquals(RetryStrategy.EXPONENTIAL, result.getRetryStrategy());
        assertEquals(1200, result.getRetryDelaySeconds());
        assertEquals(10, result.getMaxRetries());
        assertEquals("SlowDown", result.getErrorCode());
    }

    @Test
    void accessDeniedShouldGetTwoRetries() {
        ErrorClassification result = classifier.classify(
                new RuntimeException("AccessDenied: Access Denied"), ErrorContext.of("/private"));

        assertEquals(SourceErrorType.PERMISSION_DENIED, result.getErrorType());
        assertEquals(ErrorSeverity.HIGH, result.getSeverity());
        assertEquals(2, result.getMaxRetries());
    }

    @Test
    void signatureMismatchShouldBePermissionDenied() {
        ErrorClassification result = classifier.classify(
                new RuntimeException("SignatureDoesNotMatch: The request signature we calculated does not match"),
                ErrorContext.of("/photos"));

        assertEquals(SourceErrorType.PERMISSION_DENIED, result.getErrorType());
    }

    @Test
    void connectionFailureShouldRetryLinearlyAfterShortDelay() {
        ErrorClassification result = classifier.classify(
                new IllegalStateException("S3 listing failed", new ConnectException("Connection refused")),
                ErrorContext.of("/photos"));

        assertEquals(SourceErrorType.NETWORK_ERROR, result.getErrorType());
        assertEquals(RetryStrategy.LINEAR, result.getRetryStrategy());
        assertEquals(30, result.getRetryDelaySeconds());
    }

    @Test
    void statusWithoutAwsCodeShouldBecomeHttpErrorCode() {
        ErrorClassification result = classifier.classify(
                new RuntimeException("Request failed with status: 503"), ErrorContext.of("/photos"));

        assertEquals("HTTP_503", result.getErrorCode());
    }

    @Test
    void diagnosticsShouldExtractBucketAndRegion() {
        ObjectNode diagnostics = classifier.extractDiagnostics(
                new RuntimeException("Listing failed for bucket my-media in region eu-west-1"),
                ErrorContext.of("/photos/2023/summer"));

        assertTrue(diagnostics.get("s3_specific").asBoolean());
        assertEquals("my-media", diagnostics.get("bucket_name").asText());
        assertEquals("eu-west-1", diagnostics.get("aws_region").asText());
        assertEquals(19, diagnostics.get("key_length").asInt());
        assertEquals(3, diagnostics.get("key_depth").asInt());
        assertEquals("s3", diagnostics.get("source_type").asText());
    }
}
