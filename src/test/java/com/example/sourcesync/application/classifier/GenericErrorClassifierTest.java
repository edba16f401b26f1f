package com.example.sourcesync.application.classifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.enumtype.RetryStrategy;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.example.sourcesync.domain.model.ErrorClassification;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.example.sourcesync.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GenericErrorClassifierTest {

    private GenericErrorClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new GenericErrorClassifier(ErrorSourceType.DROPBOX, new ObjectMapper(),
                MutableClock.startingAt("2024-05-01T10:00:00Z"));
    }

    @Test
    void tooManyRequestsShouldBeRateLimited() {
        ErrorClassification result = classifier.classify(new RuntimeException("HTTP 429 Too Many Requests"),
                ErrorContext.of("/Apps/music"));

        assertEquals(SourceErrorType.RATE_LIMITED, result.getErrorType());
        assertEquals(ErrorSeverity.LOW, result.getSeverity());
        assertEquals(RetryStrategy.LINEAR, result.getRetryStrategy());
        assertEquals(600, result.getRetryDelaySeconds());
        assertEquals(5, result.getMaxRetries());
    }

    @Test
    void notFoundShouldBeCriticalAndNameTheSource() {
        ErrorClassification result = classifier.classify(new RuntimeException("path/not_found: 404"),
                ErrorContext.of("/Apps/gone"));

        assertEquals(SourceErrorType.NOT_FOUND, result.getErrorType());
        assertEquals(ErrorSeverity.CRITICAL, result.getSeverity());
        assertEquals("dropbox resource '/Apps/gone' was not found. It may have been deleted or moved.",
                result.getUserMessage());
    }

    @Test
    void storedMessageShouldMentionRepeatsAndNextRetry() {
        SourceScanFailureEntity failure = failure("timeout", 3);
        failure.setNextRetryAt(LocalDateTime.of(2024, 5, 1, 10, 30));

        String message = classifier.buildUserFriendlyMessage(failure);

        assertTrue(message.startsWith("The dropbox resource '/Apps/music' is taking too long to access."));
        assertTrue(message.endsWith(" This has failed 3 times. Will retry in 30 minutes."));
    }

    @Test
    void dueFailureShouldBeReportedReady() {
        SourceScanFailureEntity failure = failure("network_error", 1);
        failure.setNextRetryAt(LocalDateTime.of(2024, 5, 1, 9, 0));

        assertTrue(classifier.buildUserFriendlyMessage(failure).endsWith(" Ready for retry."));
    }

    @Test
    void excludedFailureShouldNotPromiseRetry() {
        SourceScanFailureEntity failure = failure("network_error", 1);
        failure.setNextRetryAt(LocalDateTime.of(2024, 5, 1, 11, 0));
        failure.setUserExcluded(true);

        assertEquals("Network error accessing dropbox resource '/Apps/music'. Will retry automatically.",
                classifier.buildUserFriendlyMessage(failure));
    }

    @Test
    void repeatedTimeoutsShouldChangeRecommendation() {
        SourceScanFailureEntity failure = failure("timeout", 4);
        failure.setFailureCount(4);

        assertEquals("Repeated timeouts. Resource may be too large or source is slow.",
                classifier.recommendedAction(failure));
    }

    private static SourceScanFailureEntity failure(String type, int consecutive) {
        SourceScanFailureEntity failure = new SourceScanFailureEntity();
        failure.setSourceType("dropbox");
        failure.setResourcePath("/Apps/music");
        failure.setErrorType(type);
        failure.setErrorSeverity("medium");
        failure.setConsecutiveFailures(consecutive);
        failure.setFailureCount(consecutive);
        return failure;
    }
}
