package com.example.sourcesync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.sourcesync.application.classifier.SourceErrorClassifier;
import com.example.sourcesync.application.classifier.SourceErrorClassifierRegistry;
import com.example.sourcesync.application.classifier.WebDavErrorClassifier;
import com.example.sourcesync.common.config.AppSyncProperties;
import com.example.sourcesync.common.util.HashUtil;
import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.example.sourcesync.domain.model.ErrorClassification;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.example.sourcesync.infrastructure.persistence.mapper.SourceScanFailureMapper;
import com.example.sourcesync.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;

class SourceFailureTrackerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 10, 0);
    private static final String MUSIC_KEY = HashUtil.md5Hex("/music");

    private SourceScanFailureMapper mapper;
    private AppSyncProperties properties;
    private SourceFailureTracker tracker;

    @BeforeEach
    void setUp() {
        mapper = mock(SourceScanFailureMapper.class);
        MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        ObjectMapper objectMapper = new ObjectMapper();
        SourceErrorClassifierRegistry registry = new SourceErrorClassifierRegistry(
                Collections.<SourceErrorClassifier>singletonList(new WebDavErrorClassifier(objectMapper)),
                objectMapper, clock);
        properties = new AppSyncProperties();
        tracker = new SourceFailureTracker(mapper, registry, objectMapper, properties, clock);
    }

    @Test
    void firstFailureShouldInsertClassifiedRow() {
        ErrorClassification classification = tracker.trackScanError(1L, ErrorSourceType.WEBDAV, 5L, "/music/rock",
                new IllegalStateException("WebDAV listing failed, status=503"),
                ErrorContext.of("/music/rock").withOperation("scan_directory"));

        ArgumentCaptor<SourceScanFailureEntity> captor = ArgumentCaptor.forClass(SourceScanFailureEntity.class);
        verify(mapper).insert(captor.capture());
        SourceScanFailureEntity row = captor.getValue();
        assertEquals(SourceErrorType.SERVER_ERROR, classification.getErrorType());
        assertEquals(1L, row.getUserId().longValue());
        assertEquals(5L, row.getSourceId().longValue());
        assertEquals("webdav", row.getSourceType());
        assertEquals("server_error", row.getErrorType());
        assertEquals("medium", row.getErrorSeverity());
        assertEquals(1, row.getFailureCount().intValue());
        assertEquals(1, row.getConsecutiveFailures().intValue());
        assertEquals(NOW, row.getFirstFailureAt());
        assertEquals(NOW, row.getLastFailureAt());
        assertEquals(NOW.plusSeconds(300), row.getNextRetryAt());
        assertEquals(503, row.getHttpStatusCode().intValue());
        assertEquals(2, row.getResourceDepth().intValue());
        assertEquals("exponential", row.getRetryStrategy());
        assertNotNull(row.getDiagnosticData());
        assertTrue(row.getDiagnosticData().contains("\"operation\":\"scan_directory\""));
    }

    @Test
    void pathsBeyondIndexWidthShouldBeKeyedByHash() {
        StringBuilder sb = new StringBuilder("https://dav.example.com/music");
        while (sb.length() < 1500) {
            sb.append("/very-long-directory-name");
        }
        String path = sb.toString();

        tracker.trackScanError(1L, ErrorSourceType.WEBDAV, 5L, path,
                new IllegalStateException("WebDAV listing failed, status=414"), null);

        ArgumentCaptor<SourceScanFailureEntity> captor = ArgumentCaptor.forClass(SourceScanFailureEntity.class);
        verify(mapper).selectByKey(1L, "webdav", HashUtil.md5Hex(path));
        verify(mapper).insert(captor.capture());
        assertEquals(path, captor.getValue().getResourcePath());
        assertEquals(HashUtil.md5Hex(path), captor.getValue().getResourcePathMd5());
        assertEquals(32, captor.getValue().getResourcePathMd5().length());
    }

    @Test
    void sourceQualifiedPathDepthShouldIgnoreUrlAuthority() {
        tracker.trackScanError(1L, ErrorSourceType.WEBDAV, 5L, "https://dav.example.com/music/rock",
                new IllegalStateException("WebDAV listing failed, status=503"), null);

        ArgumentCaptor<SourceScanFailureEntity> captor = ArgumentCaptor.forClass(SourceScanFailureEntity.class);
        verify(mapper).insert(captor.capture());
        assertEquals(2, captor.getValue().getResourceDepth().intValue());
        assertEquals("/music/rock", SourceFailureTracker.stripUrlAuthority("https://dav.example.com/music/rock"));
        assertEquals("", SourceFailureTracker.stripUrlAuthority("https://dav.example.com"));
    }

    @Test
    void repeatedFailureShouldIncrementCountersAndBackOff() {
        when(mapper.selectByKey(1L, "webdav", MUSIC_KEY)).thenReturn(existing(2, 2));
        when(mapper.updateOccurrence(any(SourceScanFailureEntity.class), eq(2))).thenReturn(1);

        tracker.trackScanError(1L, ErrorSourceType.WEBDAV, "/music",
                new IllegalStateException("WebDAV listing failed, status=503"), null, null, "nextcloud");

        ArgumentCaptor<SourceScanFailureEntity> captor = ArgumentCaptor.forClass(SourceScanFailureEntity.class);
        verify(mapper).updateOccurrence(captor.capture(), eq(2));
        SourceScanFailureEntity row = captor.getValue();
        assertEquals(3, row.getFailureCount().intValue());
        assertEquals(3, row.getConsecutiveFailures().intValue());
        assertEquals(NOW.plusSeconds(1200), row.getNextRetryAt());
        assertEquals(7L, row.getSourceId().longValue());
        verify(mapper, never()).insert(any(SourceScanFailureEntity.class));
    }

    @Test
    void lostUpdateRaceShouldRereadAndRetry() {
        when(mapper.selectByKey(1L, "webdav", MUSIC_KEY)).thenAnswer(invocation -> existing(2, 2));
        when(mapper.updateOccurrence(any(SourceScanFailureEntity.class), anyInt())).thenReturn(0, 1);

        tracker.trackScanError(1L, ErrorSourceType.WEBDAV, "/music",
                new RuntimeException("boom"), null, null, null);

        verify(mapper, times(2)).selectByKey(1L, "webdav", MUSIC_KEY);
        verify(mapper, times(2)).updateOccurrence(any(SourceScanFailureEntity.class), eq(2));
    }

    @Test
    void concurrentInsertShouldFallBackToUpdate() {
        when(mapper.selectByKey(1L, "webdav", MUSIC_KEY)).thenReturn(null, existing(1, 1));
        when(mapper.insert(any(SourceScanFailureEntity.class))).thenThrow(new DuplicateKeyException("dup"));
        when(mapper.updateOccurrence(any(SourceScanFailureEntity.class), eq(1))).thenReturn(1);

        tracker.trackScanError(1L, ErrorSourceType.WEBDAV, "/music",
                new RuntimeException("boom"), null, null, null);

        verify(mapper).insert(any(SourceScanFailureEntity.class));
        verify(mapper).updateOccurrence(any(SourceScanFailureEntity.class), eq(1));
    }

    @Test
    void persistentContentionShouldGiveUpAfterConfiguredAttempts() {
        properties.setTrackMaxAttempts(4);
        when(mapper.selectByKey(1L, "webdav", MUSIC_KEY)).thenAnswer(invocation -> existing(2, 2));
        when(mapper.updateOccurrence(any(SourceScanFailureEntity.class), anyInt())).thenReturn(0);

        ErrorClassification classification = tracker.trackScanError(1L, ErrorSourceType.WEBDAV, "/music",
                new RuntimeException("boom"), null, null, null);

        assertNotNull(classification);
        verify(mapper, times(4)).updateOccurrence(any(SourceScanFailureEntity.class), anyInt());
    }

    @Test
    void brokenStoreShouldNotBreakTracking() {
        when(mapper.selectByKey(anyLong(), anyString(), anyString()))
                .thenThrow(new QueryTimeoutException("db down"));

        ErrorClassification classification = tracker.trackScanError(1L, ErrorSourceType.WEBDAV, "/music",
                new IllegalStateException("WebDAV listing failed, status=403"), null, null, null);

        assertEquals(SourceErrorType.PERMISSION_DENIED, classification.getErrorType());
        assertEquals(ErrorSeverity.HIGH, classification.getSeverity());
    }

    @Test
    void unknownResourceShouldNotBeSkipped() {
        assertFalse(tracker.shouldSkipDirectory(1L, ErrorSourceType.WEBDAV, "/music"));
    }

    @Test
    void excludedResourceShouldAlwaysBeSkipped() {
        SourceScanFailureEntity row = existing(1, 1);
        row.setUserExcluded(true);
        row.setNextRetryAt(NOW.minusHours(1));
        when(mapper.selectByKey(1L, "webdav", MUSIC_KEY)).thenReturn(row);

        assertTrue(tracker.shouldSkipDirectory(1L, ErrorSourceType.WEBDAV, "/music"));
    }

    @Test
    void resolvedResourceShouldNotBeSkipped() {
        SourceScanFailureEntity row = existing(1, 0);
        row.setResolved(true);
        row.setErrorSeverity("critical");
        when(mapper.selectByKey(1L, "webdav", MUSIC_KEY)).thenReturn(row);

        assertFalse(tracker.shouldSkipDirectory(1L, ErrorSourceType.WEBDAV, "/music"));
    }

    @Test
    void coolingDownResourceShouldBeSkippedUntilDue() {
        SourceScanFailureEntity row = existing(1, 1);
        row.setNextRetryAt(NOW.plusMinutes(5));
        when(mapper.selectByKey(1L, "webdav", MUSIC_KEY)).thenReturn(row);

        assertTrue(tracker.shouldSkipDirectory(1L, ErrorSourceType.WEBDAV, "/music"));

        row.setNextRetryAt(NOW.minusMinutes(5));
        assertFalse(tracker.shouldSkipDirectory(1L, ErrorSourceType.WEBDAV, "/music"));
    }

    @Test
    void exhaustedRetryBudgetShouldBeSkippedUnlessUserRetried() {
        SourceScanFailureEntity row = existing(1, 1);
        row.setErrorSeverity("critical");
        row.setNextRetryAt(NOW.minusMinutes(5));
        row.setLastFailureAt(NOW.minusMinutes(10));
        when(mapper.selectByKey(1L, "webdav", MUSIC_KEY)).thenReturn(row);

        assertTrue(tracker.shouldSkipDirectory(1L, ErrorSourceType.WEBDAV, "/music"));

        row.setLastRetryAt(NOW.minusMinutes(1));
        assertFalse(tracker.shouldSkipDirectory(1L, ErrorSourceType.WEBDAV, "/music"));
    }

    @Test
    void lookupFailureShouldLetScanProceed() {
        when(mapper.selectByKey(1L, "webdav", MUSIC_KEY)).thenThrow(new QueryTimeoutException("db down"));

        assertFalse(tracker.shouldSkipDirectory(1L, ErrorSourceType.WEBDAV, "/music"));
    }

    @Test
    void successfulScanShouldResolveOpenFailure() {
        when(mapper.resolveByKey(1L, "webdav", MUSIC_KEY, "successful_scan", null, NOW)).thenReturn(1);

        tracker.markScanSuccessful(1L, ErrorSourceType.WEBDAV, "/music");

        verify(mapper).resolveByKey(1L, "webdav", MUSIC_KEY, "successful_scan", null, NOW);
    }

    @Test
    void resolveFailureShouldBeSwallowed() {
        when(mapper.resolveByKey(eq(1L), anyString(), anyString(), anyString(), isNull(), any(LocalDateTime.class)))
                .thenThrow(new QueryTimeoutException("db down"));

        tracker.markScanSuccessful(1L, ErrorSourceType.WEBDAV, "/music");
    }

    @Test
    void retryCandidatesShouldUseDefaultLimit() {
        SourceScanFailureEntity row = existing(1, 1);
        when(mapper.selectRetryCandidates(1L, null, NOW, 10)).thenReturn(Collections.singletonList(row));

        List<String> paths = tracker.getRetryCandidatePaths(1L, null, 0);

        assertEquals(Collections.singletonList("/music"), paths);
    }

    @Test
    void retryCandidateQueryFailureShouldYieldEmptyList() {
        when(mapper.selectRetryCandidates(eq(1L), eq("webdav"), any(LocalDateTime.class), eq(3)))
                .thenThrow(new QueryTimeoutException("db down"));

        assertTrue(tracker.getRetryCandidates(1L, ErrorSourceType.WEBDAV, 3).isEmpty());
    }

    private static SourceScanFailureEntity existing(int failureCount, int consecutive) {
        SourceScanFailureEntity row = new SourceScanFailureEntity();
        row.setId(11L);
        row.setUserId(1L);
        row.setSourceId(7L);
        row.setSourceType("webdav");
        row.setResourcePath("/music");
        row.setErrorType("server_error");
        row.setErrorSeverity("medium");
        row.setFailureCount(failureCount);
        row.setConsecutiveFailures(consecutive);
        row.setFirstFailureAt(NOW.minusDays(1));
        row.setLastFailureAt(NOW.minusHours(2));
        row.setUserExcluded(false);
        row.setResolved(false);
        return row;
    }
}
