package com.example.sourcesync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.sourcesync.application.loop.LoopDetectorRegistry;
import com.example.sourcesync.common.config.AppLoopDetectionProperties;
import com.example.sourcesync.common.config.AppSyncProperties;
import com.example.sourcesync.common.util.HashUtil;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.enumtype.SyncStrategy;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.domain.model.SyncDecision;
import com.example.sourcesync.domain.model.SyncResult;
import com.example.sourcesync.domain.model.SyncTarget;
import com.example.sourcesync.domain.model.WebDavDirectoryEntry;
import com.example.sourcesync.domain.model.WebDavDirectoryInfo;
import com.example.sourcesync.domain.model.WebDavFileObject;
import com.example.sourcesync.infrastructure.persistence.entity.DirectorySignatureEntity;
import com.example.sourcesync.infrastructure.persistence.mapper.DirectorySignatureMapper;
import com.example.sourcesync.infrastructure.webdav.WebDavClient;
import com.example.sourcesync.support.MutableClock;
import com.github.sardine.Sardine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SmartSyncServiceTest {

    private static final String ROOT_URL = "https://dav.example.com/music/";
    private static final String VIDEO_URL = "https://dav.example.com/video/";
    private static final String MUSIC = "https://dav.example.com/music";
    private static final Long USER_ID = 1L;
    private static final Long CONFIG_ID = 10L;

    private WebDavClient webDavClient;
    private DirectorySignatureMapper signatureMapper;
    private SourceFailureTracker failureTracker;
    private SyncSourceService syncSourceService;
    private LoopDetectorRegistry loopDetectorRegistry;
    private AppSyncProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private Sardine session;
    private SmartSyncService service;
    private SyncTarget target;

    // directory url -> listing, or exception to throw
    private final Map<String, Object> listings = new HashMap<>();

    @BeforeEach
    void setUp() {
        webDavClient = mock(WebDavClient.class);
        signatureMapper = mock(DirectorySignatureMapper.class);
        failureTracker = mock(SourceFailureTracker.class);
        syncSourceService = mock(SyncSourceService.class);
        session = mock(Sardine.class);
        loopDetectorRegistry = new LoopDetectorRegistry(new AppLoopDetectionProperties(), null,
                MutableClock.startingAt("2024-05-01T10:00:00Z"));
        properties = new AppSyncProperties();
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(2);
        service = new SmartSyncService(webDavClient, signatureMapper, failureTracker, loopDetectorRegistry,
                syncSourceService, properties, executor, meterRegistry);
        target = new SyncTarget(USER_ID, CONFIG_ID, "https://dav.example.com", "ann", "secret", "/music");

        when(webDavClient.createSession("ann", "secret")).thenReturn(session);
        when(webDavClient.buildRootUrl("https://dav.example.com", "/music")).thenReturn(ROOT_URL);
        when(webDavClient.buildRootUrl("https://dav.example.com", "/video")).thenReturn(VIDEO_URL);
        when(webDavClient.resolveDirectoryUrl(anyString(), anyString())).thenAnswer(invocation -> {
            String root = invocation.getArgument(0);
            String relative = invocation.getArgument(1);
            return relative.isEmpty() ? root : root + relative + "/";
        });
        when(webDavClient.listDirectory(eq(session), anyString(), anyString())).thenAnswer(invocation -> {
            String url = invocation.getArgument(1);
            Object listing = listings.get(url);
            if (listing instanceof RuntimeException) {
                throw (RuntimeException) listing;
            }
            if (listing == null) {
                throw new IllegalStateException("WebDAV directory not found, status=404");
            }
            return listing;
        });
        when(signatureMapper.selectByDirectoryPrefix(eq(CONFIG_ID), anyString()))
                .thenReturn(Collections.<DirectorySignatureEntity>emptyList());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void folderWithoutHistoryShouldNeedFullDeepScan() {
        SyncDecision decision = service.evaluateSyncNeed(target, "");

        assertEquals(SyncStrategy.FULL_DEEP_SCAN, decision.getStrategy());
        verify(webDavClient, never()).listDirectory(any(Sardine.class), anyString(), anyString());
    }

    @Test
    void matchingEtagsShouldSkip() {
        storeSignatures(sig("", "root"), sig("a", "\"e1\""), sig("b", "\"e2\""), sig("a/x", "\"deep\""));
        listing("", dir("a", "W/\"e1\""), dir("b", "\"e2\""));

        SyncDecision decision = service.evaluateSyncNeed(target, "/");

        assertTrue(decision.isSkip());
        verify(webDavClient).closeSession(session);
    }

    @Test
    void fewChangesShouldTargetChangedDirectories() {
        storeSignatures(sig("a", "e1"), sig("b", "e2"), sig("c", "e3"), sig("d", "e4"));
        listing("", dir("a", "e1-new"), dir("b", "e2"), dir("c", "e3"), dir("d", "e4"));

        SyncDecision decision = service.evaluateSyncNeed(target, "");

        assertEquals(SyncStrategy.TARGETED_SCAN, decision.getStrategy());
        assertEquals(Collections.singletonList("a"), decision.getTargetDirectories());
    }

    @Test
    void highChangeRatioShouldEscalateToFullScan() {
        storeSignatures(sig("a", "e1"), sig("b", "e2"), sig("c", "e3"));
        listing("", dir("a", "e1-new"), dir("b", "e2"), dir("c", "e3"));

        assertEquals(SyncStrategy.FULL_DEEP_SCAN, service.evaluateSyncNeed(target, "").getStrategy());
    }

    @Test
    void deletedDirectoryShouldEscalateToFullScan() {
        storeSignatures(sig("a", "e1"), sig("b", "e2"), sig("c", "e3"), sig("d", "e4"), sig("e", "e5"));
        listing("", dir("a", "e1"), dir("b", "e2"), dir("c", "e3"), dir("d", "e4"));

        assertEquals(SyncStrategy.FULL_DEEP_SCAN, service.evaluateSyncNeed(target, "").getStrategy());
    }

    @Test
    void manyNewDirectoriesShouldEscalateToFullScan() {
        properties.setFullScanChangeRatio(10.0D);
        properties.setFullScanNewDirThreshold(2);
        storeSignatures(sig("a", "e1"));
        listing("", dir("a", "e1"), dir("n1", "x"), dir("n2", "x"), dir("n3", "x"));

        assertEquals(SyncStrategy.FULL_DEEP_SCAN, service.evaluateSyncNeed(target, "").getStrategy());
    }

    @Test
    void listingFailureShouldBeTrackedAndAnsweredWithFullScan() {
        storeSignatures(sig("a", "e1"));
        listings.put(ROOT_URL, new IllegalStateException("WebDAV listing failed, status=503"));

        SyncDecision decision = service.evaluateSyncNeed(target, "");

        assertEquals(SyncStrategy.FULL_DEEP_SCAN, decision.getStrategy());
        ArgumentCaptor<ErrorContext> context = ArgumentCaptor.forClass(ErrorContext.class);
        verify(failureTracker).trackScanError(eq(USER_ID), eq(ErrorSourceType.WEBDAV), eq(CONFIG_ID), eq(MUSIC),
                any(IllegalStateException.class), context.capture());
        assertEquals("evaluate_sync_need", context.getValue().getOperation());
    }

    @Test
    void unchangedSourceShouldReturnEmptyResultAndCountDecision() {
        storeSignatures(sig("a", "e1"));
        listing("", dir("a", "e1"));

        Optional<SyncResult> result = service.evaluateAndSync(target, "");

        assertFalse(result.isPresent());
        assertEquals(1.0D, meterRegistry.counter("sync.smart.decision", "decision", "SKIP").count(), 0.001D);
    }

    @Test
    void fullScanShouldWalkTreeAndIsolateFailures() {
        listing("", file("song.mp3"), dir("a", "ea"), dir("b", "eb"));
        listing("a", file("a/one.flac"), dir("a/x", "ex"));
        listings.put(ROOT_URL + "b/", new IllegalStateException("WebDAV listing failed, status=500"));
        when(failureTracker.shouldSkipDirectory(USER_ID, ErrorSourceType.WEBDAV, MUSIC + "/a/x")).thenReturn(true);

        SyncResult result = service.performFullDeepScan(target, "");

        assertEquals(SyncStrategy.FULL_DEEP_SCAN, result.getStrategyUsed());
        assertEquals(2, result.getDirectoriesScanned());
        assertEquals(1, result.getDirectoriesFailed());
        assertEquals(1, result.getDirectoriesSkipped());
        assertEquals(0, result.getLoopRejections());
        assertEquals(2, result.getFiles().size());
        verify(failureTracker).markScanSuccessful(USER_ID, ErrorSourceType.WEBDAV, MUSIC);
        verify(failureTracker).markScanSuccessful(USER_ID, ErrorSourceType.WEBDAV, MUSIC + "/a");
        verify(failureTracker).trackScanError(eq(USER_ID), eq(ErrorSourceType.WEBDAV), eq(CONFIG_ID), eq(MUSIC + "/b"),
                any(IllegalStateException.class), any(ErrorContext.class));
        verify(signatureMapper, times(2)).upsert(any(DirectorySignatureEntity.class));
        verify(webDavClient).closeSession(session);
        assertEquals(0, loopDetectorRegistry.forUser(USER_ID).getMetrics().getActiveAccesses());
    }

    @Test
    void directoryAlreadyBeingScannedShouldBeRejectedByLoopDetector() {
        listing("", dir("a", "ea"));
        listing("a");
        loopDetectorRegistry.forUser(USER_ID).startAccess(MUSIC + "/a", "other-run");

        SyncResult result = service.performFullDeepScan(target, "");

        assertEquals(1, result.getDirectoriesScanned());
        assertEquals(1, result.getLoopRejections());
        assertEquals(1, result.getDirectoriesSkipped());
        verify(webDavClient, never()).listDirectory(session, ROOT_URL + "a/", ROOT_URL);
    }

    @Test
    void sourcesOfOneUserShouldNotShareDirectoryKeys() {
        SyncTarget video = new SyncTarget(USER_ID, 11L, "https://dav.example.com", "ann", "secret", "/video");
        listing("", dir("shared", "e1"));
        listing("shared");
        listings.put(VIDEO_URL, info("", dir("shared", "e2")));
        listings.put(VIDEO_URL + "shared/", info("shared"));
        when(failureTracker.shouldSkipDirectory(USER_ID, ErrorSourceType.WEBDAV, MUSIC + "/shared")).thenReturn(true);

        SyncResult first = service.performFullDeepScan(target, "");
        SyncResult second = service.performFullDeepScan(video, "");

        assertEquals(1, first.getDirectoriesScanned());
        assertEquals(1, first.getDirectoriesSkipped());
        assertEquals(2, second.getDirectoriesScanned());
        assertEquals(0, second.getLoopRejections());
        assertEquals(0, second.getDirectoriesSkipped());
        verify(failureTracker).markScanSuccessful(USER_ID, ErrorSourceType.WEBDAV, "https://dav.example.com/video");
        verify(failureTracker).markScanSuccessful(USER_ID, ErrorSourceType.WEBDAV,
                "https://dav.example.com/video/shared");
        verify(failureTracker, never()).markScanSuccessful(USER_ID, ErrorSourceType.WEBDAV, MUSIC + "/shared");
    }

    @Test
    void targetedScanShouldOnlyVisitGivenSubtrees() {
        listing("a", dir("a/x", "ex"));
        listing("a/x", file("a/x/track.mp3"));

        SyncResult result = service.performTargetedScan(target, Arrays.asList("/a/"));

        assertEquals(SyncStrategy.TARGETED_SCAN, result.getStrategyUsed());
        assertEquals(2, result.getDirectoriesScanned());
        assertEquals(1, result.getFiles().size());
        verify(webDavClient, never()).listDirectory(session, ROOT_URL, ROOT_URL);
    }

    @Test
    void vanishedDirectoriesShouldLoseTheirSignatures() {
        listing("", dir("a", "ea"));
        listing("a");
        storeSignatures(sig("", "root"), sig("a", "ea"), sig("gone", "g"), sig("gone/deep", "gd"));

        service.performFullDeepScan(target, "");

        verify(signatureMapper).deleteByConfigAndDirPathMd5(CONFIG_ID, HashUtil.md5Hex("gone"));
        verify(signatureMapper).deleteByConfigAndDirPathMd5(CONFIG_ID, HashUtil.md5Hex("gone/deep"));
        verify(signatureMapper, never()).deleteByConfigAndDirPathMd5(CONFIG_ID, HashUtil.md5Hex("a"));
    }

    @Test
    void syncSourceShouldResolveTargetAndStampLastSync() {
        when(syncSourceService.resolveTarget(USER_ID, CONFIG_ID)).thenReturn(target);
        listing("");

        Optional<SyncResult> result = service.syncSource(USER_ID, CONFIG_ID);

        assertTrue(result.isPresent());
        assertEquals(SyncStrategy.FULL_DEEP_SCAN, result.get().getStrategyUsed());
        verify(syncSourceService).markSynced(CONFIG_ID);
    }

    @Test
    void etagComparisonShouldIgnoreWeaknessAndQuotes() {
        assertTrue(SmartSyncService.etagsMatch("\"abc\"", "W/\"abc\""));
        assertTrue(SmartSyncService.etagsMatch("abc", "\"abc\""));
        assertFalse(SmartSyncService.etagsMatch(null, null));
        assertFalse(SmartSyncService.etagsMatch("abc", "abd"));
    }

    @Test
    void pathHelpersShouldNormalizeSeparators() {
        assertEquals("a/b", SmartSyncService.normalizeRelativePath("\\a\\b\\"));
        assertEquals("", SmartSyncService.normalizeRelativePath("/"));
        assertEquals("a", SmartSyncService.parentOf("a/b"));
        assertEquals("", SmartSyncService.parentOf("a"));
        assertEquals("/a/b", SmartSyncService.displayPath("a/b"));
        assertEquals(MUSIC + "/a/b", SmartSyncService.resourcePath(target, "/a/b/"));
        assertEquals(MUSIC, SmartSyncService.resourcePath(target, ""));
        assertEquals("https://dav.example.com",
                SmartSyncService.resourcePath(new SyncTarget(USER_ID, 12L, "https://dav.example.com/", "u", "p", "/"),
                        ""));
    }

    private void storeSignatures(DirectorySignatureEntity... signatures) {
        when(signatureMapper.selectByDirectoryPrefix(eq(CONFIG_ID), anyString()))
                .thenReturn(Arrays.asList(signatures));
    }

    private void listing(String relativePath, Object... children) {
        listings.put(relativePath.isEmpty() ? ROOT_URL : ROOT_URL + relativePath + "/", info(relativePath, children));
    }

    private static WebDavDirectoryInfo info(String relativePath, Object... children) {
        WebDavDirectoryInfo info = new WebDavDirectoryInfo();
        info.setRelativePath(relativePath);
        info.setEtag("etag-" + relativePath);
        List<WebDavFileObject> files = new ArrayList<>();
        List<WebDavDirectoryEntry> dirs = new ArrayList<>();
        for (Object child : children) {
            if (child instanceof WebDavFileObject) {
                files.add((WebDavFileObject) child);
            } else {
                dirs.add((WebDavDirectoryEntry) child);
            }
        }
        info.setFiles(files);
        info.setSubdirectories(dirs);
        return info;
    }

    private static WebDavDirectoryEntry dir(String relativePath, String etag) {
        WebDavDirectoryEntry entry = new WebDavDirectoryEntry();
        entry.setRelativePath(relativePath);
        entry.setDirectoryUrl(ROOT_URL + relativePath + "/");
        entry.setEtag(etag);
        return entry;
    }

    private static WebDavFileObject file(String relativePath) {
        WebDavFileObject file = new WebDavFileObject();
        file.setRelativePath(relativePath);
        file.setFileUrl(ROOT_URL + relativePath);
        file.setSize(1024L);
        return file;
    }

    private static DirectorySignatureEntity sig(String dirPath, String etag) {
        DirectorySignatureEntity signature = new DirectorySignatureEntity();
        signature.setConfigId(CONFIG_ID);
        signature.setDirPath(dirPath);
        signature.setDirPathMd5(HashUtil.md5Hex(dirPath));
        signature.setDirEtag(etag);
        return signature;
    }
}
