package com.example.sourcesync.application.service;

import com.example.sourcesync.application.loop.AccessHandle;
import com.example.sourcesync.application.loop.LoopDetector;
import com.example.sourcesync.application.loop.LoopDetectorRegistry;
import com.example.sourcesync.common.config.AppSyncProperties;
import com.example.sourcesync.common.exception.LoopDetectedException;
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
import com.github.sardine.Sardine;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * ETag-driven WebDAV sync: a shallow listing decides between skipping, a targeted scan of the changed
 * subtrees, or a full deep scan. Every directory visit goes through the user's {@link LoopDetector} and
 * the {@link SourceFailureTracker}, keyed by the source-qualified directory path.
 */
@Service
public class SmartSyncService {

    private static final Logger log = LoggerFactory.getLogger(SmartSyncService.class);

    static final String OPERATION_EVALUATE = "evaluate_sync_need";
    static final String OPERATION_SCAN = "scan_directory";

    private final WebDavClient webDavClient;
    private final DirectorySignatureMapper directorySignatureMapper;
    private final SourceFailureTracker sourceFailureTracker;
    private final LoopDetectorRegistry loopDetectorRegistry;
    private final SyncSourceService syncSourceService;
    private final AppSyncProperties appSyncProperties;
    private final ExecutorService syncTaskExecutor;
    private final MeterRegistry meterRegistry;
    private final AtomicLong runSequence = new AtomicLong();

    @Autowired
    public SmartSyncService(WebDavClient webDavClient,
                            DirectorySignatureMapper directorySignatureMapper,
                            SourceFailureTracker sourceFailureTracker,
                            LoopDetectorRegistry loopDetectorRegistry,
                            SyncSourceService syncSourceService,
                            AppSyncProperties appSyncProperties,
                            @Qualifier("syncTaskExecutor") ExecutorService syncTaskExecutor,
                            ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(webDavClient, directorySignatureMapper, sourceFailureTracker, loopDetectorRegistry, syncSourceService,
                appSyncProperties, syncTaskExecutor, meterRegistryProvider.getIfAvailable());
    }

    SmartSyncService(WebDavClient webDavClient,
                     DirectorySignatureMapper directorySignatureMapper,
                     SourceFailureTracker sourceFailureTracker,
                     LoopDetectorRegistry loopDetectorRegistry,
                     SyncSourceService syncSourceService,
                     AppSyncProperties appSyncProperties,
                     ExecutorService syncTaskExecutor,
                     MeterRegistry meterRegistry) {
        this.webDavClient = webDavClient;
        this.directorySignatureMapper = directorySignatureMapper;
        this.sourceFailureTracker = sourceFailureTracker;
        this.loopDetectorRegistry = loopDetectorRegistry;
        this.syncSourceService = syncSourceService;
        this.appSyncProperties = appSyncProperties;
        this.syncTaskExecutor = syncTaskExecutor;
        this.meterRegistry = meterRegistry;
    }

    // ════════════════════════════════════════════════════════
    // Entry points
    // ════════════════════════════════════════════════════════

    public Optional<SyncResult> syncSource(Long userId, Long configId) {
        SyncTarget target = syncSourceService.resolveTarget(userId, configId);
        Optional<SyncResult> result = evaluateAndSync(target, "");
        syncSourceService.markSynced(configId);
        return result;
    }

    /**
     * @return empty when nothing changed below {@code folderPath}
     */
    public Optional<SyncResult> evaluateAndSync(SyncTarget target, String folderPath) {
        String folder = normalizeRelativePath(folderPath);
        SyncDecision decision = evaluateSyncNeed(target, folder);
        incrementCounter("sync.smart.decision", "decision", decision.isSkip() ? "SKIP" : decision.getStrategy().name());
        if (decision.isSkip()) {
            log.info("SMART_SYNC_SKIPPED userId={} configId={} folder={}",
                    target.getUserId(), target.getConfigId(), displayPath(folder));
            return Optional.empty();
        }
        SyncResult result = decision.getStrategy() == SyncStrategy.TARGETED_SCAN
                ? performTargetedScan(target, decision.getTargetDirectories())
                : performFullDeepScan(target, folder);
        return Optional.of(result);
    }

    // ════════════════════════════════════════════════════════
    // Decision
    // ════════════════════════════════════════════════════════

    /**
     * Compares stored ETags of the folder's direct subdirectories against a depth-1 listing.
     * A listing failure is tracked and answered with a full deep scan.
     */
    public SyncDecision evaluateSyncNeed(SyncTarget target, String folderPath) {
        String folder = normalizeRelativePath(folderPath);
        Map<String, String> known = loadKnownChildren(target.getConfigId(), folder);
        if (known.isEmpty()) {
            log.info("SMART_SYNC_NO_HISTORY userId={} configId={} folder={} decision=FULL_DEEP_SCAN",
                    target.getUserId(), target.getConfigId(), displayPath(folder));
            return SyncDecision.fullDeepScan();
        }

        WebDavDirectoryInfo listing;
        Sardine session = webDavClient.createSession(target.getUsername(), target.getPassword());
        long startNanos = System.nanoTime();
        try {
            String rootUrl = webDavClient.buildRootUrl(target.getBaseUrl(), target.getRootPath());
            listing = webDavClient.listDirectory(session, webDavClient.resolveDirectoryUrl(rootUrl, folder), rootUrl);
        } catch (RuntimeException e) {
            String resourcePath = resourcePath(target, folder);
            ErrorContext context = ErrorContext.of(resourcePath)
                    .withSourceId(target.getConfigId())
                    .withOperation(OPERATION_EVALUATE)
                    .withResponseTime(Duration.ofNanos(System.nanoTime() - startNanos));
            sourceFailureTracker.trackScanError(target.getUserId(), ErrorSourceType.WEBDAV, target.getConfigId(),
                    resourcePath, e, context);
            log.warn("SMART_SYNC_EVALUATE_FAILED userId={} configId={} folder={} reason={} decision=FULL_DEEP_SCAN",
                    target.getUserId(), target.getConfigId(), displayPath(folder), e.getMessage());
            return SyncDecision.fullDeepScan();
        } finally {
            webDavClient.closeSession(session);
        }

        List<String> changed = new ArrayList<>();
        List<String> added = new ArrayList<>();
        Set<String> discovered = new HashSet<>();
        for (WebDavDirectoryEntry entry : listing.getSubdirectories()) {
            String path = normalizeRelativePath(entry.getRelativePath());
            discovered.add(path);
            if (!known.containsKey(path)) {
                added.add(path);
            } else if (!etagsMatch(known.get(path), entry.getEtag())) {
                changed.add(path);
            }
        }
        List<String> deleted = new ArrayList<>();
        for (String path : known.keySet()) {
            if (!discovered.contains(path)) {
                deleted.add(path);
            }
        }

        if (changed.isEmpty() && added.isEmpty() && deleted.isEmpty()) {
            log.info("SMART_SYNC_UNCHANGED userId={} configId={} folder={} knownDirs={}",
                    target.getUserId(), target.getConfigId(), displayPath(folder), known.size());
            return SyncDecision.skip();
        }
        int totalChanges = changed.size() + added.size() + deleted.size();
        double changeRatio = totalChanges / (double) Math.max(1, known.size());
        if (changeRatio > appSyncProperties.getFullScanChangeRatio()
                || added.size() > appSyncProperties.getFullScanNewDirThreshold()
                || !deleted.isEmpty()) {
            log.info("SMART_SYNC_LARGE_CHANGE userId={} configId={} folder={} changed={} new={} deleted={} "
                            + "ratio={} decision=FULL_DEEP_SCAN", target.getUserId(), target.getConfigId(),
                    displayPath(folder), changed.size(), added.size(), deleted.size(),
                    String.format("%.2f", changeRatio));
            return SyncDecision.fullDeepScan();
        }
        List<String> targets = new ArrayList<>(changed);
        targets.addAll(added);
        log.info("SMART_SYNC_TARGETED userId={} configId={} folder={} changed={} new={} targets={}",
                target.getUserId(), target.getConfigId(), displayPath(folder), changed.size(), added.size(), targets);
        return SyncDecision.targeted(targets);
    }

    // ════════════════════════════════════════════════════════
    // Scans
    // ════════════════════════════════════════════════════════

    public SyncResult performFullDeepScan(SyncTarget target, String folderPath) {
        return crawl(target, Collections.singletonList(normalizeRelativePath(folderPath)),
                SyncStrategy.FULL_DEEP_SCAN);
    }

    public SyncResult performTargetedScan(SyncTarget target, List<String> directories) {
        List<String> starts = new ArrayList<>();
        for (String directory : directories) {
            starts.add(normalizeRelativePath(directory));
        }
        return crawl(target, starts, SyncStrategy.TARGETED_SCAN);
    }

    private SyncResult crawl(SyncTarget target, List<String> startDirectories, SyncStrategy strategy) {
        long startMs = System.currentTimeMillis();
        LoopDetector detector = loopDetectorRegistry.forUser(target.getUserId());
        String scanLabel = "config-" + target.getConfigId() + "-run-" + runSequence.incrementAndGet();
        SyncResult result = new SyncResult();
        result.setStrategyUsed(strategy);

        Set<String> scheduled = new LinkedHashSet<>(startDirectories);
        Set<String> listed = new HashSet<>();
        Set<String> discovered = new HashSet<>(startDirectories);
        Sardine session = webDavClient.createSession(target.getUsername(), target.getPassword());
        try {
            String rootUrl = webDavClient.buildRootUrl(target.getBaseUrl(), target.getRootPath());
            List<String> level = new ArrayList<>(scheduled);
            while (!level.isEmpty()) {
                List<Future<DirectoryOutcome>> futures = new ArrayList<>(level.size());
                for (final String dir : level) {
                    futures.add(syncTaskExecutor.submit(
                            () -> scanDirectory(target, session, rootUrl, dir, detector, scanLabel)));
                }
                List<String> next = new ArrayList<>();
                for (int i = 0; i < futures.size(); i++) {
                    DirectoryOutcome outcome = awaitOutcome(futures.get(i), level.get(i));
                    merge(result, outcome);
                    if (outcome.status != OutcomeStatus.SCANNED) {
                        continue;
                    }
                    listed.add(outcome.path);
                    for (String subdir : outcome.subdirectories) {
                        discovered.add(subdir);
                        if (scheduled.add(subdir)) {
                            next.add(subdir);
                        }
                    }
                }
                level = next;
            }
        } finally {
            webDavClient.closeSession(session);
        }

        removeOrphanSignatures(target.getConfigId(), startDirectories, listed, discovered);
        result.setDurationMs(System.currentTimeMillis() - startMs);
        incrementCounter("sync.dir.scanned", result.getDirectoriesScanned(), "strategy", strategy.name());
        incrementCounter("sync.dir.skipped", result.getDirectoriesSkipped(), "strategy", strategy.name());
        incrementCounter("sync.dir.failed", result.getDirectoriesFailed(), "strategy", strategy.name());
        log.info("SMART_SYNC_DONE userId={} configId={} strategy={} scanned={} skipped={} failed={} "
                        + "loopRejections={} files={} costMs={}", target.getUserId(), target.getConfigId(), strategy,
                result.getDirectoriesScanned(), result.getDirectoriesSkipped(), result.getDirectoriesFailed(),
                result.getLoopRejections(), result.getFiles().size(), result.getDurationMs());
        return result;
    }

    private DirectoryOutcome scanDirectory(SyncTarget target, Sardine session, String rootUrl, String dir,
                                           LoopDetector detector, String scanLabel) {
        String path = resourcePath(target, dir);
        if (sourceFailureTracker.shouldSkipDirectory(target.getUserId(), ErrorSourceType.WEBDAV, path)) {
            log.info("SMART_SYNC_DIR_SKIPPED userId={} path={} reason=failure_tracking", target.getUserId(), path);
            return DirectoryOutcome.skipped(dir);
        }
        AccessHandle handle;
        try {
            handle = detector.startAccess(path, scanLabel);
        } catch (LoopDetectedException e) {
            log.warn("SMART_SYNC_LOOP_REJECTED userId={} path={} type={} reason={}",
                    target.getUserId(), path, e.getLoopType(), e.getMessage());
            return DirectoryOutcome.loopRejected(dir);
        }

        int filesFound = 0;
        int dirsFound = 0;
        String error = null;
        long startNanos = System.nanoTime();
        try {
            WebDavDirectoryInfo info = webDavClient.listDirectory(session,
                    webDavClient.resolveDirectoryUrl(rootUrl, dir), rootUrl);
            filesFound = info.getFiles().size();
            dirsFound = info.getSubdirectories().size();
            saveSignature(target, dir, info);
            sourceFailureTracker.markScanSuccessful(target.getUserId(), ErrorSourceType.WEBDAV, path);
            List<String> subdirectories = new ArrayList<>(dirsFound);
            for (WebDavDirectoryEntry entry : info.getSubdirectories()) {
                subdirectories.add(normalizeRelativePath(entry.getRelativePath()));
            }
            return DirectoryOutcome.scanned(dir, info.getFiles(), subdirectories);
        } catch (RuntimeException e) {
            error = StringUtils.hasText(e.getMessage()) ? e.getMessage() : e.getClass().getSimpleName();
            ErrorContext context = ErrorContext.of(path)
                    .withSourceId(target.getConfigId())
                    .withOperation(OPERATION_SCAN)
                    .withResponseTime(Duration.ofNanos(System.nanoTime() - startNanos));
            sourceFailureTracker.trackScanError(target.getUserId(), ErrorSourceType.WEBDAV, target.getConfigId(),
                    path, e, context);
            log.warn("SMART_SYNC_DIR_FAILED userId={} path={} reason={}", target.getUserId(), path, error);
            return DirectoryOutcome.failed(dir);
        } finally {
            try {
                detector.completeAccess(handle, filesFound, dirsFound, error);
            } catch (IllegalStateException e) {
                log.warn("SMART_SYNC_ACCESS_NOT_OPEN path={} reason={}", path, e.getMessage());
            }
        }
    }

    private DirectoryOutcome awaitOutcome(Future<DirectoryOutcome> future, String dir) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Directory scan interrupted", e);
        } catch (ExecutionException e) {
            log.warn("SMART_SYNC_DIR_TASK_FAILED path={} reason={}", displayPath(dir),
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return DirectoryOutcome.failed(dir);
        }
    }

    private static void merge(SyncResult result, DirectoryOutcome outcome) {
        switch (outcome.status) {
            case SCANNED:
                result.setDirectoriesScanned(result.getDirectoriesScanned() + 1);
                result.getFiles().addAll(outcome.files);
                break;
            case LOOP_REJECTED:
                result.setLoopRejections(result.getLoopRejections() + 1);
                result.setDirectoriesSkipped(result.getDirectoriesSkipped() + 1);
                break;
            case SKIPPED:
                result.setDirectoriesSkipped(result.getDirectoriesSkipped() + 1);
                break;
            case FAILED:
            default:
                result.setDirectoriesFailed(result.getDirectoriesFailed() + 1);
                break;
        }
    }

    // ════════════════════════════════════════════════════════
    // Directory signatures
    // ════════════════════════════════════════════════════════

    private Map<String, String> loadKnownChildren(Long configId, String folder) {
        Map<String, String> known = new LinkedHashMap<>();
        for (DirectorySignatureEntity signature : selectSubtree(configId, folder)) {
            String path = normalizeRelativePath(signature.getDirPath());
            if (!path.equals(folder) && parentOf(path).equals(folder)) {
                known.put(path, signature.getDirEtag());
            }
        }
        return known;
    }

    private void saveSignature(SyncTarget target, String dir, WebDavDirectoryInfo info) {
        DirectorySignatureEntity entity = new DirectorySignatureEntity();
        entity.setUserId(target.getUserId());
        entity.setConfigId(target.getConfigId());
        entity.setDirPath(dir);
        entity.setDirPathMd5(HashUtil.md5Hex(dir));
        entity.setDirEtag(info.getEtag());
        entity.setFileCount(info.getFiles().size());
        entity.setSubdirCount(info.getSubdirectories().size());
        try {
            directorySignatureMapper.upsert(entity);
        } catch (RuntimeException e) {
            log.warn("SMART_SYNC_SIGNATURE_SAVE_FAILED configId={} dir={} reason={}",
                    target.getConfigId(), displayPath(dir), e.getMessage());
        }
    }

    /**
     * Drops stored signatures of directories that vanished: the parent was listed and no longer
     * reports them, or the parent itself vanished.
     */
    private void removeOrphanSignatures(Long configId, List<String> startDirectories, Set<String> listed,
                                        Set<String> discovered) {
        try {
            for (String start : startDirectories) {
                List<DirectorySignatureEntity> stored = new ArrayList<>(selectSubtree(configId, start));
                stored.sort(Comparator.comparingInt(s -> s.getDirPath() == null ? 0 : s.getDirPath().length()));
                Set<String> orphans = new HashSet<>();
                for (DirectorySignatureEntity signature : stored) {
                    String path = normalizeRelativePath(signature.getDirPath());
                    if (path.equals(start) || discovered.contains(path)) {
                        continue;
                    }
                    String parent = parentOf(path);
                    if (listed.contains(parent) || orphans.contains(parent)) {
                        orphans.add(path);
                        directorySignatureMapper.deleteByConfigAndDirPathMd5(configId, signature.getDirPathMd5());
                    }
                }
                if (!orphans.isEmpty()) {
                    log.info("SMART_SYNC_ORPHANS_REMOVED configId={} under={} count={}",
                            configId, displayPath(start), orphans.size());
                }
            }
        } catch (RuntimeException e) {
            log.warn("SMART_SYNC_ORPHAN_CLEANUP_FAILED configId={} reason={}", configId, e.getMessage());
        }
    }

    private List<DirectorySignatureEntity> selectSubtree(Long configId, String folder) {
        String likePattern = folder.isEmpty() ? "%" : escapeLikePattern(folder) + "/%";
        List<DirectorySignatureEntity> rows = directorySignatureMapper.selectByDirectoryPrefix(configId, likePattern);
        return rows == null ? Collections.<DirectorySignatureEntity>emptyList() : rows;
    }

    // ════════════════════════════════════════════════════════
    // Helpers
    // ════════════════════════════════════════════════════════

    /**
     * Weak and strong ETags of the same value are equal; a missing ETag never matches.
     */
    static boolean etagsMatch(String stored, String current) {
        String a = normalizeEtag(stored);
        String b = normalizeEtag(current);
        return a != null && a.equals(b);
    }

    private static String normalizeEtag(String etag) {
        if (!StringUtils.hasText(etag)) {
            return null;
        }
        String value = etag.trim();
        if (value.startsWith("W/") || value.startsWith("w/")) {
            value = value.substring(2);
        }
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        return value.isEmpty() ? null : value;
    }

    static String normalizeRelativePath(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.trim().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    static String parentOf(String relativePath) {
        int idx = relativePath.lastIndexOf('/');
        return idx < 0 ? "" : relativePath.substring(0, idx);
    }

    static String displayPath(String relativePath) {
        return "/" + relativePath;
    }

    /**
     * Key of a directory in the loop detector and the failure table. Qualified by the source's
     * base URL and root path, so two sources of one user never share an entry.
     */
    static String resourcePath(SyncTarget target, String relativePath) {
        String base = target.getBaseUrl() == null ? "" : target.getBaseUrl().trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        StringBuilder sb = new StringBuilder(base);
        String root = normalizeRelativePath(target.getRootPath());
        if (!root.isEmpty()) {
            sb.append('/').append(root);
        }
        String relative = normalizeRelativePath(relativePath);
        if (!relative.isEmpty()) {
            sb.append('/').append(relative);
        }
        return sb.toString();
    }

    private static String escapeLikePattern(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    private void incrementCounter(String name, String... tags) {
        incrementCounter(name, 1, tags);
    }

    private void incrementCounter(String name, double value, String... tags) {
        if (meterRegistry == null || value <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment(value);
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    private enum OutcomeStatus {
        SCANNED, SKIPPED, LOOP_REJECTED, FAILED
    }

    private static final class DirectoryOutcome {

        private final String path;
        private final OutcomeStatus status;
        private final List<WebDavFileObject> files;
        private final List<String> subdirectories;

        private DirectoryOutcome(String path, OutcomeStatus status, List<WebDavFileObject> files,
                                 List<String> subdirectories) {
            this.path = path;
            this.status = status;
            this.files = files;
            this.subdirectories = subdirectories;
        }

        private static DirectoryOutcome scanned(String path, List<WebDavFileObject> files, List<String> subdirs) {
            return new DirectoryOutcome(path, OutcomeStatus.SCANNED, files, subdirs);
        }

        private static DirectoryOutcome skipped(String path) {
            return new DirectoryOutcome(path, OutcomeStatus.SKIPPED, Collections.<WebDavFileObject>emptyList(),
                    Collections.<String>emptyList());
        }

        private static DirectoryOutcome loopRejected(String path) {
            return new DirectoryOutcome(path, OutcomeStatus.LOOP_REJECTED, Collections.<WebDavFileObject>emptyList(),
                    Collections.<String>emptyList());
        }

        private static DirectoryOutcome failed(String path) {
            return new DirectoryOutcome(path, OutcomeStatus.FAILED, Collections.<WebDavFileObject>emptyList(),
                    Collections.<String>emptyList());
        }
    }
}
