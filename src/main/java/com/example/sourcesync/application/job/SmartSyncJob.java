package com.example.sourcesync.application.job;

import com.example.sourcesync.application.service.SmartSyncService;
import com.example.sourcesync.application.service.SyncSourceService;
import com.example.sourcesync.common.config.AppSyncProperties;
import com.example.sourcesync.common.exception.BusinessException;
import com.example.sourcesync.domain.model.SyncResult;
import com.example.sourcesync.domain.model.SyncTarget;
import com.example.sourcesync.infrastructure.persistence.entity.SyncSourceConfigEntity;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class SmartSyncJob {

    private static final Logger log = LoggerFactory.getLogger(SmartSyncJob.class);

    private final AppSyncProperties appSyncProperties;
    private final SyncSourceService syncSourceService;
    private final SmartSyncService smartSyncService;

    public SmartSyncJob(AppSyncProperties appSyncProperties,
                        SyncSourceService syncSourceService,
                        SmartSyncService smartSyncService) {
        this.appSyncProperties = appSyncProperties;
        this.syncSourceService = syncSourceService;
        this.smartSyncService = smartSyncService;
    }

    @Scheduled(cron = "${app.sync.cron:0 */30 * * * ?}")
    public void run() {
        List<SyncSourceConfigEntity> sources = syncSourceService.listEnabledSources();
        if (sources == null || sources.isEmpty()) {
            log.debug("SMART_SYNC_JOB_IDLE no enabled source");
            return;
        }
        log.info("SMART_SYNC_JOB_TRIGGERED sourceCount={} cron={}", sources.size(), appSyncProperties.getCron());
        for (SyncSourceConfigEntity source : sources) {
            try {
                SyncTarget target = syncSourceService.toTarget(source);
                Optional<SyncResult> result = smartSyncService.evaluateAndSync(target, "");
                syncSourceService.markSynced(source.getId());
                if (result.isPresent()) {
                    log.info("SMART_SYNC_JOB_SOURCE_DONE configId={} strategy={} scanned={} failed={}",
                            source.getId(), result.get().getStrategyUsed(), result.get().getDirectoriesScanned(),
                            result.get().getDirectoriesFailed());
                }
            } catch (BusinessException e) {
                log.warn("SMART_SYNC_JOB_SOURCE_SKIPPED configId={} name={} code={} msg={}",
                        source.getId(), source.getName(), e.getCode(), e.getMessage());
            } catch (Exception e) {
                log.warn("SMART_SYNC_JOB_SOURCE_FAILED configId={} name={}", source.getId(), source.getName(), e);
            }
        }
    }
}
