package com.example.sourcesync.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sync")
public class AppSyncProperties {

    private String cron = "0 */30 * * * ?";

    /**
     * Parallel directory listings per crawl level.
     */
    private int listThreadCount = 4;

    /**
     * Queue capacity of the sync worker pool.
     */
    private int listQueueCapacity = 200;

    private int retryCandidateLimit = 10;

    /**
     * Changed/known directory ratio above which a targeted scan is replaced by a full deep scan.
     */
    private double fullScanChangeRatio = 0.3D;

    /**
     * New directory count above which a targeted scan is replaced by a full deep scan.
     */
    private int fullScanNewDirThreshold = 5;

    /**
     * Optimistic upsert attempts when recording a failure races with another writer.
     */
    private int trackMaxAttempts = 3;
}
