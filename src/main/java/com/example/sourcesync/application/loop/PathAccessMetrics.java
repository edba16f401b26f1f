package com.example.sourcesync.application.loop;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregates over the retained history of a single path.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PathAccessMetrics {

    private int accessCount;

    private double timeSpanSecs;

    private double avgScanDurationSecs;

    private long totalFilesFound;

    private long totalSubdirsFound;

    private int failedAccesses;
}
