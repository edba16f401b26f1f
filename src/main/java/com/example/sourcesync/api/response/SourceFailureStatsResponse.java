package com.example.sourcesync.api.response;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class SourceFailureStatsResponse {

    private long activeFailures;

    private long resolvedFailures;

    private long excludedResources;

    private long criticalFailures;

    private long highFailures;

    private long mediumFailures;

    private long lowFailures;

    private long readyForRetry;

    private Map<String, Long> bySourceType = new LinkedHashMap<>();

    private Map<String, Long> byErrorType = new LinkedHashMap<>();
}
