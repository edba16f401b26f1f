package com.example.sourcesync.infrastructure.persistence.model;

import lombok.Data;

@Data
public class FailureSummaryRow {

    private Long activeFailures;

    private Long resolvedFailures;

    private Long excludedResources;

    private Long criticalFailures;

    private Long highFailures;

    private Long mediumFailures;

    private Long lowFailures;

    private Long readyForRetry;
}
