package com.example.sourcesync.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDateTime;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceScanFailureResponse {

    private Long id;

    private String sourceType;

    private Long sourceId;

    private String resourcePath;

    private String errorType;

    private String errorSeverity;

    private Integer failureCount;

    private Integer consecutiveFailures;

    private LocalDateTime firstFailureAt;

    private LocalDateTime lastFailureAt;

    private LocalDateTime lastRetryAt;

    private LocalDateTime nextRetryAt;

    private String errorMessage;

    private String errorCode;

    private Integer httpStatusCode;

    private Long responseTimeMs;

    private Long responseSizeBytes;

    private Integer resourceDepth;

    private Integer estimatedItemCount;

    private Boolean userExcluded;

    private String userNotes;

    private String retryStrategy;

    private Integer maxRetries;

    private Boolean resolved;

    private LocalDateTime resolvedAt;

    private String resolutionMethod;

    private String resolutionNotes;

    private String userMessage;

    private String recommendedAction;

    private boolean canRetry;

    private boolean userActionRequired;

    /** Only on the detail view. */
    private JsonNode diagnostics;
}
