package com.example.sourcesync.domain.model;

import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.RetryStrategy;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorClassification {

    private SourceErrorType errorType;

    private ErrorSeverity severity;

    private RetryStrategy retryStrategy;

    private int retryDelaySeconds;

    private int maxRetries;

    private String userMessage;

    private String recommendedAction;

    private Integer httpStatusCode;

    private String errorCode;

    private ObjectNode diagnostics;
}
