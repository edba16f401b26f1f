package com.example.sourcesync.domain.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-operation input to error classification. Immutable: every {@code with*} call returns a copy.
 */
public final class ErrorContext {

    private static final String UNKNOWN_OPERATION = "unknown";

    private final String resourcePath;
    private final Long sourceId;
    private final String operation;
    private final Duration responseTime;
    private final Long responseSizeBytes;
    private final String serverType;
    private final String serverVersion;
    private final Map<String, String> additionalContext;

    private ErrorContext(String resourcePath,
                         Long sourceId,
                         String operation,
                         Duration responseTime,
                         Long responseSizeBytes,
                         String serverType,
                         String serverVersion,
                         Map<String, String> additionalContext) {
        this.resourcePath = resourcePath == null ? "" : resourcePath;
        this.sourceId = sourceId;
        this.operation = operation == null ? UNKNOWN_OPERATION : operation;
        this.responseTime = responseTime;
        this.responseSizeBytes = responseSizeBytes;
        this.serverType = serverType;
        this.serverVersion = serverVersion;
        this.additionalContext = Collections.unmodifiableMap(new LinkedHashMap<String, String>(additionalContext));
    }

    public static ErrorContext of(String resourcePath) {
        return new ErrorContext(resourcePath, null, UNKNOWN_OPERATION, null, null, null, null,
                Collections.<String, String>emptyMap());
    }

    public ErrorContext withSourceId(Long sourceId) {
        return new ErrorContext(resourcePath, sourceId, operation, responseTime, responseSizeBytes,
                serverType, serverVersion, additionalContext);
    }

    public ErrorContext withOperation(String operation) {
        return new ErrorContext(resourcePath, sourceId, operation, responseTime, responseSizeBytes,
                serverType, serverVersion, additionalContext);
    }

    public ErrorContext withResponseTime(Duration responseTime) {
        return new ErrorContext(resourcePath, sourceId, operation, responseTime, responseSizeBytes,
                serverType, serverVersion, additionalContext);
    }

    public ErrorContext withResponseSize(Long responseSizeBytes) {
        return new ErrorContext(resourcePath, sourceId, operation, responseTime, responseSizeBytes,
                serverType, serverVersion, additionalContext);
    }

    public ErrorContext withServerInfo(String serverType, String serverVersion) {
        return new ErrorContext(resourcePath, sourceId, operation, responseTime, responseSizeBytes,
                serverType, serverVersion, additionalContext);
    }

    public ErrorContext withContext(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<String, String>(additionalContext);
        merged.put(key, value);
        return new ErrorContext(resourcePath, sourceId, operation, responseTime, responseSizeBytes,
                serverType, serverVersion, merged);
    }

    public String getResourcePath() {
        return resourcePath;
    }

    public Long getSourceId() {
        return sourceId;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getResponseTime() {
        return responseTime;
    }

    public Long getResponseSizeBytes() {
        return responseSizeBytes;
    }

    public String getServerType() {
        return serverType;
    }

    public String getServerVersion() {
        return serverVersion;
    }

    public Map<String, String> getAdditionalContext() {
        return additionalContext;
    }

    public Long getResponseTimeMs() {
        return responseTime == null ? null : responseTime.toMillis();
    }

    @Override
    public String toString() {
        return "ErrorContext{resourcePath='" + resourcePath + "', operation='" + operation
                + "', sourceId=" + sourceId + ", serverType=" + serverType + "}";
    }
}
