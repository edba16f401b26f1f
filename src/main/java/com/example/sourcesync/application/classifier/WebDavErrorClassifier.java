package com.example.sourcesync.application.classifier;

import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.enumtype.RetryStrategy;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class WebDavErrorClassifier extends AbstractSourceErrorClassifier {

    private static final Pattern ITEM_COUNT_PATTERN =
            Pattern.compile("(?i)(\\d+)\\s*(?:items?|files?|entries|resources)");

    private static final String REPEATED_TIMEOUT_ACTION =
            "Consider excluding this directory from scanning due to repeated timeouts.";

    @Autowired
    public WebDavErrorClassifier(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    WebDavErrorClassifier(ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
    }

    @Override
    public ErrorSourceType sourceType() {
        return ErrorSourceType.WEBDAV;
    }

    @Override
    protected SourceErrorType classifyType(Throwable error, String text, Integer httpStatus) {
        SourceErrorType byException = classifyByExceptionType(error);
        if (byException != null) {
            return byException;
        }
        if (httpStatus != null) {
            SourceErrorType byStatus = classifyStatus(httpStatus);
            if (byStatus != null) {
                return byStatus;
            }
        }
        if (containsAny(text, "timeout", "timed out")) {
            return SourceErrorType.TIMEOUT;
        }
        if (containsAny(text, "name too long", "path too long")) {
            return SourceErrorType.PATH_TOO_LONG;
        }
        if (containsAny(text, "permission", "forbidden", "unauthorized")) {
            return SourceErrorType.PERMISSION_DENIED;
        }
        if (containsAny(text, "invalid character", "illegal character")) {
            return SourceErrorType.INVALID_CHARACTERS;
        }
        if (containsAny(text, "connection refused", "network", "dns")) {
            return SourceErrorType.NETWORK_ERROR;
        }
        if (containsAny(text, "xml", "parse", "malformed")) {
            return SourceErrorType.XML_PARSE_ERROR;
        }
        if (containsAny(text, "too many", "limit exceeded")) {
            return SourceErrorType.TOO_MANY_ITEMS;
        }
        if (containsAny(text, "depth", "nested")) {
            return SourceErrorType.DEPTH_LIMIT;
        }
        if (containsAny(text, "size", "too large")) {
            return SourceErrorType.SIZE_LIMIT;
        }
        if (text.contains("not found")) {
            return SourceErrorType.NOT_FOUND;
        }
        return SourceErrorType.UNKNOWN;
    }

    private SourceErrorType classifyStatus(int status) {
        switch (status) {
            case 401:
            case 403:
                return SourceErrorType.PERMISSION_DENIED;
            case 404:
            case 410:
                return SourceErrorType.NOT_FOUND;
            case 405:
            case 501:
                return SourceErrorType.UNSUPPORTED_OPERATION;
            case 408:
                return SourceErrorType.TIMEOUT;
            case 409:
            case 423:
                return SourceErrorType.CONFLICT;
            case 413:
                return SourceErrorType.SIZE_LIMIT;
            case 414:
                return SourceErrorType.PATH_TOO_LONG;
            case 429:
                return SourceErrorType.RATE_LIMITED;
            case 504:
                return SourceErrorType.TIMEOUT;
            case 507:
                return SourceErrorType.QUOTA_EXCEEDED;
            default:
                return status >= 500 ? SourceErrorType.SERVER_ERROR : null;
        }
    }

    @Override
    protected ErrorSeverity classifySeverity(SourceErrorType type, String text, Integer httpStatus,
                                             ErrorContext context) {
        switch (type) {
            case PATH_TOO_LONG:
            case INVALID_CHARACTERS:
            case NOT_FOUND:
                return ErrorSeverity.CRITICAL;
            case PERMISSION_DENIED:
            case XML_PARSE_ERROR:
            case TOO_MANY_ITEMS:
            case DEPTH_LIMIT:
            case SIZE_LIMIT:
            case QUOTA_EXCEEDED:
            case UNSUPPORTED_OPERATION:
                return ErrorSeverity.HIGH;
            case NETWORK_ERROR:
            case RATE_LIMITED:
                return ErrorSeverity.LOW;
            case TIMEOUT:
            case SERVER_ERROR:
            default:
                return ErrorSeverity.MEDIUM;
        }
    }

    @Override
    protected RetryStrategy retryStrategy(SourceErrorType type) {
        return type == SourceErrorType.XML_PARSE_ERROR ? RetryStrategy.LINEAR : RetryStrategy.EXPONENTIAL;
    }

    @Override
    protected int retryDelaySeconds(SourceErrorType type) {
        switch (type) {
            case NETWORK_ERROR:
                return 60;
            case TIMEOUT:
                return 900;
            case XML_PARSE_ERROR:
                return 600;
            case RATE_LIMITED:
                return 600;
            case SERVER_ERROR:
            default:
                return 300;
        }
    }

    @Override
    protected String userMessage(SourceErrorType type, String path, String errorMessage, Integer httpStatus) {
        switch (type) {
            case TIMEOUT:
                return String.format("The WebDAV directory '%s' is taking too long to scan. This might be due "
                        + "to a large number of files or slow server response.", path);
            case PATH_TOO_LONG:
                return String.format("The WebDAV path '%s' exceeds system limits. "
                        + "Consider shortening directory names.", path);
            case PERMISSION_DENIED:
                return String.format("Access denied to WebDAV directory '%s'. "
                        + "Please check your WebDAV permissions.", path);
            case TOO_MANY_ITEMS:
                return String.format("WebDAV directory '%s' contains too many items. "
                        + "Consider organizing into subdirectories.", path);
            case NOT_FOUND:
                return String.format("WebDAV directory '%s' was not found on the server. "
                        + "It may have been deleted or moved.", path);
            case XML_PARSE_ERROR:
                return String.format("Malformed XML response from WebDAV server for directory '%s'. "
                        + "Server may be incompatible.", path);
            case NETWORK_ERROR:
                return String.format("Network error accessing WebDAV directory '%s'. Check your connection.", path);
            case SERVER_ERROR:
                return String.format("WebDAV server error while scanning directory '%s'%s.", path,
                        httpStatus == null ? "" : " (HTTP " + httpStatus + ")");
            default:
                return String.format("Failed to scan WebDAV directory '%s'. "
                        + "Error will be retried automatically.", path);
        }
    }

    @Override
    public String recommendedAction(SourceScanFailureEntity failure) {
        if (SourceErrorType.TIMEOUT.getCode().equals(failure.getErrorType()) && failure.failureCountOrZero() > 3) {
            return REPEATED_TIMEOUT_ACTION;
        }
        return super.recommendedAction(failure);
    }

    @Override
    protected String recommendedAction(SourceErrorType type, ErrorSeverity severity) {
        switch (type) {
            case PATH_TOO_LONG:
                return "Shorten directory names or reorganize the directory structure.";
            case INVALID_CHARACTERS:
                return "Remove or rename directories with invalid characters.";
            case PERMISSION_DENIED:
                return "Check WebDAV server permissions and authentication credentials.";
            case TOO_MANY_ITEMS:
                return "Split large directories into smaller subdirectories.";
            case XML_PARSE_ERROR:
                return "Check WebDAV server compatibility or contact server administrator.";
            case TIMEOUT:
                if (severity == ErrorSeverity.HIGH) {
                    return REPEATED_TIMEOUT_ACTION;
                }
                break;
            case NETWORK_ERROR:
                return "Check network connectivity to WebDAV server.";
            default:
                break;
        }
        if (severity == ErrorSeverity.CRITICAL) {
            return "Manual intervention required. This error cannot be resolved automatically.";
        }
        return "The system will retry this operation automatically with increasing delays.";
    }

    @Override
    protected void addSourceDiagnostics(ObjectNode node, Throwable error, String errorText, ErrorContext context) {
        if (context.getServerType() != null) {
            node.put("server_type", context.getServerType());
        }
        if (context.getServerVersion() != null) {
            node.put("server_version", context.getServerVersion());
        }
        Matcher matcher = ITEM_COUNT_PATTERN.matcher(errorText);
        if (matcher.find()) {
            try {
                node.put("estimated_item_count", Integer.parseInt(matcher.group(1)));
            } catch (NumberFormatException e) {
                node.put("estimated_item_count_raw", matcher.group(1));
            }
        }
    }
}
