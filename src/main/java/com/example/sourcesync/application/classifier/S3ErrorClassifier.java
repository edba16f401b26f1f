package com.example.sourcesync.application.classifier;

import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.enumtype.RetryStrategy;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.example.sourcesync.domain.model.ErrorContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Classifies AWS S3 failures from the error codes the SDK puts into exception messages,
 * e.g. {@code NoSuchBucket}, {@code SlowDown}, {@code SignatureDoesNotMatch}.
 */
@Component
public class S3ErrorClassifier extends AbstractSourceErrorClassifier {

    private static final Pattern AWS_CODE_PATTERN = Pattern.compile("(?i)(NoSuchBucket|NoSuchKey|AccessDenied"
            + "|InvalidBucketName|RequestTimeout|Throttling|SlowDown|ServiceUnavailable|InternalError"
            + "|InvalidSecurity|SignatureMismatch|QuotaExceeded|EntityTooLarge)");
    private static final Pattern STATUS_CODE_PATTERN = Pattern.compile("(?i)status[:\\s]+(\\d{3})");
    private static final Pattern BUCKET_PATTERN = Pattern.compile("(?i)bucket[:\\s]+([a-z0-9.-]+)");
    private static final Pattern REGION_PATTERN = Pattern.compile("(?i)region[:\\s]+([a-z0-9-]+)");

    @Autowired
    public S3ErrorClassifier(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    S3ErrorClassifier(ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
    }

    @Override
    public ErrorSourceType sourceType() {
        return ErrorSourceType.S3;
    }

    @Override
    protected SourceErrorType classifyType(Throwable error, String text, Integer httpStatus) {
        if (containsAny(text, "nosuchbucket", "no such bucket", "nosuchkey", "no such key")) {
            return SourceErrorType.NOT_FOUND;
        }
        if (containsAny(text, "accessdenied", "access denied")) {
            return SourceErrorType.PERMISSION_DENIED;
        }
        if (containsAny(text, "invalidbucketname", "invalid bucket name")) {
            return SourceErrorType.INVALID_CHARACTERS;
        }
        SourceErrorType byException = classifyByExceptionType(error);
        if (byException != null) {
            return byException;
        }
        if (containsAny(text, "requesttimeout", "timeout", "timed out")) {
            return SourceErrorType.TIMEOUT;
        }
        if (containsAny(text, "slowdown", "slow down", "throttling")) {
            return SourceErrorType.RATE_LIMITED;
        }
        if (containsAny(text, "serviceunavailable", "service unavailable", "internalerror", "internal error")) {
            return SourceErrorType.SERVER_ERROR;
        }
        if (containsAny(text, "invalidsecurity", "signaturemismatch", "signaturedoesnotmatch")) {
            return SourceErrorType.PERMISSION_DENIED;
        }
        if (containsAny(text, "quotaexceeded", "quota exceeded")) {
            return SourceErrorType.QUOTA_EXCEEDED;
        }
        if (containsAny(text, "entitytoolarge", "too large")) {
            return SourceErrorType.SIZE_LIMIT;
        }
        if (containsAny(text, "network", "connection")) {
            return SourceErrorType.NETWORK_ERROR;
        }
        if (containsAny(text, "json", "xml", "parse")) {
            return SourceErrorType.JSON_PARSE_ERROR;
        }
        if (text.contains("conflict")) {
            return SourceErrorType.CONFLICT;
        }
        if (containsAny(text, "unsupported", "not implemented")) {
            return SourceErrorType.UNSUPPORTED_OPERATION;
        }
        return SourceErrorType.UNKNOWN;
    }

    @Override
    protected ErrorSeverity classifySeverity(SourceErrorType type, String text, Integer httpStatus,
                                             ErrorContext context) {
        switch (type) {
            case NOT_FOUND:
                return isBucketLevel(text, context.getResourcePath())
                        ? ErrorSeverity.CRITICAL : ErrorSeverity.MEDIUM;
            case INVALID_CHARACTERS:
            case UNSUPPORTED_OPERATION:
                return ErrorSeverity.CRITICAL;
            case PERMISSION_DENIED:
            case QUOTA_EXCEEDED:
            case SIZE_LIMIT:
                return ErrorSeverity.HIGH;
            case RATE_LIMITED:
            case NETWORK_ERROR:
                return ErrorSeverity.LOW;
            default:
                return ErrorSeverity.MEDIUM;
        }
    }

    @Override
    protected RetryStrategy retryStrategy(SourceErrorType type) {
        return type == SourceErrorType.NETWORK_ERROR ? RetryStrategy.LINEAR : RetryStrategy.EXPONENTIAL;
    }

    @Override
    protected int retryDelaySeconds(SourceErrorType type) {
        switch (type) {
            case RATE_LIMITED:
                return 1200;
            case NETWORK_ERROR:
                return 30;
            case SERVER_ERROR:
                return 180;
            case TIMEOUT:
            default:
                return 300;
        }
    }

    @Override
    protected int maxRetries(ErrorSeverity severity) {
        return severity == ErrorSeverity.HIGH ? 2 : super.maxRetries(severity);
    }

    @Override
    protected String errorCode(Throwable error, String errorText) {
        Matcher aws = AWS_CODE_PATTERN.matcher(errorText);
        if (aws.find()) {
            return aws.group(1);
        }
        Matcher status = STATUS_CODE_PATTERN.matcher(errorText);
        if (status.find()) {
            return "HTTP_" + status.group(1);
        }
        return super.errorCode(error, errorText);
    }

    @Override
    protected String userMessage(SourceErrorType type, String path, String errorMessage, Integer httpStatus) {
        switch (type) {
            case NOT_FOUND:
                if (isBucketLevel(errorMessage.toLowerCase(Locale.ROOT), path)) {
                    return String.format("S3 bucket for path '%s' does not exist or is not accessible.", path);
                }
                return String.format("S3 object '%s' was not found. It may have been deleted or moved.", path);
            case PERMISSION_DENIED:
                return String.format("Access denied to S3 resource '%s'. "
                        + "Check your AWS credentials and bucket permissions.", path);
            case INVALID_CHARACTERS:
                return String.format("S3 path '%s' contains invalid characters. "
                        + "Please use valid S3 key naming conventions.", path);
            case QUOTA_EXCEEDED:
                return "AWS quota exceeded for S3 operations. Please check your AWS service limits.";
            case RATE_LIMITED:
                return "S3 requests are being rate limited. Operations will be retried with exponential backoff.";
            case TIMEOUT:
                return String.format("S3 request for '%s' timed out. "
                        + "This may be due to large object size or network issues.", path);
            case NETWORK_ERROR:
                return String.format("Network error accessing S3 resource '%s'. "
                        + "Check your internet connection.", path);
            case SERVER_ERROR:
                return String.format("AWS S3 service error for resource '%s'. This is usually temporary.", path);
            case SIZE_LIMIT:
                return String.format("S3 object '%s' exceeds size limits for processing.", path);
            default:
                return String.format("Error accessing S3 resource '%s': %s", path, errorMessage);
        }
    }

    @Override
    protected String recommendedAction(SourceErrorType type, ErrorSeverity severity) {
        switch (type) {
            case NOT_FOUND:
                if (severity == ErrorSeverity.CRITICAL) {
                    return "Verify the S3 bucket name and region configuration.";
                }
                break;
            case PERMISSION_DENIED:
                return "Check AWS IAM permissions and S3 bucket policies. Ensure read access is granted.";
            case INVALID_CHARACTERS:
                return "Rename S3 objects to use valid characters and naming conventions.";
            case QUOTA_EXCEEDED:
                return "Contact AWS support to increase service limits or reduce usage.";
            case RATE_LIMITED:
                return "Reduce request rate or enable request throttling. Will retry automatically.";
            case SIZE_LIMIT:
                return "Consider splitting large objects or excluding them from processing.";
            case NETWORK_ERROR:
                return "Check network connectivity to AWS S3 endpoints.";
            default:
                break;
        }
        if (severity == ErrorSeverity.CRITICAL) {
            return "Manual intervention required. This S3 error cannot be resolved automatically.";
        }
        return "S3 operations will be retried automatically with appropriate delays.";
    }

    @Override
    protected void addSourceDiagnostics(ObjectNode node, Throwable error, String errorText, ErrorContext context) {
        node.put("s3_specific", true);
        Matcher bucket = BUCKET_PATTERN.matcher(errorText);
        if (bucket.find()) {
            node.put("bucket_name", bucket.group(1));
        }
        Matcher region = REGION_PATTERN.matcher(errorText);
        if (region.find()) {
            node.put("aws_region", region.group(1));
        }
        String key = context.getResourcePath() == null ? "" : context.getResourcePath();
        node.put("key_length", key.length());
        node.put("key_depth", key.length() - key.replace("/", "").length());
    }

    private static boolean isBucketLevel(String lowerText, String resourcePath) {
        if (lowerText.contains("bucket")) {
            return true;
        }
        return resourcePath != null && resourcePath.toLowerCase(Locale.ROOT).contains("bucket");
    }
}
