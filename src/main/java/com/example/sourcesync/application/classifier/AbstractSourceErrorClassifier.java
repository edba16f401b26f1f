package com.example.sourcesync.application.classifier;

import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.RetryStrategy;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.example.sourcesync.domain.model.ErrorClassification;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.sardine.impl.SardineException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Shared pipeline: flatten the cause chain, detect type, derive severity and retry policy,
 * then attach diagnostics. Subclasses only provide the per-source tables.
 */
public abstract class AbstractSourceErrorClassifier implements SourceErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(AbstractSourceErrorClassifier.class);

    private static final int MAX_CAUSE_DEPTH = 10;
    private static final int[] FAST_PATH_STATUS = {404, 401, 403, 500, 502, 503, 504, 405};
    private static final Pattern STATUS_PATTERN = Pattern.compile("\\b([45]\\d{2})\\b");
    private static final Pattern ERROR_CODE_PATTERN = Pattern.compile("(?i:error)[:\\s]+([A-Z][A-Z0-9_]+)\\b");
    private static final Pattern OS_ERROR_PATTERN = Pattern.compile("(?i)os error (\\d+)");

    protected final ObjectMapper objectMapper;
    protected final Clock clock;

    protected AbstractSourceErrorClassifier(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ErrorClassification classify(Throwable error, ErrorContext context) {
        ErrorContext ctx = context == null ? ErrorContext.of("") : context;
        String text = errorText(error);
        String lower = text.toLowerCase(Locale.ROOT);
        Integer httpStatus = extractHttpStatus(error, text);

        SourceErrorType type;
        ErrorSeverity severity;
        try {
            type = classifyType(error, lower, httpStatus);
            severity = classifySeverity(type, lower, httpStatus, ctx);
        } catch (RuntimeException e) {
            log.warn("ERROR_CLASSIFY_FALLBACK source={} path={} reason={}",
                    sourceType().getCode(), ctx.getResourcePath(), e.getMessage());
            type = SourceErrorType.UNKNOWN;
            severity = ErrorSeverity.MEDIUM;
        }

        ErrorClassification classification = new ErrorClassification();
        classification.setErrorType(type);
        classification.setSeverity(severity);
        classification.setRetryStrategy(retryStrategy(type));
        classification.setRetryDelaySeconds(retryDelaySeconds(type));
        classification.setMaxRetries(maxRetries(severity));
        classification.setUserMessage(userMessage(type, ctx.getResourcePath(), text, httpStatus));
        classification.setRecommendedAction(recommendedAction(type, severity));
        classification.setHttpStatusCode(httpStatus);
        classification.setErrorCode(errorCode(error, text));
        classification.setDiagnostics(extractDiagnostics(error, ctx));
        return classification;
    }

    @Override
    public ObjectNode extractDiagnostics(Throwable error, ErrorContext context) {
        ErrorContext ctx = context == null ? ErrorContext.of("") : context;
        ObjectNode node = objectMapper.createObjectNode();
        ArrayNode chain = node.putArray("error_chain");
        for (Throwable t : causeChain(error)) {
            chain.add(describe(t));
        }
        node.put("timestamp", Instant.now(clock).toString());
        node.put("operation", ctx.getOperation());
        node.put("source_type", sourceType().getCode());
        String path = ctx.getResourcePath() == null ? "" : ctx.getResourcePath();
        node.put("path_length", path.length());
        node.put("path_depth", pathDepth(path));
        if (ctx.getResponseTimeMs() != null) {
            node.put("response_time_ms", ctx.getResponseTimeMs());
        }
        if (ctx.getResponseSizeBytes() != null) {
            node.put("response_size_bytes", ctx.getResponseSizeBytes());
        }
        String text = errorText(error);
        Integer status = extractHttpStatus(error, text);
        if (status != null) {
            node.put("http_status", status);
        }
        String errorCode = errorCode(error, text);
        if (errorCode != null) {
            node.put("error_code", errorCode);
        }
        try {
            addSourceDiagnostics(node, error, text, ctx);
        } catch (RuntimeException e) {
            log.debug("ERROR_DIAGNOSTICS_PARTIAL source={} reason={}", sourceType().getCode(), e.getMessage());
        }
        if (!ctx.getAdditionalContext().isEmpty()) {
            ObjectNode extra = node.putObject("context");
            for (Map.Entry<String, String> entry : ctx.getAdditionalContext().entrySet()) {
                extra.put(entry.getKey(), entry.getValue());
            }
        }
        return node;
    }

    @Override
    public String buildUserFriendlyMessage(SourceScanFailureEntity failure) {
        SourceErrorType type = parseType(failure.getErrorType());
        return userMessage(type, failure.getResourcePath(),
                failure.getErrorMessage() == null ? "" : failure.getErrorMessage(), failure.getHttpStatusCode());
    }

    @Override
    public String recommendedAction(SourceScanFailureEntity failure) {
        ErrorSeverity severity;
        try {
            severity = ErrorSeverity.fromCode(failure.getErrorSeverity());
        } catch (IllegalArgumentException e) {
            severity = ErrorSeverity.MEDIUM;
        }
        return recommendedAction(parseType(failure.getErrorType()), severity);
    }

    protected abstract SourceErrorType classifyType(Throwable error, String lowerText, Integer httpStatus);

    protected abstract ErrorSeverity classifySeverity(SourceErrorType type, String lowerText, Integer httpStatus,
                                                      ErrorContext context);

    protected abstract RetryStrategy retryStrategy(SourceErrorType type);

    protected abstract int retryDelaySeconds(SourceErrorType type);

    protected abstract String userMessage(SourceErrorType type, String resourcePath, String errorMessage,
                                          Integer httpStatus);

    protected abstract String recommendedAction(SourceErrorType type, ErrorSeverity severity);

    protected void addSourceDiagnostics(ObjectNode node, Throwable error, String errorText, ErrorContext context) {
    }

    protected int maxRetries(ErrorSeverity severity) {
        switch (severity) {
            case CRITICAL:
                return 1;
            case HIGH:
                return 3;
            case MEDIUM:
                return 5;
            case LOW:
            default:
                return 10;
        }
    }

    protected String errorCode(Throwable error, String errorText) {
        return extractErrorCode(error, errorText);
    }

    /**
     * Well-known JDK network exceptions anywhere in the cause chain.
     */
    protected SourceErrorType classifyByExceptionType(Throwable error) {
        for (Throwable t : causeChain(error)) {
            if (t instanceof SocketTimeoutException) {
                return SourceErrorType.TIMEOUT;
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException) {
                return SourceErrorType.NETWORK_ERROR;
            }
        }
        return null;
    }

    protected static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    protected static int pathDepth(String path) {
        int scheme = path.indexOf("://");
        if (scheme >= 0) {
            int slash = path.indexOf('/', scheme + 3);
            path = slash < 0 ? "" : path.substring(slash);
        }
        int depth = 0;
        for (String part : path.split("/")) {
            if (StringUtils.hasText(part)) {
                depth++;
            }
        }
        return depth;
    }

    protected static String errorText(Throwable error) {
        if (error == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Throwable t : causeChain(error)) {
            String part = describe(t);
            if (sb.indexOf(part) >= 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(": ");
            }
            sb.append(part);
        }
        return sb.toString();
    }

    protected static List<Throwable> causeChain(Throwable error) {
        if (error == null) {
            return Collections.emptyList();
        }
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());
        Throwable current = error;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    static Integer extractHttpStatus(Throwable error, String text) {
        for (Throwable t : causeChain(error)) {
            if (t instanceof SardineException) {
                int status = ((SardineException) t).getStatusCode();
                if (status > 0) {
                    return status;
                }
            }
        }
        if (!StringUtils.hasText(text)) {
            return null;
        }
        for (int code : FAST_PATH_STATUS) {
            if (text.contains(String.valueOf(code))) {
                Matcher exact = Pattern.compile("\\b" + code + "\\b").matcher(text);
                if (exact.find()) {
                    return code;
                }
            }
        }
        Matcher matcher = STATUS_PATTERN.matcher(text);
        if (matcher.find()) {
            return Integer.valueOf(matcher.group(1));
        }
        return null;
    }

    static String extractErrorCode(Throwable error, String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        Matcher osError = OS_ERROR_PATTERN.matcher(text);
        if (osError.find()) {
            return "OS_" + osError.group(1);
        }
        Matcher matcher = ERROR_CODE_PATTERN.matcher(text);
        if (matcher.find()) {
            return matcher.group(1);
        }
        return null;
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return StringUtils.hasText(message) ? message : t.getClass().getSimpleName();
    }

    protected static SourceErrorType parseType(String code) {
        try {
            return SourceErrorType.fromCode(code);
        } catch (IllegalArgumentException e) {
            return SourceErrorType.UNKNOWN;
        }
    }
}
