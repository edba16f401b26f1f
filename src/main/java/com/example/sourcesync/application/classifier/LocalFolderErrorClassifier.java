package com.example.sourcesync.application.classifier;

import com.example.sourcesync.domain.enumtype.ErrorSeverity;
import com.example.sourcesync.domain.enumtype.ErrorSourceType;
import com.example.sourcesync.domain.enumtype.RetryStrategy;
import com.example.sourcesync.domain.enumtype.SourceErrorType;
import com.example.sourcesync.domain.model.ErrorContext;
import com.example.sourcesync.infrastructure.persistence.entity.SourceScanFailureEntity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.File;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class LocalFolderErrorClassifier extends AbstractSourceErrorClassifier {

    private static final Pattern ERRNO_PATTERN = Pattern.compile("(?i)errno[:\\s]+(\\d+)");
    private static final Pattern NUMERIC_ERROR_PATTERN = Pattern.compile("(?i)error[:\\s]+(\\d+)");

    @Autowired
    public LocalFolderErrorClassifier(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    LocalFolderErrorClassifier(ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
    }

    @Override
    public ErrorSourceType sourceType() {
        return ErrorSourceType.LOCAL;
    }

    @Override
    protected SourceErrorType classifyType(Throwable error, String text, Integer httpStatus) {
        SourceErrorType byNio = classifyNioException(error);
        if (byNio != null) {
            return byNio;
        }
        if (containsAny(text, "permission denied", "access denied")) {
            return SourceErrorType.PERMISSION_DENIED;
        }
        if (containsAny(text, "no such file", "not found", "does not exist")) {
            return SourceErrorType.NOT_FOUND;
        }
        if (containsAny(text, "file name too long", "path too long", "name too long")) {
            return SourceErrorType.PATH_TOO_LONG;
        }
        if (containsAny(text, "invalid filename", "invalid characters", "illegal character")) {
            return SourceErrorType.INVALID_CHARACTERS;
        }
        if (containsAny(text, "too many files", "too many entries")) {
            return SourceErrorType.TOO_MANY_ITEMS;
        }
        if (containsAny(text, "directory not empty", "file exists")) {
            return SourceErrorType.CONFLICT;
        }
        if (containsAny(text, "no space", "disk full", "quota exceeded")) {
            return SourceErrorType.QUOTA_EXCEEDED;
        }
        if (containsAny(text, "file too large", "size limit")) {
            return SourceErrorType.SIZE_LIMIT;
        }
        if (containsAny(text, "too many links", "link count")) {
            return SourceErrorType.DEPTH_LIMIT;
        }
        if (containsAny(text, "device busy", "resource busy")) {
            return SourceErrorType.CONFLICT;
        }
        if (containsAny(text, "operation not supported", "function not implemented")) {
            return SourceErrorType.UNSUPPORTED_OPERATION;
        }
        if (containsAny(text, "timeout", "timed out")) {
            return SourceErrorType.TIMEOUT;
        }
        // network mounts
        if (containsAny(text, "network", "connection")) {
            return SourceErrorType.NETWORK_ERROR;
        }
        return SourceErrorType.UNKNOWN;
    }

    private SourceErrorType classifyNioException(Throwable error) {
        for (Throwable t : causeChain(error)) {
            if (t instanceof AccessDeniedException) {
                return SourceErrorType.PERMISSION_DENIED;
            }
            if (t instanceof NoSuchFileException || t instanceof NotDirectoryException) {
                return SourceErrorType.NOT_FOUND;
            }
            if (t instanceof FileSystemLoopException) {
                return SourceErrorType.DEPTH_LIMIT;
            }
            if (t instanceof FileAlreadyExistsException || t instanceof DirectoryNotEmptyException) {
                return SourceErrorType.CONFLICT;
            }
            if (t instanceof InvalidPathException) {
                return SourceErrorType.INVALID_CHARACTERS;
            }
            if (t instanceof UnsupportedOperationException) {
                return SourceErrorType.UNSUPPORTED_OPERATION;
            }
        }
        return null;
    }

    @Override
    protected ErrorSeverity classifySeverity(SourceErrorType type, String text, Integer httpStatus,
                                             ErrorContext context) {
        String path = context.getResourcePath() == null ? "" : context.getResourcePath();
        switch (type) {
            case PATH_TOO_LONG:
            case INVALID_CHARACTERS:
            case UNSUPPORTED_OPERATION:
                return ErrorSeverity.CRITICAL;
            case PERMISSION_DENIED:
                return isSystemPath(path) ? ErrorSeverity.CRITICAL : ErrorSeverity.HIGH;
            case NOT_FOUND:
                return isNearRoot(path) ? ErrorSeverity.CRITICAL : ErrorSeverity.MEDIUM;
            case QUOTA_EXCEEDED:
            case TOO_MANY_ITEMS:
            case SIZE_LIMIT:
            case DEPTH_LIMIT:
                return ErrorSeverity.HIGH;
            case CONFLICT:
            case TIMEOUT:
            case NETWORK_ERROR:
                return ErrorSeverity.MEDIUM;
            default:
                return ErrorSeverity.LOW;
        }
    }

    @Override
    protected RetryStrategy retryStrategy(SourceErrorType type) {
        switch (type) {
            case NETWORK_ERROR:
                return RetryStrategy.EXPONENTIAL;
            case TIMEOUT:
            case CONFLICT:
                return RetryStrategy.LINEAR;
            default:
                return RetryStrategy.FIXED;
        }
    }

    @Override
    protected int retryDelaySeconds(SourceErrorType type) {
        switch (type) {
            case NETWORK_ERROR:
                return 60;
            case TIMEOUT:
                return 30;
            case CONFLICT:
                return 10;
            case QUOTA_EXCEEDED:
                return 300;
            default:
                return 5;
        }
    }

    /**
     * Local failures are cheap to retry, so high severity gets one extra attempt.
     */
    @Override
    public boolean shouldRetry(SourceScanFailureEntity failure) {
        if (ErrorSeverity.HIGH.getCode().equals(failure.getErrorSeverity())) {
            return failure.failureCountOrZero() < 3;
        }
        return super.shouldRetry(failure);
    }

    @Override
    protected String errorCode(Throwable error, String errorText) {
        String osCode = super.errorCode(error, errorText);
        if (osCode != null && osCode.startsWith("OS_")) {
            return osCode;
        }
        Matcher errno = ERRNO_PATTERN.matcher(errorText);
        if (errno.find()) {
            return "ERRNO_" + errno.group(1);
        }
        Matcher numeric = NUMERIC_ERROR_PATTERN.matcher(errorText);
        if (numeric.find()) {
            return "WIN_" + numeric.group(1);
        }
        return osCode;
    }

    @Override
    protected String userMessage(SourceErrorType type, String path, String errorMessage, Integer httpStatus) {
        switch (type) {
            case NOT_FOUND:
                return String.format("Local path '%s' does not exist. It may have been deleted or moved.", path);
            case PERMISSION_DENIED:
                return String.format("Access denied to local path '%s'. Check file/directory permissions.", path);
            case PATH_TOO_LONG:
                return String.format("Local path '%s' exceeds filesystem limits. "
                        + "Consider shortening the path.", path);
            case INVALID_CHARACTERS:
                return String.format("Local path '%s' contains invalid characters for this filesystem.", path);
            case TOO_MANY_ITEMS:
                return String.format("Directory '%s' contains too many files for efficient processing.", path);
            case QUOTA_EXCEEDED:
                return String.format("Disk quota exceeded for path '%s'. Free up space or increase quota.", path);
            case SIZE_LIMIT:
                return String.format("File '%s' exceeds size limits for processing.", path);
            case CONFLICT:
                return String.format("File or directory conflict at '%s'. Resource may be in use.", path);
            case UNSUPPORTED_OPERATION:
                return String.format("Operation not supported on filesystem for path '%s'.", path);
            case TIMEOUT:
                return String.format("Filesystem operation timed out for path '%s'. "
                        + "This may indicate slow storage.", path);
            case NETWORK_ERROR:
                return String.format("Network filesystem error for path '%s'. Check network connectivity.", path);
            default:
                return String.format("Error accessing local path '%s': %s", path, errorMessage);
        }
    }

    @Override
    protected String recommendedAction(SourceErrorType type, ErrorSeverity severity) {
        switch (type) {
            case NOT_FOUND:
                if (severity == ErrorSeverity.CRITICAL) {
                    return "Verify the base directory path exists and is accessible.";
                }
                break;
            case PERMISSION_DENIED:
                return "Check file/directory permissions and user access rights. "
                        + "Consider running with elevated privileges if appropriate.";
            case PATH_TOO_LONG:
                return "Shorten the path by reorganizing directory structure or using shorter names.";
            case INVALID_CHARACTERS:
                return "Rename files/directories to remove invalid characters for this filesystem.";
            case TOO_MANY_ITEMS:
                return "Consider organizing files into subdirectories or excluding this directory from processing.";
            case QUOTA_EXCEEDED:
                return "Free up disk space or contact administrator to increase quota limits.";
            case SIZE_LIMIT:
                return "Consider excluding large files from processing or splitting them if possible.";
            case UNSUPPORTED_OPERATION:
                return "This filesystem type does not support the required operation.";
            case NETWORK_ERROR:
                return "Check network connection for network filesystem mounts.";
            default:
                break;
        }
        if (severity == ErrorSeverity.CRITICAL) {
            return "Manual intervention required. This filesystem error cannot be resolved automatically.";
        }
        return "Filesystem operations will be retried automatically after a brief delay.";
    }

    @Override
    protected void addSourceDiagnostics(ObjectNode node, Throwable error, String errorText, ErrorContext context) {
        node.put("local_filesystem", true);
        String path = context.getResourcePath() == null ? "" : context.getResourcePath();
        node.put("path_components", path.split(Pattern.quote(File.separator), -1).length);
        String fsType = detectFilesystemType(path);
        if (fsType != null) {
            node.put("filesystem_type", fsType);
        }
        node.put("os_type", osType());
        addFileMetadata(node, path);
    }

    private void addFileMetadata(ObjectNode node, String path) {
        if (path.isEmpty()) {
            return;
        }
        Path file;
        try {
            file = Paths.get(path);
        } catch (InvalidPathException e) {
            return;
        }
        if (!Files.exists(file)) {
            return;
        }
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            node.put("is_directory", attrs.isDirectory());
            node.put("is_file", attrs.isRegularFile());
            node.put("size_bytes", attrs.size());
            if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                node.put("unix_permissions", PosixFilePermissions.toString(Files.getPosixFilePermissions(file)));
            }
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            node.put("metadata_error", e.getClass().getSimpleName());
        }
    }

    static String detectFilesystemType(String path) {
        if (path.startsWith("/proc/")) {
            return "procfs";
        }
        if (path.startsWith("/sys/")) {
            return "sysfs";
        }
        if (path.startsWith("/dev/")) {
            return "devfs";
        }
        if (path.startsWith("/tmp/") || path.startsWith("/var/tmp/")) {
            return "tmpfs";
        }
        if (path.length() >= 3 && path.charAt(1) == ':') {
            return "ntfs";
        }
        return "windows".equals(osType()) ? null : "unix";
    }

    private static String osType() {
        String osName = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (osName.contains("win")) {
            return "windows";
        }
        if (osName.contains("nux") || osName.contains("nix") || osName.contains("mac") || osName.contains("bsd")) {
            return "unix";
        }
        return "unknown";
    }

    private static boolean isSystemPath(String path) {
        return path.startsWith("/etc/") || path.startsWith("/sys/") || path.startsWith("/proc/");
    }

    private static boolean isNearRoot(String path) {
        return path.length() < 10 && path.length() - path.replace("/", "").length() <= 2;
    }
}
