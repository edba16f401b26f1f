package com.example.sourcesync.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Normalized failure taxonomy shared by every source type.
 */
public enum SourceErrorType {

    TIMEOUT("timeout"),
    PERMISSION_DENIED("permission_denied"),
    NETWORK_ERROR("network_error"),
    SERVER_ERROR("server_error"),
    PATH_TOO_LONG("path_too_long"),
    INVALID_CHARACTERS("invalid_characters"),
    TOO_MANY_ITEMS("too_many_items"),
    DEPTH_LIMIT("depth_limit"),
    SIZE_LIMIT("size_limit"),
    XML_PARSE_ERROR("xml_parse_error"),
    JSON_PARSE_ERROR("json_parse_error"),
    QUOTA_EXCEEDED("quota_exceeded"),
    RATE_LIMITED("rate_limited"),
    NOT_FOUND("not_found"),
    CONFLICT("conflict"),
    UNSUPPORTED_OPERATION("unsupported_operation"),
    UNKNOWN("unknown");

    private final String code;

    SourceErrorType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static SourceErrorType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (SourceErrorType value : values()) {
                if (value.code.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Invalid error type: " + code);
    }
}
