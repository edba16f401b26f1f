package com.example.sourcesync.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ErrorSourceType {

    WEBDAV("webdav"),
    S3("s3"),
    LOCAL("local"),
    DROPBOX("dropbox"),
    GDRIVE("gdrive"),
    ONEDRIVE("onedrive");

    private final String code;

    ErrorSourceType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ErrorSourceType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (ErrorSourceType value : values()) {
                if (value.code.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Invalid source type: " + code);
    }
}
