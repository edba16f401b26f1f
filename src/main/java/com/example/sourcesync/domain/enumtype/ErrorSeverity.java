package com.example.sourcesync.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ErrorSeverity {

    LOW("low", 4),
    MEDIUM("medium", 3),
    HIGH("high", 2),
    CRITICAL("critical", 1);

    private final String code;

    /** Lower rank sorts first when ordering retry candidates. */
    private final int rank;

    ErrorSeverity(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getRank() {
        return rank;
    }

    @JsonCreator
    public static ErrorSeverity fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (ErrorSeverity value : values()) {
                if (value.code.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Invalid severity: " + code);
    }
}
