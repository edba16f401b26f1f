package com.example.sourcesync.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum RetryStrategy {

    EXPONENTIAL("exponential"),
    LINEAR("linear"),
    FIXED("fixed");

    private final String code;

    RetryStrategy(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RetryStrategy fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (RetryStrategy value : values()) {
                if (value.code.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Invalid retry strategy: " + code);
    }
}
