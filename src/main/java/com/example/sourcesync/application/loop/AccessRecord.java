package com.example.sourcesync.application.loop;

import java.time.Duration;
import java.time.Instant;
import lombok.Data;

@Data
class AccessRecord {

    private final AccessHandle handle;

    private Instant completedAt;

    private int filesFound;

    private int dirsFound;

    private String error;

    String getPath() {
        return handle.getPath();
    }

    Instant getStartedAt() {
        return handle.getStartedAt();
    }

    Duration duration() {
        return completedAt == null ? Duration.ZERO : Duration.between(handle.getStartedAt(), completedAt);
    }
}
