package com.example.sourcesync.application.loop;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public final class AccessHandle {

    private final UUID id;
    private final String path;
    private final String scanLabel;
    private final Instant startedAt;
    private final boolean tracked;

    AccessHandle(UUID id, String path, String scanLabel, Instant startedAt, boolean tracked) {
        this.id = id;
        this.path = path;
        this.scanLabel = scanLabel;
        this.startedAt = startedAt;
        this.tracked = tracked;
    }

    public UUID getId() {
        return id;
    }

    public String getPath() {
        return path;
    }

    public String getScanLabel() {
        return scanLabel;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /** False for handles issued while detection was disabled. */
    public boolean isTracked() {
        return tracked;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccessHandle)) {
            return false;
        }
        return id.equals(((AccessHandle) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AccessHandle{id=" + id + ", path='" + path + "', scanLabel='" + scanLabel + "'}";
    }
}
