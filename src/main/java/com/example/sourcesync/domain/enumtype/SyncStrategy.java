package com.example.sourcesync.domain.enumtype;

public enum SyncStrategy {
    FULL_DEEP_SCAN,
    TARGETED_SCAN
}
