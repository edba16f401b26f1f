package com.example.sourcesync.domain.model;

import com.example.sourcesync.domain.enumtype.SyncStrategy;
import java.util.Collections;
import java.util.List;

public final class SyncDecision {

    private static final SyncDecision SKIP = new SyncDecision(true, null, Collections.<String>emptyList());
    private static final SyncDecision FULL = new SyncDecision(false, SyncStrategy.FULL_DEEP_SCAN,
            Collections.<String>emptyList());

    private final boolean skip;
    private final SyncStrategy strategy;
    private final List<String> targetDirectories;

    private SyncDecision(boolean skip, SyncStrategy strategy, List<String> targetDirectories) {
        this.skip = skip;
        this.strategy = strategy;
        this.targetDirectories = targetDirectories;
    }

    public static SyncDecision skip() {
        return SKIP;
    }

    public static SyncDecision fullDeepScan() {
        return FULL;
    }

    public static SyncDecision targeted(List<String> directories) {
        return new SyncDecision(false, SyncStrategy.TARGETED_SCAN, Collections.unmodifiableList(directories));
    }

    public boolean isSkip() {
        return skip;
    }

    public SyncStrategy getStrategy() {
        return strategy;
    }

    public List<String> getTargetDirectories() {
        return targetDirectories;
    }

    @Override
    public String toString() {
        if (skip) {
            return "SKIP";
        }
        return strategy == SyncStrategy.TARGETED_SCAN ? "TARGETED_SCAN" + targetDirectories : strategy.name();
    }
}
