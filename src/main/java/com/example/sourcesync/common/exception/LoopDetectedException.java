package com.example.sourcesync.common.exception;

import com.example.sourcesync.domain.enumtype.LoopType;
import java.util.Collections;
import java.util.List;

/**
 * Raised by the loop detector when an access is rejected. The path was not registered,
 * so the caller skips it for this round and must not call complete.
 */
public class LoopDetectedException extends RuntimeException {

    private final LoopType loopType;
    private final String path;
    private final List<String> recommendations;
    private final Long elapsedMs;
    private final Integer accessCount;

    public LoopDetectedException(LoopType loopType, String path, String message, List<String> recommendations) {
        this(loopType, path, message, recommendations, null, null);
    }

    public LoopDetectedException(LoopType loopType,
                                 String path,
                                 String message,
                                 List<String> recommendations,
                                 Long elapsedMs,
                                 Integer accessCount) {
        super(message);
        this.loopType = loopType;
        this.path = path;
        this.recommendations = recommendations == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(recommendations);
        this.elapsedMs = elapsedMs;
        this.accessCount = accessCount;
    }

    public LoopType getLoopType() {
        return loopType;
    }

    public String getPath() {
        return path;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    /** Time since the previous completion, set for {@link LoopType#TOO_SOON}. */
    public Long getElapsedMs() {
        return elapsedMs;
    }

    /** Accesses already inside the window, set for {@link LoopType#TOO_FREQUENT}. */
    public Integer getAccessCount() {
        return accessCount;
    }
}
