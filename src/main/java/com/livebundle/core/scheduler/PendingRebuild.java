package com.livebundle.core.scheduler;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * A debounced rebuild waiting for its timer. Identity matters: the timer only fires the
 * rebuild if this exact instance is still the session's pending entry.
 */
public final class PendingRebuild {

    private final String sessionId;
    private final String triggerFilePath;
    private final Instant scheduledAt;
    private volatile ScheduledFuture<?> future;

    PendingRebuild(String sessionId, String triggerFilePath, Instant scheduledAt) {
        this.sessionId = sessionId;
        this.triggerFilePath = triggerFilePath;
        this.scheduledAt = scheduledAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public String triggerFilePath() {
        return triggerFilePath;
    }

    public Instant scheduledAt() {
        return scheduledAt;
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    boolean cancel() {
        var f = future;
        return f != null && f.cancel(false);
    }
}
