package com.livebundle.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Aggregated result of one rebuild request.
 *
 * @param sessionId        session the request was for
 * @param triggerFile      workspace-relative file that triggered the rebuild
 * @param status           completed, skipped (dedup) or session missing
 * @param success          true only if the web target compiled
 * @param durationMs       total wall-clock time of the attempt
 * @param totalBundleBytes sum of all successful bundle sizes
 * @param results          one result per target, web first
 */
public record RebuildOutcome(
    String sessionId,
    String triggerFile,
    RebuildStatus status,
    boolean success,
    long durationMs,
    long totalBundleBytes,
    List<BuildResult> results
) implements Serializable {

    public static RebuildOutcome skipped(String sessionId, String triggerFile) {
        return new RebuildOutcome(sessionId, triggerFile, RebuildStatus.SKIPPED_IN_PROGRESS,
                false, 0, 0, List.of());
    }

    public static RebuildOutcome sessionNotFound(String sessionId, String triggerFile) {
        return new RebuildOutcome(sessionId, triggerFile, RebuildStatus.SESSION_NOT_FOUND,
                false, 0, 0, List.of());
    }

    public BuildResult resultFor(String target) {
        return results.stream()
                .filter(r -> r.target().equals(target))
                .findFirst()
                .orElse(null);
    }
}
