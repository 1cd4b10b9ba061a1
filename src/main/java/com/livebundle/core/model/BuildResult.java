package com.livebundle.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Outcome of compiling one target during one rebuild attempt.
 *
 * @param sessionId       session that was built
 * @param target          {@code web} or {@code mobile:<platform>}
 * @param outputPath      bundle written to disk (null on failure)
 * @param sourceMapPath   source map written next to the bundle (nullable)
 * @param bundleSizeBytes size of the bundle in bytes, 0 on failure
 * @param durationMs      wall-clock time spent on this target
 * @param success         whether the target compiled
 * @param error           failure message (null on success)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BuildResult(
    String sessionId,
    String target,
    String outputPath,
    String sourceMapPath,
    long bundleSizeBytes,
    long durationMs,
    boolean success,
    String error
) implements Serializable {

    public static BuildResult succeeded(String sessionId, BuildTarget target, String outputPath,
                                        String sourceMapPath, long bundleSizeBytes, long durationMs) {
        return new BuildResult(sessionId, target.toString(), outputPath, sourceMapPath,
                bundleSizeBytes, durationMs, true, null);
    }

    public static BuildResult failed(String sessionId, BuildTarget target, long durationMs, String error) {
        return new BuildResult(sessionId, target.toString(), null, null, 0, durationMs, false, error);
    }
}
