package com.livebundle.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted while a session is edited and rebuilt, used for SSE
 * streaming and CLI watch mode.
 *
 * @param type      one of {@link #FILE_CHANGED}, {@link #REBUILD_STARTED}, {@link #REBUILD_COMPLETED}
 * @param sessionId the session this event belongs to
 * @param payload   type-specific fields (filePath, triggerFile, duration, success, buildResult, error)
 * @param timestamp when the event occurred
 */
public record LiveBundleEvent(
    String type,
    String sessionId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String FILE_CHANGED = "file-changed";
    public static final String REBUILD_STARTED = "rebuild-started";
    public static final String REBUILD_COMPLETED = "rebuild-completed";

    public static LiveBundleEvent of(String type, String sessionId, Map<String, Object> payload) {
        return new LiveBundleEvent(type, sessionId, payload == null ? Map.of() : payload, Instant.now());
    }
}
