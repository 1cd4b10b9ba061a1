package com.livebundle.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A single file change inside a session workspace. Never persisted.
 *
 * @param sessionId    owning session
 * @param kind         create, modify or delete
 * @param relativePath path relative to the workspace root, always '/'-separated
 * @param absolutePath absolute path of the changed file
 * @param timestamp    when the watcher observed the change
 */
public record ChangeEvent(
    String sessionId,
    ChangeKind kind,
    String relativePath,
    Path absolutePath,
    Instant timestamp
) {}
