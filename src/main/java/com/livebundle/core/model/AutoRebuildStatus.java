package com.livebundle.core.model;

import java.util.List;

/**
 * @param pendingRebuilds sessions with a debounce timer running
 * @param activeRebuilds  sessions currently building
 * @param watchedSessions sessions with a live workspace watcher
 */
public record AutoRebuildStatus(
    boolean enabled,
    long debounceMs,
    List<String> pendingRebuilds,
    List<String> activeRebuilds,
    List<String> watchedSessions
) {}
