package com.livebundle.core.model;

import java.time.Instant;

/**
 * Marker for a build currently executing for a session.
 */
public record ActiveBuild(
    String sessionId,
    Instant startTime,
    String triggerFilePath
) {}
