package com.livebundle.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Snapshot of the session registry.
 *
 * @param averageAgeMs mean age of the registered sessions, 0 when there are none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStats(
    int totalSessions,
    List<String> sessionIds,
    String oldestSession,
    String newestSession,
    long averageAgeMs
) {}
