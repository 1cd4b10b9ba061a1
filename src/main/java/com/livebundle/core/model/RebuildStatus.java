package com.livebundle.core.model;

/**
 * How a rebuild request was resolved by the orchestrator.
 */
public enum RebuildStatus {
    COMPLETED,
    SKIPPED_IN_PROGRESS,   // another build for the same session was running
    SESSION_NOT_FOUND
}
