package com.livebundle.core.model;

import java.util.List;

/**
 * @param removed sessions deleted
 * @param skipped sessions kept because a build was running or deletion failed
 */
public record CleanupReport(List<String> removed, List<String> skipped) {}
