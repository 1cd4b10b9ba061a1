package com.livebundle.core.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.io.Serializable;
import java.nio.file.Path;
import java.time.Instant;

/**
 * An isolated copy of a source workspace undergoing live editing.
 *
 * @param sessionId     unique, immutable id ({@code session-<epochMillis>-<suffix>})
 * @param sessionPath   root directory owned by this session
 * @param workspacePath editable source tree ({@code sessionPath/workspace})
 * @param startTime     when the session was created
 * @param lastModified  last time a change was observed in the workspace
 */
public record Session(
    String sessionId,
    @JsonSerialize(using = ToStringSerializer.class) Path sessionPath,
    @JsonSerialize(using = ToStringSerializer.class) Path workspacePath,
    Instant startTime,
    Instant lastModified
) implements Serializable {

    public static final String WORKSPACE_DIR = "workspace";
    public static final String WEB_OUTPUT_DIR = "dist";
    public static final String MOBILE_OUTPUT_DIR = "mobile-dist";

    /** Web build output directory. */
    public Path distPath() {
        return sessionPath.resolve(WEB_OUTPUT_DIR);
    }

    /** Mobile bundle output directory (one bundle + map per platform). */
    public Path mobileDistPath() {
        return sessionPath.resolve(MOBILE_OUTPUT_DIR);
    }

    public Session withLastModified(Instant lastModified) {
        return new Session(sessionId, sessionPath, workspacePath, startTime, lastModified);
    }
}
