package com.livebundle.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Metadata of a built bundle as it currently sits on disk.
 *
 * @param sessionId    owning session
 * @param target       {@code web} or {@code mobile:<platform>}
 * @param fileName     bundle file name inside the session's output directory
 * @param sizeBytes    bundle size
 * @param modified     last write of the bundle
 * @param hasSourceMap whether a source map was written next to the bundle
 */
public record BundleInfo(
    String sessionId,
    String target,
    String fileName,
    long sizeBytes,
    Instant modified,
    boolean hasSourceMap
) implements Serializable {}
