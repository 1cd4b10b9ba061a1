package com.livebundle.core.build;

import com.livebundle.core.config.LivebundleProperties;
import com.livebundle.core.model.BuildTarget;
import com.livebundle.core.model.BundleInfo;
import com.livebundle.core.model.Session;
import com.livebundle.core.session.SessionNotFoundException;
import com.livebundle.core.session.SessionRegistry;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Read access to the bundles a session's rebuilds have written.
 * <p>
 * Targets are addressed by name: {@code web} or one of the configured mobile platforms.
 * Any other name is rejected, so a request can never resolve outside the session's
 * output directories.
 */
@Service
public class BundleArtifacts {

    private final SessionRegistry sessionRegistry;
    private final LivebundleProperties properties;

    public BundleArtifacts(SessionRegistry sessionRegistry, LivebundleProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.properties = properties;
    }

    /**
     * @throws IllegalArgumentException if the name is neither {@code web} nor a configured platform
     */
    public BuildTarget resolveTarget(String name) {
        if (BuildTarget.WEB.equals(name)) {
            return BuildTarget.web();
        }
        if (name != null && properties.getPlatforms().contains(name)) {
            return BuildTarget.mobile(name);
        }
        throw new IllegalArgumentException("Unknown build target: " + name);
    }

    /**
     * @throws SessionNotFoundException if the session is unknown
     */
    public Optional<Path> bundle(String sessionId, BuildTarget target) {
        Path bundle = BuildOrchestrator.bundlePath(session(sessionId), target);
        return Files.isRegularFile(bundle) ? Optional.of(bundle) : Optional.empty();
    }

    public Optional<Path> sourceMap(String sessionId, BuildTarget target) {
        Path bundle = BuildOrchestrator.bundlePath(session(sessionId), target);
        Path map = sourceMapOf(bundle);
        return Files.isRegularFile(map) ? Optional.of(map) : Optional.empty();
    }

    public Optional<BundleInfo> info(String sessionId, BuildTarget target) {
        return bundle(sessionId, target).map(bundle -> {
            try {
                return new BundleInfo(sessionId, target.toString(), bundle.getFileName().toString(),
                        Files.size(bundle), Files.getLastModifiedTime(bundle).toInstant(),
                        Files.isRegularFile(sourceMapOf(bundle)));
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read bundle " + bundle, e);
            }
        });
    }

    static Path sourceMapOf(Path bundle) {
        return bundle.resolveSibling(bundle.getFileName() + ".map");
    }

    private Session session(String sessionId) {
        return sessionRegistry.resolveSession(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
