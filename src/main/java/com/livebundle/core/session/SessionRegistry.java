package com.livebundle.core.session;

import com.livebundle.core.config.LivebundleProperties;
import com.livebundle.core.metrics.LivebundleMetrics;
import com.livebundle.core.model.Session;
import com.livebundle.core.model.SessionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Authoritative table of live-editing sessions and their directories.
 * <p>
 * Every session owns {@code {root}/{sessionId}/}, with the editable copy of the
 * template under {@code workspace/}. The in-memory table is reconciled with disk:
 * sessions whose workspace vanished are pruned on listing, and sessions present on
 * disk but unknown in memory (after a restart) are rehydrated on lookup.
 * <p>
 * Structural operations ({@link #createSession}, {@link #removeSession}) are expected
 * to run under the {@link WorkspaceMutex}; lookups are lock-free.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    /** Sibling directory of the template holding shared UI components. */
    static final String SHARED_COMPONENTS_DIR = "~";

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

    private final Path sessionsRoot;
    private final List<PathMatcher> copyExcludes;
    private final boolean copySharedComponents;
    private final LivebundleMetrics metrics;
    private final ActiveBuildGuard activeBuildGuard;

    @Autowired
    public SessionRegistry(LivebundleProperties properties,
                           LivebundleMetrics metrics,
                           ObjectProvider<ActiveBuildGuard> activeBuildGuard) {
        this(Path.of(properties.getSessionsRoot()),
                properties.getCopyExcludes(),
                properties.isCopySharedComponents(),
                metrics,
                sessionId -> {
                    var guard = activeBuildGuard.getIfAvailable();
                    return guard != null && guard.isBuilding(sessionId);
                });
    }

    public SessionRegistry(Path sessionsRoot, List<String> copyExcludes, boolean copySharedComponents,
                           LivebundleMetrics metrics, ActiveBuildGuard activeBuildGuard) {
        this.sessionsRoot = sessionsRoot.toAbsolutePath().normalize();
        this.copyExcludes = copyExcludes.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
        this.copySharedComponents = copySharedComponents;
        this.metrics = metrics;
        this.activeBuildGuard = activeBuildGuard;
    }

    public Path getSessionsRoot() {
        return sessionsRoot;
    }

    /**
     * Creates a new session by copying the template tree into a fresh workspace.
     *
     * @param templateSourcePath directory to copy
     * @return the registered session
     * @throws SessionCreationException if the template is missing or the copy fails;
     *                                  the partial session directory is removed
     */
    public Session createSession(Path templateSourcePath) {
        if (templateSourcePath == null || !Files.isDirectory(templateSourcePath)) {
            throw new SessionCreationException("Template directory not found: " + templateSourcePath);
        }

        String sessionId = allocateSessionId();
        Path sessionPath = sessionsRoot.resolve(sessionId);
        Path workspacePath = sessionPath.resolve(Session.WORKSPACE_DIR);

        try {
            Files.createDirectories(workspacePath);
            copyTree(templateSourcePath, workspacePath);
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to create session {} from {}", sessionId, templateSourcePath, e);
            try {
                deleteDirectory(sessionPath);
            } catch (UncheckedIOException cleanupError) {
                log.warn("Could not remove partial session directory {}: {}",
                        sessionPath, cleanupError.getMessage());
            }
            throw new SessionCreationException("Failed to create session workspace: " + e.getMessage(), e);
        }

        if (copySharedComponents) {
            copySharedComponents(templateSourcePath, workspacePath);
        }

        var now = Instant.now();
        var session = new Session(sessionId, sessionPath, workspacePath,
                SessionIds.creationTime(sessionId).orElse(now), now);
        sessions.put(sessionId, session);
        metrics.recordSessionCreated();
        log.info("Created session {} at {}", sessionId, sessionPath);
        return session;
    }

    /** In-memory lookup only. */
    public Session getSession(String sessionId) {
        return sessionId == null ? null : sessions.get(sessionId);
    }

    /**
     * Rehydrates a session that exists on disk but not in memory and registers it.
     *
     * @return the session, or {@code null} if the id is malformed or no workspace exists
     */
    public Session loadSessionFromFilesystem(String sessionId) {
        if (!SessionIds.isValid(sessionId)) {
            log.debug("Refusing to load malformed session id {}", sessionId);
            return null;
        }
        Path sessionPath = sessionsRoot.resolve(sessionId);
        Path workspacePath = sessionPath.resolve(Session.WORKSPACE_DIR);
        if (!Files.isDirectory(workspacePath)) {
            return null;
        }

        Instant lastModified;
        try {
            lastModified = Files.getLastModifiedTime(workspacePath).toInstant();
        } catch (IOException e) {
            log.warn("Could not read modification time of {}: {}", workspacePath, e.getMessage());
            lastModified = Instant.now();
        }
        var loaded = new Session(sessionId, sessionPath, workspacePath,
                SessionIds.creationTime(sessionId).orElse(lastModified), lastModified);
        var existing = sessions.putIfAbsent(sessionId, loaded);
        if (existing != null) {
            return existing;
        }
        log.info("Loaded session {} from filesystem", sessionId);
        return loaded;
    }

    /**
     * Memory first, then filesystem fallback.
     */
    public Optional<Session> resolveSession(String sessionId) {
        var session = getSession(sessionId);
        if (session != null) {
            return Optional.of(session);
        }
        return Optional.ofNullable(loadSessionFromFilesystem(sessionId));
    }

    /**
     * All sessions, newest first. Sessions whose workspace directory no longer exists
     * are dropped from the table and omitted.
     */
    public List<Session> listSessions() {
        var alive = new ArrayList<Session>();
        for (var session : sessions.values()) {
            if (Files.isDirectory(session.workspacePath())) {
                alive.add(session);
            } else if (sessions.remove(session.sessionId(), session)) {
                log.info("Pruned session {}: workspace {} no longer exists",
                        session.sessionId(), session.workspacePath());
            }
        }
        alive.sort(Comparator.comparing(Session::startTime).reversed());
        return alive;
    }

    /**
     * Registers every well-formed session directory found under the sessions root.
     *
     * @return number of sessions loaded
     */
    public int loadExistingSessions() {
        if (!Files.isDirectory(sessionsRoot)) {
            log.debug("Sessions root {} does not exist yet", sessionsRoot);
            return 0;
        }
        int loaded = 0;
        try (Stream<Path> children = Files.list(sessionsRoot)) {
            for (Path child : children.toList()) {
                String name = child.getFileName().toString();
                if (SessionIds.isValid(name) && !sessions.containsKey(name)
                        && loadSessionFromFilesystem(name) != null) {
                    loaded++;
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan sessions root {}: {}", sessionsRoot, e.getMessage());
        }
        log.info("Loaded {} existing session(s) from {}", loaded, sessionsRoot);
        return loaded;
    }

    public Optional<Session> getMostRecentSession() {
        return listSessions().stream().findFirst();
    }

    /**
     * Deletes a session's directory and drops its record.
     *
     * @return the removed session
     * @throws SessionBusyException     if a build is running for the session
     * @throws SessionNotFoundException if the session is unknown in memory and on disk
     */
    public Session removeSession(String sessionId) {
        var session = resolveSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (activeBuildGuard.isBuilding(sessionId)) {
            throw new SessionBusyException(sessionId);
        }

        deleteDirectory(session.sessionPath());
        sessions.remove(sessionId);
        metrics.recordSessionRemoved();
        log.info("Removed session {}", sessionId);
        return session;
    }

    /**
     * Removes every session without a running build.
     *
     * @return ids of the sessions that were skipped because they were building
     */
    public List<String> removeAllSessions() {
        var skipped = new ArrayList<String>();
        for (var session : listSessions()) {
            try {
                removeSession(session.sessionId());
            } catch (SessionBusyException e) {
                log.info("Skipping cleanup of {}: build in progress", session.sessionId());
                skipped.add(session.sessionId());
            }
        }
        return skipped;
    }

    public boolean isBuilding(String sessionId) {
        return activeBuildGuard.isBuilding(sessionId);
    }

    /** Records that a change was observed in the session's workspace. */
    public void touch(String sessionId) {
        sessions.computeIfPresent(sessionId, (id, session) -> session.withLastModified(Instant.now()));
    }

    public SessionStats getStats() {
        var all = listSessions();
        if (all.isEmpty()) {
            return new SessionStats(0, List.of(), null, null, 0);
        }
        long now = System.currentTimeMillis();
        long totalAge = 0;
        for (var session : all) {
            totalAge += now - session.startTime().toEpochMilli();
        }
        return new SessionStats(
                all.size(),
                all.stream().map(Session::sessionId).toList(),
                all.get(all.size() - 1).sessionId(),
                all.get(0).sessionId(),
                totalAge / all.size());
    }

    private String allocateSessionId() {
        String sessionId = SessionIds.generate();
        while (sessions.containsKey(sessionId) || Files.exists(sessionsRoot.resolve(sessionId))) {
            sessionId = SessionIds.generate();
        }
        return sessionId;
    }

    private void copySharedComponents(Path templateSourcePath, Path workspacePath) {
        Path parent = templateSourcePath.toAbsolutePath().normalize().getParent();
        if (parent == null) {
            return;
        }
        Path shared = parent.resolve(SHARED_COMPONENTS_DIR);
        if (!Files.isDirectory(shared)) {
            return;
        }
        try {
            copyTree(shared, workspacePath.resolve(SHARED_COMPONENTS_DIR));
            log.debug("Copied shared components from {}", shared);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not copy shared components from {}: {}", shared, e.getMessage());
        }
    }

    boolean isExcluded(Path relativeOrName) {
        Path name = relativeOrName.getFileName();
        if (name == null) {
            return false;
        }
        for (PathMatcher matcher : copyExcludes) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    private void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(source) && isExcluded(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (!isExcluded(file)) {
                    Files.copy(file, target.resolve(source.relativize(file).toString()),
                            StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    static void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (var walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + dir, e);
        }
    }
}
