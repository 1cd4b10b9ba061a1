package com.livebundle.core.session;

import com.livebundle.core.build.BuildOrchestrator;
import com.livebundle.core.config.LivebundleProperties;
import com.livebundle.core.model.CleanupReport;
import com.livebundle.core.model.Session;
import com.livebundle.core.scheduler.AutoRebuildService;
import com.livebundle.core.scheduler.RebuildScheduler;
import com.livebundle.core.watch.WorkspaceWatcherService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Structural session operations behind the control endpoints: create, sync and cleanup.
 * <p>
 * Every operation holds the {@link WorkspaceMutex} for its whole duration so session
 * directories, watchers and the {@link SessionContext} pointer change together.
 */
@Service
public class SessionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);

    static final String INITIAL_TRIGGER = "initial";

    private final SessionRegistry sessionRegistry;
    private final WorkspaceMutex mutex;
    private final SessionContext sessionContext;
    private final WorkspaceWatcherService watcherService;
    private final RebuildScheduler scheduler;
    private final AutoRebuildService autoRebuildService;
    private final BuildOrchestrator orchestrator;
    private final LivebundleProperties properties;

    public SessionLifecycleService(SessionRegistry sessionRegistry,
                                   WorkspaceMutex mutex,
                                   SessionContext sessionContext,
                                   WorkspaceWatcherService watcherService,
                                   RebuildScheduler scheduler,
                                   AutoRebuildService autoRebuildService,
                                   BuildOrchestrator orchestrator,
                                   LivebundleProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.mutex = mutex;
        this.sessionContext = sessionContext;
        this.watcherService = watcherService;
        this.scheduler = scheduler;
        this.autoRebuildService = autoRebuildService;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    /**
     * Creates a session from {@code templatePath} (or the configured template when null),
     * starts watching it and makes it the current session.
     *
     * @throws SessionCreationException       if the workspace cannot be created
     * @throws WorkspaceMutexTimeoutException if another structural operation holds the mutex too long
     */
    public Session create(Path templatePath) {
        Path template = templatePath != null ? templatePath : Path.of(properties.getTemplateDir());
        Session session = mutex.withLock(() -> {
            var created = sessionRegistry.createSession(template);
            try {
                watcherService.startWatching(created, autoRebuildService::onFileChange);
            } catch (UncheckedIOException e) {
                log.warn("Session {} created but its workspace is not watched: {}",
                        created.sessionId(), e.getMessage());
            }
            sessionContext.setCurrent(created.sessionId());
            return created;
        });

        if (properties.isInitialBuild()) {
            orchestrator.submitRebuild(session.sessionId(), INITIAL_TRIGGER)
                    .whenComplete((outcome, error) -> {
                        if (error != null) {
                            log.warn("Initial build of session {} failed: {}", session.sessionId(), error.getMessage());
                        }
                    });
        }
        return session;
    }

    /**
     * Makes an existing session current and (re)starts its watcher.
     *
     * @throws SessionNotFoundException if the session is unknown in memory and on disk
     */
    public Session sync(String sessionId) {
        return mutex.withLock(() -> {
            var session = sessionRegistry.resolveSession(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            watcherService.startWatching(session, autoRebuildService::onFileChange);
            sessionContext.setCurrent(sessionId);
            log.info("Synced to session {}", sessionId);
            return session;
        });
    }

    /**
     * Stops watching a session and deletes it.
     *
     * @throws SessionNotFoundException if the session is unknown
     * @throws SessionBusyException     if a build for the session is running
     */
    public Session cleanup(String sessionId) {
        return mutex.withLock(() -> {
            var session = sessionRegistry.resolveSession(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            if (orchestrator.isBuilding(sessionId)) {
                throw new SessionBusyException(sessionId);
            }
            scheduler.cancel(sessionId);
            watcherService.stopWatching(sessionId);
            sessionRegistry.removeSession(sessionId);
            sessionContext.clearIfCurrent(sessionId);
            return session;
        });
    }

    /**
     * Deletes every session that is not building. Building sessions are kept, reported as
     * skipped, and keep their watcher and pending rebuild. Watchers of sessions whose
     * workspace is already gone are stopped as well.
     */
    public CleanupReport cleanupAll() {
        return mutex.withLock(() -> {
            var removed = new ArrayList<String>();
            var skipped = new ArrayList<String>();
            for (var session : sessionRegistry.listSessions()) {
                String id = session.sessionId();
                if (orchestrator.isBuilding(id)) {
                    skipped.add(id);
                    continue;
                }
                scheduler.cancel(id);
                boolean wasWatching = watcherService.stopWatching(id);
                try {
                    sessionRegistry.removeSession(id);
                    removed.add(id);
                    sessionContext.clearIfCurrent(id);
                } catch (SessionBusyException e) {
                    skipped.add(id);
                    if (wasWatching) {
                        rewatch(session);
                    }
                } catch (UncheckedIOException e) {
                    log.error("Failed to remove session {}", id, e);
                    skipped.add(id);
                    if (wasWatching) {
                        rewatch(session);
                    }
                }
            }
            for (String watched : watcherService.activeWatchers()) {
                if (!skipped.contains(watched)) {
                    scheduler.cancel(watched);
                    watcherService.stopWatching(watched);
                }
            }
            log.info("Cleaned up {} session(s), skipped {}", removed.size(), skipped.size());
            return new CleanupReport(removed, skipped);
        });
    }

    private void rewatch(Session session) {
        try {
            watcherService.startWatching(session, autoRebuildService::onFileChange);
        } catch (UncheckedIOException e) {
            log.warn("Session {} was kept but is no longer watched: {}", session.sessionId(), e.getMessage());
        }
    }

    /**
     * Resumes watching the newest session, if there is one.
     */
    public Optional<Session> resumeMostRecent() {
        var mostRecent = sessionRegistry.getMostRecentSession();
        if (mostRecent.isEmpty()) {
            log.info("No existing session to resume");
            return Optional.empty();
        }
        return Optional.of(sync(mostRecent.get().sessionId()));
    }

    @EventListener
    public void onServerStarted(WebServerInitializedEvent event) {
        if (properties.isLoadExistingOnStartup()) {
            sessionRegistry.loadExistingSessions();
        }
        if (properties.isResumeOnStartup()) {
            try {
                resumeMostRecent().ifPresent(s -> log.info("Resumed watching session {}", s.sessionId()));
            } catch (RuntimeException e) {
                log.warn("Could not resume most recent session: {}", e.getMessage());
            }
        }
    }
}
