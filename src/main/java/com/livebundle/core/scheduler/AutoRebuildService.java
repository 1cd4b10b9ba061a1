package com.livebundle.core.scheduler;

import com.livebundle.core.build.BuildOrchestrator;
import com.livebundle.core.config.LivebundleProperties;
import com.livebundle.core.events.EventBus;
import com.livebundle.core.events.LiveBundleEvent;
import com.livebundle.core.model.ActiveBuild;
import com.livebundle.core.model.AutoRebuildStatus;
import com.livebundle.core.model.ChangeEvent;
import com.livebundle.core.model.RebuildOutcome;
import com.livebundle.core.session.SessionNotFoundException;
import com.livebundle.core.session.SessionRegistry;
import com.livebundle.core.watch.ChangeFilter;
import com.livebundle.core.watch.WorkspaceWatcherService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;

/**
 * Connects workspace watchers to the rebuild pipeline: every observed change is
 * announced, relevant ones are debounced into rebuilds.
 */
@Service
public class AutoRebuildService {

    private static final Logger log = LoggerFactory.getLogger(AutoRebuildService.class);

    static final String MANUAL_TRIGGER = "manual";

    private final SessionRegistry sessionRegistry;
    private final ChangeFilter changeFilter;
    private final RebuildScheduler scheduler;
    private final BuildOrchestrator orchestrator;
    private final WorkspaceWatcherService watcherService;
    private final EventBus eventBus;
    private final boolean enabled;

    public AutoRebuildService(SessionRegistry sessionRegistry,
                              ChangeFilter changeFilter,
                              RebuildScheduler scheduler,
                              BuildOrchestrator orchestrator,
                              WorkspaceWatcherService watcherService,
                              EventBus eventBus,
                              LivebundleProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.changeFilter = changeFilter;
        this.scheduler = scheduler;
        this.orchestrator = orchestrator;
        this.watcherService = watcherService;
        this.eventBus = eventBus;
        this.enabled = properties.isRebuildEnabled();
    }

    public void onFileChange(ChangeEvent change) {
        sessionRegistry.touch(change.sessionId());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("filePath", change.relativePath());
        payload.put("changeType", change.kind().name().toLowerCase(Locale.ROOT));
        eventBus.publish(LiveBundleEvent.FILE_CHANGED, change.sessionId(), payload);

        if (!enabled) {
            return;
        }
        if (!changeFilter.isRelevant(change.relativePath())) {
            log.trace("Ignoring irrelevant change {} in session {}", change.relativePath(), change.sessionId());
            return;
        }
        log.debug("Relevant change {} in session {}", change.relativePath(), change.sessionId());
        scheduler.onRelevantChange(change.sessionId(), change.relativePath());
    }

    public AutoRebuildStatus getStatus() {
        return new AutoRebuildStatus(
                enabled,
                scheduler.getDebounceMs(),
                scheduler.pendingSessions(),
                orchestrator.activeBuilds().stream().map(ActiveBuild::sessionId).sorted().toList(),
                watcherService.activeWatchers());
    }

    /**
     * Rebuilds a session now, on the calling thread. A pending debounced rebuild for the
     * session is cancelled; a running build makes this call return a skipped outcome.
     *
     * @throws SessionNotFoundException if the session is unknown
     */
    public RebuildOutcome manualRebuild(String sessionId) {
        if (sessionRegistry.resolveSession(sessionId).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        scheduler.cancel(sessionId);
        log.info("Manual rebuild requested for session {}", sessionId);
        return orchestrator.executeRebuild(sessionId, MANUAL_TRIGGER);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
