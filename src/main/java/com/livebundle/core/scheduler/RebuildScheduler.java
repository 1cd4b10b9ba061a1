package com.livebundle.core.scheduler;

import com.livebundle.core.build.BuildOrchestrator;
import com.livebundle.core.config.LivebundleProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Collapses bursts of relevant changes into one rebuild per session.
 * <p>
 * Each change cancels the session's pending timer and schedules a new one, so the
 * rebuild runs once the session has been quiet for the debounce window and uses the
 * path of the last change. Timers of different sessions are independent.
 */
@Service
public class RebuildScheduler {

    private static final Logger log = LoggerFactory.getLogger(RebuildScheduler.class);

    private final ConcurrentHashMap<String, PendingRebuild> pending = new ConcurrentHashMap<>();
    private final BuildOrchestrator orchestrator;
    private final long debounceMs;
    private final ScheduledExecutorService timer;

    @Autowired
    public RebuildScheduler(BuildOrchestrator orchestrator, LivebundleProperties properties) {
        this(orchestrator, properties.getDebounceMs());
    }

    public RebuildScheduler(BuildOrchestrator orchestrator, long debounceMs) {
        this.orchestrator = orchestrator;
        this.debounceMs = debounceMs;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "rebuild-debounce");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Restarts the debounce window of a session.
     *
     * @param sessionId session whose workspace changed
     * @param filePath  workspace-relative path of the change
     */
    public void onRelevantChange(String sessionId, String filePath) {
        pending.compute(sessionId, (id, existing) -> {
            if (existing != null && existing.cancel()) {
                log.debug("Debounce reset for session {} ({} replaces {})",
                        id, filePath, existing.triggerFilePath());
            }
            var entry = new PendingRebuild(id, filePath, Instant.now());
            entry.attach(timer.schedule(() -> fire(entry), debounceMs, TimeUnit.MILLISECONDS));
            return entry;
        });
    }

    private void fire(PendingRebuild entry) {
        if (!pending.remove(entry.sessionId(), entry)) {
            return;
        }
        log.debug("Debounce elapsed for session {}, trigger {}", entry.sessionId(), entry.triggerFilePath());
        try {
            orchestrator.submitRebuild(entry.sessionId(), entry.triggerFilePath())
                    .whenComplete((outcome, error) -> {
                        if (error != null) {
                            log.error("Rebuild of session {} failed", entry.sessionId(), error);
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Could not submit rebuild for session {}", entry.sessionId(), e);
        }
    }

    /**
     * Drops the session's pending rebuild, if any. A rebuild that already started is unaffected.
     */
    public boolean cancel(String sessionId) {
        var entry = pending.remove(sessionId);
        return entry != null && entry.cancel();
    }

    public void cancelAll() {
        for (String sessionId : List.copyOf(pending.keySet())) {
            cancel(sessionId);
        }
    }

    public List<String> pendingSessions() {
        return pending.keySet().stream().sorted().toList();
    }

    public boolean isPending(String sessionId) {
        return pending.containsKey(sessionId);
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    @PreDestroy
    public void shutdown() {
        cancelAll();
        timer.shutdownNow();
    }
}
