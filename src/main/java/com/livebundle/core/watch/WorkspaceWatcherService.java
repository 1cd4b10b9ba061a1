package com.livebundle.core.watch;

import com.livebundle.core.config.LivebundleProperties;
import com.livebundle.core.model.Session;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the workspace watchers, at most one per session.
 * <p>
 * By default every synced session keeps its own watcher. In exclusive mode starting a
 * watcher stops all others, so only the most recently synced session is observed.
 */
@Service
public class WorkspaceWatcherService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceWatcherService.class);

    private final ConcurrentHashMap<String, WorkspaceWatcher> watchers = new ConcurrentHashMap<>();
    private final boolean exclusive;
    private final ExecutorService watcherPool;

    @Autowired
    public WorkspaceWatcherService(LivebundleProperties properties) {
        this(properties.isWatchExclusive());
    }

    public WorkspaceWatcherService(boolean exclusive) {
        this.exclusive = exclusive;
        var counter = new AtomicInteger();
        this.watcherPool = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "workspace-watcher-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts watching the session workspace, replacing any watcher the session already had.
     *
     * @throws UncheckedIOException if the workspace cannot be registered
     */
    public void startWatching(Session session, ChangeListener listener) {
        if (exclusive) {
            for (String other : List.copyOf(watchers.keySet())) {
                if (!other.equals(session.sessionId())) {
                    stopWatching(other);
                }
            }
        }

        var watcher = new WorkspaceWatcher(session, listener);
        var previous = watchers.put(session.sessionId(), watcher);
        if (previous != null) {
            previous.close();
        }
        try {
            watcher.start(watcherPool);
        } catch (IOException e) {
            watchers.remove(session.sessionId(), watcher);
            throw new UncheckedIOException("Failed to watch workspace of " + session.sessionId(), e);
        }
    }

    public boolean stopWatching(String sessionId) {
        var watcher = watchers.remove(sessionId);
        if (watcher == null) {
            return false;
        }
        watcher.close();
        return true;
    }

    public void stopAll() {
        for (String sessionId : List.copyOf(watchers.keySet())) {
            stopWatching(sessionId);
        }
    }

    public boolean isWatching(String sessionId) {
        var watcher = watchers.get(sessionId);
        return watcher != null && watcher.isRunning();
    }

    /** Ids of sessions with a running watcher. */
    public List<String> activeWatchers() {
        return watchers.values().stream()
                .filter(WorkspaceWatcher::isRunning)
                .map(WorkspaceWatcher::sessionId)
                .sorted()
                .toList();
    }

    public boolean isExclusive() {
        return exclusive;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping {} workspace watcher(s)", watchers.size());
        stopAll();
        watcherPool.shutdownNow();
    }
}
