package com.livebundle.core.watch;

import com.livebundle.core.model.ChangeEvent;
import com.livebundle.core.model.ChangeKind;
import com.livebundle.core.model.Session;
import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Recursive watcher over one session workspace.
 * <p>
 * Emits one {@link ChangeEvent} per created, modified or deleted file. Directories,
 * paths with a segment starting with {@code .}, and anything that existed before
 * {@link #start} are not reported.
 */
public class WorkspaceWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceWatcher.class);

    private final Session session;
    private final ChangeListener listener;

    private volatile DirectoryWatcher watcher;
    private volatile CompletableFuture<Void> watchFuture;
    private volatile boolean running;

    public WorkspaceWatcher(Session session, ChangeListener listener) {
        this.session = session;
        this.listener = listener;
    }

    public String sessionId() {
        return session.sessionId();
    }

    public Path root() {
        return session.workspacePath();
    }

    /**
     * Registers the workspace tree and starts delivering events on {@code executor}.
     *
     * @throws IOException if the workspace cannot be registered
     */
    public synchronized void start(Executor executor) throws IOException {
        if (running) {
            return;
        }
        watcher = DirectoryWatcher.builder()
                .path(root())
                .listener(this::handleEvent)
                .fileHashing(false)
                .build();
        running = true;
        watchFuture = watcher.watchAsync(executor);
        watchFuture.whenComplete((ignored, error) -> {
            if (error != null && running) {
                log.error("Watcher for session {} stopped unexpectedly", sessionId(), error);
            }
        });
        log.info("Watching {} for session {}", root(), sessionId());
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        try {
            watcher.close();
            log.info("Stopped watching session {}", sessionId());
        } catch (IOException e) {
            log.warn("Error closing watcher for session {}: {}", sessionId(), e.getMessage());
        }
    }

    void handleEvent(DirectoryChangeEvent event) {
        if (!running || event.isDirectory()) {
            return;
        }
        ChangeKind kind = toKind(event.eventType());
        if (kind == null) {
            if (event.eventType() == DirectoryChangeEvent.EventType.OVERFLOW) {
                log.warn("Watch event overflow for session {}; some changes may be missed", sessionId());
            }
            return;
        }

        Path absolute = event.path();
        Path relative;
        try {
            relative = root().relativize(absolute);
        } catch (IllegalArgumentException e) {
            log.trace("Skipping event outside workspace: {}", absolute);
            return;
        }
        if (isHidden(relative)) {
            return;
        }

        var change = new ChangeEvent(sessionId(), kind, relative.toString().replace('\\', '/'),
                absolute, Instant.now());
        log.trace("{} {} in session {}", kind, change.relativePath(), sessionId());
        try {
            listener.onChange(change);
        } catch (Exception e) {
            log.error("Change listener failed for {} in session {}", change.relativePath(), sessionId(), e);
        }
    }

    static ChangeKind toKind(DirectoryChangeEvent.EventType type) {
        return switch (type) {
            case CREATE -> ChangeKind.CREATE;
            case MODIFY -> ChangeKind.MODIFY;
            case DELETE -> ChangeKind.DELETE;
            default -> null;
        };
    }

    /** True if any segment of the relative path is a dotfile or dot-directory. */
    static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
