package com.livebundle.core.session;

import com.livebundle.core.config.LivebundleProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-holder, first-come-first-served lock for structural session operations
 * (create, sync, cleanup).
 * <p>
 * Waiters are granted the lock in arrival order. A waiter that is not granted the
 * lock within the configured timeout fails with {@link WorkspaceMutexTimeoutException};
 * the lock is never handed out to more than one holder.
 */
@Component
public class WorkspaceMutex {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceMutex.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Duration timeout;

    @Autowired
    public WorkspaceMutex(LivebundleProperties properties) {
        this(Duration.ofSeconds(properties.getMutexTimeoutSeconds()));
    }

    public WorkspaceMutex(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Blocks until the lock is held by the calling thread.
     *
     * @return a permit that releases the lock when closed
     * @throws WorkspaceMutexTimeoutException if the timeout elapses or the wait is interrupted
     */
    public Permit acquire() {
        log.debug("Acquiring workspace mutex ({} waiting)", lock.getQueueLength());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceMutexTimeoutException("Interrupted while waiting for workspace mutex", e);
        }
        if (!acquired) {
            log.warn("Workspace mutex not acquired within {}s", timeout.toSeconds());
            throw new WorkspaceMutexTimeoutException(
                    "Workspace is busy: mutex not acquired within %ds".formatted(timeout.toSeconds()));
        }
        return new Permit();
    }

    public <T> T withLock(Supplier<T> action) {
        try (Permit ignored = acquire()) {
            return action.get();
        }
    }

    public boolean isLocked() {
        return lock.isLocked();
    }

    public int queueLength() {
        return lock.getQueueLength();
    }

    /**
     * Proof of ownership of the mutex. Closing it more than once is a no-op.
     */
    public final class Permit implements AutoCloseable {

        private boolean released;

        private Permit() {}

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
