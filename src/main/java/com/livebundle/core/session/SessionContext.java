package com.livebundle.core.session;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the id of the session most recently created or synced. Consulted by
 * single-session paths such as {@code livebundle watch} without an explicit id.
 */
@Component
public class SessionContext {

    private final AtomicReference<String> currentSessionId = new AtomicReference<>();

    public Optional<String> currentSessionId() {
        return Optional.ofNullable(currentSessionId.get());
    }

    public void setCurrent(String sessionId) {
        currentSessionId.set(sessionId);
    }

    /**
     * Clears the pointer only if it still refers to {@code sessionId}.
     */
    public boolean clearIfCurrent(String sessionId) {
        return currentSessionId.compareAndSet(sessionId, null);
    }

    public void clear() {
        currentSessionId.set(null);
    }
}
