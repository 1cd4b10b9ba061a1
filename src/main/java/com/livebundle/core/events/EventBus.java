package com.livebundle.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for session lifecycle events.
 * <p>
 * Listeners are keyed by session id; listeners that follow every session live under
 * {@link #ALL_SESSIONS}, which can never collide with a real session id. A listener
 * that throws is logged and skipped and never fails the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final String ALL_SESSIONS = "*";

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LiveBundleEvent>>> listeners =
            new ConcurrentHashMap<>();

    /**
     * Builds an event stamped now and publishes it.
     *
     * @return the published event
     */
    public LiveBundleEvent publish(String type, String sessionId, Map<String, Object> payload) {
        var event = LiveBundleEvent.of(type, sessionId, payload);
        publish(event);
        return event;
    }

    /**
     * Delivers an event to the listeners of its session, then to listeners of every session.
     */
    public void publish(LiveBundleEvent event) {
        int delivered = 0;
        if (event.sessionId() != null && !ALL_SESSIONS.equals(event.sessionId())) {
            delivered += deliver(event.sessionId(), event);
        }
        delivered += deliver(ALL_SESSIONS, event);
        log.debug("Published {} for session {} to {} listener(s)", event.type(), event.sessionId(), delivered);
    }

    /**
     * Follows the events of one session. Unsubscribing the last listener drops the session's entry.
     */
    public Subscription subscribe(String sessionId, Consumer<LiveBundleEvent> listener) {
        Objects.requireNonNull(sessionId, "sessionId");
        if (ALL_SESSIONS.equals(sessionId)) {
            throw new IllegalArgumentException("Use subscribeAll to follow every session");
        }
        return add(sessionId, listener);
    }

    public Subscription subscribeAll(Consumer<LiveBundleEvent> listener) {
        return add(ALL_SESSIONS, listener);
    }

    public int subscriberCount(String sessionId) {
        List<Consumer<LiveBundleEvent>> subs = listeners.get(sessionId);
        return subs == null ? 0 : subs.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription add(String key, Consumer<LiveBundleEvent> listener) {
        listeners.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Subscribed to {}", ALL_SESSIONS.equals(key) ? "all sessions" : "session " + key);
        return () -> listeners.computeIfPresent(key, (k, subs) -> {
            subs.remove(listener);
            return subs.isEmpty() ? null : subs;
        });
    }

    private int deliver(String key, LiveBundleEvent event) {
        List<Consumer<LiveBundleEvent>> subs = listeners.get(key);
        if (subs == null) {
            return 0;
        }
        int delivered = 0;
        for (Consumer<LiveBundleEvent> listener : subs) {
            try {
                listener.accept(event);
                delivered++;
            } catch (Exception e) {
                log.warn("Listener threw processing {} for session {}: {}",
                        event.type(), event.sessionId(), e.getMessage(), e);
            }
        }
        return delivered;
    }
}
