package com.livebundle.dispatch.api;

import com.livebundle.core.events.EventBus;
import com.livebundle.core.events.LiveBundleEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * A client either follows one session or every session. Each event is sent as an SSE
 * frame named after the event type, with a flat JSON body:
 * {@code {type, sessionId, ...payload, timestamp}}. Emitters are unsubscribed on
 * completion, timeout or error, and receive a heartbeat comment every 30 seconds.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    static final String ALL_SESSIONS = "*";

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (EmitterRegistration registration : activeRegistrations) {
            registration.emitter.complete();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }

        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks remove the registration
                log.debug("Heartbeat failed for {} (connection likely closed): {}",
                        registration.scope, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for {} (emitter not active)", registration.scope);
            }
        }
    }

    /**
     * Creates an emitter that streams the events of one session.
     */
    public SseEmitter createEmitter(String sessionId) {
        return register(sessionId, consumer -> eventBus.subscribe(sessionId, consumer));
    }

    /**
     * Creates an emitter that streams the events of every session.
     */
    public SseEmitter createGlobalEmitter() {
        return register(ALL_SESSIONS, eventBus::subscribeAll);
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private SseEmitter register(String scope,
                                Function<Consumer<LiveBundleEvent>, EventBus.Subscription> subscriber) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = subscriber.apply(event -> sendEvent(emitter, event));

        var registration = new EmitterRegistration(scope, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for {}", scope);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for {}", scope);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", scope, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for {}: {}", scope, e.getMessage());
        }

        log.info("SSE emitter created for {} (timeout={}ms)", scope, timeoutMs);
        return emitter;
    }

    static Map<String, Object> toData(LiveBundleEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", event.type());
        data.put("sessionId", event.sessionId());
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void sendEvent(SseEmitter emitter, LiveBundleEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.type())
                    .data(toData(event)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for session {}: {}",
                    event.type(), event.sessionId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for {}", registration.scope);
    }

    private record EmitterRegistration(
            String scope,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
