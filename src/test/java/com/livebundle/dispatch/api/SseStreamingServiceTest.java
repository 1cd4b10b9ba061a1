package com.livebundle.dispatch.api;

import com.livebundle.core.events.EventBus;
import com.livebundle.core.events.LiveBundleEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus, 60_000);
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("subscribes the emitter to its session only")
        void subscribesToSession() {
            SseEmitter emitter = service.createEmitter("session-1-a");

            assertNotNull(emitter);
            assertEquals(1, service.activeEmitterCount());
            assertEquals(1, eventBus.subscriberCount("session-1-a"));
            assertEquals(0, eventBus.subscriberCount("session-2-b"));
        }

        @Test
        @DisplayName("multiple emitters can follow the same session")
        void multipleEmitters() {
            SseEmitter first = service.createEmitter("session-1-a");
            SseEmitter second = service.createEmitter("session-1-a");

            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
            assertEquals(2, eventBus.subscriberCount("session-1-a"));
        }

        @Test
        @DisplayName("global emitters are counted as active")
        void globalEmitter() {
            assertNotNull(service.createGlobalEmitter());
            assertEquals(1, service.activeEmitterCount());
        }
    }

    @Nested
    @DisplayName("event forwarding")
    class EventForwardingTests {

        @Test
        @DisplayName("publishing to an emitter that is not yet attached does not fail the publisher")
        void publishDoesNotThrow() {
            service.createEmitter("session-1-a");
            service.createGlobalEmitter();

            assertDoesNotThrow(() -> eventBus.publish(LiveBundleEvent.of(
                    LiveBundleEvent.FILE_CHANGED, "session-1-a", Map.of("filePath", "App.tsx"))));
        }

        @Test
        @DisplayName("heartbeats tolerate emitters that are not attached")
        void heartbeat() {
            service.createEmitter("session-1-a");

            assertDoesNotThrow(service::sendHeartbeats);
        }
    }

    @Test
    @DisplayName("event data is flat: type, sessionId, payload fields, timestamp")
    void toDataShape() {
        var timestamp = Instant.parse("2026-01-01T00:00:00Z");
        var event = new LiveBundleEvent(LiveBundleEvent.REBUILD_COMPLETED, "session-1-a",
                Map.of("success", true, "duration", 120L), timestamp);

        var data = SseStreamingService.toData(event);

        assertEquals(List.of("type", "sessionId", "success", "duration", "timestamp").size(), data.size());
        assertEquals("rebuild-completed", data.get("type"));
        assertEquals("session-1-a", data.get("sessionId"));
        assertEquals(true, data.get("success"));
        assertEquals(120L, data.get("duration"));
        assertEquals("2026-01-01T00:00:00Z", data.get("timestamp"));
        assertEquals(List.of("type", "sessionId"), List.copyOf(data.keySet()).subList(0, 2));
    }
}
