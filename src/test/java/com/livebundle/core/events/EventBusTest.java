package com.livebundle.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private static final String SESSION_A = "session-1700000000000-aaaaaaaaa";
    private static final String SESSION_B = "session-1700000000001-bbbbbbbbb";

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static LiveBundleEvent started(String sessionId) {
        return LiveBundleEvent.of(LiveBundleEvent.REBUILD_STARTED, sessionId, Map.of("triggerFile", "App.tsx"));
    }

    @Nested
    @DisplayName("LiveBundleEvent")
    class LiveBundleEventTests {

        @Test
        @DisplayName("of() stamps a timestamp and defaults a null payload to empty")
        void ofDefaults() {
            var event = LiveBundleEvent.of(LiveBundleEvent.FILE_CHANGED, SESSION_A, null);

            assertEquals("file-changed", event.type());
            assertEquals(SESSION_A, event.sessionId());
            assertTrue(event.payload().isEmpty());
            assertNotNull(event.timestamp());
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to session subscriber")
        void deliversToSessionSubscriber() {
            List<LiveBundleEvent> received = new ArrayList<>();
            eventBus.subscribe(SESSION_A, received::add);

            eventBus.publish(started(SESSION_A));

            assertEquals(1, received.size());
            assertEquals(LiveBundleEvent.REBUILD_STARTED, received.get(0).type());
        }

        @Test
        @DisplayName("does not deliver events of other sessions")
        void isolatesSessions() {
            List<LiveBundleEvent> received = new ArrayList<>();
            eventBus.subscribe(SESSION_A, received::add);

            eventBus.publish(started(SESSION_B));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber receives events from all sessions")
        void globalSubscriberReceivesAll() {
            List<String> sessions = new ArrayList<>();
            eventBus.subscribeAll(e -> sessions.add(e.sessionId()));

            eventBus.publish(started(SESSION_A));
            eventBus.publish(started(SESSION_B));

            assertEquals(List.of(SESSION_A, SESSION_B), sessions);
        }

        @Test
        @DisplayName("unsubscribe stops delivery and forgets empty session lists")
        void unsubscribe() {
            List<LiveBundleEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe(SESSION_A, received::add);
            assertEquals(1, eventBus.subscriberCount(SESSION_A));

            subscription.unsubscribe();
            eventBus.publish(started(SESSION_A));

            assertTrue(received.isEmpty());
            assertEquals(0, eventBus.subscriberCount(SESSION_A));
        }
    }

    @Nested
    @DisplayName("typed publish")
    class TypedPublishTests {

        @Test
        @DisplayName("builds, stamps and delivers the event")
        void publishesBuiltEvent() {
            List<LiveBundleEvent> received = new ArrayList<>();
            eventBus.subscribe(SESSION_A, received::add);

            var event = eventBus.publish(LiveBundleEvent.FILE_CHANGED, SESSION_A, Map.of("filePath", "App.tsx"));

            assertEquals(List.of(event), received);
            assertEquals("App.tsx", event.payload().get("filePath"));
            assertNotNull(event.timestamp());
        }

        @Test
        @DisplayName("an event without a session only reaches listeners of every session")
        void sessionlessEvent() {
            List<LiveBundleEvent> global = new ArrayList<>();
            eventBus.subscribeAll(global::add);

            assertDoesNotThrow(() -> eventBus.publish(LiveBundleEvent.REBUILD_COMPLETED, null, null));
            assertEquals(1, global.size());
        }

        @Test
        @DisplayName("the all-sessions key cannot be subscribed to as a session")
        void reservedKey() {
            assertThrows(IllegalArgumentException.class, () -> eventBus.subscribe(EventBus.ALL_SESSIONS, e -> { }));
        }
    }

    @Nested
    @DisplayName("failure isolation")
    class FailureIsolationTests {

        @Test
        @DisplayName("a throwing subscriber does not block the others or the publisher")
        void throwingSubscriberIsolated() {
            List<LiveBundleEvent> received = new ArrayList<>();
            eventBus.subscribe(SESSION_A, e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe(SESSION_A, received::add);
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(started(SESSION_A)));
            assertEquals(2, received.size());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("concurrent publishers all deliver")
        void concurrentPublish() throws Exception {
            var received = new CopyOnWriteArrayList<LiveBundleEvent>();
            eventBus.subscribeAll(received::add);

            int threads = 8;
            int perThread = 50;
            var latch = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        eventBus.publish(started(SESSION_A));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }
}
