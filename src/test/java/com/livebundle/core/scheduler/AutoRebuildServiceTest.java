package com.livebundle.core.scheduler;

import com.livebundle.core.build.BuildOrchestrator;
import com.livebundle.core.config.LivebundleProperties;
import com.livebundle.core.events.EventBus;
import com.livebundle.core.events.LiveBundleEvent;
import com.livebundle.core.model.ActiveBuild;
import com.livebundle.core.model.ChangeEvent;
import com.livebundle.core.model.ChangeKind;
import com.livebundle.core.model.RebuildOutcome;
import com.livebundle.core.model.RebuildStatus;
import com.livebundle.core.model.Session;
import com.livebundle.core.session.SessionNotFoundException;
import com.livebundle.core.session.SessionRegistry;
import com.livebundle.core.watch.ChangeFilter;
import com.livebundle.core.watch.WorkspaceWatcherService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AutoRebuildServiceTest {

    private static final String SESSION_ID = "session-1-aaaaaaaaa";

    private SessionRegistry registry;
    private RebuildScheduler scheduler;
    private BuildOrchestrator orchestrator;
    private WorkspaceWatcherService watcherService;
    private EventBus eventBus;
    private List<LiveBundleEvent> published;
    private LivebundleProperties properties;

    @BeforeEach
    void setUp() {
        registry = mock(SessionRegistry.class);
        scheduler = mock(RebuildScheduler.class);
        orchestrator = mock(BuildOrchestrator.class);
        watcherService = mock(WorkspaceWatcherService.class);
        eventBus = new EventBus();
        published = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(published::add);
        properties = new LivebundleProperties();
    }

    private AutoRebuildService service() {
        return new AutoRebuildService(registry, new ChangeFilter(properties), scheduler, orchestrator,
                watcherService, eventBus, properties);
    }

    private static ChangeEvent change(String path, ChangeKind kind) {
        return new ChangeEvent(SESSION_ID, kind, path, Path.of("/ws").resolve(path), Instant.now());
    }

    @Nested
    @DisplayName("onFileChange")
    class OnFileChangeTests {

        @Test
        @DisplayName("announces the change and schedules a rebuild for source files")
        void relevantChange() {
            service().onFileChange(change("components/Button.tsx", ChangeKind.MODIFY));

            verify(registry).touch(SESSION_ID);
            assertEquals(1, published.size());
            var event = published.get(0);
            assertEquals(LiveBundleEvent.FILE_CHANGED, event.type());
            assertEquals(SESSION_ID, event.sessionId());
            assertEquals("components/Button.tsx", event.payload().get("filePath"));
            assertEquals("modify", event.payload().get("changeType"));
            verify(scheduler).onRelevantChange(SESSION_ID, "components/Button.tsx");
        }

        @Test
        @DisplayName("irrelevant files are announced but never rebuilt")
        void irrelevantChange() {
            service().onFileChange(change("assets/logo.png", ChangeKind.CREATE));

            assertEquals("create", published.get(0).payload().get("changeType"));
            verifyNoInteractions(scheduler);
        }

        @Test
        @DisplayName("disabled auto-rebuild still announces changes")
        void disabled() {
            properties.getRebuild().setEnabled(false);

            service().onFileChange(change("App.tsx", ChangeKind.DELETE));

            assertEquals(1, published.size());
            verifyNoInteractions(scheduler);
        }
    }

    @Test
    @DisplayName("status combines pending, active and watched sessions")
    void status() {
        when(scheduler.getDebounceMs()).thenReturn(1000L);
        when(scheduler.pendingSessions()).thenReturn(List.of("session-2-b"));
        when(orchestrator.activeBuilds()).thenReturn(List.of(new ActiveBuild("session-3-c", Instant.now(), "App.tsx")));
        when(watcherService.activeWatchers()).thenReturn(List.of("session-2-b", "session-3-c"));

        var status = service().getStatus();

        assertTrue(status.enabled());
        assertEquals(1000L, status.debounceMs());
        assertEquals(List.of("session-2-b"), status.pendingRebuilds());
        assertEquals(List.of("session-3-c"), status.activeRebuilds());
        assertEquals(List.of("session-2-b", "session-3-c"), status.watchedSessions());
    }

    @Nested
    @DisplayName("manualRebuild")
    class ManualRebuildTests {

        @Test
        @DisplayName("cancels the pending rebuild and builds synchronously")
        void rebuilds() {
            var session = new Session(SESSION_ID, Path.of("/s"), Path.of("/s/workspace"), Instant.now(), Instant.now());
            var outcome = new RebuildOutcome(SESSION_ID, "manual", RebuildStatus.COMPLETED, true, 10, 100, List.of());
            when(registry.resolveSession(SESSION_ID)).thenReturn(Optional.of(session));
            when(orchestrator.executeRebuild(SESSION_ID, "manual")).thenReturn(outcome);

            assertSame(outcome, service().manualRebuild(SESSION_ID));

            var inOrder = inOrder(scheduler, orchestrator);
            inOrder.verify(scheduler).cancel(SESSION_ID);
            inOrder.verify(orchestrator).executeRebuild(SESSION_ID, "manual");
        }

        @Test
        @DisplayName("unknown session throws not found")
        void unknown() {
            when(registry.resolveSession(any())).thenReturn(Optional.empty());

            assertThrows(SessionNotFoundException.class, () -> service().manualRebuild(SESSION_ID));
            verifyNoInteractions(orchestrator);
        }
    }
}
