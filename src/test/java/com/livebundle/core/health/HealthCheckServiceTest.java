package com.livebundle.core.health;

import com.livebundle.core.build.CommandLineCompiler;
import com.livebundle.core.build.CompileOutput;
import com.livebundle.core.build.Compiler;
import com.livebundle.core.session.SessionRegistry;
import com.livebundle.core.watch.WorkspaceWatcherService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private SessionRegistry registry;
    private WorkspaceWatcherService watcherService;
    private final Compiler fake = (entry, root, options) -> new CompileOutput("", null);

    @BeforeEach
    void setUp() {
        registry = mock(SessionRegistry.class);
        watcherService = mock(WorkspaceWatcherService.class);
        when(registry.getSessionsRoot()).thenReturn(tempDir.resolve("sessions"));
        when(watcherService.activeWatchers()).thenReturn(List.of("session-1-a"));
    }

    @Test
    @DisplayName("checkAll returns sessions-root, compilers, watchers components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(registry, watcherService, fake, fake);

        var components = service.checkAll().stream().map(HealthStatus::component).toList();

        assertEquals(List.of("sessions-root", "compilers", "watchers"), components);
    }

    @Test
    @DisplayName("Writable sessions root -> UP and created on demand")
    void sessionsRootUp() {
        var service = new HealthCheckService(registry, watcherService, fake, fake);

        var status = service.checkSessionsRoot();

        assertEquals(HealthStatus.Status.UP, status.status());
        assertTrue(Files.isDirectory(tempDir.resolve("sessions")));
    }

    @Test
    @DisplayName("Sessions root blocked by a file -> DOWN")
    void sessionsRootDown() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        when(registry.getSessionsRoot()).thenReturn(blocker.resolve("sessions"));
        var service = new HealthCheckService(registry, watcherService, fake, fake);

        assertEquals(HealthStatus.Status.DOWN, service.checkSessionsRoot().status());
    }

    @Test
    @DisplayName("Missing compiler -> compilers DOWN")
    void missingCompiler() {
        var service = new HealthCheckService(registry, watcherService, fake, null);

        assertEquals(HealthStatus.Status.DOWN, service.checkCompilers().status());
    }

    @Test
    @DisplayName("Command line compilers report their command")
    void describesCommands() {
        var web = new CommandLineCompiler("web", "esbuild {entry}", Duration.ofSeconds(1));
        var service = new HealthCheckService(registry, watcherService, web, fake);

        var status = service.checkCompilers();

        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("esbuild {entry}", status.metadata().get("web"));
    }

    @Test
    @DisplayName("Watchers report the active count")
    void watchers() {
        var service = new HealthCheckService(registry, watcherService, fake, fake);

        var status = service.checkWatchers();

        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("1", status.metadata().get("count"));
    }
}
