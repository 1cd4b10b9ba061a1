package com.livebundle.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.ConnectException;
import java.time.Instant;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the livebundle CLI command structure.
 * Commands run through picocli without a Spring context, against a mocked {@link ServerClient}.
 */
class CliTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private record CliResult(int exitCode, String output) {}

    private ServerClient client;

    @BeforeEach
    void setUp() {
        client = mock(ServerClient.class);
    }

    private static ServerClient.ServerResponse response(int status, String json) throws Exception {
        JsonNode body = json == null ? NullNode.getInstance() : MAPPER.readTree(json);
        return new ServerClient.ServerResponse(status, body);
    }

    /**
     * Custom picocli IFactory that hands the mocked client to the client commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == SessionsCommand.class) {
                    return (K) new SessionsCommand(client);
                }
                if (cls == RebuildCommand.class) {
                    return (K) new RebuildCommand(client);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(client);
                }
                if (cls == WatchCommand.class) {
                    return (K) new WatchCommand(client);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = CliRunner.commandLine(new LivebundleCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : new String[]{"serve", "sessions", "rebuild", "status", "watch", "help"}) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("livebundle 0.1.0"));
        }

        @Test
        @DisplayName("rebuild without a session id is a usage error")
        void rebuildRequiresId() {
            CliResult result = execute("rebuild");
            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    @Nested
    @DisplayName("sessions")
    class SessionsTests {

        @Test
        @DisplayName("lists sessions returned by the server")
        void listsSessions() throws Exception {
            when(client.get(8080, "/sessions")).thenReturn(response(200, """
                    {"sessions":[{"sessionId":"session-1712345678901-k3j4h5g6f",
                                  "workspacePath":"/tmp/s/workspace",
                                  "startTime":"2024-04-05T19:34:38.901Z"}],
                     "totalSessions":1}
                    """));

            CliResult result = execute("sessions");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("session-1712345678901-k3j4h5g6f"));
            assertTrue(result.output().contains("/tmp/s/workspace"));
            assertTrue(result.output().contains("1 session(s)"));
        }

        @Test
        @DisplayName("reports an empty registry")
        void noSessions() throws Exception {
            when(client.get(anyInt(), eq("/sessions"))).thenReturn(response(200, "{\"sessions\":[],\"totalSessions\":0}"));

            assertTrue(execute("sessions", "--port", "9090").output().contains("No sessions."));
        }

        @Test
        @DisplayName("--stats prints registry statistics")
        void stats() throws Exception {
            when(client.get(8080, "/sessions/stats")).thenReturn(response(200, """
                    {"totalSessions":2,"sessionIds":["a","b"],"oldestSession":"a","newestSession":"b","averageAgeMs":65000}
                    """));

            CliResult result = execute("sessions", "--stats");

            assertTrue(result.output().contains("Total sessions: 2"));
            assertTrue(result.output().contains("Average age: 1m 5s"));
        }

        @Test
        @DisplayName("explains how to start the server when it is unreachable")
        void serverDown() throws Exception {
            when(client.get(anyInt(), any())).thenThrow(new ConnectException("refused"));

            CliResult result = execute("sessions");

            assertTrue(result.output().contains("Cannot connect to livebundle server at localhost:8080"));
            assertTrue(result.output().contains("livebundle serve"));
        }

        @Test
        @DisplayName("age renders elapsed time and tolerates bad input")
        void age() {
            assertEquals("-", SessionsCommand.age(null));
            assertEquals("-", SessionsCommand.age("yesterday"));
            assertTrue(SessionsCommand.age(Instant.now().minusSeconds(5).toString()).endsWith("s"));
        }
    }

    @Nested
    @DisplayName("rebuild")
    class RebuildTests {

        private static final String ID = "session-1712345678901-k3j4h5g6f";

        @Test
        @DisplayName("prints per-target results")
        void printsResults() throws Exception {
            when(client.post(8080, "/rebuild/" + ID)).thenReturn(response(200, """
                    {"sessionId":"%s","success":true,"durationMs":1500,"totalBundleBytes":2048,
                     "results":[
                       {"target":"web","success":true,"bundleSizeBytes":2048,"durationMs":900},
                       {"target":"mobile:ios","success":false,"bundleSizeBytes":0,"durationMs":40,
                        "error":"Unable to resolve module ./Missing"}]}
                    """.formatted(ID)));

            CliResult result = execute("rebuild", ID);

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("web"));
            assertTrue(result.output().contains("2.0 KB in 900ms"));
            assertTrue(result.output().contains("Unable to resolve module ./Missing"));
            assertTrue(result.output().contains("Rebuild finished in 1s"));
        }

        @Test
        @DisplayName("reports a build already in progress")
        void inProgress() throws Exception {
            when(client.post(8080, "/rebuild/" + ID)).thenReturn(response(409, "{\"status\":\"SKIPPED_IN_PROGRESS\"}"));

            assertTrue(execute("rebuild", ID).output().contains("A build is already running"));
        }

        @Test
        @DisplayName("reports an unknown session")
        void unknown() throws Exception {
            when(client.post(8080, "/rebuild/" + ID)).thenReturn(response(404, "{\"error\":\"Session not found\"}"));

            assertTrue(execute("rebuild", ID).output().contains("Session not found: " + ID));
        }
    }

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        @DisplayName("prints auto-rebuild state and component health")
        void printsStatus() throws Exception {
            when(client.get(8080, "/rebuild/status")).thenReturn(response(200, """
                    {"enabled":true,"debounceMs":1000,"pendingRebuilds":[],"activeRebuilds":["s-1"],
                     "watchedSessions":["s-1","s-2"]}
                    """));
            when(client.get(8080, "/health")).thenReturn(response(200, """
                    {"status":"UP","components":{"watchers":{"status":"UP","detail":"2 active watcher(s)"}}}
                    """));

            CliResult result = execute("status");

            assertTrue(result.output().contains("Auto-rebuild enabled (debounce 1000ms)"));
            assertTrue(result.output().contains("Watched:  s-1, s-2"));
            assertTrue(result.output().contains("Pending:  -"));
            assertTrue(result.output().contains("watchers: 2 active watcher(s)"));
        }
    }

    @Nested
    @DisplayName("watch")
    class WatchTests {

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("follows the global stream without an id")
        void globalStream() throws Exception {
            when(client.streamEvents(eq(8080), eq("/events"), any(BiConsumer.class))).thenAnswer(inv -> {
                BiConsumer<String, String> onEvent = inv.getArgument(2);
                onEvent.accept("rebuild-started", "{\"sessionId\":\"s-1\",\"triggerFile\":\"App.tsx\"}");
                return 200;
            });

            CliResult result = execute("watch");

            assertTrue(result.output().contains("[BUILD]"));
            assertTrue(result.output().contains("\"triggerFile\":\"App.tsx\""));
            assertTrue(result.output().contains("Stream ended."));
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("reports an unknown session stream")
        void unknownSession() throws Exception {
            when(client.streamEvents(eq(8080), eq("/sessions/s-9/events"), any(BiConsumer.class))).thenReturn(404);

            assertTrue(execute("watch", "s-9").output().contains("Session not found: s-9"));
        }
    }

    @Test
    @DisplayName("byte and duration formatting")
    void formatting() {
        assertEquals("512 B", ConsoleOutput.formatBytes(512));
        assertEquals("1.5 KB", ConsoleOutput.formatBytes(1536));
        assertEquals("250ms", ConsoleOutput.formatDuration(250));
        assertEquals("2m 0s", ConsoleOutput.formatDuration(120_000));
    }
}
