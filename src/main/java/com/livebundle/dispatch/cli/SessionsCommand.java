package com.livebundle.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * CLI command: livebundle sessions
 * <p>
 * Lists the sessions known to a running server, newest first.
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List live-editing sessions")
@Component
public class SessionsCommand implements Runnable {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    @Option(names = {"--stats"}, description = "Show registry statistics instead of the session list")
    private boolean stats;

    private final ServerClient client;

    public SessionsCommand(ServerClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            if (stats) {
                printStats();
            } else {
                printSessions();
            }
        } catch (ConnectException e) {
            ConsoleOutput.serverUnavailable(port);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Request failed: " + e.getMessage());
        }
    }

    private void printSessions() throws IOException, InterruptedException {
        var response = client.get(port, "/sessions");
        if (!response.isOk()) {
            ConsoleOutput.error(response.error());
            return;
        }
        JsonNode sessions = response.body().path("sessions");
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions.");
            return;
        }
        System.out.printf("  %-34s %-10s %s%n", "SESSION", "AGE", "WORKSPACE");
        System.out.println("  " + "-".repeat(72));
        for (JsonNode session : sessions) {
            System.out.printf("  %-34s %-10s %s%n",
                    session.path("sessionId").asText(),
                    age(session.path("startTime").asText(null)),
                    session.path("workspacePath").asText());
        }
        System.out.println();
        ConsoleOutput.info(sessions.size() + " session(s)");
    }

    private void printStats() throws IOException, InterruptedException {
        var response = client.get(port, "/sessions/stats");
        if (!response.isOk()) {
            ConsoleOutput.error(response.error());
            return;
        }
        JsonNode body = response.body();
        ConsoleOutput.info("Total sessions: " + body.path("totalSessions").asInt());
        if (body.hasNonNull("newestSession")) {
            ConsoleOutput.info("Newest: " + body.path("newestSession").asText());
            ConsoleOutput.info("Oldest: " + body.path("oldestSession").asText());
            ConsoleOutput.info("Average age: " + ConsoleOutput.formatDuration(body.path("averageAgeMs").asLong()));
        }
    }

    static String age(String startTime) {
        if (startTime == null) return "-";
        try {
            long ms = Duration.between(Instant.parse(startTime), Instant.now()).toMillis();
            return ConsoleOutput.formatDuration(Math.max(0, ms));
        } catch (DateTimeParseException e) {
            return "-";
        }
    }
}
