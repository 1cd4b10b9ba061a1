package com.livebundle.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;

/**
 * CLI command: livebundle rebuild &lt;session-id&gt;
 * <p>
 * Asks a running server to rebuild a session now and prints the per-target results.
 */
@Command(name = "rebuild", mixinStandardHelpOptions = true, description = "Rebuild a session now")
@Component
public class RebuildCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ServerClient client;

    public RebuildCommand(ServerClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Rebuilding " + sessionId + "...");
        try {
            var response = client.post(port, "/rebuild/" + sessionId);
            switch (response.status()) {
                case 404 -> ConsoleOutput.error("Session not found: " + sessionId);
                case 409 -> ConsoleOutput.error("A build is already running for " + sessionId);
                case 200 -> printOutcome(response.body());
                default -> ConsoleOutput.error(response.error());
            }
        } catch (ConnectException e) {
            ConsoleOutput.serverUnavailable(port);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Rebuild failed: " + e.getMessage());
        }
    }

    private static void printOutcome(JsonNode outcome) {
        System.out.println();
        for (JsonNode result : outcome.path("results")) {
            ConsoleOutput.buildResult(
                    result.path("target").asText(),
                    result.path("success").asBoolean(),
                    result.path("bundleSizeBytes").asLong(),
                    result.path("durationMs").asLong(),
                    result.path("error").asText(null));
        }
        System.out.println();
        String summary = "Rebuild finished in " + ConsoleOutput.formatDuration(outcome.path("durationMs").asLong())
                + " (" + ConsoleOutput.formatBytes(outcome.path("totalBundleBytes").asLong()) + ")";
        if (outcome.path("success").asBoolean()) {
            ConsoleOutput.success(summary);
        } else {
            ConsoleOutput.error(summary);
        }
    }
}
