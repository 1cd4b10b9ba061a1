package com.livebundle.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: livebundle status
 * <p>
 * Shows auto-rebuild state and component health of a running server.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show auto-rebuild status and health")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ServerClient client;

    public StatusCommand(ServerClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            var status = client.get(port, "/rebuild/status");
            if (!status.isOk()) {
                ConsoleOutput.error(status.error());
                return;
            }
            JsonNode body = status.body();
            if (body.path("enabled").asBoolean()) {
                ConsoleOutput.success("Auto-rebuild enabled (debounce " + body.path("debounceMs").asLong() + "ms)");
            } else {
                ConsoleOutput.error("Auto-rebuild disabled");
            }
            ConsoleOutput.info("Watched:  " + join(body.path("watchedSessions")));
            ConsoleOutput.info("Pending:  " + join(body.path("pendingRebuilds")));
            ConsoleOutput.info("Building: " + join(body.path("activeRebuilds")));

            var health = client.get(port, "/health");
            System.out.println("──────────────────────────────────");
            var components = health.body().path("components");
            components.fieldNames().forEachRemaining(name -> {
                JsonNode component = components.path(name);
                String label = name + ": " + component.path("detail").asText();
                if ("UP".equals(component.path("status").asText())) {
                    ConsoleOutput.success(label);
                } else {
                    ConsoleOutput.error(label);
                }
            });
        } catch (ConnectException e) {
            ConsoleOutput.serverUnavailable(port);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Status request failed: " + e.getMessage());
        }
    }

    private static String join(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(node -> values.add(node.asText()));
        return values.isEmpty() ? "-" : String.join(", ", values);
    }
}
