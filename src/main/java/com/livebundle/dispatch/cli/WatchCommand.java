package com.livebundle.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;

/**
 * CLI command: livebundle watch [session-id]
 * <p>
 * Tails the lifecycle events of one session, or of every session when no id is given.
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Stream file-change and rebuild events")
@Component
public class WatchCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Session ID (default: all sessions)")
    private String sessionId;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ServerClient client;

    public WatchCommand(ServerClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        String path = sessionId == null ? "/events" : "/sessions/" + sessionId + "/events";
        ConsoleOutput.info("Watching " + (sessionId == null ? "all sessions" : sessionId)
                + " (connecting to localhost:" + port + ")...");
        System.out.println();

        try {
            int status = client.streamEvents(port, path, ConsoleOutput::watchEvent);
            if (status == 404) {
                ConsoleOutput.error("Session not found: " + sessionId);
                return;
            }
            if (status != 200) {
                ConsoleOutput.error("Server returned HTTP " + status);
                return;
            }
            System.out.println();
            ConsoleOutput.info("Stream ended.");
        } catch (ConnectException e) {
            ConsoleOutput.serverUnavailable(port);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }
}
