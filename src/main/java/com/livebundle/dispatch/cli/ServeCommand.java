package com.livebundle.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: livebundle serve
 * <p>
 * Starts the HTTP server exposing the session API and SSE event streams. The web
 * server is enabled by {@link com.livebundle.LivebundleApplication#main} detecting
 * "serve" in the arguments; {@link CliRunner} then skips picocli so the embedded
 * server keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 livebundle serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the livebundle HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through picocli (e.g. --help); CliRunner skips picocli in serve mode
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("livebundle server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
