package com.livebundle.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

/**
 * Minimal HTTP client used by the CLI commands to talk to a running {@code livebundle serve}.
 */
@Component
public class ServerClient {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public ServerClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
    }

    public record ServerResponse(int status, JsonNode body) {
        public boolean isOk() {
            return status >= 200 && status < 300;
        }

        public String error() {
            return body.path("error").asText("HTTP " + status);
        }
    }

    public ServerResponse get(int port, String path) throws IOException, InterruptedException {
        return send(HttpRequest.newBuilder(uri(port, path)).GET());
    }

    public ServerResponse post(int port, String path) throws IOException, InterruptedException {
        return send(HttpRequest.newBuilder(uri(port, path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.noBody()));
    }

    public ServerResponse delete(int port, String path) throws IOException, InterruptedException {
        return send(HttpRequest.newBuilder(uri(port, path)).DELETE());
    }

    /**
     * Follows an SSE stream until the server closes it, passing each (event name, data) pair on.
     *
     * @return the HTTP status of the stream response
     */
    public int streamEvents(int port, String path, BiConsumer<String, String> onEvent)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(port, path))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            response.body().close();
            return response.statusCode();
        }

        final String[] currentEventType = {""};
        try (Stream<String> lines = response.body()) {
            lines.forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    onEvent.accept(eventType, line.substring(5).trim());
                    currentEventType[0] = "";
                }
            });
        }
        return 200;
    }

    private ServerResponse send(HttpRequest.Builder builder) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(
                builder.header("Accept", "application/json").build(),
                HttpResponse.BodyHandlers.ofString());
        JsonNode body = response.body() == null || response.body().isBlank()
                ? NullNode.getInstance()
                : objectMapper.readTree(response.body());
        return new ServerResponse(response.statusCode(), body);
    }

    private static URI uri(int port, String path) {
        return URI.create("http://localhost:" + port + "/api/v1" + path);
    }
}
