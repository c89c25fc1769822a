package io.github.drompincen.clawrelay.runtime.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;
import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.error.AgentSessionException;
import io.github.drompincen.clawrelay.runtime.error.RelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/** {@link AgentRuntimeClient} over the runtime's loopback HTTP API and its server-sent event feed. */
@Component
public class HttpAgentRuntimeClient implements AgentRuntimeClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentRuntimeClient.class);

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpAgentRuntimeClient(ObjectMapper objectMapper, RelayProperties properties) {
        this.objectMapper = objectMapper;
        this.requestTimeout = properties.getRuntime().getRequestTimeout();
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Override
    public boolean health(URI baseUri) {
        try {
            HttpRequest request = HttpRequest.newBuilder(baseUri.resolve("/global/health"))
                    .timeout(Duration.ofSeconds(2))
                    .GET()
                    .build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() / 100 == 2;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String createSession(URI baseUri, String title) {
        ObjectNode body = objectMapper.createObjectNode().put("title", title);
        JsonNode created = post(baseUri.resolve("/session"), body);
        String id = created.path("id").asText(null);
        if (id == null || id.isEmpty()) {
            throw new AgentSessionException("Runtime did not return a session id");
        }
        return id;
    }

    @Override
    public CompletableFuture<JsonNode> submitPrompt(URI baseUri, String runtimeSessionId,
                                                    String providerId, String modelId, String text) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putObject("model").put("providerID", providerId).put("modelID", modelId);
        body.putArray("parts").addObject().put("type", "text").put("text", text);

        HttpRequest request = jsonPost(baseUri.resolve("/session/" + runtimeSessionId + "/message"), body)
                .build();
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() / 100 != 2) {
                        throw new AgentSessionException("Prompt rejected with HTTP " + response.statusCode()
                                + ": " + response.body());
                    }
                    return readTree(response.body());
                });
    }

    @Override
    public EventStream openEventStream(URI baseUri) {
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve("/event"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        try {
            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() / 100 != 2) {
                response.body().close();
                throw new AgentSessionException("Event stream rejected with HTTP " + response.statusCode());
            }
            return new SseEventStream(response.body(), objectMapper);
        } catch (IOException e) {
            throw new AgentSessionException("Failed to open event stream", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentSessionException("Interrupted while opening event stream", e);
        }
    }

    @Override
    public void replyPermission(URI baseUri, String runtimeSessionId, String requestId, ApprovalDecision decision) {
        ObjectNode body = objectMapper.createObjectNode().put("response", decision.replyToken());
        post(baseUri.resolve("/session/" + runtimeSessionId + "/permissions/" + requestId), body);
    }

    @Override
    public void abort(URI baseUri, String runtimeSessionId) {
        post(baseUri.resolve("/session/" + runtimeSessionId + "/abort"), objectMapper.createObjectNode());
    }

    private JsonNode post(URI uri, JsonNode body) {
        HttpRequest request = jsonPost(uri, body).timeout(requestTimeout).build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new AgentSessionException("POST " + uri.getPath() + " failed with HTTP "
                        + response.statusCode() + ": " + response.body());
            }
            return readTree(response.body());
        } catch (IOException e) {
            throw new AgentSessionException("POST " + uri.getPath() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentSessionException("Interrupted during POST " + uri.getPath(), e);
        }
    }

    private HttpRequest.Builder jsonPost(URI uri, JsonNode body) {
        try {
            return HttpRequest.newBuilder(uri)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
        } catch (JsonProcessingException e) {
            throw new RelayException("Failed to serialise request body", e);
        }
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AgentSessionException("Runtime returned malformed JSON", e);
        }
    }

    /** Reads {@code data:} lines, joining multi-line payloads until the blank line that ends an event. */
    static class SseEventStream implements EventStream {

        private final InputStream input;
        private final BufferedReader reader;
        private final ObjectMapper objectMapper;
        private volatile boolean closed;

        SseEventStream(InputStream input, ObjectMapper objectMapper) {
            this.input = input;
            this.reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
            this.objectMapper = objectMapper;
        }

        @Override
        public JsonNode next() throws IOException {
            StringBuilder data = new StringBuilder();
            String line;
            while (!closed && (line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    if (data.length() == 0) {
                        continue;
                    }
                    JsonNode event = parse(data.toString());
                    data.setLength(0);
                    if (event != null) {
                        return event;
                    }
                } else if (line.startsWith("data:")) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    data.append(line.substring(5).stripLeading());
                }
            }
            if (!closed && data.length() > 0) {
                return parse(data.toString());
            }
            return null;
        }

        private JsonNode parse(String payload) {
            try {
                return objectMapper.readTree(payload);
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed event payload: {}", e.getOriginalMessage());
                return null;
            }
        }

        @Override
        public void close() {
            closed = true;
            try {
                input.close();
            } catch (IOException e) {
                log.debug("Error closing event stream: {}", e.getMessage());
            }
        }
    }
}
