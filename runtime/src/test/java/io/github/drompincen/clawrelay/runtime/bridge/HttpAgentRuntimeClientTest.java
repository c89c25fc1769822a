package io.github.drompincen.clawrelay.runtime.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;
import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.error.AgentSessionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpAgentRuntimeClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, String> received = new ConcurrentHashMap<>();
    private HttpServer server;
    private URI baseUri;
    private HttpAgentRuntimeClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/global/health", ex -> respond(ex, 200, "{\"healthy\":true}"));
        server.createContext("/session", this::handleSession);
        server.createContext("/event", ex -> {
            ex.getResponseHeaders().add("Content-Type", "text/event-stream");
            respond(ex, 200, "data: {\"type\":\"session.idle\",\"properties\":{\"sessionID\":\"ses_1\"}}\n\n");
        });
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        client = new HttpAgentRuntimeClient(mapper, new RelayProperties());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handleSession(HttpExchange ex) throws IOException {
        String path = ex.getRequestURI().getPath();
        String body = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        received.put(path, body);
        if (path.equals("/session")) {
            respond(ex, 200, "{\"id\":\"ses_1\"}");
        } else if (path.endsWith("/message")) {
            respond(ex, 200, "{\"parts\":[{\"type\":\"text\",\"text\":\"pong\"}]}");
        } else if (path.contains("/permissions/")) {
            respond(ex, 200, "true");
        } else if (path.endsWith("/abort")) {
            respond(ex, 500, "{\"error\":\"nope\"}");
        } else {
            respond(ex, 404, "");
        }
    }

    private static void respond(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = ex.getResponseBody()) {
                out.write(bytes);
            }
        }
        ex.close();
    }

    @Test
    void healthReflectsServerState() {
        assertThat(client.health(baseUri)).isTrue();
        assertThat(client.health(URI.create("http://127.0.0.1:1"))).isFalse();
    }

    @Test
    void createSessionPostsTitle() throws Exception {
        String id = client.createSession(baseUri, "Chat session 42");

        assertThat(id).isEqualTo("ses_1");
        assertThat(mapper.readTree(received.get("/session")).get("title").asText()).isEqualTo("Chat session 42");
    }

    @Test
    void submitPromptSendsModelAndTextPart() throws Exception {
        JsonNode ack = client.submitPrompt(baseUri, "ses_1", "openai", "gpt-4o", "ping")
                .get(5, TimeUnit.SECONDS);

        JsonNode sent = mapper.readTree(received.get("/session/ses_1/message"));
        assertThat(sent.get("model").get("providerID").asText()).isEqualTo("openai");
        assertThat(sent.get("model").get("modelID").asText()).isEqualTo("gpt-4o");
        assertThat(sent.get("parts").get(0).get("text").asText()).isEqualTo("ping");
        assertThat(ack.get("parts").get(0).get("text").asText()).isEqualTo("pong");
    }

    @Test
    void permissionReplyUsesRuntimeToken() throws Exception {
        client.replyPermission(baseUri, "ses_1", "perm_9", ApprovalDecision.APPROVE_ALWAYS);

        JsonNode sent = mapper.readTree(received.get("/session/ses_1/permissions/perm_9"));
        assertThat(sent.get("response").asText()).isEqualTo("always");
    }

    @Test
    void nonSuccessStatusRaisesSessionError() {
        assertThatThrownBy(() -> client.abort(baseUri, "ses_1"))
                .isInstanceOf(AgentSessionException.class)
                .hasMessageContaining("500");
    }

    @Test
    void eventStreamDeliversEnvelopes() throws Exception {
        try (EventStream events = client.openEventStream(baseUri)) {
            JsonNode first = events.next();
            assertThat(first.get("type").asText()).isEqualTo("session.idle");
            assertThat(events.next()).isNull();
        }
    }
}
