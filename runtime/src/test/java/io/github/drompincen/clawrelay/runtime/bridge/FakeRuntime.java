package io.github.drompincen.clawrelay.runtime.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;

import java.io.UncheckedIOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory agent runtime: tests script events and observe the requests the bridge makes. */
class FakeRuntime implements AgentRuntimeClient, RuntimeLauncher, RuntimeHandle {

    private static final JsonNode END = MissingNode.getInstance();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    final BlockingQueue<JsonNode> events = new LinkedBlockingQueue<>();
    final List<String> replies = new CopyOnWriteArrayList<>();
    final List<String> prompts = new CopyOnWriteArrayList<>();
    final AtomicInteger launches = new AtomicInteger();
    final AtomicInteger sessionsCreated = new AtomicInteger();
    final AtomicBoolean aborted = new AtomicBoolean();
    final AtomicBoolean alive = new AtomicBoolean(true);
    volatile CompletableFuture<JsonNode> ack = CompletableFuture.completedFuture(MAPPER.createObjectNode());
    volatile String lastPolicy;

    static JsonNode json(String raw) {
        try {
            return MAPPER.readTree(raw.replace('\'', '"'));
        } catch (Exception e) {
            throw new IllegalArgumentException(raw, e);
        }
    }

    void emit(String raw) {
        events.add(json(raw));
    }

    void endStream() {
        events.add(END);
    }

    // launcher

    @Override
    public RuntimeHandle launch(io.github.drompincen.clawrelay.runtime.workspace.SessionPaths paths, String policyJson) {
        launches.incrementAndGet();
        lastPolicy = policyJson;
        alive.set(true);
        return this;
    }

    // handle

    @Override public int port() { return 4096; }
    @Override public URI baseUri() { return URI.create("http://127.0.0.1:4096"); }
    @Override public boolean isAlive() { return alive.get(); }
    @Override public void stop() { alive.set(false); }

    // client

    @Override
    public boolean health(URI baseUri) {
        return alive.get();
    }

    @Override
    public String createSession(URI baseUri, String title) {
        sessionsCreated.incrementAndGet();
        return "ses_1";
    }

    @Override
    public CompletableFuture<JsonNode> submitPrompt(URI baseUri, String runtimeSessionId,
                                                    String providerId, String modelId, String text) {
        prompts.add(providerId + "|" + modelId + "|" + text);
        return ack;
    }

    @Override
    public EventStream openEventStream(URI baseUri) {
        return new EventStream() {
            @Override
            public JsonNode next() {
                try {
                    JsonNode next = events.take();
                    return next == END ? null : next;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new UncheckedIOException(new java.io.InterruptedIOException("interrupted"));
                }
            }

            @Override
            public void close() {
                events.add(END);
            }
        };
    }

    @Override
    public void replyPermission(URI baseUri, String runtimeSessionId, String requestId, ApprovalDecision decision) {
        replies.add(requestId + "=" + decision.replyToken());
    }

    @Override
    public void abort(URI baseUri, String runtimeSessionId) {
        aborted.set(true);
    }
}
