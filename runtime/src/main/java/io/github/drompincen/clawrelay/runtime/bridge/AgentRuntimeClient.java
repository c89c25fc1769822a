package io.github.drompincen.clawrelay.runtime.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/** Request channel and event feed of a running agent runtime. */
public interface AgentRuntimeClient {

    boolean health(URI baseUri);

    /** @return the runtime's id for the new conversation session */
    String createSession(URI baseUri, String title);

    /**
     * Submits a prompt. The returned future completes with the runtime's acknowledgement, which
     * on its own does not mean the turn has finished.
     */
    CompletableFuture<JsonNode> submitPrompt(URI baseUri, String runtimeSessionId,
                                             String providerId, String modelId, String text);

    EventStream openEventStream(URI baseUri);

    void replyPermission(URI baseUri, String runtimeSessionId, String requestId, ApprovalDecision decision);

    void abort(URI baseUri, String runtimeSessionId);
}
