package io.github.drompincen.clawrelay.runtime.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;
import io.github.drompincen.clawrelay.protocol.api.ModelInfo;
import io.github.drompincen.clawrelay.protocol.api.PermissionRequest;
import io.github.drompincen.clawrelay.protocol.event.AgentEvent;
import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.error.AgentSessionException;
import io.github.drompincen.clawrelay.runtime.error.PermissionProtocolException;
import io.github.drompincen.clawrelay.runtime.error.RelayException;
import io.github.drompincen.clawrelay.runtime.error.RuntimeCrashedException;
import io.github.drompincen.clawrelay.runtime.error.RuntimeTimeoutException;
import io.github.drompincen.clawrelay.runtime.session.Session;
import io.github.drompincen.clawrelay.runtime.session.SessionRegistry;
import io.github.drompincen.clawrelay.runtime.workspace.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one message through a session's agent runtime: starts the runtime if needed, submits the
 * prompt, and consumes the event feed until the runtime session goes idle. Permission requests
 * suspend the feed until the {@link ApprovalHandler}'s future completes.
 */
@Service
public class AgentBridge {

    private static final Logger log = LoggerFactory.getLogger(AgentBridge.class);

    private final RuntimeLauncher launcher;
    private final AgentRuntimeClient client;
    private final AgentEventDecoder decoder;
    private final PermissionPolicy permissionPolicy;
    private final ModelCatalog modelCatalog;
    private final SessionRegistry sessionRegistry;
    private final WorkspaceStore workspaceStore;
    private final Duration ackTimeout;

    public AgentBridge(RuntimeLauncher launcher, AgentRuntimeClient client, AgentEventDecoder decoder,
                       PermissionPolicy permissionPolicy, ModelCatalog modelCatalog,
                       SessionRegistry sessionRegistry, WorkspaceStore workspaceStore,
                       RelayProperties properties) {
        this.launcher = launcher;
        this.client = client;
        this.decoder = decoder;
        this.permissionPolicy = permissionPolicy;
        this.modelCatalog = modelCatalog;
        this.sessionRegistry = sessionRegistry;
        this.workspaceStore = workspaceStore;
        this.ackTimeout = properties.getRuntime().getRequestTimeout();
    }

    public RuntimeHandle ensureRuntime(Session session) {
        RuntimeHandle runtime = session.getRuntime();
        if (runtime != null && runtime.isAlive()) {
            return runtime;
        }
        if (runtime != null) {
            log.warn("Runtime for session {} is gone, relaunching", session.getSessionId());
            session.setRuntime(null);
        }
        RuntimeHandle launched = launcher.launch(session.getPaths(),
                permissionPolicy.toJson(session.getRememberedTools()));
        session.setRuntime(launched);
        return launched;
    }

    public AgentRunResult runMessage(Session session, String text, ProgressListener progress,
                                     ApprovalHandler approvals, CancellationToken cancellation) {
        RuntimeHandle runtime = ensureRuntime(session);
        String runtimeSessionId = ensureRuntimeSession(session, runtime);
        String[] model = splitModel(session.getModel());
        long startNanos = System.nanoTime();

        log.info("Running prompt in session {} (runtime session {}, model {})",
                session.getSessionId(), runtimeSessionId, session.getModel());

        EventStream stream = client.openEventStream(runtime.baseUri());
        AtomicReference<Throwable> promptFailure = new AtomicReference<>();
        CompletableFuture<JsonNode> ack = null;
        try {
            cancellation.onCancel(stream::close);
            ack = client.submitPrompt(runtime.baseUri(), runtimeSessionId, model[0], model[1], text);
            ack.whenComplete((body, error) -> {
                if (error != null) {
                    promptFailure.compareAndSet(null, unwrap(error));
                    stream.close();
                }
            });

            OutputAccumulator output = new OutputAccumulator();
            consumeUntilIdle(session, runtime, runtimeSessionId, stream, output, progress, approvals,
                    cancellation, promptFailure, startNanos);

            JsonNode acknowledgement = awaitAcknowledgement(ack, cancellation, session, runtime, runtimeSessionId);
            String result = output.isEmpty() ? fallbackText(acknowledgement) : output.snapshot();
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            log.info("Prompt in session {} finished in {}s with {} chars", session.getSessionId(),
                    duration.toSeconds(), result.length());
            return new AgentRunResult(result, duration, acknowledgement);
        } finally {
            stream.close();
            if (ack != null && !ack.isDone()) {
                ack.cancel(true);
            }
        }
    }

    public List<ModelInfo> listAvailableModels() {
        return modelCatalog.listModels();
    }

    /** Publishes the session's credentials to the shared store. Failures are only logged. */
    public void syncCredentials(Session session) {
        try {
            if (workspaceStore.publishCredentials(session.getPaths())) {
                log.debug("Published credentials from session {}", session.getSessionId());
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Credential sync from session {} failed: {}", session.getSessionId(), e.getMessage());
        }
    }

    private String ensureRuntimeSession(Session session, RuntimeHandle runtime) {
        String runtimeSessionId = session.getRuntimeSessionId();
        if (runtimeSessionId != null) {
            return runtimeSessionId;
        }
        runtimeSessionId = client.createSession(runtime.baseUri(), "Chat session " + session.getConversationKey());
        sessionRegistry.bindRuntimeSession(session, runtimeSessionId);
        log.info("Created runtime session {} for session {}", runtimeSessionId, session.getSessionId());
        return runtimeSessionId;
    }

    private void consumeUntilIdle(Session session, RuntimeHandle runtime, String runtimeSessionId,
                                  EventStream stream, OutputAccumulator output, ProgressListener progress,
                                  ApprovalHandler approvals, CancellationToken cancellation,
                                  AtomicReference<Throwable> promptFailure, long startNanos) {
        Set<String> answered = new HashSet<>();
        while (true) {
            if (cancellation.isCancelled()) {
                throw cancelled(session, runtime, runtimeSessionId);
            }
            JsonNode raw;
            IOException streamError = null;
            try {
                raw = stream.next();
            } catch (IOException e) {
                raw = null;
                streamError = e;
            }

            if (raw == null) {
                if (cancellation.isCancelled()) {
                    throw cancelled(session, runtime, runtimeSessionId);
                }
                Throwable failure = promptFailure.get();
                if (failure != null) {
                    throw asRelayException(failure);
                }
                if (!runtime.isAlive()) {
                    session.setRuntime(null);
                    throw new RuntimeCrashedException("Runtime for session " + session.getSessionId()
                            + " exited while the job was running", streamError);
                }
                throw new AgentSessionException("Event stream ended before the session went idle", streamError);
            }

            AgentEvent event = decoder.decode(raw);
            if (event.sessionId() != null && !event.sessionId().equals(runtimeSessionId)) {
                continue;
            }
            log.debug("Event {} for runtime session {}", event.type(), runtimeSessionId);

            if (event instanceof AgentEvent.TextPartUpdated update) {
                if (!runtimeSessionId.equals(update.sessionId())) {
                    continue;
                }
                output.apply(update);
                progress.onProgress(output.snapshot(), Duration.ofNanos(System.nanoTime() - startNanos));
            } else if (event instanceof AgentEvent.SessionError error) {
                log.warn("Runtime session {} reported error: {}", runtimeSessionId, error.message());
                throw new AgentSessionException(error.message());
            } else if (event instanceof AgentEvent.SessionIdle idle) {
                if (runtimeSessionId.equals(idle.sessionId())) {
                    return;
                }
            } else if (event instanceof AgentEvent.PermissionAsked asked) {
                answerQuietly(session, runtime, runtimeSessionId, asked.requestId(), asked.tool(),
                        asked.input(), answered, approvals, cancellation);
            } else if (event instanceof AgentEvent.PermissionUpdated updated) {
                answerQuietly(session, runtime, runtimeSessionId, updated.requestId(), updated.tool(),
                        updated.input(), answered, approvals, cancellation);
            }
        }
    }

    /** A malformed permission event is logged and skipped; the job keeps consuming events. */
    private void answerQuietly(Session session, RuntimeHandle runtime, String runtimeSessionId,
                               String requestId, String tool, JsonNode input, Set<String> answered,
                               ApprovalHandler approvals, CancellationToken cancellation) {
        try {
            answerPermission(session, runtime, runtimeSessionId, requestId, tool, input, answered,
                    approvals, cancellation);
        } catch (PermissionProtocolException e) {
            log.warn("Skipping permission event in session {}: {}", session.getSessionId(), e.getMessage());
        }
    }

    private void answerPermission(Session session, RuntimeHandle runtime, String runtimeSessionId,
                                  String requestId, String tool, JsonNode input, Set<String> answered,
                                  ApprovalHandler approvals, CancellationToken cancellation) {
        if (requestId == null || requestId.isBlank()) {
            throw new PermissionProtocolException("Permission event for tool " + tool + " carried no request id");
        }
        if (!answered.add(requestId)) {
            return;
        }
        PermissionRequest request = new PermissionRequest(requestId, tool, input, Instant.now());
        ApprovalDecision decision = awaitDecision(approvals.requestApproval(request), cancellation,
                session, runtime, runtimeSessionId);

        client.replyPermission(runtime.baseUri(), runtimeSessionId, requestId, decision);
        log.info("Replied {} to permission {} ({}) in session {}", decision.replyToken(), requestId, tool,
                session.getSessionId());
        if (decision.isRemembered() && tool != null) {
            sessionRegistry.rememberDecision(session, tool);
        }
    }

    private ApprovalDecision awaitDecision(CompletableFuture<ApprovalDecision> pending, CancellationToken cancellation,
                                           Session session, RuntimeHandle runtime, String runtimeSessionId) {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(session, runtime, runtimeSessionId);
        } catch (CancellationException e) {
            throw cancelled(session, runtime, runtimeSessionId);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException || cancellation.isCancelled()) {
                throw cancelled(session, runtime, runtimeSessionId);
            }
            throw asRelayException(e.getCause());
        }
    }

    private JsonNode awaitAcknowledgement(CompletableFuture<JsonNode> ack, CancellationToken cancellation,
                                          Session session, RuntimeHandle runtime, String runtimeSessionId) {
        try {
            return ack.get(ackTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(session, runtime, runtimeSessionId);
        } catch (ExecutionException e) {
            throw asRelayException(e.getCause());
        } catch (TimeoutException e) {
            if (cancellation.isCancelled()) {
                throw cancelled(session, runtime, runtimeSessionId);
            }
            throw new RuntimeTimeoutException("Runtime went idle but never acknowledged the prompt");
        }
    }

    private CancellationException cancelled(Session session, RuntimeHandle runtime, String runtimeSessionId) {
        try {
            client.abort(runtime.baseUri(), runtimeSessionId);
        } catch (RuntimeException e) {
            log.warn("Abort of runtime session {} failed: {}", runtimeSessionId, e.getMessage());
        }
        log.info("Stopped processing events for session {}", session.getSessionId());
        return new CancellationException("Job cancelled");
    }

    static String[] splitModel(String model) {
        int slash = model == null ? -1 : model.indexOf('/');
        if (slash <= 0 || slash == model.length() - 1) {
            throw new AgentSessionException("Model id must look like provider/model: " + model);
        }
        return new String[]{model.substring(0, slash), model.substring(slash + 1)};
    }

    static String fallbackText(JsonNode acknowledgement) {
        if (acknowledgement == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : acknowledgement.path("parts")) {
            if ("text".equals(part.path("type").asText()) && part.hasNonNull("text")) {
                text.append(part.get("text").asText());
            }
        }
        return text.toString();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RelayException asRelayException(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RelayException relay) {
            return relay;
        }
        return new AgentSessionException("Prompt failed: " + cause.getMessage(), cause);
    }
}
