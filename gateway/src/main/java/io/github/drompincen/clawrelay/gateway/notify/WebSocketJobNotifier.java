package io.github.drompincen.clawrelay.gateway.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawrelay.gateway.websocket.RelayWebSocketHandler;
import io.github.drompincen.clawrelay.protocol.api.PermissionRequest;
import io.github.drompincen.clawrelay.protocol.ws.WsMessage;
import io.github.drompincen.clawrelay.protocol.ws.WsMessageType;
import io.github.drompincen.clawrelay.runtime.auth.AuthEvent;
import io.github.drompincen.clawrelay.runtime.bridge.AgentRunResult;
import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.job.Job;
import io.github.drompincen.clawrelay.runtime.job.JobListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns job lifecycle callbacks into WebSocket messages for the job's conversation.
 * Progress is throttled per job; every job ends with exactly one terminal message.
 */
@Component
public class WebSocketJobNotifier implements JobListener {

    private static final Logger log = LoggerFactory.getLogger(WebSocketJobNotifier.class);

    static final int TAIL_LINES = 12;
    static final int TAIL_CHARS = 3500;
    static final int MAX_ERROR_LENGTH = 500;

    private final RelayWebSocketHandler sockets;
    private final ObjectMapper objectMapper;
    private final Duration progressInterval;
    private final Clock clock;
    private final Map<String, Instant> lastProgress = new ConcurrentHashMap<>();

    @Autowired
    public WebSocketJobNotifier(RelayWebSocketHandler sockets, ObjectMapper objectMapper, RelayProperties properties) {
        this(sockets, objectMapper, properties, Clock.systemUTC());
    }

    WebSocketJobNotifier(RelayWebSocketHandler sockets, ObjectMapper objectMapper,
                         RelayProperties properties, Clock clock) {
        this.sockets = sockets;
        this.objectMapper = objectMapper;
        this.progressInterval = properties.getProgressInterval();
        this.clock = clock;
    }

    @Override
    public void onQueued(Job job, int position) {
        send(job, WsMessageType.JOB_QUEUED, jobPayload(job).put("position", position));
    }

    @Override
    public void onStarted(Job job) {
        send(job, WsMessageType.JOB_STARTED, jobPayload(job));
    }

    @Override
    public void onProgress(Job job, String output, Duration elapsed) {
        Instant now = clock.instant();
        Instant previous = lastProgress.get(job.getJobId());
        if (previous != null && Duration.between(previous, now).compareTo(progressInterval) < 0) {
            return;
        }
        lastProgress.put(job.getJobId(), now);
        send(job, WsMessageType.JOB_PROGRESS, jobPayload(job)
                .put("output", tail(output))
                .put("elapsedSeconds", elapsed.toSeconds()));
    }

    @Override
    public void onApprovalRequested(Job job, PermissionRequest request) {
        ObjectNode payload = jobPayload(job)
                .put("requestId", request.requestId())
                .put("tool", request.tool());
        payload.set("input", request.input());
        send(job, WsMessageType.APPROVAL_REQUESTED, payload);
    }

    @Override
    public void onCompleted(Job job, AgentRunResult result) {
        lastProgress.remove(job.getJobId());
        send(job, WsMessageType.JOB_COMPLETED, jobPayload(job)
                .put("output", result.output())
                .put("durationSeconds", result.duration().toSeconds()));
    }

    @Override
    public void onFailed(Job job, String error) {
        lastProgress.remove(job.getJobId());
        send(job, WsMessageType.JOB_FAILED, jobPayload(job).put("error", truncate(error)));
    }

    @Override
    public void onCancelled(Job job) {
        lastProgress.remove(job.getJobId());
        send(job, WsMessageType.JOB_CANCELLED, jobPayload(job));
    }

    /** Relays one step of an interactive login to the conversation that started it. */
    public void onAuthEvent(String conversationKey, String provider, AuthEvent event) {
        ObjectNode payload = objectMapper.createObjectNode().put("provider", provider);
        switch (event.type()) {
            case URL_DETECTED -> {
                payload.put("url", event.url());
                sockets.broadcast(conversationKey, WsMessage.of(WsMessageType.LOGIN_URL, conversationKey, payload));
            }
            case SUCCEEDED -> {
                payload.put("success", true);
                sockets.broadcast(conversationKey, WsMessage.of(WsMessageType.LOGIN_RESULT, conversationKey, payload));
            }
            case FAILED -> {
                payload.put("success", false).put("error", truncate(event.reason()));
                sockets.broadcast(conversationKey, WsMessage.of(WsMessageType.LOGIN_RESULT, conversationKey, payload));
            }
        }
    }

    private ObjectNode jobPayload(Job job) {
        return objectMapper.createObjectNode().put("jobId", job.getJobId());
    }

    private void send(Job job, WsMessageType type, ObjectNode payload) {
        try {
            sockets.broadcast(job.getConversationKey(), WsMessage.of(type, job.getConversationKey(), payload));
        } catch (RuntimeException e) {
            log.error("Failed to notify {} for job {}", type, job.getJobId(), e);
        }
    }

    /** Last {@value #TAIL_LINES} lines of the output, capped at {@value #TAIL_CHARS} characters. */
    static String tail(String output) {
        if (output == null || output.isEmpty()) return "";
        String[] lines = output.split("\n", -1);
        String text = lines.length <= TAIL_LINES
                ? output
                : String.join("\n", Arrays.copyOfRange(lines, lines.length - TAIL_LINES, lines.length));
        if (text.length() > TAIL_CHARS) {
            text = text.substring(text.length() - TAIL_CHARS);
        }
        return text;
    }

    static String truncate(String error) {
        if (error == null) return "Unknown error";
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
