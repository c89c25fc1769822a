package io.github.drompincen.clawrelay.gateway.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawrelay.gateway.websocket.RelayWebSocketHandler;
import io.github.drompincen.clawrelay.protocol.api.PermissionRequest;
import io.github.drompincen.clawrelay.protocol.ws.WsMessage;
import io.github.drompincen.clawrelay.protocol.ws.WsMessageType;
import io.github.drompincen.clawrelay.runtime.auth.AuthEvent;
import io.github.drompincen.clawrelay.runtime.bridge.AgentRunResult;
import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.job.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebSocketJobNotifierTest {

    private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

    @Mock private RelayWebSocketHandler sockets;
    @Mock private Clock clock;
    @Mock private Job job;

    private ObjectMapper objectMapper;
    private WebSocketJobNotifier notifier;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        RelayProperties properties = new RelayProperties();
        properties.setProgressInterval(Duration.ofMillis(1500));
        notifier = new WebSocketJobNotifier(sockets, objectMapper, properties, clock);
        lenient().when(job.getJobId()).thenReturn("job-1");
        lenient().when(job.getConversationKey()).thenReturn("chat-1");
    }

    private List<WsMessage> sent() {
        ArgumentCaptor<WsMessage> captor = ArgumentCaptor.forClass(WsMessage.class);
        verify(sockets, atLeastOnce()).broadcast(eq("chat-1"), captor.capture());
        return captor.getAllValues();
    }

    @Test
    void queuedCarriesPosition() {
        notifier.onQueued(job, 3);

        WsMessage message = sent().get(0);
        assertThat(message.type()).isEqualTo(WsMessageType.JOB_QUEUED);
        assertThat(message.conversationKey()).isEqualTo("chat-1");
        assertThat(message.payload().path("jobId").asText()).isEqualTo("job-1");
        assertThat(message.payload().path("position").asInt()).isEqualTo(3);
    }

    @Test
    void progressIsThrottledPerJob() {
        when(clock.instant()).thenReturn(T0, T0.plusMillis(500), T0.plusMillis(1600));

        notifier.onProgress(job, "a", Duration.ofSeconds(1));
        notifier.onProgress(job, "ab", Duration.ofSeconds(2));
        notifier.onProgress(job, "abc", Duration.ofSeconds(3));

        List<WsMessage> messages = sent();
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).payload().path("output").asText()).isEqualTo("a");
        assertThat(messages.get(1).payload().path("output").asText()).isEqualTo("abc");
        assertThat(messages.get(1).payload().path("elapsedSeconds").asLong()).isEqualTo(3);
    }

    @Test
    void approvalRequestCarriesToolAndInput() {
        var input = objectMapper.createObjectNode().put("command", "rm -rf build");

        notifier.onApprovalRequested(job, new PermissionRequest("perm-1", "bash", input, T0));

        WsMessage message = sent().get(0);
        assertThat(message.type()).isEqualTo(WsMessageType.APPROVAL_REQUESTED);
        assertThat(message.payload().path("requestId").asText()).isEqualTo("perm-1");
        assertThat(message.payload().path("tool").asText()).isEqualTo("bash");
        assertThat(message.payload().path("input").path("command").asText()).isEqualTo("rm -rf build");
    }

    @Test
    void completedCarriesOutputAndDuration() {
        notifier.onCompleted(job, new AgentRunResult("pong", Duration.ofSeconds(4), null));

        WsMessage message = sent().get(0);
        assertThat(message.type()).isEqualTo(WsMessageType.JOB_COMPLETED);
        assertThat(message.payload().path("output").asText()).isEqualTo("pong");
        assertThat(message.payload().path("durationSeconds").asLong()).isEqualTo(4);
    }

    @Test
    void failedErrorIsBounded() {
        notifier.onFailed(job, "x".repeat(2000));

        WsMessage message = sent().get(0);
        assertThat(message.type()).isEqualTo(WsMessageType.JOB_FAILED);
        assertThat(message.payload().path("error").asText()).hasSize(WebSocketJobNotifier.MAX_ERROR_LENGTH);
    }

    @Test
    void terminalMessageResetsProgressThrottle() {
        when(clock.instant()).thenReturn(T0, T0.plusMillis(100));

        notifier.onProgress(job, "first", Duration.ZERO);
        notifier.onCancelled(job);
        notifier.onProgress(job, "again", Duration.ZERO);

        assertThat(sent()).extracting(WsMessage::type).containsExactly(
                WsMessageType.JOB_PROGRESS, WsMessageType.JOB_CANCELLED, WsMessageType.JOB_PROGRESS);
    }

    @Test
    void deliveryFailureIsNotPropagated() {
        doThrow(new IllegalStateException("socket gone")).when(sockets).broadcast(any(), any());

        notifier.onStarted(job);

        verify(sockets).broadcast(eq("chat-1"), any());
    }

    @Test
    void authEventsMapToLoginMessages() {
        notifier.onAuthEvent("chat-1", "openai", AuthEvent.urlDetected("https://auth.example.com/device"));
        notifier.onAuthEvent("chat-1", "openai", AuthEvent.failed("Login timeout"));

        List<WsMessage> messages = sent();
        assertThat(messages.get(0).type()).isEqualTo(WsMessageType.LOGIN_URL);
        assertThat(messages.get(0).payload().path("url").asText()).isEqualTo("https://auth.example.com/device");
        assertThat(messages.get(1).type()).isEqualTo(WsMessageType.LOGIN_RESULT);
        assertThat(messages.get(1).payload().path("success").asBoolean()).isFalse();
        assertThat(messages.get(1).payload().path("error").asText()).isEqualTo("Login timeout");
    }

    @Test
    void tailKeepsLastLinesWithinCharacterCap() {
        String twentyLines = IntStream.rangeClosed(1, 20).mapToObj(i -> "line" + i).collect(Collectors.joining("\n"));

        String tail = WebSocketJobNotifier.tail(twentyLines);

        assertThat(tail.split("\n")).hasSize(WebSocketJobNotifier.TAIL_LINES);
        assertThat(tail).startsWith("line9").endsWith("line20");
        assertThat(WebSocketJobNotifier.tail("y".repeat(5000))).hasSize(WebSocketJobNotifier.TAIL_CHARS);
        assertThat(WebSocketJobNotifier.tail(null)).isEmpty();
    }
}
