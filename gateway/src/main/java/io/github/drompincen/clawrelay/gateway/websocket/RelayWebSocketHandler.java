package io.github.drompincen.clawrelay.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;
import io.github.drompincen.clawrelay.protocol.ws.WsMessage;
import io.github.drompincen.clawrelay.protocol.ws.WsMessageType;
import io.github.drompincen.clawrelay.runtime.conversation.ConversationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Chat-facing socket at {@code /ws}. Clients subscribe to a conversation key and receive that
 * key's job notifications; they may also answer approval prompts over the same connection.
 */
@Component
public class RelayWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final ConversationService conversations;
    private final Map<String, Set<WebSocketSession>> subscriptions = new ConcurrentHashMap<>();

    public RelayWebSocketHandler(ObjectMapper objectMapper, ConversationService conversations) {
        this.objectMapper = objectMapper;
        this.conversations = conversations;
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        subscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (IOException e) {
            reply(session, WsMessage.error(null, errorPayload("Malformed message")));
            return;
        }
        String type = node.path("type").asText();
        String key = node.path("conversationKey").asText(null);
        if (key == null || key.isBlank()) {
            reply(session, WsMessage.error(null, errorPayload("conversationKey is required")));
            return;
        }

        switch (type) {
            case "SUBSCRIBE_CHAT" -> {
                subscriptions.computeIfAbsent(key, k -> new CopyOnWriteArraySet<>()).add(session);
                reply(session, WsMessage.of(WsMessageType.SUBSCRIBED, key, null));
            }
            case "UNSUBSCRIBE" -> {
                var set = subscriptions.get(key);
                if (set != null) set.remove(session);
                reply(session, WsMessage.of(WsMessageType.UNSUBSCRIBED, key, null));
            }
            case "APPROVAL_DECISION" -> handleDecision(session, key, node.path("payload"));
            default -> reply(session, WsMessage.error(key, errorPayload("Unknown message type: " + type)));
        }
    }

    private void handleDecision(WebSocketSession session, String key, JsonNode payload) throws IOException {
        String requestId = payload.path("requestId").asText(null);
        if (requestId == null || requestId.isBlank()) {
            reply(session, WsMessage.error(key, errorPayload("requestId is required")));
            return;
        }
        ApprovalDecision decision;
        try {
            decision = ApprovalDecision.parse(payload.path("decision").asText(null));
        } catch (IllegalArgumentException e) {
            reply(session, WsMessage.error(key, errorPayload(e.getMessage())));
            return;
        }
        if (!conversations.decide(key, requestId, decision)) {
            reply(session, WsMessage.error(key, errorPayload("No pending approval " + requestId)));
        }
    }

    /** Sends a message to every open subscriber of the key. */
    public void broadcast(String conversationKey, WsMessage message) {
        var subscribers = subscriptions.get(conversationKey);
        if (subscribers == null || subscribers.isEmpty()) {
            log.debug("No subscribers for {}, dropping {}", conversationKey, message.type());
            return;
        }
        TextMessage text;
        try {
            text = new TextMessage(objectMapper.writeValueAsString(message));
        } catch (IOException e) {
            log.error("Failed to serialize {} for {}", message.type(), conversationKey, e);
            return;
        }
        for (var ws : subscribers) {
            if (!ws.isOpen()) continue;
            try {
                send(ws, text);
            } catch (IOException e) {
                log.warn("Failed to deliver {} to socket {}: {}", message.type(), ws.getId(), e.getMessage());
            }
        }
    }

    public int subscriberCount(String conversationKey) {
        var set = subscriptions.get(conversationKey);
        return set == null ? 0 : set.size();
    }

    private ObjectNode errorPayload(String error) {
        return objectMapper.createObjectNode().put("error", error);
    }

    private void reply(WebSocketSession session, WsMessage message) throws IOException {
        send(session, new TextMessage(objectMapper.writeValueAsString(message)));
    }

    // job threads and the socket's own thread may write concurrently
    private static void send(WebSocketSession session, TextMessage message) throws IOException {
        synchronized (session) {
            session.sendMessage(message);
        }
    }
}
