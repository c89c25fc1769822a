package io.github.drompincen.clawrelay.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String conversationKey,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String conversationKey, JsonNode payload) {
        return new WsMessage(type, conversationKey, payload, Instant.now());
    }

    public static WsMessage error(String conversationKey, JsonNode payload) {
        return of(WsMessageType.ERROR, conversationKey, payload);
    }
}
