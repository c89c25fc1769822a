package io.github.drompincen.clawrelay.protocol.api;

public record SubmitMessageRequest(
        String userId,
        String text,
        String messageId
) {}
