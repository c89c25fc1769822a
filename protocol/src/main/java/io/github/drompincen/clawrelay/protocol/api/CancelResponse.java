package io.github.drompincen.clawrelay.protocol.api;

public record CancelResponse(
        int cancelled
) {}
