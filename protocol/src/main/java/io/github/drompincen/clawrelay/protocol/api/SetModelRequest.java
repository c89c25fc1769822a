package io.github.drompincen.clawrelay.protocol.api;

public record SetModelRequest(
        String modelId
) {}
