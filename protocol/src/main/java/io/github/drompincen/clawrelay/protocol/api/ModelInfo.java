package io.github.drompincen.clawrelay.protocol.api;

public record ModelInfo(
        String id,
        String name
) {}
