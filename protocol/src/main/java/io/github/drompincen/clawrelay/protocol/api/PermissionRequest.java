package io.github.drompincen.clawrelay.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record PermissionRequest(
        String requestId,
        String tool,
        JsonNode input,
        Instant createdAt
) {}
