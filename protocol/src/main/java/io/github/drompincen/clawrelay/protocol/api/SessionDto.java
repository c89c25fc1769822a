package io.github.drompincen.clawrelay.protocol.api;

import java.time.Instant;
import java.util.Map;

public record SessionDto(
        String sessionId,
        String conversationKey,
        SessionStatus status,
        String model,
        String runtimeSessionId,
        String workspacePath,
        boolean runtimeLive,
        Instant createdAt,
        Instant lastActiveAt,
        Map<String, PermissionAction> rememberedTools
) {}
