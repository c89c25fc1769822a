package io.github.drompincen.clawrelay.protocol.api;

import java.time.Instant;

public record JobDto(
        String jobId,
        String conversationKey,
        String userId,
        JobStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        String error
) {}
