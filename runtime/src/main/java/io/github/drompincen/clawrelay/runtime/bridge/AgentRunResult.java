package io.github.drompincen.clawrelay.runtime.bridge;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

public record AgentRunResult(
        String output,
        Duration duration,
        JsonNode acknowledgement
) {}
