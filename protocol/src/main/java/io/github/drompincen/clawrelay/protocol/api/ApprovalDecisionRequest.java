package io.github.drompincen.clawrelay.protocol.api;

public record ApprovalDecisionRequest(
        String decision
) {}
