package io.github.drompincen.clawrelay.protocol.api;

public enum SessionStatus {
    ACTIVE,
    ENDED
}
