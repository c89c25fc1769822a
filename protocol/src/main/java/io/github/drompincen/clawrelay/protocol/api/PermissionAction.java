package io.github.drompincen.clawrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PermissionAction {
    ALLOW("allow"),
    ASK("ask"),
    DENY("deny");

    private final String value;

    PermissionAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
