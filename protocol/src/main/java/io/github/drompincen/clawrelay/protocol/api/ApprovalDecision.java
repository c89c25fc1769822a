package io.github.drompincen.clawrelay.protocol.api;

import java.util.Locale;

/**
 * Human answer to a permission request raised by the agent runtime.
 * Each value carries the token the runtime expects in its permission reply.
 */
public enum ApprovalDecision {
    APPROVE_ONCE("once"),
    APPROVE_ALWAYS("always"),
    DENY("reject");

    private final String replyToken;

    ApprovalDecision(String replyToken) {
        this.replyToken = replyToken;
    }

    public String replyToken() {
        return replyToken;
    }

    public boolean isApproved() {
        return this != DENY;
    }

    public boolean isRemembered() {
        return this == APPROVE_ALWAYS;
    }

    /**
     * Accepts enum names as well as the short aliases used by chat buttons
     * ({@code approve}, {@code approve_all}, {@code deny}).
     */
    public static ApprovalDecision parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("decision is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "approve", "approve_once", "once" -> APPROVE_ONCE;
            case "approve_all", "approve_always", "always" -> APPROVE_ALWAYS;
            case "deny", "reject" -> DENY;
            default -> throw new IllegalArgumentException("Unknown decision: " + value);
        };
    }
}
