package io.github.drompincen.clawrelay.runtime.auth;

/** Step of an interactive login: a URL for the operator to open, then exactly one outcome. */
public record AuthEvent(Type type, String url, String reason) {

    public enum Type { URL_DETECTED, SUCCEEDED, FAILED }

    public static AuthEvent urlDetected(String url) {
        return new AuthEvent(Type.URL_DETECTED, url, null);
    }

    public static AuthEvent succeeded() {
        return new AuthEvent(Type.SUCCEEDED, null, null);
    }

    public static AuthEvent failed(String reason) {
        return new AuthEvent(Type.FAILED, null, reason);
    }

    public boolean isTerminal() {
        return type != Type.URL_DETECTED;
    }
}
