package io.github.drompincen.clawrelay.runtime.error;

public class AgentSessionException extends RelayException {

    public AgentSessionException(String message) {
        super(message);
    }

    public AgentSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
