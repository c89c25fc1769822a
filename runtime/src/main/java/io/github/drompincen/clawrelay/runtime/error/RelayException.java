package io.github.drompincen.clawrelay.runtime.error;

/**
 * Base type for failures raised by the orchestrator. Messages are meant to be shown to the
 * operator, so they stay short and free of stack detail.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
