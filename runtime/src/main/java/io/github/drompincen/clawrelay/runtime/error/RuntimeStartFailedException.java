package io.github.drompincen.clawrelay.runtime.error;

/** The agent runtime process never became healthy. The session stays usable and the next job retries the launch. */
public class RuntimeStartFailedException extends RelayException {

    public RuntimeStartFailedException(String message) {
        super(message);
    }

    public RuntimeStartFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
