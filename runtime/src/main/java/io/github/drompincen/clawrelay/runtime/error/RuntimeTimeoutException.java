package io.github.drompincen.clawrelay.runtime.error;

/** A bounded wait on an external process elapsed; the process has been terminated. */
public class RuntimeTimeoutException extends RelayException {

    public RuntimeTimeoutException(String message) {
        super(message);
    }

    public RuntimeTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
