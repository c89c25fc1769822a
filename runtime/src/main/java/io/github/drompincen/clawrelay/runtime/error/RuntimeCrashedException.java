package io.github.drompincen.clawrelay.runtime.error;

/** The agent runtime process exited while a job was using it. */
public class RuntimeCrashedException extends RelayException {

    public RuntimeCrashedException(String message) {
        super(message);
    }

    public RuntimeCrashedException(String message, Throwable cause) {
        super(message, cause);
    }
}
