package io.github.drompincen.clawrelay.runtime.error;

/**
 * A permission event could not be correlated with a pending request, typically because it
 * carried no request id. The event loop logs and skips it.
 */
public class PermissionProtocolException extends RelayException {

    public PermissionProtocolException(String message) {
        super(message);
    }

    public PermissionProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
