package io.github.drompincen.clawrelay.runtime.error;

public class ModelListUnavailableException extends RelayException {

    public ModelListUnavailableException(String message) {
        super(message);
    }

    public ModelListUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
