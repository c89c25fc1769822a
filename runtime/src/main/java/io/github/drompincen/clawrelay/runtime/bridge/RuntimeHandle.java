package io.github.drompincen.clawrelay.runtime.bridge;

import java.net.URI;

/** A launched agent runtime process listening on a loopback port. */
public interface RuntimeHandle {

    int port();

    URI baseUri();

    boolean isAlive();

    /** Terminates the process. Safe to call more than once. */
    void stop();
}
