package io.github.drompincen.clawrelay.runtime.bridge;

import io.github.drompincen.clawrelay.runtime.workspace.SessionPaths;

public interface RuntimeLauncher {

    /**
     * Starts a runtime for the given session tree and blocks until it reports healthy.
     *
     * @param policyJson effective permission policy handed to the process
     * @throws io.github.drompincen.clawrelay.runtime.error.RuntimeStartFailedException if the
     *         process exits early or never becomes healthy
     */
    RuntimeHandle launch(SessionPaths paths, String policyJson);
}
