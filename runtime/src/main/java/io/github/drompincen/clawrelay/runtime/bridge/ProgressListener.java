package io.github.drompincen.clawrelay.runtime.bridge;

import java.time.Duration;

@FunctionalInterface
public interface ProgressListener {

    /** Called after every text update with the full output so far. */
    void onProgress(String output, Duration elapsed);
}
