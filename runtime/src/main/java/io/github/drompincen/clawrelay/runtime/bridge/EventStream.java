package io.github.drompincen.clawrelay.runtime.bridge;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Closeable;
import java.io.IOException;

/** Open subscription to a runtime's event feed. Closing it from another thread unblocks {@link #next()}. */
public interface EventStream extends Closeable {

    /**
     * Blocks until the next event envelope arrives.
     *
     * @return the envelope, or {@code null} once the stream has ended
     */
    JsonNode next() throws IOException;

    @Override
    void close();
}
