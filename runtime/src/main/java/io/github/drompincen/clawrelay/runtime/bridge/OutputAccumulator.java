package io.github.drompincen.clawrelay.runtime.bridge;

import io.github.drompincen.clawrelay.protocol.event.AgentEvent;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects assistant text from part updates. Deltas are appended as they arrive; a part's final
 * payload is only used when no delta was ever seen for that part, and only once.
 */
class OutputAccumulator {

    private final StringBuilder output = new StringBuilder();
    private final Map<String, Integer> deltaLengths = new HashMap<>();
    private final Set<String> completedParts = new HashSet<>();

    void apply(AgentEvent.TextPartUpdated update) {
        if (update.hasDelta()) {
            output.append(update.delta());
            deltaLengths.merge(update.partId(), update.delta().length(), Integer::sum);
        } else if (update.completed() && completedParts.add(update.partId())) {
            if (!deltaLengths.containsKey(update.partId()) && update.text() != null) {
                output.append(update.text());
            }
        }
    }

    String snapshot() {
        return output.toString();
    }

    boolean isEmpty() {
        return output.length() == 0;
    }
}
