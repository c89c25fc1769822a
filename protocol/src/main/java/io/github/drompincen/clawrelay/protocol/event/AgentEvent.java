package io.github.drompincen.clawrelay.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed envelope read from the agent runtime event stream. The set of variants is closed;
 * anything the relay does not act on decodes to {@link Other}.
 */
public sealed interface AgentEvent
        permits AgentEvent.TextPartUpdated,
                AgentEvent.PermissionAsked,
                AgentEvent.PermissionUpdated,
                AgentEvent.SessionIdle,
                AgentEvent.SessionError,
                AgentEvent.Other {

    /** Runtime session the event belongs to, or {@code null} for global events. */
    String sessionId();

    String type();

    /**
     * A text part of an assistant message changed. {@code delta} is set for incremental
     * updates; {@code completed} marks the final, non-incremental payload of the part.
     */
    record TextPartUpdated(String sessionId, String partId, String text, String delta, boolean completed)
            implements AgentEvent {
        public String type() { return "message.part.updated"; }
        public boolean hasDelta() { return delta != null && !delta.isEmpty(); }
    }

    record PermissionAsked(String sessionId, String requestId, String tool, JsonNode input)
            implements AgentEvent {
        public String type() { return "permission.asked"; }
    }

    record PermissionUpdated(String sessionId, String requestId, String tool, JsonNode input)
            implements AgentEvent {
        public String type() { return "permission.updated"; }
    }

    record SessionIdle(String sessionId) implements AgentEvent {
        public String type() { return "session.idle"; }
    }

    record SessionError(String sessionId, String message) implements AgentEvent {
        public String type() { return "session.error"; }
    }

    record Other(String sessionId, String type, JsonNode properties) implements AgentEvent {}
}
