package io.github.drompincen.clawrelay.runtime.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.github.drompincen.clawrelay.protocol.event.AgentEvent;
import org.springframework.stereotype.Component;

/**
 * Turns raw {@code {type, properties}} envelopes from the runtime's event stream into
 * {@link AgentEvent} variants.
 */
@Component
public class AgentEventDecoder {

    static final String DEFAULT_ERROR = "Agent session error";

    public AgentEvent decode(JsonNode envelope) {
        String type = text(envelope.path("type"));
        JsonNode props = envelope.path("properties");
        String sessionId = sessionIdOf(props);

        if (type == null) {
            return new AgentEvent.Other(sessionId, "unknown", props);
        }
        switch (type) {
            case "message.part.updated": {
                JsonNode part = props.path("part");
                if (!"text".equals(text(part.path("type")))) {
                    return new AgentEvent.Other(sessionId, type, props);
                }
                return new AgentEvent.TextPartUpdated(
                        text(part.path("sessionID")),
                        text(part.path("id")),
                        text(part.path("text")),
                        text(props.path("delta")),
                        !part.path("time").path("end").isMissingNode()
                                && !part.path("time").path("end").isNull());
            }
            case "permission.asked":
                return new AgentEvent.PermissionAsked(sessionId, permissionId(props), permissionTool(props),
                        permissionInput(props));
            case "permission.updated":
                return new AgentEvent.PermissionUpdated(sessionId, permissionId(props), permissionTool(props),
                        permissionInput(props));
            case "session.idle":
                return new AgentEvent.SessionIdle(text(props.path("sessionID")));
            case "session.error":
                return new AgentEvent.SessionError(sessionId, errorMessage(props.path("error")));
            default:
                return new AgentEvent.Other(sessionId, type, props);
        }
    }

    static String sessionIdOf(JsonNode props) {
        String id = text(props.path("sessionID"));
        if (id == null) id = text(props.path("part").path("sessionID"));
        if (id == null) id = text(props.path("info").path("id"));
        if (id == null) id = text(props.path("info").path("sessionID"));
        return id;
    }

    private static String errorMessage(JsonNode error) {
        String message = text(error.path("data").path("message"));
        if (message == null) {
            message = text(error.path("name"));
        }
        return message != null ? message : DEFAULT_ERROR;
    }

    private static String permissionId(JsonNode props) {
        String id = text(props.path("id"));
        if (id == null) id = text(props.path("requestID"));
        if (id == null) id = text(props.path("permissionID"));
        return id;
    }

    private static String permissionTool(JsonNode props) {
        String tool = text(props.path("permission"));
        return tool != null ? tool : text(props.path("type"));
    }

    private static JsonNode permissionInput(JsonNode props) {
        JsonNode metadata = props.path("metadata");
        return metadata.isMissingNode() ? NullNode.getInstance() : metadata;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }
}
