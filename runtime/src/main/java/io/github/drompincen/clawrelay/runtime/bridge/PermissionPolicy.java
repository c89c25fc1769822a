package io.github.drompincen.clawrelay.runtime.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawrelay.protocol.api.PermissionAction;
import io.github.drompincen.clawrelay.runtime.error.RelayException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the permission policy a runtime is launched with. Tool entries are either a single
 * action or a map of command pattern to action, where {@code *} is the fallback.
 */
@Component
public class PermissionPolicy {

    static final String WILDCARD = "*";

    private final ObjectMapper objectMapper;

    public PermissionPolicy(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode basePolicy() {
        ObjectNode policy = objectMapper.createObjectNode();
        policy.put(WILDCARD, PermissionAction.ASK.value());
        policy.set("bash", patterns(bashPatterns()));
        policy.set("edit", patterns(Map.of(WILDCARD, PermissionAction.ASK)));
        policy.put("external_directory", PermissionAction.DENY.value());
        policy.put("doom_loop", PermissionAction.ASK.value());
        return policy;
    }

    /**
     * Overlays remembered decisions on the base policy. For a pattern-map tool only the
     * {@code *} fallback changes, so explicit patterns such as {@code rm *: deny} still win.
     */
    public ObjectNode effectivePolicy(Map<String, PermissionAction> remembered) {
        ObjectNode policy = basePolicy();
        if (remembered == null) {
            return policy;
        }
        remembered.forEach((tool, action) -> {
            JsonNode current = policy.get(tool);
            if (current instanceof ObjectNode map) {
                map.put(WILDCARD, action.value());
            } else {
                policy.put(tool, action.value());
            }
        });
        return policy;
    }

    public String toJson(Map<String, PermissionAction> remembered) {
        try {
            return objectMapper.writeValueAsString(effectivePolicy(remembered));
        } catch (JsonProcessingException e) {
            throw new RelayException("Failed to serialise permission policy", e);
        }
    }

    private ObjectNode patterns(Map<String, PermissionAction> entries) {
        ObjectNode node = objectMapper.createObjectNode();
        entries.forEach((pattern, action) -> node.put(pattern, action.value()));
        return node;
    }

    private static Map<String, PermissionAction> bashPatterns() {
        Map<String, PermissionAction> bash = new LinkedHashMap<>();
        bash.put(WILDCARD, PermissionAction.ASK);
        for (String allowed : new String[]{"git", "git status", "git log", "git diff", "git add",
                "npm", "pnpm", "yarn", "pip", "pip3", "python", "node", "grep", "cat", "ls", "find"}) {
            bash.put(allowed + " *", PermissionAction.ALLOW);
        }
        bash.put("git commit *", PermissionAction.ASK);
        for (String denied : new String[]{"git push", "rm", "sudo", "docker", "kubectl"}) {
            bash.put(denied + " *", PermissionAction.DENY);
        }
        bash.put("curl *", PermissionAction.ASK);
        bash.put("wget *", PermissionAction.ASK);
        return bash;
    }
}
