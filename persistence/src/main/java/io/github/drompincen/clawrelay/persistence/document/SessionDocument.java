package io.github.drompincen.clawrelay.persistence.document;

import io.github.drompincen.clawrelay.protocol.api.PermissionAction;
import io.github.drompincen.clawrelay.protocol.api.SessionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Durable record of a conversation's session, one per conversation key. Process handles,
 * runtime ports and pending approvals are never stored.
 */
@Document(collection = "relay_sessions")
public class SessionDocument {

    @Id
    private String conversationKey;

    @Indexed(unique = true)
    private String sessionId;

    private String workspacePath;
    private String dataDir;
    private String logsDir;
    private String model;
    private String runtimeSessionId;

    @Indexed
    private SessionStatus status;

    private Instant createdAt;
    private Instant lastActiveAt;
    private Map<String, PermissionAction> permissions;

    public SessionDocument() {}

    public String getConversationKey() { return conversationKey; }
    public void setConversationKey(String conversationKey) { this.conversationKey = conversationKey; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getWorkspacePath() { return workspacePath; }
    public void setWorkspacePath(String workspacePath) { this.workspacePath = workspacePath; }

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }

    public String getLogsDir() { return logsDir; }
    public void setLogsDir(String logsDir) { this.logsDir = logsDir; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getRuntimeSessionId() { return runtimeSessionId; }
    public void setRuntimeSessionId(String runtimeSessionId) { this.runtimeSessionId = runtimeSessionId; }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getLastActiveAt() { return lastActiveAt; }
    public void setLastActiveAt(Instant lastActiveAt) { this.lastActiveAt = lastActiveAt; }

    public Map<String, PermissionAction> getPermissions() { return permissions; }
    public void setPermissions(Map<String, PermissionAction> permissions) { this.permissions = permissions; }
}
