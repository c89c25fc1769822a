package io.github.drompincen.clawrelay.runtime.session;

import io.github.drompincen.clawrelay.persistence.document.SessionDocument;
import io.github.drompincen.clawrelay.protocol.api.PermissionAction;
import io.github.drompincen.clawrelay.protocol.api.SessionDto;
import io.github.drompincen.clawrelay.protocol.api.SessionStatus;
import io.github.drompincen.clawrelay.runtime.bridge.RuntimeHandle;
import io.github.drompincen.clawrelay.runtime.workspace.SessionPaths;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live view of a conversation's agent session. The runtime handle exists only in memory; the
 * rest mirrors {@link SessionDocument}.
 */
public class Session {

    private final String sessionId;
    private final String conversationKey;
    private final SessionPaths paths;
    private final Instant createdAt;
    private final Map<String, PermissionAction> rememberedTools = new ConcurrentHashMap<>();

    private volatile String model;
    private volatile String runtimeSessionId;
    private volatile SessionStatus status = SessionStatus.ACTIVE;
    private volatile Instant lastActiveAt;
    private volatile RuntimeHandle runtime;
    private volatile boolean busy;

    public Session(String sessionId, String conversationKey, SessionPaths paths, String model, Instant createdAt) {
        this.sessionId = sessionId;
        this.conversationKey = conversationKey;
        this.paths = paths;
        this.model = model;
        this.createdAt = createdAt;
        this.lastActiveAt = createdAt;
    }

    static Session fromDocument(SessionDocument doc) {
        SessionPaths paths = SessionPaths.fromWorkspace(
                Path.of(doc.getWorkspacePath()), Path.of(doc.getDataDir()), Path.of(doc.getLogsDir()));
        Session session = new Session(doc.getSessionId(), doc.getConversationKey(), paths,
                doc.getModel(), doc.getCreatedAt());
        session.runtimeSessionId = doc.getRuntimeSessionId();
        session.status = doc.getStatus();
        session.lastActiveAt = doc.getLastActiveAt() != null ? doc.getLastActiveAt() : doc.getCreatedAt();
        if (doc.getPermissions() != null) {
            session.rememberedTools.putAll(doc.getPermissions());
        }
        return session;
    }

    SessionDocument toDocument() {
        SessionDocument doc = new SessionDocument();
        doc.setConversationKey(conversationKey);
        doc.setSessionId(sessionId);
        doc.setWorkspacePath(paths.workspace().toString());
        doc.setDataDir(paths.data().toString());
        doc.setLogsDir(paths.logs().toString());
        doc.setModel(model);
        doc.setRuntimeSessionId(runtimeSessionId);
        doc.setStatus(status);
        doc.setCreatedAt(createdAt);
        doc.setLastActiveAt(lastActiveAt);
        doc.setPermissions(new LinkedHashMap<>(rememberedTools));
        return doc;
    }

    public SessionDto toDto() {
        RuntimeHandle handle = runtime;
        return new SessionDto(sessionId, conversationKey, status, model, runtimeSessionId,
                paths.workspace().toString(), handle != null && handle.isAlive(),
                createdAt, lastActiveAt, Map.copyOf(rememberedTools));
    }

    public String getSessionId() { return sessionId; }
    public String getConversationKey() { return conversationKey; }
    public SessionPaths getPaths() { return paths; }
    public Instant getCreatedAt() { return createdAt; }

    public String getModel() { return model; }
    void setModel(String model) { this.model = model; }

    public String getRuntimeSessionId() { return runtimeSessionId; }
    void setRuntimeSessionId(String runtimeSessionId) { this.runtimeSessionId = runtimeSessionId; }

    public SessionStatus getStatus() { return status; }
    void setStatus(SessionStatus status) { this.status = status; }

    public Instant getLastActiveAt() { return lastActiveAt; }
    void touch(Instant now) { this.lastActiveAt = now; }

    public RuntimeHandle getRuntime() { return runtime; }
    public void setRuntime(RuntimeHandle runtime) { this.runtime = runtime; }

    /** Set while a job is executing against this session; the idle sweep leaves busy sessions alone. */
    public boolean isBusy() { return busy; }
    public void setBusy(boolean busy) { this.busy = busy; }

    public boolean isActive() { return status == SessionStatus.ACTIVE; }

    public Map<String, PermissionAction> getRememberedTools() {
        return Map.copyOf(rememberedTools);
    }

    void remember(String tool, PermissionAction action) {
        rememberedTools.put(tool, action);
    }
}
