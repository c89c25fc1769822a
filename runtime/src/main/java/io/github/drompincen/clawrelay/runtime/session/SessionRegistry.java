package io.github.drompincen.clawrelay.runtime.session;

import io.github.drompincen.clawrelay.persistence.document.SessionDocument;
import io.github.drompincen.clawrelay.persistence.repository.SessionRepository;
import io.github.drompincen.clawrelay.protocol.api.PermissionAction;
import io.github.drompincen.clawrelay.protocol.api.SessionStatus;
import io.github.drompincen.clawrelay.runtime.approval.ApprovalCoordinator;
import io.github.drompincen.clawrelay.runtime.bridge.RuntimeHandle;
import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.workspace.SessionPaths;
import io.github.drompincen.clawrelay.runtime.workspace.WorkspaceStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active sessions by conversation key, backed by the {@code relay_sessions} collection. Each key
 * has its own monitor so creating, ending and mutating a session never races with itself, while
 * different keys proceed independently.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final SessionRepository repository;
    private final WorkspaceStore workspaceStore;
    private final ApprovalCoordinator approvals;
    private final String defaultModel;
    private final Clock clock;

    private final Map<String, Session> active = new ConcurrentHashMap<>();
    private final Map<String, Object> keyLocks = new ConcurrentHashMap<>();

    @Autowired
    public SessionRegistry(SessionRepository repository, WorkspaceStore workspaceStore,
                           ApprovalCoordinator approvals, RelayProperties properties) {
        this(repository, workspaceStore, approvals, properties, Clock.systemUTC());
    }

    SessionRegistry(SessionRepository repository, WorkspaceStore workspaceStore,
                    ApprovalCoordinator approvals, RelayProperties properties, Clock clock) {
        this.repository = repository;
        this.workspaceStore = workspaceStore;
        this.approvals = approvals;
        this.defaultModel = properties.getDefaultModel();
        this.clock = clock;
    }

    @PostConstruct
    public void load() {
        List<SessionDocument> docs = repository.findByStatus(SessionStatus.ACTIVE);
        for (SessionDocument doc : docs) {
            try {
                Session session = Session.fromDocument(doc);
                active.put(session.getConversationKey(), session);
            } catch (RuntimeException e) {
                log.error("Skipping unreadable session record {}", doc.getConversationKey(), e);
            }
        }
        log.info("Loaded {} active session(s)", active.size());
    }

    public Session getOrCreate(String conversationKey) {
        synchronized (lockFor(conversationKey)) {
            Session session = active.get(conversationKey);
            if (session != null && session.isActive()) {
                session.touch(clock.instant());
                save(session);
                return session;
            }
            return create(conversationKey);
        }
    }

    /**
     * Hands the key's session to a job: get-or-create, mark busy and record {@code activeAt} as
     * the last activity, all under the key lock so an idle sweep cannot end it in between.
     */
    public Session acquire(String conversationKey, Instant activeAt) {
        synchronized (lockFor(conversationKey)) {
            Session session = active.get(conversationKey);
            if (session == null || !session.isActive()) {
                session = create(conversationKey);
            }
            session.setBusy(true);
            session.touch(activeAt);
            save(session);
            return session;
        }
    }

    /** Returns a session taken by {@link #acquire}; the idle window restarts now. */
    public void release(Session session) {
        synchronized (lockFor(session.getConversationKey())) {
            session.setBusy(false);
            if (session.isActive()) {
                session.touch(clock.instant());
                save(session);
            }
        }
    }

    /** Tears down whatever the key currently has and starts over with fresh directories. */
    public Session createNew(String conversationKey) {
        synchronized (lockFor(conversationKey)) {
            end(conversationKey);
            return create(conversationKey);
        }
    }

    public Optional<Session> get(String conversationKey) {
        Session session = active.get(conversationKey);
        return session != null && session.isActive() ? Optional.of(session) : Optional.empty();
    }

    public Session setModel(String conversationKey, String modelId) {
        synchronized (lockFor(conversationKey)) {
            Session session = getOrCreate(conversationKey);
            session.setModel(modelId);
            save(session);
            log.info("Session {} now uses model {}", session.getSessionId(), modelId);
            return session;
        }
    }

    /**
     * Ends the key's session: stops its runtime, deletes its directories, marks the record ENDED
     * and drops pending approvals. Calling it again, or for an unknown key, does nothing.
     *
     * @return true if a session was ended by this call
     */
    public boolean end(String conversationKey) {
        synchronized (lockFor(conversationKey)) {
            Session session = active.remove(conversationKey);
            if (session == null) {
                return false;
            }
            RuntimeHandle runtime = session.getRuntime();
            if (runtime != null) {
                runtime.stop();
                session.setRuntime(null);
            }
            approvals.discardAll(session.getSessionId());
            try {
                workspaceStore.destroy(session.getPaths());
            } catch (RuntimeException e) {
                log.error("Failed to delete workspace of session {}", session.getSessionId(), e);
            }
            session.setStatus(SessionStatus.ENDED);
            save(session);
            log.info("Ended session {} for {}", session.getSessionId(), conversationKey);
            return true;
        }
    }

    /** Ends every idle session that has no job executing against it. */
    public int sweepIdle(Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        int ended = 0;
        for (Session session : new ArrayList<>(active.values())) {
            if (endIfIdle(session.getConversationKey(), cutoff)) {
                ended++;
            }
        }
        if (ended > 0) {
            log.info("Idle sweep ended {} session(s)", ended);
        }
        return ended;
    }

    /** Ends the key's session only if, checked under the key lock, it is idle since before {@code cutoff}. */
    boolean endIfIdle(String conversationKey, Instant cutoff) {
        synchronized (lockFor(conversationKey)) {
            Session session = active.get(conversationKey);
            if (session == null || session.isBusy() || !session.getLastActiveAt().isBefore(cutoff)) {
                return false;
            }
            return end(conversationKey);
        }
    }

    public void rememberDecision(Session session, String tool) {
        synchronized (lockFor(session.getConversationKey())) {
            session.remember(tool, PermissionAction.ALLOW);
            save(session);
        }
    }

    public void bindRuntimeSession(Session session, String runtimeSessionId) {
        synchronized (lockFor(session.getConversationKey())) {
            session.setRuntimeSessionId(runtimeSessionId);
            save(session);
        }
    }

    public List<Session> list() {
        return List.copyOf(active.values());
    }

    private Session create(String conversationKey) {
        String sessionId = UUID.randomUUID().toString();
        SessionPaths paths = workspaceStore.allocate(sessionId);
        workspaceStore.seedCredentials(paths);
        Session session = new Session(sessionId, conversationKey, paths, defaultModel, clock.instant());
        active.put(conversationKey, session);
        save(session);
        log.info("Created session {} for {}", sessionId, conversationKey);
        return session;
    }

    private void save(Session session) {
        repository.save(session.toDocument());
    }

    private Object lockFor(String conversationKey) {
        return keyLocks.computeIfAbsent(conversationKey, k -> new Object());
    }
}
