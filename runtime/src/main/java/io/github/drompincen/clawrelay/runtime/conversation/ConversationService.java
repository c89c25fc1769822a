package io.github.drompincen.clawrelay.runtime.conversation;

import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;
import io.github.drompincen.clawrelay.protocol.api.ModelInfo;
import io.github.drompincen.clawrelay.protocol.api.PermissionRequest;
import io.github.drompincen.clawrelay.runtime.approval.ApprovalCoordinator;
import io.github.drompincen.clawrelay.runtime.auth.AuthEvent;
import io.github.drompincen.clawrelay.runtime.auth.InteractiveAuthService;
import io.github.drompincen.clawrelay.runtime.bridge.AgentBridge;
import io.github.drompincen.clawrelay.runtime.job.JobListener;
import io.github.drompincen.clawrelay.runtime.job.JobScheduler;
import io.github.drompincen.clawrelay.runtime.job.SubmitResult;
import io.github.drompincen.clawrelay.runtime.session.Session;
import io.github.drompincen.clawrelay.runtime.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Entry point for chat transports: one method per command a conversation can issue. */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    static final Duration TEARDOWN_WAIT = Duration.ofSeconds(15);

    private final JobScheduler jobScheduler;
    private final SessionRegistry sessionRegistry;
    private final ApprovalCoordinator approvals;
    private final AgentBridge agentBridge;
    private final InteractiveAuthService authService;

    public ConversationService(JobScheduler jobScheduler, SessionRegistry sessionRegistry,
                               ApprovalCoordinator approvals, AgentBridge agentBridge,
                               InteractiveAuthService authService) {
        this.jobScheduler = jobScheduler;
        this.sessionRegistry = sessionRegistry;
        this.approvals = approvals;
        this.agentBridge = agentBridge;
        this.authService = authService;
    }

    public SubmitResult submit(String conversationKey, String userId, String text, JobListener listener) {
        return jobScheduler.submit(conversationKey, userId, text, listener);
    }

    public int cancel(String conversationKey) {
        return jobScheduler.cancel(conversationKey);
    }

    /** Stops the key's jobs, tears its session down, and starts a fresh one. */
    public Session newSession(String conversationKey) {
        int cancelled = jobScheduler.cancelAndAwait(conversationKey, TEARDOWN_WAIT);
        if (cancelled > 0) {
            log.info("Cancelled {} job(s) before resetting session for {}", cancelled, conversationKey);
        }
        return sessionRegistry.createNew(conversationKey);
    }

    public boolean endSession(String conversationKey) {
        jobScheduler.cancelAndAwait(conversationKey, TEARDOWN_WAIT);
        return sessionRegistry.end(conversationKey);
    }

    public Optional<Session> session(String conversationKey) {
        return sessionRegistry.get(conversationKey);
    }

    public List<Session> sessions() {
        return sessionRegistry.list();
    }

    public Session setModel(String conversationKey, String modelId) {
        return sessionRegistry.setModel(conversationKey, modelId);
    }

    public List<ModelInfo> listModels() {
        return agentBridge.listAvailableModels();
    }

    /**
     * Answers a pending permission request of the key's session.
     *
     * @return false if no such request is waiting
     */
    public boolean decide(String conversationKey, String requestId, ApprovalDecision decision) {
        return sessionRegistry.get(conversationKey)
                .map(session -> approvals.resolve(session.getSessionId(), requestId, decision))
                .orElse(false);
    }

    public List<PermissionRequest> pendingApprovals(String conversationKey) {
        return sessionRegistry.get(conversationKey)
                .map(session -> approvals.pending(session.getSessionId()))
                .orElse(List.of());
    }

    public Flux<AuthEvent> login(String provider) {
        return authService.performInteractiveAuth(provider);
    }
}
