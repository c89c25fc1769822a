package io.github.drompincen.clawrelay.runtime.approval;

import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;
import io.github.drompincen.clawrelay.protocol.api.PermissionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Correlates permission requests raised by a session's runtime with the operator's decision.
 * A job suspends on the future returned by {@link #register}; whoever answers calls
 * {@link #resolve}. Entries are never left dangling: teardown paths call {@link #discardAll}.
 */
@Service
public class ApprovalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ApprovalCoordinator.class);

    private final Map<String, Map<String, PendingApproval>> pendingBySession = new ConcurrentHashMap<>();

    public CompletableFuture<ApprovalDecision> register(String sessionId, PermissionRequest request) {
        PendingApproval pending = new PendingApproval(request, new CompletableFuture<>());
        PendingApproval existing = pendingBySession
                .computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>())
                .putIfAbsent(request.requestId(), pending);
        if (existing != null) {
            return existing.future();
        }
        log.info("Permission {} for tool {} pending in session {}", request.requestId(), request.tool(), sessionId);
        return pending.future();
    }

    /**
     * Completes a pending request.
     *
     * @return false if nothing was pending under that id (already answered, discarded, or unknown)
     */
    public boolean resolve(String sessionId, String requestId, ApprovalDecision decision) {
        Map<String, PendingApproval> pending = pendingBySession.get(sessionId);
        if (pending == null) {
            return false;
        }
        PendingApproval entry = pending.remove(requestId);
        if (entry == null) {
            return false;
        }
        boolean completed = entry.future().complete(decision);
        log.info("Permission {} in session {} resolved as {}", requestId, sessionId, decision);
        return completed;
    }

    public void discard(String sessionId, String requestId) {
        Map<String, PendingApproval> pending = pendingBySession.get(sessionId);
        if (pending == null) {
            return;
        }
        PendingApproval entry = pending.remove(requestId);
        if (entry != null) {
            entry.future().cancel(false);
        }
    }

    /** Drops every pending request of a session; waiting jobs see a {@link CancellationException}. */
    public int discardAll(String sessionId) {
        Map<String, PendingApproval> pending = pendingBySession.remove(sessionId);
        if (pending == null || pending.isEmpty()) {
            return 0;
        }
        pending.values().forEach(entry ->
                entry.future().completeExceptionally(new CancellationException("Approval discarded")));
        log.info("Discarded {} pending approval(s) for session {}", pending.size(), sessionId);
        return pending.size();
    }

    public List<PermissionRequest> pending(String sessionId) {
        Map<String, PendingApproval> pending = pendingBySession.get(sessionId);
        if (pending == null) {
            return List.of();
        }
        return pending.values().stream()
                .map(PendingApproval::request)
                .sorted(Comparator.comparing(PermissionRequest::createdAt))
                .toList();
    }

    private record PendingApproval(PermissionRequest request, CompletableFuture<ApprovalDecision> future) {}
}
