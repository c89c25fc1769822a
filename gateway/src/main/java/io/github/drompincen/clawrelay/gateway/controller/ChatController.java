package io.github.drompincen.clawrelay.gateway.controller;

import io.github.drompincen.clawrelay.gateway.notify.WebSocketJobNotifier;
import io.github.drompincen.clawrelay.gateway.security.UserAllowList;
import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;
import io.github.drompincen.clawrelay.protocol.api.ApprovalDecisionRequest;
import io.github.drompincen.clawrelay.protocol.api.CancelResponse;
import io.github.drompincen.clawrelay.protocol.api.PermissionRequest;
import io.github.drompincen.clawrelay.protocol.api.SessionDto;
import io.github.drompincen.clawrelay.protocol.api.SetModelRequest;
import io.github.drompincen.clawrelay.protocol.api.SubmitMessageRequest;
import io.github.drompincen.clawrelay.protocol.api.SubmitMessageResponse;
import io.github.drompincen.clawrelay.runtime.conversation.ConversationService;
import io.github.drompincen.clawrelay.runtime.job.SubmitResult;
import io.github.drompincen.clawrelay.runtime.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/** Commands a chat transport issues on behalf of one conversation. */
@RestController
@RequestMapping("/api/chats/{conversationKey}")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final ConversationService conversations;
    private final WebSocketJobNotifier notifier;
    private final UserAllowList allowList;

    public ChatController(ConversationService conversations, WebSocketJobNotifier notifier,
                          UserAllowList allowList) {
        this.conversations = conversations;
        this.notifier = notifier;
        this.allowList = allowList;
    }

    @PostMapping("/messages")
    public ResponseEntity<?> submit(@PathVariable String conversationKey,
                                    @RequestBody SubmitMessageRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "text is required"));
        }
        if (!allowList.isAllowed(request.userId())) {
            log.warn("Rejected message {} from user {} on {}", request.messageId(), request.userId(), conversationKey);
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(Map.of("error", "User is not allowed to use this agent"));
        }
        SubmitResult result = conversations.submit(conversationKey, request.userId(), request.text(), notifier);
        log.info("Message {} on {} queued as job {} at position {}",
                request.messageId(), conversationKey, result.jobId(), result.position());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new SubmitMessageResponse(result.jobId(), result.position()));
    }

    @PostMapping("/cancel")
    public ResponseEntity<CancelResponse> cancel(@PathVariable String conversationKey) {
        return ResponseEntity.ok(new CancelResponse(conversations.cancel(conversationKey)));
    }

    @PostMapping("/session")
    public ResponseEntity<SessionDto> newSession(@PathVariable String conversationKey) {
        Session session = conversations.newSession(conversationKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(session.toDto());
    }

    @DeleteMapping("/session")
    public ResponseEntity<Void> endSession(@PathVariable String conversationKey) {
        return conversations.endSession(conversationKey)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/session")
    public ResponseEntity<SessionDto> getSession(@PathVariable String conversationKey) {
        return conversations.session(conversationKey)
                .map(s -> ResponseEntity.ok(s.toDto()))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/model")
    public ResponseEntity<?> setModel(@PathVariable String conversationKey, @RequestBody SetModelRequest request) {
        if (request.modelId() == null || request.modelId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "modelId is required"));
        }
        return ResponseEntity.ok(conversations.setModel(conversationKey, request.modelId().trim()).toDto());
    }

    @PostMapping("/approvals/{requestId}")
    public ResponseEntity<?> decide(@PathVariable String conversationKey, @PathVariable String requestId,
                                    @RequestBody ApprovalDecisionRequest request) {
        ApprovalDecision decision = ApprovalDecision.parse(request.decision());
        if (!conversations.decide(conversationKey, requestId, decision)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No pending approval " + requestId));
        }
        return ResponseEntity.ok(Map.of("requestId", requestId, "decision", decision.name()));
    }

    @GetMapping("/approvals")
    public List<PermissionRequest> pendingApprovals(@PathVariable String conversationKey) {
        return conversations.pendingApprovals(conversationKey);
    }
}
