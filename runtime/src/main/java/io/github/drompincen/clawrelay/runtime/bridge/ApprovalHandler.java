package io.github.drompincen.clawrelay.runtime.bridge;

import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;
import io.github.drompincen.clawrelay.protocol.api.PermissionRequest;

import java.util.concurrent.CompletableFuture;

/** Surfaces a permission request to a human; the event loop blocks on the returned future. */
@FunctionalInterface
public interface ApprovalHandler {

    CompletableFuture<ApprovalDecision> requestApproval(PermissionRequest request);
}
