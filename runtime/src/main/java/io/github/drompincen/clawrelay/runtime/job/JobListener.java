package io.github.drompincen.clawrelay.runtime.job;

import io.github.drompincen.clawrelay.protocol.api.PermissionRequest;
import io.github.drompincen.clawrelay.runtime.bridge.AgentRunResult;

import java.time.Duration;

/**
 * Receives a job's lifecycle. Exactly one of {@link #onCompleted}, {@link #onFailed} or
 * {@link #onCancelled} is delivered per job. Implementations must not block.
 */
public interface JobListener {

    default void onQueued(Job job, int position) {}

    void onStarted(Job job);

    void onProgress(Job job, String output, Duration elapsed);

    void onApprovalRequested(Job job, PermissionRequest request);

    void onCompleted(Job job, AgentRunResult result);

    void onFailed(Job job, String error);

    void onCancelled(Job job);

    JobListener NOOP = new JobListener() {
        @Override public void onStarted(Job job) {}
        @Override public void onProgress(Job job, String output, Duration elapsed) {}
        @Override public void onApprovalRequested(Job job, PermissionRequest request) {}
        @Override public void onCompleted(Job job, AgentRunResult result) {}
        @Override public void onFailed(Job job, String error) {}
        @Override public void onCancelled(Job job) {}
    };
}
