package io.github.drompincen.clawrelay.runtime.job;

import io.github.drompincen.clawrelay.protocol.api.JobDto;
import io.github.drompincen.clawrelay.protocol.api.JobStatus;
import io.github.drompincen.clawrelay.runtime.bridge.CancellationToken;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * One inbound message on its way through the agent. State changes are guarded by the job's own
 * monitor; once terminal, a job never changes again.
 */
public class Job {

    private final String jobId;
    private final long seq;
    private final String conversationKey;
    private final String userId;
    private final String text;
    private final Instant createdAt;
    private final JobListener listener;
    private final CancellationToken cancellation = new CancellationToken();
    private final CompletableFuture<Void> finished = new CompletableFuture<>();

    private volatile JobStatus status = JobStatus.QUEUED;
    private volatile Instant startedAt;
    private volatile Instant endedAt;
    private volatile String error;
    private volatile String output;
    private Thread worker;

    Job(String jobId, long seq, String conversationKey, String userId, String text,
        Instant createdAt, JobListener listener) {
        this.jobId = jobId;
        this.seq = seq;
        this.conversationKey = conversationKey;
        this.userId = userId;
        this.text = text;
        this.createdAt = createdAt;
        this.listener = listener;
    }

    synchronized boolean markRunning(Instant now, Thread worker) {
        if (status != JobStatus.QUEUED) {
            return false;
        }
        this.status = JobStatus.RUNNING;
        this.startedAt = now;
        this.worker = worker;
        return true;
    }

    synchronized boolean complete(String output, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        this.status = JobStatus.COMPLETED;
        this.output = output;
        this.endedAt = now;
        return true;
    }

    synchronized boolean fail(String error, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        this.status = JobStatus.FAILED;
        this.error = error;
        this.endedAt = now;
        return true;
    }

    /**
     * Moves the job to CANCELLED, signalling and interrupting its worker if it is running.
     *
     * @return the status before the call, or {@code null} if the job had already ended
     */
    synchronized JobStatus cancel(Instant now) {
        if (status.isTerminal()) {
            return null;
        }
        JobStatus previous = status;
        this.status = JobStatus.CANCELLED;
        this.endedAt = now;
        cancellation.cancel();
        if (worker != null) {
            worker.interrupt();
        }
        return previous;
    }

    /** Detaches the pool thread and clears any interrupt aimed at this job. */
    synchronized void detachWorker() {
        if (worker == Thread.currentThread()) {
            Thread.interrupted();
        }
        worker = null;
    }

    void markFinished() {
        finished.complete(null);
    }

    CompletableFuture<Void> finished() {
        return finished;
    }

    JobListener listener() {
        return listener;
    }

    CancellationToken cancellation() {
        return cancellation;
    }

    long seq() {
        return seq;
    }

    public JobDto toDto() {
        return new JobDto(jobId, conversationKey, userId, status, createdAt, startedAt, endedAt, error);
    }

    public String getJobId() { return jobId; }
    public String getConversationKey() { return conversationKey; }
    public String getUserId() { return userId; }
    public String getText() { return text; }
    public Instant getCreatedAt() { return createdAt; }
    public JobStatus getStatus() { return status; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getEndedAt() { return endedAt; }
    public String getError() { return error; }
    public String getOutput() { return output; }
}
