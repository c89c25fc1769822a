package io.github.drompincen.clawrelay.runtime.job;

import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;
import io.github.drompincen.clawrelay.protocol.api.JobStatus;
import io.github.drompincen.clawrelay.runtime.approval.ApprovalCoordinator;
import io.github.drompincen.clawrelay.runtime.bridge.AgentBridge;
import io.github.drompincen.clawrelay.runtime.bridge.AgentRunResult;
import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.session.Session;
import io.github.drompincen.clawrelay.runtime.session.SessionRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs one job per inbound message on a fixed pool sized to the global concurrency cap. Jobs for
 * the same conversation are chained so that at most one of them runs at a time; jobs for different
 * conversations share the pool in FIFO order.
 */
@Service
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    static final int MAX_ERROR_LENGTH = 500;

    private final SessionRegistry sessionRegistry;
    private final AgentBridge agentBridge;
    private final ApprovalCoordinator approvals;
    private final Clock clock;

    private final ThreadPoolExecutor pool;
    private final SerialByKeyExecutor serial;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Autowired
    public JobScheduler(SessionRegistry sessionRegistry, AgentBridge agentBridge,
                        ApprovalCoordinator approvals, RelayProperties properties) {
        this(sessionRegistry, agentBridge, approvals, properties, Clock.systemUTC());
    }

    JobScheduler(SessionRegistry sessionRegistry, AgentBridge agentBridge,
                 ApprovalCoordinator approvals, RelayProperties properties, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.agentBridge = agentBridge;
        this.approvals = approvals;
        this.clock = clock;
        int cap = Math.max(1, properties.getMaxConcurrentJobs());
        AtomicInteger threadIndex = new AtomicInteger();
        this.pool = new ThreadPoolExecutor(cap, cap, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), r -> {
            Thread t = new Thread(r, "job-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.serial = new SerialByKeyExecutor(pool);
        log.info("Job scheduler started with {} slot(s)", cap);
    }

    public SubmitResult submit(String conversationKey, String userId, String text, JobListener listener) {
        Job job = new Job(newJobId(), sequence.incrementAndGet(), conversationKey, userId, text,
                clock.instant(), listener != null ? listener : JobListener.NOOP);
        jobs.put(job.getJobId(), job);
        int position = positionOf(job);
        log.info("Queued job {} for {} at position {}", job.getJobId(), conversationKey, position);
        notify(job, l -> l.onQueued(job, position));
        serial.submit(conversationKey, () -> execute(job));
        return new SubmitResult(job.getJobId(), position);
    }

    /**
     * Cancels the key's running job and every job queued behind it.
     *
     * @return how many jobs were affected
     */
    public int cancel(String conversationKey) {
        int affected = 0;
        for (Job job : jobsFor(conversationKey)) {
            JobStatus previous = job.cancel(clock.instant());
            if (previous == null) {
                continue;
            }
            affected++;
            if (previous == JobStatus.QUEUED) {
                job.markFinished();
                notify(job, l -> l.onCancelled(job));
            } else {
                sessionRegistry.get(conversationKey)
                        .ifPresent(session -> approvals.discardAll(session.getSessionId()));
            }
            log.info("Cancelled {} job {} for {}", previous, job.getJobId(), conversationKey);
        }
        return affected;
    }

    /** Cancels the key's jobs and waits for a running one to leave its worker thread. */
    public int cancelAndAwait(String conversationKey, Duration timeout) {
        List<Job> affectedJobs = jobsFor(conversationKey).stream()
                .filter(job -> !job.getStatus().isTerminal())
                .toList();
        int cancelled = cancel(conversationKey);
        CompletableFuture<?>[] pending = affectedJobs.stream().map(Job::finished).toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Jobs for {} did not stop within {}", conversationKey, timeout);
        }
        return cancelled;
    }

    /** Drops ended jobs whose end time is older than the retention window. */
    public int purgeOlderThan(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int before = jobs.size();
        jobs.values().removeIf(job -> job.getStatus().isTerminal()
                && job.getEndedAt() != null && job.getEndedAt().isBefore(cutoff));
        int purged = before - jobs.size();
        if (purged > 0) {
            log.info("Purged {} finished job(s)", purged);
        }
        return purged;
    }

    public Optional<Job> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<Job> list() {
        List<Job> all = new ArrayList<>(jobs.values());
        all.sort(Comparator.comparingLong(Job::seq));
        return all;
    }

    /** The key's running job, else its oldest queued one. */
    public Optional<Job> activeJobFor(String conversationKey) {
        List<Job> forKey = jobsFor(conversationKey);
        return forKey.stream().filter(j -> j.getStatus() == JobStatus.RUNNING).findFirst()
                .or(() -> forKey.stream().filter(j -> j.getStatus() == JobStatus.QUEUED).findFirst());
    }

    public int runningCount() {
        return (int) jobs.values().stream().filter(j -> j.getStatus() == JobStatus.RUNNING).count();
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdownNow();
    }

    void execute(Job job) {
        try {
            if (!job.markRunning(clock.instant(), Thread.currentThread())) {
                return;
            }
            runJob(job);
        } finally {
            job.detachWorker();
            job.markFinished();
        }
    }

    private void runJob(Job job) {
        log.info("Starting job {} for {}", job.getJobId(), job.getConversationKey());
        notify(job, l -> l.onStarted(job));
        Session session = null;
        try {
            session = sessionRegistry.acquire(job.getConversationKey(), job.getCreatedAt());
            Session target = session;
            AgentRunResult result = agentBridge.runMessage(session, job.getText(),
                    (output, elapsed) -> notify(job, l -> l.onProgress(job, output, elapsed)),
                    request -> {
                        CompletableFuture<ApprovalDecision> decision =
                                approvals.register(target.getSessionId(), request);
                        notify(job, l -> l.onApprovalRequested(job, request));
                        return decision;
                    },
                    job.cancellation());
            if (job.complete(result.output(), clock.instant())) {
                agentBridge.syncCredentials(session);
                log.info("Job {} completed in {}s", job.getJobId(), result.duration().toSeconds());
                notify(job, l -> l.onCompleted(job, result));
            } else {
                notify(job, l -> l.onCancelled(job));
            }
        } catch (CancellationException e) {
            job.cancel(clock.instant());
            log.info("Job {} cancelled", job.getJobId());
            notify(job, l -> l.onCancelled(job));
        } catch (RuntimeException e) {
            String message = truncate(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            if (job.fail(message, clock.instant())) {
                log.error("Job {} failed: {}", job.getJobId(), message, e);
                notify(job, l -> l.onFailed(job, message));
            } else {
                log.info("Job {} stopped after cancellation: {}", job.getJobId(), message);
                notify(job, l -> l.onCancelled(job));
            }
        } finally {
            if (session != null) {
                approvals.discardAll(session.getSessionId());
                releaseQuietly(session);
            }
        }
    }

    private void releaseQuietly(Session session) {
        try {
            sessionRegistry.release(session);
        } catch (RuntimeException e) {
            session.setBusy(false);
            log.warn("Could not record activity for session {}: {}", session.getSessionId(), e.getMessage());
        }
    }

    private int positionOf(Job job) {
        return (int) jobs.values().stream()
                .filter(other -> other.getStatus() == JobStatus.QUEUED && other.seq() < job.seq())
                .count();
    }

    private List<Job> jobsFor(String conversationKey) {
        return list().stream().filter(job -> job.getConversationKey().equals(conversationKey)).toList();
    }

    private String newJobId() {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (jobs.containsKey(id));
        return id;
    }

    private static void notify(Job job, Consumer<JobListener> call) {
        try {
            call.accept(job.listener());
        } catch (RuntimeException e) {
            log.warn("Listener for job {} failed: {}", job.getJobId(), e.getMessage());
        }
    }

    static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
