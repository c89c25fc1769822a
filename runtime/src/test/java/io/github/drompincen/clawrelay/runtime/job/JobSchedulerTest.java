package io.github.drompincen.clawrelay.runtime.job;

import io.github.drompincen.clawrelay.protocol.api.ApprovalDecision;
import io.github.drompincen.clawrelay.protocol.api.JobStatus;
import io.github.drompincen.clawrelay.protocol.api.PermissionRequest;
import io.github.drompincen.clawrelay.runtime.MutableClock;
import io.github.drompincen.clawrelay.runtime.Waits;
import io.github.drompincen.clawrelay.runtime.approval.ApprovalCoordinator;
import io.github.drompincen.clawrelay.runtime.bridge.AgentBridge;
import io.github.drompincen.clawrelay.runtime.bridge.AgentRunResult;
import io.github.drompincen.clawrelay.runtime.bridge.ApprovalHandler;
import io.github.drompincen.clawrelay.runtime.bridge.CancellationToken;
import io.github.drompincen.clawrelay.runtime.bridge.ProgressListener;
import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.error.AgentSessionException;
import io.github.drompincen.clawrelay.runtime.session.Session;
import io.github.drompincen.clawrelay.runtime.session.SessionRegistry;
import io.github.drompincen.clawrelay.runtime.workspace.SessionPaths;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobSchedulerTest {

    @Mock
    private SessionRegistry sessionRegistry;

    @Mock
    private AgentBridge agentBridge;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private ApprovalCoordinator approvals;
    private MutableClock clock;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        RelayProperties props = new RelayProperties();
        approvals = new ApprovalCoordinator();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        scheduler = new JobScheduler(sessionRegistry, agentBridge, approvals, props, clock);
        lenient().when(sessionRegistry.acquire(anyString(), any())).thenAnswer(inv -> {
            Session session = session(inv.getArgument(0));
            session.setBusy(true);
            return session;
        });
        lenient().doAnswer(inv -> {
            inv.<Session>getArgument(0).setBusy(false);
            return null;
        }).when(sessionRegistry).release(any());
        lenient().when(sessionRegistry.get(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(sessions.get(inv.<String>getArgument(0))));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private Session session(String key) {
        return sessions.computeIfAbsent(key, k -> new Session("sid-" + k, k,
                SessionPaths.under(Path.of("/tmp/agent-test"), "sid-" + k), "openai/gpt-4o", Instant.now()));
    }

    private void bridgeAnswers(Answer<AgentRunResult> answer) {
        when(agentBridge.runMessage(any(), anyString(), any(), any(), any())).thenAnswer(answer);
    }

    private static AgentRunResult result(String output) {
        return new AgentRunResult(output, Duration.ofSeconds(1), null);
    }

    @Test
    void pingCompletesWithPong() throws Exception {
        Instant submittedAt = clock.instant();
        bridgeAnswers(inv -> {
            clock.advance(Duration.ofSeconds(5));
            ProgressListener progress = inv.getArgument(2);
            progress.onProgress("pong", Duration.ofMillis(10));
            return result("pong");
        });
        RecordingListener listener = new RecordingListener();

        SubmitResult submitted = scheduler.submit("chat-1", "user-1", "ping", listener);

        assertThat(submitted.position()).isZero();
        assertThat(listener.awaitTerminal()).isTrue();
        assertThat(listener.output).isEqualTo("pong");
        assertThat(listener.events).containsExactly("queued:0", "started", "progress:pong", "completed");
        Job job = scheduler.get(submitted.jobId()).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getOutput()).isEqualTo("pong");
        assertThat(job.getJobId()).hasSize(8);
        verify(agentBridge).syncCredentials(sessions.get("chat-1"));
        verify(sessionRegistry).acquire("chat-1", submittedAt);
        Waits.until(() -> !sessions.get("chat-1").isBusy());
        verify(sessionRegistry).release(sessions.get("chat-1"));
    }

    @Test
    void bridgeFailureBecomesFailedJobWithBoundedError() throws Exception {
        String longMessage = "x".repeat(800);
        bridgeAnswers(inv -> {
            throw new AgentSessionException(longMessage);
        });
        RecordingListener listener = new RecordingListener();

        String jobId = scheduler.submit("chat-1", "user-1", "hi", listener).jobId();

        assertThat(listener.awaitTerminal()).isTrue();
        Job job = scheduler.get(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).hasSize(500);
        assertThat(listener.error).hasSize(500);
        assertThat(listener.terminalCount()).isEqualTo(1);
        verify(agentBridge, never()).syncCredentials(any());
    }

    @Test
    void jobsForOneKeyNeverOverlap() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        bridgeAnswers(inv -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            Thread.sleep(30);
            running.decrementAndGet();
            return result("ok");
        });
        List<RecordingListener> listeners = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            RecordingListener listener = new RecordingListener();
            listeners.add(listener);
            scheduler.submit("chat-1", "user-1", "msg " + i, listener);
        }

        for (RecordingListener listener : listeners) {
            assertThat(listener.awaitTerminal()).isTrue();
            assertThat(listener.events).contains("completed");
        }
        assertThat(maxRunning).hasValue(1);
    }

    @Test
    void globalCapBoundsConcurrentJobs() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        bridgeAnswers(inv -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            running.decrementAndGet();
            return result("ok");
        });
        List<RecordingListener> listeners = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            RecordingListener listener = new RecordingListener();
            listeners.add(listener);
            scheduler.submit("chat-" + i, "user-1", "msg", listener);
        }

        for (RecordingListener listener : listeners) {
            assertThat(listener.awaitTerminal()).isTrue();
        }
        assertThat(maxRunning.get()).isBetween(1, 2);
        assertThat(scheduler.list()).allMatch(job -> job.getStatus() == JobStatus.COMPLETED);
    }

    @Test
    void queuePositionCountsEarlierQueuedJobs() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        bridgeAnswers(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return result("ok");
        });
        RecordingListener first = new RecordingListener();
        scheduler.submit("chat-1", "u", "a", first);
        first.started.await(5, TimeUnit.SECONDS);

        SubmitResult second = scheduler.submit("chat-1", "u", "b", new RecordingListener());
        SubmitResult third = scheduler.submit("chat-2", "u", "c", new RecordingListener());

        assertThat(second.position()).isZero();
        assertThat(third.position()).isEqualTo(1);
        release.countDown();
    }

    @Test
    void cancelAffectsRunningAndQueuedJobs() throws Exception {
        bridgeAnswers(inv -> {
            CancellationToken token = inv.getArgument(4);
            CountDownLatch cancelled = new CountDownLatch(1);
            token.onCancel(cancelled::countDown);
            try {
                cancelled.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new CancellationException("Job cancelled");
        });
        RecordingListener running = new RecordingListener();
        RecordingListener queued = new RecordingListener();
        String runningId = scheduler.submit("chat-1", "u", "long task", running).jobId();
        running.started.await(5, TimeUnit.SECONDS);
        String queuedId = scheduler.submit("chat-1", "u", "next", queued).jobId();

        int cancelled = scheduler.cancel("chat-1");

        assertThat(cancelled).isEqualTo(2);
        assertThat(running.awaitTerminal()).isTrue();
        assertThat(queued.awaitTerminal()).isTrue();
        assertThat(scheduler.get(runningId).orElseThrow().getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(scheduler.get(queuedId).orElseThrow().getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(running.terminalCount()).isEqualTo(1);
        assertThat(queued.events).containsExactly("queued:0", "cancelled");
        assertThat(scheduler.cancel("chat-1")).isZero();
    }

    @Test
    void approvalSuspendsJobUntilResolved() throws Exception {
        bridgeAnswers(inv -> {
            ApprovalHandler handler = inv.getArgument(3);
            ApprovalDecision decision = handler.requestApproval(
                    new PermissionRequest("perm-1", "bash", null, Instant.now())).get(5, TimeUnit.SECONDS);
            return result(decision == ApprovalDecision.DENY ? "denied" : "approved");
        });
        RecordingListener listener = new RecordingListener();
        scheduler.submit("chat-1", "u", "run tests", listener);

        Waits.until(() -> !listener.approvals.isEmpty());
        assertThat(listener.terminal.getCount()).isEqualTo(1);
        assertThat(approvals.pending("sid-chat-1")).extracting(PermissionRequest::requestId).containsExactly("perm-1");

        assertThat(approvals.resolve("sid-chat-1", "perm-1", ApprovalDecision.DENY)).isTrue();

        assertThat(listener.awaitTerminal()).isTrue();
        assertThat(listener.output).isEqualTo("denied");
        assertThat(approvals.pending("sid-chat-1")).isEmpty();
    }

    @Test
    void cancelWhileAwaitingApprovalReleasesSlot() throws Exception {
        bridgeAnswers(inv -> {
            ApprovalHandler handler = inv.getArgument(3);
            try {
                handler.requestApproval(new PermissionRequest("perm-1", "bash", null, Instant.now())).get();
            } catch (InterruptedException e) {
                throw new CancellationException("interrupted");
            }
            return result("never");
        });
        RecordingListener listener = new RecordingListener();
        String jobId = scheduler.submit("chat-1", "u", "x", listener).jobId();
        Waits.until(() -> !listener.approvals.isEmpty());

        assertThat(scheduler.cancel("chat-1")).isEqualTo(1);

        assertThat(listener.awaitTerminal()).isTrue();
        assertThat(listener.events).endsWith("cancelled");
        assertThat(scheduler.get(jobId).orElseThrow().getStatus()).isEqualTo(JobStatus.CANCELLED);
        Waits.until(() -> scheduler.runningCount() == 0);
    }

    @Test
    void purgeDropsOnlyOldEndedJobs() throws Exception {
        bridgeAnswers(inv -> result("ok"));
        RecordingListener listener = new RecordingListener();
        String jobId = scheduler.submit("chat-1", "u", "x", listener).jobId();
        assertThat(listener.awaitTerminal()).isTrue();

        assertThat(scheduler.purgeOlderThan(Duration.ofHours(24))).isZero();
        clock.advance(Duration.ofHours(25));
        assertThat(scheduler.purgeOlderThan(Duration.ofHours(24))).isEqualTo(1);
        assertThat(scheduler.get(jobId)).isEmpty();
    }

    @Test
    void listenerFailuresDoNotBreakTheJob() throws Exception {
        bridgeAnswers(inv -> result("ok"));
        RecordingListener terminal = new RecordingListener();
        JobListener throwing = new JobListener() {
            @Override public void onStarted(Job job) { throw new IllegalStateException("socket closed"); }
            @Override public void onProgress(Job job, String output, Duration elapsed) {}
            @Override public void onApprovalRequested(Job job, PermissionRequest request) {}
            @Override public void onCompleted(Job job, AgentRunResult result) { terminal.onCompleted(job, result); }
            @Override public void onFailed(Job job, String error) { terminal.onFailed(job, error); }
            @Override public void onCancelled(Job job) { terminal.onCancelled(job); }
        };

        scheduler.submit("chat-1", "u", "x", throwing);

        assertThat(terminal.awaitTerminal()).isTrue();
        assertThat(terminal.events).containsExactly("completed");
    }
}
