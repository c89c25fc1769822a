package io.github.drompincen.clawrelay.runtime.reaper;

import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import io.github.drompincen.clawrelay.runtime.job.JobScheduler;
import io.github.drompincen.clawrelay.runtime.session.SessionRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledFuture;

/** Periodically ends idle sessions and forgets old jobs. The first sweep runs as soon as the app is ready. */
@Component
public class IdleReaper {

    private static final Logger log = LoggerFactory.getLogger(IdleReaper.class);

    private final SessionRegistry sessionRegistry;
    private final JobScheduler jobScheduler;
    private final RelayProperties properties;
    private final TaskScheduler taskScheduler;
    private volatile ScheduledFuture<?> schedule;

    public IdleReaper(SessionRegistry sessionRegistry, JobScheduler jobScheduler,
                      RelayProperties properties, TaskScheduler taskScheduler) {
        this.sessionRegistry = sessionRegistry;
        this.jobScheduler = jobScheduler;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (schedule != null) {
            return;
        }
        schedule = taskScheduler.scheduleAtFixedRate(this::sweep, properties.getSweepInterval());
        log.info("Idle reaper every {} (idle timeout {}, job retention {})", properties.getSweepInterval(),
                properties.getSessionIdleTimeout(), properties.getJobRetention());
    }

    public void sweep() {
        try {
            sessionRegistry.sweepIdle(properties.getSessionIdleTimeout());
        } catch (Exception e) {
            log.error("Idle session sweep failed", e);
        }
        try {
            jobScheduler.purgeOlderThan(properties.getJobRetention());
        } catch (Exception e) {
            log.error("Job purge failed", e);
        }
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> current = schedule;
        if (current != null) {
            current.cancel(false);
            schedule = null;
        }
    }
}
