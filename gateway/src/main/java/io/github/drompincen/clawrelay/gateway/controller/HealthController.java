package io.github.drompincen.clawrelay.gateway.controller;

import io.github.drompincen.clawrelay.runtime.conversation.ConversationService;
import io.github.drompincen.clawrelay.runtime.job.JobScheduler;
import io.github.drompincen.clawrelay.runtime.session.Session;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final ConversationService conversations;
    private final JobScheduler jobScheduler;

    public HealthController(ConversationService conversations, JobScheduler jobScheduler) {
        this.conversations = conversations;
        this.jobScheduler = jobScheduler;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        long activeSessions = conversations.sessions().stream().filter(Session::isActive).count();
        return Map.of(
                "status", "ok",
                "activeSessions", activeSessions,
                "runningJobs", jobScheduler.runningCount());
    }
}
