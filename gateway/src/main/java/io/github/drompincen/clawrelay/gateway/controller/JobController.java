package io.github.drompincen.clawrelay.gateway.controller;

import io.github.drompincen.clawrelay.protocol.api.JobDto;
import io.github.drompincen.clawrelay.runtime.job.Job;
import io.github.drompincen.clawrelay.runtime.job.JobScheduler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final JobScheduler jobScheduler;

    public JobController(JobScheduler jobScheduler) {
        this.jobScheduler = jobScheduler;
    }

    @GetMapping
    public List<JobDto> list(@RequestParam(required = false) String conversationKey) {
        return jobScheduler.list().stream()
                .filter(j -> conversationKey == null || conversationKey.equals(j.getConversationKey()))
                .map(Job::toDto)
                .toList();
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobDto> get(@PathVariable String jobId) {
        return jobScheduler.get(jobId)
                .map(j -> ResponseEntity.ok(j.toDto()))
                .orElse(ResponseEntity.notFound().build());
    }
}
