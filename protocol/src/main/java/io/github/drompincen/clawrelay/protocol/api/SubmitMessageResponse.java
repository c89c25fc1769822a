package io.github.drompincen.clawrelay.protocol.api;

public record SubmitMessageResponse(
        String jobId,
        int position
) {}
