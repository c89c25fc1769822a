package io.github.drompincen.clawrelay.runtime.job;

/** @param position number of jobs queued ahead of this one when it was submitted */
public record SubmitResult(String jobId, int position) {}
