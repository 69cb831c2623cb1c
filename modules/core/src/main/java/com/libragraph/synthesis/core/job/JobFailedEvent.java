package com.libragraph.synthesis.core.job;

import java.time.Instant;

public record JobFailedEvent(String jobId, JobType type, int attempts, String error, Instant failedAt) {}
