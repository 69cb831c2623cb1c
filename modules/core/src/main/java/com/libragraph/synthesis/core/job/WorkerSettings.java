package com.libragraph.synthesis.core.job;

import java.time.Duration;

/**
 * Per-loop knobs of a {@link JobWorker}.
 *
 * @param pollTimeout  how long one dequeue waits for a job
 * @param errorBackoff sleep after a transient loop error
 * @param maxRetries   re-enqueues allowed after the first attempt
 */
public record WorkerSettings(Duration pollTimeout, Duration errorBackoff, int maxRetries) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public static WorkerSettings defaults() {
        return new WorkerSettings(Duration.ofSeconds(5), Duration.ofSeconds(1), DEFAULT_MAX_RETRIES);
    }
}
