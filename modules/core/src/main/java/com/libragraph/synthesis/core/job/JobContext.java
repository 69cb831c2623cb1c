package com.libragraph.synthesis.core.job;

public interface JobContext {

    String jobId();

    JobType jobType();

    int attempt();

    /** Converts the job payload into the handler's request type. */
    <T> T payloadAs(Class<T> type);

    /**
     * Records progress for the running job. Values are clamped to [0, 100] and never move
     * backwards within an attempt.
     */
    void reportProgress(int percent);
}
