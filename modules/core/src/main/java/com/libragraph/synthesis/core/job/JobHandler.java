package com.libragraph.synthesis.core.job;

import java.util.Map;

/**
 * Executes one job type. Implementations are {@code @ApplicationScoped} CDI beans, discovered by
 * {@link JobHandlerRegistry}; exactly one handler may claim each {@link JobType}.
 * <p>
 * Any exception thrown from {@link #handle} fails the current attempt; the worker decides whether
 * the job is retried.
 */
public interface JobHandler {

    JobType jobType();

    /**
     * Runs the job to completion.
     *
     * @return a JSON-serializable summary stored as the completed job's result, or null
     */
    Map<String, Object> handle(Job job, JobContext ctx) throws Exception;
}
