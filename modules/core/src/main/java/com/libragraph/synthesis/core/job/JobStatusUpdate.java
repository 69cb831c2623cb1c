package com.libragraph.synthesis.core.job;

/**
 * A full overwrite of a job's status record. {@code result} is JSON text or null.
 */
public record JobStatusUpdate(
        Job job,
        JobStatus status,
        int progress,
        String error,
        String result
) {
    public static JobStatusUpdate queued(Job job) {
        return new JobStatusUpdate(job, JobStatus.QUEUED, 0, null, null);
    }

    /** Queued again for a retry; keeps the error that caused it. */
    public static JobStatusUpdate requeued(Job job, String lastError) {
        return new JobStatusUpdate(job, JobStatus.QUEUED, 0, lastError, null);
    }

    public static JobStatusUpdate active(Job job, int progress) {
        return new JobStatusUpdate(job, JobStatus.ACTIVE, progress, null, null);
    }

    public static JobStatusUpdate completed(Job job, String result) {
        return new JobStatusUpdate(job, JobStatus.COMPLETED, 100, null, result);
    }

    public static JobStatusUpdate failed(Job job, String error) {
        return new JobStatusUpdate(job, JobStatus.FAILED, 0, error, null);
    }
}
