package com.libragraph.synthesis.core.job;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-type FIFO queues plus one expiring status record per job.
 * <p>
 * Queue entries and status records are independent: a job can leave its queue before its
 * status is updated. Every status write resets the record's expiry.
 * Implementations throw {@link JobStoreException} when the backing store is unavailable.
 */
public interface JobStore {

    /**
     * Appends the job to the tail of its type's queue and writes a {@code queued} status
     * with progress 0. Never blocks on queue depth.
     */
    void enqueue(Job job);

    /**
     * Appends a retry of a failed job to the tail of its queue. The status becomes
     * {@code queued} again and keeps {@code lastError}.
     */
    void requeue(Job job, String lastError);

    /**
     * Removes and returns the oldest job of the given type, waiting up to {@code timeout}
     * for one to arrive.
     */
    Optional<Job> dequeue(JobType type, Duration timeout) throws InterruptedException;

    void setStatus(JobStatusUpdate update);

    /** Empty once the record has expired or if the id was never recorded. */
    Optional<JobStatusRecord> getStatus(String jobId);

    long queueLength(JobType type);

    /** Deletes expired status records; returns how many were removed. */
    int purgeExpiredStatuses();

    /** Live {@code active} status records last written before {@code cutoff}. */
    List<JobStatusRecord> findActiveNotUpdatedSince(Instant cutoff);
}
