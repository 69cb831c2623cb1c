package com.libragraph.synthesis.core.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * Single-process {@link JobStore}: one blocking deque per job type and a map of status records.
 * Used by the {@code memory} store mode and by tests.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<JobType, BlockingDeque<Job>> queues = new EnumMap<>(JobType.class);
    private final Map<String, JobStatusRecord> statuses = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration statusTtl;

    public InMemoryJobStore(Clock clock, Duration statusTtl) {
        this.clock = clock;
        this.statusTtl = statusTtl;
        for (JobType type : JobType.values()) {
            queues.put(type, new LinkedBlockingDeque<>());
        }
    }

    public InMemoryJobStore() {
        this(Clock.systemUTC(), Duration.ofHours(24));
    }

    @Override
    public void enqueue(Job job) {
        queues.get(job.type()).addLast(job);
        setStatus(JobStatusUpdate.queued(job));
    }

    @Override
    public void requeue(Job job, String lastError) {
        queues.get(job.type()).addLast(job);
        setStatus(JobStatusUpdate.requeued(job, lastError));
    }

    @Override
    public Optional<Job> dequeue(JobType type, Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queues.get(type).pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public void setStatus(JobStatusUpdate update) {
        Instant now = clock.instant();
        Job job = update.job();
        statuses.put(job.id(), new JobStatusRecord(
                job.id(), job.type(), update.status(), update.progress(), job.attempts(),
                update.error(), update.result(), now, now.plus(statusTtl)));
    }

    @Override
    public Optional<JobStatusRecord> getStatus(String jobId) {
        JobStatusRecord record = statuses.get(jobId);
        if (record == null || record.isExpiredAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public long queueLength(JobType type) {
        return queues.get(type).size();
    }

    @Override
    public int purgeExpiredStatuses() {
        Instant now = clock.instant();
        int before = statuses.size();
        statuses.values().removeIf(r -> r.isExpiredAt(now));
        return before - statuses.size();
    }

    @Override
    public List<JobStatusRecord> findActiveNotUpdatedSince(Instant cutoff) {
        Instant now = clock.instant();
        return statuses.values().stream()
                .filter(r -> r.status() == JobStatus.ACTIVE)
                .filter(r -> r.updatedAt().isBefore(cutoff))
                .filter(r -> !r.isExpiredAt(now))
                .sorted(Comparator.comparing(JobStatusRecord::updatedAt))
                .toList();
    }
}
