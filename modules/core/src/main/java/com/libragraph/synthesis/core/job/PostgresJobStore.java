package com.libragraph.synthesis.core.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.synthesis.core.dao.JobQueueDao;
import com.libragraph.synthesis.core.dao.JobQueueRecord;
import com.libragraph.synthesis.core.dao.JobStatusDao;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Durable {@link JobStore} over the {@code job_queue} and {@code job_status} tables.
 * <p>
 * Each queue is addressed as {@code queue:<queueName>:<type>}. Dequeue claims the head row with
 * {@code FOR UPDATE SKIP LOCKED} and deletes it in the same statement; idle pollers park on
 * {@code NOTIFY job_available} until the timeout elapses.
 */
public class PostgresJobStore implements JobStore {

    private static final Logger log = Logger.getLogger(PostgresJobStore.class);
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final Jdbi jdbi;
    private final ObjectMapper objectMapper;
    private final JobNotificationListener notifications;
    private final String queueName;
    private final Duration statusTtl;
    private final Clock clock;

    PostgresJobStore(Jdbi jdbi, ObjectMapper objectMapper, JobNotificationListener notifications,
                     String queueName, Duration statusTtl, Clock clock) {
        this.jdbi = jdbi;
        this.objectMapper = objectMapper;
        this.notifications = notifications;
        this.queueName = queueName;
        this.statusTtl = statusTtl;
        this.clock = clock;
    }

    String queueKey(JobType type) {
        return "queue:" + queueName + ":" + type.wireName();
    }

    @Override
    public void enqueue(Job job) {
        push(job, JobStatusUpdate.queued(job));
    }

    @Override
    public void requeue(Job job, String lastError) {
        push(job, JobStatusUpdate.requeued(job, lastError));
    }

    private void push(Job job, JobStatusUpdate status) {
        String payload = serialize(job.payload());
        try {
            jdbi.useTransaction(handle -> {
                handle.attach(JobQueueDao.class).push(queueKey(job.type()), job.id(), job.type(),
                        payload, job.attempts(), job.createdAt());
                writeStatus(handle, status);
                // wire names are a closed set, safe to inline
                handle.execute("NOTIFY " + JobNotificationListener.CHANNEL + ", '" + job.type().wireName() + "'");
            });
        } catch (JdbiException e) {
            throw new JobStoreException("Failed to enqueue job " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> dequeue(JobType type, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        String key = queueKey(type);
        while (true) {
            Optional<JobQueueRecord> row;
            try {
                row = jdbi.inTransaction(handle -> handle.attach(JobQueueDao.class).pop(key));
            } catch (JdbiException e) {
                throw new JobStoreException("Failed to dequeue from " + key, e);
            }
            if (row.isPresent()) {
                log.debugf("Dequeued job %s from %s", row.get().jobId(), key);
                return Optional.of(toJob(row.get()));
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            notifications.awaitWork(type, remaining, TimeUnit.NANOSECONDS);
        }
    }

    @Override
    public void setStatus(JobStatusUpdate update) {
        try {
            jdbi.useHandle(handle -> writeStatus(handle, update));
        } catch (JdbiException e) {
            throw new JobStoreException("Failed to write status of job " + update.job().id(), e);
        }
    }

    private void writeStatus(Handle handle, JobStatusUpdate update) {
        Instant now = clock.instant();
        Job job = update.job();
        handle.attach(JobStatusDao.class).upsert(job.id(), job.type(), update.status(), update.progress(),
                job.attempts(), update.error(), update.result(), now, now.plus(statusTtl));
    }

    @Override
    public Optional<JobStatusRecord> getStatus(String jobId) {
        try {
            return jdbi.withExtension(JobStatusDao.class, dao -> dao.findLive(jobId, clock.instant()));
        } catch (JdbiException e) {
            throw new JobStoreException("Failed to read status of job " + jobId, e);
        }
    }

    @Override
    public long queueLength(JobType type) {
        try {
            return jdbi.withExtension(JobQueueDao.class, dao -> dao.count(queueKey(type)));
        } catch (JdbiException e) {
            throw new JobStoreException("Failed to count " + queueKey(type), e);
        }
    }

    @Override
    public int purgeExpiredStatuses() {
        try {
            return jdbi.withExtension(JobStatusDao.class, dao -> dao.deleteExpired(clock.instant()));
        } catch (JdbiException e) {
            throw new JobStoreException("Failed to purge expired job statuses", e);
        }
    }

    @Override
    public List<JobStatusRecord> findActiveNotUpdatedSince(Instant cutoff) {
        try {
            return jdbi.withExtension(JobStatusDao.class,
                    dao -> dao.findNotUpdatedSince(JobStatus.ACTIVE, cutoff, clock.instant()));
        } catch (JdbiException e) {
            throw new JobStoreException("Failed to query stale active jobs", e);
        }
    }

    private Job toJob(JobQueueRecord row) {
        try {
            Map<String, Object> payload = objectMapper.readValue(row.payload(), PAYLOAD_TYPE);
            return new Job(row.jobId(), row.jobType(), payload, row.attempts(), row.createdAt());
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Unreadable payload for job " + row.jobId(), e);
        }
    }

    private String serialize(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload is not serializable", e);
        }
    }
}
