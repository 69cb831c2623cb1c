package com.libragraph.synthesis.core.dao;

import com.libragraph.synthesis.core.job.JobType;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.Optional;

@RegisterColumnMapper(JobTypeColumnMapper.class)
@RegisterArgumentFactory(JobTypeArgumentFactory.class)
@RegisterConstructorMapper(JobQueueRecord.class)
public interface JobQueueDao {

    @SqlUpdate("INSERT INTO job_queue (queue_key, job_id, job_type, payload, attempts, created_at) " +
            "VALUES (:queueKey, :jobId, :jobType, CAST(:payload AS jsonb), :attempts, :createdAt)")
    void push(@Bind("queueKey") String queueKey,
              @Bind("jobId") String jobId,
              @Bind("jobType") JobType jobType,
              @Bind("payload") String payload,
              @Bind("attempts") int attempts,
              @Bind("createdAt") Instant createdAt);

    /**
     * Removes and returns the head of a queue. Concurrent pollers skip each other's locked row,
     * so every entry is handed out once.
     */
    @SqlQuery("DELETE FROM job_queue WHERE seq = (" +
            "SELECT seq FROM job_queue WHERE queue_key = :queueKey " +
            "ORDER BY seq LIMIT 1 FOR UPDATE SKIP LOCKED) " +
            "RETURNING *")
    Optional<JobQueueRecord> pop(@Bind("queueKey") String queueKey);

    @SqlQuery("SELECT COUNT(*) FROM job_queue WHERE queue_key = :queueKey")
    long count(@Bind("queueKey") String queueKey);
}
