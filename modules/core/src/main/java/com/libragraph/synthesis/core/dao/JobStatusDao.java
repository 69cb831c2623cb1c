package com.libragraph.synthesis.core.dao;

import com.libragraph.synthesis.core.job.JobStatus;
import com.libragraph.synthesis.core.job.JobStatusRecord;
import com.libragraph.synthesis.core.job.JobType;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(JobStatusColumnMapper.class)
@RegisterColumnMapper(JobTypeColumnMapper.class)
@RegisterArgumentFactory(JobStatusArgumentFactory.class)
@RegisterArgumentFactory(JobTypeArgumentFactory.class)
@RegisterConstructorMapper(JobStatusRecord.class)
public interface JobStatusDao {

    @SqlUpdate("INSERT INTO job_status (job_id, job_type, status, progress, attempts, error, result, " +
            "updated_at, expires_at) " +
            "VALUES (:jobId, :jobType, :status, :progress, :attempts, :error, CAST(:result AS jsonb), " +
            ":updatedAt, :expiresAt) " +
            "ON CONFLICT (job_id) DO UPDATE SET job_type = EXCLUDED.job_type, status = EXCLUDED.status, " +
            "progress = EXCLUDED.progress, attempts = EXCLUDED.attempts, error = EXCLUDED.error, " +
            "result = EXCLUDED.result, updated_at = EXCLUDED.updated_at, expires_at = EXCLUDED.expires_at")
    void upsert(@Bind("jobId") String jobId,
                @Bind("jobType") JobType jobType,
                @Bind("status") JobStatus status,
                @Bind("progress") int progress,
                @Bind("attempts") int attempts,
                @Bind("error") String error,
                @Bind("result") String result,
                @Bind("updatedAt") Instant updatedAt,
                @Bind("expiresAt") Instant expiresAt);

    @SqlQuery("SELECT * FROM job_status WHERE job_id = :jobId AND expires_at > :now")
    Optional<JobStatusRecord> findLive(@Bind("jobId") String jobId, @Bind("now") Instant now);

    @SqlUpdate("DELETE FROM job_status WHERE expires_at <= :now")
    int deleteExpired(@Bind("now") Instant now);

    @SqlQuery("SELECT * FROM job_status WHERE status = :status AND updated_at < :cutoff " +
            "AND expires_at > :now ORDER BY updated_at")
    List<JobStatusRecord> findNotUpdatedSince(@Bind("status") JobStatus status,
                                              @Bind("cutoff") Instant cutoff,
                                              @Bind("now") Instant now);
}
