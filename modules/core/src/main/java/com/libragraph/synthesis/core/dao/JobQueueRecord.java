package com.libragraph.synthesis.core.dao;

import com.libragraph.synthesis.core.job.JobType;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record JobQueueRecord(
        @ColumnName("seq") long seq,
        @ColumnName("queue_key") String queueKey,
        @ColumnName("job_id") String jobId,
        @ColumnName("job_type") JobType jobType,
        @ColumnName("payload") String payload,
        @ColumnName("attempts") int attempts,
        @ColumnName("created_at") Instant createdAt
) {}
