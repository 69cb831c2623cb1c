package com.libragraph.synthesis.core.job;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record JobStatusRecord(
        @ColumnName("job_id") String jobId,
        @ColumnName("job_type") JobType jobType,
        @ColumnName("status") JobStatus status,
        @ColumnName("progress") int progress,
        @ColumnName("attempts") int attempts,
        @ColumnName("error") String error,
        @ColumnName("result") String result,
        @ColumnName("updated_at") Instant updatedAt,
        @ColumnName("expires_at") Instant expiresAt
) {
    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
