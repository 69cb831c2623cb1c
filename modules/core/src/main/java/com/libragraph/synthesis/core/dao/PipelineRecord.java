package com.libragraph.synthesis.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record PipelineRecord(
        @ColumnName("id") UUID id,
        @ColumnName("user_id") String userId,
        @ColumnName("name") String name,
        @ColumnName("status") String status,
        @ColumnName("total_claims") int totalClaims,
        @ColumnName("total_dependencies") int totalDependencies,
        @ColumnName("total_contradictions") int totalContradictions,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt
) {}
