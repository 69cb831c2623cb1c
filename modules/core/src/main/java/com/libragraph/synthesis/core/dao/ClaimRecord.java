package com.libragraph.synthesis.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.util.UUID;

/**
 * A claim as read by the inference pipeline. Only the four metric columns are ever written back.
 */
public record ClaimRecord(
        @ColumnName("id") UUID id,
        @ColumnName("pipeline_id") UUID pipelineId,
        @ColumnName("text") String text,
        @ColumnName("claim_type") String claimType,
        @ColumnName("confidence") Double confidence,
        @ColumnName("importance_score") double importanceScore,
        @ColumnName("pagerank") Double pagerank,
        @ColumnName("centrality") Double centrality,
        @ColumnName("is_foundational") boolean foundational
) {
    public static final double DEFAULT_CONFIDENCE = 0.8;
    public static final String UNKNOWN_TYPE = "unknown";

    /** Stored confidence, or {@value #DEFAULT_CONFIDENCE} when unset. */
    public double effectiveConfidence() {
        return confidence != null ? confidence : DEFAULT_CONFIDENCE;
    }

    /** Stored type label, or {@value #UNKNOWN_TYPE} when unset. */
    public String effectiveType() {
        return claimType == null || claimType.isBlank() ? UNKNOWN_TYPE : claimType;
    }
}
