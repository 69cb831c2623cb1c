package com.libragraph.synthesis.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record DocumentRecord(
        @ColumnName("id") UUID id,
        @ColumnName("pipeline_id") UUID pipelineId,
        @ColumnName("filename") String filename,
        @ColumnName("source_llm") String sourceLlm,
        @ColumnName("status") String status,
        @ColumnName("extracted_text") String extractedText,
        @ColumnName("processed_at") Instant processedAt
) {}
