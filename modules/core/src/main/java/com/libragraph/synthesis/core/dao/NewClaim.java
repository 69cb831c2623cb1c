package com.libragraph.synthesis.core.dao;

import java.util.UUID;

/** Row inserted by claim extraction. Metric columns start at their defaults. */
public record NewClaim(
        UUID id,
        UUID pipelineId,
        UUID documentId,
        String text,
        String claimType,
        double confidence,
        String evidenceType,
        Integer sourceSpanStart,
        Integer sourceSpanEnd,
        String surroundingContext,
        double importanceScore
) {}
