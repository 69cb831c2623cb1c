package com.libragraph.synthesis.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.util.UUID;

public record EdgeRecord(
        @ColumnName("source_claim_id") UUID sourceClaimId,
        @ColumnName("target_claim_id") UUID targetClaimId,
        @ColumnName("confidence") double confidence
) {}
