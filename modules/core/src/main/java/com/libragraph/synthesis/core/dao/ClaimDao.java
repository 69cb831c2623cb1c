package com.libragraph.synthesis.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.UUID;

@RegisterConstructorMapper(ClaimRecord.class)
public interface ClaimDao {

    @SqlQuery("SELECT * FROM claims WHERE pipeline_id = :pipelineId " +
            "ORDER BY confidence DESC NULLS LAST, extracted_at, id")
    List<ClaimRecord> findByPipeline(@Bind("pipelineId") UUID pipelineId);

    @SqlQuery("SELECT COUNT(*) FROM claims WHERE pipeline_id = :pipelineId")
    int countByPipeline(@Bind("pipelineId") UUID pipelineId);

    @SqlUpdate("UPDATE claims SET pagerank = :pagerank, centrality = :centrality, " +
            "is_foundational = :foundational, importance_score = :importanceScore WHERE id = :id")
    int updateMetrics(@Bind("id") UUID id,
                      @Bind("pagerank") double pagerank,
                      @Bind("centrality") double centrality,
                      @Bind("foundational") boolean foundational,
                      @Bind("importanceScore") double importanceScore);

    @SqlBatch("INSERT INTO claims (id, pipeline_id, document_id, text, claim_type, confidence, evidence_type, " +
            "source_span_start, source_span_end, surrounding_context, importance_score, is_foundational) " +
            "VALUES (:id, :pipelineId, :documentId, :text, :claimType, :confidence, :evidenceType, " +
            ":sourceSpanStart, :sourceSpanEnd, :surroundingContext, :importanceScore, false)")
    void insertAll(@BindMethods List<NewClaim> claims);
}
