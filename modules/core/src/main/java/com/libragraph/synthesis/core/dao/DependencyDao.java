package com.libragraph.synthesis.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.UUID;

@RegisterConstructorMapper(EdgeRecord.class)
public interface DependencyDao {

    /** Returns 0 when the same typed edge already exists for the pipeline. */
    @SqlUpdate("INSERT INTO dependencies (id, pipeline_id, source_claim_id, target_claim_id, relationship_type, " +
            "confidence, strength, explanation, semantic_markers) " +
            "VALUES (:id, :pipelineId, :sourceClaimId, :targetClaimId, :relationshipType, :confidence, " +
            ":strength, :explanation, CAST(:semanticMarkers AS jsonb)) " +
            "ON CONFLICT (pipeline_id, source_claim_id, target_claim_id, relationship_type) DO NOTHING")
    int insert(@Bind("id") UUID id,
               @Bind("pipelineId") UUID pipelineId,
               @Bind("sourceClaimId") UUID sourceClaimId,
               @Bind("targetClaimId") UUID targetClaimId,
               @Bind("relationshipType") String relationshipType,
               @Bind("confidence") double confidence,
               @Bind("strength") String strength,
               @Bind("explanation") String explanation,
               @Bind("semanticMarkers") String semanticMarkers);

    @SqlQuery("SELECT source_claim_id, target_claim_id, confidence FROM dependencies " +
            "WHERE pipeline_id = :pipelineId")
    List<EdgeRecord> findEdges(@Bind("pipelineId") UUID pipelineId);

    @SqlQuery("SELECT COUNT(*) FROM dependencies WHERE pipeline_id = :pipelineId")
    int countByPipeline(@Bind("pipelineId") UUID pipelineId);
}
