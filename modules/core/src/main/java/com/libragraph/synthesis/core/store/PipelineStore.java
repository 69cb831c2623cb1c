package com.libragraph.synthesis.core.store;

import com.libragraph.synthesis.core.dao.PipelineRecord;

import java.util.Optional;
import java.util.UUID;

public interface PipelineStore {

    Optional<PipelineRecord> findById(UUID pipelineId);

    /** Overwrites {@code total_dependencies} and touches {@code updated_at}. */
    void updateTotalDependencies(UUID pipelineId, int total);

    /** Overwrites {@code total_claims} and touches {@code updated_at}. */
    void updateTotalClaims(UUID pipelineId, int total);

    default PipelineRecord require(UUID pipelineId) {
        return findById(pipelineId).orElseThrow(() -> new PipelineNotFoundException(pipelineId));
    }
}
