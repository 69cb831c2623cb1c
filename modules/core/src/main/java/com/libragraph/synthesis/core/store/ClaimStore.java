package com.libragraph.synthesis.core.store;

import com.libragraph.synthesis.core.dao.ClaimRecord;
import com.libragraph.synthesis.core.dao.NewClaim;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ClaimStore {

    /** All claims of a pipeline, highest confidence first. */
    List<ClaimRecord> findByPipeline(UUID pipelineId);

    int countByPipeline(UUID pipelineId);

    /** Overwrites the metric fields of each listed claim; other claims are untouched. */
    void updateMetrics(Collection<ClaimMetrics> metrics);

    void insertAll(List<NewClaim> claims);
}
