package com.libragraph.synthesis.core.store;

import com.libragraph.synthesis.core.dao.EdgeRecord;

import java.util.List;
import java.util.UUID;

public interface DependencyStore {

    /**
     * Inserts a batch atomically. Edges whose {@link Dependency.EdgeKey} already exists are skipped.
     *
     * @return number of rows actually inserted
     */
    int insertAll(List<Dependency> dependencies);

    /** Every edge of the pipeline, from all inference runs. */
    List<EdgeRecord> findEdges(UUID pipelineId);

    int countByPipeline(UUID pipelineId);
}
