package com.libragraph.synthesis.core.stats;

import com.libragraph.synthesis.core.store.ClaimStore;
import com.libragraph.synthesis.core.store.DependencyStore;
import com.libragraph.synthesis.core.store.PipelineStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.UUID;

/**
 * Recounts rows and overwrites a pipeline's denormalized counters. Never increments, so reruns
 * are harmless.
 */
@ApplicationScoped
public class PipelineStatsUpdater {

    private static final Logger log = Logger.getLogger(PipelineStatsUpdater.class);

    private final PipelineStore pipelineStore;
    private final DependencyStore dependencyStore;
    private final ClaimStore claimStore;

    @Inject
    public PipelineStatsUpdater(PipelineStore pipelineStore, DependencyStore dependencyStore,
                                ClaimStore claimStore) {
        this.pipelineStore = pipelineStore;
        this.dependencyStore = dependencyStore;
        this.claimStore = claimStore;
    }

    public int refreshDependencyCount(UUID pipelineId) {
        int total = dependencyStore.countByPipeline(pipelineId);
        pipelineStore.updateTotalDependencies(pipelineId, total);
        log.infof("Pipeline %s total_dependencies=%d", pipelineId, total);
        return total;
    }

    public int refreshClaimCount(UUID pipelineId) {
        int total = claimStore.countByPipeline(pipelineId);
        pipelineStore.updateTotalClaims(pipelineId, total);
        log.infof("Pipeline %s total_claims=%d", pipelineId, total);
        return total;
    }
}
