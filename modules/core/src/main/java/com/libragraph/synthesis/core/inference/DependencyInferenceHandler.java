package com.libragraph.synthesis.core.inference;

import com.libragraph.synthesis.core.classify.RelationshipClassifier;
import com.libragraph.synthesis.core.classify.RelationshipJudgment;
import com.libragraph.synthesis.core.dao.ClaimRecord;
import com.libragraph.synthesis.core.graph.GraphMetricsEngine;
import com.libragraph.synthesis.core.job.Job;
import com.libragraph.synthesis.core.job.JobContext;
import com.libragraph.synthesis.core.job.JobHandler;
import com.libragraph.synthesis.core.job.JobType;
import com.libragraph.synthesis.core.stats.PipelineStatsUpdater;
import com.libragraph.synthesis.core.store.ClaimStore;
import com.libragraph.synthesis.core.store.Dependency;
import com.libragraph.synthesis.core.store.DependencyStore;
import com.libragraph.synthesis.core.store.PipelineLock;
import com.libragraph.synthesis.core.store.PipelineStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Infers the dependency graph of one pipeline: selects claim pairs, classifies them one at a
 * time, persists accepted edges batch by batch, then recomputes graph metrics and the pipeline's
 * dependency count under the pipeline lock.
 * <p>
 * A failed classification skips its pair. Edges committed by earlier batches survive a later
 * failure of the job.
 */
@ApplicationScoped
public class DependencyInferenceHandler implements JobHandler {

    private static final Logger log = Logger.getLogger(DependencyInferenceHandler.class);

    static final int PROGRESS_CLAIMS_LOADED = 10;
    static final int PROGRESS_PAIRS_SELECTED = 20;
    static final int PROGRESS_PAIRS_SPAN = 60;
    static final int PROGRESS_METRICS = 85;
    static final int PROGRESS_STATS = 90;

    private final ClaimStore claimStore;
    private final DependencyStore dependencyStore;
    private final PipelineStore pipelineStore;
    private final RelationshipClassifier classifier;
    private final GraphMetricsEngine metricsEngine;
    private final PipelineStatsUpdater statsUpdater;
    private final PipelineLock pipelineLock;
    private final PairSelector pairSelector;
    private final DependencyAssembler assembler = new DependencyAssembler();
    private final int defaultBatchSize;

    @Inject
    public DependencyInferenceHandler(ClaimStore claimStore,
                                      DependencyStore dependencyStore,
                                      PipelineStore pipelineStore,
                                      RelationshipClassifier classifier,
                                      GraphMetricsEngine metricsEngine,
                                      PipelineStatsUpdater statsUpdater,
                                      PipelineLock pipelineLock,
                                      @ConfigProperty(name = "synthesis.inference.max-pairs", defaultValue = "250")
                                      int maxPairs,
                                      @ConfigProperty(name = "synthesis.inference.batch-size", defaultValue = "15")
                                      int batchSize) {
        this.claimStore = claimStore;
        this.dependencyStore = dependencyStore;
        this.pipelineStore = pipelineStore;
        this.classifier = classifier;
        this.metricsEngine = metricsEngine;
        this.statsUpdater = statsUpdater;
        this.pipelineLock = pipelineLock;
        this.pairSelector = new PairSelector(maxPairs);
        this.defaultBatchSize = batchSize;
    }

    @Override
    public JobType jobType() {
        return JobType.DEPENDENCY_INFERENCE;
    }

    @Override
    public Map<String, Object> handle(Job job, JobContext ctx) throws Exception {
        DependencyInferenceRequest request = ctx.payloadAs(DependencyInferenceRequest.class);
        if (request == null || request.pipelineId() == null) {
            throw new IllegalArgumentException("Job " + job.id() + " has no pipeline_id");
        }
        UUID pipelineId = request.pipelineId();
        int batchSize = request.batchSize() != null && request.batchSize() > 0
                ? request.batchSize() : defaultBatchSize;

        log.infof("Processing dependency inference for pipeline %s", pipelineId);
        pipelineStore.require(pipelineId);

        List<ClaimRecord> claims = claimStore.findByPipeline(pipelineId);
        log.infof("Found %d claims to analyze", claims.size());
        if (claims.size() < 2) {
            log.warnf("Not enough claims for dependency analysis in pipeline %s", pipelineId);
            return result(pipelineId, 0, 0, 0);
        }
        ctx.reportProgress(PROGRESS_CLAIMS_LOADED);

        List<ClaimPair> pairs = pairSelector.select(claims);
        log.infof("Generated %d claim pairs to analyze", pairs.size());
        ctx.reportProgress(PROGRESS_PAIRS_SELECTED);

        int found = 0;
        int failed = 0;
        int batches = (pairs.size() + batchSize - 1) / batchSize;
        for (int start = 0, batch = 1; start < pairs.size(); start += batchSize, batch++) {
            int end = Math.min(start + batchSize, pairs.size());
            List<Dependency> edges = new ArrayList<>();
            for (ClaimPair pair : pairs.subList(start, end)) {
                RelationshipJudgment judgment;
                try {
                    judgment = classifier.classify(
                            pair.a().text(), pair.a().effectiveType(),
                            pair.b().text(), pair.b().effectiveType());
                } catch (RuntimeException e) {
                    failed++;
                    log.warnf("Error analyzing pair %s / %s: %s", pair.a().id(), pair.b().id(), e.getMessage());
                    continue;
                }
                edges.addAll(assembler.assemble(pipelineId, pair, judgment));
            }
            found += dependencyStore.insertAll(edges);

            ctx.reportProgress(PROGRESS_PAIRS_SELECTED + (int) ((long) end * PROGRESS_PAIRS_SPAN / pairs.size()));
            log.infof("Processed batch %d/%d", batch, batches);
        }
        log.infof("Found %d dependencies (%d pairs without judgment)", found, failed);

        ctx.reportProgress(PROGRESS_METRICS);
        pipelineLock.withLock(pipelineId, () -> {
            metricsEngine.recompute(pipelineId);
            ctx.reportProgress(PROGRESS_STATS);
            return statsUpdater.refreshDependencyCount(pipelineId);
        });

        return result(pipelineId, found, pairs.size(), failed);
    }

    private static Map<String, Object> result(UUID pipelineId, int found, int analyzed, int failed) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("dependencies_found", found);
        result.put("total_pairs_analyzed", analyzed);
        result.put("classification_failures", failed);
        result.put("pipeline_id", pipelineId.toString());
        return result;
    }
}
