package com.libragraph.synthesis.core.graph;

import com.libragraph.synthesis.core.dao.EdgeRecord;
import com.libragraph.synthesis.core.store.ClaimMetrics;
import com.libragraph.synthesis.core.store.ClaimStore;
import com.libragraph.synthesis.core.store.DependencyStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Recomputes PageRank, betweenness, the foundational flag and the combined importance score over
 * a pipeline's full edge set and writes them to every claim that is a graph node. Claims outside
 * the graph keep their previous values.
 * <p>
 * A metric that cannot be computed falls back to 0 for every node; it never fails the caller.
 */
@ApplicationScoped
public class GraphMetricsEngine {

    private static final Logger log = Logger.getLogger(GraphMetricsEngine.class);

    static final int FOUNDATIONAL_MIN_OUT_DEGREE = 3;
    static final int FOUNDATIONAL_MAX_IN_DEGREE = 2;
    static final double PAGERANK_WEIGHT = 0.7;
    static final double CENTRALITY_WEIGHT = 0.3;

    private final ClaimStore claimStore;
    private final DependencyStore dependencyStore;
    private final PageRank pageRank = new PageRank();
    private final BetweennessCentrality betweenness = new BetweennessCentrality();

    @Inject
    public GraphMetricsEngine(ClaimStore claimStore, DependencyStore dependencyStore) {
        this.claimStore = claimStore;
        this.dependencyStore = dependencyStore;
    }

    /**
     * @return the metrics written, empty when the pipeline has no edges
     */
    public List<ClaimMetrics> recompute(UUID pipelineId) {
        log.infof("Calculating graph metrics for pipeline %s", pipelineId);
        List<EdgeRecord> edges = dependencyStore.findEdges(pipelineId);
        if (edges.isEmpty()) {
            log.warnf("No dependencies found for pipeline %s, graph metrics unchanged", pipelineId);
            return List.of();
        }

        DependencyGraph graph = DependencyGraph.fromEdges(edges);
        log.infof("Built graph with %d nodes and %d edges", graph.nodeCount(), graph.edgeCount());

        List<ClaimMetrics> metrics = computeMetrics(graph);
        claimStore.updateMetrics(metrics);
        log.infof("Graph metrics updated for %d claims of pipeline %s", metrics.size(), pipelineId);
        return metrics;
    }

    List<ClaimMetrics> computeMetrics(DependencyGraph graph) {
        int n = graph.nodeCount();
        double[] ranks = pageRankOrZeros(graph);
        double[] centrality = centralityOrZeros(graph);

        List<ClaimMetrics> metrics = new ArrayList<>(n);
        int foundational = 0;
        for (int i = 0; i < n; i++) {
            boolean isFoundational = isFoundational(graph.outDegree(i), graph.inDegree(i));
            if (isFoundational) foundational++;
            double importance = PAGERANK_WEIGHT * ranks[i] + CENTRALITY_WEIGHT * centrality[i];
            metrics.add(new ClaimMetrics(graph.node(i), ranks[i], centrality[i], isFoundational, importance));
        }
        log.infof("Identified %d foundational claims", foundational);
        return metrics;
    }

    static boolean isFoundational(int outDegree, int inDegree) {
        return outDegree >= FOUNDATIONAL_MIN_OUT_DEGREE && inDegree <= FOUNDATIONAL_MAX_IN_DEGREE;
    }

    private double[] pageRankOrZeros(DependencyGraph graph) {
        try {
            return pageRank.compute(graph);
        } catch (RuntimeException e) {
            log.warnf(e, "Could not calculate PageRank, defaulting to 0");
            return new double[graph.nodeCount()];
        }
    }

    private double[] centralityOrZeros(DependencyGraph graph) {
        try {
            return betweenness.compute(graph);
        } catch (RuntimeException e) {
            log.warnf(e, "Could not calculate centrality, defaulting to 0");
            return new double[graph.nodeCount()];
        }
    }
}
