package com.libragraph.synthesis.core.graph;

import com.libragraph.synthesis.core.dao.EdgeRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Directed weighted claim graph. Nodes are the claims that appear in at least one edge, indexed
 * in first-appearance order. Parallel edges between the same ordered pair collapse into one,
 * keeping the highest weight.
 */
public final class DependencyGraph {

    private final List<UUID> nodes;
    private final Map<UUID, Integer> index;
    private final List<Map<Integer, Double>> out;
    private final int[] inDegree;
    private final int edgeCount;

    private DependencyGraph(List<UUID> nodes, Map<UUID, Integer> index, List<Map<Integer, Double>> out) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.index = index;
        this.out = out;
        this.inDegree = new int[nodes.size()];
        int edges = 0;
        for (Map<Integer, Double> successors : out) {
            for (int target : successors.keySet()) {
                inDegree[target]++;
                edges++;
            }
        }
        this.edgeCount = edges;
    }

    public static DependencyGraph fromEdges(Collection<EdgeRecord> edges) {
        List<UUID> nodes = new ArrayList<>();
        Map<UUID, Integer> index = new LinkedHashMap<>();
        List<Map<Integer, Double>> out = new ArrayList<>();

        for (EdgeRecord edge : edges) {
            if (edge.sourceClaimId().equals(edge.targetClaimId())) {
                continue;
            }
            int source = indexOf(edge.sourceClaimId(), nodes, index, out);
            int target = indexOf(edge.targetClaimId(), nodes, index, out);
            out.get(source).merge(target, edge.confidence(), Math::max);
        }
        return new DependencyGraph(nodes, index, out);
    }

    private static int indexOf(UUID id, List<UUID> nodes, Map<UUID, Integer> index,
                               List<Map<Integer, Double>> out) {
        Integer existing = index.get(id);
        if (existing != null) return existing;
        int i = nodes.size();
        nodes.add(id);
        index.put(id, i);
        out.add(new LinkedHashMap<>());
        return i;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return edgeCount == 0;
    }

    public List<UUID> nodes() {
        return nodes;
    }

    public UUID node(int i) {
        return nodes.get(i);
    }

    public int indexOf(UUID id) {
        Integer i = index.get(id);
        if (i == null) throw new IllegalArgumentException("Not a graph node: " + id);
        return i;
    }

    /** Successor index → edge weight. */
    public Map<Integer, Double> successors(int i) {
        return Collections.unmodifiableMap(out.get(i));
    }

    public int outDegree(int i) {
        return out.get(i).size();
    }

    public int inDegree(int i) {
        return inDegree[i];
    }

    public double outWeight(int i) {
        double sum = 0.0;
        for (double w : out.get(i).values()) sum += w;
        return sum;
    }
}
