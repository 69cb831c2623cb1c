package com.libragraph.synthesis.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Unweighted shortest-path betweenness (Brandes). Scores are normalized by
 * {@code 1 / ((n - 1)(n - 2))} for directed graphs with more than two nodes; endpoints are
 * not counted.
 */
public final class BetweennessCentrality {

    public double[] compute(DependencyGraph graph) {
        int n = graph.nodeCount();
        double[] betweenness = new double[n];

        for (int s = 0; s < n; s++) {
            Deque<Integer> stack = new ArrayDeque<>();
            List<List<Integer>> predecessors = new ArrayList<>(n);
            for (int i = 0; i < n; i++) predecessors.add(new ArrayList<>());
            double[] sigma = new double[n];
            int[] dist = new int[n];
            Arrays.fill(dist, -1);
            sigma[s] = 1.0;
            dist[s] = 0;

            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(s);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                stack.push(v);
                for (int w : graph.successors(v).keySet()) {
                    if (dist[w] < 0) {
                        dist[w] = dist[v] + 1;
                        queue.add(w);
                    }
                    if (dist[w] == dist[v] + 1) {
                        sigma[w] += sigma[v];
                        predecessors.get(w).add(v);
                    }
                }
            }

            double[] delta = new double[n];
            while (!stack.isEmpty()) {
                int w = stack.pop();
                for (int v : predecessors.get(w)) {
                    delta[v] += (sigma[v] / sigma[w]) * (1.0 + delta[w]);
                }
                if (w != s) {
                    betweenness[w] += delta[w];
                }
            }
        }

        if (n > 2) {
            double scale = 1.0 / ((double) (n - 1) * (n - 2));
            for (int i = 0; i < n; i++) betweenness[i] *= scale;
        }
        return betweenness;
    }
}
