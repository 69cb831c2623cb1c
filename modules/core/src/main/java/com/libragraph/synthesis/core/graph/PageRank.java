package com.libragraph.synthesis.core.graph;

import java.util.Arrays;
import java.util.Map;

/**
 * Weighted PageRank by power iteration.
 * <p>
 * Out-edge weights are normalized per source node. Nodes with zero outgoing weight are dangling:
 * their rank is redistributed uniformly. Iteration stops when the L1 change drops below
 * {@code nodeCount * tolerance}.
 */
public final class PageRank {

    public static final double DEFAULT_DAMPING = 0.85;
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 1.0e-6;

    private final double damping;
    private final int maxIterations;
    private final double tolerance;

    public PageRank(double damping, int maxIterations, double tolerance) {
        if (damping < 0.0 || damping > 1.0) {
            throw new IllegalArgumentException("damping must be in [0, 1]: " + damping);
        }
        this.damping = damping;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public PageRank() {
        this(DEFAULT_DAMPING, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    /**
     * @return rank per node index, summing to 1; empty for an empty graph
     * @throws ConvergenceException if {@code maxIterations} pass without convergence
     */
    public double[] compute(DependencyGraph graph) {
        int n = graph.nodeCount();
        if (n == 0) {
            return new double[0];
        }

        double[] outWeight = new double[n];
        for (int i = 0; i < n; i++) {
            outWeight[i] = graph.outWeight(i);
        }

        double uniform = 1.0 / n;
        double[] x = new double[n];
        Arrays.fill(x, uniform);

        for (int iter = 0; iter < maxIterations; iter++) {
            double[] last = x;
            x = new double[n];

            double danglingSum = 0.0;
            for (int i = 0; i < n; i++) {
                if (outWeight[i] == 0.0) danglingSum += last[i];
            }
            danglingSum *= damping;

            for (int i = 0; i < n; i++) {
                if (outWeight[i] == 0.0) continue;
                for (Map.Entry<Integer, Double> e : graph.successors(i).entrySet()) {
                    x[e.getKey()] += damping * last[i] * (e.getValue() / outWeight[i]);
                }
            }

            double err = 0.0;
            for (int i = 0; i < n; i++) {
                x[i] += danglingSum * uniform + (1.0 - damping) * uniform;
                err += Math.abs(x[i] - last[i]);
            }
            if (err < n * tolerance) {
                return x;
            }
        }
        throw new ConvergenceException(maxIterations);
    }
}
