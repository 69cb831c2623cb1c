package com.libragraph.synthesis.core.graph;

public class ConvergenceException extends RuntimeException {

    private final int iterations;

    public ConvergenceException(int iterations) {
        super("Power iteration failed to converge in " + iterations + " iterations");
        this.iterations = iterations;
    }

    public int iterations() {
        return iterations;
    }
}
