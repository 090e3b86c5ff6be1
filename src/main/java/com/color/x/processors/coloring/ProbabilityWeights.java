package com.color.x.processors.coloring;

import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.Arrays;

/**
 * Per-vertex seed weights for the independent-set constructor, indexed {@code 1..N} (slot 0 unused).
 * Instances are immutable; every update returns a new vector.
 */
public final class ProbabilityWeights {
    private final double[] weights;

    private ProbabilityWeights(double[] weights) {
        this.weights = weights;
    }

    public static ProbabilityWeights uniform(int vertexCount) {
        if (vertexCount < 0) {
            throw new IllegalArgumentException("Vertex count cannot be negative: " + vertexCount);
        }
        double[] weights = new double[vertexCount + 1];
        if (vertexCount > 0) {
            Arrays.fill(weights, 1, vertexCount + 1, 1.0 / vertexCount);
        }
        return new ProbabilityWeights(weights);
    }

    /**
     * @param weights weight of vertex {@code i + 1} at index {@code i}; values must be finite and non-negative
     */
    public static ProbabilityWeights of(double... weights) {
        double[] slots = new double[weights.length + 1];
        for (int i = 0; i < weights.length; i++) {
            double w = weights[i];
            if (w < 0 || Double.isNaN(w) || Double.isInfinite(w)) {
                throw new IllegalArgumentException("Weight of vertex " + (i + 1) + " is invalid: " + w);
            }
            slots[i + 1] = w;
        }
        return new ProbabilityWeights(slots);
    }

    public int vertexCount() {
        return weights.length - 1;
    }

    public double get(int vertex) {
        return weights[vertex];
    }

    public double total() {
        double sum = 0.0;
        for (int v = 1; v < weights.length; v++) {
            sum += weights[v];
        }
        return sum;
    }

    /**
     * Adds {@code increment} to the weight of every vertex in {@code vertices}.
     */
    public ProbabilityWeights reweight(IntSet vertices, double increment) {
        if (increment < 0 || Double.isNaN(increment)) {
            throw new IllegalArgumentException("Increment must be non-negative: " + increment);
        }
        double[] next = weights.clone();
        for (int v : vertices) {
            if (v < 1 || v >= next.length) {
                throw new IllegalArgumentException("Vertex " + v + " is outside 1.." + vertexCount());
            }
            next[v] += increment;
        }
        return new ProbabilityWeights(next);
    }

    /**
     * Scales the vector to sum to 1. An all-zero vector is returned unchanged.
     */
    public ProbabilityWeights normalize() {
        double sum = total();
        if (sum <= 0.0) {
            return this;
        }
        double[] next = new double[weights.length];
        for (int v = 1; v < weights.length; v++) {
            next[v] = weights[v] / sum;
        }
        return new ProbabilityWeights(next);
    }

    @Override
    public String toString() {
        return "ProbabilityWeights" + Arrays.toString(Arrays.copyOfRange(weights, 1, weights.length));
    }
}
