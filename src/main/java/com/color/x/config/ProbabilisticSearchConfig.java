package com.color.x.config;

import lombok.Builder;
import lombok.Getter;

import java.util.OptionalLong;

@Getter
public class ProbabilisticSearchConfig {
    public static final int DEFAULT_TRIALS = 10;
    public static final double DEFAULT_REWEIGHT_INCREMENT = 0.1;
    public static final int DEFAULT_LOCAL_SEARCH_ITERATIONS = 50;
    public static final double DEFAULT_PERTURBATION_FRACTION = 0.2;

    private final int trials;
    private final double reweightIncrement;
    private final int localSearchIterations;
    private final double perturbationFraction;
    private final Long seed;

    @Builder
    public ProbabilisticSearchConfig(int trials, double reweightIncrement, int localSearchIterations,
                                     double perturbationFraction, Long seed) {
        if (trials < 1) {
            throw new IllegalArgumentException("trials must be positive: " + trials);
        }
        if (localSearchIterations < 0) {
            throw new IllegalArgumentException("localSearchIterations cannot be negative: " + localSearchIterations);
        }
        this.trials = trials;
        this.reweightIncrement = reweightIncrement;
        this.localSearchIterations = localSearchIterations;
        this.perturbationFraction = perturbationFraction;
        this.seed = seed;
    }

    public static ProbabilisticSearchConfig defaults() {
        return new ProbabilisticSearchConfig(DEFAULT_TRIALS, DEFAULT_REWEIGHT_INCREMENT,
                DEFAULT_LOCAL_SEARCH_ITERATIONS, DEFAULT_PERTURBATION_FRACTION, null);
    }

    public OptionalLong seedValue() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }
}
