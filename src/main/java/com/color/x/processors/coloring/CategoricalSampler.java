package com.color.x.processors.coloring;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Draws one vertex from a candidate list with probability proportional to its weight.
 * Falls back to a uniform draw when every candidate weighs zero.
 */
public class CategoricalSampler {
    private final RandomGenerator random;

    public CategoricalSampler(RandomGenerator random) {
        this.random = Objects.requireNonNull(random, "Random source cannot be null.");
    }

    public int sample(IntList candidates, ProbabilityWeights weights) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Cannot sample from an empty candidate list");
        }

        double total = 0.0;
        for (int i = 0; i < candidates.size(); i++) {
            total += weights.get(candidates.getInt(i));
        }
        if (total <= 0.0) {
            return candidates.getInt(random.nextInt(candidates.size()));
        }

        double target = random.nextDouble() * total;
        double cumulative = 0.0;
        int lastPositive = -1;
        for (int i = 0; i < candidates.size(); i++) {
            double w = weights.get(candidates.getInt(i));
            if (w <= 0.0) {
                continue;
            }
            lastPositive = i;
            cumulative += w;
            if (target < cumulative) {
                return candidates.getInt(i);
            }
        }
        // rounding can leave target just above the accumulated sum
        return candidates.getInt(lastPositive);
    }
}
