package com.color.x.processors.coloring;

import com.color.x.models.ColorGraph;
import com.color.x.models.Coloring;
import com.color.x.service.ColoringRecords;
import com.color.x.utils.SolveDeadline;
import it.unimi.dsi.fastutil.ints.IntArrays;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Iterated first-fit recoloring with snapshot/revert and random perturbation.
 * <p>
 * Each round sweeps the vertices in a fresh random order and moves every vertex to the first color below
 * {@code bestColorCount - 1} that no neighbor holds. A round is kept only when it leaves a conflict-free
 * coloring with strictly fewer colors; otherwise the working coloring is restored from the round's snapshot and
 * a fraction of vertices receive random colors to leave the plateau.
 * </p>
 * The best coloring only ever advances to conflict-free states, so the returned coloring is valid whenever the
 * input is, and its color count never exceeds the input's.
 */
@Slf4j
public class LocalSearchRefiner {
    private final ColorGraph graph;
    private final RandomGenerator random;
    private final double perturbationFraction;

    public LocalSearchRefiner(ColorGraph graph, RandomGenerator random, double perturbationFraction) {
        this.graph = Objects.requireNonNull(graph, "ColorGraph cannot be null.");
        this.random = Objects.requireNonNull(random, "Random source cannot be null.");
        if (perturbationFraction < 0.0 || perturbationFraction > 1.0 || Double.isNaN(perturbationFraction)) {
            throw new IllegalArgumentException("Perturbation fraction must be within [0, 1]: " + perturbationFraction);
        }
        this.perturbationFraction = perturbationFraction;
    }

    public ColoringRecords.RefinementResult refine(Coloring initial, int maxIterations) {
        return refine(initial, maxIterations, SolveDeadline.none());
    }

    public ColoringRecords.RefinementResult refine(Coloring initial, int maxIterations, SolveDeadline deadline) {
        Objects.requireNonNull(initial, "Initial coloring cannot be null.");
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations cannot be negative: " + maxIterations);
        }
        if (initial.vertexCount() != graph.vertexCount()) {
            throw new IllegalArgumentException("Coloring covers " + initial.vertexCount()
                    + " vertices but graph has " + graph.vertexCount());
        }
        if (!initial.isComplete()) {
            throw new IllegalArgumentException("Only complete colorings can be refined");
        }

        Coloring best = initial.copy();
        int bestColorCount = best.colorCount();
        int n = graph.vertexCount();
        if (n == 0) {
            return new ColoringRecords.RefinementResult(best, bestColorCount, 0, 0, 0);
        }

        Coloring working = best.copy();
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i + 1;
        }

        int rounds = 0;
        int improvingRounds = 0;
        int perturbations = 0;
        while (rounds < maxIterations && !deadline.isExpired()) {
            rounds++;
            Coloring snapshot = working.copy();
            shuffle(order);
            sweep(working, order, bestColorCount - 1);

            int sweptColorCount = working.colorCount();
            if (sweptColorCount < bestColorCount && ConflictAnalyzer.analyze(graph, working).isConflictFree()) {
                working.compact();
                best = working.copy();
                bestColorCount = sweptColorCount;
                improvingRounds++;
                log.debug("Local search round {} reduced colors to {}", rounds, bestColorCount);
            } else {
                working.copyFrom(snapshot);
                perturb(working);
                perturbations++;
            }
        }

        if (rounds < maxIterations) {
            log.debug("Local search stopped by deadline after {} of {} rounds", rounds, maxIterations);
        }
        return new ColoringRecords.RefinementResult(best, bestColorCount, rounds, improvingRounds, perturbations);
    }

    private void sweep(Coloring working, int[] order, int colorLimit) {
        for (int vertex : order) {
            for (int color = 0; color < colorLimit; color++) {
                if (isFree(working, vertex, color)) {
                    working.set(vertex, color);
                    break;
                }
            }
        }
    }

    private boolean isFree(Coloring working, int vertex, int color) {
        for (int neighbor : graph.neighbors(vertex)) {
            if (working.get(neighbor) == color) {
                return false;
            }
        }
        return true;
    }

    /**
     * Gives a random {@code perturbationFraction} of the vertices a uniform color in {@code [0, maxColor]}.
     * Conflicts introduced here are left for later sweeps to repair.
     */
    void perturb(Coloring working) {
        int n = graph.vertexCount();
        int count = (int) (n * perturbationFraction);
        if (count == 0) {
            return;
        }
        int maxColor = Math.max(0, working.maxColor());
        int[] vertices = new int[n];
        for (int i = 0; i < n; i++) {
            vertices[i] = i + 1;
        }
        shuffle(vertices);
        for (int i = 0; i < count; i++) {
            working.set(vertices[i], random.nextInt(maxColor + 1));
        }
    }

    private void shuffle(int[] values) {
        for (int i = values.length - 1; i > 0; i--) {
            IntArrays.swap(values, i, random.nextInt(i + 1));
        }
    }
}
