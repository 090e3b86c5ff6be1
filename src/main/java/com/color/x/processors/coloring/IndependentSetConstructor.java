package com.color.x.processors.coloring;

import com.color.x.models.ColorGraph;
import com.color.x.models.Coloring;
import com.color.x.service.ColoringRecords;
import com.color.x.utils.SolveDeadline;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Builds a full coloring one independent set at a time.
 * <p>
 * Each pass samples a seed among the still-available vertices, grows an independent set around it by
 * breadth-first traversal of the seed's component, then gives every member the smallest color below the
 * current color index that none of its neighbors holds, opening a new color only when none is free.
 * </p>
 * The traversal walks through every reachable vertex, already-colored ones included, so members are found
 * at any distance from the seed. A candidate is admitted only while it is available and no neighbor of it
 * is already a member.
 */
@Slf4j
public class IndependentSetConstructor {
    private final ColorGraph graph;
    private final CategoricalSampler sampler;

    private final int[] visitedStamp;
    private final int[] blockedStamp;
    private final int[] usedColorStamp;
    private int stamp;
    private int colorStamp;

    public IndependentSetConstructor(ColorGraph graph, RandomGenerator random) {
        this.graph = Objects.requireNonNull(graph, "ColorGraph cannot be null.");
        this.sampler = new CategoricalSampler(random);
        int n = graph.vertexCount();
        this.visitedStamp = new int[n + 1];
        this.blockedStamp = new int[n + 1];
        this.usedColorStamp = new int[n + 1];
    }

    public ColoringRecords.TrialResult constructOnce(ProbabilityWeights weights) {
        return constructOnce(weights, SolveDeadline.none());
    }

    /**
     * Runs one construction pass.
     *
     * @return the complete coloring and the number of colors opened, or {@code null} if the deadline expired
     *         before every vertex was colored
     */
    public ColoringRecords.TrialResult constructOnce(ProbabilityWeights weights, SolveDeadline deadline) {
        Objects.requireNonNull(weights, "ProbabilityWeights cannot be null.");
        int n = graph.vertexCount();
        if (weights.vertexCount() != n) {
            throw new IllegalArgumentException("Weights cover " + weights.vertexCount()
                    + " vertices but graph has " + n);
        }

        Coloring coloring = Coloring.uncolored(n);
        AvailableVertices available = new AvailableVertices(n);
        int colorIndex = 0;

        while (!available.isEmpty()) {
            if (deadline.isExpired()) {
                log.debug("Construction pass abandoned by deadline with {} vertices left", available.size());
                return null;
            }
            int seed = sampler.sample(available.asList(), weights);
            IntArrayList members = growIndependentSet(seed, available);
            for (int i = 0; i < members.size(); i++) {
                int vertex = members.getInt(i);
                int color = smallestFreeColorBelow(vertex, colorIndex, coloring);
                if (color < 0) {
                    color = colorIndex++;
                }
                coloring.set(vertex, color);
            }
        }
        return new ColoringRecords.TrialResult(coloring, colorIndex);
    }

    IntArrayList growIndependentSet(int seed, AvailableVertices available) {
        nextStamp();
        IntArrayList members = new IntArrayList();
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        admit(seed, members, available);
        visitedStamp[seed] = stamp;
        queue.enqueue(seed);

        while (!queue.isEmpty()) {
            int current = queue.dequeueInt();
            for (int candidate : graph.neighbors(current)) {
                if (visitedStamp[candidate] == stamp) {
                    continue;
                }
                visitedStamp[candidate] = stamp;
                queue.enqueue(candidate);
                if (available.contains(candidate) && blockedStamp[candidate] != stamp) {
                    admit(candidate, members, available);
                }
            }
        }
        return members;
    }

    private void admit(int vertex, IntArrayList members, AvailableVertices available) {
        members.add(vertex);
        available.remove(vertex);
        for (int neighbor : graph.neighbors(vertex)) {
            blockedStamp[neighbor] = stamp;
        }
    }

    private int smallestFreeColorBelow(int vertex, int limit, Coloring coloring) {
        if (limit == 0) {
            return -1;
        }
        colorStamp++;
        for (int neighbor : graph.neighbors(vertex)) {
            int c = coloring.get(neighbor);
            if (c != Coloring.UNCOLORED) {
                usedColorStamp[c] = colorStamp;
            }
        }
        for (int c = 0; c < limit; c++) {
            if (usedColorStamp[c] != colorStamp) {
                return c;
            }
        }
        return -1;
    }

    private void nextStamp() {
        stamp++;
    }

    /**
     * Dense set of still-uncolored vertices with O(1) removal; iteration order changes on removal.
     */
    static final class AvailableVertices {
        private final IntArrayList vertices;
        private final int[] position;

        AvailableVertices(int vertexCount) {
            this.vertices = new IntArrayList(vertexCount);
            this.position = new int[vertexCount + 1];
            for (int v = 1; v <= vertexCount; v++) {
                position[v] = vertices.size();
                vertices.add(v);
            }
        }

        boolean contains(int vertex) {
            return position[vertex] >= 0;
        }

        void remove(int vertex) {
            int index = position[vertex];
            if (index < 0) {
                return;
            }
            int last = vertices.removeInt(vertices.size() - 1);
            if (last != vertex) {
                vertices.set(index, last);
                position[last] = index;
            }
            position[vertex] = -1;
        }

        boolean isEmpty() {
            return vertices.isEmpty();
        }

        int size() {
            return vertices.size();
        }

        IntArrayList asList() {
            return vertices;
        }
    }
}
