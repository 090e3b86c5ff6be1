package com.color.x.models;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.Arrays;

/**
 * Read-only undirected graph over the dense vertex range {@code 1..N}.
 * <p>
 * Adjacency is symmetric and free of self-loops. Neighbor arrays are sorted ascending so
 * that every engine iterating them sees the same order. Instances are safe to share between
 * concurrently running solves.
 * </p>
 */
public final class ColorGraph {
    private static final ColorGraph EMPTY = new ColorGraph(0, new int[1][0], new IntSet[1], 0);

    private final int vertexCount;
    private final int[][] neighbors;
    private final IntSet[] adjacency;
    private final int edgeCount;

    private ColorGraph(int vertexCount, int[][] neighbors, IntSet[] adjacency, int edgeCount) {
        this.vertexCount = vertexCount;
        this.neighbors = neighbors;
        this.adjacency = adjacency;
        this.edgeCount = edgeCount;
    }

    public static ColorGraph empty() {
        return EMPTY;
    }

    public static Builder builder(int vertexCount) {
        return new Builder(vertexCount);
    }

    public int vertexCount() {
        return vertexCount;
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return vertexCount == 0;
    }

    /**
     * Neighbors of {@code vertex} in ascending order. The returned array is shared; callers must not modify it.
     */
    public int[] neighbors(int vertex) {
        checkVertex(vertex);
        return neighbors[vertex];
    }

    public int degree(int vertex) {
        checkVertex(vertex);
        return neighbors[vertex].length;
    }

    public boolean areAdjacent(int u, int v) {
        checkVertex(u);
        checkVertex(v);
        return adjacency[u].contains(v);
    }

    /**
     * Ratio of present edges to the edges of the complete graph on the same vertices; 0 below two vertices.
     */
    public double edgeDensity() {
        if (vertexCount <= 1) {
            return 0.0;
        }
        long maxEdges = (long) vertexCount * (vertexCount - 1) / 2;
        return (double) edgeCount / maxEdges;
    }

    private void checkVertex(int vertex) {
        if (vertex < 1 || vertex > vertexCount) {
            throw new IllegalArgumentException("Vertex " + vertex + " is outside 1.." + vertexCount);
        }
    }

    @Override
    public String toString() {
        return "ColorGraph{vertices=" + vertexCount + ", edges=" + edgeCount + "}";
    }

    public static final class Builder {
        private final int vertexCount;
        private final IntOpenHashSet[] adjacency;

        private Builder(int vertexCount) {
            if (vertexCount < 0) {
                throw new IllegalArgumentException("Vertex count cannot be negative: " + vertexCount);
            }
            this.vertexCount = vertexCount;
            this.adjacency = new IntOpenHashSet[vertexCount + 1];
            for (int v = 1; v <= vertexCount; v++) {
                adjacency[v] = new IntOpenHashSet();
            }
        }

        public Builder addEdge(int u, int v) {
            if (u < 1 || u > vertexCount || v < 1 || v > vertexCount) {
                throw new IllegalArgumentException(
                        "Edge (" + u + ", " + v + ") has an endpoint outside 1.." + vertexCount);
            }
            if (u == v) {
                throw new IllegalArgumentException("Self-loop on vertex " + u + " is not allowed");
            }
            adjacency[u].add(v);
            adjacency[v].add(u);
            return this;
        }

        public ColorGraph build() {
            if (vertexCount == 0) {
                return EMPTY;
            }
            int[][] neighbors = new int[vertexCount + 1][];
            IntSet[] frozen = new IntSet[vertexCount + 1];
            neighbors[0] = new int[0];
            long degreeSum = 0;
            for (int v = 1; v <= vertexCount; v++) {
                int[] sorted = adjacency[v].toIntArray();
                Arrays.sort(sorted);
                neighbors[v] = sorted;
                frozen[v] = new IntOpenHashSet(adjacency[v]);
                degreeSum += sorted.length;
            }
            return new ColorGraph(vertexCount, neighbors, frozen, (int) (degreeSum / 2));
        }
    }
}
