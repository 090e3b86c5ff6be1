package com.color.x.processors.coloring;

import com.color.x.models.ColorGraph;
import com.color.x.models.Coloring;
import com.color.x.service.ColoringRecords;
import com.color.x.utils.SolveDeadline;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * DSATUR greedy coloring.
 * <p>
 * The uncolored vertex with the most distinct neighbor colors is colored next with the smallest color
 * its colored neighbors do not use. Saturation is maintained incrementally: coloring a vertex only touches
 * the neighbor-color sets of its uncolored neighbors.
 * </p>
 * Selection order is fully deterministic: highest saturation, then highest static degree, then lowest vertex id.
 * Vertex 1 is always colored first.
 */
@Slf4j
public class DSaturAlgorithm {
    private static final int FIRST_VERTEX = 1;

    private final ColorGraph graph;
    private final Coloring coloring;
    private final IntOpenHashSet[] neighborColors;
    private final boolean[] colored;
    private int colorsUsed;
    private boolean consumed;

    public DSaturAlgorithm(ColorGraph graph) {
        this.graph = Objects.requireNonNull(graph, "ColorGraph cannot be null.");
        int n = graph.vertexCount();
        this.coloring = Coloring.uncolored(n);
        this.neighborColors = new IntOpenHashSet[n + 1];
        this.colored = new boolean[n + 1];
        for (int v = 1; v <= n; v++) {
            neighborColors[v] = new IntOpenHashSet();
        }
    }

    public ColoringRecords.ColoringResult colorGraph() {
        return colorGraph(SolveDeadline.none());
    }

    /**
     * Colors the whole graph unless {@code deadline} expires first, in which case the result is marked timed out
     * and carries no coloring.
     */
    public ColoringRecords.ColoringResult colorGraph(SolveDeadline deadline) {
        if (consumed) {
            throw new IllegalStateException("DSaturAlgorithm instances color a graph only once");
        }
        consumed = true;
        int n = graph.vertexCount();
        if (n == 0) {
            return ColoringRecords.ColoringResult.complete(coloring);
        }

        assign(FIRST_VERTEX, 0);
        for (int step = 1; step < n; step++) {
            if (deadline.isExpired()) {
                log.warn("DSATUR stopped by deadline after {} of {} vertices", step, n);
                return ColoringRecords.ColoringResult.expired(null);
            }
            int next = selectNext();
            assign(next, smallestFreeColor(next));
        }

        log.debug("DSATUR colored {} vertices with {} colors", n, colorsUsed);
        return ColoringRecords.ColoringResult.complete(coloring);
    }

    private int selectNext() {
        int selected = -1;
        int bestSaturation = -1;
        int bestDegree = -1;
        for (int v = 1; v <= graph.vertexCount(); v++) {
            if (colored[v]) {
                continue;
            }
            int saturation = neighborColors[v].size();
            int degree = graph.degree(v);
            if (saturation > bestSaturation || (saturation == bestSaturation && degree > bestDegree)) {
                selected = v;
                bestSaturation = saturation;
                bestDegree = degree;
            }
        }
        return selected;
    }

    private int smallestFreeColor(int vertex) {
        IntOpenHashSet excluded = neighborColors[vertex];
        for (int color = 0; color < colorsUsed; color++) {
            if (!excluded.contains(color)) {
                return color;
            }
        }
        return colorsUsed;
    }

    private void assign(int vertex, int color) {
        coloring.set(vertex, color);
        colored[vertex] = true;
        if (color == colorsUsed) {
            colorsUsed++;
        }
        for (int neighbor : graph.neighbors(vertex)) {
            if (!colored[neighbor]) {
                neighborColors[neighbor].add(color);
            }
        }
        neighborColors[vertex] = null;
    }
}
