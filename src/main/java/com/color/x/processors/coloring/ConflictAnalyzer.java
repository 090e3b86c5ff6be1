package com.color.x.processors.coloring;

import com.color.x.models.ColorGraph;
import com.color.x.models.Coloring;
import com.color.x.service.ColoringRecords;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.experimental.UtilityClass;

@UtilityClass
public class ConflictAnalyzer {

    /**
     * Counts edges whose endpoints share a color, each edge once, and collects the vertices touching them.
     * Uncolored vertices never conflict.
     */
    public static ColoringRecords.ConflictReport analyze(ColorGraph graph, Coloring coloring) {
        if (graph.vertexCount() != coloring.vertexCount()) {
            throw new IllegalArgumentException("Coloring covers " + coloring.vertexCount()
                    + " vertices but graph has " + graph.vertexCount());
        }
        int conflicts = 0;
        IntOpenHashSet conflictVertices = new IntOpenHashSet();
        for (int u = 1; u <= graph.vertexCount(); u++) {
            if (!coloring.isColored(u)) {
                continue;
            }
            for (int v : graph.neighbors(u)) {
                if (v > u && coloring.get(u) == coloring.get(v)) {
                    conflicts++;
                    conflictVertices.add(u);
                    conflictVertices.add(v);
                }
            }
        }
        return new ColoringRecords.ConflictReport(conflicts, conflictVertices);
    }
}
