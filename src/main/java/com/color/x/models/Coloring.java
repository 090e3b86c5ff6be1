package com.color.x.models;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable vertex-to-color assignment for a graph with vertices {@code 1..N}.
 * Slot 0 is unused. Uncolored vertices hold {@link #UNCOLORED}.
 */
public final class Coloring {
    public static final int UNCOLORED = -1;

    private final int[] colors;

    private Coloring(int[] colors) {
        this.colors = colors;
    }

    public static Coloring uncolored(int vertexCount) {
        int[] colors = new int[vertexCount + 1];
        Arrays.fill(colors, UNCOLORED);
        return new Coloring(colors);
    }

    /**
     * Builds a coloring from explicit values, {@code colors[i]} being the color of vertex {@code i + 1}.
     */
    public static Coloring of(int... colors) {
        int[] slots = new int[colors.length + 1];
        slots[0] = UNCOLORED;
        System.arraycopy(colors, 0, slots, 1, colors.length);
        return new Coloring(slots);
    }

    public int vertexCount() {
        return colors.length - 1;
    }

    public int get(int vertex) {
        return colors[vertex];
    }

    public void set(int vertex, int color) {
        colors[vertex] = color;
    }

    public boolean isColored(int vertex) {
        return colors[vertex] != UNCOLORED;
    }

    public boolean isComplete() {
        for (int v = 1; v < colors.length; v++) {
            if (colors[v] == UNCOLORED) {
                return false;
            }
        }
        return true;
    }

    public Coloring copy() {
        return new Coloring(colors.clone());
    }

    public void copyFrom(Coloring other) {
        if (other.colors.length != colors.length) {
            throw new IllegalArgumentException("Colorings cover different vertex counts");
        }
        System.arraycopy(other.colors, 0, colors, 0, colors.length);
    }

    public int maxColor() {
        int max = UNCOLORED;
        for (int v = 1; v < colors.length; v++) {
            max = Math.max(max, colors[v]);
        }
        return max;
    }

    /**
     * Number of distinct colors in use.
     */
    public int colorCount() {
        int max = maxColor();
        if (max == UNCOLORED) {
            return 0;
        }
        boolean[] seen = new boolean[max + 1];
        int distinct = 0;
        for (int v = 1; v < colors.length; v++) {
            int c = colors[v];
            if (c != UNCOLORED && !seen[c]) {
                seen[c] = true;
                distinct++;
            }
        }
        return distinct;
    }

    /**
     * Renumbers colors to {@code 0..k-1} keeping their relative order, so no gaps remain.
     */
    public void compact() {
        int max = maxColor();
        if (max == UNCOLORED) {
            return;
        }
        int[] remap = new int[max + 1];
        Arrays.fill(remap, UNCOLORED);
        for (int v = 1; v < colors.length; v++) {
            if (colors[v] != UNCOLORED) {
                remap[colors[v]] = 0;
            }
        }
        int next = 0;
        for (int c = 0; c <= max; c++) {
            if (remap[c] == 0) {
                remap[c] = next++;
            }
        }
        for (int v = 1; v < colors.length; v++) {
            if (colors[v] != UNCOLORED) {
                colors[v] = remap[colors[v]];
            }
        }
    }

    /**
     * True when every vertex of {@code graph} is colored and no edge joins two equal colors.
     */
    public boolean isValidFor(ColorGraph graph) {
        if (graph.vertexCount() != vertexCount() || !isComplete()) {
            return false;
        }
        for (int u = 1; u <= graph.vertexCount(); u++) {
            for (int v : graph.neighbors(u)) {
                if (v > u && colors[u] == colors[v]) {
                    return false;
                }
            }
        }
        return true;
    }

    public Map<Integer, Integer> asMap() {
        Map<Integer, Integer> result = new LinkedHashMap<>();
        for (int v = 1; v < colors.length; v++) {
            result.put(v, colors[v]);
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coloring)) return false;
        return Arrays.equals(colors, ((Coloring) o).colors);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(colors);
    }

    @Override
    public String toString() {
        return "Coloring" + asMap();
    }
}
