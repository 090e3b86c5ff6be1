package com.color.x.models;

import java.util.SplittableRandom;

public final class GraphFixtures {

    private GraphFixtures() {
    }

    public static ColorGraph cycle(int n) {
        ColorGraph.Builder builder = ColorGraph.builder(n);
        for (int v = 1; v <= n; v++) {
            builder.addEdge(v, v % n + 1);
        }
        return builder.build();
    }

    public static ColorGraph complete(int n) {
        ColorGraph.Builder builder = ColorGraph.builder(n);
        for (int u = 1; u <= n; u++) {
            for (int v = u + 1; v <= n; v++) {
                builder.addEdge(u, v);
            }
        }
        return builder.build();
    }

    public static ColorGraph star(int leaves) {
        ColorGraph.Builder builder = ColorGraph.builder(leaves + 1);
        for (int v = 2; v <= leaves + 1; v++) {
            builder.addEdge(1, v);
        }
        return builder.build();
    }

    public static ColorGraph edgeless(int n) {
        return ColorGraph.builder(n).build();
    }

    public static ColorGraph random(int n, double p, long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        ColorGraph.Builder builder = ColorGraph.builder(n);
        for (int u = 1; u <= n; u++) {
            for (int v = u + 1; v <= n; v++) {
                if (random.nextDouble() < p) {
                    builder.addEdge(u, v);
                }
            }
        }
        return builder.build();
    }
}
